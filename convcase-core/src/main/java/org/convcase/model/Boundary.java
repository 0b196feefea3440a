package org.convcase.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 단어 경계 규칙.
 * <p>
 * 구분자 규칙(SPACE, UNDERSCORE, HYPHEN)은 해당 문자를 소비하며 결과 단어에 포함되지 않습니다.
 * 나머지 규칙은 인접한 문자의 분류만 보고 경계를 선언합니다.
 *
 * @see org.convcase.words.WordSplitter
 */
public enum Boundary {
    SPACE {
        @Override
        public boolean consumes(int codePoint) {
            return Character.isWhitespace(codePoint);
        }
    },
    UNDERSCORE {
        @Override
        public boolean consumes(int codePoint) {
            return codePoint == '_';
        }
    },
    HYPHEN {
        @Override
        public boolean consumes(int codePoint) {
            return codePoint == '-';
        }
    },
    /**
     * "aB" → "a", "B"
     */
    LOWER_UPPER {
        @Override
        public boolean splitsBefore(int previous, int current) {
            return Character.isLowerCase(previous) && Character.isUpperCase(current);
        }
    },
    /**
     * 대문자 연속 뒤에 소문자가 오면 마지막 대문자 앞에서 분리합니다.
     * "XMLHttp" → "XML", "Http"
     */
    ACRONYM {
        @Override
        public boolean splitsAcronym(int first, int second, int third) {
            return Character.isUpperCase(first) && Character.isUpperCase(second) && Character.isLowerCase(third);
        }
    },
    /**
     * 문자와 숫자 사이 (양방향). "E5150" → "E", "5150"
     */
    DIGIT {
        @Override
        public boolean splitsBefore(int previous, int current) {
            return (Character.isLetter(previous) && Character.isDigit(current))
                    || (Character.isDigit(previous) && Character.isLetter(current));
        }
    };

    private static final Set<Boundary> DEFAULTS = Collections.unmodifiableSet(EnumSet.allOf(Boundary.class));

    /**
     * 출처 케이스를 모를 때 사용하는 최대 분할 규칙 집합.
     */
    public static Set<Boundary> defaults() {
        return DEFAULTS;
    }

    /**
     * @return 이 규칙이 해당 문자를 구분자로 소비하면 true
     */
    public boolean consumes(int codePoint) {
        return false;
    }

    public boolean splitsBefore(int previous, int current) {
        return false;
    }

    /**
     * 세 문자 창에서 두 번째 문자 앞이 경계인지 판단합니다.
     */
    public boolean splitsAcronym(int first, int second, int third) {
        return false;
    }
}
