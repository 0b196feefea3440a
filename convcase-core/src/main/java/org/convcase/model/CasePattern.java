package org.convcase.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 단어를 구분자로 잇기 전에 적용하는 단어별 대소문자 패턴.
 * 대소문자가 있는 문자만 바뀌고 숫자와 구두점은 그대로 남습니다.
 */
public enum CasePattern {
    LOWERCASE {
        @Override
        public List<String> mutate(List<String> words) {
            return words.stream().map(CasePattern::lower).toList();
        }
    },
    UPPERCASE {
        @Override
        public List<String> mutate(List<String> words) {
            return words.stream().map(CasePattern::upper).toList();
        }
    },
    CAPITAL {
        @Override
        public List<String> mutate(List<String> words) {
            return words.stream().map(CasePattern::capitalize).toList();
        }
    },
    CAMEL {
        @Override
        public List<String> mutate(List<String> words) {
            List<String> result = new ArrayList<>(words.size());
            for (int i = 0; i < words.size(); i++) {
                result.add(i == 0 ? lower(words.get(i)) : capitalize(words.get(i)));
            }
            return List.copyOf(result);
        }
    },
    TOGGLE {
        @Override
        public List<String> mutate(List<String> words) {
            return words.stream().map(CasePattern::toggle).toList();
        }
    },
    /**
     * 단어 단위가 아니라 전체 단어열에 걸쳐 번갈아 적용합니다.
     * 첫 문자는 소문자이며, 대소문자가 없는 문자는 순서를 넘기지 않습니다.
     */
    ALTERNATING {
        @Override
        public List<String> mutate(List<String> words) {
            List<String> result = new ArrayList<>(words.size());
            boolean upper = false;
            for (String word : words) {
                StringBuilder sb = new StringBuilder(word.length());
                int i = 0;
                while (i < word.length()) {
                    int cp = word.codePointAt(i);
                    if (isCased(cp)) {
                        sb.append(upper ? upperCodePoint(cp) : lowerCodePoint(cp));
                        upper = !upper;
                    } else {
                        sb.appendCodePoint(cp);
                    }
                    i += Character.charCount(cp);
                }
                result.add(sb.toString());
            }
            return List.copyOf(result);
        }
    };

    public abstract List<String> mutate(List<String> words);

    static String lower(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    static String upper(String word) {
        return word.toUpperCase(Locale.ROOT);
    }

    static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int split = word.offsetByCodePoints(0, 1);
        return upper(word.substring(0, split)) + lower(word.substring(split));
    }

    static String toggle(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int split = word.offsetByCodePoints(0, 1);
        return lower(word.substring(0, split)) + upper(word.substring(split));
    }

    private static String lowerCodePoint(int codePoint) {
        return lower(new String(Character.toChars(codePoint)));
    }

    private static String upperCodePoint(int codePoint) {
        return upper(new String(Character.toChars(codePoint)));
    }

    private static boolean isCased(int codePoint) {
        return Character.isLowerCase(codePoint)
                || Character.isUpperCase(codePoint)
                || Character.isTitleCase(codePoint);
    }
}
