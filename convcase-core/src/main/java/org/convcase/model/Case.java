package org.convcase.model;

import org.convcase.words.Words;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static org.convcase.model.Boundary.ACRONYM;
import static org.convcase.model.Boundary.DIGIT;
import static org.convcase.model.Boundary.HYPHEN;
import static org.convcase.model.Boundary.LOWER_UPPER;
import static org.convcase.model.Boundary.SPACE;
import static org.convcase.model.Boundary.UNDERSCORE;

/**
 * 지원하는 케이스 목록.
 * <p>
 * 각 케이스는 단어 사이 구분자, 단어별 대소문자 패턴, 그리고 이 케이스로 작성된 텍스트를
 * 분할할 때 사용하는 경계 규칙 집합을 가집니다. 이 생성자 인자들이 유일한 변환 테이블입니다.
 * <ul>
 *   <li>{@code LOWER} → "my variable 22 name"</li>
 *   <li>{@code CAMEL} → "myVariable22Name"</li>
 *   <li>{@code SCREAMING_SNAKE} → "MY_VARIABLE_22_NAME"</li>
 *   <li>{@code ALTERNATING} → "mY vArIaBlE 22 nAmE"</li>
 * </ul>
 */
public enum Case {
    LOWER(" ", CasePattern.LOWERCASE, EnumSet.of(SPACE)),
    UPPER(" ", CasePattern.UPPERCASE, EnumSet.of(SPACE)),
    TITLE(" ", CasePattern.CAPITAL, EnumSet.of(SPACE)),
    TOGGLE(" ", CasePattern.TOGGLE, EnumSet.of(SPACE)),
    CAMEL("", CasePattern.CAMEL, EnumSet.of(LOWER_UPPER, ACRONYM, DIGIT)),
    PASCAL("", CasePattern.CAPITAL, EnumSet.of(LOWER_UPPER, ACRONYM, DIGIT)),
    UPPER_CAMEL("", CasePattern.CAPITAL, EnumSet.of(LOWER_UPPER, ACRONYM, DIGIT)),
    SNAKE("_", CasePattern.LOWERCASE, EnumSet.of(UNDERSCORE)),
    SCREAMING_SNAKE("_", CasePattern.UPPERCASE, EnumSet.of(UNDERSCORE)),
    KEBAB("-", CasePattern.LOWERCASE, EnumSet.of(HYPHEN)),
    COBOL("-", CasePattern.UPPERCASE, EnumSet.of(HYPHEN)),
    TRAIN("-", CasePattern.CAPITAL, EnumSet.of(HYPHEN)),
    ALTERNATING(" ", CasePattern.ALTERNATING, EnumSet.of(SPACE));

    private final String delimiter;
    private final CasePattern pattern;
    private final Set<Boundary> boundaries;

    Case(String delimiter, CasePattern pattern, EnumSet<Boundary> boundaries) {
        this.delimiter = delimiter;
        this.pattern = pattern;
        this.boundaries = Collections.unmodifiableSet(boundaries);
    }

    public String delimiter() {
        return delimiter;
    }

    public CasePattern pattern() {
        return pattern;
    }

    /**
     * 이 케이스로 작성된 텍스트를 분할할 때 사용하는 경계 규칙.
     */
    public Set<Boundary> boundaries() {
        return boundaries;
    }

    /**
     * 사용자 입력 이름으로 케이스를 찾습니다. 이름 자체의 표기법은 무관합니다.
     * <p>
     * "snake", "ScreamingSnake", "upper-camel", "UPPER_CAMEL" 모두 허용됩니다.
     *
     * @param name 케이스 이름
     * @return 일치하는 케이스
     * @throws IllegalArgumentException 일치하는 케이스가 없는 경우
     */
    public static Case parse(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String constant = Words.of(name).into(SCREAMING_SNAKE);
        for (Case c : values()) {
            if (c.name().equals(constant)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown case: " + name);
    }
}
