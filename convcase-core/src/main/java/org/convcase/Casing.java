package org.convcase;

import org.convcase.model.Case;

/**
 * 케이스 변환이 가능한 값.
 * <p>
 * 변환은 실패하지 않습니다. 경계를 찾지 못하면 전체 텍스트를 한 단어로 취급합니다.
 * <pre>{@code
 * Casing.of("Ronnie_James_dio").toCase(Case.CAMEL);                   // "ronnieJamesDio"
 * Casing.of("2020-04-16_my_cat").fromCase(Case.SNAKE).toCase(Case.TITLE); // "2020-04-16 My Cat"
 * }</pre>
 *
 * @see Text
 * @see FromCasing
 */
public interface Casing {

    /**
     * 주어진 케이스로 변환합니다.
     *
     * @param target 대상 케이스
     * @return 변환된 문자열
     */
    String toCase(Case target);

    /**
     * 텍스트가 이미 따르고 있는 케이스를 선언합니다. 분할은 {@link #toCase(Case)} 호출 시점까지 미뤄집니다.
     *
     * @param source 출처 케이스
     * @return 출처 케이스를 기억하는 값
     */
    Casing fromCase(Case source);

    static Casing of(CharSequence text) {
        return new Text(text == null ? "" : text.toString());
    }
}
