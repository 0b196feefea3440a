package org.convcase;

import org.convcase.model.Case;

/**
 * {@link Casing}의 정적 단축 메서드.
 */
public final class CaseConverter {

    private CaseConverter() {
    }

    public static String convert(CharSequence text, Case target) {
        return Casing.of(text).toCase(target);
    }

    /**
     * @param source 출처 케이스, null이면 모든 경계로 분할
     */
    public static String convert(CharSequence text, Case source, Case target) {
        Casing casing = Casing.of(text);
        if (source != null) {
            casing = casing.fromCase(source);
        }
        return casing.toCase(target);
    }
}
