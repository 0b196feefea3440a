package org.convcase;

import org.convcase.model.Case;
import org.convcase.words.Words;

/**
 * 출처 케이스가 선언되지 않은 텍스트. 변환 시 모든 경계로 분할합니다.
 */
public record Text(String value) implements Casing {

    public Text {
        if (value == null) {
            value = "";
        }
    }

    @Override
    public String toCase(Case target) {
        return Words.of(value).into(target);
    }

    @Override
    public FromCasing fromCase(Case source) {
        return new FromCasing(value, source);
    }
}
