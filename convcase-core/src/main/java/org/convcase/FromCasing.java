package org.convcase;

import org.convcase.model.Case;
import org.convcase.words.Words;

import java.util.Objects;

/**
 * 이미 따르고 있는 케이스와 짝지어진 텍스트.
 * <pre>{@code
 * new FromCasing("ninety-nine_problems", Case.SNAKE).toCase(Case.TITLE); // "Ninety-nine Problems"
 * }</pre>
 */
public record FromCasing(String value, Case source) implements Casing {

    public FromCasing {
        if (value == null) {
            value = "";
        }
        Objects.requireNonNull(source, "source case must not be null");
    }

    @Override
    public String toCase(Case target) {
        return Words.fromCasing(value, source).into(target);
    }

    /**
     * 출처 케이스만 교체합니다. 여기서는 분할하지 않습니다.
     */
    @Override
    public FromCasing fromCase(Case source) {
        return new FromCasing(value, source);
    }
}
