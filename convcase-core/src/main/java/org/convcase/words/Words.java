package org.convcase.words;

import org.convcase.model.Boundary;
import org.convcase.model.Case;

import java.util.List;
import java.util.Objects;

/**
 * {@link WordSplitter}가 만든 순서 있는 불변 단어열.
 * {@link Case}로의 변환은 실패하지 않으며, 빈 단어열은 ""가 됩니다.
 */
public final class Words {

    private final List<String> words;

    private Words(List<String> words) {
        this.words = words;
    }

    /**
     * 모든 경계 규칙으로 분할합니다.
     */
    public static Words of(String text) {
        return new Words(WordSplitter.split(text, Boundary.defaults()));
    }

    /**
     * 출처 케이스가 자기 단어를 구분할 때 쓰는 경계로만 분할합니다.
     */
    public static Words fromCasing(String text, Case source) {
        Objects.requireNonNull(source, "source case must not be null");
        return new Words(WordSplitter.split(text, source.boundaries()));
    }

    public String into(Case target) {
        Objects.requireNonNull(target, "target case must not be null");
        return String.join(target.delimiter(), target.pattern().mutate(words));
    }

    public List<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Words other)) return false;
        return words.equals(other.words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return "Words" + words;
    }
}
