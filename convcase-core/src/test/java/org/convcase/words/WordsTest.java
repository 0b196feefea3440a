package org.convcase.words;

import org.convcase.model.Case;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordsTest {

    @Test
    void of_uses_default_boundaries() {
        Words words = Words.of("my-kebab_varName");

        assertThat(words.words()).containsExactly("my", "kebab", "var", "Name");
        assertThat(words.size()).isEqualTo(4);
        assertThat(words.isEmpty()).isFalse();
    }

    @Test
    void from_casing_uses_source_boundaries() {
        Words words = Words.fromCasing("my-kebab-var", Case.SNAKE);

        assertThat(words.words()).containsExactly("my-kebab-var");
        assertThat(words.into(Case.TITLE)).isEqualTo("My-kebab-var");
    }

    @Test
    void into_joins_with_delimiter() {
        Words words = Words.of("XMLHttpRequest");

        assertThat(words.into(Case.SNAKE)).isEqualTo("xml_http_request");
        assertThat(words.into(Case.CAMEL)).isEqualTo("xmlHttpRequest");
        assertThat(words.into(Case.COBOL)).isEqualTo("XML-HTTP-REQUEST");
        assertThat(words.into(Case.TRAIN)).isEqualTo("Xml-Http-Request");
    }

    @Test
    void empty_renders_empty() {
        Words words = Words.of("");

        assertThat(words.isEmpty()).isTrue();
        for (Case c : Case.values()) {
            assertThat(words.into(c)).isEmpty();
        }
    }

    @Test
    void equality_by_words() {
        assertThat(Words.of("fooBar")).isEqualTo(Words.of("foo_bar"));
        assertThat(Words.of("fooBar")).hasSameHashCodeAs(Words.of("foo bar"));
        assertThat(Words.of("fooBar")).isNotEqualTo(Words.of("Foo_Bar"));
    }

    @Test
    void null_case_rejected() {
        assertThatThrownBy(() -> Words.fromCasing("x", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Words.of("x").into(null)).isInstanceOf(NullPointerException.class);
    }
}
