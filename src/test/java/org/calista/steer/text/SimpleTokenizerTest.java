package org.calista.steer.text;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SimpleTokenizerTest {

    @Test
    void tokenize_shouldLowercaseAndSplitPunctuation() {
        assertThat(new SimpleTokenizer().tokenize("Hello, World! It's fine."))
                .containsExactly("hello", ",", "world", "!", "it's", "fine", ".");
    }

    @Test
    void tokenize_shouldDropPunctuationWhenDisabled() {
        assertThat(new SimpleTokenizer(false).tokenize("Hi there?  (yes)"))
                .containsExactly("hi", "there", "yes");
    }

    @Test
    void tokenize_shouldReturnEmptyForBlank() {
        assertThat(new SimpleTokenizer().tokenize("   ")).isEmpty();
        assertThat(new SimpleTokenizer().tokenize(null)).isEmpty();
    }
}
