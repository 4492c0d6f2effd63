package com.phillippitts.speechrelay.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void returnsShortTextUnchanged() {
        assertThat(LogSanitizer.preview("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.preview("hello", 5)).isEqualTo("hello");
    }

    @Test
    void truncatesLongTextAndAppendsLength() {
        assertThat(LogSanitizer.preview("hello world", 5)).isEqualTo("hello… (11 chars)");
    }

    @Test
    void returnsEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview("hello", 0)).isEmpty();
        assertThat(LogSanitizer.preview("hello", -1)).isEmpty();
    }
}
