package com.phillippitts.speakagent.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void previewQuotesShortText() {
        assertThat(LogSanitizer.preview("  send   mom\na text ", 40)).isEqualTo("\"send mom a text\"");
    }

    @Test
    void previewCutsLongTextAndReportsLength() {
        String text = "a".repeat(50);

        assertThat(LogSanitizer.preview(text, 10)).isEqualTo("\"" + "a".repeat(10) + "…\" (50 chars)");
    }

    @Test
    void previewOfNullIsEmptyQuotes() {
        assertThat(LogSanitizer.preview(null, 10)).isEqualTo("\"\"");
    }
}
