package com.phillippitts.duplexvoice.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("open the door", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("open the door", -3)).isEmpty();
    }

    @Test
    void shouldKeepShortStringsIntact() {
        assertThat(LogSanitizer.truncate("stop", 10)).isEqualTo("stop");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateLongStrings() {
        assertThat(LogSanitizer.truncate("scroll down please", 6)).isEqualTo("scroll");
    }

    @Test
    void previewShouldCapAtDefaultLength() {
        String utterance = "x".repeat(LogSanitizer.PREVIEW_CHARS + 25);

        assertThat(LogSanitizer.preview(utterance)).hasSize(LogSanitizer.PREVIEW_CHARS);
        assertThat(LogSanitizer.preview("short reply")).isEqualTo("short reply");
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldPreserveVietnameseText() {
        assertThat(LogSanitizer.truncate("Tôi sẽ mở chrome", 6)).isEqualTo("Tôi sẽ");
    }
}
