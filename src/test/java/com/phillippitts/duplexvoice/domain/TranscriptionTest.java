package com.phillippitts.duplexvoice.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionTest {

    @Test
    void partialShouldUseMidConfidence() {
        Transcription partial = Transcription.partial("open", "en");

        assertThat(partial.isFinal()).isFalse();
        assertThat(partial.confidence()).isEqualTo(0.5);
        assertThat(partial.language()).isEqualTo("en");
    }

    @Test
    void finalResultShouldCarryConfidence() {
        Transcription result = Transcription.finalResult("open chrome", 0.92, "vi");

        assertThat(result.isFinal()).isTrue();
        assertThat(result.confidence()).isEqualTo(0.92);
        assertThat(result.text()).isEqualTo("open chrome");
    }

    @Test
    void shouldAllowEmptyText() {
        assertThat(Transcription.finalResult("", 0.0, "en").text()).isEmpty();
    }

    @Test
    void shouldRejectNullText() {
        assertThatThrownBy(() -> new Transcription(null, true, 0.9, "en"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("text");
    }

    @Test
    void shouldRejectConfidenceOutOfRange() {
        assertThatThrownBy(() -> new Transcription("hi", true, 1.01, "en"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Transcription("hi", true, -0.1, "en"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNullLanguage() {
        assertThatThrownBy(() -> new Transcription("hi", false, 0.5, null))
                .isInstanceOf(NullPointerException.class);
    }
}
