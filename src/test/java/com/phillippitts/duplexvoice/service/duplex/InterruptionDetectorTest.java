package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.domain.DuplexState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InterruptionDetectorTest {

    private final InterruptionDetector detector = new InterruptionDetector(DuplexConfig.builder()
            .interruptionThreshold(Duration.ofMillis(300))
            .build());

    @Test
    void shouldInterruptOnFreshSpeechInDuplex() {
        assertThat(detector.shouldInterrupt(DuplexState.DUPLEX, 0)).isTrue();
        assertThat(detector.shouldInterrupt(DuplexState.DUPLEX, 299)).isTrue();
    }

    @Test
    void shouldNotInterruptOnStaleSpeech() {
        assertThat(detector.shouldInterrupt(DuplexState.DUPLEX, 300)).isFalse();
        assertThat(detector.shouldInterrupt(DuplexState.DUPLEX, SpeechTimingTracker.NEVER)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = DuplexState.class, names = {"IDLE", "LISTENING", "SPEAKING"})
    void shouldNotInterruptOutsideDuplex(DuplexState state) {
        assertThat(detector.shouldInterrupt(state, 0)).isFalse();
    }

    @Test
    void shouldNeverInterruptWhenDisabled() {
        InterruptionDetector disabled = new InterruptionDetector(DuplexConfig.builder()
                .allowInterruptions(false)
                .build());

        assertThat(disabled.shouldInterrupt(DuplexState.DUPLEX, 0)).isFalse();
    }
}
