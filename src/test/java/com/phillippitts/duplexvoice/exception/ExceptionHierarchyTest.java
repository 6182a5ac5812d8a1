package com.phillippitts.duplexvoice.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsShouldExtendBase() {
        assertThat(new ControllerConfigurationException("x")).isInstanceOf(DuplexVoiceException.class);
        assertThat(new RecognitionException("x")).isInstanceOf(DuplexVoiceException.class);
        assertThat(new SynthesisException("x")).isInstanceOf(DuplexVoiceException.class);
        assertThat(new DuplexVoiceException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void recognitionExceptionShouldIncludeEngineName() {
        RecognitionException ex = new RecognitionException("chunk rejected", "vosk");

        assertThat(ex.getEngineName()).isEqualTo("vosk");
        assertThat(ex.getMessage()).isEqualTo("chunk rejected (engine: vosk)");
        assertThat(new RecognitionException("chunk rejected").getEngineName()).isEqualTo("unknown");
    }

    @Test
    void shouldPreserveCause() {
        IOException cause = new IOException("device lost");

        assertThat(new SynthesisException("failed", cause)).hasCause(cause);
        assertThat(new RecognitionException("failed", "whisper", cause)).hasCause(cause);
        assertThat(new DuplexVoiceException(cause)).hasCause(cause);
    }
}
