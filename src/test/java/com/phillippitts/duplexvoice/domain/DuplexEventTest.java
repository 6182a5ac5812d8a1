package com.phillippitts.duplexvoice.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplexEventTest {

    private static final Instant AT = Instant.parse("2026-01-01T10:00:00Z");

    @Test
    void transcriptionEventShouldExposeAllFields() {
        DuplexEvent event = DuplexEvent.transcription(Transcription.finalResult("open chrome", 0.8, "en"), AT);

        assertThat(event.type()).isEqualTo(DuplexEventType.TRANSCRIPTION);
        assertThat(event.timestamp()).isEqualTo(AT);
        assertThat(event.data())
                .containsEntry("text", "open chrome")
                .containsEntry("isFinal", true)
                .containsEntry("confidence", 0.8)
                .containsEntry("language", "en");
    }

    @Test
    void interruptionEventShouldCarryInterruptedTextAndSpeechTime() {
        Instant speech = AT.minusMillis(120);

        DuplexEvent event = DuplexEvent.interruption("I'll open chrome now...", AT, speech);

        assertThat(event.type()).isEqualTo(DuplexEventType.INTERRUPTION);
        assertThat(event.timestamp()).isEqualTo(AT);
        assertThat(event.data())
                .containsEntry("interruptedText", "I'll open chrome now...")
                .containsEntry("userSpeechAt", speech.toString());
    }

    @Test
    void responseAndBackchannelEventsShouldCarryText() {
        assertThat(DuplexEvent.response("Got it!", AT).data()).containsEntry("text", "Got it!");
        assertThat(DuplexEvent.backchannel("uh-huh", AT).type()).isEqualTo(DuplexEventType.BACKCHANNEL);
    }

    @Test
    void dataShouldBeDefensivelyCopied() {
        Map<String, Object> data = new HashMap<>();
        data.put("text", "a");
        DuplexEvent event = new DuplexEvent(DuplexEventType.RESPONSE, data, AT);

        data.put("text", "b");

        assertThat(event.data()).containsEntry("text", "a");
        assertThatThrownBy(() -> event.data().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullDataShouldBecomeEmpty() {
        assertThat(new DuplexEvent(DuplexEventType.RESPONSE, null, AT).data()).isEmpty();
    }

    @Test
    void wireNameShouldBeLowerCase() {
        assertThat(DuplexEventType.INTERRUPTION.wireName()).isEqualTo("interruption");
    }
}
