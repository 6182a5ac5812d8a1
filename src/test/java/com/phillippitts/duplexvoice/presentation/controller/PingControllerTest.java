package com.phillippitts.duplexvoice.presentation.controller;

import com.phillippitts.duplexvoice.domain.DuplexState;
import com.phillippitts.duplexvoice.service.duplex.DuplexController;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PingControllerTest {

    private final DuplexController duplex = mock(DuplexController.class);

    @Test
    void reportsNotReadyWithoutComponents() {
        when(duplex.hasComponents()).thenReturn(false);
        when(duplex.getState()).thenReturn(DuplexState.IDLE);

        ResponseEntity<Map<String, Object>> res = new PingController(duplex).ping();

        assertThat(res.getStatusCode().value()).isEqualTo(200);
        assertThat(res.getBody())
                .containsEntry("status", "ok")
                .containsEntry("ready", false)
                .containsEntry("sessionActive", false)
                .containsEntry("state", "IDLE")
                .containsKey("timestamp");
    }

    @Test
    void reportsActiveSession() {
        when(duplex.hasComponents()).thenReturn(true);
        when(duplex.isRunning()).thenReturn(true);
        when(duplex.getState()).thenReturn(DuplexState.DUPLEX);

        Map<String, Object> body = new PingController(duplex).ping().getBody();

        assertThat(body)
                .containsEntry("ready", true)
                .containsEntry("sessionActive", true)
                .containsEntry("state", "DUPLEX");
    }
}
