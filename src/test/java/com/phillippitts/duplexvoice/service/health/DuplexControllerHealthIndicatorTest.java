package com.phillippitts.duplexvoice.service.health;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.domain.DuplexState;
import com.phillippitts.duplexvoice.domain.TurnState;
import com.phillippitts.duplexvoice.service.duplex.DuplexController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DuplexControllerHealthIndicatorTest {

    private DuplexController controller;
    private DuplexControllerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        controller = mock(DuplexController.class);
        when(controller.getConfig()).thenReturn(DuplexConfig.defaults());
        when(controller.getState()).thenReturn(DuplexState.IDLE);
        when(controller.getTurn()).thenReturn(TurnState.USER);
        indicator = new DuplexControllerHealthIndicator(controller);
    }

    @Test
    void shouldReportDownWhenComponentsMissing() {
        when(controller.hasComponents()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("reason", "components not set");
    }

    @Test
    void shouldReportIdleWhenNoSessionRunning() {
        when(controller.hasComponents()).thenReturn(true);
        when(controller.isRunning()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("IDLE");
        assertThat(health.getDetails()).containsEntry("state", "IDLE");
    }

    @Test
    void shouldReportUpWhileSpeakingEvenThoughNotListening() {
        when(controller.hasComponents()).thenReturn(true);
        when(controller.isRunning()).thenReturn(true);
        when(controller.isListening()).thenReturn(false);
        when(controller.getState()).thenReturn(DuplexState.SPEAKING);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("listening", false);
    }

    @Test
    void shouldReportUpWithStateDetailsWhileRunning() {
        when(controller.hasComponents()).thenReturn(true);
        when(controller.isRunning()).thenReturn(true);
        when(controller.isListening()).thenReturn(true);
        when(controller.isSpeaking()).thenReturn(true);
        when(controller.getState()).thenReturn(DuplexState.DUPLEX);
        when(controller.getTurn()).thenReturn(TurnState.OVERLAP);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("state", "DUPLEX")
                .containsEntry("turn", "OVERLAP")
                .containsEntry("listening", true)
                .containsEntry("speaking", true)
                .containsEntry("language", "en");
    }
}
