package com.phillippitts.duplexvoice.service.health;

import com.phillippitts.duplexvoice.service.duplex.DuplexController;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the duplex controller.
 *
 * <ul>
 *   <li>UP: a session is running</li>
 *   <li>IDLE: components attached, no session running</li>
 *   <li>DOWN: recognizer, synthesizer or intent analyzer missing</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class DuplexControllerHealthIndicator implements HealthIndicator {

    static final Status IDLE = new Status("IDLE", "Components attached; no session running");

    private final DuplexController controller;

    public DuplexControllerHealthIndicator(DuplexController controller) {
        this.controller = controller;
    }

    @Override
    public Health health() {
        Health.Builder builder;
        if (!controller.hasComponents()) {
            builder = Health.down().withDetail("reason", "components not set");
        } else if (controller.isRunning()) {
            builder = Health.up();
        } else {
            builder = Health.status(IDLE);
        }
        return builder
                .withDetail("state", controller.getState().name())
                .withDetail("turn", controller.getTurn().name())
                .withDetail("listening", controller.isListening())
                .withDetail("speaking", controller.isSpeaking())
                .withDetail("language", controller.getConfig().language())
                .build();
    }
}
