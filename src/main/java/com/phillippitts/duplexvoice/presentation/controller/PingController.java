package com.phillippitts.duplexvoice.presentation.controller;

import com.phillippitts.duplexvoice.service.duplex.DuplexController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint reporting whether the duplex controller is ready to start a session.
 *
 * <p>{@code ready} is true once recognizer, synthesizer and intent analyzer are attached.
 * Unlike {@code /actuator/health}, the response is always 200 so load balancers only check the
 * process.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final DuplexController controller;

    PingController(DuplexController controller) {
        this.controller = controller;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        boolean ready = controller.hasComponents();
        boolean sessionActive = controller.isRunning();
        log.info("Ping received (ready={}, sessionActive={})", ready, sessionActive);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ready", ready);
        body.put("sessionActive", sessionActive);
        body.put("state", controller.getState().name());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
