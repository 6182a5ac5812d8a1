package com.phillippitts.duplexvoice.presentation.controller;

import com.phillippitts.duplexvoice.domain.DuplexEvent;
import com.phillippitts.duplexvoice.exception.ControllerConfigurationException;
import com.phillippitts.duplexvoice.exception.DuplexVoiceException;
import com.phillippitts.duplexvoice.service.duplex.DuplexController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

/**
 * Read-only HTTP view of the duplex controller, plus a remote stop.
 *
 * <ul>
 *   <li>{@code GET /duplex/status} - current state, turn and flags</li>
 *   <li>{@code GET /duplex/events} - Server-Sent Events, one subscription per request</li>
 *   <li>{@code POST /duplex/stop} - stops the running session; 409 when idle</li>
 * </ul>
 */
@RestController
@RequestMapping("/duplex")
class DuplexStatusController {

    private static final Logger LOG = LogManager.getLogger(DuplexStatusController.class);

    private final DuplexController controller;
    private final Executor eventExecutor;

    DuplexStatusController(DuplexController controller,
                           @Qualifier("eventExecutor") Executor eventExecutor) {
        this.controller = controller;
        this.eventExecutor = eventExecutor;
    }

    @GetMapping("/status")
    DuplexStatus status() {
        return DuplexStatus.of(controller);
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter events() {
        SseEmitter emitter = new SseEmitter(0L);
        Stream<DuplexEvent> stream = controller.getEvents();
        emitter.onCompletion(stream::close);
        emitter.onTimeout(stream::close);
        emitter.onError(e -> stream.close());
        try {
            eventExecutor.execute(() -> pump(emitter, stream));
        } catch (RejectedExecutionException e) {
            stream.close();
            throw new DuplexVoiceException("Too many event stream clients", e);
        }
        return emitter;
    }

    @PostMapping("/stop")
    DuplexStatus stop() {
        if (!controller.isRunning()) {
            throw new ControllerConfigurationException("No duplex session is running");
        }
        controller.stop();
        LOG.info("Duplex session stopped via HTTP");
        return DuplexStatus.of(controller);
    }

    private static void pump(SseEmitter emitter, Stream<DuplexEvent> stream) {
        try (stream) {
            Iterator<DuplexEvent> it = stream.iterator();
            while (it.hasNext()) {
                DuplexEvent event = it.next();
                emitter.send(SseEmitter.event()
                        .name(event.type().wireName())
                        .data(EventPayload.of(event), MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            // Client went away or the emitter already completed
            LOG.debug("Event stream client disconnected: {}", e.toString());
        }
    }

    /**
     * Snapshot returned by the status and stop endpoints.
     */
    record DuplexStatus(String state, String turn, boolean running, boolean listening, boolean speaking,
                        String language) {

        static DuplexStatus of(DuplexController controller) {
            return new DuplexStatus(
                    controller.getState().name(),
                    controller.getTurn().name(),
                    controller.isRunning(),
                    controller.isListening(),
                    controller.isSpeaking(),
                    controller.getConfig().language());
        }
    }

    /**
     * JSON shape of one SSE data line.
     */
    record EventPayload(String type, Map<String, Object> data, String timestamp) {

        static EventPayload of(DuplexEvent event) {
            return new EventPayload(event.type().wireName(), event.data(), event.timestamp().toString());
        }
    }
}
