package com.phillippitts.duplexvoice.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the duplex controller loops.
 *
 * <p>Provides:
 * <ul>
 *   <li>Transcription counts, tagged partial/final</li>
 *   <li>Response, interruption and backchannel counts</li>
 *   <li>Latency from final transcription to queued response</li>
 *   <li>Per-loop error counts</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class DuplexMetrics {

    static final String METRIC_PREFIX = "duplexvoice";

    private final MeterRegistry registry;

    public DuplexMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param isFinal whether the transcription was final
     */
    public void incrementTranscriptions(boolean isFinal) {
        Counter.builder(METRIC_PREFIX + ".transcriptions")
                .description("Transcriptions received from the recognizer")
                .tag("final", Boolean.toString(isFinal))
                .register(registry)
                .increment();
    }

    public void incrementResponses() {
        Counter.builder(METRIC_PREFIX + ".responses")
                .description("Responses that finished playing")
                .register(registry)
                .increment();
    }

    public void incrementInterruptions() {
        Counter.builder(METRIC_PREFIX + ".interruptions")
                .description("Responses cut off by user speech")
                .register(registry)
                .increment();
    }

    public void incrementBackchannels() {
        Counter.builder(METRIC_PREFIX + ".backchannels")
                .description("Backchannel phrases emitted")
                .register(registry)
                .increment();
    }

    /**
     * Records the time between a final transcription and its queued response.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordResponseLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".response.latency")
                .description("Time from final transcription to queued response")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param loop loop name (listen, process, speak, monitor)
     */
    public void incrementLoopErrors(String loop) {
        Counter.builder(METRIC_PREFIX + ".loop.errors")
                .description("Recoverable errors caught inside controller loops")
                .tag("loop", loop)
                .register(registry)
                .increment();
    }
}
