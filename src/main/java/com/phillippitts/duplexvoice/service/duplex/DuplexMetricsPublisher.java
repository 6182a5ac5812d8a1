package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.service.metrics.DuplexMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe facade over {@link DuplexMetrics} used by the controller loops.
 *
 * <p>Every method is a no-op when constructed without metrics, so the controller runs unchanged
 * in unit tests.
 *
 * @see DuplexMetrics
 */
public final class DuplexMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DuplexMetricsPublisher.class);

    /** Shared no-op instance; the builder default. */
    public static final DuplexMetricsPublisher NOOP = new DuplexMetricsPublisher(null);

    static final String LOOP_LISTEN = "listen";
    static final String LOOP_PROCESS = "process";
    static final String LOOP_SPEAK = "speak";
    static final String LOOP_MONITOR = "monitor";

    private final DuplexMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public DuplexMetricsPublisher(DuplexMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DuplexMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTranscription(boolean isFinal) {
        if (metrics != null) {
            metrics.incrementTranscriptions(isFinal);
        }
    }

    /**
     * @param latencyNanos time from final transcription to queued response
     */
    public void recordResponseQueued(long latencyNanos) {
        if (metrics != null) {
            metrics.recordResponseLatency(latencyNanos);
        }
    }

    public void recordResponseCompleted() {
        if (metrics != null) {
            metrics.incrementResponses();
        }
    }

    public void recordInterruption() {
        if (metrics != null) {
            metrics.incrementInterruptions();
        }
    }

    public void recordBackchannel() {
        if (metrics != null) {
            metrics.incrementBackchannels();
        }
    }

    public void recordLoopError(String loop) {
        if (metrics != null) {
            metrics.incrementLoopErrors(loop);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
