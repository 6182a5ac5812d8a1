package com.phillippitts.duplexvoice.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DuplexMetricsTest {

    private MeterRegistry registry;
    private DuplexMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DuplexMetrics(registry);
    }

    @Test
    void shouldCountTranscriptionsByFinality() {
        metrics.incrementTranscriptions(false);
        metrics.incrementTranscriptions(false);
        metrics.incrementTranscriptions(true);

        Counter partials = registry.find("duplexvoice.transcriptions").tag("final", "false").counter();
        Counter finals = registry.find("duplexvoice.transcriptions").tag("final", "true").counter();

        assertThat(partials).isNotNull();
        assertThat(partials.count()).isEqualTo(2.0);
        assertThat(finals).isNotNull();
        assertThat(finals.count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordResponseLatency() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordResponseLatency(durationNanos);

        Timer timer = registry.find("duplexvoice.response.latency").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldCountTurnEvents() {
        metrics.incrementResponses();
        metrics.incrementInterruptions();
        metrics.incrementInterruptions();
        metrics.incrementBackchannels();

        assertThat(registry.find("duplexvoice.responses").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("duplexvoice.interruptions").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("duplexvoice.backchannels").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagLoopErrorsByLoop() {
        metrics.incrementLoopErrors("speak");
        metrics.incrementLoopErrors("listen");
        metrics.incrementLoopErrors("speak");

        assertThat(registry.find("duplexvoice.loop.errors").tag("loop", "speak").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("duplexvoice.loop.errors").tag("loop", "listen").counter().count())
                .isEqualTo(1.0);
    }
}
