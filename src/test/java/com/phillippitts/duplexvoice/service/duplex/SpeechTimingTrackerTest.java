package com.phillippitts.duplexvoice.service.duplex;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SpeechTimingTrackerTest {

    private MutableClock clock;
    private SpeechTimingTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        tracker = new SpeechTimingTracker(clock);
    }

    @Test
    void shouldReportNeverBeforeAnythingIsRecorded() {
        assertThat(tracker.millisSinceUserSpeech()).isEqualTo(SpeechTimingTracker.NEVER);
        assertThat(tracker.millisSinceAssistantSpeech()).isEqualTo(SpeechTimingTracker.NEVER);
        assertThat(tracker.millisSinceBackchannel()).isEqualTo(SpeechTimingTracker.NEVER);
    }

    @Test
    void shouldMeasureElapsedTimeSinceUserSpeech() {
        long recorded = tracker.recordUserSpeech();
        clock.advance(Duration.ofMillis(250));

        assertThat(recorded).isEqualTo(Instant.parse("2026-01-01T00:00:00Z").toEpochMilli());
        assertThat(tracker.getLastUserSpeechMs()).isEqualTo(recorded);
        assertThat(tracker.millisSinceUserSpeech()).isEqualTo(250);
    }

    @Test
    void shouldTrackEachTimestampIndependently() {
        tracker.recordBackchannel();
        clock.advance(Duration.ofMillis(100));
        tracker.recordAssistantSpeech();
        clock.advance(Duration.ofMillis(50));

        assertThat(tracker.millisSinceBackchannel()).isEqualTo(150);
        assertThat(tracker.millisSinceAssistantSpeech()).isEqualTo(50);
        assertThat(tracker.millisSinceUserSpeech()).isEqualTo(SpeechTimingTracker.NEVER);
    }

    @Test
    void shouldClearAllTimestampsOnReset() {
        tracker.recordUserSpeech();
        tracker.recordAssistantSpeech();
        tracker.recordBackchannel();

        tracker.reset();

        assertThat(tracker.millisSinceUserSpeech()).isEqualTo(SpeechTimingTracker.NEVER);
        assertThat(tracker.millisSinceAssistantSpeech()).isEqualTo(SpeechTimingTracker.NEVER);
        assertThat(tracker.millisSinceBackchannel()).isEqualTo(SpeechTimingTracker.NEVER);
    }

    @Test
    void shouldNeverReportNegativeElapsedTime() {
        tracker.recordUserSpeech();
        clock.advance(Duration.ofMillis(-20));

        assertThat(tracker.millisSinceUserSpeech()).isZero();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
