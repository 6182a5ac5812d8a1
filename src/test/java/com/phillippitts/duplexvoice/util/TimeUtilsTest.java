package com.phillippitts.duplexvoice.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertAndTruncateNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(5_000_000L)).isEqualTo(5L);
        // 2.999 ms truncates to 2 ms
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1_000L);
        assertThat(elapsedMs).isLessThan(1_500L);
    }

    @Test
    void elapsedNanosShouldBeNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedNanos(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void shouldConvertEpochMillisToInstant() {
        assertThat(TimeUtils.toInstant(0L)).isEqualTo(Instant.EPOCH);
        assertThat(TimeUtils.toInstant(1_700_000_000_123L))
                .isEqualTo(Instant.parse("2023-11-14T22:13:20.123Z"));
    }
}
