package com.phillippitts.duplexvoice.domain;

import com.phillippitts.duplexvoice.exception.ControllerConfigurationException;

import java.time.Duration;

/**
 * Immutable configuration of a duplex controller. Created once, never mutated.
 *
 * @param interruptionThreshold user speech newer than this interrupts a response in DUPLEX state
 * @param backchannelInterval   minimum spacing between two backchannels
 * @param silenceTimeout        reserved; validated but not consumed by any loop
 * @param allowInterruptions    whether user speech may cut off a response
 * @param enableBackchannels    whether the monitor loop emits backchannels
 * @param sampleRate            audio sample rate in Hz
 * @param language              locale code used for recognition, synthesis and templates
 * @param pollInterval          queue-pull timeout and monitor tick; bounds cancellation latency
 * @param userSpeechFreshness   user speech must be newer than this for a backchannel to fire
 * @param stopTimeout           how long {@code stop()} waits for the loops to exit
 */
public record DuplexConfig(
        Duration interruptionThreshold,
        Duration backchannelInterval,
        Duration silenceTimeout,
        boolean allowInterruptions,
        boolean enableBackchannels,
        int sampleRate,
        String language,
        Duration pollInterval,
        Duration userSpeechFreshness,
        Duration stopTimeout
) {

    public static final Duration DEFAULT_INTERRUPTION_THRESHOLD = Duration.ofMillis(300);
    public static final Duration DEFAULT_BACKCHANNEL_INTERVAL = Duration.ofSeconds(3);
    public static final Duration DEFAULT_SILENCE_TIMEOUT = Duration.ofMillis(1500);
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    public static final String DEFAULT_LANGUAGE = "en";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_USER_SPEECH_FRESHNESS = Duration.ofMillis(500);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Validates all values.
     *
     * @throws ControllerConfigurationException if a duration is missing or not positive,
     *         the sample rate is not positive, or the language is blank
     */
    public DuplexConfig {
        requirePositive("interruptionThreshold", interruptionThreshold);
        requirePositive("backchannelInterval", backchannelInterval);
        requirePositive("silenceTimeout", silenceTimeout);
        requirePositive("pollInterval", pollInterval);
        requirePositive("userSpeechFreshness", userSpeechFreshness);
        requirePositive("stopTimeout", stopTimeout);
        if (sampleRate <= 0) {
            throw new ControllerConfigurationException("sampleRate must be positive, got: " + sampleRate);
        }
        if (language == null || language.isBlank()) {
            throw new ControllerConfigurationException("language must not be blank");
        }
    }

    /**
     * Configuration with every value at its default.
     */
    public static DuplexConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ControllerConfigurationException(name + " must be a positive duration, got: " + value);
        }
    }

    /**
     * Fluent builder starting from the defaults.
     */
    public static final class Builder {
        private Duration interruptionThreshold = DEFAULT_INTERRUPTION_THRESHOLD;
        private Duration backchannelInterval = DEFAULT_BACKCHANNEL_INTERVAL;
        private Duration silenceTimeout = DEFAULT_SILENCE_TIMEOUT;
        private boolean allowInterruptions = true;
        private boolean enableBackchannels = true;
        private int sampleRate = DEFAULT_SAMPLE_RATE;
        private String language = DEFAULT_LANGUAGE;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration userSpeechFreshness = DEFAULT_USER_SPEECH_FRESHNESS;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;

        private Builder() {
        }

        public Builder interruptionThreshold(Duration interruptionThreshold) {
            this.interruptionThreshold = interruptionThreshold;
            return this;
        }

        public Builder backchannelInterval(Duration backchannelInterval) {
            this.backchannelInterval = backchannelInterval;
            return this;
        }

        public Builder silenceTimeout(Duration silenceTimeout) {
            this.silenceTimeout = silenceTimeout;
            return this;
        }

        public Builder allowInterruptions(boolean allowInterruptions) {
            this.allowInterruptions = allowInterruptions;
            return this;
        }

        public Builder enableBackchannels(boolean enableBackchannels) {
            this.enableBackchannels = enableBackchannels;
            return this;
        }

        public Builder sampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder userSpeechFreshness(Duration userSpeechFreshness) {
            this.userSpeechFreshness = userSpeechFreshness;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public DuplexConfig build() {
            return new DuplexConfig(interruptionThreshold, backchannelInterval, silenceTimeout,
                    allowInterruptions, enableBackchannels, sampleRate, language,
                    pollInterval, userSpeechFreshness, stopTimeout);
        }
    }
}
