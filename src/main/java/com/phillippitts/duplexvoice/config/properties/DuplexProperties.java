package com.phillippitts.duplexvoice.config.properties;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the duplex controller, bound from {@code duplex.*}.
 *
 * <p>Missing values fall back to the {@link DuplexConfig} defaults. Durations accept Spring's
 * formats ({@code 300ms}, {@code 3s}).
 */
@Validated
@ConfigurationProperties(prefix = "duplex")
public class DuplexProperties {

    @NotNull
    private final Duration interruptionThreshold;

    @NotNull
    private final Duration backchannelInterval;

    /**
     * Reserved. Validated and exposed, not consumed by the controller loops.
     */
    @NotNull
    private final Duration silenceTimeout;

    private final boolean allowInterruptions;
    private final boolean enableBackchannels;

    @Min(1)
    private final int sampleRate;

    @NotBlank
    private final String language;

    @NotNull
    private final Duration pollInterval;

    @NotNull
    private final Duration userSpeechFreshness;

    @NotNull
    private final Duration stopTimeout;

    @ConstructorBinding
    public DuplexProperties(Duration interruptionThreshold,
                            Duration backchannelInterval,
                            Duration silenceTimeout,
                            Boolean allowInterruptions,
                            Boolean enableBackchannels,
                            Integer sampleRate,
                            String language,
                            Duration pollInterval,
                            Duration userSpeechFreshness,
                            Duration stopTimeout) {
        this.interruptionThreshold = orDefault(interruptionThreshold, DuplexConfig.DEFAULT_INTERRUPTION_THRESHOLD);
        this.backchannelInterval = orDefault(backchannelInterval, DuplexConfig.DEFAULT_BACKCHANNEL_INTERVAL);
        this.silenceTimeout = orDefault(silenceTimeout, DuplexConfig.DEFAULT_SILENCE_TIMEOUT);
        this.allowInterruptions = allowInterruptions == null || allowInterruptions;
        this.enableBackchannels = enableBackchannels == null || enableBackchannels;
        this.sampleRate = sampleRate == null ? DuplexConfig.DEFAULT_SAMPLE_RATE : sampleRate;
        this.language = language == null ? DuplexConfig.DEFAULT_LANGUAGE : language;
        this.pollInterval = orDefault(pollInterval, DuplexConfig.DEFAULT_POLL_INTERVAL);
        this.userSpeechFreshness = orDefault(userSpeechFreshness, DuplexConfig.DEFAULT_USER_SPEECH_FRESHNESS);
        this.stopTimeout = orDefault(stopTimeout, DuplexConfig.DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Converts to the immutable controller configuration.
     *
     * @throws com.phillippitts.duplexvoice.exception.ControllerConfigurationException
     *         if a duration is zero or negative
     */
    public DuplexConfig toDuplexConfig() {
        return DuplexConfig.builder()
                .interruptionThreshold(interruptionThreshold)
                .backchannelInterval(backchannelInterval)
                .silenceTimeout(silenceTimeout)
                .allowInterruptions(allowInterruptions)
                .enableBackchannels(enableBackchannels)
                .sampleRate(sampleRate)
                .language(language)
                .pollInterval(pollInterval)
                .userSpeechFreshness(userSpeechFreshness)
                .stopTimeout(stopTimeout)
                .build();
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value == null ? fallback : value;
    }

    public Duration getInterruptionThreshold() {
        return interruptionThreshold;
    }

    public Duration getBackchannelInterval() {
        return backchannelInterval;
    }

    public Duration getSilenceTimeout() {
        return silenceTimeout;
    }

    public boolean isAllowInterruptions() {
        return allowInterruptions;
    }

    public boolean isEnableBackchannels() {
        return enableBackchannels;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public String getLanguage() {
        return language;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getUserSpeechFreshness() {
        return userSpeechFreshness;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }
}
