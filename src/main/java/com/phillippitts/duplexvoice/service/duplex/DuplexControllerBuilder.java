package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.service.intent.IntentAnalyzer;
import com.phillippitts.duplexvoice.service.response.ResponseGenerator;
import com.phillippitts.duplexvoice.service.response.TemplateResponseGenerator;
import com.phillippitts.duplexvoice.service.stt.SpeechRecognizer;
import com.phillippitts.duplexvoice.service.tts.SpeechSynthesizer;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultDuplexController}.
 *
 * <p>The configuration and both executors are required. Everything else has a default: template
 * responses, no-op metrics, the system UTC clock and a fresh event bus. Components may be
 * supplied here or later through {@link DuplexController#setComponents}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DuplexController controller = DuplexControllerBuilder.builder()
 *     .config(DuplexConfig.defaults())
 *     .loopExecutor(loopExecutor)
 *     .backchannelExecutor(backchannelExecutor)
 *     .components(recognizer, synthesizer, analyzer)
 *     .build();
 * }</pre>
 */
public final class DuplexControllerBuilder {

    // Required
    private DuplexConfig config;
    private Executor loopExecutor;
    private Executor backchannelExecutor;

    // Optional
    private ResponseGenerator responseGenerator;
    private DuplexMetricsPublisher metricsPublisher;
    private Clock clock;
    private DuplexEventBus eventBus;
    private SpeechRecognizer recognizer;
    private SpeechSynthesizer synthesizer;
    private IntentAnalyzer intentAnalyzer;
    private DuplexCallbacks callbacks;
    private String context;

    private DuplexControllerBuilder() {
    }

    public static DuplexControllerBuilder builder() {
        return new DuplexControllerBuilder();
    }

    /**
     * @param config controller configuration (required)
     * @return this builder
     */
    public DuplexControllerBuilder config(DuplexConfig config) {
        this.config = config;
        return this;
    }

    /**
     * Executor for the four session loops. Needs at least four free threads per session.
     *
     * @param loopExecutor executor (required)
     * @return this builder
     */
    public DuplexControllerBuilder loopExecutor(Executor loopExecutor) {
        this.loopExecutor = loopExecutor;
        return this;
    }

    /**
     * Executor for fire-and-forget backchannel playback. Should reject rather than block when full.
     *
     * @param backchannelExecutor executor (required)
     * @return this builder
     */
    public DuplexControllerBuilder backchannelExecutor(Executor backchannelExecutor) {
        this.backchannelExecutor = backchannelExecutor;
        return this;
    }

    public DuplexControllerBuilder responseGenerator(ResponseGenerator responseGenerator) {
        this.responseGenerator = responseGenerator;
        return this;
    }

    public DuplexControllerBuilder metricsPublisher(DuplexMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * @param clock clock for turn timing; tests may supply a controllable one
     * @return this builder
     */
    public DuplexControllerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public DuplexControllerBuilder eventBus(DuplexEventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    public DuplexControllerBuilder components(SpeechRecognizer recognizer,
                                              SpeechSynthesizer synthesizer,
                                              IntentAnalyzer intentAnalyzer) {
        this.recognizer = recognizer;
        this.synthesizer = synthesizer;
        this.intentAnalyzer = intentAnalyzer;
        return this;
    }

    public DuplexControllerBuilder callbacks(DuplexCallbacks callbacks) {
        this.callbacks = callbacks;
        return this;
    }

    public DuplexControllerBuilder context(String context) {
        this.context = context;
        return this;
    }

    /**
     * Builds the controller.
     *
     * @return configured controller in IDLE state
     * @throws NullPointerException if a required dependency is missing
     * @throws com.phillippitts.duplexvoice.exception.ControllerConfigurationException
     *         if only some of the components were supplied
     */
    public DefaultDuplexController build() {
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(loopExecutor, "loopExecutor is required");
        Objects.requireNonNull(backchannelExecutor, "backchannelExecutor is required");

        DefaultDuplexController controller = new DefaultDuplexController(
                config,
                loopExecutor,
                backchannelExecutor,
                responseGenerator != null ? responseGenerator : new TemplateResponseGenerator(),
                metricsPublisher != null ? metricsPublisher : DuplexMetricsPublisher.NOOP,
                new SpeechTimingTracker(clock != null ? clock : Clock.systemUTC()),
                eventBus != null ? eventBus : new DuplexEventBus()
        );

        if (recognizer != null || synthesizer != null || intentAnalyzer != null) {
            controller.setComponents(recognizer, synthesizer, intentAnalyzer);
        }
        controller.setCallbacks(callbacks);
        controller.setContext(context);
        return controller;
    }
}
