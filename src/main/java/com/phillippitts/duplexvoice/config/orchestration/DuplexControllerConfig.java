package com.phillippitts.duplexvoice.config.orchestration;

import com.phillippitts.duplexvoice.config.properties.DuplexProperties;
import com.phillippitts.duplexvoice.service.duplex.DuplexController;
import com.phillippitts.duplexvoice.service.duplex.DuplexControllerBuilder;
import com.phillippitts.duplexvoice.service.duplex.DuplexMetricsPublisher;
import com.phillippitts.duplexvoice.service.intent.IntentAnalyzer;
import com.phillippitts.duplexvoice.service.metrics.DuplexMetrics;
import com.phillippitts.duplexvoice.service.response.ResponseGenerator;
import com.phillippitts.duplexvoice.service.response.TemplateResponseGenerator;
import com.phillippitts.duplexvoice.service.stt.SpeechRecognizer;
import com.phillippitts.duplexvoice.service.tts.SpeechSynthesizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the {@link DuplexController} from {@code duplex.*} properties and the duplex executors.
 *
 * <p>Recognizer, synthesizer and intent analyzer are optional beans: when the embedding
 * application provides all three they are attached at startup, otherwise callers attach them
 * with {@link DuplexController#setComponents} before starting a session.
 */
@Configuration
public class DuplexControllerConfig {

    private static final Logger LOG = LogManager.getLogger(DuplexControllerConfig.class);

    @Bean
    public DuplexMetricsPublisher duplexMetricsPublisher(DuplexMetrics metrics) {
        return new DuplexMetricsPublisher(metrics);
    }

    /**
     * Template-based responses, replaceable by declaring another {@link ResponseGenerator} bean.
     */
    @Bean
    @ConditionalOnMissingBean(ResponseGenerator.class)
    public ResponseGenerator responseGenerator() {
        return new TemplateResponseGenerator();
    }

    /**
     * The controller. Its session is stopped when the context closes.
     */
    @Bean(destroyMethod = "stop")
    public DuplexController duplexController(DuplexProperties properties,
                                             @Qualifier("duplexLoopExecutor") Executor loopExecutor,
                                             @Qualifier("backchannelExecutor") Executor backchannelExecutor,
                                             ResponseGenerator responseGenerator,
                                             DuplexMetricsPublisher metricsPublisher,
                                             ObjectProvider<SpeechRecognizer> recognizer,
                                             ObjectProvider<SpeechSynthesizer> synthesizer,
                                             ObjectProvider<IntentAnalyzer> intentAnalyzer) {
        DuplexController controller = DuplexControllerBuilder.builder()
                .config(properties.toDuplexConfig())
                .loopExecutor(loopExecutor)
                .backchannelExecutor(backchannelExecutor)
                .responseGenerator(responseGenerator)
                .metricsPublisher(metricsPublisher)
                .build();

        SpeechRecognizer stt = recognizer.getIfUnique();
        SpeechSynthesizer tts = synthesizer.getIfUnique();
        IntentAnalyzer analyzer = intentAnalyzer.getIfUnique();
        if (stt != null && tts != null && analyzer != null) {
            controller.setComponents(stt, tts, analyzer);
        } else {
            LOG.info("Duplex components not provided as beans; call setComponents() before start()");
        }
        return controller;
    }
}
