package com.phillippitts.scantomack.config.orchestration;

import com.phillippitts.scantomack.config.properties.CacheProperties;
import com.phillippitts.scantomack.config.properties.EnsembleProperties;
import com.phillippitts.scantomack.config.properties.OrchestrationProperties;
import com.phillippitts.scantomack.service.cache.InMemoryResultCache;
import com.phillippitts.scantomack.service.cache.NoOpResultCache;
import com.phillippitts.scantomack.service.cache.ResultCache;
import com.phillippitts.scantomack.service.combine.ResultCombiner;
import com.phillippitts.scantomack.service.combine.ResultSelector;
import com.phillippitts.scantomack.service.combine.impl.ConfidenceSelector;
import com.phillippitts.scantomack.service.combine.impl.ConsensusSelector;
import com.phillippitts.scantomack.service.combine.impl.PreferenceSelector;
import com.phillippitts.scantomack.service.integration.DocumentProcessingFacade;
import com.phillippitts.scantomack.service.metrics.OcrMetrics;
import com.phillippitts.scantomack.service.ocr.EngineResultAssembler;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.orchestration.Backoff;
import com.phillippitts.scantomack.service.orchestration.EngineInvoker;
import com.phillippitts.scantomack.service.orchestration.EnsembleDispatcher;
import com.phillippitts.scantomack.service.orchestration.ProcessingMetricsPublisher;
import com.phillippitts.scantomack.service.orchestration.ProcessingOrchestrator;
import com.phillippitts.scantomack.service.orchestration.RetryingDispatcher;
import com.phillippitts.scantomack.service.orchestration.ThreadSleepBackoff;
import com.phillippitts.scantomack.service.postprocess.RuleBasedTextPostProcessor;
import com.phillippitts.scantomack.service.postprocess.TextPostProcessor;
import com.phillippitts.scantomack.service.preprocess.DocumentPreprocessor;
import com.phillippitts.scantomack.service.preprocess.PassThroughPreprocessor;
import com.phillippitts.scantomack.service.quality.QualityAssessor;
import com.phillippitts.scantomack.service.quality.QualityMetricsCalculator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the processing pipeline explicitly to avoid bean ambiguity.
 *
 * <p>The collaborator seams (preprocessor, post-processor, cache, backoff) are
 * {@code @ConditionalOnMissingBean}, so a deployment can replace any of them with its own bean.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    @Bean
    public QualityMetricsCalculator qualityMetricsCalculator() {
        return new QualityMetricsCalculator();
    }

    @Bean
    public EngineResultAssembler engineResultAssembler(QualityMetricsCalculator calculator) {
        return new EngineResultAssembler(calculator);
    }

    @Bean
    public ResultSelector resultSelector(EnsembleProperties props) {
        return switch (props.getMethod()) {
            case CONFIDENCE_WEIGHTED -> new ConfidenceSelector();
            case PREFERENCE -> new PreferenceSelector(props.getPreference());
            case CONSENSUS -> new ConsensusSelector();
        };
    }

    @Bean
    public ResultCombiner resultCombiner(ResultSelector selector) {
        return new ResultCombiner(selector);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentPreprocessor documentPreprocessor() {
        return new PassThroughPreprocessor();
    }

    @Bean
    @ConditionalOnMissingBean
    public TextPostProcessor textPostProcessor() {
        return new RuleBasedTextPostProcessor();
    }

    @Bean
    public QualityAssessor qualityAssessor() {
        return new QualityAssessor();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultCache resultCache(CacheProperties props) {
        if (!props.isEnabled()) {
            return new NoOpResultCache();
        }
        LOG.info("In-memory result cache enabled (maxEntries={}, ttl={})", props.getMaxEntries(), props.getTtl());
        return new InMemoryResultCache(props.getMaxEntries(), props.getTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public Backoff backoff() {
        return new ThreadSleepBackoff();
    }

    @Bean
    public ProcessingMetricsPublisher processingMetricsPublisher(ObjectProvider<OcrMetrics> metrics) {
        return new ProcessingMetricsPublisher(metrics.getIfAvailable());
    }

    @Bean
    public EngineInvoker engineInvoker(EngineRegistry registry, EngineResultAssembler assembler,
                                       ProcessingMetricsPublisher metricsPublisher) {
        return new EngineInvoker(registry, assembler, metricsPublisher);
    }

    @Bean
    public RetryingDispatcher retryingDispatcher(EngineInvoker invoker, EngineRegistry registry, Backoff backoff,
                                                 OrchestrationProperties props) {
        return new RetryingDispatcher(invoker, registry, backoff, Duration.ofMillis(props.getBackoffBaseMs()));
    }

    @Bean
    public EnsembleDispatcher ensembleDispatcher(EngineInvoker invoker, ResultCombiner combiner,
                                                 @Qualifier("ocrExecutor") Executor ocrExecutor,
                                                 ProcessingMetricsPublisher metricsPublisher) {
        return new EnsembleDispatcher(invoker, combiner, ocrExecutor, metricsPublisher);
    }

    // CHECKSTYLE.OFF: ParameterNumber - explicit wiring of every pipeline seam
    @Bean
    public ProcessingOrchestrator processingOrchestrator(EngineRegistry registry,
                                                         RetryingDispatcher singleDispatcher,
                                                         EnsembleDispatcher ensembleDispatcher,
                                                         DocumentPreprocessor preprocessor,
                                                         TextPostProcessor postProcessor,
                                                         QualityAssessor assessor,
                                                         ResultCache cache,
                                                         @Value("${scantomack.version:0.1.0}") String version) {
        return new ProcessingOrchestrator(registry, singleDispatcher, ensembleDispatcher, preprocessor,
                postProcessor, assessor, cache, Clock.systemUTC(), version);
    }
    // CHECKSTYLE.ON: ParameterNumber

    @Bean
    public DocumentProcessingFacade documentProcessingFacade(ProcessingOrchestrator orchestrator,
                                                             EngineRegistry registry,
                                                             @Qualifier("eventExecutor") Executor eventExecutor,
                                                             ApplicationEventPublisher publisher,
                                                             OrchestrationProperties props) {
        return new DocumentProcessingFacade(orchestrator, registry, eventExecutor, publisher,
                props.getMaxDocumentBytes());
    }
}
