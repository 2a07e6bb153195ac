package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.domain.EnsembleResult;
import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.AllEnginesFailedException;
import com.phillippitts.scantomack.exception.RecognitionException;
import com.phillippitts.scantomack.exception.RecognitionExceptionBuilder;
import com.phillippitts.scantomack.service.combine.ResultCombiner;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventChannel;
import com.phillippitts.scantomack.service.preprocess.PreprocessedDocument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs several engines in parallel on the OCR executor and combines the successes.
 *
 * <p>Each engine call is isolated: a failure is recorded and the others carry on. Every engine
 * call carries its own timeout, so waiting for all of them is bounded. The request fails only if
 * every engine failed.
 */
public class EnsembleDispatcher {

    private static final Logger LOG = LogManager.getLogger(EnsembleDispatcher.class);

    private final EngineInvoker invoker;
    private final ResultCombiner combiner;
    private final Executor executor;
    private final ProcessingMetricsPublisher metrics;

    public EnsembleDispatcher(EngineInvoker invoker, ResultCombiner combiner, Executor executor,
                              ProcessingMetricsPublisher metrics) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.combiner = Objects.requireNonNull(combiner, "combiner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = metrics == null ? ProcessingMetricsPublisher.NOOP : metrics;
    }

    /**
     * @param engines engines to run (duplicates ignored)
     * @throws AllEnginesFailedException if no engine succeeded (or none were given)
     */
    public EnsembleResult dispatch(List<EngineId> engines,
                                   PreprocessedDocument document,
                                   ProcessingOptions options,
                                   ProcessingEventChannel channel) {
        List<EngineId> targets = engines.stream().distinct().toList();
        if (targets.isEmpty()) {
            throw new AllEnginesFailedException("No engines available for ensemble", Map.of(), null);
        }

        Map<EngineId, CompletableFuture<EngineResult>> futures = new LinkedHashMap<>();
        for (EngineId id : targets) {
            channel.emit(ProcessingEvent.Type.ENGINE_SELECTED,
                    Map.of("engine", id.wireName(), "attempt", 1, "fallback", false));
            futures.put(id, CompletableFuture.supplyAsync(() -> invoker.invoke(id, document, options), executor));
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                .exceptionally(t -> null)
                .join();

        Map<EngineId, EngineResult> successes = new EnumMap<>(EngineId.class);
        Map<EngineId, RecognitionException> failures = new LinkedHashMap<>();
        RecognitionException last = null;
        List<RuntimeException> nonRecognition = new ArrayList<>();
        for (Map.Entry<EngineId, CompletableFuture<EngineResult>> e : futures.entrySet()) {
            try {
                successes.put(e.getKey(), e.getValue().join());
            } catch (CompletionException ce) {
                RecognitionException failure = asRecognitionFailure(e.getKey(), ce.getCause(), nonRecognition);
                failures.put(e.getKey(), failure);
                last = failure;
                LOG.warn("Ensemble member {} failed: {}", e.getKey(), failure.getMessage());
            }
        }

        if (successes.isEmpty()) {
            if (nonRecognition.size() == targets.size()) {
                // Every engine rejected the document itself
                throw nonRecognition.get(0);
            }
            throw new AllEnginesFailedException("All ensemble engines failed", failures, last);
        }

        EnsembleResult result = combiner.combine(successes);
        metrics.recordEnsemble(result.combinationMethod(), successes.size());
        LOG.info("Ensemble combined {}/{} engines (agreement={})", successes.size(), targets.size(),
                String.format("%.3f", result.agreementScore()));
        return result;
    }

    private static RecognitionException asRecognitionFailure(EngineId id, Throwable cause,
                                                             List<RuntimeException> nonRecognition) {
        if (cause instanceof RecognitionException re) {
            return re;
        }
        if (cause instanceof RuntimeException rt) {
            nonRecognition.add(rt);
        }
        return RecognitionExceptionBuilder.create("Ensemble member failed")
                .engine(id)
                .cause(cause)
                .build();
    }
}
