package com.phillippitts.scantomack.domain;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable per-request options, passed unchanged through the whole pipeline.
 *
 * @param language            engine language code (Tesseract style, e.g. "eng")
 * @param engines             engine selection
 * @param confidenceThreshold results below this confidence produce a warning
 * @param timeout             per engine call timeout
 * @param maxRetries          attempts on the primary engine (at least 1 is always made)
 * @param fallbackEnabled     whether other engines may substitute for a failed primary
 * @param correlationId       request correlation id (not part of the request key)
 * @param preprocessingSteps  requested preprocessing steps, in order
 * @param postProcessing      whether to run text post-processing
 * @param caching             whether the result cache may be consulted and filled
 * @param qualityThreshold    overall quality below this adds a high-impact warning
 */
public record ProcessingOptions(
        String language,
        EngineSelector engines,
        double confidenceThreshold,
        Duration timeout,
        int maxRetries,
        boolean fallbackEnabled,
        String correlationId,
        List<String> preprocessingSteps,
        boolean postProcessing,
        boolean caching,
        double qualityThreshold
) {

    public static final String DEFAULT_LANGUAGE = "eng";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 2;

    public ProcessingOptions {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        Objects.requireNonNull(engines, "engines");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0,1]");
        }
        if (qualityThreshold < 0.0 || qualityThreshold > 1.0) {
            throw new IllegalArgumentException("qualityThreshold must be in [0,1]");
        }
        preprocessingSteps = preprocessingSteps == null ? List.of() : List.copyOf(preprocessingSteps);
    }

    /**
     * Stable key of every option that affects the produced result. The correlation id is excluded
     * so that identical requests from different callers share one execution.
     */
    public String normalizedKey() {
        return String.join("|",
                language.trim().toLowerCase(Locale.ROOT),
                engines.key(),
                Double.toString(confidenceThreshold),
                Long.toString(timeout.toMillis()),
                Integer.toString(maxRetries),
                Boolean.toString(fallbackEnabled),
                String.join(",", preprocessingSteps),
                Boolean.toString(postProcessing),
                Double.toString(qualityThreshold));
    }

    public ProcessingOptions withCorrelationId(String id) {
        return new ProcessingOptions(language, engines, confidenceThreshold, timeout, maxRetries,
                fallbackEnabled, id, preprocessingSteps, postProcessing, caching, qualityThreshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .language(language)
                .engines(engines)
                .confidenceThreshold(confidenceThreshold)
                .timeout(timeout)
                .maxRetries(maxRetries)
                .fallbackEnabled(fallbackEnabled)
                .correlationId(correlationId)
                .preprocessingSteps(preprocessingSteps)
                .postProcessing(postProcessing)
                .caching(caching)
                .qualityThreshold(qualityThreshold);
    }

    /**
     * Fluent builder with service defaults: Tesseract, English, 60s timeout, 2 retries, fallback on.
     */
    public static final class Builder {
        private String language = DEFAULT_LANGUAGE;
        private EngineSelector engines = EngineSelector.single(EngineId.TESSERACT);
        private double confidenceThreshold = 0.0;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private boolean fallbackEnabled = true;
        private String correlationId;
        private List<String> preprocessingSteps = List.of();
        private boolean postProcessing = true;
        private boolean caching = false;
        private double qualityThreshold = 0.0;

        private Builder() {
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder engines(EngineSelector engines) {
            this.engines = engines;
            return this;
        }

        public Builder engine(EngineId engine) {
            this.engines = EngineSelector.single(engine);
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder fallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder preprocessingSteps(List<String> preprocessingSteps) {
            this.preprocessingSteps = preprocessingSteps;
            return this;
        }

        public Builder postProcessing(boolean postProcessing) {
            this.postProcessing = postProcessing;
            return this;
        }

        public Builder caching(boolean caching) {
            this.caching = caching;
            return this;
        }

        public Builder qualityThreshold(double qualityThreshold) {
            this.qualityThreshold = qualityThreshold;
            return this;
        }

        public ProcessingOptions build() {
            return new ProcessingOptions(language, engines, confidenceThreshold, timeout, maxRetries,
                    fallbackEnabled, correlationId, preprocessingSteps, postProcessing, caching, qualityThreshold);
        }
    }
}
