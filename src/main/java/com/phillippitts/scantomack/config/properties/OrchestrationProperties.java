package com.phillippitts.scantomack.config.properties;

import com.phillippitts.scantomack.domain.ProcessingOptions;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for request processing defaults ({@code ocr.orchestration.*}).
 */
@Validated
@ConfigurationProperties(prefix = "ocr.orchestration")
public class OrchestrationProperties {

    /** Per engine call timeout used when a request does not set one. */
    @Min(1)
    private final long defaultTimeoutMs;

    /** Attempts on the primary engine before fallbacks. */
    @Min(0)
    private final int maxRetries;

    private final boolean fallbackEnabled;

    /** First retry delay; later delays double. */
    @Min(0)
    private final long backoffBaseMs;

    @NotBlank
    private final String defaultLanguage;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double qualityThreshold;

    /** Uploads larger than this are rejected; 0 disables the check. */
    @Min(0)
    private final long maxDocumentBytes;

    @ConstructorBinding
    public OrchestrationProperties(Long defaultTimeoutMs,
                                   Integer maxRetries,
                                   Boolean fallbackEnabled,
                                   Long backoffBaseMs,
                                   String defaultLanguage,
                                   Double qualityThreshold,
                                   Long maxDocumentBytes) {
        this.defaultTimeoutMs = defaultTimeoutMs == null ? 60_000L : defaultTimeoutMs;
        this.maxRetries = maxRetries == null ? ProcessingOptions.DEFAULT_MAX_RETRIES : maxRetries;
        this.fallbackEnabled = fallbackEnabled == null || fallbackEnabled;
        this.backoffBaseMs = backoffBaseMs == null ? 1000L : backoffBaseMs;
        this.defaultLanguage = defaultLanguage == null ? ProcessingOptions.DEFAULT_LANGUAGE : defaultLanguage;
        this.qualityThreshold = qualityThreshold == null ? 0.0 : qualityThreshold;
        this.maxDocumentBytes = maxDocumentBytes == null ? 20L * 1024 * 1024 : maxDocumentBytes;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public long getMaxDocumentBytes() {
        return maxDocumentBytes;
    }

    /**
     * Options builder pre-filled with these defaults.
     */
    public ProcessingOptions.Builder defaultOptions() {
        return ProcessingOptions.builder()
                .language(defaultLanguage)
                .timeout(Duration.ofMillis(defaultTimeoutMs))
                .maxRetries(maxRetries)
                .fallbackEnabled(fallbackEnabled)
                .qualityThreshold(qualityThreshold);
    }
}
