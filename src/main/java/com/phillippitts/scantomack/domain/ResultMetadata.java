package com.phillippitts.scantomack.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Provenance of an engine result.
 *
 * @param correlationId      request correlation id
 * @param timestamp          when the result was produced
 * @param preprocessingSteps preprocessing steps actually applied to the image
 * @param postprocessing     steps applied to the result after recognition (e.g. ensemble combination)
 * @param engineVersion      engine-reported version string, or "unknown"
 */
public record ResultMetadata(
        String correlationId,
        Instant timestamp,
        List<String> preprocessingSteps,
        List<String> postprocessing,
        String engineVersion
) {
    public ResultMetadata {
        Objects.requireNonNull(timestamp, "timestamp");
        preprocessingSteps = preprocessingSteps == null ? List.of() : List.copyOf(preprocessingSteps);
        postprocessing = postprocessing == null ? List.of() : List.copyOf(postprocessing);
        engineVersion = engineVersion == null || engineVersion.isBlank() ? "unknown" : engineVersion;
    }

    public ResultMetadata withPostprocessing(String step) {
        List<String> steps = new ArrayList<>(postprocessing);
        steps.add(step);
        return new ResultMetadata(correlationId, timestamp, preprocessingSteps, steps, engineVersion);
    }
}
