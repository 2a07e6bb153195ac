package com.phillippitts.scantomack.service.ocr;

import java.util.Set;

/**
 * What an engine can handle, recorded by the registry when the engine passes its probe.
 *
 * @param languages      engine-native language codes
 * @param formats        accepted image formats
 * @param features       engine features (e.g. layout_analysis)
 * @param specialties    document kinds the engine is known to be good at
 * @param maxConcurrency concurrent calls the engine serves
 */
public record EngineCapabilities(
        Set<String> languages,
        Set<String> formats,
        Set<String> features,
        Set<String> specialties,
        int maxConcurrency
) {
    public EngineCapabilities {
        languages = Set.copyOf(languages);
        formats = Set.copyOf(formats);
        features = Set.copyOf(features);
        specialties = Set.copyOf(specialties);
    }
}
