package com.phillippitts.scantomack.config.properties;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;

/**
 * How ensemble results are combined ({@code ocr.ensemble.*}).
 */
@ConfigurationProperties(prefix = "ocr.ensemble")
public class EnsembleProperties {

    static final List<EngineId> DEFAULT_PREFERENCE =
            List.of(EngineId.TESSERACT, EngineId.PADDLEOCR, EngineId.EASYOCR);

    private final CombinationMethod method;

    /** Engine order for the PREFERENCE method. */
    private final List<EngineId> preference;

    @ConstructorBinding
    public EnsembleProperties(CombinationMethod method, List<EngineId> preference) {
        this.method = method == null ? CombinationMethod.CONFIDENCE_WEIGHTED : method;
        this.preference = preference == null || preference.isEmpty() ? DEFAULT_PREFERENCE : List.copyOf(preference);
        if (this.preference.contains(EngineId.ENSEMBLE)) {
            throw new IllegalArgumentException("ocr.ensemble.preference must list real engines only");
        }
    }

    public CombinationMethod getMethod() {
        return method;
    }

    public List<EngineId> getPreference() {
        return preference;
    }
}
