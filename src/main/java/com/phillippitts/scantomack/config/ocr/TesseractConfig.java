package com.phillippitts.scantomack.config.ocr;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the native Tesseract engine.
 * Binds to properties prefixed with "ocr.tesseract".
 *
 * <p>Example application.properties:
 * <pre>
 * ocr.tesseract.enabled=true
 * ocr.tesseract.datapath=/usr/share/tesseract-ocr/5/tessdata
 * ocr.tesseract.language=eng
 * ocr.tesseract.page-seg-mode=3
 * ocr.tesseract.engine-mode=1
 * ocr.tesseract.workers=4
 * </pre>
 *
 * @param enabled     whether the engine is registered at all
 * @param datapath    tessdata directory (must exist when enabled)
 * @param language    default language pack
 * @param pageSegMode Tesseract PSM (3 = fully automatic)
 * @param engineMode  Tesseract OEM (1 = LSTM only)
 * @param workers     requested worker count; capped at 4
 */
@ConfigurationProperties(prefix = "ocr.tesseract")
@Validated
public record TesseractConfig(
        boolean enabled,

        @NotBlank(message = "Tesseract datapath must not be blank")
        String datapath,

        @NotBlank(message = "Tesseract language must not be blank")
        String language,

        @Min(value = 0, message = "Page segmentation mode must be between 0 and 13")
        @Max(value = 13, message = "Page segmentation mode must be between 0 and 13")
        int pageSegMode,

        @Min(value = 0, message = "Engine mode must be between 0 and 3")
        @Max(value = 3, message = "Engine mode must be between 0 and 3")
        int engineMode,

        @Positive(message = "Worker count must be positive")
        int workers
) {
}
