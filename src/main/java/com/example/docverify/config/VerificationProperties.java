package com.example.docverify.config;

import com.example.docverify.extraction.MissingDatePolicy;
import com.example.docverify.model.EligibilityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for document verification.
 */
@ConfigurationProperties(prefix = "verification")
public record VerificationProperties(
        Ocr ocr,
        Extraction extraction,
        EligibilityPolicy defaultPolicy
) {

    public VerificationProperties {
        if (ocr == null) ocr = new Ocr(null, null, null, null);
        if (extraction == null) extraction = new Extraction(null);
    }

    /**
     * Tesseract settings.
     *
     * @param datapath     tessdata directory
     * @param language     traineddata language(s), e.g. "eng"
     * @param pageSegMode  tesseract page segmentation mode
     * @param ocrEngineMode tesseract engine mode (1 = LSTM only)
     */
    public record Ocr(String datapath, String language, Integer pageSegMode, Integer ocrEngineMode) {
        public Ocr {
            if (datapath == null || datapath.isBlank()) datapath = "/usr/share/tesseract-ocr/5/tessdata";
            if (language == null || language.isBlank()) language = "eng";
            if (pageSegMode == null) pageSegMode = 3;
            if (ocrEngineMode == null) ocrEngineMode = 1;
        }
    }

    /**
     * Heuristic extraction settings.
     *
     * @param missingDate value reported for a date found nowhere in the text
     */
    public record Extraction(MissingDatePolicy missingDate) {
        public Extraction {
            if (missingDate == null) missingDate = MissingDatePolicy.TODAY;
        }
    }
}
