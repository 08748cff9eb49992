package com.example.docverify.orchestrator;

import com.example.docverify.eligibility.EligibilityChecker;
import com.example.docverify.extraction.HeuristicFieldExtractor;
import com.example.docverify.model.ApplicantData;
import com.example.docverify.model.EligibilityCheck;
import com.example.docverify.model.EligibilityPolicy;
import com.example.docverify.model.ExtractedDocument;
import com.example.docverify.model.ValidationCheck;
import com.example.docverify.model.VerificationResult;
import com.example.docverify.mrz.MrzCodec;
import com.example.docverify.mrz.MrzRecord;
import com.example.docverify.ocr.OcrEngine;
import com.example.docverify.service.VerificationReportService;
import com.example.docverify.validation.DocumentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Verification pipeline.
 * <ol>
 *   <li>OCR of the document image</li>
 *   <li>MRZ detection and decoding</li>
 *   <li>Field extraction (MRZ first, free-text heuristics for the rest)</li>
 *   <li>Document validity and eligibility checks</li>
 *   <li>Confidence aggregation, recommended actions and summary</li>
 * </ol>
 * Holds no state between requests.
 */
@Service
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    private final OcrEngine ocrEngine;
    private final MrzCodec mrzCodec;
    private final HeuristicFieldExtractor fieldExtractor;
    private final DocumentValidator documentValidator;
    private final EligibilityChecker eligibilityChecker;
    private final VerificationReportService reportService;
    private final EligibilityPolicy defaultPolicy;
    private final Clock clock;

    public VerificationOrchestrator(OcrEngine ocrEngine,
                                    MrzCodec mrzCodec,
                                    HeuristicFieldExtractor fieldExtractor,
                                    DocumentValidator documentValidator,
                                    EligibilityChecker eligibilityChecker,
                                    VerificationReportService reportService,
                                    @Qualifier("defaultEligibilityPolicy") EligibilityPolicy defaultPolicy,
                                    Clock clock) {
        this.ocrEngine = ocrEngine;
        this.mrzCodec = mrzCodec;
        this.fieldExtractor = fieldExtractor;
        this.documentValidator = documentValidator;
        this.eligibilityChecker = eligibilityChecker;
        this.reportService = reportService;
        this.defaultPolicy = defaultPolicy;
        this.clock = clock;
    }

    /**
     * Verifies a document image against the applicant's claims.
     *
     * @param imageBytes encoded document image
     * @param applicant  claimed identity and intended visa type
     * @param policy     eligibility policy, or {@code null} for the configured default
     * @throws com.example.docverify.ocr.OcrException if the image cannot be recognized
     */
    public VerificationResult verify(byte[] imageBytes, ApplicantData applicant, EligibilityPolicy policy) {
        log.info("[1/5] Running OCR on {} byte image...", imageBytes.length);
        String rawText = ocrEngine.recognize(imageBytes);
        log.info("[1/5] OCR completed: {} characters", rawText.length());
        return verifyText(rawText, applicant, policy);
    }

    /**
     * Runs the pipeline from already recognized text.
     */
    public VerificationResult verifyText(String rawText, ApplicantData applicant, EligibilityPolicy policy) {
        EligibilityPolicy effectivePolicy = policy != null ? policy : defaultPolicy;

        log.info("[2/5] Detecting machine-readable zone...");
        List<String> mrzLines = mrzCodec.detectMrzLines(rawText);
        MrzRecord mrz = null;
        if (mrzLines.isEmpty()) {
            log.info("[2/5] No MRZ lines found, relying on text heuristics");
        } else {
            mrz = mrzCodec.parse(mrzLines);
            if (mrz.valid()) {
                log.info("[2/5] MRZ {} decoded, all check digits valid", mrz.layout());
            } else {
                log.warn("[2/5] MRZ decoded with {} error(s): {}", mrz.errors().size(), mrz.errors());
            }
        }

        log.info("[3/5] Extracting document fields...");
        ExtractedDocument document = fieldExtractor.extractFields(rawText, mrz);

        log.info("[4/5] Running validity and eligibility checks...");
        List<ValidationCheck> validationChecks = documentValidator.validateDocument(document);
        List<EligibilityCheck> eligibilityChecks =
                eligibilityChecker.checkEligibility(document, applicant, effectivePolicy);

        log.info("[5/5] Building report...");
        int overallConfidence = reportService.overallConfidence(document);
        List<String> actions = reportService.recommendedActions(validationChecks, eligibilityChecks,
                overallConfidence, effectivePolicy, applicant.intendedVisaType());
        String summary = reportService.summary(document, validationChecks, eligibilityChecks, overallConfidence);

        VerificationResult result = new VerificationResult(overallConfidence, document, validationChecks,
                eligibilityChecks, actions, summary, clock.instant());

        log.info("Verification completed: confidence {}%, {} validation / {} eligibility check(s) failed",
                overallConfidence,
                validationChecks.stream().filter(c -> !c.passed()).count(),
                eligibilityChecks.stream().filter(c -> !c.passed()).count());
        return result;
    }
}
