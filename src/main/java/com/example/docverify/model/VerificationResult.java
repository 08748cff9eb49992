package com.example.docverify.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated outcome of one document verification.
 *
 * @param overallConfidence  mean confidence of all present fields (0-100)
 * @param extractedData      fields extracted from the document
 * @param validationChecks   document validity verdicts, in fixed order
 * @param eligibilityChecks  eligibility verdicts, in fixed order
 * @param recommendedActions next steps for the case officer
 * @param summary            one-paragraph outcome
 * @param verifiedAt         when the verification completed
 */
public record VerificationResult(
        int overallConfidence,
        ExtractedDocument extractedData,
        List<ValidationCheck> validationChecks,
        List<EligibilityCheck> eligibilityChecks,
        List<String> recommendedActions,
        String summary,
        Instant verifiedAt
) {

    public VerificationResult {
        validationChecks = List.copyOf(validationChecks);
        eligibilityChecks = List.copyOf(eligibilityChecks);
        recommendedActions = List.copyOf(recommendedActions);
    }

    public boolean allChecksPassed() {
        return validationChecks.stream().allMatch(ValidationCheck::passed)
                && eligibilityChecks.stream().allMatch(EligibilityCheck::passed);
    }
}
