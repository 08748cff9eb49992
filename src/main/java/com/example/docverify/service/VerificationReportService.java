package com.example.docverify.service;

import com.example.docverify.model.ConfidenceField;
import com.example.docverify.model.EligibilityCheck;
import com.example.docverify.model.EligibilityPolicy;
import com.example.docverify.model.EligibilityPolicy.VisaTypeRequirement;
import com.example.docverify.model.ExtractedDocument;
import com.example.docverify.model.ValidationCheck;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the check verdicts and field confidences into the officer-facing part of the result:
 * overall confidence, recommended actions and a summary sentence.
 */
@Service
public class VerificationReportService {

    /** At or above this overall confidence a clean verification may proceed. */
    static final int HIGH_CONFIDENCE = 85;

    /** Below this overall confidence the extraction needs a human. */
    static final int LOW_CONFIDENCE = 70;

    /**
     * Mean confidence of every present field, rounded half up; 0 when there is none.
     */
    public int overallConfidence(ExtractedDocument document) {
        List<ConfidenceField> fields = document.presentFields();
        if (fields.isEmpty()) return 0;
        double mean = fields.stream().mapToInt(ConfidenceField::confidence).average().orElse(0);
        return (int) Math.round(mean);
    }

    /**
     * Next steps for the case officer, most urgent first. Supporting documents for the visa type are
     * only listed when no check failed.
     */
    public List<String> recommendedActions(List<ValidationCheck> validationChecks,
                                           List<EligibilityCheck> eligibilityChecks,
                                           int overallConfidence,
                                           EligibilityPolicy policy,
                                           String visaType) {
        VisaTypeRequirement visaRequirement = policy.requirementFor(visaType);
        List<String> failedValidations = failedValidationNames(validationChecks);
        List<String> failedEligibility = failedEligibilityNames(eligibilityChecks);
        boolean nothingFailed = failedValidations.isEmpty() && failedEligibility.isEmpty();
        List<String> actions = new ArrayList<>();

        if (!failedValidations.isEmpty()) {
            actions.add("Review failed validation checks: " + String.join(", ", failedValidations));
        }
        if (!failedEligibility.isEmpty()) {
            actions.add("Address eligibility issues: " + String.join(", ", failedEligibility));
        }
        if (overallConfidence < LOW_CONFIDENCE) {
            actions.add("Request manual verification due to low confidence in extracted data");
        }
        if (overallConfidence < HIGH_CONFIDENCE && nothingFailed) {
            actions.add("Consider requesting clearer document images for higher confidence");
        }
        if (nothingFailed && overallConfidence >= HIGH_CONFIDENCE) {
            actions.add("Proceed with visa application - all checks passed");
        }
        if (nothingFailed && visaRequirement != null && !visaRequirement.additionalRequirements().isEmpty()) {
            actions.add("Collect supporting documents for %s visa: %s"
                    .formatted(visaType, String.join(", ", visaRequirement.additionalRequirements())));
        }
        if (actions.isEmpty()) {
            actions.add("Review application manually before proceeding");
        }
        return actions;
    }

    public String summary(ExtractedDocument document,
                          List<ValidationCheck> validationChecks,
                          List<EligibilityCheck> eligibilityChecks,
                          int overallConfidence) {
        String documentType = document.documentType().value();
        String documentNumber = document.documentNumber().value();
        String holder = document.fullName();
        List<String> failedValidations = failedValidationNames(validationChecks);
        List<String> failedEligibility = failedEligibilityNames(eligibilityChecks);

        if (failedValidations.isEmpty() && failedEligibility.isEmpty() && overallConfidence >= HIGH_CONFIDENCE) {
            return ("Document verification successful. %s document %s for %s passed all validation and "
                    + "eligibility checks with %d%% confidence. Application is ready to proceed.")
                    .formatted(documentType, documentNumber, holder, overallConfidence);
        }
        if (!failedValidations.isEmpty()) {
            return ("Document verification flagged issues. %s document %s for %s failed %d validation "
                    + "check(s): %s. Manual review required.")
                    .formatted(documentType, documentNumber, holder, failedValidations.size(),
                            String.join(", ", failedValidations));
        }
        if (!failedEligibility.isEmpty()) {
            return ("Eligibility check failed. %s document %s for %s does not meet eligibility requirements "
                    + "for visa application. Failed %d check(s): %s.")
                    .formatted(documentType, documentNumber, holder, failedEligibility.size(),
                            String.join(", ", failedEligibility));
        }
        if (overallConfidence < LOW_CONFIDENCE) {
            return ("Low confidence verification. %s document %s for %s extracted with only %d%% confidence. "
                    + "Request clearer images or manual verification.")
                    .formatted(documentType, documentNumber, holder, overallConfidence);
        }
        return ("Document verification completed with %d%% confidence. %s document %s for %s. "
                + "Review recommended actions before proceeding.")
                .formatted(overallConfidence, documentType, documentNumber, holder);
    }

    private static List<String> failedValidationNames(List<ValidationCheck> checks) {
        return checks.stream().filter(c -> !c.passed()).map(ValidationCheck::check).toList();
    }

    private static List<String> failedEligibilityNames(List<EligibilityCheck> checks) {
        return checks.stream().filter(c -> !c.passed()).map(EligibilityCheck::check).toList();
    }
}
