package com.example.docverify.service;

import com.example.docverify.model.EligibilityCheck;
import com.example.docverify.model.EligibilityPolicy;
import com.example.docverify.model.ExtractedDocument;
import com.example.docverify.model.ValidationCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.docverify.TestFixtures.defaultPolicy;
import static com.example.docverify.TestFixtures.field;
import static com.example.docverify.TestFixtures.validDocument;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("VerificationReportService")
class VerificationReportServiceTest {

    private static final List<ValidationCheck> VALID =
            List.of(ValidationCheck.pass("Document Expiry", "Document valid until 2030-04-15"));
    private static final List<ValidationCheck> EXPIRED =
            List.of(ValidationCheck.fail("Document Expiry", "Document expired on 2012-04-15"),
                    ValidationCheck.pass("Name Format", "Name format valid"));
    private static final List<EligibilityCheck> ELIGIBLE =
            List.of(EligibilityCheck.pass("Name Match", "Applicant name matches document"));
    private static final List<EligibilityCheck> INELIGIBLE =
            List.of(EligibilityCheck.fail("Validity Period", "Document only valid for 2 months, requires 6"),
                    EligibilityCheck.fail("Nationality Eligibility", "Nationality PRK is not eligible for visa"));

    private final VerificationReportService service = new VerificationReportService();
    private final EligibilityPolicy policy = defaultPolicy();

    @Nested
    @DisplayName("Overall confidence")
    class OverallConfidence {

        @Test
        @DisplayName("Mean of the present fields, rounded")
        void roundedMean() {
            assertThat(service.overallConfidence(validDocument())).isEqualTo(93);
        }

        @Test
        @DisplayName("Optional fields count once present")
        void includesOptionalFields() {
            ExtractedDocument doc = validDocument().toBuilder()
                    .mrzLine1(field("P<UTO"))
                    .mrzLine2(field("L898902C3"))
                    .build();

            assertThat(service.overallConfidence(doc)).isEqualTo(93);
            assertThat(doc.presentFields()).hasSize(12);
        }

        @Test
        void unknownFieldsScoreZero() {
            assertThat(service.overallConfidence(ExtractedDocument.builder().build())).isZero();
        }
    }

    @Nested
    @DisplayName("Recommended actions")
    class RecommendedActions {

        @Test
        @DisplayName("Clean, confident verification proceeds and lists the supporting documents")
        void proceed() {
            assertThat(service.recommendedActions(VALID, ELIGIBLE, 93, policy, "tourist")).containsExactly(
                    "Proceed with visa application - all checks passed",
                    "Collect supporting documents for tourist visa: Valid passport, Proof of accommodation");
        }

        @Test
        @DisplayName("Failures come first and suppress the supporting documents")
        void failures() {
            assertThat(service.recommendedActions(EXPIRED, INELIGIBLE, 65, policy, "tourist")).containsExactly(
                    "Review failed validation checks: Document Expiry",
                    "Address eligibility issues: Validity Period, Nationality Eligibility",
                    "Request manual verification due to low confidence in extracted data");
        }

        @Test
        void mediumConfidence() {
            assertThat(service.recommendedActions(VALID, ELIGIBLE, 75, policy, "work")).containsExactly(
                    "Consider requesting clearer document images for higher confidence",
                    "Collect supporting documents for work visa: Valid passport, Job offer letter, Work permit");
        }

        @Test
        void lowConfidenceWithoutFailures() {
            assertThat(service.recommendedActions(VALID, ELIGIBLE, 60, policy, "tourist")).startsWith(
                    "Request manual verification due to low confidence in extracted data",
                    "Consider requesting clearer document images for higher confidence");
        }

        @Test
        void unconfiguredVisaType() {
            assertThat(service.recommendedActions(VALID, ELIGIBLE, 90, policy, "diplomatic"))
                    .containsExactly("Proceed with visa application - all checks passed");
        }
    }

    @Nested
    @DisplayName("Summary")
    class Summary {

        @Test
        void success() {
            assertThat(service.summary(validDocument(), VALID, ELIGIBLE, 93)).isEqualTo(
                    "Document verification successful. P document L898902C3 for ANNA MARIA ERIKSSON passed all "
                            + "validation and eligibility checks with 93% confidence. Application is ready to proceed.");
        }

        @Test
        @DisplayName("Validation failures take precedence over eligibility failures")
        void validationFailure() {
            assertThat(service.summary(validDocument(), EXPIRED, INELIGIBLE, 93)).isEqualTo(
                    "Document verification flagged issues. P document L898902C3 for ANNA MARIA ERIKSSON failed 1 "
                            + "validation check(s): Document Expiry. Manual review required.");
        }

        @Test
        void eligibilityFailure() {
            assertThat(service.summary(validDocument(), VALID, INELIGIBLE, 93)).isEqualTo(
                    "Eligibility check failed. P document L898902C3 for ANNA MARIA ERIKSSON does not meet "
                            + "eligibility requirements for visa application. Failed 2 check(s): Validity Period, "
                            + "Nationality Eligibility.");
        }

        @Test
        void lowConfidence() {
            assertThat(service.summary(validDocument(), VALID, ELIGIBLE, 60)).isEqualTo(
                    "Low confidence verification. P document L898902C3 for ANNA MARIA ERIKSSON extracted with only "
                            + "60% confidence. Request clearer images or manual verification.");
        }

        @Test
        void mediumConfidence() {
            assertThat(service.summary(validDocument(), VALID, ELIGIBLE, 80)).isEqualTo(
                    "Document verification completed with 80% confidence. P document L898902C3 for "
                            + "ANNA MARIA ERIKSSON. Review recommended actions before proceeding.");
        }
    }
}
