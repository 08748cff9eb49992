package com.example.docverify.eligibility;

import com.example.docverify.model.ApplicantData;
import com.example.docverify.model.EligibilityCheck;
import com.example.docverify.model.EligibilityPolicy;
import com.example.docverify.model.EligibilityPolicy.VisaTypeRequirement;
import com.example.docverify.model.ExtractedDocument;
import com.example.docverify.validation.IsoDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cross-checks the extracted document against the applicant's claims and the eligibility policy.
 * <p>
 * The checks are independent of each other and never modify the applicant data or the policy.
 */
@Service
public class EligibilityChecker {

    private static final Logger log = LoggerFactory.getLogger(EligibilityChecker.class);

    static final String NAME_MATCH = "Name Match";
    static final String DATE_OF_BIRTH_MATCH = "Date of Birth Match";
    static final String PASSPORT_NUMBER_MATCH = "Passport Number Match";
    static final String NATIONALITY_MATCH = "Nationality Match";
    static final String AGE_REQUIREMENTS = "Age Requirements";
    static final String NATIONALITY_ELIGIBILITY = "Nationality Eligibility";
    static final String DOCUMENT_TYPE = "Document Type";
    static final String VALIDITY_PERIOD = "Validity Period";
    static final String VISA_TYPE_REQUIREMENTS = "Visa Type Requirements";

    /** Validity is measured in fixed 30-day months. */
    private static final double DAYS_PER_MONTH = 30.0;

    private final Clock clock;
    private final List<Check> checks;

    public EligibilityChecker(Clock clock) {
        this.clock = clock;
        this.checks = List.of(
                (doc, applicant, policy) -> checkNameMatch(doc, applicant),
                (doc, applicant, policy) -> checkDateOfBirthMatch(doc, applicant),
                (doc, applicant, policy) -> checkPassportNumberMatch(doc, applicant),
                (doc, applicant, policy) -> checkNationalityMatch(doc, applicant),
                this::checkAgeRequirements,
                (doc, applicant, policy) -> checkNationalityEligibility(doc, policy),
                (doc, applicant, policy) -> checkDocumentType(doc, policy),
                (doc, applicant, policy) -> checkValidityPeriod(doc, policy),
                this::checkVisaTypeRequirements
        );
    }

    /**
     * Runs every check in fixed order: name, date of birth, passport number, nationality,
     * age, nationality eligibility, document type, validity period, visa type.
     */
    public List<EligibilityCheck> checkEligibility(ExtractedDocument document,
                                                   ApplicantData applicant,
                                                   EligibilityPolicy policy) {
        List<EligibilityCheck> results = checks.stream()
                .map(check -> check.evaluate(document, applicant, policy))
                .toList();
        log.debug("Eligibility ({} visa): {}/{} checks failed", applicant.intendedVisaType(),
                results.stream().filter(r -> !r.passed()).count(), results.size());
        return results;
    }

    EligibilityCheck checkNameMatch(ExtractedDocument document, ApplicantData applicant) {
        String onDocument = document.fullName().toLowerCase(Locale.ROOT);
        String claimed = applicant.name().trim().toLowerCase(Locale.ROOT);
        return onDocument.equals(claimed)
                ? EligibilityCheck.pass(NAME_MATCH, "Applicant name matches document")
                : EligibilityCheck.fail(NAME_MATCH, "Name mismatch: Document shows \"%s\", applicant claims \"%s\""
                        .formatted(onDocument, claimed));
    }

    EligibilityCheck checkDateOfBirthMatch(ExtractedDocument document, ApplicantData applicant) {
        String onDocument = document.dateOfBirth().value();
        return onDocument.equals(applicant.dateOfBirth())
                ? EligibilityCheck.pass(DATE_OF_BIRTH_MATCH, "Date of birth matches")
                : EligibilityCheck.fail(DATE_OF_BIRTH_MATCH, "DOB mismatch: Document shows %s, applicant claims %s"
                        .formatted(onDocument, applicant.dateOfBirth()));
    }

    EligibilityCheck checkPassportNumberMatch(ExtractedDocument document, ApplicantData applicant) {
        String onDocument = document.documentNumber().value();
        return onDocument.equals(applicant.passportNumber())
                ? EligibilityCheck.pass(PASSPORT_NUMBER_MATCH, "Passport number matches")
                : EligibilityCheck.fail(PASSPORT_NUMBER_MATCH,
                        "Passport number mismatch: Document shows %s, applicant claims %s"
                                .formatted(onDocument, applicant.passportNumber()));
    }

    EligibilityCheck checkNationalityMatch(ExtractedDocument document, ApplicantData applicant) {
        String onDocument = document.nationality().value();
        return onDocument.equals(applicant.nationality())
                ? EligibilityCheck.pass(NATIONALITY_MATCH, "Nationality matches")
                : EligibilityCheck.fail(NATIONALITY_MATCH, "Nationality mismatch: Document shows %s, applicant claims %s"
                        .formatted(onDocument, applicant.nationality()));
    }

    EligibilityCheck checkAgeRequirements(ExtractedDocument document, ApplicantData applicant,
                                          EligibilityPolicy policy) {
        Optional<LocalDate> birth = IsoDates.parse(document.dateOfBirth().value());
        if (birth.isEmpty()) {
            return EligibilityCheck.fail(AGE_REQUIREMENTS, "Unable to verify age requirements");
        }
        int age = IsoDates.ageOn(birth.get(), today());

        VisaTypeRequirement requirement = policy.requirementFor(applicant.intendedVisaType());
        int minAge = requirement != null && requirement.minAge() != null ? requirement.minAge() : policy.minAge();
        int maxAge = policy.maxAge();

        boolean meets = age >= minAge && age <= maxAge;
        String range = "(%d-%d)".formatted(minAge, maxAge);
        return meets
                ? EligibilityCheck.pass(AGE_REQUIREMENTS, "Age %d meets requirements %s".formatted(age, range))
                : EligibilityCheck.fail(AGE_REQUIREMENTS, "Age %d does not meet requirements %s".formatted(age, range));
    }

    EligibilityCheck checkNationalityEligibility(ExtractedDocument document, EligibilityPolicy policy) {
        String nationality = document.nationality().value();
        if (policy.blockedNationalities().contains(nationality)) {
            return EligibilityCheck.fail(NATIONALITY_ELIGIBILITY,
                    "Nationality %s is not eligible for visa".formatted(nationality));
        }
        if (!policy.allowedNationalities().isEmpty() && !policy.allowedNationalities().contains(nationality)) {
            return EligibilityCheck.fail(NATIONALITY_ELIGIBILITY,
                    "Nationality %s is not in allowed list".formatted(nationality));
        }
        return EligibilityCheck.pass(NATIONALITY_ELIGIBILITY, "Nationality %s is eligible".formatted(nationality));
    }

    EligibilityCheck checkDocumentType(ExtractedDocument document, EligibilityPolicy policy) {
        String type = document.documentType().value();
        boolean accepted = policy.requiredDocumentTypes().isEmpty() || policy.requiredDocumentTypes().contains(type);
        return accepted
                ? EligibilityCheck.pass(DOCUMENT_TYPE, "Document type %s is accepted".formatted(type))
                : EligibilityCheck.fail(DOCUMENT_TYPE, "Document type %s is not accepted. Required: %s"
                        .formatted(type, String.join(", ", policy.requiredDocumentTypes())));
    }

    EligibilityCheck checkValidityPeriod(ExtractedDocument document, EligibilityPolicy policy) {
        Optional<LocalDate> expiry = IsoDates.parse(document.expiryDate().value());
        if (expiry.isEmpty()) {
            return EligibilityCheck.fail(VALIDITY_PERIOD, "Unable to verify validity period");
        }
        double monthsValid = ChronoUnit.DAYS.between(today(), expiry.get()) / DAYS_PER_MONTH;
        long wholeMonths = (long) Math.floor(monthsValid);
        int required = policy.minValidityMonths();

        return monthsValid >= required
                ? EligibilityCheck.pass(VALIDITY_PERIOD,
                        "Document valid for %d months (min: %d)".formatted(wholeMonths, required))
                : EligibilityCheck.fail(VALIDITY_PERIOD,
                        "Document only valid for %d months, requires %d".formatted(wholeMonths, required));
    }

    /** An empty allow list for the visa type means no nationality restriction for it. */
    EligibilityCheck checkVisaTypeRequirements(ExtractedDocument document, ApplicantData applicant,
                                               EligibilityPolicy policy) {
        String visaType = applicant.intendedVisaType();
        VisaTypeRequirement requirement = policy.requirementFor(visaType);
        if (requirement == null) {
            return EligibilityCheck.pass(VISA_TYPE_REQUIREMENTS,
                    "No specific requirements for visa type: " + visaType);
        }

        String nationality = document.nationality().value();
        List<String> allowed = requirement.allowedNationalities();
        if (!allowed.isEmpty() && !allowed.contains(nationality)) {
            return EligibilityCheck.fail(VISA_TYPE_REQUIREMENTS,
                    "Nationality %s not eligible for %s visa".formatted(nationality, visaType));
        }
        return EligibilityCheck.pass(VISA_TYPE_REQUIREMENTS,
                "Meets all requirements for %s visa".formatted(visaType));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    @FunctionalInterface
    private interface Check {
        EligibilityCheck evaluate(ExtractedDocument document, ApplicantData applicant, EligibilityPolicy policy);
    }
}
