package com.example.docverify.validation;

import com.example.docverify.model.ExtractedDocument;
import com.example.docverify.model.ValidationCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Self-contained validity checks over one extracted document.
 * <p>
 * Each check reads only the document and the clock; none throws for bad data. An unparseable or
 * empty value makes the check fail with an explanatory message.
 */
@Service
public class DocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(DocumentValidator.class);

    static final String DOCUMENT_EXPIRY = "Document Expiry";
    static final String DATE_FORMAT = "Date Format Validation";
    static final String AGE_CONSISTENCY = "Age Consistency";
    static final String NAME_FORMAT = "Name Format";
    static final String DOCUMENT_NUMBER_FORMAT = "Document Number Format";
    static final String NATIONALITY_FORMAT = "Nationality Code Format";
    static final String DATE_LOGIC = "Date Logic";

    private static final int MAX_PLAUSIBLE_AGE = 150;
    private static final Pattern NAME = Pattern.compile("[A-Za-z\\s\\-']+");
    private static final Pattern DOCUMENT_NUMBER = Pattern.compile("[A-Z0-9]{6,12}");
    private static final Pattern NATIONALITY = Pattern.compile("[A-Z]{3}");

    private final Clock clock;
    private final List<Function<ExtractedDocument, ValidationCheck>> checks;

    public DocumentValidator(Clock clock) {
        this.clock = clock;
        this.checks = List.of(
                this::checkDocumentExpiry,
                this::checkDateFormats,
                this::checkAgeConsistency,
                this::checkNameFormat,
                this::checkDocumentNumberFormat,
                this::checkNationalityFormat,
                this::checkDateLogic
        );
    }

    /**
     * Runs every check in fixed order: expiry, date format, age, name, document number,
     * nationality, date logic.
     */
    public List<ValidationCheck> validateDocument(ExtractedDocument document) {
        List<ValidationCheck> results = checks.stream()
                .map(check -> check.apply(document))
                .toList();
        log.debug("Document validation: {}/{} checks failed",
                results.stream().filter(r -> !r.passed()).count(), results.size());
        return results;
    }

    ValidationCheck checkDocumentExpiry(ExtractedDocument document) {
        String expiry = document.expiryDate().value();
        Optional<LocalDate> expiryDate = IsoDates.parse(expiry);
        if (expiryDate.isEmpty()) {
            return ValidationCheck.fail(DOCUMENT_EXPIRY, "Invalid expiry date format");
        }
        if (expiryDate.get().isBefore(today())) {
            return ValidationCheck.fail(DOCUMENT_EXPIRY, "Document expired on " + expiry);
        }
        return ValidationCheck.pass(DOCUMENT_EXPIRY, "Document valid until " + expiry);
    }

    ValidationCheck checkDateFormats(ExtractedDocument document) {
        Map<String, String> dates = new LinkedHashMap<>();
        dates.put("Date of Birth", document.dateOfBirth().value());
        dates.put("Issue Date", document.issueDate().value());
        dates.put("Expiry Date", document.expiryDate().value());

        List<String> invalid = dates.entrySet().stream()
                .filter(e -> !IsoDates.isIsoFormat(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();

        return invalid.isEmpty()
                ? ValidationCheck.pass(DATE_FORMAT, "All dates in valid ISO 8601 format")
                : ValidationCheck.fail(DATE_FORMAT, "Invalid date formats: " + String.join(", ", invalid));
    }

    ValidationCheck checkAgeConsistency(ExtractedDocument document) {
        Optional<LocalDate> birth = IsoDates.parse(document.dateOfBirth().value());
        if (birth.isEmpty()) {
            return ValidationCheck.fail(AGE_CONSISTENCY, "Unable to calculate age from date of birth");
        }
        int age = IsoDates.ageOn(birth.get(), today());
        if (age < 0 || age > MAX_PLAUSIBLE_AGE) {
            return ValidationCheck.fail(AGE_CONSISTENCY, "Calculated age (%d) is invalid".formatted(age));
        }
        return ValidationCheck.pass(AGE_CONSISTENCY, "Holder age: %d years".formatted(age));
    }

    ValidationCheck checkNameFormat(ExtractedDocument document) {
        String surname = document.surname().value();
        String givenNames = document.givenNames().value();
        boolean valid = !surname.isEmpty()
                && NAME.matcher(surname).matches()
                && (givenNames.isEmpty() || NAME.matcher(givenNames).matches());
        return valid
                ? ValidationCheck.pass(NAME_FORMAT, "Name format valid")
                : ValidationCheck.fail(NAME_FORMAT, "Invalid name format or missing required fields");
    }

    ValidationCheck checkDocumentNumberFormat(ExtractedDocument document) {
        return DOCUMENT_NUMBER.matcher(document.documentNumber().value()).matches()
                ? ValidationCheck.pass(DOCUMENT_NUMBER_FORMAT, "Document number format valid")
                : ValidationCheck.fail(DOCUMENT_NUMBER_FORMAT,
                        "Document number format invalid (should be 6-12 alphanumeric characters)");
    }

    ValidationCheck checkNationalityFormat(ExtractedDocument document) {
        String nationality = document.nationality().value();
        return NATIONALITY.matcher(nationality).matches()
                ? ValidationCheck.pass(NATIONALITY_FORMAT, "Valid nationality code: " + nationality)
                : ValidationCheck.fail(NATIONALITY_FORMAT, "Invalid nationality code (should be 3-letter ISO code)");
    }

    ValidationCheck checkDateLogic(ExtractedDocument document) {
        Optional<LocalDate> birth = IsoDates.parse(document.dateOfBirth().value());
        Optional<LocalDate> issue = IsoDates.parse(document.issueDate().value());
        Optional<LocalDate> expiry = IsoDates.parse(document.expiryDate().value());

        List<String> unparseable = new ArrayList<>();
        if (birth.isEmpty()) unparseable.add("date of birth");
        if (issue.isEmpty()) unparseable.add("issue date");
        if (expiry.isEmpty()) unparseable.add("expiry date");
        if (!unparseable.isEmpty()) {
            return ValidationCheck.fail(DATE_LOGIC,
                    "Unable to validate date logic: unreadable " + String.join(", ", unparseable));
        }

        boolean birthBeforeIssue = birth.get().isBefore(issue.get());
        boolean issueBeforeExpiry = issue.get().isBefore(expiry.get());
        boolean birthNotInFuture = !birth.get().isAfter(today());

        return birthBeforeIssue && issueBeforeExpiry && birthNotInFuture
                ? ValidationCheck.pass(DATE_LOGIC, "All dates are logically consistent")
                : ValidationCheck.fail(DATE_LOGIC, "Date sequence error: dates are not in logical order");
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
