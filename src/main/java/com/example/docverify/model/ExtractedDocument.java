package com.example.docverify.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Fields extracted from one travel document.
 * <p>
 * The ten mandatory fields are never null; an unknown value is an empty {@link ConfidenceField#value()}.
 * {@code placeOfBirth} and the MRZ line echoes are optional and serialized only when present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedDocument(
        ConfidenceField documentType,
        ConfidenceField documentNumber,
        ConfidenceField surname,
        ConfidenceField givenNames,
        ConfidenceField nationality,
        ConfidenceField dateOfBirth,
        ConfidenceField sex,
        ConfidenceField placeOfBirth,
        ConfidenceField issuingCountry,
        ConfidenceField issueDate,
        ConfidenceField expiryDate,
        ConfidenceField mrzLine1,
        ConfidenceField mrzLine2,
        ConfidenceField mrzLine3
) {

    private static final ConfidenceField UNKNOWN = ConfidenceField.of("", 0);

    public ExtractedDocument {
        if (documentType == null) documentType = UNKNOWN;
        if (documentNumber == null) documentNumber = UNKNOWN;
        if (surname == null) surname = UNKNOWN;
        if (givenNames == null) givenNames = UNKNOWN;
        if (nationality == null) nationality = UNKNOWN;
        if (dateOfBirth == null) dateOfBirth = UNKNOWN;
        if (sex == null) sex = UNKNOWN;
        if (issuingCountry == null) issuingCountry = UNKNOWN;
        if (issueDate == null) issueDate = UNKNOWN;
        if (expiryDate == null) expiryDate = UNKNOWN;
    }

    /** Holder name as printed in "given names surname" order, trimmed. */
    public String fullName() {
        return (givenNames.value() + " " + surname.value()).trim();
    }

    /** Every present field, mandatory first, then place of birth and MRZ echoes when set. */
    public List<ConfidenceField> presentFields() {
        List<ConfidenceField> fields = new ArrayList<>(List.of(
                documentType, documentNumber, surname, givenNames, nationality,
                dateOfBirth, sex, issuingCountry, issueDate, expiryDate));
        Stream.of(placeOfBirth, mrzLine1, mrzLine2, mrzLine3)
                .filter(f -> f != null)
                .forEach(fields::add);
        return fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .documentType(documentType)
                .documentNumber(documentNumber)
                .surname(surname)
                .givenNames(givenNames)
                .nationality(nationality)
                .dateOfBirth(dateOfBirth)
                .sex(sex)
                .placeOfBirth(placeOfBirth)
                .issuingCountry(issuingCountry)
                .issueDate(issueDate)
                .expiryDate(expiryDate)
                .mrzLine1(mrzLine1)
                .mrzLine2(mrzLine2)
                .mrzLine3(mrzLine3);
    }

    public static final class Builder {
        private ConfidenceField documentType;
        private ConfidenceField documentNumber;
        private ConfidenceField surname;
        private ConfidenceField givenNames;
        private ConfidenceField nationality;
        private ConfidenceField dateOfBirth;
        private ConfidenceField sex;
        private ConfidenceField placeOfBirth;
        private ConfidenceField issuingCountry;
        private ConfidenceField issueDate;
        private ConfidenceField expiryDate;
        private ConfidenceField mrzLine1;
        private ConfidenceField mrzLine2;
        private ConfidenceField mrzLine3;

        private Builder() {
        }

        public Builder documentType(ConfidenceField value) { this.documentType = value; return this; }
        public Builder documentNumber(ConfidenceField value) { this.documentNumber = value; return this; }
        public Builder surname(ConfidenceField value) { this.surname = value; return this; }
        public Builder givenNames(ConfidenceField value) { this.givenNames = value; return this; }
        public Builder nationality(ConfidenceField value) { this.nationality = value; return this; }
        public Builder dateOfBirth(ConfidenceField value) { this.dateOfBirth = value; return this; }
        public Builder sex(ConfidenceField value) { this.sex = value; return this; }
        public Builder placeOfBirth(ConfidenceField value) { this.placeOfBirth = value; return this; }
        public Builder issuingCountry(ConfidenceField value) { this.issuingCountry = value; return this; }
        public Builder issueDate(ConfidenceField value) { this.issueDate = value; return this; }
        public Builder expiryDate(ConfidenceField value) { this.expiryDate = value; return this; }
        public Builder mrzLine1(ConfidenceField value) { this.mrzLine1 = value; return this; }
        public Builder mrzLine2(ConfidenceField value) { this.mrzLine2 = value; return this; }
        public Builder mrzLine3(ConfidenceField value) { this.mrzLine3 = value; return this; }

        public ExtractedDocument build() {
            return new ExtractedDocument(documentType, documentNumber, surname, givenNames, nationality,
                    dateOfBirth, sex, placeOfBirth, issuingCountry, issueDate, expiryDate,
                    mrzLine1, mrzLine2, mrzLine3);
        }
    }
}
