package com.example.docverify;

import com.example.docverify.model.ApplicantData;
import com.example.docverify.model.ConfidenceField;
import com.example.docverify.model.EligibilityPolicy;
import com.example.docverify.model.EligibilityPolicy.VisaTypeRequirement;
import com.example.docverify.model.ExtractedDocument;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared test data: a fixed clock, ICAO specimen MRZ lines and a document that passes every check.
 */
public final class TestFixtures {

    public static final LocalDate TODAY = LocalDate.of(2025, 6, 15);
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);

    /** ICAO 9303 specimen passport, line 1. */
    public static final String TD3_LINE1 = "P<UTOERIKSSON<<ANNA<MARIA<<<<<<<<<<<<<<<<<<<";
    /** ICAO 9303 specimen passport, line 2 (expired 2012-04-15). */
    public static final String TD3_LINE2 = "L898902C36UTO7408122F1204159ZE184226B<<<<<10";
    /** Specimen line 2 re-issued with expiry 2030-04-15, check digits recomputed. */
    public static final String TD3_LINE2_VALID_UNTIL_2030 = "L898902C36UTO7408122F3004157ZE184226B<<<<<16";

    /** ICAO 9303 specimen identity card. */
    public static final String TD1_LINE1 = "I<UTOD231458907<<<<<<<<<<<<<<<";
    public static final String TD1_LINE2 = "7408122F1204159UTO<<<<<<<<<<<6";
    public static final String TD1_LINE3 = "ERIKSSON<<ANNA<MARIA<<<<<<<<<<";

    private TestFixtures() {
    }

    /** Document for ANNA MARIA ERIKSSON that passes every validity check on {@link #TODAY}. */
    public static ExtractedDocument validDocument() {
        return ExtractedDocument.builder()
                .documentType(field("P"))
                .documentNumber(field("L898902C3"))
                .surname(field("ERIKSSON"))
                .givenNames(field("ANNA MARIA"))
                .nationality(field("UTO"))
                .dateOfBirth(field("1974-08-12"))
                .sex(field("F"))
                .issuingCountry(field("UTO"))
                .issueDate(ConfidenceField.of("2020-04-16", 70))
                .expiryDate(field("2030-04-15"))
                .build();
    }

    public static ApplicantData matchingApplicant(String visaType) {
        return new ApplicantData("Anna Maria Eriksson", "1974-08-12", "L898902C3", "UTO", visaType);
    }

    /** Same rules as the shipped default policy. */
    public static EligibilityPolicy defaultPolicy() {
        Map<String, VisaTypeRequirement> visaTypes = new LinkedHashMap<>();
        visaTypes.put("tourist", new VisaTypeRequirement(18, List.of(),
                List.of("Valid passport", "Proof of accommodation")));
        visaTypes.put("business", new VisaTypeRequirement(21, List.of(),
                List.of("Valid passport", "Business invitation letter")));
        visaTypes.put("student", new VisaTypeRequirement(16, List.of(),
                List.of("Valid passport", "Letter of acceptance from institution")));
        visaTypes.put("work", new VisaTypeRequirement(18, List.of(),
                List.of("Valid passport", "Job offer letter", "Work permit")));
        return new EligibilityPolicy(18, 120, Set.of(), Set.of("PRK"),
                new LinkedHashSet<>(List.of("P", "I")), 6, visaTypes);
    }

    public static ConfidenceField field(String value) {
        return ConfidenceField.of(value, 95);
    }
}
