package com.example.docverify.extraction;

/**
 * Mandatory document fields with the confidence their free-text heuristic earns.
 * MRZ-sourced values score {@link #MRZ_VERIFIED} or {@link #MRZ_UNVERIFIED} regardless of field.
 */
public enum DocumentField {
    DOCUMENT_TYPE(80),
    DOCUMENT_NUMBER(75),
    SURNAME(75),
    GIVEN_NAMES(75),
    NATIONALITY(80),
    DATE_OF_BIRTH(70),
    SEX(85),
    ISSUING_COUNTRY(80),
    ISSUE_DATE(70),
    EXPIRY_DATE(70),
    PLACE_OF_BIRTH(70);

    public static final int MRZ_VERIFIED = 95;
    public static final int MRZ_UNVERIFIED = 60;

    private final int heuristicConfidence;

    DocumentField(int heuristicConfidence) {
        this.heuristicConfidence = heuristicConfidence;
    }

    public int heuristicConfidence() {
        return heuristicConfidence;
    }

    /** Confidence of a value decoded from an MRZ, by whether all its check digits passed. */
    public static int mrzConfidence(boolean checksumsValid) {
        return checksumsValid ? MRZ_VERIFIED : MRZ_UNVERIFIED;
    }
}
