package com.example.docverify.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A single extracted value paired with a 0-100 confidence score.
 * <p>
 * The score reflects where the value came from (checksum-verified MRZ, MRZ with checksum errors,
 * free-text heuristics), not a calibrated probability. Only the relative ordering is meaningful.
 *
 * @param value      extracted value; the empty string means "unknown"
 * @param confidence provenance score in the range 0-100
 */
public record ConfidenceField(String value, int confidence) {

    public ConfidenceField {
        if (value == null) value = "";
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be between 0 and 100, got " + confidence);
        }
    }

    public static ConfidenceField of(String value, int confidence) {
        return new ConfidenceField(value, confidence);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return value.isEmpty();
    }
}
