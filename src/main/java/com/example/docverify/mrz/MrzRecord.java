package com.example.docverify.mrz;

import java.util.List;
import java.util.Optional;

/**
 * Decoded machine-readable zone.
 * <p>
 * A record with errors still carries its best-effort decoded values and is used as a
 * lower-confidence source. Only a record produced for an unsupported line count has no layout and
 * no decoded fields. Fields a layout does not encode (the personal number on TD1) are {@code null}.
 *
 * @param layout         layout the lines were decoded with, {@code null} for an unsupported line count
 * @param lines          the candidate lines as given to the codec
 * @param documentType   document type code, fillers stripped (e.g. "P", "I")
 * @param issuingCountry 3-letter issuing state
 * @param documentNumber document number, fillers stripped
 * @param surname        primary identifier, inner fillers turned into spaces
 * @param givenNames     secondary identifier, inner fillers turned into spaces
 * @param nationality    3-letter nationality
 * @param dateOfBirth    expanded to YYYY-MM-DD, empty if undecodable
 * @param sex            "M", "F" or empty when the filler was printed
 * @param expiryDate     expanded to YYYY-MM-DD, empty if undecodable
 * @param personalNumber optional personal number (TD3 only), fillers stripped
 * @param errors         structural and checksum errors, empty for a valid record
 */
public record MrzRecord(
        MrzLayout layout,
        List<String> lines,
        String documentType,
        String issuingCountry,
        String documentNumber,
        String surname,
        String givenNames,
        String nationality,
        String dateOfBirth,
        String sex,
        String expiryDate,
        String personalNumber,
        List<String> errors
) {

    public MrzRecord {
        lines = lines == null ? List.of() : List.copyOf(lines);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Record for a line count no layout supports: no decoded fields, a single error. */
    public static MrzRecord unsupported(List<String> lines, String error) {
        return new MrzRecord(null, lines, null, null, null, null, null, null, null, null, null, null,
                List.of(error));
    }

    /** True when a layout was recognised and every structural and checksum test passed. */
    public boolean valid() {
        return layout != null && errors.isEmpty();
    }

    public Optional<MrzLayout> layoutIfKnown() {
        return Optional.ofNullable(layout);
    }
}
