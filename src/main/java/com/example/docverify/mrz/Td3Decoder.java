package com.example.docverify.mrz;

import java.util.ArrayList;
import java.util.List;

/**
 * TD3 (passport) layout, 2 lines of 44 characters.
 * <pre>
 * line 1: type[0,2) issuer[2,5) name[5,44)
 * line 2: number[0,9) cd[9] nationality[10,13) birth[13,19) cd[19] sex[20]
 *         expiry[21,27) cd[27] personal[28,42) cd[42] composite cd[43]
 * </pre>
 */
final class Td3Decoder extends AbstractMrzDecoder {

    @Override
    public MrzLayout layout() {
        return MrzLayout.TD3;
    }

    @Override
    public MrzRecord decode(List<String> lines) {
        String line1 = lines.get(0);
        String line2 = lines.get(1);
        List<String> errors = new ArrayList<>();
        checkLineLengths(lines, errors);

        String documentType = stripFiller(slice(line1, 0, 2));
        String issuingCountry = stripFiller(slice(line1, 2, 5));
        String[] name = splitName(slice(line1, 5, 44));

        String rawNumber = slice(line2, 0, 9);
        verifyCheckDigit("Document number", rawNumber, charAt(line2, 9), errors);

        String nationality = stripFiller(slice(line2, 10, 13));

        String rawBirth = slice(line2, 13, 19);
        verifyCheckDigit("Date of birth", rawBirth, charAt(line2, 19), errors);

        String sex = stripFiller(slice(line2, 20, 21));

        String rawExpiry = slice(line2, 21, 27);
        verifyCheckDigit("Expiry date", rawExpiry, charAt(line2, 27), errors);

        // the personal number is optional: an all-filler field carries no check digit
        String rawPersonal = slice(line2, 28, 42);
        String personalNumber = stripFiller(rawPersonal);
        if (!personalNumber.isEmpty()) {
            verifyCheckDigit("Personal number", rawPersonal, charAt(line2, 42), errors);
        }

        String composite = slice(line2, 0, 10) + slice(line2, 13, 20) + slice(line2, 21, 43);
        verifyCheckDigit("Composite", composite, charAt(line2, 43), errors);

        return new MrzRecord(
                MrzLayout.TD3,
                lines,
                documentType,
                issuingCountry,
                stripFiller(rawNumber),
                name[0],
                name[1],
                nationality,
                MrzDates.expand(rawBirth),
                sex,
                MrzDates.expand(rawExpiry),
                personalNumber,
                errors
        );
    }
}
