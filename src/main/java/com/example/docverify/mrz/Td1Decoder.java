package com.example.docverify.mrz;

import java.util.ArrayList;
import java.util.List;

/**
 * TD1 (identity card) layout, 3 lines of 30 characters.
 * <pre>
 * line 1: type[0,2) issuer[2,5) number[5,14) cd[14]
 * line 2: birth[0,6) cd[6] sex[7] expiry[8,14) cd[14] nationality[15,18)
 * line 3: name[0,30)
 * </pre>
 */
final class Td1Decoder extends AbstractMrzDecoder {

    @Override
    public MrzLayout layout() {
        return MrzLayout.TD1;
    }

    @Override
    public MrzRecord decode(List<String> lines) {
        String line1 = lines.get(0);
        String line2 = lines.get(1);
        String line3 = lines.get(2);
        List<String> errors = new ArrayList<>();
        checkLineLengths(lines, errors);

        String documentType = stripFiller(slice(line1, 0, 2));
        String issuingCountry = stripFiller(slice(line1, 2, 5));

        String rawNumber = slice(line1, 5, 14);
        verifyCheckDigit("Document number", rawNumber, charAt(line1, 14), errors);

        String rawBirth = slice(line2, 0, 6);
        verifyCheckDigit("Date of birth", rawBirth, charAt(line2, 6), errors);

        String sex = stripFiller(slice(line2, 7, 8));

        String rawExpiry = slice(line2, 8, 14);
        verifyCheckDigit("Expiry date", rawExpiry, charAt(line2, 14), errors);

        String nationality = stripFiller(slice(line2, 15, 18));
        String[] name = splitName(slice(line3, 0, 30));

        return new MrzRecord(
                MrzLayout.TD1,
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
                null,
                errors
        );
    }
}
