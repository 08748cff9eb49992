package com.example.docverify.mrz;

import java.util.List;

/**
 * Decodes the candidate lines of one MRZ layout into a {@link MrzRecord}.
 */
interface MrzDecoder {

    MrzLayout layout();

    /**
     * Slices fixed-offset fields and verifies check digits. Never throws on malformed lines:
     * wrong lengths and checksum mismatches are reported in the record's errors.
     *
     * @param lines exactly {@link MrzLayout#lineCount()} lines
     */
    MrzRecord decode(List<String> lines);
}
