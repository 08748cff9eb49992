package com.example.docverify.mrz;

import java.util.Arrays;
import java.util.Optional;

/**
 * ICAO 9303 machine-readable zone layouts supported by the codec.
 * The layout is chosen from the number of candidate lines only; no format marker is trusted.
 */
public enum MrzLayout {

    /** Passport booklet: 2 lines of 44 characters. */
    TD3(2, 44),

    /** Identity card: 3 lines of 30 characters. */
    TD1(3, 30);

    private final int lineCount;
    private final int lineLength;

    MrzLayout(int lineCount, int lineLength) {
        this.lineCount = lineCount;
        this.lineLength = lineLength;
    }

    public int lineCount() {
        return lineCount;
    }

    public int lineLength() {
        return lineLength;
    }

    public static Optional<MrzLayout> forLineCount(int count) {
        return Arrays.stream(values())
                .filter(layout -> layout.lineCount == count)
                .findFirst();
    }

    public static boolean isLineLength(int length) {
        return Arrays.stream(values()).anyMatch(layout -> layout.lineLength == length);
    }
}
