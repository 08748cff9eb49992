package com.example.docverify.mrz;

import java.util.List;

/**
 * ICAO 9303 check digit: characters are valued 0-9 for digits, 10-35 for A-Z and 0 for the
 * filler, weighted 7-3-1 by position and summed modulo 10.
 */
public final class CheckDigit {

    public static final char FILLER = '<';

    private static final List<Integer> WEIGHTS = List.of(7, 3, 1);

    private CheckDigit() {
    }

    public static int compute(String data) {
        int sum = 0;
        for (int i = 0; i < data.length(); i++) {
            sum += valueOf(data.charAt(i)) * WEIGHTS.get(i % WEIGHTS.size());
        }
        return sum % 10;
    }

    /** Character value; anything outside {@code [0-9A-Z]} (including the filler) counts as 0. */
    static int valueOf(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'A' && c <= 'Z') return c - 'A' + 10;
        return 0;
    }

    /**
     * Whether {@code provided} matches the digit computed over {@code data}.
     * A filler in the check position means "not provided" and always matches.
     */
    public static boolean matches(String data, char provided) {
        if (provided == FILLER) return true;
        return provided >= '0' && provided <= '9' && provided - '0' == compute(data);
    }
}
