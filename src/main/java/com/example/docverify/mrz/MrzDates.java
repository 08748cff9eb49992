package com.example.docverify.mrz;

/**
 * Expansion of 6-character MRZ dates and two-digit years. Calendar validity is not checked here.
 */
public final class MrzDates {

    /** Two-digit years above this pivot belong to the 1900s, the rest to the 2000s. */
    public static final int CENTURY_PIVOT = 50;

    private MrzDates() {
    }

    /**
     * Expands {@code YYMMDD} to {@code YYYY-MM-DD}; returns an empty string when the field is not
     * 6 characters long or its year is not numeric.
     */
    public static String expand(String yymmdd) {
        if (yymmdd == null || yymmdd.length() != 6) return "";
        char y1 = yymmdd.charAt(0);
        char y2 = yymmdd.charAt(1);
        if (!Character.isDigit(y1) || !Character.isDigit(y2)) return "";
        int year = (y1 - '0') * 10 + (y2 - '0');
        return "%d-%s-%s".formatted(expandYear(year), yymmdd.substring(2, 4), yymmdd.substring(4, 6));
    }

    public static int expandYear(int twoDigitYear) {
        return twoDigitYear > CENTURY_PIVOT ? 1900 + twoDigitYear : 2000 + twoDigitYear;
    }
}
