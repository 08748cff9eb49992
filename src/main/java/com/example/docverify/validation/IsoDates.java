package com.example.docverify.validation;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict {@code YYYY-MM-DD} parsing without exceptions, and the holder-age rule shared by the
 * validity and eligibility checks.
 */
public final class IsoDates {

    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");

    private IsoDates() {
    }

    /** Whether the value has the exact {@code YYYY-MM-DD} shape (calendar validity not checked). */
    public static boolean isIsoFormat(String value) {
        return value != null && ISO_DATE.matcher(value).matches();
    }

    /**
     * Parses a {@code YYYY-MM-DD} date. Empty when the shape is wrong or the date does not exist
     * (month 13, 30 February).
     */
    public static Optional<LocalDate> parse(String value) {
        if (value == null) return Optional.empty();
        Matcher matcher = ISO_DATE.matcher(value);
        if (!matcher.matches()) return Optional.empty();

        int year = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        int day = Integer.parseInt(matcher.group(3));
        if (month < 1 || month > 12) return Optional.empty();
        if (day < 1 || day > YearMonth.of(year, month).lengthOfMonth()) return Optional.empty();
        return Optional.of(LocalDate.of(year, month, day));
    }

    /**
     * Completed years between birth and {@code today}: the year difference, minus one when today's
     * month and day precede the birthday. Negative when the birth date lies in the future.
     */
    public static int ageOn(LocalDate dateOfBirth, LocalDate today) {
        int age = today.getYear() - dateOfBirth.getYear();
        if (MonthDay.from(today).isBefore(MonthDay.from(dateOfBirth))) {
            age--;
        }
        return age;
    }
}
