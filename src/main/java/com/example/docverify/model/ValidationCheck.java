package com.example.docverify.model;

/**
 * Verdict of one document validity check.
 *
 * @param check   display name of the check
 * @param passed  whether the check passed
 * @param message human-readable explanation
 */
public record ValidationCheck(String check, boolean passed, String message) {

    public static ValidationCheck pass(String check, String message) {
        return new ValidationCheck(check, true, message);
    }

    public static ValidationCheck fail(String check, String message) {
        return new ValidationCheck(check, false, message);
    }
}
