package com.example.docverify.model;

/**
 * Verdict of one eligibility check against the applicant's claims and the policy.
 *
 * @param check   display name of the check
 * @param passed  whether the check passed
 * @param message human-readable explanation
 */
public record EligibilityCheck(String check, boolean passed, String message) {

    public static EligibilityCheck pass(String check, String message) {
        return new EligibilityCheck(check, true, message);
    }

    public static EligibilityCheck fail(String check, String message) {
        return new EligibilityCheck(check, false, message);
    }
}
