package com.example.docverify.model;

/**
 * Body of a verification request.
 *
 * @param imageData         base64 document image, optionally with a data URL prefix
 * @param applicantData     identity claimed by the applicant
 * @param eligibilityPolicy policy override; the configured default policy is used when null
 */
public record VerificationRequest(
        String imageData,
        ApplicantData applicantData,
        EligibilityPolicy eligibilityPolicy
) {}
