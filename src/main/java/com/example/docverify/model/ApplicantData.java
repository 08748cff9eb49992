package com.example.docverify.model;

/**
 * Identity data claimed by the applicant, compared against the document.
 *
 * @param name             full name as "given names surname"
 * @param dateOfBirth      ISO date (YYYY-MM-DD)
 * @param passportNumber   document number
 * @param nationality      3-letter nationality code
 * @param intendedVisaType visa type key, looked up in the policy's visa type requirements
 */
public record ApplicantData(
        String name,
        String dateOfBirth,
        String passportNumber,
        String nationality,
        String intendedVisaType
) {
    public static final String DEFAULT_VISA_TYPE = "tourist";

    /** Missing claims become empty strings; the visa type defaults to tourist. */
    public ApplicantData {
        if (name == null) name = "";
        if (dateOfBirth == null) dateOfBirth = "";
        if (passportNumber == null) passportNumber = "";
        if (nationality == null) nationality = "";
        if (intendedVisaType == null || intendedVisaType.isBlank()) intendedVisaType = DEFAULT_VISA_TYPE;
    }
}
