package com.example.docverify.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Visa issuance rules applied by the eligibility checks. Read-only for the checks.
 *
 * @param minAge                minimum holder age, unless the visa type overrides it
 * @param maxAge                maximum holder age
 * @param allowedNationalities  allow list of 3-letter codes; empty means no restriction
 * @param blockedNationalities  nationalities that are never eligible
 * @param requiredDocumentTypes accepted document type codes; empty means any type
 * @param minValidityMonths     minimum remaining validity, in 30-day months
 * @param visaTypeRequirements  per visa type overrides, keyed by visa type
 */
public record EligibilityPolicy(
        int minAge,
        int maxAge,
        Set<String> allowedNationalities,
        Set<String> blockedNationalities,
        Set<String> requiredDocumentTypes,
        int minValidityMonths,
        Map<String, VisaTypeRequirement> visaTypeRequirements
) {

    /** Null collections (absent in a caller-supplied policy) become empty; iteration order is kept. */
    public EligibilityPolicy {
        allowedNationalities = orderedCopy(allowedNationalities);
        blockedNationalities = orderedCopy(blockedNationalities);
        requiredDocumentTypes = orderedCopy(requiredDocumentTypes);
        visaTypeRequirements = visaTypeRequirements == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(visaTypeRequirements));
    }

    /**
     * Requirements configured for a visa type, or {@code null} if the type has none.
     */
    public VisaTypeRequirement requirementFor(String visaType) {
        return visaType == null ? null : visaTypeRequirements.get(visaType);
    }

    private static Set<String> orderedCopy(Collection<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    /**
     * Overrides for a single visa type.
     *
     * @param minAge                 minimum age for this visa type, {@code null} to use the policy minimum
     * @param allowedNationalities   allow list for this visa type; empty means no restriction
     * @param additionalRequirements supporting documents the applicant has to provide
     */
    public record VisaTypeRequirement(
            Integer minAge,
            List<String> allowedNationalities,
            List<String> additionalRequirements
    ) {
        public VisaTypeRequirement {
            allowedNationalities = allowedNationalities == null ? List.of() : List.copyOf(allowedNationalities);
            additionalRequirements = additionalRequirements == null ? List.of() : List.copyOf(additionalRequirements);
        }
    }
}
