package com.example.docverify.extraction;

/**
 * What the extractor reports for a date it cannot find anywhere in the text.
 */
public enum MissingDatePolicy {

    /** Report the current date with the field's heuristic confidence. */
    TODAY,

    /** Report an empty value with confidence 0, which the checks treat as unverifiable. */
    UNKNOWN
}
