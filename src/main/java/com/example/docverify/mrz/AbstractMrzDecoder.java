package com.example.docverify.mrz;

import java.util.List;

/**
 * Slicing and check digit helpers shared by the layout decoders.
 * Slices are clamped to the line so a short line yields partial values instead of an exception.
 */
abstract class AbstractMrzDecoder implements MrzDecoder {

    /** Stand-in for a check digit position beyond the end of a short line. */
    private static final char MISSING = '?';

    private static final String NAME_SEPARATOR = "<<";

    protected void checkLineLengths(List<String> lines, List<String> errors) {
        int expected = layout().lineLength();
        for (int i = 0; i < lines.size(); i++) {
            int actual = lines.get(i).length();
            if (actual != expected) {
                errors.add("Line %d length invalid: %d, expected %d".formatted(i + 1, actual, expected));
            }
        }
    }

    protected static String slice(String line, int from, int to) {
        int end = Math.min(to, line.length());
        return from >= end ? "" : line.substring(from, end);
    }

    protected static char charAt(String line, int index) {
        return index < line.length() ? line.charAt(index) : MISSING;
    }

    /** Field value with every filler removed. */
    protected static String stripFiller(String raw) {
        return raw.replace(String.valueOf(CheckDigit.FILLER), "").trim();
    }

    /** Name component with inner fillers turned into spaces. */
    protected static String nameComponent(String raw) {
        return raw.replace(CheckDigit.FILLER, ' ').trim();
    }

    /** Splits a name field on the first double filler: [surname, given names]. */
    protected static String[] splitName(String nameField) {
        int separator = nameField.indexOf(NAME_SEPARATOR);
        if (separator < 0) {
            return new String[]{nameComponent(nameField), ""};
        }
        return new String[]{
                nameComponent(nameField.substring(0, separator)),
                nameComponent(nameField.substring(separator + NAME_SEPARATOR.length()))
        };
    }

    protected static void verifyCheckDigit(String label, String data, char provided, List<String> errors) {
        if (!CheckDigit.matches(data, provided)) {
            errors.add("%s check digit failed: expected %d, got %s"
                    .formatted(label, CheckDigit.compute(data), provided));
        }
    }
}
