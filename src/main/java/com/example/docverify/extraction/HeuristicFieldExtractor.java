package com.example.docverify.extraction;

import com.example.docverify.config.VerificationProperties;
import com.example.docverify.model.ConfidenceField;
import com.example.docverify.model.ExtractedDocument;
import com.example.docverify.mrz.MrzDates;
import com.example.docverify.mrz.MrzRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link ExtractedDocument} for one OCR text.
 * <p>
 * Every mandatory field is taken from the MRZ record when it decoded a non-empty value there,
 * and otherwise from a free-text heuristic (keyword scan, pattern match, date normalisation).
 * Confidence depends only on where the value came from, see {@link DocumentField}.
 */
@Service
public class HeuristicFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(HeuristicFieldExtractor.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern DOCUMENT_NUMBER = Pattern.compile("[A-Z]{1,2}\\d{7,9}");
    private static final Pattern COUNTRY_CODE = Pattern.compile("\\b([A-Z]{3})\\b");
    private static final Pattern DAY_MONTH_YEAR =
            Pattern.compile("(?<!\\d)(\\d{1,2})[/.\\-](\\d{1,2})[/.\\-](\\d{2,4})(?!\\d)");
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern SINGLE_M = Pattern.compile("\\bM\\b");
    private static final Pattern SINGLE_F = Pattern.compile("\\bF\\b");

    private static final List<String> SURNAME_LABELS = List.of("surname", "last name", "family name");
    private static final List<String> GIVEN_NAME_LABELS = List.of("given name", "first name");
    private static final List<String> PLACE_OF_BIRTH_LABELS = List.of("place of birth");
    private static final List<String> BIRTH_KEYWORDS = List.of("birth", "born", "dob");
    private static final List<String> ISSUE_KEYWORDS = List.of("issue", "issued", "date of issue");
    private static final List<String> EXPIRY_KEYWORDS = List.of("expiry", "expires", "valid until", "exp");

    private final MissingDatePolicy missingDatePolicy;
    private final Clock clock;

    public HeuristicFieldExtractor(VerificationProperties properties, Clock clock) {
        this.missingDatePolicy = properties.extraction().missingDate();
        this.clock = clock;
    }

    /**
     * Extracts the document fields.
     *
     * @param rawText OCR output
     * @param mrz     decoded MRZ, may be {@code null} or invalid; an invalid record still supplies
     *                values at reduced confidence
     */
    public ExtractedDocument extractFields(String rawText, MrzRecord mrz) {
        String text = rawText == null ? "" : rawText;
        List<String> lines = LINE_BREAK.splitAsStream(text).toList();
        int mrzConfidence = DocumentField.mrzConfidence(mrz != null && mrz.valid());
        FieldSource source = new FieldSource(mrzConfidence);

        ExtractedDocument.Builder builder = ExtractedDocument.builder()
                .documentType(source.pick(mrz == null ? null : mrz.documentType(),
                        DocumentField.DOCUMENT_TYPE, () -> documentType(text)))
                .documentNumber(source.pick(mrz == null ? null : mrz.documentNumber(),
                        DocumentField.DOCUMENT_NUMBER, () -> firstMatch(DOCUMENT_NUMBER, text)))
                .surname(source.pick(mrz == null ? null : mrz.surname(),
                        DocumentField.SURNAME, () -> labelledValue(lines, SURNAME_LABELS).orElse("")))
                .givenNames(source.pick(mrz == null ? null : mrz.givenNames(),
                        DocumentField.GIVEN_NAMES, () -> labelledValue(lines, GIVEN_NAME_LABELS).orElse("")))
                .nationality(source.pick(mrz == null ? null : mrz.nationality(),
                        DocumentField.NATIONALITY, () -> firstMatch(COUNTRY_CODE, text)))
                .dateOfBirth(source.pickOrMissing(mrz == null ? null : mrz.dateOfBirth(),
                        DocumentField.DATE_OF_BIRTH, () -> date(lines, text, BIRTH_KEYWORDS)))
                .sex(source.pick(mrz == null ? null : mrz.sex(),
                        DocumentField.SEX, () -> sex(text)))
                .issuingCountry(source.pick(mrz == null ? null : mrz.issuingCountry(),
                        DocumentField.ISSUING_COUNTRY, () -> firstMatch(COUNTRY_CODE, text)))
                .issueDate(source.pickOrMissing(null,
                        DocumentField.ISSUE_DATE, () -> date(lines, text, ISSUE_KEYWORDS)))
                .expiryDate(source.pickOrMissing(mrz == null ? null : mrz.expiryDate(),
                        DocumentField.EXPIRY_DATE, () -> date(lines, text, EXPIRY_KEYWORDS)));

        labelledValue(lines, PLACE_OF_BIRTH_LABELS)
                .filter(value -> !value.isEmpty())
                .ifPresent(value -> builder.placeOfBirth(
                        ConfidenceField.of(value, DocumentField.PLACE_OF_BIRTH.heuristicConfidence())));

        if (mrz != null && !mrz.lines().isEmpty()) {
            List<String> mrzLines = mrz.lines();
            builder.mrzLine1(ConfidenceField.of(mrzLines.get(0), mrzConfidence));
            builder.mrzLine2(ConfidenceField.of(mrzLines.size() > 1 ? mrzLines.get(1) : "", mrzConfidence));
            if (mrzLines.size() > 2) {
                builder.mrzLine3(ConfidenceField.of(mrzLines.get(2), mrzConfidence));
            }
        }

        log.debug("Fields extracted: {} from MRZ, {} from heuristics", source.fromMrz, source.fromHeuristics);
        return builder.build();
    }

    static String documentType(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.contains("PASSPORT")) return "P";
        if (upper.contains("VISA")) return "V";
        if (upper.contains("IDENTITY") || upper.contains("ID CARD")) return "I";
        if (upper.contains("DRIVING") || upper.contains("LICENSE") || upper.contains("LICENCE")) return "D";
        return "P";
    }

    /** First match of the pattern: its first group when it has one, the whole match otherwise. */
    static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) return "";
        return matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
    }

    /** Upper-cased text after the first colon of the first line carrying one of the labels. */
    static Optional<String> labelledValue(List<String> lines, List<String> labels) {
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (labels.stream().anyMatch(lower::contains)) {
                String[] parts = line.split(":", -1);
                if (parts.length > 1) {
                    return Optional.of(parts[1].trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Date on the first keyworded line that holds one, day/month/year forms first, then ISO.
     * Falls back to the first ISO date anywhere in the text.
     */
    static Optional<String> date(List<String> lines, String text, List<String> keywords) {
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (keywords.stream().noneMatch(lower::contains)) continue;

            Matcher dmy = DAY_MONTH_YEAR.matcher(line);
            if (dmy.find()) {
                return Optional.of(normalizeDayMonthYear(dmy.group(1), dmy.group(2), dmy.group(3)));
            }
            Matcher iso = ISO_DATE.matcher(line);
            if (iso.find()) {
                return Optional.of(iso.group());
            }
        }
        Matcher anywhere = ISO_DATE.matcher(text);
        return anywhere.find() ? Optional.of(anywhere.group()) : Optional.empty();
    }

    static String normalizeDayMonthYear(String day, String month, String year) {
        String fullYear = year.length() == 2
                ? String.valueOf(MrzDates.expandYear(Integer.parseInt(year)))
                : year;
        return "%s-%s-%s".formatted(fullYear, padTwo(month), padTwo(day));
    }

    private static String padTwo(String value) {
        return value.length() == 1 ? "0" + value : value;
    }

    /** Single-letter evidence wins over the words; "FEMALE" contains "MALE", hence the ordering. */
    static String sex(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        boolean m = SINGLE_M.matcher(upper).find();
        boolean f = SINGLE_F.matcher(upper).find();
        if (m && !f) return "M";
        if (f && !m) return "F";
        if (upper.contains("MALE") && !upper.contains("FEMALE")) return "M";
        if (upper.contains("FEMALE")) return "F";
        return "M";
    }

    /**
     * Chooses between the MRZ value and the heuristic for each field and stamps the confidence.
     * Lives for one extraction only.
     */
    private final class FieldSource {
        private final int mrzConfidence;
        private int fromMrz;
        private int fromHeuristics;

        private FieldSource(int mrzConfidence) {
            this.mrzConfidence = mrzConfidence;
        }

        ConfidenceField pick(String mrzValue, DocumentField field, Supplier<String> heuristic) {
            if (mrzValue != null && !mrzValue.isEmpty()) {
                fromMrz++;
                return ConfidenceField.of(mrzValue, mrzConfidence);
            }
            fromHeuristics++;
            return ConfidenceField.of(heuristic.get(), field.heuristicConfidence());
        }

        /** Like {@link #pick} for dates, applying the missing-date policy when no date is found. */
        ConfidenceField pickOrMissing(String mrzValue, DocumentField field, Supplier<Optional<String>> heuristic) {
            if (mrzValue != null && !mrzValue.isEmpty()) {
                fromMrz++;
                return ConfidenceField.of(mrzValue, mrzConfidence);
            }
            fromHeuristics++;
            Optional<String> found = heuristic.get();
            if (found.isPresent()) {
                return ConfidenceField.of(found.get(), field.heuristicConfidence());
            }
            return switch (missingDatePolicy) {
                case TODAY -> ConfidenceField.of(LocalDate.now(clock).toString(), field.heuristicConfidence());
                case UNKNOWN -> ConfidenceField.of("", 0);
            };
        }
    }
}
