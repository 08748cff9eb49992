package com.example.docverify.mrz;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Machine-readable zone codec: finds MRZ candidate lines in OCR text, picks the layout from the
 * line count and decodes the fields with their check digits.
 * <p>
 * Stateless: every call is a pure function of its input.
 */
@Service
public class MrzCodec {

    private static final Logger log = LoggerFactory.getLogger(MrzCodec.class);

    static final String UNSUPPORTED_LINE_COUNT = "Invalid MRZ format - expected 2 or 3 lines";

    private static final Pattern WHITESPACE = Pattern.compile("\\s");
    private static final Pattern MRZ_CHARSET = Pattern.compile("[A-Z0-9<]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final Map<MrzLayout, MrzDecoder> decoders = Stream.of(new Td3Decoder(), new Td1Decoder())
            .collect(Collectors.toUnmodifiableMap(MrzDecoder::layout, Function.identity()));

    /**
     * Returns the lines of {@code text} that look like MRZ lines, in source order.
     * A line qualifies when, with all whitespace removed and upper-cased, it is exactly 44 or 30
     * characters of {@code [A-Z0-9<]}. The returned lines are in that normalised form.
     */
    public List<String> detectMrzLines(String text) {
        if (text == null || text.isEmpty()) return List.of();
        return LINE_BREAK.splitAsStream(text)
                .map(line -> WHITESPACE.matcher(line).replaceAll("").toUpperCase(Locale.ROOT))
                .filter(line -> MrzLayout.isLineLength(line.length()))
                .filter(line -> MRZ_CHARSET.matcher(line).matches())
                .toList();
    }

    /**
     * Decodes candidate lines. Two lines are decoded as TD3, three as TD1; any other count yields a
     * record with a single error and no decoded fields.
     */
    public MrzRecord parse(List<String> lines) {
        MrzRecord record = MrzLayout.forLineCount(lines.size())
                .map(decoders::get)
                .map(decoder -> decoder.decode(lines))
                .orElseGet(() -> MrzRecord.unsupported(lines, UNSUPPORTED_LINE_COUNT));

        log.debug("MRZ decoded: layout={}, lines={}, errors={}",
                record.layout(), lines.size(), record.errors().size());
        return record;
    }

    /** Detects the candidate lines in raw OCR text and decodes them. */
    public MrzRecord parseAndValidate(String rawText) {
        return parse(detectMrzLines(rawText));
    }
}
