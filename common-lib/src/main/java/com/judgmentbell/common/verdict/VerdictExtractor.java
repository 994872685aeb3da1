package com.judgmentbell.common.verdict;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Ordered parser chain turning raw oracle text into a {@link Verdict}.
 * The structured parser runs first, the label scan second; the first success wins.
 * Never throws: an unrecoverable response yields UNRESOLVED with a truncated excerpt.
 */
public class VerdictExtractor {

    private static final Logger log = LoggerFactory.getLogger(VerdictExtractor.class);

    public static final int EXCERPT_LENGTH = 80;

    private final List<VerdictParser> parsers;

    public VerdictExtractor(ObjectMapper objectMapper) {
        this(List.of(new StructuredVerdictParser(objectMapper), new LabelScanVerdictParser()));
    }

    public VerdictExtractor(List<VerdictParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public VerdictExtraction extract(String text) {
        for (VerdictParser parser : parsers) {
            Optional<Verdict> verdict = parser.parse(text);
            if (verdict.isPresent()) {
                return new VerdictExtraction(verdict.get(), parser.name(), null);
            }
        }
        String excerpt = "Parse failed: " + ResponseText.excerpt(text, EXCERPT_LENGTH);
        log.debug("[VerdictExtractor] Unresolved response. {}", excerpt);
        return new VerdictExtraction(Verdict.UNRESOLVED, null, excerpt);
    }
}
