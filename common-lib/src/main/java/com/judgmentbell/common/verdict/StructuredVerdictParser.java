package com.judgmentbell.common.verdict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads the {@code verdict} field of a JSON payload, tolerating code fences and prose
 * around the object. Only the two canonical labels resolve; any other value is left to
 * the next parser.
 */
public class StructuredVerdictParser implements VerdictParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredVerdictParser.class);

    static final String VERDICT_FIELD = "verdict";

    private final ObjectMapper objectMapper;

    public StructuredVerdictParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "structured";
    }

    @Override
    public Optional<Verdict> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Optional<String> payload = ResponseText.embeddedObject(ResponseText.stripMarkup(text));
        if (payload.isEmpty()) return Optional.empty();

        try {
            JsonNode json = objectMapper.readTree(payload.get());
            JsonNode field = json.path(VERDICT_FIELD);
            if (!field.isTextual()) return Optional.empty();
            return canonical(field.asText());
        } catch (JsonProcessingException e) {
            log.debug("[VerdictParser] Structured payload unreadable. reason={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static Optional<Verdict> canonical(String label) {
        String v = label.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        switch (v) {
            case "GUILTY":
                return Optional.of(Verdict.GUILTY);
            case "NOT_GUILTY":
            case "NOTGUILTY":
                return Optional.of(Verdict.NOT_GUILTY);
            default:
                return Optional.empty();
        }
    }
}
