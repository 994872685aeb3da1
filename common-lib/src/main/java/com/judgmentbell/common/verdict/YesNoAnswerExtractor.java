package com.judgmentbell.common.verdict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YES/NO counterpart of {@link VerdictExtractor} for the ordering and timing variants.
 * Structured payload first ({@code answer}, or {@code first_answer} / {@code second_answer}),
 * standalone-word scan second.
 */
public class YesNoAnswerExtractor {

    private static final Logger log = LoggerFactory.getLogger(YesNoAnswerExtractor.class);

    private static final Pattern ANSWER_WORD = Pattern.compile("\\b(YES|NO)\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public YesNoAnswerExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Single answer; empty when unresolved or when both words occur. */
    public Optional<Boolean> extractSingle(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Optional<JsonNode> json = readPayload(text);
        if (json.isPresent()) {
            Optional<Boolean> answer = answer(json.get().path("answer"));
            if (answer.isPresent()) return answer;
        }

        List<Boolean> words = scan(text);
        boolean anyYes = words.contains(Boolean.TRUE);
        boolean anyNo = words.contains(Boolean.FALSE);
        if (anyYes == anyNo) return Optional.empty();
        return Optional.of(anyYes);
    }

    /** Two ordered answers; the scan fallback needs exactly two answer words. */
    public Optional<AnswerPair> extractPair(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Optional<JsonNode> json = readPayload(text);
        if (json.isPresent()) {
            Optional<Boolean> first = answer(json.get().path("first_answer"));
            Optional<Boolean> second = answer(json.get().path("second_answer"));
            if (first.isPresent() && second.isPresent()) {
                return Optional.of(new AnswerPair(first.get(), second.get()));
            }
        }

        List<Boolean> words = scan(text);
        if (words.size() != 2) return Optional.empty();
        return Optional.of(new AnswerPair(words.get(0), words.get(1)));
    }

    private Optional<JsonNode> readPayload(String text) {
        Optional<String> payload = ResponseText.embeddedObject(ResponseText.stripMarkup(text));
        if (payload.isEmpty()) return Optional.empty();
        try {
            return Optional.of(objectMapper.readTree(payload.get()));
        } catch (JsonProcessingException e) {
            log.debug("[AnswerExtractor] Structured payload unreadable. reason={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Optional<Boolean> answer(JsonNode node) {
        if (!node.isTextual()) return Optional.empty();
        String v = node.asText().trim().toUpperCase(Locale.ROOT);
        if (v.equals("YES")) return Optional.of(true);
        if (v.equals("NO")) return Optional.of(false);
        return Optional.empty();
    }

    private static List<Boolean> scan(String text) {
        List<Boolean> words = new ArrayList<>();
        Matcher m = ANSWER_WORD.matcher(text);
        while (m.find()) {
            words.add(m.group(1).equalsIgnoreCase("YES"));
        }
        return words;
    }
}
