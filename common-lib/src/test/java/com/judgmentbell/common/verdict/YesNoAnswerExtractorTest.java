package com.judgmentbell.common.verdict;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class YesNoAnswerExtractorTest {

    private final YesNoAnswerExtractor extractor = new YesNoAnswerExtractor(new ObjectMapper());

    @Test
    @DisplayName("structured pair → ordered answers")
    void structuredPair() {
        Optional<AnswerPair> pair = extractor.extractPair(
            "```json\n{\"first_answer\": \"YES\", \"second_answer\": \"no\"}\n```");
        assertEquals(Optional.of(new AnswerPair(true, false)), pair);
    }

    @Test
    @DisplayName("free text with exactly two answer words → pair in order")
    void scannedPair() {
        assertEquals(Optional.of(new AnswerPair(false, true)),
            extractor.extractPair("First: No. Second: Yes."));
    }

    @Test
    @DisplayName("three answer words → no pair")
    void ambiguousPair() {
        assertTrue(extractor.extractPair("Yes, no, yes").isEmpty());
    }

    @Test
    @DisplayName("single structured answer and single scanned answer")
    void single() {
        assertEquals(Optional.of(true), extractor.extractSingle("{\"answer\": \"YES\"}"));
        assertEquals(Optional.of(false), extractor.extractSingle("My answer is no."));
        assertTrue(extractor.extractSingle("yes and no").isEmpty());
        assertTrue(extractor.extractSingle(null).isEmpty());
    }
}
