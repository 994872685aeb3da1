package com.judgmentbell.common.verdict;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerdictExtractorTest {

    private final VerdictExtractor extractor = new VerdictExtractor(new ObjectMapper());

    // ── structured payloads ───────────────────────────────────────────────

    @Nested
    @DisplayName("structured payloads")
    class StructuredTests {

        @Test
        @DisplayName("fenced JSON with GUILTY → −1 via structured parser")
        void fencedGuilty() {
            VerdictExtraction e = extractor.extract(
                "```json\n{\"verdict\": \"GUILTY\", \"confidence\": 0.9, \"reasoning\": \"x\"}\n```");
            assertEquals(Verdict.GUILTY, e.verdict());
            assertEquals(-1, e.verdict().sign());
            assertEquals("structured", e.parser());
            assertNull(e.diagnostic());
        }

        @Test
        @DisplayName("JSON embedded in prose → +1")
        void embeddedNotGuilty() {
            VerdictExtraction e = extractor.extract(
                "Here is my answer: {\"verdict\": \"NOT_GUILTY\", \"confidence\": 0.7} Thank you.");
            assertEquals(Verdict.NOT_GUILTY, e.verdict());
            assertEquals("structured", e.parser());
        }

        @Test
        @DisplayName("label spelled with a space and mixed case → +1")
        void spacedLabel() {
            assertEquals(Verdict.NOT_GUILTY, extractor.extract("{\"verdict\": \"Not Guilty\"}").verdict());
        }

        @Test
        @DisplayName("non-canonical verdict field and no labels in text → unresolved")
        void nonCanonicalField() {
            VerdictExtraction e = extractor.extract("{\"verdict\": \"MAYBE\", \"confidence\": 0.5}");
            assertEquals(Verdict.UNRESOLVED, e.verdict());
            assertFalse(e.isResolved());
        }
    }

    // ── label scan fallback ───────────────────────────────────────────────

    @Nested
    @DisplayName("label scan fallback")
    class LabelScanTests {

        @Test
        @DisplayName("free text with only NOT GUILTY → +1 via label scan")
        void freeTextNotGuilty() {
            VerdictExtraction e = extractor.extract("After reflection, Person B is NOT GUILTY of any wrong.");
            assertEquals(Verdict.NOT_GUILTY, e.verdict());
            assertEquals("label-scan", e.parser());
        }

        @Test
        @DisplayName("free text with only GUILTY → −1")
        void freeTextGuilty() {
            assertEquals(Verdict.GUILTY, extractor.extract("I find Person A guilty.").verdict());
        }

        @Test
        @DisplayName("truncated JSON falls through to the scan")
        void truncatedJson() {
            assertEquals(Verdict.GUILTY, extractor.extract("{\"verdict\": \"GUILTY\", \"conf").verdict());
        }

        @Test
        @DisplayName("both labels present (echoed template) → unresolved")
        void bothLabels() {
            assertEquals(Verdict.UNRESOLVED,
                extractor.extract("The answer is GUILTY or NOT_GUILTY depending on view.").verdict());
        }

        @Test
        @DisplayName("label inside a longer word is not a standalone token")
        void notStandalone() {
            assertEquals(Verdict.UNRESOLVED, extractor.extract("GUILTYISH feelings aside").verdict());
        }
    }

    // ── failures ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("neither label → 0 with truncated excerpt")
        void neitherLabel() {
            String text = "I cannot decide. ".repeat(20);
            VerdictExtraction e = extractor.extract(text);
            assertEquals(Verdict.UNRESOLVED, e.verdict());
            assertEquals(0, e.verdict().legacyValue());
            assertTrue(e.diagnostic().startsWith("Parse failed: "));
            assertTrue(e.diagnostic().length() <= "Parse failed: ".length() + VerdictExtractor.EXCERPT_LENGTH);
        }

        @Test
        @DisplayName("null text → unresolved, no exception")
        void nullText() {
            assertEquals(Verdict.UNRESOLVED, extractor.extract(null).verdict());
        }

        @Test
        @DisplayName("UNRESOLVED refuses to produce a sign")
        void unresolvedHasNoSign() {
            assertThrows(IllegalStateException.class, Verdict.UNRESOLVED::sign);
        }
    }
}
