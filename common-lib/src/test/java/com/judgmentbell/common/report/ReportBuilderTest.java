package com.judgmentbell.common.report;

import com.judgmentbell.common.format.JsonSupport;
import com.judgmentbell.common.format.ReportCodec;
import com.judgmentbell.common.model.ChshResult;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CrossType;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    private static final PartyFrame EN = new PartyFrame(Language.ENGLISH, Tense.PRESENT);
    private static final PartyFrame JA = new PartyFrame(Language.JAPANESE, Tense.PRESENT);

    private static ChshResult result(String scenario, PartyFrame beta, CrossType type, double s, double se) {
        ConfigurationKey key = new ConfigurationKey(scenario, EN, beta, type, null);
        double significance = Math.abs(s) > 2 && Double.isFinite(se) && se > 0 ? (Math.abs(s) - 2) / se : 0.0;
        return new ChshResult(key, Map.of(), s, se, Math.abs(s) > 2, significance, 32);
    }

    private final ReportBuilder builder = new ReportBuilder();

    // ── ranking and partitions ────────────────────────────────────────────

    @Nested
    @DisplayName("ranking and partitions")
    class RankingTests {

        @Test
        @DisplayName("rank → significance first, then |S|")
        void ranking() {
            ChshResult weak = result("a", EN, CrossType.MONO, 1.9, 0.2);
            ChshResult strong = result("b", EN, CrossType.MONO, 2.6, 0.1);
            ChshResult mild = result("c", EN, CrossType.MONO, 2.2, 0.1);
            ChshResult weaker = result("d", EN, CrossType.MONO, -1.2, 0.2);

            assertEquals(List.of(strong, mild, weak, weaker), ReportBuilder.rank(List.of(weaker, weak, mild, strong)));
        }

        @Test
        @DisplayName("partition by cross-type keeps declaration order and omits empty groups")
        void crossTypePartition() {
            ChshResult mono = result("a", EN, CrossType.MONO, 1.0, 0.2);
            ChshResult xlang = result("a", JA, CrossType.CROSS_LINGUAL, 1.5, 0.2);

            Map<CrossType, List<ChshResult>> parts = ReportBuilder.partitionByCrossType(List.of(xlang, mono));

            assertEquals(List.of(CrossType.MONO, CrossType.CROSS_LINGUAL), List.copyOf(parts.keySet()));
            assertFalse(parts.containsKey(CrossType.CROSS_MODEL));
        }

        @Test
        @DisplayName("partition by source groups a missing source as default")
        void sourcePartition() {
            ChshResult plain = result("a", EN, CrossType.MONO, 1.0, 0.2);
            ChshResult opus = plain.withKey(plain.key().withSource("opus"));

            Map<String, List<ChshResult>> parts = ReportBuilder.partitionBySource(List.of(plain, opus));

            assertEquals(List.of(plain), parts.get("default"));
            assertEquals(List.of(opus), parts.get("opus"));
        }

        @Test
        @DisplayName("flagged → only significance above the threshold")
        void flagged() {
            ChshResult fourSigma = result("a", EN, CrossType.MONO, 2.4, 0.1);
            ChshResult twoSigma = result("b", EN, CrossType.MONO, 2.2, 0.1);

            assertEquals(List.of(fourSigma), builder.flagged(List.of(twoSigma, fourSigma)));
            assertEquals(List.of(fourSigma, twoSigma), new ReportBuilder(1.0).flagged(List.of(twoSigma, fourSigma)));
        }
    }

    // ── report document ───────────────────────────────────────────────────

    @Nested
    @DisplayName("report document")
    class DocumentTests {

        @Test
        @DisplayName("build → ranked rows, violation count, per-type partitions")
        void build() {
            ChshReport report = builder.build(List.of(
                result("a", EN, CrossType.MONO, 1.0, 0.2),
                result("a", JA, CrossType.CROSS_LINGUAL, 2.5, 0.1)), null, "sonnet", "0123456789abcdef");

            assertEquals(1, report.violations());
            assertEquals(2.5, report.rows().get(0).s());
            assertEquals(List.of("mono", "xlang"), List.copyOf(report.byCrossType().keySet()));
            assertEquals(1, report.flagged().size());
            assertEquals("sonnet", report.source());
        }

        @Test
        @DisplayName("infinite se survives the JSON round trip and renders as inf")
        void infiniteError() throws Exception {
            ChshReport report = builder.build(List.of(
                result("a", EN, CrossType.MONO, 3.0, Double.POSITIVE_INFINITY)), null, null, null);
            ReportCodec codec = new ReportCodec(JsonSupport.newObjectMapper());

            ChshReport reloaded = codec.read(codec.write(report));

            assertTrue(Double.isInfinite(reloaded.rows().get(0).standardError()));
            assertEquals(0.0, reloaded.rows().get(0).significance());
            assertEquals(report.rows().get(0).key(), reloaded.rows().get(0).key());
            assertTrue(ReportRenderer.render(reloaded).contains("inf"));
        }
    }
}
