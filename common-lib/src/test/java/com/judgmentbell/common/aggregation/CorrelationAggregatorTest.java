package com.judgmentbell.common.aggregation;

import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.model.ConditionFields;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CorrelationSample;
import com.judgmentbell.common.model.CrossType;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;
import com.judgmentbell.common.model.TrialCondition;
import com.judgmentbell.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pairing of per-party verdicts into correlation samples, and the drop accounting around it.
 */
class CorrelationAggregatorTest {

    private final TrialIdentifierCodec codec = new TrialIdentifierCodec();
    private final CorrelationAggregator aggregator = new CorrelationAggregator(codec);

    private static final PartyFrame EN = new PartyFrame(Language.ENGLISH, Tense.PRESENT);
    private static final PartyFrame JA = new PartyFrame(Language.JAPANESE, Tense.PRESENT);

    private static TrialCondition condition(String scenario, PartyFrame beta, MeasurementSetting setting,
                                            Party subject, int trial) {
        CrossType type = beta.equals(EN) ? CrossType.MONO : CrossType.CROSS_LINGUAL;
        String salt = String.format("%08x", (scenario.hashCode() ^ trial * 31 ^ setting.ordinal() * 7
                                             ^ subject.ordinal()) & 0x7fffffff);
        return new TrialCondition(scenario, EN, beta, setting, subject, trial, type, salt);
    }

    /** Registers one matched trial: both halves in the manifest and in the results. */
    private void pair(Map<String, TrialCondition> manifest, Map<String, ResultEntry> results,
                      String scenario, PartyFrame beta, MeasurementSetting setting, int trial,
                      Verdict alpha, Verdict betaVerdict) {
        TrialCondition a = condition(scenario, beta, setting, Party.ALPHA, trial);
        TrialCondition b = condition(scenario, beta, setting, Party.BETA, trial);
        manifest.put(codec.encode(a), a);
        manifest.put(codec.encode(b), b);
        results.put(codec.encode(a), ResultEntry.of(alpha));
        results.put(codec.encode(b), ResultEntry.of(betaVerdict));
    }

    // ── matching ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("matching")
    class MatchingTests {

        @Test
        @DisplayName("both halves present → one sample with product alpha × beta")
        void matchedPair() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new HashMap<>();
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.PS, 0, Verdict.GUILTY, Verdict.NOT_GUILTY);
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.PS, 1, Verdict.GUILTY, Verdict.GUILTY);

            AggregationOutcome outcome = aggregator.aggregate(results, manifest);

            assertEquals(1, outcome.table().size());
            ConfigurationKey key = outcome.table().configurations().get(0);
            List<CorrelationSample> samples = outcome.table().samples(key, MeasurementSetting.PS);
            assertEquals(2, samples.size());
            assertEquals(-1, samples.get(0).product());
            assertEquals(1, samples.get(1).product());
            assertTrue(outcome.table().samples(key, MeasurementSetting.PP).isEmpty());
            assertEquals(0, outcome.drops().total());
            assertEquals(4, outcome.trialsAccepted());
        }

        @Test
        @DisplayName("one half missing → no sample, counted as unmatched")
        void unmatched() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new HashMap<>();
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.PP, 0, Verdict.GUILTY, Verdict.GUILTY);
            TrialCondition lone = condition("kidney_gift", EN, MeasurementSetting.PP, Party.ALPHA, 1);
            manifest.put(codec.encode(lone), lone);
            results.put(codec.encode(lone), ResultEntry.of(Verdict.NOT_GUILTY));

            AggregationOutcome outcome = aggregator.aggregate(results, manifest);

            assertEquals(1, outcome.table().sampleCount());
            assertEquals(1, outcome.drops().count(DropReason.UNMATCHED));
        }

        @Test
        @DisplayName("different configurations never pair with each other")
        void separateConfigurations() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new HashMap<>();
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.SS, 0, Verdict.GUILTY, Verdict.GUILTY);
            pair(manifest, results, "kidney_gift", JA, MeasurementSetting.SS, 0, Verdict.GUILTY, Verdict.NOT_GUILTY);

            AggregationOutcome outcome = aggregator.aggregate(results, manifest);

            assertEquals(2, outcome.table().size());
            assertEquals(CrossType.MONO, outcome.table().configurations().get(0).crossType());
            assertEquals(CrossType.CROSS_LINGUAL, outcome.table().configurations().get(1).crossType());
        }

        @Test
        @DisplayName("same trial index under two settings → two separate samples")
        void trialIndexReusedAcrossSettings() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new HashMap<>();
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.PP, 0, Verdict.GUILTY, Verdict.GUILTY);
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.SP, 0, Verdict.GUILTY, Verdict.NOT_GUILTY);

            AggregationOutcome outcome = aggregator.aggregate(results, manifest);
            ConfigurationKey key = outcome.table().configurations().get(0);

            assertEquals(1, outcome.table().samples(key, MeasurementSetting.PP).get(0).product());
            assertEquals(-1, outcome.table().samples(key, MeasurementSetting.SP).get(0).product());
        }

        @Test
        @DisplayName("same input twice → same table and drops")
        void deterministic() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new LinkedHashMap<>();
            for (int t = 0; t < 5; t++) {
                pair(manifest, results, "mutual_betrayal", EN, MeasurementSetting.values()[t % 4], t,
                     Verdict.GUILTY, t % 2 == 0 ? Verdict.GUILTY : Verdict.NOT_GUILTY);
            }
            results.put("garbage", ResultEntry.of(Verdict.GUILTY));

            AggregationOutcome first = aggregator.aggregate(results, manifest);
            AggregationOutcome second = aggregator.aggregate(new HashMap<>(results), manifest);

            assertEquals(first.table().configurations(), second.table().configurations());
            ConfigurationKey key = first.table().configurations().get(0);
            assertEquals(first.table().row(key), second.table().row(key));
            assertEquals(first.drops().asMap(), second.drops().asMap());
        }
    }

    // ── drops ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("drop accounting")
    class DropTests {

        @Test
        @DisplayName("unresolved verdict → PARSE_FAILURE")
        void unresolved() {
            TrialCondition c = condition("kidney_gift", EN, MeasurementSetting.PP, Party.ALPHA, 0);
            AggregationOutcome outcome = aggregator.aggregate(
                Map.of(codec.encode(c), ResultEntry.failed("Parse failed: hmm")), Map.of(codec.encode(c), c));

            assertEquals(1, outcome.drops().count(DropReason.PARSE_FAILURE));
            assertEquals(0, outcome.trialsAccepted());
        }

        @Test
        @DisplayName("no manifest entry and no embedded fields → MISSING_CONDITION")
        void missingCondition() {
            AggregationOutcome outcome = aggregator.aggregate(
                Map.of("xlang_kidney_en-pre_ja-pre_001_ppa_deadbeef", ResultEntry.of(Verdict.GUILTY)));

            assertEquals(1, outcome.drops().count(DropReason.MISSING_CONDITION));
            assertTrue(outcome.table().isEmpty());
        }

        @Test
        @DisplayName("embedded fields with undecodable identifier → DECODE_FAILURE")
        void decodeFailure() {
            ConditionFields fields = new ConditionFields("kidney_gift", EN, EN, CrossType.MONO, Party.ALPHA, null);
            AggregationOutcome outcome = aggregator.aggregate(
                Map.of("no_axis_here", new ResultEntry(Verdict.GUILTY, fields, null)));

            assertEquals(1, outcome.drops().count(DropReason.DECODE_FAILURE));
        }

        @Test
        @DisplayName("trial token overflowing an int → DECODE_FAILURE, remaining rows still paired")
        void overflowingTrialToken() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new HashMap<>();
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.PP, 0, Verdict.GUILTY, Verdict.GUILTY);
            ConditionFields fields = new ConditionFields("kidney_gift", EN, EN, CrossType.MONO, Party.ALPHA, null);
            results.put("m_s_en_99999999999_pp_a_x", new ResultEntry(Verdict.GUILTY, fields, null));

            AggregationOutcome outcome = aggregator.aggregate(results, manifest);

            assertEquals(1, outcome.drops().count(DropReason.DECODE_FAILURE));
            assertEquals(1, outcome.table().sampleCount());
        }

        @Test
        @DisplayName("subject in neither condition nor identifier → UNKNOWN_SUBJECT")
        void unknownSubject() {
            ConditionFields fields = new ConditionFields("kidney_gift", EN, JA, CrossType.CROSS_LINGUAL, null, null);
            AggregationOutcome outcome = aggregator.aggregate(
                Map.of("xlang_kidney_en-pre_ja-pre_001_pp_deadbeef", new ResultEntry(Verdict.GUILTY, fields, null)));

            assertEquals(1, outcome.drops().count(DropReason.UNKNOWN_SUBJECT));
        }

        @Test
        @DisplayName("same party and trial key twice → DUPLICATE_TRIAL, one sample kept")
        void duplicateTrial() {
            ConditionFields fields = new ConditionFields("kidney_gift", EN, EN, CrossType.MONO, null, null);
            Map<String, ResultEntry> results = new HashMap<>();
            results.put("mono_kidney_en-pre_en-pre_000_ppa_00000001", new ResultEntry(Verdict.GUILTY, fields, null));
            results.put("mono_kidney_en-pre_en-pre_000_ppa_00000002", new ResultEntry(Verdict.GUILTY, fields, null));
            results.put("mono_kidney_en-pre_en-pre_000_ppb_00000003", new ResultEntry(Verdict.GUILTY, fields, null));

            AggregationOutcome outcome = aggregator.aggregate(results);

            assertEquals(1, outcome.drops().count(DropReason.DUPLICATE_TRIAL));
            assertEquals(1, outcome.table().sampleCount());
        }
    }

    // ── condition lookup ──────────────────────────────────────────────────

    @Nested
    @DisplayName("condition lookup")
    class LookupTests {

        @Test
        @DisplayName("embedded fields used when the manifest lacks the identifier")
        void embeddedFallback() {
            ConditionFields fields = new ConditionFields("kidney_gift", EN, JA, CrossType.CROSS_LINGUAL, null, "opus");
            Map<String, ResultEntry> results = Map.of(
                "xlang_kidney_en-pre_ja-pre_002_ssa_cafe0001", new ResultEntry(Verdict.NOT_GUILTY, fields, null),
                "xlang_kidney_en-pre_ja-pre_002_ssb_cafe0002", new ResultEntry(Verdict.GUILTY, fields, null));

            AggregationOutcome outcome = aggregator.aggregate(results, null);

            assertEquals(1, outcome.table().size());
            ConfigurationKey key = outcome.table().configurations().get(0);
            assertEquals("opus", key.source());
            assertEquals(-1, outcome.table().samples(key, MeasurementSetting.SS).get(0).product());
            assertEquals(2, outcome.table().samples(key, MeasurementSetting.SS).get(0).trialIndex());
        }

        @Test
        @DisplayName("source argument stamps every configuration key")
        void sourceStamping() {
            Map<String, TrialCondition> manifest = new HashMap<>();
            Map<String, ResultEntry> results = new HashMap<>();
            pair(manifest, results, "kidney_gift", EN, MeasurementSetting.PP, 0, Verdict.GUILTY, Verdict.GUILTY);

            AggregationOutcome outcome = aggregator.aggregate(results, manifest, "haiku");

            assertEquals("haiku", outcome.table().configurations().get(0).source());
        }
    }
}
