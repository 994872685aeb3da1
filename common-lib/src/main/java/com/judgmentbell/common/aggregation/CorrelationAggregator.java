package com.judgmentbell.common.aggregation;

import com.judgmentbell.common.codec.DecodedIdentifier;
import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.model.ConditionFields;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CorrelationSample;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.TrialCondition;
import com.judgmentbell.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Groups recovered verdicts into matched correlation samples.
 *
 * <h3>Grouping</h3>
 * <pre>
 *   ConfigurationKey → MeasurementSetting → party → trial key (trial index + axis pair) → verdict
 * </pre>
 * Within a setting, the alpha and beta verdicts sharing a trial key form one sample with
 * product alpha × beta. Unmatched trials are excluded, never zero-filled.
 *
 * <h3>Condition lookup</h3>
 * The manifest entry for an identifier wins; otherwise the condition fields embedded in the
 * result record are used. The axis pair and trial index always come from the identifier;
 * the subject comes from the condition, falling back to the identifier.
 *
 * <p>Every per-trial problem is counted in the outcome's {@link DropTally}; nothing here
 * throws for bad input data. Output order is deterministic for a given input.
 */
public class CorrelationAggregator {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAggregator.class);

    private final TrialIdentifierCodec codec;

    public CorrelationAggregator(TrialIdentifierCodec codec) {
        this.codec = codec;
    }

    public AggregationOutcome aggregate(Map<String, ResultEntry> results) {
        return aggregate(results, Map.of(), null);
    }

    public AggregationOutcome aggregate(Map<String, ResultEntry> results, Map<String, TrialCondition> manifest) {
        return aggregate(results, manifest, null);
    }

    /**
     * @param results  identifier → recovered verdict
     * @param manifest identifier → design-time condition; may be empty or {@code null}
     * @param source   result-set source label stamped onto every configuration key; overrides
     *                 a source embedded in the records; {@code null} keeps the embedded one
     */
    public AggregationOutcome aggregate(Map<String, ResultEntry> results,
                                        Map<String, TrialCondition> manifest,
                                        String source) {
        Map<String, TrialCondition> conditions = manifest == null ? Map.of() : manifest;
        DropTally drops = new DropTally();
        Map<ConfigurationKey, PendingConfiguration> pending = new HashMap<>();
        int accepted = 0;

        // Sorted iteration keeps duplicate resolution independent of the caller's map type.
        for (Map.Entry<String, ResultEntry> entry : new TreeMap<>(results).entrySet()) {
            String identifier = entry.getKey();
            ResultEntry result = entry.getValue();

            if (result == null || !result.verdict().isResolved()) {
                drops.increment(DropReason.PARSE_FAILURE);
                continue;
            }

            ConditionFields fields = resolveFields(identifier, result, conditions);
            if (fields == null) {
                drops.increment(DropReason.MISSING_CONDITION);
                log.debug("[Aggregator] No condition for identifier. id={}", identifier);
                continue;
            }

            Optional<DecodedIdentifier> decoded = codec.decode(identifier);
            if (decoded.isEmpty()) {
                drops.increment(DropReason.DECODE_FAILURE);
                continue;
            }

            Party subject = fields.subject() != null ? fields.subject() : decoded.get().subject();
            if (subject == null) {
                drops.increment(DropReason.UNKNOWN_SUBJECT);
                log.debug("[Aggregator] Subject unknown. id={}", identifier);
                continue;
            }

            ConfigurationKey key = fields.configurationKey();
            if (source != null) key = key.withSource(source);

            TrialKey trialKey = new TrialKey(decoded.get().trialIndex(), decoded.get().setting());
            boolean duplicate = pending.computeIfAbsent(key, k -> new PendingConfiguration())
                .put(trialKey, subject, result.verdict());
            if (duplicate) {
                drops.increment(DropReason.DUPLICATE_TRIAL);
            }
            accepted++;
        }

        CorrelationTable table = new CorrelationTable();
        List<ConfigurationKey> keys = new ArrayList<>(pending.keySet());
        keys.sort(ConfigurationKey.ORDER);
        for (ConfigurationKey key : keys) {
            table.slot(key);
            pending.get(key).match(key, table, drops);
        }

        log.info("[Aggregator] Aggregation complete. results={} accepted={} configurations={} samples={} drops={}",
                 results.size(), accepted, table.size(), table.sampleCount(), drops);
        return new AggregationOutcome(table, drops, results.size(), accepted);
    }

    private static ConditionFields resolveFields(String identifier, ResultEntry result,
                                                 Map<String, TrialCondition> conditions) {
        TrialCondition condition = conditions.get(identifier);
        if (condition != null) return condition.fields();
        return result.embedded();
    }

    // ── per-configuration pairing ────────────────────────────────────────────

    /** Trial index plus axis pair; disambiguates repeated trial indices across rounds. */
    record TrialKey(int trialIndex, MeasurementSetting setting) {
        static final Comparator<TrialKey> ORDER =
            Comparator.comparingInt(TrialKey::trialIndex).thenComparing(TrialKey::setting);
    }

    private static final class PendingConfiguration {

        private final EnumMap<Party, Map<TrialKey, Verdict>> byParty = new EnumMap<>(Party.class);

        PendingConfiguration() {
            for (Party party : Party.values()) {
                byParty.put(party, new TreeMap<>(TrialKey.ORDER));
            }
        }

        /** @return {@code true} if a verdict was already recorded for this party and trial key */
        boolean put(TrialKey key, Party party, Verdict verdict) {
            return byParty.get(party).put(key, verdict) != null;
        }

        void match(ConfigurationKey configuration, CorrelationTable table, DropTally drops) {
            Map<TrialKey, Verdict> alpha = byParty.get(Party.ALPHA);
            Map<TrialKey, Verdict> beta = byParty.get(Party.BETA);

            for (Map.Entry<TrialKey, Verdict> a : alpha.entrySet()) {
                Verdict b = beta.get(a.getKey());
                if (b == null) {
                    drops.increment(DropReason.UNMATCHED);
                    continue;
                }
                table.add(CorrelationSample.of(configuration, a.getKey().setting(),
                                               a.getKey().trialIndex(), a.getValue(), b));
            }
            for (TrialKey key : beta.keySet()) {
                if (!alpha.containsKey(key)) {
                    drops.increment(DropReason.UNMATCHED);
                }
            }
        }
    }
}
