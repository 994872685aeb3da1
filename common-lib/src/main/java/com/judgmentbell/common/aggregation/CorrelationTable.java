package com.judgmentbell.common.aggregation;

import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CorrelationSample;
import com.judgmentbell.common.model.MeasurementSetting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-level table ConfigurationKey → MeasurementSetting → samples.
 *
 * <p>Configurations live in an arena list in insertion order; a key → slot index gives
 * O(1) lookup. Every configuration row holds all four settings, empty lists included.
 */
public final class CorrelationTable {

    private final List<ConfigurationKey> keys = new ArrayList<>();
    private final Map<ConfigurationKey, Integer> index = new HashMap<>();
    private final List<EnumMap<MeasurementSetting, List<CorrelationSample>>> rows = new ArrayList<>();

    int slot(ConfigurationKey key) {
        Integer slot = index.get(key);
        if (slot != null) return slot;

        EnumMap<MeasurementSetting, List<CorrelationSample>> row = new EnumMap<>(MeasurementSetting.class);
        for (MeasurementSetting setting : MeasurementSetting.values()) {
            row.put(setting, new ArrayList<>());
        }
        keys.add(key);
        rows.add(row);
        index.put(key, keys.size() - 1);
        return keys.size() - 1;
    }

    void add(CorrelationSample sample) {
        rows.get(slot(sample.key())).get(sample.setting()).add(sample);
    }

    /** Configurations in insertion order. */
    public List<ConfigurationKey> configurations() {
        return Collections.unmodifiableList(keys);
    }

    public boolean contains(ConfigurationKey key) {
        return index.containsKey(key);
    }

    public List<CorrelationSample> samples(ConfigurationKey key, MeasurementSetting setting) {
        Integer slot = index.get(key);
        if (slot == null) return List.of();
        return Collections.unmodifiableList(rows.get(slot).get(setting));
    }

    public Map<MeasurementSetting, List<CorrelationSample>> row(ConfigurationKey key) {
        EnumMap<MeasurementSetting, List<CorrelationSample>> view = new EnumMap<>(MeasurementSetting.class);
        for (MeasurementSetting setting : MeasurementSetting.values()) {
            view.put(setting, samples(key, setting));
        }
        return Collections.unmodifiableMap(view);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public int sampleCount() {
        int total = 0;
        for (EnumMap<MeasurementSetting, List<CorrelationSample>> row : rows) {
            for (List<CorrelationSample> samples : row.values()) total += samples.size();
        }
        return total;
    }
}
