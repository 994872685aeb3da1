package com.judgmentbell.common.aggregation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Per-reason counts of dropped trials. Mutable while aggregating, read-only afterwards by convention. */
public final class DropTally {

    private final EnumMap<DropReason, Integer> counts = new EnumMap<>(DropReason.class);

    public void increment(DropReason reason) {
        counts.merge(reason, 1, Integer::sum);
    }

    public int count(DropReason reason) {
        return counts.getOrDefault(reason, 0);
    }

    public int total() {
        int total = 0;
        for (int c : counts.values()) total += c;
        return total;
    }

    public Map<DropReason, Integer> asMap() {
        EnumMap<DropReason, Integer> copy = new EnumMap<>(DropReason.class);
        for (DropReason reason : DropReason.values()) {
            copy.put(reason, count(reason));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
