package com.judgmentbell.common.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommutatorAnalyzerTest {

    private static List<OrderedObservation> observations(String first, String second,
                                                         int total, int firstYes, int secondYes) {
        List<OrderedObservation> list = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            list.add(new OrderedObservation("kidney_gift", first, second, i < firstYes, i < secondYes));
        }
        return list;
    }

    @Test
    @DisplayName("order-dependent answers → both directions significant, largest effect first")
    void orderEffect() {
        List<OrderedObservation> all = new ArrayList<>();
        all.addAll(observations("harm", "duty", 10, 8, 10));
        all.addAll(observations("duty", "harm", 10, 5, 2));

        List<CommutatorEffect> effects = CommutatorAnalyzer.analyze(all);

        assertEquals(2, effects.size());
        CommutatorEffect harm = effects.get(0);
        assertEquals("harm", harm.target());
        assertEquals("duty", harm.context());
        assertEquals(0.8, harm.baseline(), 1e-9);
        assertEquals(0.2, harm.withContext(), 1e-9);
        assertEquals(-0.6, harm.effect(), 1e-9);
        assertTrue(harm.significant());

        CommutatorEffect duty = effects.get(1);
        assertEquals(0.5, duty.effect(), 1e-9);
        assertEquals(10, duty.baselineCount());
        assertTrue(duty.significant());
    }

    @Test
    @DisplayName("same answers in either order → zero effect, not significant")
    void noOrderEffect() {
        List<OrderedObservation> all = new ArrayList<>();
        all.addAll(observations("harm", "duty", 10, 5, 5));
        all.addAll(observations("duty", "harm", 10, 5, 5));

        for (CommutatorEffect e : CommutatorAnalyzer.analyze(all)) {
            assertEquals(0.0, e.effect(), 1e-9);
            assertFalse(e.significant());
        }
    }

    @Test
    @DisplayName("axis never asked first → no baseline, no effect reported for it")
    void missingBaseline() {
        List<CommutatorEffect> effects = CommutatorAnalyzer.analyze(observations("harm", "duty", 4, 2, 2));

        assertEquals(0, effects.size());
    }
}
