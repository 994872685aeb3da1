package com.judgmentbell.common.design;

import com.judgmentbell.common.model.TrialCondition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link DesignGenerator}: the requests in generation order plus the audit hash.
 *
 * @param skippedConfigurations (scenario, frame pair) combinations left out for missing localization
 */
public record TrialDesign(
    String auditHash,
    DesignParameters parameters,
    List<TrialRequest> requests,
    int skippedConfigurations
) {
    public TrialDesign {
        requests = List.copyOf(requests);
    }

    /** Conditions keyed by identifier, in generation order. */
    public Map<String, TrialCondition> conditions() {
        Map<String, TrialCondition> conditions = new LinkedHashMap<>();
        for (TrialRequest request : requests) {
            conditions.put(request.identifier(), request.condition());
        }
        return Collections.unmodifiableMap(conditions);
    }
}
