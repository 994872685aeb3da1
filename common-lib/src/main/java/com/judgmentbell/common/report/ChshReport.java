package com.judgmentbell.common.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.aggregation.DropReason;

import java.util.List;
import java.util.Map;

/**
 * Structured output of one analysis run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code rows}: every configuration, ranked by significance then |S|</li>
 *   <li>{@code byCrossType}: the same rows partitioned by cross-type tag, each ranked</li>
 *   <li>{@code flagged}: rows whose significance exceeds {@code significanceThreshold}</li>
 *   <li>{@code drops}: per-reason counts of trials that did not contribute</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChshReport(
    @JsonProperty("source")                String source,
    @JsonProperty("auditHash")             String auditHash,
    @JsonProperty("significanceThreshold") double significanceThreshold,
    @JsonProperty("resultsSeen")           int resultsSeen,
    @JsonProperty("violations")            int violations,
    @JsonProperty("rows")                  List<ChshSummaryRow> rows,
    @JsonProperty("byCrossType")           Map<String, List<ChshSummaryRow>> byCrossType,
    @JsonProperty("flagged")               List<ChshSummaryRow> flagged,
    @JsonProperty("drops")                 Map<DropReason, Integer> drops
) {
}
