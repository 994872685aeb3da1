package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One result set to analyse.
 *
 * @param manifest design manifest in any layout the manifest codec reads; may be {@code null}
 *                 when the records embed their conditions
 * @param results  result set in any layout the result-set reader accepts
 * @param source   label stamped onto every configuration; overrides the label in {@code results}
 */
public record ChshRequest(
    @JsonProperty("manifest") JsonNode manifest,
    @JsonProperty("results")  JsonNode results,
    @JsonProperty("source")   String source
) {
}
