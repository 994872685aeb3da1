package com.judgmentbell.common.format;

import com.judgmentbell.common.aggregation.ResultEntry;

import java.util.Map;

/**
 * @param source    source label from the file, {@code null} if absent
 * @param entries   identifier → entry
 * @param malformed records without an identifier
 */
public record ResultSet(String source, Map<String, ResultEntry> entries, int malformed) {
}
