package com.judgmentbell.orchestrator.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Maps source labels used in designs to Anthropic model ids.
 *
 * <p>Labels are case-insensitive. A value that already looks like a model id is passed
 * through; anything else falls back to the default label's model.
 */
public final class SourceSelector {

    private static final Logger log = LoggerFactory.getLogger(SourceSelector.class);

    public static final String HAIKU_MODEL  = "claude-haiku-4-5-20251001";
    public static final String SONNET_MODEL = "claude-sonnet-4-6";
    public static final String OPUS_MODEL   = "claude-opus-4-1";

    private static final Map<String, String> MODELS = Map.of(
        "haiku", HAIKU_MODEL,
        "sonnet", SONNET_MODEL,
        "opus", OPUS_MODEL
    );

    private SourceSelector() {}

    public static String selectModel(String source, String defaultSource) {
        if (source != null && !source.isBlank()) {
            String label = source.trim().toLowerCase(Locale.ROOT);
            String model = MODELS.get(label);
            if (model != null) return model;
            if (label.startsWith("claude-")) return source.trim();
            log.warn("[SourceSelector] Unknown source, using default. source={} default={}", source, defaultSource);
        }
        return MODELS.getOrDefault(defaultSource == null ? "" : defaultSource.toLowerCase(Locale.ROOT), SONNET_MODEL);
    }

    /** Labels known to the selector, for status and health output. */
    public static Map<String, String> knownSources() {
        return MODELS;
    }
}
