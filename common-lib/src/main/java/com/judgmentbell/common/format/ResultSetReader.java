package com.judgmentbell.common.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.aggregation.ResultEntry;
import com.judgmentbell.common.exception.AnalysisException;
import com.judgmentbell.common.model.ConditionFields;
import com.judgmentbell.common.model.TrialCondition;
import com.judgmentbell.common.model.Verdict;
import com.judgmentbell.common.verdict.VerdictExtraction;
import com.judgmentbell.common.verdict.VerdictExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads result sets in either top-level shape:
 * <pre>
 *   { "id-1": {"verdict": -1, "condition": {...}}, "id-2": {...} }
 *   [ {"custom_id": "id-1", "verdict": "GUILTY", "spec": {...}}, ... ]
 * </pre>
 * optionally wrapped as {@code {"source": "...", "results": <either shape>}}.
 *
 * <p>A verdict may be an integer or a label. When it is absent but raw oracle text is present,
 * the text is run through the {@link VerdictExtractor}.
 */
public class ResultSetReader {

    private static final Logger log = LoggerFactory.getLogger(ResultSetReader.class);

    private final ObjectMapper objectMapper;
    private final VerdictExtractor extractor;

    public ResultSetReader(ObjectMapper objectMapper, VerdictExtractor extractor) {
        this.objectMapper = objectMapper;
        this.extractor = extractor;
    }

    public ResultSet read(InputStream in) throws IOException {
        return read(objectMapper.readTree(in));
    }

    public ResultSet read(String json) throws JsonProcessingException {
        return read(objectMapper.readTree(json));
    }

    /**
     * @throws AnalysisException when there is no result set at all
     */
    public ResultSet read(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode() || !root.isContainerNode()) {
            throw new AnalysisException("ResultSetReader", "No result set supplied");
        }

        String source = null;
        JsonNode results = root;
        if (root.isObject() && root.path("results").isContainerNode()) {
            source = EmbeddedConditionReader.text(root, "source", "model");
            results = root.path("results");
        }

        Map<String, ResultEntry> entries = new LinkedHashMap<>();
        int malformed = 0;
        if (results.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = results.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), entry(field.getValue()));
            }
        } else {
            for (JsonNode record : results) {
                String id = EmbeddedConditionReader.text(record, "custom_id", "identifier", "id");
                if (id == null) {
                    malformed++;
                    continue;
                }
                entries.put(id, entry(record));
            }
        }

        log.info("[ResultSetReader] Result set read. entries={} malformed={} source={}",
                 entries.size(), malformed, source);
        return new ResultSet(source, entries, malformed);
    }

    private ResultEntry entry(JsonNode record) {
        if (!record.isObject()) {
            // Bare value: {"id": -1} or {"id": "GUILTY"}
            return ResultEntry.of(verdict(record));
        }

        Verdict verdict = verdict(record.path("verdict"));
        String error = EmbeddedConditionReader.text(record, "error");
        if (!record.has("verdict") && extractor != null) {
            String raw = EmbeddedConditionReader.text(record, "raw", "response", "text");
            if (raw != null) {
                VerdictExtraction extraction = extractor.extract(raw);
                verdict = extraction.verdict();
                if (error == null) error = extraction.diagnostic();
            }
        }

        return new ResultEntry(verdict, embedded(record), error);
    }

    private ConditionFields embedded(JsonNode record) {
        JsonNode condition = record.path("condition");
        if (condition.isObject()) {
            try {
                return objectMapper.treeToValue(condition, TrialCondition.class).fields();
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("[ResultSetReader] Embedded condition unreadable, trying flat fields. reason={}",
                          e.getMessage());
                return EmbeddedConditionReader.read(condition).orElse(null);
            }
        }
        return EmbeddedConditionReader.read(record.path("spec")).orElse(null);
    }

    private static Verdict verdict(JsonNode node) {
        if (node.isNumber()) return Verdict.fromLegacyValue((int) Math.signum(node.asDouble()));
        if (node.isTextual()) return Verdict.fromStored(node.asText());
        return Verdict.UNRESOLVED;
    }
}
