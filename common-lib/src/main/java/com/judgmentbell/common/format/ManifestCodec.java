package com.judgmentbell.common.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.codec.DecodedIdentifier;
import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.design.DesignParameters;
import com.judgmentbell.common.model.ConditionFields;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.TrialCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes {@link DesignManifest} JSON.
 *
 * <p>Accepted inputs:
 * <ul>
 *   <li>{@code {"auditHash", "generatedAt", "parameters", "conditions": {id: condition}}}</li>
 *   <li>{@code "conditions"} as a list of condition objects carrying {@code "identifier"}</li>
 *   <li>older {@code {"prereg": {"hash"}, "specs": [...]}} manifests with flat condition fields</li>
 * </ul>
 * Entries that cannot be converted are skipped and logged.
 */
public class ManifestCodec {

    private static final Logger log = LoggerFactory.getLogger(ManifestCodec.class);

    private final ObjectMapper objectMapper;
    private final TrialIdentifierCodec identifierCodec;

    public ManifestCodec(ObjectMapper objectMapper, TrialIdentifierCodec identifierCodec) {
        this.objectMapper = objectMapper;
        this.identifierCodec = identifierCodec;
    }

    public String write(DesignManifest manifest) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(manifest);
    }

    public DesignManifest read(InputStream in) throws IOException {
        return read(objectMapper.readTree(in));
    }

    public DesignManifest read(String json) throws JsonProcessingException {
        return read(objectMapper.readTree(json));
    }

    public DesignManifest read(JsonNode root) throws JsonProcessingException {
        if (root == null || !root.isObject()) {
            return new DesignManifest(null, null, null, Map.of());
        }

        JsonNode conditions = root.path("conditions");
        if (conditions.isObject()) {
            Map<String, TrialCondition> read = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = conditions.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                condition(entry.getKey(), entry.getValue()).ifPresent(c -> read.put(entry.getKey(), c));
            }
            DesignParameters parameters = root.hasNonNull("parameters")
                ? objectMapper.treeToValue(root.get("parameters"), DesignParameters.class) : null;
            Instant generatedAt = root.hasNonNull("generatedAt")
                ? objectMapper.treeToValue(root.get("generatedAt"), Instant.class) : null;
            return new DesignManifest(EmbeddedConditionReader.text(root, "auditHash"), generatedAt, parameters, read);
        }

        Map<String, TrialCondition> converted = new LinkedHashMap<>();
        if (conditions.isArray()) {
            for (JsonNode node : conditions) {
                String id = EmbeddedConditionReader.text(node, "identifier", "custom_id", "id");
                if (id == null) continue;
                condition(id, node).ifPresent(c -> converted.put(id, c));
            }
        } else if (root.path("specs").isArray()) {
            Iterator<JsonNode> specs = root.path("specs").elements();
            while (specs.hasNext()) {
                JsonNode spec = specs.next();
                String id = EmbeddedConditionReader.text(spec, "custom_id", "identifier", "id");
                if (id == null) continue;
                legacyCondition(id, spec).ifPresentOrElse(
                    c -> converted.put(id, c),
                    () -> log.debug("[Manifest] Skipping unconvertible spec. id={}", id));
            }
        }

        String auditHash = EmbeddedConditionReader.text(root, "auditHash");
        if (auditHash == null) auditHash = EmbeddedConditionReader.text(root.path("prereg"), "hash");
        Instant generatedAt = null;
        String timestamp = EmbeddedConditionReader.text(root, "generatedAt");
        if (timestamp == null) timestamp = EmbeddedConditionReader.text(root.path("prereg"), "timestamp");
        if (timestamp != null) {
            try {
                generatedAt = Instant.parse(timestamp.endsWith("Z") || timestamp.contains("+") ? timestamp : timestamp + "Z");
            } catch (RuntimeException e) {
                log.debug("[Manifest] Unparseable timestamp ignored. value={}", timestamp);
            }
        }

        log.info("[Manifest] Converted manifest. conditions={} auditHash={}", converted.size(), auditHash);
        return new DesignManifest(auditHash, generatedAt, null, converted);
    }

    private Optional<TrialCondition> condition(String id, JsonNode node) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, TrialCondition.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Manifest] Skipping unreadable condition. id={} reason={}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TrialCondition> legacyCondition(String id, JsonNode spec) {
        Optional<ConditionFields> fields = EmbeddedConditionReader.read(spec);
        if (fields.isEmpty()) return Optional.empty();

        Optional<DecodedIdentifier> decoded = identifierCodec.decode(id);
        Optional<MeasurementSetting> setting = MeasurementSetting.fromCode(EmbeddedConditionReader.text(spec, "axis", "axes"));
        if (setting.isEmpty()) setting = decoded.map(DecodedIdentifier::setting);

        Party subject = fields.get().subject();
        if (subject == null) subject = decoded.map(DecodedIdentifier::subject).orElse(null);

        JsonNode trial = spec.path("trial");
        Integer trialIndex = trial.canConvertToInt() ? Integer.valueOf(trial.asInt())
                                                     : decoded.map(DecodedIdentifier::trialIndex).orElse(null);

        if (setting.isEmpty() || subject == null || trialIndex == null) return Optional.empty();

        ConditionFields f = fields.get();
        String salt = id.substring(id.lastIndexOf('_') + 1);
        return Optional.of(new TrialCondition(f.scenarioId(), f.alpha(), f.beta(), setting.get(),
                                              subject, trialIndex, f.crossType(), salt));
    }
}
