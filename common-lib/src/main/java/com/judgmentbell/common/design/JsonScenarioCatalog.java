package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ScenarioCatalog} read from a JSON document:
 * <pre>
 * {
 *   "languages": { "en": { "template": "...", "tenseMarkers": { "past": "..." } } },
 *   "scenarios": { "trolley_standoff": { "en": { "title", "content", "primary", "secondary" } } }
 * }
 * </pre>
 * Entries under unknown language codes are ignored with a warning.
 */
public class JsonScenarioCatalog implements ScenarioCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonScenarioCatalog.class);

    record CatalogDocument(
        @JsonProperty("languages") Map<String, LanguagePack> languages,
        @JsonProperty("scenarios") Map<String, Map<String, ScenarioContent>> scenarios
    ) {}

    private final Map<Language, LanguagePack> languages;
    private final Map<String, Map<Language, ScenarioContent>> scenarios;

    JsonScenarioCatalog(Map<Language, LanguagePack> languages,
                        Map<String, Map<Language, ScenarioContent>> scenarios) {
        this.languages = languages;
        this.scenarios = scenarios;
    }

    public static JsonScenarioCatalog load(InputStream in, ObjectMapper objectMapper) throws IOException {
        CatalogDocument doc = objectMapper.readValue(in, CatalogDocument.class);

        Map<Language, LanguagePack> languages = new EnumMap<>(Language.class);
        if (doc.languages() != null) {
            doc.languages().forEach((code, pack) -> Language.fromCode(code).ifPresentOrElse(
                lang -> languages.put(lang, pack),
                () -> log.warn("[Catalog] Ignoring template for unknown language. code={}", code)));
        }

        Map<String, Map<Language, ScenarioContent>> scenarios = new LinkedHashMap<>();
        if (doc.scenarios() != null) {
            doc.scenarios().forEach((id, perLanguage) -> {
                Map<Language, ScenarioContent> localized = new EnumMap<>(Language.class);
                perLanguage.forEach((code, content) -> Language.fromCode(code).ifPresentOrElse(
                    lang -> localized.put(lang, content),
                    () -> log.warn("[Catalog] Ignoring scenario text for unknown language. scenario={} code={}",
                                   id, code)));
                scenarios.put(id, Collections.unmodifiableMap(localized));
            });
        }

        log.info("[Catalog] Loaded. scenarios={} languages={}", scenarios.size(), languages.keySet());
        return new JsonScenarioCatalog(Collections.unmodifiableMap(languages),
                                       Collections.unmodifiableMap(scenarios));
    }

    @Override
    public Set<String> scenarioIds() {
        return scenarios.keySet();
    }

    @Override
    public Optional<ScenarioContent> content(String scenarioId, Language language) {
        Map<Language, ScenarioContent> localized = scenarios.get(scenarioId);
        return localized == null ? Optional.empty() : Optional.ofNullable(localized.get(language));
    }

    @Override
    public Optional<LanguagePack> languagePack(Language language) {
        LanguagePack pack = languages.get(language);
        if (pack == null) pack = languages.get(Language.ENGLISH);
        return Optional.ofNullable(pack);
    }
}
