package com.judgmentbell.common.design;

import com.judgmentbell.common.model.Language;

import java.util.Optional;
import java.util.Set;

/**
 * Source of localized scenario text. Coverage is intentionally partial: a missing
 * (scenario, language) entry is a normal answer, not an error.
 */
public interface ScenarioCatalog {

    Set<String> scenarioIds();

    Optional<ScenarioContent> content(String scenarioId, Language language);

    /** Prompt template for the language, falling back to English when it has none. */
    Optional<LanguagePack> languagePack(Language language);
}
