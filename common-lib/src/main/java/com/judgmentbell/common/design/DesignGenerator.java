package com.judgmentbell.common.design;

import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.model.CrossType;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;
import com.judgmentbell.common.model.TrialCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Enumerates the full trial set of a Bell-test design.
 *
 * <h3>Configurations</h3>
 * <ul>
 *   <li><b>mono</b>: every language × tense, both parties identical</li>
 *   <li><b>xlang</b>: every declared language pair × tense</li>
 *   <li><b>xtemp</b>: every declared tense pair × language</li>
 *   <li><b>xdim</b>: every declared (language, tense) frame pair</li>
 *   <li><b>xmodel</b>: every declared source pair × language × tense</li>
 * </ul>
 * Party A receives the first element of a pair and party B the second.
 *
 * <h3>Requests</h3>
 * For each configuration and scenario: trial index × axis pair × party, one request each.
 * The judged party is questioned on its own axis of the pair and sees the scenario in its
 * own language and tense.
 *
 * <p>A (scenario, configuration) combination whose scenario lacks text in either party's
 * language, or whose text or template is incomplete, is skipped silently and counted in
 * {@link TrialDesign#skippedConfigurations()}.
 */
public class DesignGenerator {

    private static final Logger log = LoggerFactory.getLogger(DesignGenerator.class);

    static final int MAX_SALT_ATTEMPTS = 16;

    private final ScenarioCatalog catalog;
    private final TrialIdentifierCodec codec;
    private final Supplier<String> saltSource;

    public DesignGenerator(ScenarioCatalog catalog, TrialIdentifierCodec codec) {
        this(catalog, codec, TrialIdentifierCodec.randomSalt());
    }

    public DesignGenerator(ScenarioCatalog catalog, TrialIdentifierCodec codec, Supplier<String> saltSource) {
        this.catalog = catalog;
        this.codec = codec;
        this.saltSource = saltSource;
    }

    public TrialDesign generate(DesignParameters params) {
        Emitter emitter = new Emitter(params);

        for (String scenario : params.scenarioIds()) {
            if (params.includeMono()) {
                for (Language language : params.languages()) {
                    for (Tense tense : params.tenses()) {
                        PartyFrame frame = new PartyFrame(language, tense);
                        emitter.emit(scenario, frame, frame, CrossType.MONO);
                    }
                }
            }
            for (DimensionPair<Language> pair : params.crossLingual()) {
                for (Tense tense : params.tenses()) {
                    emitter.emit(scenario, new PartyFrame(pair.first(), tense),
                                 new PartyFrame(pair.second(), tense), CrossType.CROSS_LINGUAL);
                }
            }
            for (DimensionPair<Tense> pair : params.crossTemporal()) {
                for (Language language : params.languages()) {
                    emitter.emit(scenario, new PartyFrame(language, pair.first()),
                                 new PartyFrame(language, pair.second()), CrossType.CROSS_TEMPORAL);
                }
            }
            for (DimensionPair<PartyFrame> pair : params.crossDimensional()) {
                emitter.emit(scenario, pair.first(), pair.second(), CrossType.CROSS_DIMENSIONAL);
            }
            for (DimensionPair<String> pair : params.crossModel()) {
                for (Language language : params.languages()) {
                    for (Tense tense : params.tenses()) {
                        emitter.emit(scenario, new PartyFrame(language, tense, pair.first()),
                                     new PartyFrame(language, tense, pair.second()), CrossType.CROSS_MODEL);
                    }
                }
            }
        }

        String auditHash = AuditHash.compute(params.trialCount(), params.scenarioIds(), emitter.requests.size());
        log.info("[DesignGenerator] Design generated. requests={} skipped={} auditHash={}",
                 emitter.requests.size(), emitter.skipped, auditHash);
        return new TrialDesign(auditHash, params, emitter.requests, emitter.skipped);
    }

    /** Accumulates requests for one generation run and enforces identifier uniqueness. */
    private final class Emitter {

        private final DesignParameters params;
        private final List<TrialRequest> requests = new ArrayList<>();
        private final Set<String> identifiers = new HashSet<>();
        private int skipped;

        Emitter(DesignParameters params) {
            this.params = params;
        }

        void emit(String scenario, PartyFrame alpha, PartyFrame beta, CrossType crossType) {
            Optional<ScenarioContent> alphaText = catalog.content(scenario, alpha.language())
                .filter(ScenarioContent::isComplete);
            Optional<ScenarioContent> betaText = catalog.content(scenario, beta.language())
                .filter(ScenarioContent::isComplete);
            Optional<LanguagePack> alphaPack = catalog.languagePack(alpha.language())
                .filter(LanguagePack::isComplete);
            Optional<LanguagePack> betaPack = catalog.languagePack(beta.language())
                .filter(LanguagePack::isComplete);
            if (alphaText.isEmpty() || betaText.isEmpty() || alphaPack.isEmpty() || betaPack.isEmpty()) {
                skipped++;
                log.debug("[DesignGenerator] Missing localization, skipped. scenario={} alpha={} beta={}",
                          scenario, alpha, beta);
                return;
            }

            for (int trial = 0; trial < params.trialCount(); trial++) {
                for (MeasurementSetting setting : MeasurementSetting.values()) {
                    for (Party subject : Party.values()) {
                        boolean isAlpha = subject == Party.ALPHA;
                        PartyFrame frame = isAlpha ? alpha : beta;
                        ScenarioContent text = isAlpha ? alphaText.get() : betaText.get();
                        LanguagePack pack = isAlpha ? alphaPack.get() : betaPack.get();

                        TrialCondition condition = uniqueCondition(
                            scenario, alpha, beta, setting, subject, trial, crossType);
                        String prompt = PromptRenderer.render(
                            pack, text, frame.tense(), setting.axisFor(subject), subject);
                        String source = frame.source() != null ? frame.source() : params.defaultSource();

                        requests.add(new TrialRequest(codec.encode(condition), prompt, source, condition));
                    }
                }
            }
        }

        private TrialCondition uniqueCondition(String scenario, PartyFrame alpha, PartyFrame beta,
                                               MeasurementSetting setting, Party subject,
                                               int trial, CrossType crossType) {
            for (int attempt = 0; attempt < MAX_SALT_ATTEMPTS; attempt++) {
                TrialCondition condition = new TrialCondition(
                    scenario, alpha, beta, setting, subject, trial, crossType, saltSource.get());
                if (identifiers.add(codec.encode(condition))) {
                    return condition;
                }
            }
            throw new IllegalStateException("Salt source keeps producing duplicate identifiers for scenario "
                                            + scenario);
        }
    }
}
