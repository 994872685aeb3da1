package com.judgmentbell.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.judgmentbell.analysis.model.ChshRequest;
import com.judgmentbell.analysis.model.CommutatorResponse;
import com.judgmentbell.analysis.model.InterferenceResponse;
import com.judgmentbell.analysis.model.OrderedTrial;
import com.judgmentbell.analysis.model.TimedTrial;
import com.judgmentbell.common.aggregation.AggregationOutcome;
import com.judgmentbell.common.aggregation.CorrelationAggregator;
import com.judgmentbell.common.exception.AnalysisException;
import com.judgmentbell.common.format.DesignManifest;
import com.judgmentbell.common.format.ManifestCodec;
import com.judgmentbell.common.format.ResultSet;
import com.judgmentbell.common.format.ResultSetReader;
import com.judgmentbell.common.model.ChshResult;
import com.judgmentbell.common.model.TrialCondition;
import com.judgmentbell.common.report.ChshReport;
import com.judgmentbell.common.report.ReportBuilder;
import com.judgmentbell.common.report.SourceComparator;
import com.judgmentbell.common.report.SourceComparison;
import com.judgmentbell.common.statistics.ChshCalculator;
import com.judgmentbell.common.statistics.CommutatorAnalyzer;
import com.judgmentbell.common.statistics.CommutatorEffect;
import com.judgmentbell.common.statistics.InterferenceAnalyzer;
import com.judgmentbell.common.statistics.OrderedObservation;
import com.judgmentbell.common.statistics.TimedObservation;
import com.judgmentbell.common.verdict.AnswerPair;
import com.judgmentbell.common.verdict.YesNoAnswerExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the analysis pipeline over submitted result sets:
 * <pre>
 *   manifest + results → CorrelationAggregator → ChshCalculator → ReportBuilder
 * </pre>
 * Each request is one-shot work over a static snapshot; it runs on the bounded elastic
 * scheduler so large result sets never block the event loop.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final ManifestCodec manifestCodec;
    private final ResultSetReader resultSetReader;
    private final CorrelationAggregator aggregator;
    private final ReportBuilder reportBuilder;
    private final SourceComparator sourceComparator;
    private final YesNoAnswerExtractor answerExtractor;

    public AnalysisService(ManifestCodec manifestCodec,
                           ResultSetReader resultSetReader,
                           CorrelationAggregator aggregator,
                           ReportBuilder reportBuilder,
                           SourceComparator sourceComparator,
                           YesNoAnswerExtractor answerExtractor) {
        this.manifestCodec = manifestCodec;
        this.resultSetReader = resultSetReader;
        this.aggregator = aggregator;
        this.reportBuilder = reportBuilder;
        this.sourceComparator = sourceComparator;
        this.answerExtractor = answerExtractor;
    }

    /** Outcome of one result set: raw per-configuration results plus the assembled report. */
    record Analysis(List<ChshResult> results, ChshReport report) {}

    // ── CHSH ─────────────────────────────────────────────────────────────────

    public Mono<ChshReport> chsh(ChshRequest request) {
        return Mono.fromCallable(() -> analyze(request, null).report())
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Analyses every source in parallel, then compares them. Any source that cannot be
     * analysed fails the whole comparison.
     */
    public Mono<SourceComparison> compare(Map<String, ChshRequest> sources) {
        if (sources == null || sources.isEmpty()) {
            return Mono.error(new AnalysisException("SourceComparator", "No sources supplied"));
        }
        log.info("[Analysis] Comparing sources. count={}", sources.size());
        return Flux.fromIterable(sources.entrySet())
            .flatMap(entry -> Mono.fromCallable(() ->
                    Tuples.of(entry.getKey(), analyze(entry.getValue(), entry.getKey()).results()))
                .subscribeOn(Schedulers.boundedElastic()))
            .collectList()
            .map(analysed -> {
                Map<String, List<ChshResult>> bySource = new LinkedHashMap<>();
                analysed.forEach(t -> bySource.put(t.getT1(), t.getT2()));
                return sourceComparator.compare(bySource);
            });
    }

    Analysis analyze(ChshRequest request, String sourceOverride) {
        if (request == null || request.results() == null) {
            throw new AnalysisException("ResultSetReader", "No result set supplied");
        }
        DesignManifest manifest = readManifest(request);
        ResultSet resultSet = resultSetReader.read(request.results());

        String source = sourceOverride != null ? sourceOverride
                      : request.source() != null ? request.source()
                      : resultSet.source();
        Map<String, TrialCondition> conditions = manifest == null ? Map.of() : manifest.conditions();

        AggregationOutcome outcome = aggregator.aggregate(resultSet.entries(), conditions, source);
        List<ChshResult> results = ChshCalculator.compute(outcome.table());
        if (results.isEmpty()) {
            throw new AnalysisException("ChshCalculator",
                "No configurations recovered from " + resultSet.entries().size() + " results; drops=" + outcome.drops());
        }

        ChshReport report = reportBuilder.build(results, outcome, source, manifest == null ? null : manifest.auditHash());
        log.info("[Analysis] CHSH analysis complete. source={} configurations={} violations={} flagged={}",
                 source, results.size(), report.violations(), report.flagged().size());
        return new Analysis(results, report);
    }

    private DesignManifest readManifest(ChshRequest request) {
        if (request.manifest() == null || request.manifest().isNull()) {
            log.debug("[Analysis] No manifest supplied, relying on embedded conditions");
            return null;
        }
        try {
            return manifestCodec.read(request.manifest());
        } catch (JsonProcessingException e) {
            throw new AnalysisException("ManifestCodec", "Manifest unreadable: " + e.getOriginalMessage(), e);
        }
    }

    // ── variants ─────────────────────────────────────────────────────────────

    public Mono<CommutatorResponse> commutator(List<OrderedTrial> trials) {
        return Mono.fromCallable(() -> {
            List<OrderedObservation> observations = new ArrayList<>();
            int unresolved = 0;
            for (OrderedTrial trial : trials == null ? List.<OrderedTrial>of() : trials) {
                Optional<AnswerPair> answers = answers(trial);
                if (answers.isEmpty()) {
                    unresolved++;
                    continue;
                }
                observations.add(new OrderedObservation(trial.scenarioId(), trial.firstAxis(), trial.secondAxis(),
                                                        answers.get().first(), answers.get().second()));
            }
            List<CommutatorEffect> effects = CommutatorAnalyzer.analyze(observations);
            boolean significant = effects.stream().anyMatch(CommutatorEffect::significant);
            log.info("[Analysis] Commutator analysis complete. used={} unresolved={} effects={} significant={}",
                     observations.size(), unresolved, effects.size(), significant);
            return new CommutatorResponse(effects, observations.size(), unresolved, significant);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<InterferenceResponse> interference(List<TimedTrial> trials) {
        return Mono.fromCallable(() -> {
            List<TimedObservation> observations = new ArrayList<>();
            int unresolved = 0;
            for (TimedTrial trial : trials == null ? List.<TimedTrial>of() : trials) {
                Optional<Boolean> answer = trial.answer() != null
                    ? Optional.of(trial.answer())
                    : answerExtractor.extractSingle(trial.raw());
                if (answer.isEmpty() || trial.timing() == null) {
                    unresolved++;
                    continue;
                }
                observations.add(new TimedObservation(trial.scenarioId(), trial.axis(), trial.timing(), answer.get()));
            }
            InterferenceResponse response =
                new InterferenceResponse(InterferenceAnalyzer.analyze(observations), observations.size(), unresolved);
            log.info("[Analysis] Interference analysis complete. used={} unresolved={} detected={}",
                     observations.size(), unresolved, response.report().detected());
            return response;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Optional<AnswerPair> answers(OrderedTrial trial) {
        if (trial.firstAnswer() != null && trial.secondAnswer() != null) {
            return Optional.of(new AnswerPair(trial.firstAnswer(), trial.secondAnswer()));
        }
        return answerExtractor.extractPair(trial.raw());
    }
}
