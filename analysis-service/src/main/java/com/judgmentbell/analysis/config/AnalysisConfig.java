package com.judgmentbell.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.aggregation.CorrelationAggregator;
import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.format.JsonSupport;
import com.judgmentbell.common.format.ManifestCodec;
import com.judgmentbell.common.format.ResultSetReader;
import com.judgmentbell.common.report.ReportBuilder;
import com.judgmentbell.common.report.SourceComparator;
import com.judgmentbell.common.verdict.VerdictExtractor;
import com.judgmentbell.common.verdict.YesNoAnswerExtractor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    @Value("${analysis.significance-threshold:3.0}")
    private double significanceThreshold;

    @Value("${analysis.consistency-threshold:0.25}")
    private double consistencyThreshold;

    @Bean
    public ObjectMapper objectMapper() {
        return JsonSupport.newObjectMapper();
    }

    @Bean
    public TrialIdentifierCodec trialIdentifierCodec() {
        return new TrialIdentifierCodec();
    }

    @Bean
    public ManifestCodec manifestCodec(ObjectMapper objectMapper, TrialIdentifierCodec codec) {
        return new ManifestCodec(objectMapper, codec);
    }

    @Bean
    public ResultSetReader resultSetReader(ObjectMapper objectMapper) {
        return new ResultSetReader(objectMapper, new VerdictExtractor(objectMapper));
    }

    @Bean
    public YesNoAnswerExtractor yesNoAnswerExtractor(ObjectMapper objectMapper) {
        return new YesNoAnswerExtractor(objectMapper);
    }

    @Bean
    public CorrelationAggregator correlationAggregator(TrialIdentifierCodec codec) {
        return new CorrelationAggregator(codec);
    }

    @Bean
    public ReportBuilder reportBuilder() {
        return new ReportBuilder(significanceThreshold);
    }

    @Bean
    public SourceComparator sourceComparator() {
        return new SourceComparator(consistencyThreshold);
    }
}
