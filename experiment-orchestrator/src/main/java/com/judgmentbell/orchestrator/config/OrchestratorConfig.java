package com.judgmentbell.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.design.DesignGenerator;
import com.judgmentbell.common.design.JsonScenarioCatalog;
import com.judgmentbell.common.design.ScenarioCatalog;
import com.judgmentbell.common.format.JsonSupport;
import com.judgmentbell.common.verdict.VerdictExtractor;
import com.judgmentbell.orchestrator.oracle.AnthropicBatchOracle;
import com.judgmentbell.orchestrator.oracle.JudgmentOracle;
import com.judgmentbell.orchestrator.oracle.RuleBasedOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${oracle.anthropic.api-key:}")
    private String apiKey;

    @Value("${oracle.anthropic.max-tokens:200}")
    private int maxTokens;

    @Value("${oracle.anthropic.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${oracle.default-source:sonnet}")
    private String defaultSource;

    @Value("${oracle.rules.max-retained-batches:64}")
    private int maxRetainedBatches;

    @Value("${experiment.catalog-location:classpath:catalog/scenarios.json}")
    private String catalogLocation;

    @Bean
    public ObjectMapper objectMapper() {
        return JsonSupport.newObjectMapper();
    }

    @Bean
    public ScenarioCatalog scenarioCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper) throws IOException {
        try (InputStream in = resourceLoader.getResource(catalogLocation).getInputStream()) {
            JsonScenarioCatalog catalog = JsonScenarioCatalog.load(in, objectMapper);
            log.info("Scenario catalog loaded. location={} scenarios={}", catalogLocation, catalog.scenarioIds().size());
            return catalog;
        }
    }

    @Bean
    public TrialIdentifierCodec trialIdentifierCodec() {
        return new TrialIdentifierCodec();
    }

    @Bean
    public DesignGenerator designGenerator(ScenarioCatalog scenarioCatalog, TrialIdentifierCodec codec) {
        return new DesignGenerator(scenarioCatalog, codec);
    }

    @Bean
    public VerdictExtractor verdictExtractor(ObjectMapper objectMapper) {
        return new VerdictExtractor(objectMapper);
    }

    /** Anthropic batches when a key is configured; otherwise the deterministic rule-based oracle. */
    @Bean
    public JudgmentOracle judgmentOracle(WebClient anthropicWebClient, ObjectMapper objectMapper) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("oracle.anthropic.api-key is not set; using the rule-based oracle");
            return new RuleBasedOracle(objectMapper, maxRetainedBatches);
        }
        return new AnthropicBatchOracle(anthropicWebClient, objectMapper, apiKey, maxTokens,
                                        Duration.ofMillis(timeoutMs), defaultSource);
    }
}
