package com.example.contractlens.infrastructure;

import com.example.contractlens.application.CollaboratorFailureException;
import com.example.contractlens.application.ComparisonCache;
import com.example.contractlens.application.SemanticAnalyzer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ContractLensProperties.class)
public class ContractLensConfiguration {
    private static final Logger log = LogManager.getLogger(ContractLensConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ComparisonCache comparisonCache(ContractLensProperties properties, Clock clock) {
        return new ComparisonCache(clock, properties.getCache().getTtl(), properties.getCache().getMaxEntries());
    }

    /**
     * Uses the application's {@link ObjectMapper} and {@link RestClient.Builder} so the
     * semantic client shares the JSON settings of the web layer.
     */
    @Bean
    public SemanticAnalyzer semanticAnalyzer(
            ContractLensProperties properties, RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        ContractLensProperties.Semantic semantic = properties.getSemantic();
        if (!semantic.isEnabled()) {
            log.info("Semantic analysis disabled, comparisons use rule-based results only");
            return new NoOpSemanticAnalyzer(CollaboratorFailureException.Reason.DISABLED);
        }
        if (semantic.getApiKey() == null || semantic.getApiKey().isBlank()) {
            log.warn("Semantic analysis enabled but no API key configured, comparisons use rule-based results only");
            return new NoOpSemanticAnalyzer(CollaboratorFailureException.Reason.MISSING_CREDENTIALS);
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) semantic.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) semantic.getTimeout().toMillis());
        log.info("Semantic analysis enabled with model {}", semantic.getModel());
        return new AnthropicSemanticAnalyzer(
                restClientBuilder.requestFactory(requestFactory),
                semantic,
                new SemanticPromptBuilder(semantic.getSourceExcerptChars()),
                new SemanticResponseParser(objectMapper));
    }
}
