package com.example.contractlens.infrastructure;

import com.example.contractlens.application.CollaboratorFailureException;
import com.example.contractlens.application.SemanticAnalyzer;
import com.example.contractlens.domain.SemanticAnalysisRequest;
import com.example.contractlens.domain.SemanticAnalysisResponse;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/** Semantic analysis through the Anthropic Messages API. */
public class AnthropicSemanticAnalyzer implements SemanticAnalyzer {
    private static final Logger log = LogManager.getLogger(AnthropicSemanticAnalyzer.class);

    static final String API_VERSION = "2023-06-01";

    private final RestClient restClient;
    private final ContractLensProperties.Semantic settings;
    private final SemanticPromptBuilder promptBuilder;
    private final SemanticResponseParser responseParser;

    public AnthropicSemanticAnalyzer(
            RestClient.Builder restClientBuilder,
            ContractLensProperties.Semantic settings,
            SemanticPromptBuilder promptBuilder,
            SemanticResponseParser responseParser) {
        this.restClient = restClientBuilder
                .baseUrl(settings.getBaseUrl())
                .defaultHeader("x-api-key", settings.getApiKey())
                .defaultHeader("anthropic-version", API_VERSION)
                .build();
        this.settings = settings;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
    }

    SemanticResponseParser responseParser() {
        return responseParser;
    }

    @Override
    public SemanticAnalysisResponse analyze(SemanticAnalysisRequest request) throws CollaboratorFailureException {
        Map<String, Object> body = Map.of(
                "model", settings.getModel(),
                "max_tokens", settings.getMaxTokens(),
                "system", SemanticPromptBuilder.SYSTEM_PROMPT,
                "messages", List.of(Map.of("role", "user", "content", promptBuilder.userPrompt(request))));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.TRANSPORT,
                    "Semantic analysis request failed: " + e.getMessage(),
                    e);
        }
        if (response == null) {
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.MALFORMED_RESPONSE, "Semantic analysis returned no body");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        log.debug("Semantic analysis returned {} characters", text.length());
        return responseParser.parse(text.toString());
    }
}
