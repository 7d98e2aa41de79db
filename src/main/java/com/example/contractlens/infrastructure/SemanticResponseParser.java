package com.example.contractlens.infrastructure;

import com.example.contractlens.application.CollaboratorFailureException;
import com.example.contractlens.domain.BreakingChangeDetail;
import com.example.contractlens.domain.RiskLevel;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.SemanticAnalysisResponse;
import com.example.contractlens.domain.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the model's JSON answer. The JSON may be wrapped in a Markdown code fence.
 * Missing fields fall back to defaults; text that is not a JSON object is rejected.
 */
public class SemanticResponseParser {
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private final ObjectMapper objectMapper;

    public SemanticResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    public SemanticAnalysisResponse parse(String responseText) throws CollaboratorFailureException {
        String text = responseText == null ? "" : responseText;
        Matcher fenced = FENCED_BLOCK.matcher(text);
        String json = (fenced.find() ? fenced.group(1) : text).trim();

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.MALFORMED_RESPONSE,
                    "Semantic analysis response is not valid JSON: " + e.getOriginalMessage(),
                    e);
        }
        if (root == null || !root.isObject()) {
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.MALFORMED_RESPONSE,
                    "Semantic analysis response is not a JSON object");
        }

        List<BreakingChangeDetail> breakingChanges = new ArrayList<>();
        for (JsonNode node : arrayOrEmpty(root.get("breakingChanges"))) {
            breakingChanges.add(new BreakingChangeDetail(
                    text(node, "name"), text(node, "category"), text(node, "reason"),
                    text(node, "before"), text(node, "after")));
        }
        List<SecurityImpact> securityImpacts = new ArrayList<>();
        for (JsonNode node : arrayOrEmpty(root.get("securityImpacts"))) {
            securityImpacts.add(new SecurityImpact(
                    text(node, "change"),
                    text(node, "impact"),
                    Severity.fromLabel(text(node, "severity")),
                    text(node, "recommendation")));
        }
        return new SemanticAnalysisResponse(
                text(root, "summary"),
                breakingChanges,
                securityImpacts,
                text(root, "migrationGuide"),
                RiskLevel.fromLabel(text(root, "riskLevel")));
    }

    private static Iterable<JsonNode> arrayOrEmpty(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
