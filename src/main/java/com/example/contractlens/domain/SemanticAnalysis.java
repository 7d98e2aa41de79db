package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Analysis payload attached to a diff result. When {@code degraded} is set the
 * payload was synthesized from the rule-based findings alone and
 * {@code fallbackReason} says why.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SemanticAnalysis(
        String summary,
        List<BreakingChangeDetail> breakingChanges,
        List<SecurityImpact> securityImpacts,
        String migrationGuide,
        RiskLevel riskLevel,
        boolean degraded,
        String fallbackReason) {
    public SemanticAnalysis {
        breakingChanges = List.copyOf(breakingChanges);
        securityImpacts = List.copyOf(securityImpacts);
    }
}
