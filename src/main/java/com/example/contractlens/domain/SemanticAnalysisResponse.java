package com.example.contractlens.domain;

import java.util.List;

/** What the semantic collaborator returns before it is merged with rule-based findings. */
public record SemanticAnalysisResponse(
        String summary,
        List<BreakingChangeDetail> breakingChanges,
        List<SecurityImpact> securityImpacts,
        String migrationGuide,
        RiskLevel riskLevel) {
    public SemanticAnalysisResponse {
        summary = summary == null || summary.isBlank() ? "Analysis complete." : summary;
        breakingChanges = breakingChanges == null ? List.of() : List.copyOf(breakingChanges);
        securityImpacts = securityImpacts == null ? List.of() : List.copyOf(securityImpacts);
        migrationGuide = migrationGuide == null ? "" : migrationGuide;
        riskLevel = riskLevel == null ? RiskLevel.LOW : riskLevel;
    }
}
