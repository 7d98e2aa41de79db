package com.example.contractlens.domain;

import java.util.List;

/**
 * What the semantic collaborator receives: both versions with their full sources, the
 * structural change list and the rule-based findings. Excerpting the sources is up to
 * the collaborator.
 */
public record SemanticAnalysisRequest(
        ContractVersion contractA,
        ContractVersion contractB,
        List<DiffChange> changes,
        List<SecurityImpact> securityImpacts) {
    public SemanticAnalysisRequest {
        changes = List.copyOf(changes);
        securityImpacts = List.copyOf(securityImpacts);
    }
}
