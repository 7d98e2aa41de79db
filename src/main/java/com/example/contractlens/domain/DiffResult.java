package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Outcome of comparing two contract versions. {@code semanticAnalysis} is only set by
 * the enriched comparison.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffResult {
    private ContractVersion contractA;
    private ContractVersion contractB;
    private List<DiffChange> changes;
    private DiffSummary summary;
    private DiffStats stats;
    private List<SecurityImpact> securityImpacts;
    private List<DiffLine> textDiff;
    private String unifiedDiff;
    private SemanticAnalysis semanticAnalysis;
    private ComparisonTiming timing;

    public DiffResult(
            ContractVersion contractA,
            ContractVersion contractB,
            List<DiffChange> changes,
            DiffSummary summary,
            DiffStats stats) {
        this.contractA = contractA;
        this.contractB = contractB;
        this.changes = changes;
        this.summary = summary;
        this.stats = stats;
    }
}
