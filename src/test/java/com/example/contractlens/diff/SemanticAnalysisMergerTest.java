package com.example.contractlens.diff;

import com.example.contractlens.domain.BreakingChangeDetail;
import com.example.contractlens.domain.ChangeCategory;
import com.example.contractlens.domain.ChangeType;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.Impact;
import com.example.contractlens.domain.RiskLevel;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.SemanticAnalysis;
import com.example.contractlens.domain.SemanticAnalysisResponse;
import com.example.contractlens.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticAnalysisMergerTest {

    private static final DiffChange REMOVED_TRANSFER = new DiffChange(
            ChangeType.REMOVED, ChangeCategory.FUNCTION, "transfer", "function transfer() external nonpayable", null,
            "Function removed: transfer", Impact.BREAKING,
            "Removing a external function breaks existing callers and integrations.");
    private static final DiffChange ADDED_EVENT = new DiffChange(
            ChangeType.ADDED, ChangeCategory.EVENT, "Paused", null, "event Paused()",
            "New event added: Paused", Impact.NON_BREAKING, null);

    private final SemanticAnalysisMerger merger = new SemanticAnalysisMerger();

    @Test
    void riskLevelFollowsSeverityThenBreakingThenAnyChange() {
        SecurityImpact critical = new SecurityImpact("x", "y", Severity.CRITICAL, null);
        SecurityImpact high = new SecurityImpact("x", "y", Severity.HIGH, null);
        SecurityImpact low = new SecurityImpact("x", "y", Severity.LOW, null);

        assertEquals(RiskLevel.CRITICAL, merger.riskLevel(List.of(), List.of(high, critical)));
        assertEquals(RiskLevel.HIGH, merger.riskLevel(List.of(ADDED_EVENT), List.of(high)));
        assertEquals(RiskLevel.MEDIUM, merger.riskLevel(List.of(REMOVED_TRANSFER), List.of(low)));
        assertEquals(RiskLevel.LOW, merger.riskLevel(List.of(ADDED_EVENT), List.of()));
        assertEquals(RiskLevel.NONE, merger.riskLevel(List.of(), List.of()));
    }

    @Test
    void fallbackIsBuiltFromRuleBasedFindings() {
        SemanticAnalysis analysis = merger.fallback(
                List.of(REMOVED_TRANSFER, ADDED_EVENT), List.of(), "Semantic analysis timed out after 10 ms");

        assertTrue(analysis.degraded());
        assertEquals("Semantic analysis timed out after 10 ms", analysis.fallbackReason());
        assertEquals("2 change(s) detected: 1 breaking. Semantic analysis unavailable, showing rule-based results.",
                analysis.summary());
        assertEquals(List.of(BreakingChangeDetail.from(REMOVED_TRANSFER)), analysis.breakingChanges());
        assertEquals(RiskLevel.MEDIUM, analysis.riskLevel());
        assertEquals("""
                Review the following breaking changes before upgrading:
                - function "transfer": Removing a external function breaks existing callers and integrations.""",
                analysis.migrationGuide());
    }

    @Test
    void fallbackWithoutBreakingChangesNeedsNoMigration() {
        SemanticAnalysis analysis = merger.fallback(List.of(ADDED_EVENT), List.of(), "disabled");

        assertEquals("No migration steps required.", analysis.migrationGuide());
        assertEquals(RiskLevel.LOW, analysis.riskLevel());
    }

    @Test
    void mergeKeepsRuleBasedEntriesFirstAndDropsDuplicates() {
        SecurityImpact ruleImpact = new SecurityImpact(
                "Function \"f\" visibility relaxed: internal → public", "rule", Severity.MEDIUM, null);
        SemanticAnalysisResponse response = new SemanticAnalysisResponse(
                "Transfer was removed.",
                List.of(
                        new BreakingChangeDetail("transfer", "function", "model says so", null, null),
                        new BreakingChangeDetail("Approval", "event", "topic changed", null, null)),
                List.of(
                        new SecurityImpact("FUNCTION \"F\" VISIBILITY RELAXED: INTERNAL → PUBLIC", "model",
                                Severity.HIGH, null),
                        new SecurityImpact("Storage layout shifted", "proxy risk", Severity.CRITICAL, "Check slots")),
                "Update integrations.",
                RiskLevel.CRITICAL);

        SemanticAnalysis analysis = merger.merge(List.of(REMOVED_TRANSFER, ADDED_EVENT), List.of(ruleImpact), response);

        assertFalse(analysis.degraded());
        assertEquals("Transfer was removed.", analysis.summary());
        assertThat(analysis.breakingChanges()).extracting(BreakingChangeDetail::name, BreakingChangeDetail::reason)
                .containsExactly(
                        tuple("transfer",
                                "Removing a external function breaks existing callers and integrations."),
                        tuple("Approval", "topic changed"));
        assertThat(analysis.securityImpacts()).extracting(SecurityImpact::impact).containsExactly("rule", "proxy risk");
        assertEquals(RiskLevel.CRITICAL, analysis.riskLevel());
        assertEquals("Update integrations.", analysis.migrationGuide());
    }
}
