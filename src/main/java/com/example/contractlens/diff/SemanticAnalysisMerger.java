package com.example.contractlens.diff;

import com.example.contractlens.domain.BreakingChangeDetail;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.RiskLevel;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.SemanticAnalysis;
import com.example.contractlens.domain.SemanticAnalysisResponse;
import com.example.contractlens.domain.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines rule-based findings with collaborator output, or synthesizes the analysis
 * payload from the rules alone when the collaborator is unavailable. On merge,
 * rule-based entries come first and win over collaborator entries with the same key.
 */
@Component
public class SemanticAnalysisMerger {

    public List<BreakingChangeDetail> breakingChanges(List<DiffChange> changes) {
        return changes.stream().filter(DiffChange::isBreaking).map(BreakingChangeDetail::from).toList();
    }

    public RiskLevel riskLevel(List<DiffChange> changes, List<SecurityImpact> impacts) {
        if (impacts.stream().anyMatch(impact -> impact.severity() == Severity.CRITICAL)) {
            return RiskLevel.CRITICAL;
        }
        if (impacts.stream().anyMatch(impact -> impact.severity() == Severity.HIGH)) {
            return RiskLevel.HIGH;
        }
        if (changes.stream().anyMatch(DiffChange::isBreaking)) {
            return RiskLevel.MEDIUM;
        }
        return changes.isEmpty() ? RiskLevel.NONE : RiskLevel.LOW;
    }

    public SemanticAnalysis fallback(List<DiffChange> changes, List<SecurityImpact> impacts, String reason) {
        List<BreakingChangeDetail> breaking = breakingChanges(changes);
        String summary = changes.size() + " change(s) detected: " + breaking.size()
                + " breaking. Semantic analysis unavailable, showing rule-based results.";
        return new SemanticAnalysis(
                summary, breaking, impacts, migrationNote(breaking), riskLevel(changes, impacts), true, reason);
    }

    public SemanticAnalysis merge(
            List<DiffChange> changes, List<SecurityImpact> ruleImpacts, SemanticAnalysisResponse response) {
        return new SemanticAnalysis(
                response.summary(),
                mergeBreakingChanges(breakingChanges(changes), response.breakingChanges()),
                mergeSecurityImpacts(ruleImpacts, response.securityImpacts()),
                response.migrationGuide(),
                response.riskLevel(),
                false,
                null);
    }

    /** Keyed by {@code category:name}. */
    public List<BreakingChangeDetail> mergeBreakingChanges(
            List<BreakingChangeDetail> ruleBased, List<BreakingChangeDetail> additional) {
        Set<String> seen = new HashSet<>();
        List<BreakingChangeDetail> merged = new ArrayList<>();
        for (BreakingChangeDetail detail : ruleBased) {
            seen.add(detail.category() + ":" + detail.name());
            merged.add(detail);
        }
        for (BreakingChangeDetail detail : additional) {
            if (seen.add(detail.category() + ":" + detail.name())) {
                merged.add(detail);
            }
        }
        return merged;
    }

    /** Keyed by the change text, ignoring case. */
    public List<SecurityImpact> mergeSecurityImpacts(List<SecurityImpact> ruleBased, List<SecurityImpact> additional) {
        Set<String> seen = new HashSet<>();
        List<SecurityImpact> merged = new ArrayList<>();
        for (SecurityImpact impact : ruleBased) {
            seen.add(changeKey(impact));
            merged.add(impact);
        }
        for (SecurityImpact impact : additional) {
            if (seen.add(changeKey(impact))) {
                merged.add(impact);
            }
        }
        return merged;
    }

    static String migrationNote(List<BreakingChangeDetail> breaking) {
        if (breaking.isEmpty()) {
            return "No migration steps required.";
        }
        return "Review the following breaking changes before upgrading:\n"
                + breaking.stream()
                        .map(detail -> "- " + detail.category() + " \"" + detail.name() + "\": " + detail.reason())
                        .collect(Collectors.joining("\n"));
    }

    private static String changeKey(SecurityImpact impact) {
        return impact.change() == null ? "" : impact.change().toLowerCase(Locale.ROOT);
    }
}
