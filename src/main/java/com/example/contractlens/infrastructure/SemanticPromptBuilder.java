package com.example.contractlens.infrastructure;

import com.example.contractlens.domain.ContractVersion;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.SemanticAnalysisRequest;

import java.util.Locale;
import java.util.stream.Collectors;

/** Shapes the request sent to the language model. */
public class SemanticPromptBuilder {
    static final String SYSTEM_PROMPT = """
            You are a smart contract security analyst. You analyze differences between two versions of a \
            Solidity contract and provide:
            1. A clear summary of what changed and why it matters
            2. Breaking changes that affect callers/integrators
            3. Security impact analysis
            4. A migration guide for developers who need to update their integrations

            Respond in valid JSON with this exact structure:
            {
              "summary": "Clear 2-3 sentence summary of the changes",
              "breakingChanges": [
                { "name": "functionOrElement", "category": "function|event|variable|modifier", \
            "reason": "Why this breaks compatibility", "before": "old signature", "after": "new signature" }
              ],
              "securityImpacts": [
                { "change": "What changed", "impact": "Why it matters for security", \
            "severity": "critical|high|medium|low|info", "recommendation": "What to do about it" }
              ],
              "migrationGuide": "Step-by-step markdown guide for migrating from version A to B",
              "riskLevel": "critical|high|medium|low|none"
            }""";

    private final int sourceExcerptChars;

    public SemanticPromptBuilder(int sourceExcerptChars) {
        this.sourceExcerptChars = Math.max(0, sourceExcerptChars);
    }

    public String userPrompt(SemanticAnalysisRequest request) {
        String changes = request.changes().stream()
                .map(SemanticPromptBuilder::describe)
                .collect(Collectors.joining("\n\n"));
        String findings = request.securityImpacts().isEmpty()
                ? "No rule-based security impacts detected."
                : request.securityImpacts().stream()
                        .map(SemanticPromptBuilder::describe)
                        .collect(Collectors.joining("\n"));

        return "Compare these two contract versions:\n\n"
                + contractBlock("A", request.contractA())
                + "\n"
                + contractBlock("B", request.contractB())
                + "\nDETECTED CHANGES (" + request.changes().size() + " total):\n"
                + changes
                + "\n\nPRELIMINARY SECURITY ANALYSIS:\n"
                + findings
                + "\n\nAnalyze these changes. Focus on:\n"
                + "1. What is the overall intent of these changes?\n"
                + "2. Are there breaking changes that the rule-based system missed?\n"
                + "3. Are there security implications the rule-based system missed?\n"
                + "4. What should a developer do to migrate from A to B?\n\n"
                + "Respond with valid JSON only.";
    }

    String excerpt(String source) {
        return source.length() <= sourceExcerptChars ? source : source.substring(0, sourceExcerptChars);
    }

    private String contractBlock(String label, ContractVersion contract) {
        return "CONTRACT " + label + ": \"" + contract.name() + "\" at " + contract.address() + "\n"
                + "```solidity\n"
                + excerpt(contract.sourceCode())
                + "\n```\n";
    }

    private static String describe(DiffChange change) {
        StringBuilder text = new StringBuilder("[")
                .append(change.type().label().toUpperCase(Locale.ROOT))
                .append("] ")
                .append(change.category().label())
                .append(": ")
                .append(change.name());
        if (change.before() != null) {
            text.append("\n  Before: ").append(change.before());
        }
        if (change.after() != null) {
            text.append("\n  After:  ").append(change.after());
        }
        text.append("\n  Impact: ").append(change.impact().label());
        if (change.explanation() != null) {
            text.append("\n  Note: ").append(change.explanation());
        }
        return text.toString();
    }

    private static String describe(SecurityImpact impact) {
        return "- [" + impact.severity().label().toUpperCase(Locale.ROOT) + "] " + impact.change() + ": "
                + impact.impact();
    }
}
