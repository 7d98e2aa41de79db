package com.example.contractlens.diff;

import com.example.contractlens.domain.ChangeCategory;
import com.example.contractlens.domain.ChangeType;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.ExternalCall;
import com.example.contractlens.domain.FunctionInfo;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.Severity;
import com.example.contractlens.domain.Visibility;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-based security findings over a structural change list. Every rule runs
 * independently, so a single change can produce several findings.
 */
@Component
public class ImpactClassifier {

    public List<SecurityImpact> classifySecurityImpacts(List<DiffChange> changes, ContractModel a, ContractModel b) {
        List<SecurityImpact> impacts = new ArrayList<>();
        removedModifiersInUse(changes, a, impacts);
        relaxedVisibility(changes, impacts);
        newExternalCalls(a, b, impacts);
        escalatedMutability(changes, impacts);
        removedEvents(changes, impacts);
        return impacts;
    }

    private static void removedModifiersInUse(List<DiffChange> changes, ContractModel a, List<SecurityImpact> impacts) {
        for (DiffChange change : changes) {
            if (change.category() != ChangeCategory.MODIFIER || change.type() != ChangeType.REMOVED) {
                continue;
            }
            List<String> users = a.functions().stream()
                    .filter(function -> function.modifiers().contains(change.name()))
                    .map(FunctionInfo::key)
                    .toList();
            if (!users.isEmpty()) {
                impacts.add(new SecurityImpact(
                        "Modifier \"" + change.name() + "\" removed",
                        users.size() + " function(s) used this modifier: " + String.join(", ", users)
                                + ". Access control may be weakened.",
                        Severity.HIGH,
                        "Verify that equivalent access control is maintained through other means."));
            }
        }
    }

    private static void relaxedVisibility(List<DiffChange> changes, List<SecurityImpact> impacts) {
        for (DiffChange change : modifiedFunctions(changes)) {
            Visibility before = Visibility.fromKeyword(CanonicalSignatures.visibilityOf(change.before()));
            Visibility after = Visibility.fromKeyword(CanonicalSignatures.visibilityOf(change.after()));
            if (after.isRelaxedComparedTo(before)) {
                impacts.add(new SecurityImpact(
                        "Function \"" + change.name() + "\" visibility relaxed: " + before.keyword() + " → "
                                + after.keyword(),
                        "Function is now callable by external parties, increasing attack surface.",
                        Severity.MEDIUM,
                        "Ensure proper access control modifiers are in place."));
            }
        }
    }

    private static void newExternalCalls(ContractModel a, ContractModel b, List<SecurityImpact> impacts) {
        NamedIndex<FunctionInfo> functionsA = NamedIndex.of(a.functions());
        for (FunctionInfo after : NamedIndex.of(b.functions()).values()) {
            FunctionInfo before = functionsA.get(after.key());
            if (before == null || after.externalCalls().size() <= before.externalCalls().size()) {
                continue;
            }
            Set<ExternalCall> known = new HashSet<>(before.externalCalls());
            List<ExternalCall> introduced = after.externalCalls().stream()
                    .filter(call -> !known.contains(call))
                    .toList();
            if (!introduced.isEmpty()) {
                impacts.add(new SecurityImpact(
                        "Function \"" + after.key() + "\" has " + introduced.size() + " new external call(s)",
                        "New external calls to: "
                                + introduced.stream().map(ExternalCall::toString).collect(Collectors.joining(", "))
                                + ". May introduce reentrancy or trust assumptions.",
                        Severity.MEDIUM,
                        "Review external call ordering and consider reentrancy guards."));
            }
        }
    }

    private static void escalatedMutability(List<DiffChange> changes, List<SecurityImpact> impacts) {
        for (DiffChange change : modifiedFunctions(changes)) {
            String before = CanonicalSignatures.mutabilityOf(change.before());
            String after = CanonicalSignatures.mutabilityOf(change.after());
            boolean wasReadOnly = before.equals("view") || before.equals("pure");
            boolean writes = after.equals("nonpayable") || after.equals("payable");
            if (wasReadOnly && writes) {
                impacts.add(new SecurityImpact(
                        "Function \"" + change.name() + "\" mutability changed: " + before + " → " + after,
                        "Function can now modify state or accept ETH, changing its trust model.",
                        after.equals("payable") ? Severity.HIGH : Severity.MEDIUM,
                        "Review all callers and ensure the state changes are intentional."));
            }
        }
    }

    private static void removedEvents(List<DiffChange> changes, List<SecurityImpact> impacts) {
        List<String> removed = changes.stream()
                .filter(change -> change.category() == ChangeCategory.EVENT && change.type() == ChangeType.REMOVED)
                .map(DiffChange::name)
                .toList();
        if (!removed.isEmpty()) {
            impacts.add(new SecurityImpact(
                    removed.size() + " event(s) removed: " + String.join(", ", removed),
                    "Off-chain monitoring and audit trails may be disrupted.",
                    Severity.LOW,
                    "Ensure alternative monitoring mechanisms are in place."));
        }
    }

    private static List<DiffChange> modifiedFunctions(List<DiffChange> changes) {
        return changes.stream()
                .filter(change -> change.category() == ChangeCategory.FUNCTION
                        && change.type() == ChangeType.MODIFIED
                        && change.before() != null
                        && change.after() != null)
                .toList();
    }
}
