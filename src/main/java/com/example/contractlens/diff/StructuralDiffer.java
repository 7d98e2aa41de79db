package com.example.contractlens.diff;

import com.example.contractlens.domain.ChangeCategory;
import com.example.contractlens.domain.ChangeType;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.EventInfo;
import com.example.contractlens.domain.FunctionInfo;
import com.example.contractlens.domain.Impact;
import com.example.contractlens.domain.ImportInfo;
import com.example.contractlens.domain.ModifierInfo;
import com.example.contractlens.domain.Parameter;
import com.example.contractlens.domain.VariableInfo;
import com.example.contractlens.domain.Visibility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Compares two contract models category by category. Each category reports its
 * additions, then removals, then modifications. A comparator that fails contributes no
 * changes while the others still run.
 */
@Component
public class StructuralDiffer {
    private static final Logger log = LogManager.getLogger(StructuralDiffer.class);

    public List<DiffChange> diffModels(ContractModel a, ContractModel b) {
        List<DiffChange> changes = new ArrayList<>();
        changes.addAll(guarded(ChangeCategory.FUNCTION, () -> compareFunctions(a.functions(), b.functions())));
        changes.addAll(guarded(ChangeCategory.EVENT, () -> compareEvents(a.events(), b.events())));
        changes.addAll(guarded(ChangeCategory.VARIABLE, () -> compareVariables(a.variables(), b.variables())));
        changes.addAll(guarded(ChangeCategory.MODIFIER, () -> compareModifiers(a.modifiers(), b.modifiers())));
        changes.addAll(guarded(ChangeCategory.IMPORT, () -> compareImports(a.imports(), b.imports())));
        changes.addAll(guarded(
                ChangeCategory.INHERITANCE,
                () -> compareInheritance(a.inheritedContracts(), b.inheritedContracts())));
        return changes;
    }

    private List<DiffChange> guarded(ChangeCategory category, Supplier<List<DiffChange>> comparator) {
        try {
            return comparator.get();
        } catch (RuntimeException e) {
            log.error("Comparing {} declarations failed, reporting no {} changes", category.label(), category.label(), e);
            return List.of();
        }
    }

    List<DiffChange> compareFunctions(List<FunctionInfo> functionsA, List<FunctionInfo> functionsB) {
        NamedIndex<FunctionInfo> indexA = indexed(ChangeCategory.FUNCTION, NamedIndex.of(functionsA));
        NamedIndex<FunctionInfo> indexB = indexed(ChangeCategory.FUNCTION, NamedIndex.of(functionsB));
        List<DiffChange> changes = new ArrayList<>();

        for (Map.Entry<String, FunctionInfo> entry : indexB.entries()) {
            if (!indexA.contains(entry.getKey())) {
                changes.add(new DiffChange(
                        ChangeType.ADDED,
                        ChangeCategory.FUNCTION,
                        entry.getKey(),
                        null,
                        CanonicalSignatures.functionSignature(entry.getValue()),
                        "New function added: " + entry.getKey(),
                        Impact.NON_BREAKING,
                        null));
            }
        }

        for (Map.Entry<String, FunctionInfo> entry : indexA.entries()) {
            if (!indexB.contains(entry.getKey())) {
                FunctionInfo function = entry.getValue();
                boolean callable = function.visibility().isExternallyCallable();
                String visibility = function.visibility().keyword();
                changes.add(new DiffChange(
                        ChangeType.REMOVED,
                        ChangeCategory.FUNCTION,
                        entry.getKey(),
                        CanonicalSignatures.functionSignature(function),
                        null,
                        "Function removed: " + entry.getKey(),
                        Impact.of(callable),
                        callable
                                ? "Removing a " + visibility + " function breaks existing callers and integrations."
                                : "Removing a " + visibility + " function has no external impact."));
            }
        }

        for (Map.Entry<String, FunctionInfo> entry : indexA.entries()) {
            FunctionInfo before = entry.getValue();
            FunctionInfo after = indexB.get(entry.getKey());
            if (after == null
                    || CanonicalSignatures.canonicalFunction(before).equals(CanonicalSignatures.canonicalFunction(after))) {
                continue;
            }
            changes.add(functionModified(entry.getKey(), before, after));
        }
        return changes;
    }

    private DiffChange functionModified(String key, FunctionInfo before, FunctionInfo after) {
        boolean parameterTypesChanged = !CanonicalSignatures.typeSequence(before.parameters())
                .equals(CanonicalSignatures.typeSequence(after.parameters()));
        boolean returnTypesChanged = !CanonicalSignatures.typeSequence(before.returns())
                .equals(CanonicalSignatures.typeSequence(after.returns()));
        boolean namesChanged = !parameterTypesChanged
                && !returnTypesChanged
                && !(names(before.parameters()).equals(names(after.parameters()))
                        && names(before.returns()).equals(names(after.returns())));
        boolean visibilityChanged = before.visibility() != after.visibility();
        boolean mutabilityChanged = before.mutability() != after.mutability();
        boolean modifiersChanged = !before.modifiers().equals(after.modifiers());

        boolean callable = before.visibility().isExternallyCallable() || after.visibility().isExternallyCallable();
        boolean breaking =
                callable && (parameterTypesChanged || returnTypesChanged || visibilityChanged || mutabilityChanged);

        List<String> reasons = new ArrayList<>();
        if (parameterTypesChanged) {
            reasons.add("parameters changed");
        }
        if (returnTypesChanged) {
            reasons.add("return type changed");
        }
        if (namesChanged) {
            reasons.add("parameter names changed");
        }
        if (visibilityChanged) {
            reasons.add("visibility: " + before.visibility().keyword() + " → " + after.visibility().keyword());
        }
        if (mutabilityChanged) {
            reasons.add("mutability: " + before.mutability().keyword() + " → " + after.mutability().keyword());
        }
        if (modifiersChanged) {
            reasons.add("modifiers changed");
        }

        return new DiffChange(
                ChangeType.MODIFIED,
                ChangeCategory.FUNCTION,
                key,
                CanonicalSignatures.functionSignature(before),
                CanonicalSignatures.functionSignature(after),
                "Function modified: " + key + " (" + String.join(", ", reasons) + ")",
                Impact.of(breaking),
                breaking ? "Changing the signature of a public function breaks ABI compatibility." : null);
    }

    List<DiffChange> compareEvents(List<EventInfo> eventsA, List<EventInfo> eventsB) {
        NamedIndex<EventInfo> indexA = indexed(ChangeCategory.EVENT, NamedIndex.of(eventsA));
        NamedIndex<EventInfo> indexB = indexed(ChangeCategory.EVENT, NamedIndex.of(eventsB));
        List<DiffChange> changes = new ArrayList<>();

        for (EventInfo event : indexB.values()) {
            if (!indexA.contains(event.key())) {
                changes.add(new DiffChange(
                        ChangeType.ADDED,
                        ChangeCategory.EVENT,
                        event.name(),
                        null,
                        CanonicalSignatures.eventSignature(event),
                        "New event added: " + event.name(),
                        Impact.NON_BREAKING,
                        null));
            }
        }
        for (EventInfo event : indexA.values()) {
            if (!indexB.contains(event.key())) {
                changes.add(new DiffChange(
                        ChangeType.REMOVED,
                        ChangeCategory.EVENT,
                        event.name(),
                        CanonicalSignatures.eventSignature(event),
                        null,
                        "Event removed: " + event.name(),
                        Impact.BREAKING,
                        "Removing an event breaks off-chain indexers and listeners that depend on it."));
            }
        }
        for (EventInfo before : indexA.values()) {
            EventInfo after = indexB.get(before.key());
            if (after != null
                    && !CanonicalSignatures.canonicalEvent(before).equals(CanonicalSignatures.canonicalEvent(after))) {
                changes.add(new DiffChange(
                        ChangeType.MODIFIED,
                        ChangeCategory.EVENT,
                        before.name(),
                        CanonicalSignatures.eventSignature(before),
                        CanonicalSignatures.eventSignature(after),
                        "Event signature changed: " + before.name(),
                        Impact.BREAKING,
                        "Changing event parameters breaks off-chain indexers that decode these events."));
            }
        }
        return changes;
    }

    List<DiffChange> compareVariables(List<VariableInfo> variablesA, List<VariableInfo> variablesB) {
        NamedIndex<VariableInfo> indexA = indexed(ChangeCategory.VARIABLE, NamedIndex.of(variablesA));
        NamedIndex<VariableInfo> indexB = indexed(ChangeCategory.VARIABLE, NamedIndex.of(variablesB));
        List<DiffChange> changes = new ArrayList<>();

        for (VariableInfo variable : indexB.values()) {
            if (!indexA.contains(variable.key())) {
                changes.add(new DiffChange(
                        ChangeType.ADDED,
                        ChangeCategory.VARIABLE,
                        variable.name(),
                        null,
                        CanonicalSignatures.variableSignature(variable),
                        "New state variable: " + variable.name(),
                        Impact.NON_BREAKING,
                        null));
            }
        }
        for (VariableInfo variable : indexA.values()) {
            if (!indexB.contains(variable.key())) {
                boolean isPublic = variable.visibility() == Visibility.PUBLIC;
                changes.add(new DiffChange(
                        ChangeType.REMOVED,
                        ChangeCategory.VARIABLE,
                        variable.name(),
                        CanonicalSignatures.variableSignature(variable),
                        null,
                        "State variable removed: " + variable.name(),
                        Impact.of(isPublic),
                        isPublic ? "Removing a public state variable removes its auto-generated getter function." : null));
            }
        }
        for (VariableInfo before : indexA.values()) {
            VariableInfo after = indexB.get(before.key());
            if (after == null) {
                continue;
            }
            boolean typeChanged = !TypeNames.normalize(before.type()).equals(TypeNames.normalize(after.type()));
            boolean visibilityChanged = before.visibility() != after.visibility();
            if (!typeChanged && !visibilityChanged) {
                continue;
            }
            List<String> reasons = new ArrayList<>();
            if (typeChanged) {
                reasons.add("type: " + before.type() + " → " + after.type());
            }
            if (visibilityChanged) {
                reasons.add("visibility: " + before.visibility().keyword() + " → " + after.visibility().keyword());
            }
            boolean isPublic = before.visibility() == Visibility.PUBLIC || after.visibility() == Visibility.PUBLIC;
            changes.add(new DiffChange(
                    ChangeType.MODIFIED,
                    ChangeCategory.VARIABLE,
                    before.name(),
                    CanonicalSignatures.variableSignature(before),
                    CanonicalSignatures.variableSignature(after),
                    "State variable changed: " + before.name() + " (" + String.join(", ", reasons) + ")",
                    Impact.of(typeChanged || isPublic),
                    typeChanged
                            ? "Changing a state variable's type can break storage layout and ABI compatibility."
                            : null));
        }
        return changes;
    }

    List<DiffChange> compareModifiers(List<ModifierInfo> modifiersA, List<ModifierInfo> modifiersB) {
        NamedIndex<ModifierInfo> indexA = indexed(ChangeCategory.MODIFIER, NamedIndex.of(modifiersA));
        NamedIndex<ModifierInfo> indexB = indexed(ChangeCategory.MODIFIER, NamedIndex.of(modifiersB));
        List<DiffChange> changes = new ArrayList<>();

        for (ModifierInfo modifier : indexB.values()) {
            if (!indexA.contains(modifier.key())) {
                changes.add(new DiffChange(
                        ChangeType.ADDED,
                        ChangeCategory.MODIFIER,
                        modifier.name(),
                        null,
                        CanonicalSignatures.modifierSignature(modifier),
                        "New modifier added: " + modifier.name(),
                        Impact.NON_BREAKING,
                        null));
            }
        }
        for (ModifierInfo modifier : indexA.values()) {
            if (!indexB.contains(modifier.key())) {
                changes.add(new DiffChange(
                        ChangeType.REMOVED,
                        ChangeCategory.MODIFIER,
                        modifier.name(),
                        CanonicalSignatures.modifierSignature(modifier),
                        null,
                        "Modifier removed: " + modifier.name(),
                        Impact.NON_BREAKING,
                        "Modifier removal may weaken access control or validation if used by functions."));
            }
        }
        for (ModifierInfo before : indexA.values()) {
            ModifierInfo after = indexB.get(before.key());
            if (after != null
                    && !CanonicalSignatures.canonicalModifier(before)
                            .equals(CanonicalSignatures.canonicalModifier(after))) {
                changes.add(new DiffChange(
                        ChangeType.MODIFIED,
                        ChangeCategory.MODIFIER,
                        before.name(),
                        CanonicalSignatures.modifierSignature(before),
                        CanonicalSignatures.modifierSignature(after),
                        "Modifier signature changed: " + before.name(),
                        Impact.NON_BREAKING,
                        null));
            }
        }
        return changes;
    }

    List<DiffChange> compareImports(List<ImportInfo> importsA, List<ImportInfo> importsB) {
        NamedIndex<ImportInfo> indexA = indexed(ChangeCategory.IMPORT, NamedIndex.by(importsA, ImportInfo::path));
        NamedIndex<ImportInfo> indexB = indexed(ChangeCategory.IMPORT, NamedIndex.by(importsB, ImportInfo::path));
        List<DiffChange> changes = new ArrayList<>();

        for (ImportInfo importInfo : indexB.values()) {
            if (!indexA.contains(importInfo.path())) {
                changes.add(new DiffChange(
                        ChangeType.ADDED,
                        ChangeCategory.IMPORT,
                        importInfo.path(),
                        null,
                        CanonicalSignatures.importSignature(importInfo),
                        "New import: " + importInfo.path(),
                        Impact.NON_BREAKING,
                        null));
            }
        }
        for (ImportInfo importInfo : indexA.values()) {
            if (!indexB.contains(importInfo.path())) {
                changes.add(new DiffChange(
                        ChangeType.REMOVED,
                        ChangeCategory.IMPORT,
                        importInfo.path(),
                        CanonicalSignatures.importSignature(importInfo),
                        null,
                        "Import removed: " + importInfo.path(),
                        Impact.NON_BREAKING,
                        null));
            }
        }
        return changes;
    }

    List<DiffChange> compareInheritance(List<String> basesA, List<String> basesB) {
        NamedIndex<String> indexA = indexed(ChangeCategory.INHERITANCE, NamedIndex.by(basesA, Function.identity()));
        NamedIndex<String> indexB = indexed(ChangeCategory.INHERITANCE, NamedIndex.by(basesB, Function.identity()));
        List<DiffChange> changes = new ArrayList<>();

        for (String base : indexB.keys()) {
            if (!indexA.contains(base)) {
                changes.add(new DiffChange(
                        ChangeType.ADDED,
                        ChangeCategory.INHERITANCE,
                        base,
                        null,
                        "is " + base,
                        "New base contract: " + base,
                        Impact.NON_BREAKING,
                        null));
            }
        }
        for (String base : indexA.keys()) {
            if (!indexB.contains(base)) {
                changes.add(new DiffChange(
                        ChangeType.REMOVED,
                        ChangeCategory.INHERITANCE,
                        base,
                        "is " + base,
                        null,
                        "Base contract removed: " + base,
                        Impact.BREAKING,
                        "Removing an inherited contract may remove functions, events, and modifiers that callers depend on."));
            }
        }
        return changes;
    }

    private static <T> NamedIndex<T> indexed(ChangeCategory category, NamedIndex<T> index) {
        if (index.skipped() > 0) {
            log.warn("Skipped {} {} declaration(s) without a usable name", index.skipped(), category.label());
        }
        return index;
    }

    private static List<String> names(List<Parameter> parameters) {
        return parameters.stream().map(p -> Objects.toString(p.name(), "")).toList();
    }
}
