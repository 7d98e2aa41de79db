package com.example.contractlens.diff;

import com.example.contractlens.domain.ContractKind;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.EventInfo;
import com.example.contractlens.domain.ExternalCall;
import com.example.contractlens.domain.FunctionInfo;
import com.example.contractlens.domain.FunctionKind;
import com.example.contractlens.domain.ImportInfo;
import com.example.contractlens.domain.LineSpan;
import com.example.contractlens.domain.ModifierInfo;
import com.example.contractlens.domain.Parameter;
import com.example.contractlens.domain.StateMutability;
import com.example.contractlens.domain.VariableInfo;
import com.example.contractlens.domain.Visibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Fluent fixtures for hand-built contract models. */
final class TestModels {
    private TestModels() {}

    static Builder contract(String name) {
        return new Builder(name);
    }

    static FunctionInfo function(
            String name, Visibility visibility, StateMutability mutability, List<Parameter> parameters) {
        return function(name, visibility, mutability, parameters, List.of(), List.of(), List.of());
    }

    static FunctionInfo function(
            String name,
            Visibility visibility,
            StateMutability mutability,
            List<Parameter> parameters,
            List<Parameter> returns,
            List<String> modifiers,
            List<ExternalCall> externalCalls) {
        return new FunctionInfo(
                name,
                FunctionKind.FUNCTION,
                visibility,
                mutability,
                parameters,
                returns,
                modifiers,
                LineSpan.UNKNOWN,
                Set.of(),
                externalCalls,
                1);
    }

    static EventInfo event(String name, Parameter... parameters) {
        return new EventInfo(name, List.of(parameters), LineSpan.UNKNOWN);
    }

    static Parameter indexed(String name, String type) {
        return new Parameter(name, type, null, true);
    }

    static VariableInfo variable(String name, String type, Visibility visibility) {
        return new VariableInfo(name, type, visibility, false, false, LineSpan.UNKNOWN);
    }

    static ModifierInfo modifier(String name, Parameter... parameters) {
        return new ModifierInfo(name, List.of(parameters), LineSpan.UNKNOWN);
    }

    static final class Builder {
        private final String name;
        private final List<ImportInfo> imports = new ArrayList<>();
        private final List<String> bases = new ArrayList<>();
        private final List<FunctionInfo> functions = new ArrayList<>();
        private final List<EventInfo> events = new ArrayList<>();
        private final List<VariableInfo> variables = new ArrayList<>();
        private final List<ModifierInfo> modifiers = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        Builder imports(ImportInfo... values) {
            imports.addAll(List.of(values));
            return this;
        }

        Builder inherits(String... values) {
            bases.addAll(List.of(values));
            return this;
        }

        Builder functions(FunctionInfo... values) {
            functions.addAll(List.of(values));
            return this;
        }

        Builder events(EventInfo... values) {
            events.addAll(List.of(values));
            return this;
        }

        Builder variables(VariableInfo... values) {
            variables.addAll(List.of(values));
            return this;
        }

        Builder modifiers(ModifierInfo... values) {
            modifiers.addAll(List.of(values));
            return this;
        }

        ContractModel build() {
            int complexity = functions.stream().mapToInt(FunctionInfo::complexity).sum();
            return new ContractModel(
                    name,
                    ContractKind.CONTRACT,
                    "^0.8.0",
                    imports,
                    bases,
                    functions,
                    events,
                    variables,
                    modifiers,
                    List.of(),
                    List.of(),
                    0,
                    complexity);
        }
    }
}
