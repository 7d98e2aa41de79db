package com.example.contractlens.domain;

import java.util.List;

/**
 * Structural model of one analyzed source. Built fresh on every parse and never
 * mutated afterwards.
 */
public record ContractModel(
        String name,
        ContractKind kind,
        String pragma,
        List<ImportInfo> imports,
        List<String> inheritedContracts,
        List<FunctionInfo> functions,
        List<EventInfo> events,
        List<VariableInfo> variables,
        List<ModifierInfo> modifiers,
        List<StructInfo> structs,
        List<EnumInfo> enums,
        int totalLines,
        int complexity) {
    public ContractModel {
        imports = List.copyOf(imports);
        inheritedContracts = List.copyOf(inheritedContracts);
        functions = List.copyOf(functions);
        events = List.copyOf(events);
        variables = List.copyOf(variables);
        modifiers = List.copyOf(modifiers);
        structs = List.copyOf(structs);
        enums = List.copyOf(enums);
    }

    /** Stand-in for a side that could not be parsed. */
    public static ContractModel empty(String name) {
        return new ContractModel(
                name,
                ContractKind.CONTRACT,
                "",
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                0,
                0);
    }
}
