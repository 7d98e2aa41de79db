package com.example.contractlens.parser;

import com.example.contractlens.analysis.CallGraph;
import com.example.contractlens.analysis.CallGraphAnalyzer;
import com.example.contractlens.domain.ContractKind;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.EnumInfo;
import com.example.contractlens.domain.EventInfo;
import com.example.contractlens.domain.FunctionInfo;
import com.example.contractlens.domain.ImportInfo;
import com.example.contractlens.domain.ModifierInfo;
import com.example.contractlens.domain.Parameter;
import com.example.contractlens.domain.StateMutability;
import com.example.contractlens.domain.StructInfo;
import com.example.contractlens.domain.VariableInfo;
import com.example.contractlens.domain.Visibility;
import com.example.contractlens.parser.syntax.Declaration;
import com.example.contractlens.parser.syntax.SourceUnit;
import com.example.contractlens.parser.syntax.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link ContractModel} from a syntax tree. Entities are gathered from every
 * contract in the unit (and from file level) in declaration order; the name and kind
 * come from the last contract definition.
 */
class ContractModelExtractor implements Declaration.Visitor<Void> {
    static final String UNKNOWN_CONTRACT = "Unknown";

    private final CallGraphAnalyzer callGraphAnalyzer;

    private Declaration.ContractDefinition mainContract;
    private final List<String> inheritedContracts = new ArrayList<>();
    private final List<FunctionInfo> functions = new ArrayList<>();
    private final List<EventInfo> events = new ArrayList<>();
    private final List<VariableInfo> variables = new ArrayList<>();
    private final List<ModifierInfo> modifiers = new ArrayList<>();
    private final List<StructInfo> structs = new ArrayList<>();
    private final List<EnumInfo> enums = new ArrayList<>();

    ContractModelExtractor(CallGraphAnalyzer callGraphAnalyzer) {
        this.callGraphAnalyzer = callGraphAnalyzer;
    }

    ContractModel extract(SourceUnit unit, String pragma, List<ImportInfo> imports, int totalLines) {
        for (Declaration member : unit.members()) {
            member.accept(this);
        }
        int complexity = functions.stream().mapToInt(FunctionInfo::complexity).sum();
        return new ContractModel(
                mainContract != null ? mainContract.name() : UNKNOWN_CONTRACT,
                mainContract != null ? mainContract.kind() : ContractKind.CONTRACT,
                pragma,
                imports,
                inheritedContracts,
                functions,
                events,
                variables,
                modifiers,
                structs,
                enums,
                totalLines,
                complexity);
    }

    @Override
    public Void visitContract(Declaration.ContractDefinition node) {
        mainContract = node;
        for (Declaration.InheritanceSpecifier base : node.baseContracts()) {
            inheritedContracts.add(base.namePath());
        }
        for (Declaration member : node.members()) {
            member.accept(this);
        }
        return null;
    }

    @Override
    public Void visitFunction(Declaration.FunctionDefinition node) {
        CallGraph callGraph = callGraphAnalyzer.analyze(node.body());
        functions.add(new FunctionInfo(
                node.name(),
                node.kind(),
                node.visibility() != null ? node.visibility() : Visibility.PUBLIC,
                node.mutability() != null ? node.mutability() : StateMutability.NONPAYABLE,
                parameters(node.parameters()),
                parameters(node.returns()),
                node.modifiers().stream().map(Declaration.ModifierInvocation::name).toList(),
                node.span(),
                callGraph.calls(),
                callGraph.externalCalls(),
                callGraph.complexity()));
        return null;
    }

    @Override
    public Void visitModifier(Declaration.ModifierDefinition node) {
        modifiers.add(new ModifierInfo(node.name(), parameters(node.parameters()), node.span()));
        return null;
    }

    @Override
    public Void visitEvent(Declaration.EventDefinition node) {
        events.add(new EventInfo(node.name(), parameters(node.parameters()), node.span()));
        return null;
    }

    @Override
    public Void visitStateVariable(Declaration.StateVariableDeclaration node) {
        variables.add(new VariableInfo(
                node.name(),
                node.typeName().render(),
                node.visibility() != null ? node.visibility() : Visibility.INTERNAL,
                node.constant(),
                node.immutable(),
                node.span()));
        return null;
    }

    @Override
    public Void visitStruct(Declaration.StructDefinition node) {
        List<StructInfo.Member> members = node.members().stream()
                .map(member -> new StructInfo.Member(member.name(), member.typeName().render()))
                .toList();
        structs.add(new StructInfo(node.name(), members, node.span()));
        return null;
    }

    @Override
    public Void visitEnum(Declaration.EnumDefinition node) {
        enums.add(new EnumInfo(node.name(), node.values(), node.span()));
        return null;
    }

    // the remaining declarations carry nothing the model records

    @Override
    public Void visitPragma(Declaration.PragmaDirective node) {
        return null;
    }

    @Override
    public Void visitImport(Declaration.ImportDirective node) {
        return null;
    }

    @Override
    public Void visitError(Declaration.ErrorDefinition node) {
        return null;
    }

    @Override
    public Void visitUsingFor(Declaration.UsingForDirective node) {
        return null;
    }

    @Override
    public Void visitUserDefinedValueType(Declaration.UserDefinedValueTypeDefinition node) {
        return null;
    }

    private static List<Parameter> parameters(List<VariableDeclaration> declarations) {
        return declarations.stream()
                .map(declaration -> new Parameter(
                        declaration.name(),
                        declaration.typeName().render(),
                        declaration.storageLocation(),
                        declaration.indexed()))
                .toList();
    }
}
