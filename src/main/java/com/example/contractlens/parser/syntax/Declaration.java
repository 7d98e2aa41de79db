package com.example.contractlens.parser.syntax;

import com.example.contractlens.domain.ContractKind;
import com.example.contractlens.domain.FunctionKind;
import com.example.contractlens.domain.LineSpan;
import com.example.contractlens.domain.StateMutability;
import com.example.contractlens.domain.Visibility;

import java.util.List;

/**
 * Source-unit and contract-level declarations.
 */
public sealed interface Declaration {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitPragma(PragmaDirective node);

        R visitImport(ImportDirective node);

        R visitContract(ContractDefinition node);

        R visitFunction(FunctionDefinition node);

        R visitModifier(ModifierDefinition node);

        R visitEvent(EventDefinition node);

        R visitStateVariable(StateVariableDeclaration node);

        R visitStruct(StructDefinition node);

        R visitEnum(EnumDefinition node);

        R visitError(ErrorDefinition node);

        R visitUsingFor(UsingForDirective node);

        R visitUserDefinedValueType(UserDefinedValueTypeDefinition node);
    }

    record PragmaDirective(String name, String value) implements Declaration {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPragma(this);
        }
    }

    /**
     * @param symbols named symbols; empty for {@code import "p";} and {@code import * as X from "p";}
     * @param alias unit alias, or null
     */
    record ImportDirective(String path, List<String> symbols, String alias) implements Declaration {
        public ImportDirective {
            symbols = List.copyOf(symbols);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    record ContractDefinition(
            String name,
            ContractKind kind,
            List<InheritanceSpecifier> baseContracts,
            List<Declaration> members,
            LineSpan span)
            implements Declaration {
        public ContractDefinition {
            baseContracts = List.copyOf(baseContracts);
            members = List.copyOf(members);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContract(this);
        }
    }

    record InheritanceSpecifier(String namePath, List<Expression> arguments) {
        public InheritanceSpecifier {
            arguments = List.copyOf(arguments);
        }
    }

    record ModifierInvocation(String name, List<Expression> arguments) {
        public ModifierInvocation {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * @param name empty for constructor, fallback and receive
     * @param visibility null when not declared
     * @param mutability null when not declared
     * @param body null for declarations without implementation
     */
    record FunctionDefinition(
            String name,
            FunctionKind kind,
            List<VariableDeclaration> parameters,
            List<VariableDeclaration> returns,
            Visibility visibility,
            StateMutability mutability,
            List<ModifierInvocation> modifiers,
            boolean virtual,
            Statement.Block body,
            LineSpan span)
            implements Declaration {
        public FunctionDefinition {
            name = name == null ? "" : name;
            parameters = List.copyOf(parameters);
            returns = List.copyOf(returns);
            modifiers = List.copyOf(modifiers);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    record ModifierDefinition(
            String name, List<VariableDeclaration> parameters, boolean virtual, Statement.Block body, LineSpan span)
            implements Declaration {
        public ModifierDefinition {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitModifier(this);
        }
    }

    record EventDefinition(String name, List<VariableDeclaration> parameters, boolean anonymous, LineSpan span)
            implements Declaration {
        public EventDefinition {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEvent(this);
        }
    }

    /** {@code visibility} is null when not declared. */
    record StateVariableDeclaration(
            TypeName typeName,
            String name,
            Visibility visibility,
            boolean constant,
            boolean immutable,
            Expression initialValue,
            LineSpan span)
            implements Declaration {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStateVariable(this);
        }
    }

    record StructDefinition(String name, List<VariableDeclaration> members, LineSpan span) implements Declaration {
        public StructDefinition {
            members = List.copyOf(members);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStruct(this);
        }
    }

    record EnumDefinition(String name, List<String> values, LineSpan span) implements Declaration {
        public EnumDefinition {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnum(this);
        }
    }

    record ErrorDefinition(String name, List<VariableDeclaration> parameters, LineSpan span) implements Declaration {
        public ErrorDefinition {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitError(this);
        }
    }

    /** {@code typeName} is null for {@code using L for *}. */
    record UsingForDirective(String libraryName, TypeName typeName) implements Declaration {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUsingFor(this);
        }
    }

    record UserDefinedValueTypeDefinition(String name, TypeName underlyingType) implements Declaration {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUserDefinedValueType(this);
        }
    }
}
