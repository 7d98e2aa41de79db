package com.example.contractlens.parser;

import com.example.contractlens.domain.ContractKind;
import com.example.contractlens.domain.FunctionKind;
import com.example.contractlens.domain.LineSpan;
import com.example.contractlens.domain.StateMutability;
import com.example.contractlens.domain.Visibility;
import com.example.contractlens.parser.antlr.SolidityBaseVisitor;
import com.example.contractlens.parser.antlr.SolidityParser;
import com.example.contractlens.parser.syntax.Declaration;
import com.example.contractlens.parser.syntax.Expression;
import com.example.contractlens.parser.syntax.SourceUnit;
import com.example.contractlens.parser.syntax.Statement;
import com.example.contractlens.parser.syntax.SyntaxDiagnostic;
import com.example.contractlens.parser.syntax.TypeName;
import com.example.contractlens.parser.syntax.VariableDeclaration;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Turns the ANTLR parse tree into the {@link SourceUnit} syntax tree.
 *
 * <p>Members and statements that the parser had to repair are left out; the error
 * itself was already reported by the parser's listener. Contract bodies and blocks are
 * containers: they are kept even when damaged, and a missing closing brace gets a
 * diagnostic of its own.
 */
class SyntaxTreeBuilder extends SolidityBaseVisitor<Object> {
    static final int MAX_EXPRESSION_DEPTH = 1000;

    private final CharStream input;
    private final List<SyntaxDiagnostic> diagnostics = new ArrayList<>();
    private int expressionDepth;

    SyntaxTreeBuilder(CharStream input) {
        this.input = input;
    }

    SourceUnit build(SolidityParser.SourceUnitContext tree, List<SyntaxDiagnostic> reported) {
        List<Declaration> members = new ArrayList<>();
        for (SolidityParser.SourceUnitPartContext part : tree.sourceUnitPart()) {
            Declaration declaration = part.contractDefinition() != null
                    ? visitContractDefinition(part.contractDefinition())
                    : isMalformed(part) ? null : (Declaration) visit(part);
            if (declaration != null) {
                members.add(declaration);
            }
        }
        List<SyntaxDiagnostic> all = new ArrayList<>(reported);
        all.addAll(diagnostics);
        all.sort(Comparator.comparingInt(SyntaxDiagnostic::line).thenComparingInt(SyntaxDiagnostic::column));
        return new SourceUnit(members, all);
    }

    // ------------------------------------------------------------ declarations

    @Override
    public Declaration visitPragmaDirective(SolidityParser.PragmaDirectiveContext ctx) {
        List<SolidityParser.PragmaTokenContext> tokens = ctx.pragmaToken();
        String value = tokens.isEmpty()
                ? ""
                : raw(tokens.get(0).getStart(), tokens.get(tokens.size() - 1).getStop()).trim();
        return new Declaration.PragmaDirective(ctx.identifier().getText(), value);
    }

    @Override
    public Declaration visitImportPath(SolidityParser.ImportPathContext ctx) {
        return new Declaration.ImportDirective(
                unquote(ctx.path.getText()), List.of(), ctx.alias != null ? ctx.alias.getText() : null);
    }

    @Override
    public Declaration visitImportUnit(SolidityParser.ImportUnitContext ctx) {
        String alias = ctx.alias != null ? ctx.alias.getText()
                : ctx.unitName != null ? ctx.unitName.getText() : null;
        return new Declaration.ImportDirective(unquote(ctx.path.getText()), List.of(), alias);
    }

    @Override
    public Declaration visitImportSymbols(SolidityParser.ImportSymbolsContext ctx) {
        List<String> symbols = ctx.importSymbol().stream()
                .map(symbol -> symbol.identifier(0).getText())
                .toList();
        return new Declaration.ImportDirective(unquote(ctx.path.getText()), symbols, null);
    }

    @Override
    public Declaration.ContractDefinition visitContractDefinition(SolidityParser.ContractDefinitionContext ctx) {
        if (ctx.identifier() == null
                || isMalformed(ctx.identifier())
                || ctx.inheritanceSpecifier().stream().anyMatch(SyntaxTreeBuilder::isMalformed)) {
            return null;
        }
        ContractKind kind = switch (ctx.kind.getText()) {
            case "interface" -> ContractKind.INTERFACE;
            case "library" -> ContractKind.LIBRARY;
            default -> ctx.isAbstract != null ? ContractKind.ABSTRACT : ContractKind.CONTRACT;
        };
        List<Declaration.InheritanceSpecifier> bases = new ArrayList<>();
        for (SolidityParser.InheritanceSpecifierContext base : ctx.inheritanceSpecifier()) {
            bases.add(new Declaration.InheritanceSpecifier(
                    base.userDefinedTypeName().getText(), arguments(base.callArgumentList()).values()));
        }
        List<Declaration> members = new ArrayList<>();
        for (SolidityParser.ContractPartContext part : ctx.contractPart()) {
            if (!isMalformed(part)) {
                members.add((Declaration) visit(part));
            }
        }
        requireClosingBrace(ctx);
        return new Declaration.ContractDefinition(ctx.identifier().getText(), kind, bases, members, span(ctx));
    }

    @Override
    public Declaration visitStateVariableDeclaration(SolidityParser.StateVariableDeclarationContext ctx) {
        Visibility visibility = null;
        boolean constant = false;
        boolean immutable = false;
        for (SolidityParser.StateVariableAttributeContext attribute : ctx.stateVariableAttribute()) {
            String keyword = attribute.getText();
            if (keyword.equals("constant")) {
                constant = true;
            } else if (keyword.equals("immutable")) {
                immutable = true;
            } else if (Visibility.fromKeyword(keyword) != null) {
                visibility = Visibility.fromKeyword(keyword);
            }
        }
        return new Declaration.StateVariableDeclaration(
                typeName(ctx.typeName()),
                ctx.identifier().getText(),
                visibility,
                constant,
                immutable,
                expression(ctx.expression()),
                span(ctx));
    }

    @Override
    public Declaration visitUsingForDeclaration(SolidityParser.UsingForDeclarationContext ctx) {
        SolidityParser.UsingLibraryContext library = ctx.usingLibrary();
        String libraryName = library.userDefinedTypeName() != null
                ? library.userDefinedTypeName().getText()
                : raw(library.getStart(), library.getStop());
        return new Declaration.UsingForDirective(
                libraryName, ctx.typeName() != null ? typeName(ctx.typeName()) : null);
    }

    @Override
    public Declaration visitStructDefinition(SolidityParser.StructDefinitionContext ctx) {
        List<VariableDeclaration> members = new ArrayList<>();
        for (SolidityParser.StructMemberContext member : ctx.structMember()) {
            members.add(new VariableDeclaration(
                    typeName(member.typeName()), member.identifier().getText(), null, false, span(member)));
        }
        return new Declaration.StructDefinition(ctx.identifier().getText(), members, span(ctx));
    }

    @Override
    public Declaration visitEnumDefinition(SolidityParser.EnumDefinitionContext ctx) {
        List<SolidityParser.IdentifierContext> names = ctx.identifier();
        List<String> values = names.subList(1, names.size()).stream()
                .map(ParserRuleContext::getText)
                .toList();
        return new Declaration.EnumDefinition(names.get(0).getText(), values, span(ctx));
    }

    @Override
    public Declaration visitEventDefinition(SolidityParser.EventDefinitionContext ctx) {
        return new Declaration.EventDefinition(
                ctx.identifier().getText(), parameters(ctx.parameterList()), ctx.isAnonymous != null, span(ctx));
    }

    @Override
    public Declaration visitErrorDefinition(SolidityParser.ErrorDefinitionContext ctx) {
        return new Declaration.ErrorDefinition(ctx.identifier().getText(), parameters(ctx.parameterList()), span(ctx));
    }

    @Override
    public Declaration visitUserDefinedValueTypeDefinition(
            SolidityParser.UserDefinedValueTypeDefinitionContext ctx) {
        return new Declaration.UserDefinedValueTypeDefinition(ctx.identifier().getText(), typeName(ctx.typeName()));
    }

    @Override
    public Declaration visitModifierDefinition(SolidityParser.ModifierDefinitionContext ctx) {
        boolean virtual = ctx.modifierAttribute().stream().anyMatch(attribute -> attribute.getText().equals("virtual"));
        return new Declaration.ModifierDefinition(
                ctx.identifier().getText(),
                ctx.parameterList() != null ? parameters(ctx.parameterList()) : List.of(),
                virtual,
                block(ctx.block()),
                span(ctx));
    }

    @Override
    public Declaration visitFunctionDefinition(SolidityParser.FunctionDefinitionContext ctx) {
        SolidityParser.FunctionDescriptorContext descriptor = ctx.functionDescriptor();
        String name = "";
        FunctionKind kind = switch (descriptor.getStart().getText()) {
            case "constructor" -> FunctionKind.CONSTRUCTOR;
            case "fallback" -> FunctionKind.FALLBACK;
            case "receive" -> FunctionKind.RECEIVE;
            default -> {
                // "function() payable {}" is the pre-0.6 fallback
                name = descriptor.identifier() != null ? descriptor.identifier().getText() : "";
                yield name.isEmpty() ? FunctionKind.FALLBACK : FunctionKind.FUNCTION;
            }
        };

        Visibility visibility = null;
        StateMutability mutability = null;
        boolean virtual = false;
        List<Declaration.ModifierInvocation> modifiers = new ArrayList<>();
        for (SolidityParser.FunctionAttributeContext attribute : ctx.functionAttribute()) {
            if (attribute.visibility() != null) {
                visibility = Visibility.fromKeyword(attribute.getText());
            } else if (attribute.stateMutability() != null) {
                mutability = StateMutability.fromKeyword(attribute.getText());
            } else if (attribute.modifierInvocation() != null) {
                SolidityParser.ModifierInvocationContext invocation = attribute.modifierInvocation();
                modifiers.add(new Declaration.ModifierInvocation(
                        invocation.userDefinedTypeName().getText(),
                        arguments(invocation.callArgumentList()).values()));
            } else if (attribute.overrideSpecifier() == null) {
                virtual = true;
            }
        }

        return new Declaration.FunctionDefinition(
                name,
                kind,
                parameters(ctx.parameterList(0)),
                ctx.returnParameters != null ? parameters(ctx.returnParameters) : List.of(),
                visibility,
                mutability,
                modifiers,
                virtual,
                block(ctx.block()),
                span(ctx));
    }

    private List<VariableDeclaration> parameters(SolidityParser.ParameterListContext ctx) {
        List<VariableDeclaration> parameters = new ArrayList<>();
        for (SolidityParser.ParameterContext parameter : ctx.parameter()) {
            parameters.add(new VariableDeclaration(
                    typeName(parameter.typeName()),
                    parameter.identifier() != null ? parameter.identifier().getText() : "",
                    parameter.dataLocation() != null ? parameter.dataLocation().getText() : null,
                    parameter.isIndexed != null,
                    span(parameter)));
        }
        return parameters;
    }

    // ------------------------------------------------------------ types

    @Override
    public TypeName visitElementaryType(SolidityParser.ElementaryTypeContext ctx) {
        return elementaryType(ctx.elementaryTypeName());
    }

    @Override
    public TypeName visitUserDefinedType(SolidityParser.UserDefinedTypeContext ctx) {
        return new TypeName.UserDefinedType(ctx.userDefinedTypeName().getText());
    }

    @Override
    public TypeName visitMappingType(SolidityParser.MappingTypeContext ctx) {
        SolidityParser.MappingContext mapping = ctx.mapping();
        return new TypeName.MappingType(
                typeName(mapping.keyType),
                mapping.keyName != null ? mapping.keyName.getText() : null,
                typeName(mapping.valueType),
                mapping.valueName != null ? mapping.valueName.getText() : null);
    }

    @Override
    public TypeName visitFunctionType(SolidityParser.FunctionTypeContext ctx) {
        SolidityParser.FunctionTypeNameContext function = ctx.functionTypeName();
        String visibility = null;
        String mutability = null;
        for (SolidityParser.FunctionTypeAttributeContext attribute : function.functionTypeAttribute()) {
            if (attribute.visibility() != null) {
                visibility = attribute.getText();
            } else {
                mutability = attribute.getText();
            }
        }
        return new TypeName.FunctionType(
                parameters(function.parameterList(0)),
                function.returnParameters != null ? parameters(function.returnParameters) : List.of(),
                visibility,
                mutability);
    }

    @Override
    public TypeName visitArrayType(SolidityParser.ArrayTypeContext ctx) {
        return new TypeName.ArrayType(typeName(ctx.typeName()), expression(ctx.expression()));
    }

    private static TypeName.ElementaryType elementaryType(SolidityParser.ElementaryTypeNameContext ctx) {
        return new TypeName.ElementaryType(ctx.getStart().getText(), ctx.getChildCount() > 1);
    }

    // ------------------------------------------------------------ statements

    @Override
    public Statement.Block visitBlock(SolidityParser.BlockContext ctx) {
        List<Statement> statements = new ArrayList<>();
        for (SolidityParser.StatementContext statement : ctx.statement()) {
            if (isMalformed(statement)) {
                continue;
            }
            Statement built = statement(statement);
            if (built != null) {
                statements.add(built);
            }
        }
        requireClosingBrace(ctx);
        return new Statement.Block(statements, false);
    }

    @Override
    public Statement visitBlockStatement(SolidityParser.BlockStatementContext ctx) {
        return block(ctx.block());
    }

    @Override
    public Statement visitUncheckedStatement(SolidityParser.UncheckedStatementContext ctx) {
        return new Statement.Block(block(ctx.block()).statements(), true);
    }

    @Override
    public Statement visitIfStatement(SolidityParser.IfStatementContext ctx) {
        List<SolidityParser.StatementContext> branches = ctx.statement();
        return new Statement.IfStatement(
                expression(ctx.expression()),
                statement(branches.get(0)),
                branches.size() > 1 ? statement(branches.get(1)) : null);
    }

    @Override
    public Statement visitForStatement(SolidityParser.ForStatementContext ctx) {
        Statement init = ctx.simpleStatement() != null ? (Statement) visit(ctx.simpleStatement()) : null;
        Expression condition = null;
        Expression loopExpression = null;
        boolean afterCondition = false;
        // children after the initializer: condition? ';' loopExpression? ')' body
        for (int i = 3; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof SolidityParser.ExpressionContext expression) {
                if (afterCondition) {
                    loopExpression = expression(expression);
                } else {
                    condition = expression(expression);
                }
            } else if (child instanceof TerminalNode terminal
                    && terminal.getSymbol().getType() == SolidityParser.Semi) {
                afterCondition = true;
            }
        }
        return new Statement.ForStatement(init, condition, loopExpression, statement(ctx.statement()));
    }

    @Override
    public Statement visitWhileStatement(SolidityParser.WhileStatementContext ctx) {
        return new Statement.WhileStatement(expression(ctx.expression()), statement(ctx.statement()));
    }

    @Override
    public Statement visitDoWhileStatement(SolidityParser.DoWhileStatementContext ctx) {
        return new Statement.DoWhileStatement(statement(ctx.statement()), expression(ctx.expression()));
    }

    @Override
    public Statement visitReturnStatement(SolidityParser.ReturnStatementContext ctx) {
        return new Statement.ReturnStatement(expression(ctx.expression()));
    }

    @Override
    public Statement visitEmitStatement(SolidityParser.EmitStatementContext ctx) {
        if (expression(ctx.expression()) instanceof Expression.FunctionCall call) {
            return new Statement.EmitStatement(call);
        }
        report("Expected event call after 'emit'", ctx.getStart());
        return null;
    }

    @Override
    public Statement visitRevertStatement(SolidityParser.RevertStatementContext ctx) {
        Expression error = null;
        for (SolidityParser.IdentifierContext part : ctx.userDefinedTypeName().identifier()) {
            error = error == null
                    ? new Expression.Identifier(part.getText())
                    : new Expression.MemberAccess(error, part.getText());
        }
        Arguments arguments = arguments(ctx.callArgumentList());
        return new Statement.RevertStatement(
                new Expression.FunctionCall(error, arguments.values(), arguments.names()));
    }

    @Override
    public Statement visitTryStatement(SolidityParser.TryStatementContext ctx) {
        List<Statement.CatchClause> clauses = new ArrayList<>();
        for (SolidityParser.CatchClauseContext clause : ctx.catchClause()) {
            clauses.add(new Statement.CatchClause(
                    clause.identifier() != null ? clause.identifier().getText() : "",
                    clause.parameterList() != null ? parameters(clause.parameterList()) : List.of(),
                    block(clause.block())));
        }
        return new Statement.TryStatement(
                expression(ctx.expression()),
                ctx.parameterList() != null ? parameters(ctx.parameterList()) : List.of(),
                block(ctx.block()),
                clauses);
    }

    @Override
    public Statement visitAssemblyStatement(SolidityParser.AssemblyStatementContext ctx) {
        SolidityParser.AssemblyBlockContext body = ctx.assemblyBlock();
        return new Statement.InlineAssemblyStatement(raw(body.getStart(), body.getStop()));
    }

    @Override
    public Statement visitBreakStatement(SolidityParser.BreakStatementContext ctx) {
        return new Statement.BreakStatement();
    }

    @Override
    public Statement visitContinueStatement(SolidityParser.ContinueStatementContext ctx) {
        return new Statement.ContinueStatement();
    }

    @Override
    public Statement visitVariableDeclarationStatement(SolidityParser.VariableDeclarationStatementContext ctx) {
        List<VariableDeclaration> variables = new ArrayList<>();
        if (ctx.variableDeclaration() != null) {
            variables.add(variable(ctx.variableDeclaration()));
        } else {
            VariableDeclaration slot = null;
            for (ParseTree child : ctx.variableDeclarationList().children == null
                    ? List.<ParseTree>of() : ctx.variableDeclarationList().children) {
                if (child instanceof SolidityParser.VariableDeclarationContext declaration) {
                    slot = variable(declaration);
                } else {
                    variables.add(slot);
                    slot = null;
                }
            }
            variables.add(slot);
        }
        return new Statement.VariableDeclarationStatement(variables, expression(ctx.expression()));
    }

    @Override
    public Statement visitExpressionStatement(SolidityParser.ExpressionStatementContext ctx) {
        Expression expression = expression(ctx.expression());
        if (expression instanceof Expression.Identifier identifier && identifier.name().equals("_")) {
            return new Statement.PlaceholderStatement();
        }
        return new Statement.ExpressionStatement(expression);
    }

    private VariableDeclaration variable(SolidityParser.VariableDeclarationContext ctx) {
        return new VariableDeclaration(
                typeName(ctx.typeName()),
                ctx.identifier().getText(),
                ctx.dataLocation() != null ? ctx.dataLocation().getText() : null,
                false,
                span(ctx));
    }

    // ------------------------------------------------------------ expressions

    @Override
    public Expression visitPostfixUnary(SolidityParser.PostfixUnaryContext ctx) {
        return new Expression.UnaryOperation(ctx.op.getText(), expression(ctx.expression()), false);
    }

    @Override
    public Expression visitPrefixUnary(SolidityParser.PrefixUnaryContext ctx) {
        return new Expression.UnaryOperation(ctx.op.getText(), expression(ctx.expression()), true);
    }

    @Override
    public Expression visitIndexAccess(SolidityParser.IndexAccessContext ctx) {
        List<SolidityParser.ExpressionContext> operands = ctx.expression();
        return new Expression.IndexAccess(
                expression(operands.get(0)), operands.size() > 1 ? expression(operands.get(1)) : null);
    }

    @Override
    public Expression visitIndexRangeAccess(SolidityParser.IndexRangeAccessContext ctx) {
        Expression start = null;
        Expression end = null;
        boolean afterColon = false;
        for (int i = 2; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof SolidityParser.ExpressionContext bound) {
                if (afterColon) {
                    end = expression(bound);
                } else {
                    start = expression(bound);
                }
            } else if (child.getText().equals(":")) {
                afterColon = true;
            }
        }
        return new Expression.IndexRangeAccess(expression(ctx.expression(0)), start, end);
    }

    @Override
    public Expression visitMemberAccess(SolidityParser.MemberAccessContext ctx) {
        return new Expression.MemberAccess(expression(ctx.expression()), ctx.memberName().getText());
    }

    @Override
    public Expression visitCallOptions(SolidityParser.CallOptionsContext ctx) {
        List<String> names = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        for (SolidityParser.CallOptionContext option : ctx.callOption()) {
            names.add(option.identifier().getText());
            values.add(expression(option.expression()));
        }
        return new Expression.CallOptions(expression(ctx.expression()), names, values);
    }

    @Override
    public Expression visitFunctionCall(SolidityParser.FunctionCallContext ctx) {
        Arguments arguments = arguments(ctx.callArgumentList());
        return new Expression.FunctionCall(expression(ctx.expression()), arguments.values(), arguments.names());
    }

    @Override
    public Expression visitNewExpression(SolidityParser.NewExpressionContext ctx) {
        return new Expression.New(typeName(ctx.typeName()));
    }

    @Override
    public Expression visitPayableConversion(SolidityParser.PayableConversionContext ctx) {
        Arguments arguments = arguments(ctx.callArgumentList());
        return new Expression.FunctionCall(new Expression.Identifier("payable"), arguments.values(), arguments.names());
    }

    @Override
    public Expression visitTypeMeta(SolidityParser.TypeMetaContext ctx) {
        return new Expression.FunctionCall(
                new Expression.Identifier("type"),
                List.of(new Expression.TypeExpression(typeName(ctx.typeName()))),
                List.of());
    }

    @Override
    public Expression visitBinary(SolidityParser.BinaryContext ctx) {
        return new Expression.BinaryOperation(
                ctx.op.getText(), expression(ctx.expression(0)), expression(ctx.expression(1)));
    }

    @Override
    public Expression visitAssignment(SolidityParser.AssignmentContext ctx) {
        return new Expression.BinaryOperation(
                ctx.op.getText(), expression(ctx.expression(0)), expression(ctx.expression(1)));
    }

    @Override
    public Expression visitConditional(SolidityParser.ConditionalContext ctx) {
        return new Expression.Conditional(
                expression(ctx.expression(0)), expression(ctx.expression(1)), expression(ctx.expression(2)));
    }

    @Override
    public Expression visitPrimary(SolidityParser.PrimaryContext ctx) {
        return (Expression) visit(ctx.primaryExpression());
    }

    @Override
    public Expression visitBooleanPrimary(SolidityParser.BooleanPrimaryContext ctx) {
        return new Expression.Literal(Expression.LiteralKind.BOOLEAN, ctx.getText());
    }

    @Override
    public Expression visitNumberPrimary(SolidityParser.NumberPrimaryContext ctx) {
        SolidityParser.NumberLiteralContext number = ctx.numberLiteral();
        String value = number.getStart().getText();
        if (number.numberUnit() != null) {
            value = value + " " + number.numberUnit().getText();
        }
        return new Expression.Literal(Expression.LiteralKind.NUMBER, value);
    }

    @Override
    public Expression visitHexPrimary(SolidityParser.HexPrimaryContext ctx) {
        return new Expression.Literal(Expression.LiteralKind.HEX, concatenated(ctx.HexLiteral()));
    }

    @Override
    public Expression visitStringPrimary(SolidityParser.StringPrimaryContext ctx) {
        return new Expression.Literal(Expression.LiteralKind.STRING, concatenated(ctx.StringLiteral()));
    }

    @Override
    public Expression visitUnicodePrimary(SolidityParser.UnicodePrimaryContext ctx) {
        return new Expression.Literal(Expression.LiteralKind.STRING, concatenated(ctx.UnicodeStringLiteral()));
    }

    @Override
    public Expression visitIdentifierPrimary(SolidityParser.IdentifierPrimaryContext ctx) {
        return new Expression.Identifier(ctx.getText());
    }

    @Override
    public Expression visitElementaryTypePrimary(SolidityParser.ElementaryTypePrimaryContext ctx) {
        return new Expression.TypeExpression(elementaryType(ctx.elementaryTypeName()));
    }

    /** {@code (x)} is just {@code x}; {@code ()} and anything with a comma is a tuple. */
    @Override
    public Expression visitTuplePrimary(SolidityParser.TuplePrimaryContext ctx) {
        List<Expression> components = new ArrayList<>();
        Expression slot = null;
        boolean sawComma = false;
        for (int i = 1; i < ctx.getChildCount() - 1; i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof SolidityParser.ExpressionContext component) {
                slot = expression(component);
            } else {
                components.add(slot);
                slot = null;
                sawComma = true;
            }
        }
        if (!sawComma) {
            return slot != null ? slot : new Expression.Tuple(List.of(), false);
        }
        components.add(slot);
        return new Expression.Tuple(components, false);
    }

    @Override
    public Expression visitInlineArrayPrimary(SolidityParser.InlineArrayPrimaryContext ctx) {
        return new Expression.Tuple(ctx.expression().stream().map(this::expression).toList(), true);
    }

    private Arguments arguments(SolidityParser.CallArgumentListContext ctx) {
        if (ctx == null) {
            return new Arguments(List.of(), List.of());
        }
        List<Expression> values = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (SolidityParser.NamedArgumentContext argument : ctx.namedArgument()) {
            names.add(argument.identifier().getText());
            values.add(expression(argument.expression()));
        }
        for (SolidityParser.ExpressionContext argument : ctx.expression()) {
            values.add(expression(argument));
        }
        return new Arguments(values, names);
    }

    private record Arguments(List<Expression> values, List<String> names) {}

    static final class NestingTooDeep extends RuntimeException {
        final int line;
        final int column;

        NestingTooDeep(String message, Token at) {
            super(message, null, false, false);
            this.line = at.getLine();
            this.column = at.getCharPositionInLine() + 1;
        }
    }

    // ------------------------------------------------------------ helpers

    private Expression expression(SolidityParser.ExpressionContext ctx) {
        if (ctx == null) {
            return null;
        }
        if (++expressionDepth > MAX_EXPRESSION_DEPTH) {
            throw new NestingTooDeep(
                    "Expression nests deeper than " + MAX_EXPRESSION_DEPTH + " levels", ctx.getStart());
        }
        try {
            return (Expression) visit(ctx);
        } finally {
            expressionDepth--;
        }
    }

    private TypeName typeName(SolidityParser.TypeNameContext ctx) {
        return (TypeName) visit(ctx);
    }

    private Statement statement(SolidityParser.StatementContext ctx) {
        return (Statement) visit(ctx);
    }

    private Statement.Block block(SolidityParser.BlockContext ctx) {
        return ctx == null ? null : visitBlock(ctx);
    }

    /**
     * True when the parser reported an error inside the construct, not counting nested
     * blocks, which drop their own broken statements.
     */
    static boolean isMalformed(ParserRuleContext root) {
        Deque<ParserRuleContext> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ParserRuleContext ctx = pending.pop();
            if (ctx.exception != null) {
                return true;
            }
            if (ctx.getChildCount() == 0) {
                // a repaired token that was never added to the tree
                if (ctx instanceof SolidityParser.VariableDeclarationListContext) {
                    continue;
                }
                return true;
            }
            for (ParseTree child : ctx.children) {
                if (child instanceof ErrorNode) {
                    return true;
                }
                if (child instanceof ParserRuleContext rule && !(rule instanceof SolidityParser.BlockContext)) {
                    pending.push(rule);
                }
            }
        }
        return false;
    }

    private void requireClosingBrace(ParserRuleContext ctx) {
        boolean closed = ctx.getTokens(SolidityParser.RBrace).stream()
                .anyMatch(brace -> !(brace instanceof ErrorNode));
        if (!closed) {
            TerminalNode open = ctx.getToken(SolidityParser.LBrace, 0);
            Token opening = open != null ? open.getSymbol() : ctx.getStart();
            Token last = ctx.getStop() != null ? ctx.getStop() : opening;
            report("Missing '}' for block opened at line " + opening.getLine(), last);
        }
    }

    private void report(String message, Token at) {
        diagnostics.add(new SyntaxDiagnostic(message, at.getLine(), at.getCharPositionInLine() + 1));
    }

    private static LineSpan span(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop() != null ? ctx.getStop() : start;
        return new LineSpan(start.getLine(), Math.max(start.getLine(), stop.getLine()));
    }

    private String raw(Token start, Token stop) {
        return input.getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    private static String concatenated(List<TerminalNode> literals) {
        StringBuilder value = new StringBuilder();
        for (TerminalNode literal : literals) {
            value.append(unquote(literal.getText()));
        }
        return value.toString();
    }

    /** Strips the quotes and any {@code hex}/{@code unicode} prefix, then resolves escapes. */
    static String unquote(String literal) {
        int open = 0;
        while (open < literal.length() && literal.charAt(open) != '"' && literal.charAt(open) != '\'') {
            open++;
        }
        String body = literal.substring(open + 1, literal.length() - 1);
        StringBuilder value = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                value.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case '\n' -> { }
                default -> value.append(escaped);
            }
        }
        return value.toString();
    }
}
