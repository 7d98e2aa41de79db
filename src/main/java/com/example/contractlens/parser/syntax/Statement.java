package com.example.contractlens.parser.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public sealed interface Statement {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitBlock(Block node);

        R visitIf(IfStatement node);

        R visitFor(ForStatement node);

        R visitWhile(WhileStatement node);

        R visitDoWhile(DoWhileStatement node);

        R visitReturn(ReturnStatement node);

        R visitEmit(EmitStatement node);

        R visitRevert(RevertStatement node);

        R visitVariableDeclaration(VariableDeclarationStatement node);

        R visitExpression(ExpressionStatement node);

        R visitTry(TryStatement node);

        R visitInlineAssembly(InlineAssemblyStatement node);

        R visitBreak(BreakStatement node);

        R visitContinue(ContinueStatement node);

        R visitPlaceholder(PlaceholderStatement node);
    }

    record Block(List<Statement> statements, boolean unchecked) implements Statement {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /** {@code falseBody} is null when there is no else branch. */
    record IfStatement(Expression condition, Statement trueBody, Statement falseBody) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /** Any of the three header parts may be null. */
    record ForStatement(Statement init, Expression condition, Expression loopExpression, Statement body)
            implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record WhileStatement(Expression condition, Statement body) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record DoWhileStatement(Statement body, Expression condition) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDoWhile(this);
        }
    }

    record ReturnStatement(Expression expression) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record EmitStatement(Expression.FunctionCall eventCall) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmit(this);
        }
    }

    /** {@code revert CustomError(...)}; the plain {@code revert(...)} call is an expression statement. */
    record RevertStatement(Expression.FunctionCall errorCall) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRevert(this);
        }
    }

    /** Tuple declarations may leave slots empty, so {@code variables} can contain nulls. */
    record VariableDeclarationStatement(List<VariableDeclaration> variables, Expression initialValue)
            implements Statement {
        public VariableDeclarationStatement {
            variables = Collections.unmodifiableList(new ArrayList<>(variables));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableDeclaration(this);
        }
    }

    record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    record TryStatement(
            Expression expression, List<VariableDeclaration> returns, Block body, List<CatchClause> catchClauses)
            implements Statement {
        public TryStatement {
            returns = List.copyOf(returns);
            catchClauses = List.copyOf(catchClauses);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    /** {@code identifier} is empty for the catch-all clause. */
    record CatchClause(String identifier, List<VariableDeclaration> parameters, Block body) {
        public CatchClause {
            parameters = List.copyOf(parameters);
        }
    }

    /** Assembly is kept as raw text; its contents are never analyzed. */
    record InlineAssemblyStatement(String raw) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineAssembly(this);
        }
    }

    record BreakStatement() implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record ContinueStatement() implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    /** The {@code _;} inside a modifier body. */
    record PlaceholderStatement() implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPlaceholder(this);
        }
    }
}
