package com.example.contractlens.parser.syntax;

import java.util.List;

/**
 * Depth-first traversal over statements and expressions. Subclasses override the
 * visits they care about and call {@code super} to keep descending.
 */
public abstract class SyntaxWalker implements Statement.Visitor<Void>, Expression.Visitor<Void> {

    protected void walk(Statement statement) {
        if (statement != null) {
            statement.accept(this);
        }
    }

    protected void walk(Expression expression) {
        if (expression != null) {
            expression.accept(this);
        }
    }

    protected void walkAll(List<? extends Expression> expressions) {
        for (Expression expression : expressions) {
            walk(expression);
        }
    }

    private void walkDeclarations(List<VariableDeclaration> declarations) {
        for (VariableDeclaration declaration : declarations) {
            if (declaration != null && declaration.typeName() instanceof TypeName.ArrayType array) {
                walk(array.length());
            }
        }
    }

    @Override
    public Void visitBlock(Statement.Block node) {
        for (Statement statement : node.statements()) {
            walk(statement);
        }
        return null;
    }

    @Override
    public Void visitIf(Statement.IfStatement node) {
        walk(node.condition());
        walk(node.trueBody());
        walk(node.falseBody());
        return null;
    }

    @Override
    public Void visitFor(Statement.ForStatement node) {
        walk(node.init());
        walk(node.condition());
        walk(node.loopExpression());
        walk(node.body());
        return null;
    }

    @Override
    public Void visitWhile(Statement.WhileStatement node) {
        walk(node.condition());
        walk(node.body());
        return null;
    }

    @Override
    public Void visitDoWhile(Statement.DoWhileStatement node) {
        walk(node.body());
        walk(node.condition());
        return null;
    }

    @Override
    public Void visitReturn(Statement.ReturnStatement node) {
        walk(node.expression());
        return null;
    }

    @Override
    public Void visitEmit(Statement.EmitStatement node) {
        walk(node.eventCall());
        return null;
    }

    @Override
    public Void visitRevert(Statement.RevertStatement node) {
        walk(node.errorCall());
        return null;
    }

    @Override
    public Void visitVariableDeclaration(Statement.VariableDeclarationStatement node) {
        walkDeclarations(node.variables());
        walk(node.initialValue());
        return null;
    }

    @Override
    public Void visitExpression(Statement.ExpressionStatement node) {
        walk(node.expression());
        return null;
    }

    @Override
    public Void visitTry(Statement.TryStatement node) {
        walk(node.expression());
        walk(node.body());
        for (Statement.CatchClause clause : node.catchClauses()) {
            walk(clause.body());
        }
        return null;
    }

    @Override
    public Void visitInlineAssembly(Statement.InlineAssemblyStatement node) {
        return null;
    }

    @Override
    public Void visitBreak(Statement.BreakStatement node) {
        return null;
    }

    @Override
    public Void visitContinue(Statement.ContinueStatement node) {
        return null;
    }

    @Override
    public Void visitPlaceholder(Statement.PlaceholderStatement node) {
        return null;
    }

    @Override
    public Void visitIdentifier(Expression.Identifier node) {
        return null;
    }

    @Override
    public Void visitLiteral(Expression.Literal node) {
        return null;
    }

    @Override
    public Void visitMemberAccess(Expression.MemberAccess node) {
        walk(node.expression());
        return null;
    }

    @Override
    public Void visitIndexAccess(Expression.IndexAccess node) {
        walk(node.base());
        walk(node.index());
        return null;
    }

    @Override
    public Void visitIndexRangeAccess(Expression.IndexRangeAccess node) {
        walk(node.base());
        walk(node.start());
        walk(node.end());
        return null;
    }

    @Override
    public Void visitFunctionCall(Expression.FunctionCall node) {
        walk(node.expression());
        walkAll(node.arguments());
        return null;
    }

    @Override
    public Void visitCallOptions(Expression.CallOptions node) {
        walk(node.expression());
        walkAll(node.values());
        return null;
    }

    @Override
    public Void visitUnaryOperation(Expression.UnaryOperation node) {
        walk(node.subExpression());
        return null;
    }

    @Override
    public Void visitBinaryOperation(Expression.BinaryOperation node) {
        walk(node.left());
        walk(node.right());
        return null;
    }

    @Override
    public Void visitConditional(Expression.Conditional node) {
        walk(node.condition());
        walk(node.trueExpression());
        walk(node.falseExpression());
        return null;
    }

    @Override
    public Void visitTuple(Expression.Tuple node) {
        walkAll(node.components());
        return null;
    }

    @Override
    public Void visitNew(Expression.New node) {
        return null;
    }

    @Override
    public Void visitTypeExpression(Expression.TypeExpression node) {
        return null;
    }
}
