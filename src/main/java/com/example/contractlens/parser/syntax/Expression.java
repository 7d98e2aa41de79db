package com.example.contractlens.parser.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public sealed interface Expression {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitIdentifier(Identifier node);

        R visitLiteral(Literal node);

        R visitMemberAccess(MemberAccess node);

        R visitIndexAccess(IndexAccess node);

        R visitIndexRangeAccess(IndexRangeAccess node);

        R visitFunctionCall(FunctionCall node);

        R visitCallOptions(CallOptions node);

        R visitUnaryOperation(UnaryOperation node);

        R visitBinaryOperation(BinaryOperation node);

        R visitConditional(Conditional node);

        R visitTuple(Tuple node);

        R visitNew(New node);

        R visitTypeExpression(TypeExpression node);
    }

    enum LiteralKind {
        NUMBER,
        STRING,
        HEX,
        BOOLEAN
    }

    record Identifier(String name) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /** Number literals keep their unit suffix, e.g. {@code 1 ether}. */
    record Literal(LiteralKind kind, String value) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record MemberAccess(Expression expression, String memberName) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMemberAccess(this);
        }
    }

    /** {@code index} is null for the type form {@code T[]}. */
    record IndexAccess(Expression base, Expression index) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndexAccess(this);
        }
    }

    record IndexRangeAccess(Expression base, Expression start, Expression end) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndexRangeAccess(this);
        }
    }

    /** {@code names} is non-empty only for named-argument calls {@code f({a: 1})}. */
    record FunctionCall(Expression expression, List<Expression> arguments, List<String> names)
            implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /** {@code target.call{value: v, gas: g}}. */
    record CallOptions(Expression expression, List<String> names, List<Expression> values)
            implements Expression {
        public CallOptions {
            names = List.copyOf(names);
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallOptions(this);
        }
    }

    record UnaryOperation(String operator, Expression subExpression, boolean prefix) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOperation(this);
        }
    }

    /** Binary and assignment operators alike. */
    record BinaryOperation(String operator, Expression left, Expression right) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOperation(this);
        }
    }

    record Conditional(Expression condition, Expression trueExpression, Expression falseExpression)
            implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    /** Parenthesized tuple or, when {@code array} is set, an inline array. Components may be null. */
    record Tuple(List<Expression> components, boolean array) implements Expression {
        public Tuple {
            components = Collections.unmodifiableList(new ArrayList<>(components));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record New(TypeName typeName) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNew(this);
        }
    }

    /** An elementary type in expression position, as in {@code address(x)}. */
    record TypeExpression(TypeName typeName) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypeExpression(this);
        }
    }
}
