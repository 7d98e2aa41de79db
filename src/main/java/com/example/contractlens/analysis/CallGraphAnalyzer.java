package com.example.contractlens.analysis;

import com.example.contractlens.domain.ExternalCall;
import com.example.contractlens.parser.syntax.Expression;
import com.example.contractlens.parser.syntax.Statement;
import com.example.contractlens.parser.syntax.SyntaxWalker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes complexity and call targets of a function body.
 *
 * <p>Complexity starts at 1 and adds one for every {@code if}, {@code for},
 * {@code while}, {@code do}-{@code while}, ternary, {@code require}/{@code assert}
 * call and short-circuit {@code &&}/{@code ||}. Bare identifier calls are reported as
 * intra-contract calls. Member calls whose receiver is a variable or a type cast are
 * reported as external calls. Emitted events and reverted errors are not calls, but
 * their arguments are still inspected.
 */
@Component
public class CallGraphAnalyzer {

    public int complexity(Statement.Block body) {
        return analyze(body).complexity();
    }

    public Set<String> calls(Statement.Block body) {
        return analyze(body).calls();
    }

    public List<ExternalCall> externalCalls(Statement.Block body) {
        return analyze(body).externalCalls();
    }

    /** A missing body (interface or abstract declaration) has complexity 1 and no calls. */
    public CallGraph analyze(Statement.Block body) {
        BodyWalker walker = new BodyWalker();
        if (body != null) {
            body.accept(walker);
        }
        return new CallGraph(walker.complexity, walker.calls, walker.externalCalls);
    }

    private static final class BodyWalker extends SyntaxWalker {
        private int complexity = 1;
        private final Set<String> calls = new LinkedHashSet<>();
        private final List<ExternalCall> externalCalls = new ArrayList<>();

        @Override
        public Void visitIf(Statement.IfStatement node) {
            complexity++;
            return super.visitIf(node);
        }

        @Override
        public Void visitFor(Statement.ForStatement node) {
            complexity++;
            return super.visitFor(node);
        }

        @Override
        public Void visitWhile(Statement.WhileStatement node) {
            complexity++;
            return super.visitWhile(node);
        }

        @Override
        public Void visitDoWhile(Statement.DoWhileStatement node) {
            complexity++;
            return super.visitDoWhile(node);
        }

        @Override
        public Void visitConditional(Expression.Conditional node) {
            complexity++;
            return super.visitConditional(node);
        }

        @Override
        public Void visitBinaryOperation(Expression.BinaryOperation node) {
            if (node.operator().equals("&&") || node.operator().equals("||")) {
                complexity++;
            }
            return super.visitBinaryOperation(node);
        }

        @Override
        public Void visitEmit(Statement.EmitStatement node) {
            walkAll(node.eventCall().arguments());
            return null;
        }

        @Override
        public Void visitRevert(Statement.RevertStatement node) {
            walkAll(node.errorCall().arguments());
            return null;
        }

        @Override
        public Void visitFunctionCall(Expression.FunctionCall node) {
            Expression callee = unwrapOptions(node.expression());
            if (callee instanceof Expression.Identifier identifier) {
                calls.add(identifier.name());
                if (identifier.name().equals("require") || identifier.name().equals("assert")) {
                    complexity++;
                }
            } else if (callee instanceof Expression.MemberAccess member) {
                String receiver = receiverName(member.expression());
                if (receiver != null) {
                    externalCalls.add(new ExternalCall(receiver, member.memberName()));
                }
            }
            return super.visitFunctionCall(node);
        }

        private static Expression unwrapOptions(Expression callee) {
            Expression current = callee;
            while (current instanceof Expression.CallOptions options) {
                current = options.expression();
            }
            return current;
        }

        /** Variable name for {@code token.f()}, cast target for {@code IERC20(a).f()}; null otherwise. */
        private static String receiverName(Expression receiver) {
            if (receiver instanceof Expression.Identifier identifier) {
                return identifier.name();
            }
            if (receiver instanceof Expression.FunctionCall cast) {
                if (cast.expression() instanceof Expression.Identifier target) {
                    return target.name();
                }
                if (cast.expression() instanceof Expression.TypeExpression type) {
                    return type.typeName().render();
                }
            }
            return null;
        }
    }
}
