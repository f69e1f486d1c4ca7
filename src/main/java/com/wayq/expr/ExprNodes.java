package com.wayq.expr;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.function.UnaryOperator;

/**
 * Structural helpers shared by the rewrite passes.
 */
public final class ExprNodes {

    private ExprNodes() {
    }

    /**
     * Returns a node of the same kind whose direct children have been replaced by {@code rewrite} applied to
     * each of them. Leaves are returned as they are; a composite is returned unchanged when none of its
     * children changed.
     */
    public static ExprNode mapChildren(ExprNode node, UnaryOperator<ExprNode> rewrite) {
        if (node instanceof ExprNode.UnaryOp u) {
            ExprNode operand = rewrite.apply(u.operand());
            return operand == u.operand() ? u : new ExprNode.UnaryOp(u.operator(), operand);
        }
        if (node instanceof ExprNode.BinaryOp b) {
            ExprNode left = rewrite.apply(b.left());
            ExprNode right = rewrite.apply(b.right());
            return left == b.left() && right == b.right() ? b : new ExprNode.BinaryOp(b.operator(), left, right);
        }
        if (node instanceof ExprNode.MatchesOp m) {
            ExprNode left = rewrite.apply(m.left());
            ExprNode right = rewrite.apply(m.right());
            return left == m.left() && right == m.right() ? m : new ExprNode.MatchesOp(left, right);
        }
        if (node instanceof ExprNode.ConditionalOp c) {
            ExprNode condition = rewrite.apply(c.condition());
            ExprNode whenTrue = rewrite.apply(c.whenTrue());
            ExprNode whenFalse = rewrite.apply(c.whenFalse());
            if (condition == c.condition() && whenTrue == c.whenTrue() && whenFalse == c.whenFalse()) {
                return c;
            }
            return new ExprNode.ConditionalOp(condition, whenTrue, whenFalse);
        }
        if (node instanceof ExprNode.RangeLiteral r) {
            ExprNode from = rewrite.apply(r.from());
            ExprNode to = rewrite.apply(r.to());
            return from == r.from() && to == r.to() ? r : new ExprNode.RangeLiteral(from, to);
        }
        if (node instanceof ExprNode.ArrayLiteral a) {
            ImmutableList<ExprNode> elements = mapAll(a.elements(), rewrite);
            return elements == a.elements() ? a : new ExprNode.ArrayLiteral(elements);
        }
        if (node instanceof ExprNode.FunctionCall f) {
            ImmutableList<ExprNode> arguments = mapAll(f.arguments(), rewrite);
            return arguments == f.arguments() ? f : new ExprNode.FunctionCall(f.name(), arguments);
        }
        if (node instanceof ExprNode.MemberAccess m) {
            ExprNode target = rewrite.apply(m.target());
            return target == m.target() ? m : new ExprNode.MemberAccess(target, m.property());
        }
        return node;
    }

    private static ImmutableList<ExprNode> mapAll(ImmutableList<ExprNode> nodes, UnaryOperator<ExprNode> rewrite) {
        ImmutableList<ExprNode> mapped = nodes.collect(rewrite::apply);
        return mapped.corresponds(nodes, (after, before) -> after == before) ? nodes : mapped;
    }

    /**
     * Returns the literal value of {@code node}, or {@code null} if it is not a literal with a value.
     */
    public static Object literalValue(ExprNode node) {
        if (node instanceof ExprNode.IntegerLiteral i) {
            return i.value();
        }
        if (node instanceof ExprNode.FloatLiteral f) {
            return f.value();
        }
        if (node instanceof ExprNode.BoolLiteral b) {
            return b.value();
        }
        if (node instanceof ExprNode.StringLiteral s) {
            return s.value();
        }
        return null;
    }
}
