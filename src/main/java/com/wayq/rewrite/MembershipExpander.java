package com.wayq.rewrite;

import com.wayq.expr.ExprNode;
import com.wayq.expr.ExprNodes;

import java.util.Objects;

/**
 * Rewrites membership tests against literal arrays and ranges into equality and comparison trees.
 *
 * <p>For example {@code a not in ['b','c']} becomes {@code not ((a == 'b') or (a == 'c'))} and
 * {@code a in 2..6} becomes {@code (a >= 2) and (a <= 6)}. Membership against anything else is left alone.
 */
public class MembershipExpander {

    public ExprNode expand(ExprNode node) {
        ExprNode expanded = ExprNodes.mapChildren(node, this::expand);
        if (!(expanded instanceof ExprNode.BinaryOp membership) || !Operators.isMembership(membership.operator())) {
            return expanded;
        }

        ExprNode result;
        if (membership.right() instanceof ExprNode.ArrayLiteral array) {
            result = expandArray(membership.left(), array);
        } else if (membership.right() instanceof ExprNode.RangeLiteral range) {
            result = expandRange(membership.left(), range);
        } else {
            return expanded;
        }

        if (membership.operator().equals(Operators.NOT_IN)) {
            result = new ExprNode.UnaryOp(Operators.NOT, result);
        }
        return result;
    }

    private static ExprNode expandArray(ExprNode subject, ExprNode.ArrayLiteral array) {
        if (array.elements().isEmpty()) {
            return new ExprNode.BoolLiteral(false);
        }
        ExprNode result = null;
        for (ExprNode element : array.elements()) {
            ExprNode equals = new ExprNode.BinaryOp(Operators.EQ, subject, element);
            result = result == null ? equals : new ExprNode.BinaryOp(Operators.OR, result, equals);
        }
        return result;
    }

    private static ExprNode expandRange(ExprNode subject, ExprNode.RangeLiteral range) {
        if (sameLiteral(range.from(), range.to())) {
            return new ExprNode.BinaryOp(Operators.EQ, subject, range.from());
        }
        return new ExprNode.BinaryOp(Operators.AND,
                new ExprNode.BinaryOp(Operators.GTE, subject, range.from()),
                new ExprNode.BinaryOp(Operators.LTE, subject, range.to()));
    }

    private static boolean sameLiteral(ExprNode a, ExprNode b) {
        Object left = ExprNodes.literalValue(a);
        return left != null && Objects.equals(left, ExprNodes.literalValue(b));
    }
}
