package com.wayq.rewrite;

import com.wayq.expr.ExprNode;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Operator classification and the duality table used when folding negations.
 */
public final class Operators {
    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String EQ = "==";
    public static final String NE = "!=";
    public static final String GTE = ">=";
    public static final String LTE = "<=";
    public static final String IN = "in";
    public static final String NOT_IN = "not in";

    private static final ImmutableMap<String, String> DUALS = buildDuals();

    private Operators() {
    }

    private static ImmutableMap<String, String> buildDuals() {
        MutableMap<String, String> duals = Maps.mutable.<String, String>empty()
                .withKeyValue(AND, OR)
                .withKeyValue("&&", "||")
                .withKeyValue(EQ, NE)
                .withKeyValue(GTE, "<")
                .withKeyValue(">", LTE)
                .withKeyValue(IN, NOT_IN);
        return duals.withAllKeyValues(duals.flipUniqueValues().keyValuesView()).toImmutable();
    }

    /**
     * Returns the operator whose result is the negation of {@code operator}, or {@code null} if there is none.
     */
    public static String dual(String operator) {
        return DUALS.get(operator);
    }

    public static boolean isAnd(String operator) {
        return operator.equals(AND) || operator.equals("&&");
    }

    public static boolean isOr(String operator) {
        return operator.equals(OR) || operator.equals("||");
    }

    public static boolean isLogical(String operator) {
        return isAnd(operator) || isOr(operator);
    }

    public static boolean isNot(String operator) {
        return operator.equals(NOT) || operator.equals("!");
    }

    public static boolean isMembership(String operator) {
        return operator.equals(IN) || operator.equals(NOT_IN);
    }

    public static boolean isComparison(String operator) {
        return switch (operator) {
            case ">", ">=", "<", "<=" -> true;
            default -> false;
        };
    }

    public static boolean isAnd(ExprNode node) {
        return node instanceof ExprNode.BinaryOp b && isAnd(b.operator());
    }

    public static boolean isOr(ExprNode node) {
        return node instanceof ExprNode.BinaryOp b && isOr(b.operator());
    }

    public static boolean isLogical(ExprNode node) {
        return node instanceof ExprNode.BinaryOp b && isLogical(b.operator());
    }

    public static boolean isNot(ExprNode node) {
        return node instanceof ExprNode.UnaryOp u && isNot(u.operator());
    }
}
