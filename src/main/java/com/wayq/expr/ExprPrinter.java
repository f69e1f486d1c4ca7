package com.wayq.expr;

import java.math.BigDecimal;

/**
 * Renders an expression tree back into filter syntax. Composite operands are parenthesised so the
 * printed text shows the tree shape regardless of operator precedence.
 */
public final class ExprPrinter {

    private ExprPrinter() {
    }

    public static String print(ExprNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, sb);
        return sb.toString();
    }

    private static void print(ExprNode node, StringBuilder sb) {
        if (node instanceof ExprNode.Identifier id) {
            sb.append(id.name());
        } else if (node instanceof ExprNode.IntegerLiteral i) {
            sb.append(i.value());
        } else if (node instanceof ExprNode.FloatLiteral f) {
            sb.append(formatFloat(f.value()));
        } else if (node instanceof ExprNode.BoolLiteral b) {
            sb.append(b.value());
        } else if (node instanceof ExprNode.StringLiteral s) {
            sb.append('\'').append(s.value().replace("\\", "\\\\").replace("'", "\\'")).append('\'');
        } else if (node instanceof ExprNode.NilLiteral) {
            sb.append("nil");
        } else if (node instanceof ExprNode.ArrayLiteral a) {
            sb.append('[');
            for (int i = 0; i < a.elements().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                print(a.elements().get(i), sb);
            }
            sb.append(']');
        } else if (node instanceof ExprNode.RangeLiteral r) {
            operand(r.from(), sb);
            sb.append("..");
            operand(r.to(), sb);
        } else if (node instanceof ExprNode.UnaryOp u) {
            sb.append(u.operator());
            if (Character.isLetter(u.operator().charAt(0))) {
                sb.append(' ');
            }
            operand(u.operand(), sb);
        } else if (node instanceof ExprNode.BinaryOp b) {
            operand(b.left(), sb);
            sb.append(' ').append(b.operator()).append(' ');
            operand(b.right(), sb);
        } else if (node instanceof ExprNode.MatchesOp m) {
            operand(m.left(), sb);
            sb.append(" matches ");
            operand(m.right(), sb);
        } else if (node instanceof ExprNode.FunctionCall f) {
            sb.append(f.name()).append('(');
            for (int i = 0; i < f.arguments().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                print(f.arguments().get(i), sb);
            }
            sb.append(')');
        } else if (node instanceof ExprNode.ConditionalOp c) {
            operand(c.condition(), sb);
            sb.append(" ? ");
            operand(c.whenTrue(), sb);
            sb.append(" : ");
            operand(c.whenFalse(), sb);
        } else if (node instanceof ExprNode.MemberAccess m) {
            operand(m.target(), sb);
            sb.append('.').append(m.property());
        }
    }

    private static void operand(ExprNode node, StringBuilder sb) {
        boolean composite = node instanceof ExprNode.UnaryOp
                || node instanceof ExprNode.BinaryOp
                || node instanceof ExprNode.MatchesOp
                || node instanceof ExprNode.ConditionalOp
                || node instanceof ExprNode.RangeLiteral;
        if (composite) {
            sb.append('(');
            print(node, sb);
            sb.append(')');
        } else {
            print(node, sb);
        }
    }

    /**
     * Plain decimal form of a double without exponent or trailing zeros, e.g. {@code 1.5}, {@code 1000}.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
