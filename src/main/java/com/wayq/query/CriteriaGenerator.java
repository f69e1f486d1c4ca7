package com.wayq.query;

import com.wayq.expr.ExprNode;
import com.wayq.expr.ExprPrinter;
import com.wayq.rewrite.Operators;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Turns a rewritten expression tree into Overpass criteria. Nodes on the outermost and/or chain become tag
 * filters where possible; anything else is an evaluated {@code (if:...)} filter.
 */
public class CriteriaGenerator {
    private static final String META_CHARACTERS = "\\.+*?()|[]{}^$";
    private static final String TAG_PRESENCE_FUNCTION = "is_tag";

    public MutableList<String> generate(ExprNode tree) {
        return root(tree, false).collect(c -> isWrapped(c) ? c : evaluated(c));
    }

    private MutableList<String> root(ExprNode node, boolean negated) {
        if (Operators.isNot(node)) {
            return root(((ExprNode.UnaryOp) node).operand(), !negated);
        }
        if (node instanceof ExprNode.BinaryOp binary && Operators.isLogical(binary.operator())) {
            MutableList<String> left = root(binary.left(), false);
            MutableList<String> right = root(binary.right(), false);
            if (negated) {
                throw inversion(binary.operator());
            }
            return Operators.isAnd(binary.operator()) ? intersect(left, right) : union(left, right);
        }
        return Lists.mutable.with(emit(node, true, negated));
    }

    private static MutableList<String> intersect(MutableList<String> left, MutableList<String> right) {
        MutableList<String> criteria = Lists.mutable.empty();
        for (String lhs : left) {
            for (String rhs : right) {
                if (!isWrapped(lhs) && !isWrapped(rhs)) {
                    criteria.add(lhs + "&&" + rhs);
                } else {
                    criteria.add(wrap(lhs) + wrap(rhs));
                }
            }
        }
        return criteria;
    }

    private static MutableList<String> union(MutableList<String> left, MutableList<String> right) {
        MutableList<String> criteria = Lists.mutable.withAll(left);
        // the last criterion on the left joins the right one when both are plain expressions
        if (right.size() == 1 && criteria.notEmpty()
                && !isWrapped(criteria.getLast()) && !isWrapped(right.getFirst())) {
            criteria.set(criteria.size() - 1, criteria.getLast() + "||" + right.getFirst());
            return criteria;
        }
        return criteria.withAll(right);
    }

    private String nested(ExprNode node) {
        return emit(node, false, false);
    }

    private String emit(ExprNode node, boolean root, boolean negated) {
        if (node instanceof ExprNode.Identifier id) {
            String name = quoteIfNeeded(id.name());
            if (!root) {
                return bangIf(name, negated);
            }
            return "[" + name + (negated ? "=\"no\"]" : "=\"yes\"]");
        }
        if (node instanceof ExprNode.IntegerLiteral i) {
            rejectInversion(node, negated);
            return Long.toString(i.value());
        }
        if (node instanceof ExprNode.FloatLiteral f) {
            rejectInversion(node, negated);
            return ExprPrinter.formatFloat(f.value());
        }
        if (node instanceof ExprNode.StringLiteral s) {
            rejectInversion(node, negated);
            return quote(s.value());
        }
        if (node instanceof ExprNode.BoolLiteral b) {
            return b.value() != negated ? "\"yes\"" : "\"no\"";
        }
        if (node instanceof ExprNode.UnaryOp u) {
            return bangIf(u.operator(), negated) + "(" + nested(u.operand()) + ")";
        }
        if (node instanceof ExprNode.BinaryOp b) {
            return binary(b, root, negated);
        }
        if (node instanceof ExprNode.MatchesOp m) {
            String lhs = nested(m.left());
            String rhs = nested(m.right());
            return root ? "[" + lhs + bangIf("~", negated) + rhs + "]" : lhs + bangIf("~", negated) + rhs;
        }
        if (node instanceof ExprNode.FunctionCall f) {
            ImmutableList<String> args = f.arguments().collect(this::nested);
            if (root && f.name().equals(TAG_PRESENCE_FUNCTION) && args.size() == 1) {
                return "[" + bangIf(args.getFirst(), negated) + "]";
            }
            return bangIf(f.name(), negated) + "(" + args.makeString(",") + ")";
        }
        if (node instanceof ExprNode.ConditionalOp c) {
            String text = nested(c.condition()) + "?" + nested(c.whenTrue()) + ":" + nested(c.whenFalse());
            return root && negated ? "!(" + text + ")" : text;
        }

        // No Overpass form; children still go first so the earliest failure is the one reported
        if (node instanceof ExprNode.ArrayLiteral a) {
            a.elements().each(this::nested);
        } else if (node instanceof ExprNode.RangeLiteral r) {
            nested(r.from());
            nested(r.to());
        } else if (node instanceof ExprNode.MemberAccess m) {
            nested(m.target());
        }
        throw unsupported(node.kind() + " not supported");
    }

    private String binary(ExprNode.BinaryOp node, boolean root, boolean negated) {
        String lhs = nested(node.left());
        String rhs = nested(node.right());
        String op = node.operator();

        if (Operators.isLogical(op)) {
            return lhs + (Operators.isAnd(op) ? "&&" : "||") + rhs;
        }
        if (Operators.isComparison(op)) {
            if (node.left() instanceof ExprNode.Identifier) {
                lhs = "t[" + (lhs.startsWith("\"") ? lhs : quote(lhs)) + "]";
            }
            String text = lhs + op + rhs;
            return root && negated ? "!(" + text + ")" : text;
        }
        if (Operators.isMembership(op)) {
            throw unsupported("membership test against " + node.right().kind() + " not supported");
        }

        boolean literal = node.right() instanceof ExprNode.StringLiteral;
        switch (op) {
            case "contains" -> {
                op = "~";
                if (literal) {
                    rhs = quoteMeta(rhs);
                }
            }
            case "startsWith" -> {
                op = "~";
                if (literal) {
                    rhs = rhs.charAt(0) + "^" + quoteMeta(rhs.substring(1));
                }
            }
            case "endsWith" -> {
                op = "~";
                if (literal) {
                    rhs = quoteMeta(rhs.substring(0, rhs.length() - 1)) + "$" + rhs.charAt(rhs.length() - 1);
                }
            }
            default -> {
            }
        }

        // A function call operand cannot be expressed as a tag filter
        if (node.left() instanceof ExprNode.FunctionCall || node.right() instanceof ExprNode.FunctionCall) {
            root = false;
        }
        if (!root) {
            return lhs + bangIf(op, negated) + rhs;
        }

        if (op.equals(Operators.EQ) || op.equals(Operators.NE)) {
            if (node.right() instanceof ExprNode.Identifier) {
                String swap = lhs;
                lhs = rhs;
                rhs = swap;
            }
            if (op.equals(Operators.NE)) {
                negated = !negated;
            }
            if (rhs.equals("\"\"")) {
                op = "~";
                rhs = "\"^$\"";
            } else {
                op = "=";
            }
        }
        return "[" + lhs + bangIf(op, negated) + rhs + "]";
    }

    private static void rejectInversion(ExprNode literal, boolean negated) {
        if (negated) {
            throw new QueryCompileException(QueryCompileException.Reason.UNSUPPORTED_INVERSION,
                    "inverted " + literal.kind() + " not supported");
        }
    }

    private static QueryCompileException inversion(String operator) {
        return new QueryCompileException(QueryCompileException.Reason.UNSUPPORTED_INVERSION,
                "inverted " + operator + " not supported");
    }

    private static QueryCompileException unsupported(String message) {
        return new QueryCompileException(QueryCompileException.Reason.UNSUPPORTED_NODE, message);
    }

    static boolean isWrapped(String criterion) {
        return criterion.startsWith("[") || criterion.startsWith("(if:");
    }

    static String evaluated(String criterion) {
        return "(if:" + criterion + ")";
    }

    private static String wrap(String criterion) {
        return isWrapped(criterion) ? criterion : evaluated(criterion);
    }

    private static String bangIf(String text, boolean negated) {
        return negated ? "!" + text : text;
    }

    static String quoteIfNeeded(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(c >= 'a' && c <= 'z') && !(c >= 'A' && c <= 'Z')) {
                return quote(name);
            }
        }
        return name;
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u0007' -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\u000b' -> sb.append("\\v");
                default -> {
                    // hex escape for ASCII controls, four-digit unicode escape above
                    if (c < 0x80 && Character.isISOControl(c)) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    static String quoteMeta(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 2);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (META_CHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
