package com.wayq.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public sealed interface ExprNode {

    /**
     * Short lower-case name of the node kind, used in error messages.
     */
    String kind();

    record Identifier(String name) implements ExprNode {
        @Override
        public String kind() {
            return "identifier";
        }
    }

    record IntegerLiteral(long value) implements ExprNode {
        @Override
        public String kind() {
            return "integer";
        }
    }

    record FloatLiteral(double value) implements ExprNode {
        @Override
        public String kind() {
            return "float";
        }
    }

    record BoolLiteral(boolean value) implements ExprNode {
        @Override
        public String kind() {
            return "bool";
        }
    }

    record StringLiteral(String value) implements ExprNode {
        @Override
        public String kind() {
            return "string";
        }
    }

    record NilLiteral() implements ExprNode {
        @Override
        public String kind() {
            return "nil";
        }
    }

    record ArrayLiteral(ImmutableList<ExprNode> elements) implements ExprNode {
        public static ArrayLiteral of(ExprNode... elements) {
            return new ArrayLiteral(Lists.immutable.with(elements));
        }

        @Override
        public String kind() {
            return "array";
        }
    }

    record RangeLiteral(ExprNode from, ExprNode to) implements ExprNode {
        @Override
        public String kind() {
            return "range";
        }
    }

    record UnaryOp(String operator, ExprNode operand) implements ExprNode {
        @Override
        public String kind() {
            return "unary";
        }
    }

    record BinaryOp(String operator, ExprNode left, ExprNode right) implements ExprNode {
        @Override
        public String kind() {
            return "binary";
        }
    }

    // Explicit regex test: left matches right
    record MatchesOp(ExprNode left, ExprNode right) implements ExprNode {
        public String operator() {
            return "matches";
        }

        @Override
        public String kind() {
            return "matches";
        }
    }

    record FunctionCall(String name, ImmutableList<ExprNode> arguments) implements ExprNode {
        public static FunctionCall of(String name, ExprNode... arguments) {
            return new FunctionCall(name, Lists.immutable.with(arguments));
        }

        @Override
        public String kind() {
            return "function";
        }
    }

    record ConditionalOp(ExprNode condition, ExprNode whenTrue, ExprNode whenFalse) implements ExprNode {
        public String operator() {
            return "?";
        }

        @Override
        public String kind() {
            return "conditional";
        }
    }

    record MemberAccess(ExprNode target, String property) implements ExprNode {
        @Override
        public String kind() {
            return "member";
        }
    }
}
