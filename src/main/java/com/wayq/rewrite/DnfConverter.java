package com.wayq.rewrite;

import com.wayq.expr.ExprNode;
import com.wayq.expr.ExprPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes {@code and} over {@code or} along the outermost and/or chain, one traversal per round, until a
 * round changes nothing or the round limit runs out.
 */
public class DnfConverter {
    public static final int DEFAULT_MAX_ROUNDS = 1000;

    private static final Logger LOGGER = LoggerFactory.getLogger(DnfConverter.class);

    private final int maxRounds;

    public DnfConverter() {
        this(DEFAULT_MAX_ROUNDS);
    }

    public DnfConverter(int maxRounds) {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must not be negative: " + maxRounds);
        }
        this.maxRounds = maxRounds;
    }

    public record Conversion(ExprNode node, int rewrites, boolean converged) {
    }

    public Conversion convert(ExprNode node) {
        ExprNode current = node;
        for (int round = 0; round <= maxRounds; round++) {
            Round pass = new Round();
            current = pass.distribute(current);
            if (!pass.applied) {
                return new Conversion(current, round, true);
            }
        }
        LOGGER.warn("DNF conversion gave up after {} rounds: {}", maxRounds + 1, ExprPrinter.print(current));
        return new Conversion(current, maxRounds + 1, false);
    }

    private static final class Round {
        private boolean applied;

        ExprNode distribute(ExprNode node) {
            if (!(node instanceof ExprNode.BinaryOp binary) || !Operators.isLogical(binary.operator())) {
                return node;
            }
            ExprNode left = distribute(binary.left());
            ExprNode right = distribute(binary.right());

            if (Operators.isAnd(binary.operator())) {
                if (left instanceof ExprNode.BinaryOp or && Operators.isOr(or.operator())) {
                    applied = true;
                    return new ExprNode.BinaryOp(or.operator(),
                            new ExprNode.BinaryOp(binary.operator(), or.left(), right),
                            new ExprNode.BinaryOp(binary.operator(), or.right(), right));
                }
                if (right instanceof ExprNode.BinaryOp or && Operators.isOr(or.operator())) {
                    applied = true;
                    return new ExprNode.BinaryOp(or.operator(),
                            new ExprNode.BinaryOp(binary.operator(), left, or.left()),
                            new ExprNode.BinaryOp(binary.operator(), left, or.right()));
                }
            }
            if (left == binary.left() && right == binary.right()) {
                return binary;
            }
            return new ExprNode.BinaryOp(binary.operator(), left, right);
        }
    }
}
