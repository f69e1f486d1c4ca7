package com.wayq.rewrite;

import com.wayq.expr.ExprNode;
import com.wayq.expr.ExprNodes;

/**
 * Pushes negations down the tree: De Morgan for and/or, operator duals for comparisons and membership,
 * double negation and boolean literals folded. Other negations stay where they are.
 */
public class NegationNormalizer {

    public ExprNode normalize(ExprNode node) {
        if (node instanceof ExprNode.UnaryOp negation && Operators.isNot(negation.operator())) {
            ExprNode operand = negation.operand();

            if (operand instanceof ExprNode.UnaryOp inner && Operators.isNot(inner.operator())) {
                return normalize(inner.operand());
            }
            if (operand instanceof ExprNode.BoolLiteral bool) {
                return new ExprNode.BoolLiteral(!bool.value());
            }
            if (operand instanceof ExprNode.BinaryOp binary && Operators.dual(binary.operator()) != null) {
                node = flip(negation.operator(), binary);
            }
        }
        return ExprNodes.mapChildren(node, this::normalize);
    }

    private static ExprNode flip(String negation, ExprNode.BinaryOp binary) {
        String dual = Operators.dual(binary.operator());
        if (Operators.isLogical(binary.operator())) {
            return new ExprNode.BinaryOp(dual,
                    new ExprNode.UnaryOp(negation, binary.left()),
                    new ExprNode.UnaryOp(negation, binary.right()));
        }
        return new ExprNode.BinaryOp(dual, binary.left(), binary.right());
    }
}
