package org.finos.formulex.ast;

import java.util.Objects;

/**
 * Infix operator application: left op right.
 * 
 * @param left     The left operand
 * @param operator The operator symbol, always an infix entry of the operator
 *                 table when built by the parser
 * @param right    The right operand
 */
public record BinaryOp(
        ExpressionNode left,
        String operator,
        ExpressionNode right) implements ExpressionNode {

    public BinaryOp {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryOp of(ExpressionNode left, String operator, ExpressionNode right) {
        return new BinaryOp(left, operator, right);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBinaryOp(this);
    }

    /**
     * Fully parenthesized form, for debugging and test messages.
     */
    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
