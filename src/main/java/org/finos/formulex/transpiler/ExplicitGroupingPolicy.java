package org.finos.formulex.transpiler;

import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.ast.Identifier;
import org.finos.formulex.ast.Literal;
import org.finos.formulex.dsl.OperatorSpec;

import java.util.Optional;

/**
 * The default policy: makes every grouping visible except plain
 * left-associative chains.
 * 
 * An operand of an infix operator is parenthesized when
 * - its precedence is below the context of its side (the operator's own
 *   precedence on the associative side, one more on the other side),
 * - its precedence is higher than the operator's, or
 * - its precedence is equal and it is not the left operand of a
 *   left-associative operator.
 * 
 * Prefix applications used as operands are always parenthesized, and a prefix
 * operator's own operand is bare only when it is a literal or identifier.
 * 
 * Examples: a + (b * c), (a * b) + c, a - b - c, a ** (b ** c), (-a) + b,
 * -(abs(a - b)).
 */
public final class ExplicitGroupingPolicy implements ParenthesizationPolicy {

    public static final ExplicitGroupingPolicy INSTANCE = new ExplicitGroupingPolicy();

    private ExplicitGroupingPolicy() {
        // Singleton
    }

    @Override
    public String name() {
        return "explicit";
    }

    @Override
    public String toString() {
        return name();
    }

    @Override
    public boolean wrapOperand(OperatorSpec parent, ExpressionNode operand, OperatorSpec operandSpec,
            OperandSide side, int followingPrecedence) {
        if (operandSpec.isPrefix()) {
            return true;
        }

        int context = side == OperandSide.LEFT
                ? parent.leftOperandPrecedence()
                : parent.rightOperandPrecedence();
        if (operandSpec.precedence() < context) {
            return true;
        }
        if (operandSpec.precedence() > parent.precedence()) {
            return true;
        }
        return operandSpec.precedence() == parent.precedence()
                && !(parent.isLeftAssociative() && side == OperandSide.LEFT);
    }

    @Override
    public boolean wrapPrefixOperand(OperatorSpec prefix, ExpressionNode operand, Optional<OperatorSpec> operandSpec,
            int followingPrecedence) {
        return !(operand instanceof Literal || operand instanceof Identifier);
    }
}
