package org.finos.formulex.transpiler;

import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.dsl.OperatorSpec;

import java.util.Optional;

/**
 * Emits only the parentheses the parser needs to rebuild the same tree.
 * 
 * An infix operand is wrapped only when its precedence is below the context of
 * its side. A prefix application reads every following operator that binds at
 * least as tightly as the prefix operator, so it is wrapped only when the
 * operator after its text would bind that tightly.
 * 
 * Examples: a + b * c, (a + b) * c, a - (b - c), (a ** b) ** c, -a + b,
 * a and not b, (not a) == b.
 */
public final class MinimalPolicy implements ParenthesizationPolicy {

    public static final MinimalPolicy INSTANCE = new MinimalPolicy();

    private MinimalPolicy() {
        // Singleton
    }

    @Override
    public String name() {
        return "minimal";
    }

    @Override
    public String toString() {
        return name();
    }

    @Override
    public boolean wrapOperand(OperatorSpec parent, ExpressionNode operand, OperatorSpec operandSpec,
            OperandSide side, int followingPrecedence) {
        if (operandSpec.isPrefix()) {
            int following = side == OperandSide.LEFT ? parent.precedence() : followingPrecedence;
            return following >= operandSpec.precedence();
        }

        int context = side == OperandSide.LEFT
                ? parent.leftOperandPrecedence()
                : parent.rightOperandPrecedence();
        return operandSpec.precedence() < context;
    }

    @Override
    public boolean wrapPrefixOperand(OperatorSpec prefix, ExpressionNode operand, Optional<OperatorSpec> operandSpec,
            int followingPrecedence) {
        if (operandSpec.isEmpty()) {
            return false;
        }
        OperatorSpec spec = operandSpec.get();
        if (spec.isPrefix()) {
            return followingPrecedence >= spec.precedence();
        }
        return spec.precedence() < prefix.precedence();
    }
}
