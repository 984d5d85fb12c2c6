package org.finos.formulex.transpiler;

import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.dsl.OperatorSpec;

import java.util.Optional;

/**
 * Decides which operands the formatter wraps in parentheses.
 * 
 * Literals, identifiers and function calls are never offered to a policy;
 * they are self-delimiting under every policy.
 * 
 * Any implementation must at least wrap the operands whose removal of
 * parentheses would change the parse, otherwise formatting stops being a
 * round trip.
 */
public interface ParenthesizationPolicy {

    /**
     * @return The policy name accepted by {@link #named(String)}
     */
    String name();

    /**
     * Whether an operator operand of an infix operator needs parentheses.
     * 
     * @param parent              The infix operator
     * @param operand             The operand node
     * @param operandSpec         The operator the operand applies (infix or prefix)
     * @param side                Which side of {@code parent} the operand is on
     * @param followingPrecedence Precedence of the operator that will follow the
     *                            operand's text, 0 if the text ends the group
     * @return true to parenthesize the operand
     */
    boolean wrapOperand(OperatorSpec parent, ExpressionNode operand, OperatorSpec operandSpec,
            OperandSide side, int followingPrecedence);

    /**
     * Whether the operand of a prefix operator ({@code -}, {@code not}) needs
     * parentheses.
     * 
     * @param prefix              The prefix operator
     * @param operand             The operand node
     * @param operandSpec         The operator the operand applies, empty for
     *                            literals, identifiers and function calls
     * @param followingPrecedence Precedence of the operator that will follow the
     *                            operand's text, 0 if the text ends the group
     * @return true to parenthesize the operand
     */
    boolean wrapPrefixOperand(OperatorSpec prefix, ExpressionNode operand, Optional<OperatorSpec> operandSpec,
            int followingPrecedence);

    /**
     * Resolves a policy by name, case-insensitively.
     * 
     * @throws IllegalArgumentException for unknown names
     */
    static ParenthesizationPolicy named(String name) {
        if (ExplicitGroupingPolicy.INSTANCE.name().equalsIgnoreCase(name)) {
            return ExplicitGroupingPolicy.INSTANCE;
        }
        if (MinimalPolicy.INSTANCE.name().equalsIgnoreCase(name)) {
            return MinimalPolicy.INSTANCE;
        }
        throw new IllegalArgumentException("Unknown parenthesization policy: " + name
                + " (expected " + ExplicitGroupingPolicy.INSTANCE.name() + " or " + MinimalPolicy.INSTANCE.name() + ")");
    }
}
