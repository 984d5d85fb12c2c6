package org.finos.formulex.dsl;

import java.util.Objects;

/**
 * Precedence and associativity of one operator symbol.
 * 
 * @param symbol        The operator as written in source (e.g. "+", "and")
 * @param precedence    Binding strength, higher binds tighter
 * @param associativity Grouping of equal-precedence chains
 * @param fixity        Whether the operator sits between or before its operands
 */
public record OperatorSpec(
        String symbol,
        int precedence,
        Associativity associativity,
        Fixity fixity) {

    public enum Associativity {
        LEFT,
        RIGHT
    }

    public enum Fixity {
        INFIX,
        PREFIX
    }

    public OperatorSpec {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(associativity, "Associativity cannot be null");
        Objects.requireNonNull(fixity, "Fixity cannot be null");
        if (precedence < 1) {
            throw new IllegalArgumentException("Precedence must be >= 1, got " + precedence);
        }
    }

    public static OperatorSpec infix(String symbol, int precedence, Associativity associativity) {
        return new OperatorSpec(symbol, precedence, associativity, Fixity.INFIX);
    }

    public static OperatorSpec prefix(String symbol, int precedence) {
        return new OperatorSpec(symbol, precedence, Associativity.RIGHT, Fixity.PREFIX);
    }

    public boolean isLeftAssociative() {
        return associativity == Associativity.LEFT;
    }

    public boolean isPrefix() {
        return fixity == Fixity.PREFIX;
    }

    /**
     * Minimum precedence of the operand parsed after this operator.
     * Left-associative operators forbid an equal-precedence operator from
     * binding on their right; right-associative operators allow it.
     */
    public int rightOperandPrecedence() {
        return isLeftAssociative() ? precedence + 1 : precedence;
    }

    /**
     * Minimum precedence an operand can have on its left without parentheses.
     */
    public int leftOperandPrecedence() {
        return isLeftAssociative() ? precedence : precedence + 1;
    }

    /**
     * @return true for operators spelled as words ("and", "not"), which need
     *         surrounding whitespace
     */
    public boolean isWord() {
        return Character.isLetter(symbol.charAt(0));
    }
}
