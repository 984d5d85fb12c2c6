package org.finos.formulex.transpiler;

/**
 * Position of an operand relative to its infix operator.
 */
public enum OperandSide {
    LEFT,
    RIGHT
}
