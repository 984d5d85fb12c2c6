package org.finos.formulex.ast;

/**
 * Sealed interface representing nodes of a parsed formula.
 * 
 * Type hierarchy:
 * ExpressionNode
 * ├── Literal (numeric literal, kept verbatim)
 * ├── Identifier (variable reference)
 * ├── Call (function application, also prefix operators: -a, not a)
 * └── BinaryOp (infix operator application)
 * 
 * Nodes are immutable and never shared between parents.
 */
public sealed interface ExpressionNode
        permits Literal, Identifier, Call, BinaryOp {

    /**
     * Accept method for the expression visitor pattern.
     * 
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
