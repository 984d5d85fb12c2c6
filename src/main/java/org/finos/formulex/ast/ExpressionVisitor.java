package org.finos.formulex.ast;

/**
 * Visitor interface for traversing formula trees.
 * 
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitLiteral(Literal literal);

    T visitIdentifier(Identifier identifier);

    /**
     * Visit a function call or prefix operator application.
     */
    T visitCall(Call call);

    T visitBinaryOp(BinaryOp binaryOp);
}
