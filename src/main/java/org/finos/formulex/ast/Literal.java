package org.finos.formulex.ast;

import java.util.Objects;

/**
 * Numeric literal, stored exactly as written (no rounding or normalization).
 * 
 * @param text The literal text, e.g. "42" or "3.50"
 */
public record Literal(String text) implements ExpressionNode {

    public Literal {
        Objects.requireNonNull(text, "Text cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
