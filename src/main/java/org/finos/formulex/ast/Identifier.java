package org.finos.formulex.ast;

import java.util.Objects;

/**
 * Variable reference.
 * 
 * @param name The variable name
 */
public record Identifier(String name) implements ExpressionNode {

    public Identifier {
        Objects.requireNonNull(name, "Name cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
