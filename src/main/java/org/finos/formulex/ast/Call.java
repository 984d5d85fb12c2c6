package org.finos.formulex.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Function application: name(arg1, arg2, ...).
 * 
 * Prefix operators are represented as single-argument calls named after the
 * operator, so {@code -a} is {@code Call("-", [a])} and {@code not a} is
 * {@code Call("not", [a])}. An empty argument list is allowed.
 * 
 * @param name      The function name or prefix operator symbol
 * @param arguments The arguments in source order
 */
public record Call(
        String name,
        List<ExpressionNode> arguments) implements ExpressionNode {

    public Call {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");

        // Ensure immutability
        arguments = List.copyOf(arguments);
    }

    public static Call of(String name, ExpressionNode... arguments) {
        return new Call(name, List.of(arguments));
    }

    /**
     * Factory for a prefix operator application.
     */
    public static Call prefix(String operator, ExpressionNode operand) {
        return new Call(operator, List.of(operand));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return name + arguments.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
