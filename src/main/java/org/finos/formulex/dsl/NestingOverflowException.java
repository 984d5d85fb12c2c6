package org.finos.formulex.dsl;

/**
 * Thrown when parsing or formatting nests deeper than
 * {@link FormulaOptions#maxNestingDepth()}.
 */
public class NestingOverflowException extends FormulaParseException {

    private final int depth;

    public NestingOverflowException(int depth, int limit) {
        super("Expression nesting depth " + depth + " exceeds the limit of " + limit);
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }
}
