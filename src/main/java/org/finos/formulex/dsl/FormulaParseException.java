package org.finos.formulex.dsl;

/**
 * Exception thrown when a formula cannot be tokenized, parsed or formatted.
 * Includes the offending source position when one is known.
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    public FormulaParseException(String message) {
        super(message);
        this.position = -1;
    }

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public FormulaParseException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position >= 0;
    }
}
