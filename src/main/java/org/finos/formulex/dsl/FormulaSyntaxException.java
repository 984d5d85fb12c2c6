package org.finos.formulex.dsl;

/**
 * Thrown when the token stream does not form a formula: an unexpected token in
 * primary position, a missing or mismatched parenthesis, or tokens left over
 * after a complete expression.
 */
public class FormulaSyntaxException extends FormulaParseException {

    private final String expected;
    private final String found;

    public FormulaSyntaxException(String expected, Token found) {
        this("Expected " + expected + " but found " + found.describe(), expected, found.describe(),
                found.position());
    }

    public FormulaSyntaxException(String message, String expected, String found, int position) {
        super(message, position);
        this.expected = expected;
        this.found = found;
    }

    /**
     * Tokens remain after a complete expression was parsed.
     */
    public static FormulaSyntaxException trailingTokens(Token found) {
        return new FormulaSyntaxException(
                "Unexpected trailing tokens starting with " + found.describe(),
                "end of input", found.describe(), found.position());
    }

    /**
     * @return What the parser was looking for, or null when unknown
     */
    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
