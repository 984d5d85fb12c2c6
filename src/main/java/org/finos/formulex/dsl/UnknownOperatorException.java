package org.finos.formulex.dsl;

/**
 * Thrown when an operator symbol has no entry in the {@link OperatorTable}.
 */
public class UnknownOperatorException extends FormulaParseException {

    private final String symbol;

    public UnknownOperatorException(String symbol) {
        super("Unknown operator: " + symbol);
        this.symbol = symbol;
    }

    public UnknownOperatorException(String symbol, int position) {
        super("Unknown operator: " + symbol, position);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
