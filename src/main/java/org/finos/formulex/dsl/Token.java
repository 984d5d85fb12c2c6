package org.finos.formulex.dsl;

/**
 * Represents a token produced by the formula lexer.
 * 
 * @param type     The token type
 * @param value    The token text as it appears in the source
 * @param position The zero-based offset of the token in the source string
 */
public record Token(TokenType type, String value, int position) {

    public enum TokenType {
        NUMBER, // 42, 3.14
        IDENTIFIER, // a, round, var_1
        OPERATOR, // + - * / % ** == != < > <= >= = and or not is in
        LPAREN, // (
        RPAREN, // )
        COMMA, // ,

        // Special
        EOF, // End of input
    }

    /**
     * @return true if this is an operator token with the given symbol
     */
    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && value.equals(symbol);
    }

    /**
     * Describes the token for diagnostics: the quoted text, or "end of input".
     */
    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + value + "'";
    }

    @Override
    public String toString() {
        return type + (value.isEmpty() ? "" : "(" + value + ")") + "@" + position;
    }
}
