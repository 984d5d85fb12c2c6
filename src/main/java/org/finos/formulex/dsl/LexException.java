package org.finos.formulex.dsl;

/**
 * Thrown when the lexer meets a character that starts no token.
 */
public class LexException extends FormulaParseException {

    private final char character;

    public LexException(char character, int position) {
        super("Unexpected character '" + character + "'", position);
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }
}
