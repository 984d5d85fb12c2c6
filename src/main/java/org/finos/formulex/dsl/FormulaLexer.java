package org.finos.formulex.dsl;

import org.finos.formulex.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lexer for formulas.
 *
 * Scans lazily: each call to {@link #next()} reads exactly one token, ending
 * with a single {@link TokenType#EOF} token. The lexer is single-pass and
 * cannot be rewound.
 *
 * Matching order at each position:
 * - spaces and tabs are skipped
 * - operators, two-character forms before their one-character prefixes
 * - numerals: digits with an optional fraction ("3", "3.14", "3.")
 * - identifiers; the words and/or/not/is/in are operator tokens
 * - comma and parentheses
 */
public final class FormulaLexer implements Iterator<Token> {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("**", "==", "!=", "<=", ">=");
    private static final String ONE_CHAR_OPERATORS = "+-*/%<>=";
    private static final Set<String> WORD_OPERATORS = Set.of("and", "or", "not", "is", "in");

    private final String input;
    private int position;
    private boolean finished;

    public FormulaLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens, the last one being EOF
     * @throws LexException at the first character that starts no token
     */
    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        new FormulaLexer(input).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("Lexer already reached end of input");
        }

        skipWhitespace();
        if (position >= input.length()) {
            finished = true;
            return new Token(TokenType.EOF, "", position);
        }
        return nextToken();
    }

    private void skipWhitespace() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c != ' ' && c != '\t') {
                break;
            }
            position++;
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;

        // Two-character operators
        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            if (TWO_CHAR_OPERATORS.contains(twoChar)) {
                position += 2;
                return new Token(TokenType.OPERATOR, twoChar, start);
            }
        }

        if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
            position++;
            return new Token(TokenType.OPERATOR, String.valueOf(c), start);
        }

        if (isDigit(c)) {
            return readNumber();
        }

        if (isIdentifierStart(c)) {
            return readIdentifierOrWordOperator();
        }

        TokenType delimiter = switch (c) {
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            default -> null;
        };
        if (delimiter != null) {
            position++;
            return new Token(delimiter, String.valueOf(c), start);
        }

        throw new LexException(c, position);
    }

    private Token readNumber() {
        int start = position;
        while (position < input.length() && isDigit(input.charAt(position))) {
            position++;
        }
        if (position < input.length() && input.charAt(position) == '.') {
            position++;
            while (position < input.length() && isDigit(input.charAt(position))) {
                position++;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, position), start);
    }

    private Token readIdentifierOrWordOperator() {
        int start = position;
        while (position < input.length() && isIdentifierPart(input.charAt(position))) {
            position++;
        }

        String value = input.substring(start, position);
        TokenType type = WORD_OPERATORS.contains(value) ? TokenType.OPERATOR : TokenType.IDENTIFIER;
        return new Token(type, value, start);
    }

    // ASCII only, matching [A-Za-z_][A-Za-z0-9_]*
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
