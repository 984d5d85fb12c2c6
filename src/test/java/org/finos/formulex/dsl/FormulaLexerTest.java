package org.finos.formulex.dsl;

import org.finos.formulex.dsl.Token.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaLexer Tests")
class FormulaLexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private static List<String> values(List<Token> tokens) {
        return tokens.stream().map(Token::value).toList();
    }

    @Nested
    @DisplayName("Token classification")
    class Classification {

        @Test
        @DisplayName("Tokenize simple arithmetic with positions")
        void testSimpleArithmetic() {
            List<Token> tokens = FormulaLexer.tokenize("a + b * c");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER,
                    TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
            assertEquals(List.of("a", "+", "b", "*", "c", ""), values(tokens));
            assertEquals(List.of(0, 2, 4, 6, 8, 9), tokens.stream().map(Token::position).toList());
        }

        @Test
        @DisplayName("Two-character operators win over their prefixes")
        void testTwoCharacterOperators() {
            List<Token> tokens = FormulaLexer.tokenize("a**b<=c!=d>=e==f");

            assertEquals(List.of("a", "**", "b", "<=", "c", "!=", "d", ">=", "e", "==", "f", ""), values(tokens));
        }

        @Test
        @DisplayName("Single-character operators")
        void testSingleCharacterOperators() {
            List<Token> tokens = FormulaLexer.tokenize("+ - * / % < > =");

            assertTrue(tokens.subList(0, 8).stream().allMatch(t -> t.type() == TokenType.OPERATOR));
            assertEquals(List.of("+", "-", "*", "/", "%", "<", ">", "="), values(tokens.subList(0, 8)));
        }

        @Test
        @DisplayName("Word operators only match whole words")
        void testWordOperators() {
            List<Token> tokens = FormulaLexer.tokenize("x and android or not_y not z is in_ in");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER,
                    TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER,
                    TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.EOF), types(tokens));
        }

        @Test
        @DisplayName("Numbers are kept verbatim")
        void testNumbers() {
            List<Token> tokens = FormulaLexer.tokenize("3.14 42 7. 007");

            assertEquals(List.of("3.14", "42", "7.", "007", ""), values(tokens));
            assertTrue(tokens.subList(0, 4).stream().allMatch(t -> t.type() == TokenType.NUMBER));
        }

        @Test
        @DisplayName("Delimiters of a function call")
        void testDelimiters() {
            List<Token> tokens = FormulaLexer.tokenize("round(a,\t2)");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.COMMA,
                    TokenType.NUMBER, TokenType.RPAREN, TokenType.EOF), types(tokens));
        }

        @Test
        @DisplayName("Empty input yields only EOF")
        void testEmptyInput() {
            List<Token> tokens = FormulaLexer.tokenize("   ");

            assertEquals(1, tokens.size());
            assertEquals(TokenType.EOF, tokens.get(0).type());
            assertEquals(3, tokens.get(0).position());
        }
    }

    @Nested
    @DisplayName("Errors and laziness")
    class Errors {

        @Test
        @DisplayName("Unknown character reports character and position")
        void testUnknownCharacter() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("a # b"));

            assertEquals('#', e.getCharacter());
            assertEquals(2, e.getPosition());
            assertTrue(e.hasPosition());
            assertTrue(e.getMessage().contains("'#'"), e.getMessage());
        }

        @Test
        @DisplayName("Newlines are not whitespace")
        void testNewline() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("a\nb"));

            assertEquals('\n', e.getCharacter());
            assertEquals(1, e.getPosition());
        }

        @Test
        @DisplayName("A second decimal point is invalid")
        void testSecondDecimalPoint() {
            LexException e = assertThrows(LexException.class, () -> FormulaLexer.tokenize("1.2.3"));

            assertEquals('.', e.getCharacter());
            assertEquals(3, e.getPosition());
        }

        @Test
        @DisplayName("Tokens are produced on demand")
        void testLazyScanning() {
            FormulaLexer lexer = new FormulaLexer("a + $");

            assertEquals("a", lexer.next().value());
            assertEquals("+", lexer.next().value());
            assertThrows(LexException.class, lexer::next);
        }

        @Test
        @DisplayName("Lexer is exhausted after EOF")
        void testExhausted() {
            FormulaLexer lexer = new FormulaLexer("x");

            assertTrue(lexer.hasNext());
            assertEquals(TokenType.IDENTIFIER, lexer.next().type());
            assertEquals(TokenType.EOF, lexer.next().type());
            assertFalse(lexer.hasNext());
            assertThrows(NoSuchElementException.class, lexer::next);
        }
    }
}
