package org.finos.formulex.dsl.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.dsl.FormulaSyntaxException;
import org.finos.formulex.dsl.LexException;

/**
 * ANTLR-based formula parser generated from FormulaGrammar.g4.
 * 
 * Produces the same {@link ExpressionNode} trees as the hand-written
 * {@link org.finos.formulex.dsl.FormulaParser} and is used to check it against
 * an independent description of the grammar. It does not enforce a nesting
 * limit.
 */
public final class AntlrFormulaParserAdapter {

    private AntlrFormulaParserAdapter() {
        // Static utility class
    }

    /**
     * Parses a formula using the ANTLR-generated parser.
     * 
     * @param text The formula source
     * @return The parsed expression AST
     * @throws LexException           on a character that starts no token
     * @throws FormulaSyntaxException if parsing fails
     */
    public static ExpressionNode parse(String text) {
        FormulaGrammarLexer lexer = new FormulaGrammarLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new LexerErrorListener(text));

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        FormulaGrammarParser parser = new FormulaGrammarParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ParserErrorListener());

        FormulaGrammarParser.FormulaContext tree = parser.formula();
        return new FormulaAstBuilder().visit(tree);
    }

    /**
     * Converts a line/column pair reported by ANTLR into a character offset.
     */
    static int offset(String text, int line, int charPositionInLine) {
        int offset = 0;
        for (int i = 1; i < line; i++) {
            offset = text.indexOf('\n', offset) + 1;
        }
        return offset + charPositionInLine;
    }

    /**
     * Error listener that converts ANTLR token recognition errors to
     * LexException.
     */
    private static class LexerErrorListener extends BaseErrorListener {

        private final String text;

        LexerErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            int position = offset(text, line, charPositionInLine);
            char character = position < text.length() ? text.charAt(position) : '\0';
            throw new LexException(character, position);
        }
    }

    /**
     * Error listener that converts ANTLR syntax errors to
     * FormulaSyntaxException.
     */
    private static class ParserErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            if (offendingSymbol instanceof Token token) {
                String found = token.getType() == Token.EOF ? "end of input" : "'" + token.getText() + "'";
                throw new FormulaSyntaxException("Parse error - " + msg, null, found, token.getStartIndex());
            }
            throw new FormulaSyntaxException("Parse error - " + msg, null, "unknown", charPositionInLine);
        }
    }
}
