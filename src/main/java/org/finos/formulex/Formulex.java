package org.finos.formulex;

import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.dsl.FormulaLexer;
import org.finos.formulex.dsl.FormulaOptions;
import org.finos.formulex.dsl.FormulaParser;
import org.finos.formulex.dsl.Token;
import org.finos.formulex.transpiler.FormulaFormatter;

import java.util.List;

/**
 * Entry point for parsing and formatting formulas.
 *
 * <pre>
 * ExpressionNode tree = Formulex.parse("a + b * c");
 * String text = Formulex.format(tree); // "a + (b * c)"
 * </pre>
 */
public final class Formulex {

    private Formulex() {
        // Static utility class
    }

    public static List<Token> tokenize(String text) {
        return FormulaLexer.tokenize(text);
    }

    /**
     * Parses a formula with default options.
     *
     * @throws org.finos.formulex.dsl.FormulaParseException if the text is not a
     *                                                      valid formula
     */
    public static ExpressionNode parse(String text) {
        return FormulaParser.parse(text);
    }

    public static ExpressionNode parse(String text, FormulaOptions options) {
        return FormulaParser.parse(text, options);
    }

    public static String format(ExpressionNode tree) {
        return new FormulaFormatter().format(tree);
    }

    public static String format(ExpressionNode tree, FormulaOptions options) {
        return new FormulaFormatter(options).format(tree);
    }

    /**
     * Parses and formats in one step.
     */
    public static String reformat(String text) {
        return reformat(text, FormulaOptions.defaults());
    }

    public static String reformat(String text, FormulaOptions options) {
        return format(parse(text, options), options);
    }
}
