package org.finos.formulex.dsl;

import org.finos.formulex.ast.BinaryOp;
import org.finos.formulex.ast.Call;
import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.ast.Identifier;
import org.finos.formulex.ast.Literal;
import org.finos.formulex.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Precedence-climbing parser for formulas.
 *
 * Parses infix expressions like:
 * a + b * c, -abs(a - b), round(a + b, 2), not x == y and z
 *
 * The parser reads tokens from a {@link FormulaLexer} with one token of
 * lookahead and never backtracks. Binding strength comes from the
 * {@link OperatorTable}; parentheses only steer parsing and are not kept in
 * the tree.
 *
 * Recursion depth and the height of the tree being built are both bounded by
 * {@link FormulaOptions#maxNestingDepth()}.
 */
public final class FormulaParser {

    private final FormulaLexer lexer;
    private final int maxNestingDepth;
    private Token current;
    private int depth;

    public FormulaParser(FormulaLexer lexer, FormulaOptions options) {
        this.lexer = Objects.requireNonNull(lexer, "Lexer cannot be null");
        this.maxNestingDepth = options.maxNestingDepth();
        this.current = lexer.next();
        this.depth = 0;
    }

    /**
     * Parses a formula with default options.
     *
     * @param text The formula source
     * @return The parsed expression tree
     * @throws FormulaParseException if the text is not a valid formula
     */
    public static ExpressionNode parse(String text) {
        return parse(text, FormulaOptions.defaults());
    }

    /**
     * Parses a formula.
     *
     * @param text    The formula source
     * @param options Nesting limit to enforce
     * @return The parsed expression tree
     * @throws FormulaParseException if the text is not a valid formula
     */
    public static ExpressionNode parse(String text, FormulaOptions options) {
        return new FormulaParser(new FormulaLexer(text), options).parse();
    }

    /**
     * Parses one complete expression and requires the input to end there.
     */
    public ExpressionNode parse() {
        Parsed result = parseExpression(1);
        if (current.type() != TokenType.EOF) {
            throw FormulaSyntaxException.trailingTokens(current);
        }
        return result.node();
    }

    /**
     * Parses operators binding at least as tightly as {@code minPrecedence}.
     *
     * The loop keeps the same minimum for every operator it consumes; only the
     * right operand is parsed with a raised minimum, which makes left
     * associative chains nest to the left and right associative ones to the
     * right.
     */
    private Parsed parseExpression(int minPrecedence) {
        enter();
        try {
            Parsed node = parsePrimary();

            while (current.type() == TokenType.OPERATOR) {
                String symbol = current.value();
                if (!OperatorTable.contains(symbol)) {
                    if (OperatorTable.isRegistered(symbol)) {
                        // prefix-only operator, cannot continue an expression
                        break;
                    }
                    throw new UnknownOperatorException(symbol, current.position());
                }

                OperatorSpec spec = OperatorTable.get(symbol);
                if (spec.precedence() < minPrecedence) {
                    break;
                }
                advance();

                Parsed right = parseExpression(spec.rightOperandPrecedence());
                node = branch(new BinaryOp(node.node(), symbol, right.node()),
                        Math.max(node.height(), right.height()));
            }

            return node;
        } finally {
            depth--;
        }
    }

    /**
     * Parses numbers, identifiers, function calls, parenthesized expressions
     * and prefix operator applications.
     */
    private Parsed parsePrimary() {
        Token token = current;

        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new Parsed(new Literal(token.value()), 1);
            }
            case IDENTIFIER -> {
                advance();
                if (current.type() == TokenType.LPAREN) {
                    return parseCall(token);
                }
                return new Parsed(new Identifier(token.value()), 1);
            }
            case LPAREN -> {
                advance();
                Parsed inner = parseExpression(1);
                consume(TokenType.RPAREN, "')'");
                return inner;
            }
            case OPERATOR -> {
                Optional<OperatorSpec> prefix = OperatorTable.prefix(token.value());
                if (prefix.isPresent()) {
                    return parsePrefix(prefix.get());
                }
                throw new FormulaSyntaxException("an operand", token);
            }
            default -> throw new FormulaSyntaxException("an operand", token);
        }
    }

    /**
     * Parses name(arg, ...) after the name has been consumed.
     */
    private Parsed parseCall(Token name) {
        consume(TokenType.LPAREN, "'('");

        List<ExpressionNode> arguments = new ArrayList<>();
        int height = 0;
        if (current.type() != TokenType.RPAREN) {
            do {
                Parsed argument = parseExpression(1);
                arguments.add(argument.node());
                height = Math.max(height, argument.height());
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RPAREN, "')'");
        return branch(new Call(name.value(), arguments), height);
    }

    /**
     * Parses a prefix operator and its operand. The operand takes every infix
     * operator binding at least as tightly as the prefix operator; unary minus
     * outranks all of them, so its operand is a single primary.
     */
    private Parsed parsePrefix(OperatorSpec spec) {
        advance();
        Parsed operand = parseExpression(spec.precedence());
        return branch(Call.prefix(spec.symbol(), operand.node()), operand.height());
    }

    private Parsed branch(ExpressionNode node, int childHeight) {
        int height = childHeight + 1;
        if (height > maxNestingDepth) {
            throw new NestingOverflowException(height, maxNestingDepth);
        }
        return new Parsed(node, height);
    }

    private void enter() {
        depth++;
        if (depth > maxNestingDepth) {
            throw new NestingOverflowException(depth, maxNestingDepth);
        }
    }

    // ==================== Token Access ====================

    private void advance() {
        if (current.type() != TokenType.EOF) {
            current = lexer.next();
        }
    }

    private boolean match(TokenType type) {
        if (current.type() == type) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        Token token = current;
        if (token.type() != type) {
            throw new FormulaSyntaxException(expected, token);
        }
        advance();
        return token;
    }

    /**
     * A parsed subtree together with its height, leaves counting as 1.
     */
    private record Parsed(ExpressionNode node, int height) {
    }
}
