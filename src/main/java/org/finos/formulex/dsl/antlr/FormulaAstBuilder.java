package org.finos.formulex.dsl.antlr;

import org.finos.formulex.ast.BinaryOp;
import org.finos.formulex.ast.Call;
import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.ast.Identifier;
import org.finos.formulex.ast.Literal;

import java.util.List;

/**
 * ANTLR visitor that converts a FormulaGrammar parse tree to ExpressionNode
 * records. Parentheses disappear here just as they do in the hand-written
 * parser.
 */
public class FormulaAstBuilder extends FormulaGrammarBaseVisitor<ExpressionNode> {

    @Override
    public ExpressionNode visitFormula(FormulaGrammarParser.FormulaContext ctx) {
        return visit(ctx.expression());
    }

    // ========================================
    // INFIX OPERATORS
    // ========================================

    @Override
    public ExpressionNode visitPower(FormulaGrammarParser.PowerContext ctx) {
        return binary(ctx.left, ctx.op.getText(), ctx.right);
    }

    @Override
    public ExpressionNode visitMultiplicative(FormulaGrammarParser.MultiplicativeContext ctx) {
        return binary(ctx.left, ctx.op.getText(), ctx.right);
    }

    @Override
    public ExpressionNode visitAdditive(FormulaGrammarParser.AdditiveContext ctx) {
        return binary(ctx.left, ctx.op.getText(), ctx.right);
    }

    @Override
    public ExpressionNode visitEquality(FormulaGrammarParser.EqualityContext ctx) {
        return binary(ctx.left, ctx.op.getText(), ctx.right);
    }

    @Override
    public ExpressionNode visitAnd(FormulaGrammarParser.AndContext ctx) {
        return binary(ctx.left, ctx.op.getText(), ctx.right);
    }

    @Override
    public ExpressionNode visitOr(FormulaGrammarParser.OrContext ctx) {
        return binary(ctx.left, ctx.op.getText(), ctx.right);
    }

    private ExpressionNode binary(FormulaGrammarParser.ExpressionContext left, String operator,
            FormulaGrammarParser.ExpressionContext right) {
        return new BinaryOp(visit(left), operator, visit(right));
    }

    // ========================================
    // PREFIX OPERATORS
    // ========================================

    @Override
    public ExpressionNode visitNot(FormulaGrammarParser.NotContext ctx) {
        return Call.prefix("not", visit(ctx.operand));
    }

    @Override
    public ExpressionNode visitNegate(FormulaGrammarParser.NegateContext ctx) {
        return Call.prefix("-", visit(ctx.primary()));
    }

    // ========================================
    // PRIMARIES
    // ========================================

    @Override
    public ExpressionNode visitAtom(FormulaGrammarParser.AtomContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public ExpressionNode visitNumber(FormulaGrammarParser.NumberContext ctx) {
        return new Literal(ctx.NUMBER().getText());
    }

    @Override
    public ExpressionNode visitIdentifier(FormulaGrammarParser.IdentifierContext ctx) {
        return new Identifier(ctx.IDENTIFIER().getText());
    }

    @Override
    public ExpressionNode visitCall(FormulaGrammarParser.CallContext ctx) {
        List<ExpressionNode> arguments = ctx.arguments() == null
                ? List.of()
                : ctx.arguments().expression().stream().map(this::visit).toList();
        return new Call(ctx.IDENTIFIER().getText(), arguments);
    }

    @Override
    public ExpressionNode visitParenthesized(FormulaGrammarParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }
}
