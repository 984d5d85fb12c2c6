package org.finos.formulex.transpiler;

import org.finos.formulex.ast.BinaryOp;
import org.finos.formulex.ast.Call;
import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.ast.ExpressionVisitor;
import org.finos.formulex.ast.Identifier;
import org.finos.formulex.ast.Literal;
import org.finos.formulex.dsl.FormulaOptions;
import org.finos.formulex.dsl.NestingOverflowException;
import org.finos.formulex.dsl.OperatorSpec;
import org.finos.formulex.dsl.OperatorTable;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders an expression tree back to formula text.
 *
 * Which operands get parentheses is delegated to the configured
 * {@link ParenthesizationPolicy}; everything else is fixed:
 * - literals and identifiers are written verbatim
 * - function calls are written name(arg, ...), each argument as a top-level
 *   expression
 * - symbolic prefix operators attach to their operand (-a), word operators
 *   are followed by a space (not a)
 * - infix operators are surrounded by single spaces, except symbolic ones in
 *   compact mode
 *
 * The formatter holds no per-call state and can be shared between threads.
 * It never fails on a tree the parser produced under the same options.
 */
public final class FormulaFormatter {

    private final FormulaOptions options;

    public FormulaFormatter() {
        this(FormulaOptions.defaults());
    }

    public FormulaFormatter(FormulaOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    /**
     * Formats an expression tree.
     *
     * @param tree The root of the tree
     * @return The formula text
     * @throws NestingOverflowException if the tree is deeper than the
     *                                  configured nesting limit
     */
    public String format(ExpressionNode tree) {
        return new Renderer().render(tree, 0);
    }

    public FormulaOptions options() {
        return options;
    }

    /**
     * Per-call rendering state: current depth and the precedence of the
     * operator that follows the text being rendered.
     */
    private final class Renderer implements ExpressionVisitor<String> {

        private final ParenthesizationPolicy policy = options.policy();
        private int depth;
        private int following;

        String render(ExpressionNode node, int followingPrecedence) {
            depth++;
            if (depth > options.maxNestingDepth()) {
                throw new NestingOverflowException(depth, options.maxNestingDepth());
            }
            int saved = following;
            following = followingPrecedence;
            try {
                return node.accept(this);
            } finally {
                following = saved;
                depth--;
            }
        }

        @Override
        public String visitLiteral(Literal literal) {
            return literal.text();
        }

        @Override
        public String visitIdentifier(Identifier identifier) {
            return identifier.name();
        }

        @Override
        public String visitCall(Call call) {
            Optional<OperatorSpec> prefix = OperatorTable.specOf(call);
            if (prefix.isPresent()) {
                return renderPrefix(prefix.get(), call.arguments().get(0));
            }

            String separator = options.compact() ? "," : ", ";
            return call.arguments().stream()
                    .map(argument -> render(argument, 0))
                    .collect(Collectors.joining(separator, call.name() + "(", ")"));
        }

        @Override
        public String visitBinaryOp(BinaryOp binaryOp) {
            OperatorSpec spec = OperatorTable.get(binaryOp.operator());

            // the left operand is followed by this operator, the right one by
            // whatever follows this node
            String left = renderOperand(spec, binaryOp.left(), OperandSide.LEFT, spec.precedence());
            String right = renderOperand(spec, binaryOp.right(), OperandSide.RIGHT, following);

            String space = options.compact() && !spec.isWord() ? "" : " ";
            return left + space + spec.symbol() + space + right;
        }

        private String renderOperand(OperatorSpec parent, ExpressionNode operand, OperandSide side,
                int followingPrecedence) {
            Optional<OperatorSpec> operandSpec = OperatorTable.specOf(operand);
            if (operandSpec.isPresent()
                    && policy.wrapOperand(parent, operand, operandSpec.get(), side, followingPrecedence)) {
                return "(" + render(operand, 0) + ")";
            }
            return render(operand, followingPrecedence);
        }

        private String renderPrefix(OperatorSpec spec, ExpressionNode operand) {
            String space = spec.isWord() ? " " : "";
            Optional<OperatorSpec> operandSpec = OperatorTable.specOf(operand);
            if (policy.wrapPrefixOperand(spec, operand, operandSpec, following)) {
                return spec.symbol() + space + "(" + render(operand, 0) + ")";
            }
            return spec.symbol() + space + render(operand, following);
        }
    }
}
