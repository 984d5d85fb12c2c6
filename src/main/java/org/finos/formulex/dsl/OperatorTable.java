package org.finos.formulex.dsl;

import org.finos.formulex.ast.BinaryOp;
import org.finos.formulex.ast.Call;
import org.finos.formulex.ast.ExpressionNode;
import org.finos.formulex.dsl.OperatorSpec.Associativity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide registry of operator precedence and associativity.
 * 
 * Precedence ladder, low to high:
 * 
 * <pre>
 * 1  or                          left
 * 2  and                         left
 * 3  not                         prefix
 * 4  ==  !=                      left
 * 5  <  >  <=  >=  +  -          left
 * 6  *  /  %                     left
 * 7  **                          right
 * 8  - (unary)                   prefix
 * </pre>
 * 
 * Additive operators deliberately share rank 5 with the comparisons, so
 * {@code a < b + c} groups as {@code (a < b) + c}. Unary minus outranks every
 * infix operator, which makes its operand a single primary.
 */
public final class OperatorTable {

    private static final Map<String, OperatorSpec> INFIX;
    private static final Map<String, OperatorSpec> PREFIX;

    static {
        Map<String, OperatorSpec> infix = new LinkedHashMap<>();
        register(infix, OperatorSpec.infix("or", 1, Associativity.LEFT));
        register(infix, OperatorSpec.infix("and", 2, Associativity.LEFT));
        register(infix, OperatorSpec.infix("==", 4, Associativity.LEFT));
        register(infix, OperatorSpec.infix("!=", 4, Associativity.LEFT));
        register(infix, OperatorSpec.infix("<", 5, Associativity.LEFT));
        register(infix, OperatorSpec.infix(">", 5, Associativity.LEFT));
        register(infix, OperatorSpec.infix("<=", 5, Associativity.LEFT));
        register(infix, OperatorSpec.infix(">=", 5, Associativity.LEFT));
        register(infix, OperatorSpec.infix("+", 5, Associativity.LEFT));
        register(infix, OperatorSpec.infix("-", 5, Associativity.LEFT));
        register(infix, OperatorSpec.infix("*", 6, Associativity.LEFT));
        register(infix, OperatorSpec.infix("/", 6, Associativity.LEFT));
        register(infix, OperatorSpec.infix("%", 6, Associativity.LEFT));
        register(infix, OperatorSpec.infix("**", 7, Associativity.RIGHT));
        INFIX = Map.copyOf(infix);

        Map<String, OperatorSpec> prefix = new LinkedHashMap<>();
        register(prefix, OperatorSpec.prefix("not", 3));
        register(prefix, OperatorSpec.prefix("-", 8));
        PREFIX = Map.copyOf(prefix);
    }

    private OperatorTable() {
        // Static utility class
    }

    private static void register(Map<String, OperatorSpec> table, OperatorSpec spec) {
        table.put(spec.symbol(), spec);
    }

    /**
     * Looks up an infix operator.
     * 
     * @param op The operator symbol
     * @return Its precedence and associativity
     * @throws UnknownOperatorException if the symbol is not an infix operator
     */
    public static OperatorSpec get(String op) {
        OperatorSpec spec = INFIX.get(op);
        if (spec == null) {
            throw new UnknownOperatorException(op);
        }
        return spec;
    }

    /**
     * @return true if {@code op} is a registered infix operator
     */
    public static boolean contains(String op) {
        return INFIX.containsKey(op);
    }

    public static Optional<OperatorSpec> prefix(String op) {
        return Optional.ofNullable(PREFIX.get(op));
    }

    /**
     * @return true if {@code op} is registered with either fixity
     */
    public static boolean isRegistered(String op) {
        return INFIX.containsKey(op) || PREFIX.containsKey(op);
    }

    /**
     * Returns the operator a node applies: the infix spec of a
     * {@link BinaryOp}, the prefix spec of a single-operand {@link Call} named
     * after a prefix operator, and empty for literals, identifiers and
     * ordinary function calls.
     */
    public static Optional<OperatorSpec> specOf(ExpressionNode node) {
        if (node instanceof BinaryOp binary) {
            return Optional.of(get(binary.operator()));
        }
        if (node instanceof Call call && call.arguments().size() == 1) {
            return prefix(call.name());
        }
        return Optional.empty();
    }

    /**
     * Highest precedence of any infix operator.
     */
    public static int maxInfixPrecedence() {
        return INFIX.values().stream().mapToInt(OperatorSpec::precedence).max().orElse(1);
    }
}
