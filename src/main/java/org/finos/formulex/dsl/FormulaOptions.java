package org.finos.formulex.dsl;

import org.finos.formulex.transpiler.ExplicitGroupingPolicy;
import org.finos.formulex.transpiler.ParenthesizationPolicy;

import java.util.Objects;

/**
 * Settings shared by the parser and the formatter.
 *
 * @param maxNestingDepth Bound on recursion depth and tree height, in both
 *                        parsing and formatting
 * @param policy          Decides which operands the formatter parenthesizes
 * @param compact         Drop the spaces around symbolic infix operators and
 *                        after argument commas
 */
public record FormulaOptions(
        int maxNestingDepth,
        ParenthesizationPolicy policy,
        boolean compact) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public static final String MAX_NESTING_DEPTH_PROPERTY = "formulex.maxNestingDepth";
    public static final String POLICY_PROPERTY = "formulex.policy";
    public static final String COMPACT_PROPERTY = "formulex.compact";

    public FormulaOptions {
        Objects.requireNonNull(policy, "Policy cannot be null");
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be >= 1, got " + maxNestingDepth);
        }
    }

    public static FormulaOptions defaults() {
        return new FormulaOptions(DEFAULT_MAX_NESTING_DEPTH, ExplicitGroupingPolicy.INSTANCE, false);
    }

    /**
     * Reads overrides from {@code formulex.maxNestingDepth},
     * {@code formulex.policy} and {@code formulex.compact}, falling back to
     * {@link #defaults()} for properties that are not set.
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static FormulaOptions fromSystemProperties() {
        FormulaOptions options = defaults();

        String depth = System.getProperty(MAX_NESTING_DEPTH_PROPERTY);
        if (depth != null) {
            try {
                options = options.withMaxNestingDepth(Integer.parseInt(depth.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid " + MAX_NESTING_DEPTH_PROPERTY + ": " + depth, e);
            }
        }

        String policy = System.getProperty(POLICY_PROPERTY);
        if (policy != null) {
            options = options.withPolicy(ParenthesizationPolicy.named(policy.trim()));
        }

        String compact = System.getProperty(COMPACT_PROPERTY);
        if (compact != null) {
            options = options.withCompact(Boolean.parseBoolean(compact.trim()));
        }
        return options;
    }

    public FormulaOptions withMaxNestingDepth(int maxNestingDepth) {
        return new FormulaOptions(maxNestingDepth, policy, compact);
    }

    public FormulaOptions withPolicy(ParenthesizationPolicy policy) {
        return new FormulaOptions(maxNestingDepth, policy, compact);
    }

    public FormulaOptions withCompact(boolean compact) {
        return new FormulaOptions(maxNestingDepth, policy, compact);
    }
}
