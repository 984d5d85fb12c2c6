package org.finos.formulex;

import java.util.List;

/**
 * Valid formulas shared by the round-trip and parser comparison tests.
 */
public final class FormulaCorpus {

    public static final List<String> VALID = List.of(
            "a",
            "42",
            "3.14",
            "a + b * c",
            "a * b + c",
            "a - b - c",
            "a - (b - c)",
            "a ** b ** c",
            "(a ** b) ** c",
            "a ** b * c",
            "a ** (b + c) ** d",
            "a and b or c",
            "a or b and c",
            "(a or b) and c",
            "a == b and c",
            "a != b == c",
            "a == (b != c)",
            "a < b + c",
            "a + (b < c)",
            "a <= b >= c",
            "a % b * c",
            "a / (b * c)",
            "x1 * y2 + (a - b / c)",
            "  a + b * c - d / e ",
            "-a + b",
            "-a ** b",
            "a ** -b",
            "--a",
            "a * -b",
            "a - -b",
            "-abs(a - b)",
            "-(a + b)",
            "abs(a + b * c)",
            "round(a + b, 2)",
            "f()",
            "max(a, b, c * d)",
            "f(g(h(x)))",
            "f(-a, not b)",
            "not a",
            "not a and b",
            "not (a and b)",
            "not a == b",
            "a and not b",
            "(not a) == b",
            "a == not b",
            "a == (not b) == c",
            "(a == not b) and c",
            "not not a",
            "((a))",
            "(a + b) * (c - d)");

    private FormulaCorpus() {
        // Static utility class
    }
}
