package org.finos.formulex.cli;

import org.finos.formulex.Formulex;
import org.finos.formulex.dsl.FormulaOptions;
import org.finos.formulex.dsl.FormulaParseException;
import org.finos.formulex.transpiler.MinimalPolicy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end: prints each formula with its grouping made explicit.
 *
 * Usage: FormulexCli [--minimal] [--compact] [--max-depth N] [expression...]
 *
 * Without expressions, formulas are read from standard input, one per line.
 * Defaults come from the formulex.* system properties.
 */
public final class FormulexCli {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_FORMULA = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: FormulexCli [--minimal] [--compact] [--max-depth N] [expression...]";

    private FormulexCli() {
        // Static utility class
    }

    public static void main(String[] args) throws IOException {
        Reader stdin = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        int status = run(args, stdin, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the tool.
     *
     * @return the process exit status: 0 on success, 1 if any formula failed,
     *         2 on invalid arguments
     */
    static int run(String[] args, Reader in, PrintStream out, PrintStream err) throws IOException {
        FormulaOptions options;
        List<String> expressions = new ArrayList<>();
        try {
            options = FormulaOptions.fromSystemProperties();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--minimal" -> options = options.withPolicy(MinimalPolicy.INSTANCE);
                    case "--compact" -> options = options.withCompact(true);
                    case "--max-depth" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--max-depth requires a value");
                        }
                        options = options.withMaxNestingDepth(parseDepth(args[++i]));
                    }
                    default -> {
                        if (args[i].startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + args[i]);
                        }
                        expressions.add(args[i]);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (expressions.isEmpty()) {
            BufferedReader reader = new BufferedReader(in);
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    expressions.add(line);
                }
            }
        }

        int status = EXIT_OK;
        for (String expression : expressions) {
            try {
                out.println("Bracketed expression: " + Formulex.reformat(expression, options));
            } catch (FormulaParseException e) {
                err.println("Invalid expression '" + expression + "': " + e.getMessage());
                status = EXIT_INVALID_FORMULA;
            }
        }
        return status;
    }

    private static int parseDepth(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid --max-depth: " + value, e);
        }
    }
}
