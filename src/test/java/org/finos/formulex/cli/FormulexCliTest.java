package org.finos.formulex.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulexCli Tests")
class FormulexCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @AfterEach
    void clearProperties() {
        System.clearProperty("formulex.policy");
    }

    private int run(String stdin, String... args) throws IOException {
        return FormulexCli.run(args, new StringReader(stdin),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testExpressionArguments() throws IOException {
        int status = run("", "a + b * c", "-abs(a - b)");

        assertEquals(FormulexCli.EXIT_OK, status);
        assertEquals(String.join(System.lineSeparator(),
                "Bracketed expression: a + (b * c)",
                "Bracketed expression: -(abs(a - b))",
                ""), stdout());
        assertEquals("", stderr());
    }

    @Test
    void testStandardInput() throws IOException {
        int status = run("a * b + c\n\n   \na ** b ** c\n");

        assertEquals(FormulexCli.EXIT_OK, status);
        assertTrue(stdout().contains("Bracketed expression: (a * b) + c"));
        assertTrue(stdout().contains("Bracketed expression: a ** (b ** c)"));
        assertEquals(2, stdout().lines().count());
    }

    @Test
    void testMinimalFlag() throws IOException {
        assertEquals(FormulexCli.EXIT_OK, run("", "--minimal", "a + (b * c)"));
        assertTrue(stdout().contains("Bracketed expression: a + b * c"));
    }

    @Test
    void testCompactFlag() throws IOException {
        assertEquals(FormulexCli.EXIT_OK, run("", "--compact", "a+b*c-d/e"));
        assertTrue(stdout().contains("Bracketed expression: a+(b*c)-(d/e)"));
    }

    @Test
    void testPolicyFromSystemProperty() throws IOException {
        System.setProperty("formulex.policy", "minimal");
        assertEquals(FormulexCli.EXIT_OK, run("", "(a * b) + c"));
        assertTrue(stdout().contains("Bracketed expression: a * b + c"));
    }

    @Test
    void testMaxDepthFlag() throws IOException {
        assertEquals(FormulexCli.EXIT_INVALID_FORMULA, run("", "--max-depth", "2", "((a))"));
        assertTrue(stderr().contains("Invalid expression '((a))'"));
    }

    @Test
    void testInvalidFormulaContinues() throws IOException {
        int status = run("", "a +", "a + b");

        assertEquals(FormulexCli.EXIT_INVALID_FORMULA, status);
        assertTrue(stderr().contains("Invalid expression 'a +'"));
        assertTrue(stdout().contains("Bracketed expression: a + b"));
    }

    @Test
    void testUnknownOption() throws IOException {
        assertEquals(FormulexCli.EXIT_USAGE, run("", "--verbose", "a"));
        assertTrue(stderr().contains("Unknown option: --verbose"));
        assertTrue(stderr().contains("Usage:"));
        assertEquals("", stdout());
    }

    @Test
    void testInvalidMaxDepth() throws IOException {
        assertEquals(FormulexCli.EXIT_USAGE, run("", "--max-depth", "0", "a"));
        assertEquals(FormulexCli.EXIT_USAGE, run("", "--max-depth", "deep", "a"));
        assertEquals(FormulexCli.EXIT_USAGE, run("", "--max-depth"));
    }
}
