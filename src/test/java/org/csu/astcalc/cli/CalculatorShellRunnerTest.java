package org.csu.astcalc.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 启动入口的测试：退出码和输出编码。标准输入输出用内存流代替。
 */
public class CalculatorShellRunnerTest {

    private CalculatorShellRunner runner;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        runner = new CalculatorShellRunner(false, "hierarchy");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int execute(String input, String... args) throws IOException {
        int code = runner.execute(args, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out, err);
        System.out.println("Exit code: " + code);
        System.out.println(out.toString(StandardCharsets.UTF_8));
        return code;
    }

    @Test
    void testUnknownOptionExitsWithUsageCode() throws Exception {
        System.out.println("--- Test: Unknown Option ---");
        int code = execute("", "--bogus");

        assertEquals(CalculatorShellRunner.EXIT_USAGE, code);
        assertNotEquals(0, code);
        String errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.startsWith("ERROR: Unknown option '--bogus'"));
        assertTrue(errors.contains("Usage: ast-calc"));
        assertEquals("", out.toString(StandardCharsets.UTF_8), "the shell must not start");
    }

    @Test
    void testAstViewWithoutAstModeExitsWithUsageCode() throws Exception {
        System.out.println("--- Test: AST View Without AST Mode ---");
        assertEquals(CalculatorShellRunner.EXIT_USAGE, execute("", "-v", "tree"));
    }

    @Test
    void testExitCodeIsReportedToSpring() throws Exception {
        System.out.println("--- Test: Exit Code Reported Through ExitCodeGenerator ---");
        assertEquals(CalculatorShellRunner.EXIT_OK, runner.getExitCode());
        runner.run("--bogus");
        assertEquals(CalculatorShellRunner.EXIT_USAGE, runner.getExitCode());
    }

    @Test
    void testHelpExitsCleanly() throws Exception {
        System.out.println("--- Test: Help ---");
        assertEquals(CalculatorShellRunner.EXIT_OK, execute("", "--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage: ast-calc"));
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testDiagramIsWrittenAsUtf8() throws Exception {
        System.out.println("--- Test: UTF-8 Output ---");
        int code = execute("1+2\nquit\n", "-a");

        assertEquals(CalculatorShellRunner.EXIT_OK, code);
        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("+\n├── 1\n└── 2\n"));
        assertTrue(text.contains("The expression evaluates to: 3\n"));
        assertTrue(text.endsWith("Bye!\n"));
    }
}
