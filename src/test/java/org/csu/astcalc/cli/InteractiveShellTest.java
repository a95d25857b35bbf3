package org.csu.astcalc.cli;

import org.csu.astcalc.common.exception.ErrorKind;
import org.csu.astcalc.engine.CalculationResult;
import org.csu.astcalc.engine.ExpressionProcessor;
import org.csu.astcalc.render.DiagramStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 交互式循环的测试。输入输出都在内存中完成。
 */
public class InteractiveShellTest {

    private ByteArrayOutputStream output;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        out = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    private String runShell(ExpressionProcessor processor, ShellOptions options, String input) throws IOException {
        new InteractiveShell(processor, options).run(new BufferedReader(new StringReader(input)), out);
        String text = output.toString(StandardCharsets.UTF_8);
        System.out.println(text);
        return text;
    }

    @Test
    void testEvaluatesUntilQuit() throws IOException {
        System.out.println("--- Test: Evaluate Until Quit ---");
        ShellOptions options = new ShellOptions(false, DiagramStyle.HIERARCHY, false);
        String text = runShell(new ExpressionProcessor(), options, "2+3*4\n\n(2+3)*4\nquit\n5\n");

        assertTrue(text.startsWith("Type exit or quit to stop the program!\n>>> "));
        assertTrue(text.contains("The expression evaluates to: 14\n"));
        assertTrue(text.contains("The expression evaluates to: 20\n"));
        assertFalse(text.contains("The expression evaluates to: 5\n"), "lines after 'quit' must not be evaluated");
        assertFalse(text.contains("Here is the AST"));
        assertTrue(text.endsWith("Bye!\n"));
    }

    @Test
    void testFailuresDoNotStopTheLoop() throws IOException {
        System.out.println("--- Test: Failures Do Not Stop the Loop ---");
        ShellOptions options = new ShellOptions(false, DiagramStyle.HIERARCHY, false);
        String text = runShell(new ExpressionProcessor(), options, "sin)4//3\nln(-1)\n3!+1\n");

        assertTrue(text.contains("ERROR: Syntax Error"));
        assertTrue(text.contains("ERROR: Undefined result"));
        assertTrue(text.contains("The expression evaluates to: 7\n"));
        assertTrue(text.endsWith("Bye!\n"), "end of input ends the loop");
    }

    @Test
    void testAstModePrintsDiagram() throws IOException {
        System.out.println("--- Test: AST Mode ---");
        ShellOptions options = new ShellOptions(true, DiagramStyle.TREE, false);
        String text = runShell(new ExpressionProcessor(), options, "1+2\nexit\n");

        assertTrue(text.contains("Here is the AST for your expression:\n  +\n / \\\n1   2\nThe expression evaluates to: 3\n"));
    }

    @Test
    void testDeeplyNestedLineDoesNotStopTheLoop() throws IOException {
        System.out.println("--- Test: Deeply Nested Line ---");
        ShellOptions options = new ShellOptions(true, DiagramStyle.TREE, false);
        String deep = "(".repeat(3000) + "1" + ")".repeat(3000);
        String text = runShell(new ExpressionProcessor(), options, deep + "\n2*3\nexit\n");

        assertTrue(text.contains("ERROR: Syntax Error: expression nested too deeply"));
        assertTrue(text.contains("The expression evaluates to: 6\n"));
        assertTrue(text.endsWith("Bye!\n"));
    }

    @Test
    void testProcessorReceivesSelectedStyle() throws IOException {
        System.out.println("--- Test: Processor Receives Style ---");
        ExpressionProcessor processor = Mockito.mock(ExpressionProcessor.class);
        when(processor.process(anyString(), any())).thenReturn(
                CalculationResult.failure(null, null, ErrorKind.PARSE_UNEXPECTED_END, "boom"));

        runShell(processor, new ShellOptions(true, DiagramStyle.HIERARCHY, false), "1+\n  q  \n");

        verify(processor, times(1)).process("1+", DiagramStyle.HIERARCHY);
        verifyNoMoreInteractions(processor);
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("ERROR: boom"));
    }

    @Test
    void testNoStyleWhenAstModeIsOff() throws IOException {
        ExpressionProcessor processor = Mockito.mock(ExpressionProcessor.class);
        when(processor.process(anyString(), any())).thenReturn(
                CalculationResult.success(null, 7, null));

        runShell(processor, new ShellOptions(false, DiagramStyle.TREE, false), "7\n");

        verify(processor).process("7", null);
    }
}
