package org.csu.astcalc.engine;

import org.csu.astcalc.common.exception.ErrorKind;
import org.csu.astcalc.render.DiagramStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 处理流程的集成测试：成功与失败都以 CalculationResult 返回，不向外抛出。
 */
public class ExpressionProcessorTest {

    private ExpressionProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ExpressionProcessor();
    }

    @Test
    void testSuccessfulCalculation() {
        System.out.println("--- Test: Successful Calculation ---");
        CalculationResult result = processor.process("2+3*4");

        assertTrue(result.isSuccess());
        assertEquals(14.0, result.value(), 0.0);
        assertEquals("14", result.message());
        assertNotNull(result.ast());
        assertFalse(result.hasDiagram(), "no diagram unless a style is requested");
        assertNull(result.errorKind());
    }

    @Test
    void testDiagramIsAttached() {
        System.out.println("--- Test: Diagram Attached ---");
        CalculationResult hierarchy = processor.process("1+2", DiagramStyle.HIERARCHY);
        assertEquals("+\n├── 1\n└── 2\n", hierarchy.diagram());

        CalculationResult tree = processor.process("1+2", DiagramStyle.TREE);
        assertEquals("  +\n / \\\n1   2\n", tree.diagram());
        assertEquals("3", tree.message());
    }

    @Test
    void testParseFailureBecomesResult() {
        System.out.println("--- Test: Parse Failure ---");
        CalculationResult result = processor.process("sin)4//3", DiagramStyle.TREE);

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.PARSE_UNEXPECTED_TOKEN, result.errorKind());
        assertTrue(result.message().startsWith("Syntax Error"), result.message());
        assertNull(result.ast());
        assertNull(result.diagram());
        assertTrue(Double.isNaN(result.value()));
    }

    @Test
    void testEvaluationFailureKeepsTree() {
        System.out.println("--- Test: Evaluation Failure ---");
        CalculationResult result = processor.process("ln(-1)", DiagramStyle.HIERARCHY);

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.EVAL_DOMAIN_ERROR, result.errorKind());
        assertNotNull(result.ast());
        assertEquals("ln\n└── -\n    └── 1\n", result.diagram());
    }

    @Test
    void testEmptyInput() {
        CalculationResult result = processor.process("   ");
        assertEquals(ErrorKind.PARSE_UNEXPECTED_END, result.errorKind());
    }

    @Test
    void testDeterministic() {
        CalculationResult first = processor.process("sin(4) + exp(3 - 1)^3", DiagramStyle.TREE);
        CalculationResult second = processor.process("sin(4) + exp(3 - 1)^3", DiagramStyle.TREE);
        assertEquals(first, second);
    }

    @Test
    void testDeeplyNestedInputBecomesResult() {
        System.out.println("--- Test: Deeply Nested Input ---");
        CalculationResult parens = processor.process("(".repeat(3000) + "1" + ")".repeat(3000), DiagramStyle.HIERARCHY);
        assertFalse(parens.isSuccess());
        assertEquals(ErrorKind.PARSE_UNEXPECTED_TOKEN, parens.errorKind());
        assertNull(parens.ast());
        assertFalse(parens.hasDiagram());

        CalculationResult negations = processor.process("-".repeat(3000) + "1", DiagramStyle.TREE);
        assertEquals(ErrorKind.PARSE_UNEXPECTED_TOKEN, negations.errorKind());

        CalculationResult shallow = processor.process("(".repeat(500) + "1" + ")".repeat(500), DiagramStyle.TREE);
        assertTrue(shallow.isSuccess());
        assertEquals("1", shallow.message());
    }
}
