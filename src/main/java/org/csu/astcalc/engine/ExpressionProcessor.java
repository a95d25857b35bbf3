package org.csu.astcalc.engine;

import org.csu.astcalc.common.exception.EvaluationException;
import org.csu.astcalc.common.exception.ParseException;
import org.csu.astcalc.compiler.lexer.Lexer;
import org.csu.astcalc.compiler.parser.Parser;
import org.csu.astcalc.compiler.parser.ast.AstNode;
import org.csu.astcalc.render.DiagramStyle;

/**
 * 一行表达式的完整处理流程：词法分析 -> 语法分析 -> 求值 -> (可选) 画图。
 * 解析和求值的失败在这里被转换成 CalculationResult，不会向上抛出。
 */
public class ExpressionProcessor {

    /**
     * 只求值，不画图。
     */
    public CalculationResult process(String line) {
        return process(line, null);
    }

    /**
     * @param line  一行输入
     * @param style 图示风格，为 null 时不画图
     */
    public CalculationResult process(String line, DiagramStyle style) {
        AstNode ast;
        try {
            ast = parse(line);
        } catch (ParseException e) {
            return CalculationResult.failure(null, null, e.getKind(), e.getMessage());
        }

        // 先画图再求值，求值失败时仍然可以展示AST
        String diagram = (style == null) ? null : style.renderer().render(ast);
        try {
            double value = ExpressionEvaluator.evaluate(ast);
            return CalculationResult.success(ast, value, diagram);
        } catch (EvaluationException e) {
            return CalculationResult.failure(ast, diagram, e.getKind(), e.getMessage());
        }
    }

    public AstNode parse(String line) {
        Lexer lexer = new Lexer(line);
        Parser parser = new Parser(lexer.tokenize());
        return parser.parse();
    }
}
