package org.csu.astcalc.engine;

import org.csu.astcalc.common.exception.ErrorKind;
import org.csu.astcalc.common.util.NumberFormatter;
import org.csu.astcalc.compiler.parser.ast.AstNode;

/**
 * 封装一行表达式处理的全部结果：要么成功 (AST、数值、可选的图示)，要么失败 (错误类别和信息)。
 */
public record CalculationResult(
        AstNode ast,            // 语法错误时为 null
        double value,           // 失败时为 NaN
        String diagram,         // 未要求画图或语法错误时为 null
        ErrorKind errorKind,    // 成功时为 null
        String message          // 成功时为格式化后的数值, 失败时为错误信息
) {
    // 静态工厂方法，用于成功返回
    public static CalculationResult success(AstNode ast, double value, String diagram) {
        return new CalculationResult(ast, value, diagram, null, NumberFormatter.format(value));
    }

    // 静态工厂方法，用于失败返回
    public static CalculationResult failure(AstNode ast, String diagram, ErrorKind errorKind, String message) {
        return new CalculationResult(ast, Double.NaN, diagram, errorKind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean hasDiagram() {
        return diagram != null;
    }
}
