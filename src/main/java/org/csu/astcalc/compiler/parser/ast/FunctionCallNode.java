package org.csu.astcalc.compiler.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST 节点: 表示一个函数调用, e.g., sin(x), ln(2)
 * @param function 函数名
 * @param argument 唯一的参数
 */
public record FunctionCallNode(
        MathFunction function,
        AstNode argument
) implements AstNode {

    public FunctionCallNode {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(argument, "argument");
    }

    @Override
    public String label() {
        return function.functionName();
    }

    @Override
    public List<AstNode> children() {
        return List.of(argument);
    }
}
