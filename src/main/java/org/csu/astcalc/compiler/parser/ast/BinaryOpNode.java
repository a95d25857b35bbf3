package org.csu.astcalc.compiler.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., 2 + 3)
 */
public record BinaryOpNode(
        BinaryOperator operator,
        AstNode left,
        AstNode right
) implements AstNode {

    public BinaryOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String label() {
        return operator.symbol();
    }

    @Override
    public List<AstNode> children() {
        return List.of(left, right);
    }
}
