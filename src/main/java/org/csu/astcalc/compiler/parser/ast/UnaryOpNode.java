package org.csu.astcalc.compiler.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST 节点: 前缀一元运算, e.g., -x
 */
public record UnaryOpNode(UnaryOperator operator, AstNode operand) implements AstNode {

    public UnaryOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public String label() {
        return operator.symbol();
    }

    @Override
    public List<AstNode> children() {
        return List.of(operand);
    }
}
