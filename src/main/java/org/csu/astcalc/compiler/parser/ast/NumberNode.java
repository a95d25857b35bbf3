package org.csu.astcalc.compiler.parser.ast;

import org.csu.astcalc.common.util.NumberFormatter;

import java.util.List;

/**
 * AST 节点: 数字字面量 (叶子)
 */
public record NumberNode(double value) implements AstNode {

    @Override
    public String label() {
        return NumberFormatter.format(value);
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }
}
