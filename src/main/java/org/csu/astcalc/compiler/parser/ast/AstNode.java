package org.csu.astcalc.compiler.parser.ast;

import java.util.List;

/**
 * 所有AST节点的根接口。
 * 实现类只有 NumberNode、UnaryOpNode、PostfixOpNode、BinaryOpNode 和 FunctionCallNode，
 * 每种节点的子节点个数由其构造器固定，且不允许为 null。
 */
public interface AstNode {

    /**
     * 节点在图示中显示的文本：运算符、函数名或数字。
     */
    String label();

    /**
     * 按从左到右顺序排列的子节点，叶子节点返回空列表。
     */
    List<AstNode> children();
}
