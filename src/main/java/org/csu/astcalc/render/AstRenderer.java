package org.csu.astcalc.render;

import org.csu.astcalc.compiler.parser.ast.AstNode;

/**
 * 把AST画成可打印的文本。实现必须是纯函数：不修改树，相同的树总是得到相同的文本，
 * 对任何合法的AST都不会失败。
 */
public interface AstRenderer {

    /**
     * @param root AST 根节点
     * @return 以 '\n' 结尾的多行文本，行尾不带空格
     */
    String render(AstNode root);
}
