package org.csu.astcalc.render;

import org.csu.astcalc.compiler.parser.ast.AstNode;

import java.util.List;

/**
 * 层级视图：根节点单独一行，子节点依次缩进列出。
 * <pre>
 * +
 * ├── 1
 * └── *
 *     ├── 2
 *     └── 3
 * </pre>
 * 对任何形状的树都是精确的，是结构上的参照。
 */
public class HierarchyRenderer implements AstRenderer {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String VERTICAL = "│   ";
    private static final String BLANK = "    ";

    @Override
    public String render(AstNode root) {
        StringBuilder sb = new StringBuilder();
        sb.append(root.label()).append('\n');
        renderChildren(root, "", sb);
        return sb.toString();
    }

    private void renderChildren(AstNode node, String prefix, StringBuilder sb) {
        List<AstNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            AstNode child = children.get(i);
            boolean isLast = i == children.size() - 1;
            sb.append(prefix).append(isLast ? LAST_BRANCH : BRANCH).append(child.label()).append('\n');
            renderChildren(child, prefix + (isLast ? BLANK : VERTICAL), sb);
        }
    }
}
