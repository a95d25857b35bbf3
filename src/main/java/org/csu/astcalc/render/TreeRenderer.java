package org.csu.astcalc.render;

import org.csu.astcalc.compiler.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 树形视图：ASCII 画出的自顶向下的树，每一层占两行 (标签行 + 连线行)。
 * <pre>
 *     _*_
 *    /   \
 *   +     +
 *  / \   / \
 * 1   2 3   4
 * </pre>
 *
 * 分两遍完成：
 * 1. 自底向上 ({@link #measure})，为每棵子树计算宽度、标签起始列、锚点列 (连线连接的列)
 *    以及每个子树相对本子树左边界的偏移；
 * 2. 自顶向下 ({@link #paint})，根据父节点的位置和第一遍的偏移算出每个节点的绝对列并逐行绘制。
 *
 * 这是面向二叉形状的启发式布局，三个及以上子节点时中间的子节点只画一条 '|'，可能与父节点对不齐。
 */
public class TreeRenderer implements AstRenderer {

    // 相邻子树之间至少空出的列数
    private static final int MIN_GAP = 1;

    @Override
    public String render(AstNode root) {
        Layout layout = measure(root);
        Canvas canvas = new Canvas(layout.width());
        paint(layout, 0, 0, canvas);
        return canvas.toString();
    }

    /**
     * 第一遍布局的结果，所有列都相对于本子树的左边界。
     */
    private record Layout(
            String label,
            int width,
            int labelStart,
            int anchor,
            List<Layout> children,
            int[] childOffsets
    ) {
    }

    private Layout measure(AstNode node) {
        String label = node.label();
        int length = label.length();
        List<Layout> children = new ArrayList<>();
        for (AstNode child : node.children()) {
            children.add(measure(child));
        }

        if (children.isEmpty()) {
            return new Layout(label, length, 0, (length - 1) / 2, children, new int[0]);
        }

        if (children.size() == 1) {
            // 子节点的锚点正好在父节点锚点的下方，用 '|' 相连
            Layout child = children.get(0);
            int leftOfAnchor = (length - 1) / 2;
            int shift = Math.max(0, leftOfAnchor - child.anchor());
            int anchor = shift + child.anchor();
            int labelStart = anchor - leftOfAnchor;
            int width = Math.max(shift + child.width(), labelStart + length);
            return new Layout(label, width, labelStart, anchor, children, new int[]{shift});
        }

        // 子树并排摆放，互不重叠
        int[] offsets = new int[children.size()];
        int x = 0;
        for (int i = 0; i < children.size(); i++) {
            offsets[i] = x;
            x += children.get(i).width() + MIN_GAP;
        }
        Layout first = children.get(0);
        Layout last = children.get(children.size() - 1);
        int firstAnchor = offsets[0] + first.anchor();
        int lastAnchor = offsets[offsets.length - 1] + last.anchor();

        // 父标签必须放在 '/' 和 '\' 之间，两侧各留一列
        int shortfall = length + 3 - (lastAnchor - firstAnchor);
        if (shortfall > 0) {
            offsets[offsets.length - 1] += shortfall;
            lastAnchor += shortfall;
        }

        int free = lastAnchor - firstAnchor - 3 - length;
        int labelStart = firstAnchor + 2 + free / 2;
        int anchor = labelStart + (length - 1) / 2;
        int width = offsets[offsets.length - 1] + last.width();
        return new Layout(label, width, labelStart, anchor, children, offsets);
    }

    private void paint(Layout layout, int left, int depth, Canvas canvas) {
        char[] labelRow = canvas.row(2 * depth);
        int labelStart = left + layout.labelStart();
        layout.label().getChars(0, layout.label().length(), labelRow, labelStart);

        List<Layout> children = layout.children();
        if (children.isEmpty()) {
            return;
        }

        char[] edgeRow = canvas.row(2 * depth + 1);
        if (children.size() == 1) {
            edgeRow[left + layout.anchor()] = '|';
        } else {
            int firstAnchor = left + layout.childOffsets()[0] + children.get(0).anchor();
            int lastIndex = children.size() - 1;
            int lastAnchor = left + layout.childOffsets()[lastIndex] + children.get(lastIndex).anchor();

            edgeRow[firstAnchor + 1] = '/';
            edgeRow[lastAnchor - 1] = '\\';
            for (int i = 1; i < lastIndex; i++) {
                edgeRow[left + layout.childOffsets()[i] + children.get(i).anchor()] = '|';
            }

            int labelEnd = labelStart + layout.label().length();
            Arrays.fill(labelRow, firstAnchor + 2, labelStart, '_');
            Arrays.fill(labelRow, labelEnd, lastAnchor - 1, '_');
        }

        for (int i = 0; i < children.size(); i++) {
            paint(children.get(i), left + layout.childOffsets()[i], depth + 1, canvas);
        }
    }

    /**
     * 按行绘制的字符画布，宽度固定为整棵树的宽度。
     */
    private static final class Canvas {
        private final int width;
        private final List<char[]> rows = new ArrayList<>();

        Canvas(int width) {
            this.width = width;
        }

        char[] row(int index) {
            while (rows.size() <= index) {
                char[] blank = new char[width];
                Arrays.fill(blank, ' ');
                rows.add(blank);
            }
            return rows.get(index);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (char[] row : rows) {
                sb.append(new String(row).stripTrailing()).append('\n');
            }
            return sb.toString();
        }
    }
}
