package org.csu.astcalc.render;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * AST 图示的两种风格。
 */
public enum DiagramStyle {
    HIERARCHY(new HierarchyRenderer()),
    TREE(new TreeRenderer());

    private final AstRenderer renderer;

    DiagramStyle(AstRenderer renderer) {
        this.renderer = renderer;
    }

    public AstRenderer renderer() {
        return renderer;
    }

    /**
     * 命令行和配置文件中使用的名字: "hierarchy" 或 "tree"。
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DiagramStyle fromName(String name) {
        for (DiagramStyle style : values()) {
            if (style.displayName().equalsIgnoreCase(name.trim())) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unknown AST view '" + name + "', expected one of: " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(DiagramStyle::displayName).collect(Collectors.joining(", "));
    }
}
