package org.csu.astcalc.cli;

import lombok.Getter;
import org.csu.astcalc.render.DiagramStyle;

/**
 * 命令行参数。
 * <pre>
 *   -a, --ast-mode                 每个表达式求值前先打印它的AST
 *   -v, --ast-view &lt;style&gt;         AST 的图示风格 (hierarchy | tree)，需要打开 AST 模式
 *   -h, --help                     打印用法
 * </pre>
 */
@Getter
public class ShellOptions {

    private final boolean astMode;
    private final DiagramStyle astView;
    private final boolean help;

    public ShellOptions(boolean astMode, DiagramStyle astView, boolean help) {
        this.astMode = astMode;
        this.astView = astView;
        this.help = help;
    }

    /**
     * 解析命令行参数，未出现的选项取配置中的默认值。
     *
     * @throws IllegalArgumentException 参数不合法
     */
    public static ShellOptions parse(String[] args, boolean defaultAstMode, DiagramStyle defaultAstView) {
        boolean astMode = defaultAstMode;
        DiagramStyle astView = defaultAstView;
        boolean viewGiven = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-a") || arg.equals("--ast-mode")) {
                astMode = true;
            } else if (arg.equals("-h") || arg.equals("--help")) {
                help = true;
            } else if (arg.equals("-v") || arg.equals("--ast-view")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Option '" + arg + "' requires a value: " + DiagramStyle.names());
                }
                astView = DiagramStyle.fromName(args[++i]);
                viewGiven = true;
            } else if (arg.startsWith("--ast-view=")) {
                astView = DiagramStyle.fromName(arg.substring("--ast-view=".length()));
                viewGiven = true;
            } else {
                throw new IllegalArgumentException("Unknown option '" + arg + "'");
            }
        }

        if (viewGiven && !astMode) {
            throw new IllegalArgumentException("Option '--ast-view' requires '--ast-mode'");
        }
        return new ShellOptions(astMode, astView, help);
    }

    public static String usage() {
        return String.join("\n",
                "Usage: ast-calc [-a] [-v <style>]",
                "  -a, --ast-mode            Print the AST of each expression before evaluating it",
                "  -v, --ast-view <style>    AST view when AST mode is on: " + DiagramStyle.names(),
                "  -h, --help                Print this help");
    }
}
