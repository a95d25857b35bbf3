package org.csu.astcalc.cli;

import org.csu.astcalc.engine.CalculationResult;
import org.csu.astcalc.engine.ExpressionProcessor;
import org.csu.astcalc.render.DiagramStyle;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Set;

/**
 * 交互式读取-求值循环。
 * 每次读入一行表达式，单行的解析或求值失败只打印错误信息，然后继续等待下一行。
 */
public class InteractiveShell {

    private static final String PROMPT = ">>> ";
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit", "q");

    private final ExpressionProcessor processor;
    private final ShellOptions options;

    public InteractiveShell(ExpressionProcessor processor, ShellOptions options) {
        this.processor = processor;
        this.options = options;
    }

    public void run(BufferedReader in, PrintStream out) throws IOException {
        out.println("Type exit or quit to stop the program!");
        prompt(out);

        String line;
        while ((line = in.readLine()) != null) {
            String trimmed = line.trim();
            if (EXIT_COMMANDS.contains(trimmed)) {
                break;
            }
            if (!trimmed.isEmpty()) {
                handleLine(line, out);
            }
            prompt(out);
        }
        out.println("Bye!");
    }

    private void handleLine(String line, PrintStream out) {
        DiagramStyle style = options.isAstMode() ? options.getAstView() : null;
        CalculationResult result = processor.process(line, style);

        if (result.hasDiagram()) {
            out.println("Here is the AST for your expression:");
            out.print(result.diagram());
        }
        if (result.isSuccess()) {
            out.println("The expression evaluates to: " + result.message());
        } else {
            out.println("ERROR: " + result.message());
        }
    }

    private void prompt(PrintStream out) {
        out.print(PROMPT);
        out.flush();
    }
}
