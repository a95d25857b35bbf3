package org.csu.astcalc.cli;

import org.csu.astcalc.engine.ExpressionProcessor;
import org.csu.astcalc.render.DiagramStyle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Spring 启动完成后运行交互式计算器。
 * AST 模式和图示风格的默认值来自 application.properties，命令行参数优先。
 * 输入输出一律按 UTF-8 处理，命令行参数错误时退出码为 {@link #EXIT_USAGE}。
 */
@Component
public class CalculatorShellRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    private final boolean defaultAstMode;
    private final String defaultAstView;
    private int exitCode = EXIT_OK;

    public CalculatorShellRunner(@Value("${astcalc.ast-mode:false}") boolean defaultAstMode,
                                 @Value("${astcalc.ast-view:hierarchy}") String defaultAstView) {
        this.defaultAstMode = defaultAstMode;
        this.defaultAstView = defaultAstView;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = execute(args, System.in, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args, InputStream in, OutputStream out, OutputStream err) throws IOException {
        PrintStream stdout = new PrintStream(out, true, StandardCharsets.UTF_8);
        ShellOptions options;
        try {
            options = ShellOptions.parse(args, defaultAstMode, DiagramStyle.fromName(defaultAstView));
        } catch (IllegalArgumentException e) {
            PrintStream stderr = new PrintStream(err, true, StandardCharsets.UTF_8);
            stderr.println("ERROR: " + e.getMessage());
            stderr.println(ShellOptions.usage());
            return EXIT_USAGE;
        }

        if (options.isHelp()) {
            stdout.println(ShellOptions.usage());
            return EXIT_OK;
        }

        InteractiveShell shell = new InteractiveShell(new ExpressionProcessor(), options);
        shell.run(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), stdout);
        return EXIT_OK;
    }
}
