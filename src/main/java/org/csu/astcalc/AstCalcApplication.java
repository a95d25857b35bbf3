package org.csu.astcalc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 程序入口。启动 Spring 容器后由 {@link org.csu.astcalc.cli.CalculatorShellRunner} 接管交互，
 * 交互结束后按它给出的退出码退出进程。
 */
@SpringBootApplication
public class AstCalcApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AstCalcApplication.class, args)));
    }
}
