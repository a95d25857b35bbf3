package org.csu.astcalc.compiler.parser.ast;

/**
 * 后缀一元运算符，目前只有阶乘。
 */
public enum PostfixOperator {
    FACTORIAL("!");

    private final String symbol;

    PostfixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
