package org.csu.astcalc.compiler.parser.ast;

/**
 * 前缀一元运算符，目前只有取负。
 */
public enum UnaryOperator {
    NEGATE("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
