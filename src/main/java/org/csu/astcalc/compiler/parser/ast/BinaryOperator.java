package org.csu.astcalc.compiler.parser.ast;

import org.csu.astcalc.compiler.lexer.TokenType;

public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    POWER("^");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static BinaryOperator fromTokenType(TokenType type) {
        return switch (type) {
            case PLUS -> PLUS;
            case MINUS -> MINUS;
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            case CARET -> POWER;
            default -> throw new IllegalArgumentException("Cannot convert " + type + " to binary operator");
        };
    }
}
