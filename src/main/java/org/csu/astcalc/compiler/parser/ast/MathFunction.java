package org.csu.astcalc.compiler.parser.ast;

import org.csu.astcalc.compiler.lexer.TokenType;

/**
 * 内置的超越函数，ln 为自然对数。
 */
public enum MathFunction {
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    EXP("exp"),
    LN("ln");

    private final String functionName;

    MathFunction(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    public static boolean isFunction(TokenType type) {
        return type == TokenType.SIN || type == TokenType.COS || type == TokenType.TAN
                || type == TokenType.EXP || type == TokenType.LN;
    }

    public static MathFunction fromTokenType(TokenType type) {
        return switch (type) {
            case SIN -> SIN;
            case COS -> COS;
            case TAN -> TAN;
            case EXP -> EXP;
            case LN -> LN;
            default -> throw new IllegalArgumentException("Cannot convert " + type + " to function");
        };
    }
}
