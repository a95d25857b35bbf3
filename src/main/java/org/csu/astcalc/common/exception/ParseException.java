package org.csu.astcalc.common.exception;

import lombok.Getter;
import org.csu.astcalc.compiler.lexer.Token;
import org.csu.astcalc.compiler.lexer.TokenType;

/**
 * 语法分析阶段的异常，不做任何错误恢复。
 */
public class ParseException extends RuntimeException {

    @Getter
    private final ErrorKind kind;

    public ParseException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ParseException(Token token, String expected) {
        this(kindOf(token), String.format("Syntax Error: Expected %s, but found %s",
                expected, describe(token)));
    }

    private static ErrorKind kindOf(Token token) {
        return switch (token.type()) {
            case EOF -> ErrorKind.PARSE_UNEXPECTED_END;
            case ILLEGAL, IDENTIFIER -> ErrorKind.LEX_UNRECOGNIZED;
            default -> ErrorKind.PARSE_UNEXPECTED_TOKEN;
        };
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of input";
        }
        if (token.type() == TokenType.ILLEGAL || token.type() == TokenType.IDENTIFIER) {
            return "unrecognized input '" + token.lexeme() + "'";
        }
        return "'" + token.lexeme() + "' (" + token.type() + ")";
    }
}
