package org.csu.astcalc.compiler.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的一行算术表达式分解为一系列的Token，以 EOF 结尾。
 * 词法分析本身从不失败：无法识别的字符生成 ILLEGAL，未知的名字生成 IDENTIFIER，
 * 由语法分析器在用到它们时报错。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    // 函数名映射表，区分大小写
    private static final Map<String, TokenType> functions;

    static {
        functions = new HashMap<>();
        functions.put("sin", TokenType.SIN);
        functions.put("cos", TokenType.COS);
        functions.put("tan", TokenType.TAN);
        functions.put("exp", TokenType.EXP);
        functions.put("ln", TokenType.LN);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "");
        }

        char currentChar = peek();

        // 识别函数名或未知标识符
        if (isLetter(currentChar)) {
            return readIdentifierOrFunction();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                return consumeAndReturn(TokenType.STAR, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case '^':
                return consumeAndReturn(TokenType.CARET, "^");
            case '!':
                return consumeAndReturn(TokenType.BANG, "!");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            default:
                return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(currentChar));
        }
    }

    private Token readIdentifierOrFunction() {
        int startPos = position;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 最长匹配：整个标识符必须恰好是一个函数名，"sinh" 不会被拆成 "sin" + "h"
        TokenType type = functions.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text);
    }

    private Token readNumber() {
        int startPos = position;
        skipDigits();

        // 小数部分：小数点后面必须还有数字，"1." 会被拆成 1 和一个非法的 '.'
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            skipDigits();
        }

        // 指数部分：只有 e 后面跟着 (可选符号 +) 数字时才算，"2exp(1)" 中的 e 属于函数名
        if (peek() == 'e' || peek() == 'E') {
            int exponentDigits = (peekNext() == '+' || peekNext() == '-') ? position + 2 : position + 1;
            if (exponentDigits < input.length() && isDigit(input.charAt(exponentDigits))) {
                position = exponentDigits;
                skipDigits();
            }
        }

        return new Token(TokenType.NUMBER, input.substring(startPos, position));
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n' || ch == '\f') {
                advance();
            } else {
                break;
            }
        }
    }

    private void skipDigits() {
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 输入结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme);
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
