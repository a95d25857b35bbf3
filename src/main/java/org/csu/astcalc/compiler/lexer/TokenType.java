package org.csu.astcalc.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 算术表达式中所有可能出现的“单词”的分类。
 * 注意 MINUS 既是二元减号也是一元负号，由语法分析器根据位置区分。
 */
public enum TokenType {
    // ---- 常量 (Constants) ----
    NUMBER,     // 123, 3.14, 1e-3

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    MINUS,      // -
    STAR,       // *
    SLASH,      // /
    CARET,      // ^
    BANG,       // !  阶乘 (后缀)

    // ---- 函数名 (Functions) ----
    SIN,        // "sin"
    COS,        // "cos"
    TAN,        // "tan"
    EXP,        // "exp"
    LN,         // "ln"

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    IDENTIFIER, // 未知的名字，只会在语法分析阶段报错
    EOF,        // End-Of-File，表示输入流结束
    ILLEGAL     // 非法字符，用于错误处理
}
