package org.csu.astcalc.common.exception;

/**
 * 表达式处理失败的分类。
 */
public enum ErrorKind {
    LEX_UNRECOGNIZED,       // 无法识别的字符或名字
    PARSE_UNEXPECTED_TOKEN, // 该位置不允许出现这个 Token
    PARSE_UNEXPECTED_END,   // 表达式中途结束
    PARSE_TRAILING_TOKENS,  // 完整表达式之后还有多余的 Token
    EVAL_DOMAIN_ERROR       // 数学上无定义的运算
}
