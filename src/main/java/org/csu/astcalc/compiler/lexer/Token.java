package org.csu.astcalc.compiler.lexer;

/**
 * 词法单元不携带位置信息。
 *
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 */
public record Token(TokenType type, String lexeme) {

    /**
     * NUMBER 类型 Token 的数值。
     */
    public double numericValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Token " + this + " is not a number");
        }
        return Double.parseDouble(lexeme);
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-10s, Lexeme='%s']", type, lexeme);
    }
}
