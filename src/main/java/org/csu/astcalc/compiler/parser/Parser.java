package org.csu.astcalc.compiler.parser;

import org.csu.astcalc.common.exception.ErrorKind;
import org.csu.astcalc.common.exception.ParseException;
import org.csu.astcalc.compiler.lexer.Token;
import org.csu.astcalc.compiler.lexer.TokenType;
import org.csu.astcalc.compiler.parser.ast.*;

import java.util.List;

/**
 * @description: 语法分析器
 * 采用 Pratt 算法 (按最小绑定力递归下降)，将Token流转换为抽象语法树(AST)
 *
 * 绑定力 (左, 右)，数值越大结合越紧:
 * <pre>
 *   + -   (1, 2)   左结合
 *   * /   (3, 4)   左结合
 *   -x    操作数按 5 解析，比 * / 紧、比 ^ 松
 *   ^     (6, 5)   右结合
 *   x!    左绑定力 7，比所有运算符都紧
 * </pre>
 */
public class Parser {

    private static final int LOWEST_BINDING_POWER = 0;
    private static final int PREFIX_MINUS_BINDING_POWER = 5;
    private static final int POSTFIX_BINDING_POWER = 7;

    // 递归层数和AST深度的上限，求值和画图都按树的深度递归，超过上限就当作语法错误
    static final int MAX_DEPTH = 1000;

    private final List<Token> tokens;
    private int position = 0;
    private int nesting = 0;   // 当前 parseExpression 的递归层数
    private int treeDepth = 0; // 最近一次解析出的子树的深度

    /**
     * @param tokens Lexer 产生的Token列表，必须以 EOF 结尾
     */
    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    /**
     * 解析整个Token流，得到一棵完整的AST；之后必须恰好剩下 EOF。
     */
    public AstNode parse() {
        AstNode expression = parseExpression(LOWEST_BINDING_POWER);
        if (!isAtEnd()) {
            throw new ParseException(ErrorKind.PARSE_TRAILING_TOKENS,
                    String.format("Syntax Error: Unexpected '%s' after the end of the expression", peek().lexeme()));
        }
        return expression;
    }

    private AstNode parseExpression(int minBindingPower) {
        nesting++;
        try {
            if (nesting > MAX_DEPTH) {
                throw nestedTooDeeply();
            }
            AstNode left = parsePrefix();
            int leftDepth = treeDepth;

            while (true) {
                TokenType type = peek().type();

                if (type == TokenType.BANG) {
                    if (POSTFIX_BINDING_POWER < minBindingPower) {
                        break;
                    }
                    advance();
                    left = new PostfixOpNode(PostfixOperator.FACTORIAL, left);
                    leftDepth = checkTreeDepth(leftDepth + 1);
                    continue;
                }

                BindingPower power = infixBindingPower(type);
                if (power == null || power.left() < minBindingPower) {
                    break;
                }
                advance();
                AstNode right = parseExpression(power.right());
                left = new BinaryOpNode(BinaryOperator.fromTokenType(type), left, right);
                leftDepth = checkTreeDepth(Math.max(leftDepth, treeDepth) + 1);
            }

            treeDepth = leftDepth;
            return left;
        } finally {
            nesting--;
        }
    }

    private AstNode parsePrefix() {
        if (match(TokenType.NUMBER)) {
            treeDepth = 1;
            return new NumberNode(previous().numericValue());
        }
        if (match(TokenType.LPAREN)) {
            AstNode expr = parseExpression(LOWEST_BINDING_POWER);
            consume(TokenType.RPAREN, "')' after expression");
            return expr;
        }
        if (MathFunction.isFunction(peek().type())) {
            return parseFunctionCall();
        }
        if (match(TokenType.MINUS)) {
            AstNode operand = parseExpression(PREFIX_MINUS_BINDING_POWER);
            treeDepth = checkTreeDepth(treeDepth + 1);
            return new UnaryOpNode(UnaryOperator.NEGATE, operand);
        }
        throw new ParseException(peek(), "an operand (a number, a function call, '(' or '-')");
    }

    private FunctionCallNode parseFunctionCall() {
        Token functionToken = advance();
        consume(TokenType.LPAREN, "'(' after function name '" + functionToken.lexeme() + "'");
        AstNode argument = parseExpression(LOWEST_BINDING_POWER);
        consume(TokenType.RPAREN, "')' after function argument");
        treeDepth = checkTreeDepth(treeDepth + 1);
        return new FunctionCallNode(MathFunction.fromTokenType(functionToken.type()), argument);
    }

    private int checkTreeDepth(int depth) {
        if (depth > MAX_DEPTH) {
            throw nestedTooDeeply();
        }
        return depth;
    }

    private ParseException nestedTooDeeply() {
        return new ParseException(ErrorKind.PARSE_UNEXPECTED_TOKEN,
                "Syntax Error: expression nested too deeply (limit " + MAX_DEPTH + ")");
    }

    private static BindingPower infixBindingPower(TokenType type) {
        return switch (type) {
            case PLUS, MINUS -> new BindingPower(1, 2);
            case STAR, SLASH -> new BindingPower(3, 4);
            case CARET -> new BindingPower(6, 5);
            default -> null;
        };
    }

    /**
     * 中缀运算符的绑定力：左结合时 right = left + 1，右结合时 right = left - 1。
     */
    private record BindingPower(int left, int right) {
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
