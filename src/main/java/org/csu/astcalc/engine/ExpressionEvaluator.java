package org.csu.astcalc.engine;

import org.csu.astcalc.common.exception.EvaluationException;
import org.csu.astcalc.common.util.NumberFormatter;
import org.csu.astcalc.compiler.parser.ast.*;

/**
 * 表达式求值器。
 * 后序遍历AST (先子节点后父节点)，得到一个 double 结果。
 *
 * 定义域错误一律抛出 EvaluationException：
 * 阶乘的操作数不是非负整数，或者某个运算在操作数都不是 NaN 的情况下算出了 NaN (ln(-1), 0/0 ...)。
 * 其余 IEEE 结果原样保留，例如 1/0 = Infinity, ln(0) = -Infinity。
 */
public class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static double evaluate(AstNode node) {
        if (node instanceof NumberNode numberNode) {
            return numberNode.value();
        }
        if (node instanceof BinaryOpNode binaryNode) {
            double left = evaluate(binaryNode.left());
            double right = evaluate(binaryNode.right());
            double result = switch (binaryNode.operator()) {
                case PLUS -> left + right;
                case MINUS -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> left / right;
                case POWER -> Math.pow(left, right);
            };
            return checkDomain(result, binaryNode, left, right);
        }
        if (node instanceof UnaryOpNode unaryNode) {
            double operand = evaluate(unaryNode.operand());
            return switch (unaryNode.operator()) {
                case NEGATE -> -operand;
            };
        }
        if (node instanceof PostfixOpNode postfixNode) {
            double operand = evaluate(postfixNode.operand());
            return switch (postfixNode.operator()) {
                case FACTORIAL -> factorial(operand);
            };
        }
        if (node instanceof FunctionCallNode callNode) {
            double argument = evaluate(callNode.argument());
            double result = switch (callNode.function()) {
                case SIN -> Math.sin(argument);
                case COS -> Math.cos(argument);
                case TAN -> Math.tan(argument);
                case EXP -> Math.exp(argument);
                case LN -> Math.log(argument);
            };
            return checkDomain(result, callNode, argument);
        }
        throw new UnsupportedOperationException("Unsupported AST node type: " + node.getClass().getSimpleName());
    }

    static double factorial(double operand) {
        if (Double.isNaN(operand) || Double.isInfinite(operand)) {
            throw new EvaluationException("Cannot evaluate factorial of " + NumberFormatter.format(operand));
        }
        if (operand < 0) {
            throw new EvaluationException("Cannot evaluate factorial of negative number " + NumberFormatter.format(operand));
        }
        if (operand != Math.rint(operand)) {
            throw new EvaluationException("Cannot evaluate factorial on decimal " + NumberFormatter.format(operand));
        }
        double result = 1;
        // 171! 起已超出 double 范围，结果为 Infinity，无需继续乘
        for (long i = 2; i <= operand && !Double.isInfinite(result); i++) {
            result *= i;
        }
        return result;
    }

    private static double checkDomain(double result, AstNode node, double... operands) {
        if (!Double.isNaN(result)) {
            return result;
        }
        for (double operand : operands) {
            if (Double.isNaN(operand)) {
                return result;
            }
        }
        throw new EvaluationException("Undefined result for '" + node.label() + "' applied to "
                + describe(operands));
    }

    private static String describe(double... operands) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operands.length; i++) {
            if (i > 0) {
                sb.append(" and ");
            }
            sb.append(NumberFormatter.format(operands[i]));
        }
        return sb.toString();
    }
}
