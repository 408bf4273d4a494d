package org.csu.calculator.cli.tool;

import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.LiteralNode;
import org.csu.calculator.compiler.parser.ast.expression.UnaryExpressionNode;

/**
 * 将表达式树格式化为最少括号的中缀字符串。
 * 每次递归都带上当前位置要求的优先级以及位于父节点的哪一侧：子节点优先级更低时加括号，
 * 优先级相同且位于（左结合）二元运算符右侧时也加括号。重新解析输出会得到同一棵树。
 */
public class CanonicalExpressionFormatter {

    private enum Side { LEFT, RIGHT }

    /**
     * @param expression the tree to print
     * @return e.g. {@code (10 + 5) * -2}
     */
    public static String format(ExpressionNode expression) {
        StringBuilder sb = new StringBuilder();
        append(sb, expression, 0, Side.LEFT);
        return sb.toString();
    }

    private static void append(StringBuilder sb, ExpressionNode node, int requiredPrecedence, Side side) {
        boolean parenthesize = node.precedence() < requiredPrecedence
                || (node.precedence() == requiredPrecedence && side == Side.RIGHT);
        if (parenthesize) sb.append('(');

        if (node instanceof LiteralNode literal) {
            sb.append(literal.value());
        } else if (node instanceof UnaryExpressionNode unary) {
            sb.append(unary.operator().getSymbol());
            // prefix operand: equal rank (a nested negation) needs no parentheses
            append(sb, unary.operand(), unary.precedence(), Side.LEFT);
        } else if (node instanceof BinaryExpressionNode binary) {
            append(sb, binary.left(), binary.precedence(), Side.LEFT);
            sb.append(' ').append(binary.operator().getSymbol()).append(' ');
            append(sb, binary.right(), binary.precedence(), Side.RIGHT);
        } else {
            throw new IllegalStateException("Unsupported expression type: " + node.getClass().getSimpleName());
        }

        if (parenthesize) sb.append(')');
    }
}
