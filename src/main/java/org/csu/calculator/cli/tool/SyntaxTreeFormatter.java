package org.csu.calculator.cli.tool;

import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.LiteralNode;
import org.csu.calculator.compiler.parser.ast.expression.UnaryExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 将表达式树渲染为带连接线的树状图，每个节点一行（先序）。
 * <pre>
 * *
 * ├ +
 * │ ├ 10
 * │ └ 5
 * └ -
 *   └ 2
 * </pre>
 */
public class SyntaxTreeFormatter {

    private static final String BRANCH = "├";
    private static final String LAST_BRANCH = "└";
    private static final String CONTINUATION = "│ ";
    private static final String BLANK = "  ";

    public static String format(ExpressionNode expression) {
        List<String> lines = new ArrayList<>();
        lines.add(label(expression));
        appendChildren(lines, expression, "");
        return String.join("\n", lines);
    }

    private static void appendNode(List<String> lines, ExpressionNode node, String prefix, boolean isLast) {
        lines.add(prefix + (isLast ? LAST_BRANCH : BRANCH) + " " + label(node));
        appendChildren(lines, node, prefix + (isLast ? BLANK : CONTINUATION));
    }

    private static void appendChildren(List<String> lines, ExpressionNode node, String prefix) {
        List<ExpressionNode> children = children(node);
        for (int i = 0; i < children.size(); i++) {
            appendNode(lines, children.get(i), prefix, i == children.size() - 1);
        }
    }

    private static List<ExpressionNode> children(ExpressionNode node) {
        if (node instanceof LiteralNode) {
            return List.of();
        }
        if (node instanceof UnaryExpressionNode unary) {
            return List.of(unary.operand());
        }
        if (node instanceof BinaryExpressionNode binary) {
            return List.of(binary.left(), binary.right());
        }
        throw new IllegalStateException("Unsupported expression type: " + node.getClass().getSimpleName());
    }

    private static String label(ExpressionNode node) {
        if (node instanceof LiteralNode literal) {
            return Long.toString(literal.value());
        }
        if (node instanceof UnaryExpressionNode unary) {
            return unary.operator().getSymbol();
        }
        if (node instanceof BinaryExpressionNode binary) {
            return binary.operator().getSymbol();
        }
        throw new IllegalStateException("Unsupported expression type: " + node.getClass().getSimpleName());
    }
}
