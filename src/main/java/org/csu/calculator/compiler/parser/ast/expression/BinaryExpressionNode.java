package org.csu.calculator.compiler.parser.ast.expression;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., 10 - 3)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        BinaryOperator operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public int precedence() {
        return operator.getPrecedence();
    }
}
