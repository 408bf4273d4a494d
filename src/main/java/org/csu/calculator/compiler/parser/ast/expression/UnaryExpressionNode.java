package org.csu.calculator.compiler.parser.ast.expression;

import java.util.Objects;

/**
 * AST 节点: 表示一个一元运算表达式 (e.g., -5)
 */
public record UnaryExpressionNode(
        UnaryOperator operator,
        ExpressionNode operand
) implements ExpressionNode {

    public UnaryExpressionNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    public static UnaryExpressionNode negate(ExpressionNode operand) {
        return new UnaryExpressionNode(UnaryOperator.NEGATE, operand);
    }

    @Override
    public int precedence() {
        return operator.getPrecedence();
    }
}
