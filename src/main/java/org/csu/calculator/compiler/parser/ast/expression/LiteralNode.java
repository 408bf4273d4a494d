package org.csu.calculator.compiler.parser.ast.expression;

/**
 * AST 节点: 表示一个整数字面量
 */
public record LiteralNode(long value) implements ExpressionNode {

    public static final int PRECEDENCE = Integer.MAX_VALUE;

    @Override
    public int precedence() {
        return PRECEDENCE;
    }
}
