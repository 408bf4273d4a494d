package org.csu.calculator.compiler.parser.ast.expression;

/**
 * AST 表达式节点的根类型。
 * 节点种类是封闭的，所有使用方只处理这三种；节点不可变，并独占自己的子节点。
 */
public sealed interface ExpressionNode
        permits LiteralNode, UnaryExpressionNode, BinaryExpressionNode {

    /**
     * Binding strength of the node's top-level operator. Literals bind tighter than any operator.
     */
    int precedence();
}
