package org.csu.calculator.engine;

import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryOperator;
import org.csu.calculator.compiler.parser.ast.expression.LiteralNode;
import org.csu.calculator.compiler.parser.ast.expression.UnaryExpressionNode;

import java.util.Optional;

/**
 * 表达式求值器。
 * 自底向上把表达式树折叠为 64 位整数。除数为零或结果超出 {@code long} 范围时结果为空，
 * 且空结果会一直传播到根节点。对合法的树求值永远不会抛出异常。
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static Optional<Long> evaluate(ExpressionNode expression) {
        if (expression instanceof LiteralNode literal) {
            return Optional.of(literal.value());
        }
        if (expression instanceof UnaryExpressionNode unary) {
            return evaluate(unary.operand()).flatMap(v -> switch (unary.operator()) {
                case NEGATE -> checked(() -> Math.negateExact(v));
            });
        }
        if (expression instanceof BinaryExpressionNode binary) {
            Optional<Long> left = evaluate(binary.left());
            Optional<Long> right = evaluate(binary.right());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return apply(binary.operator(), left.get(), right.get());
        }
        throw new IllegalStateException("Unsupported expression type: " + expression.getClass().getSimpleName());
    }

    private static Optional<Long> apply(BinaryOperator operator, long left, long right) {
        return switch (operator) {
            case ADD -> checked(() -> Math.addExact(left, right));
            case SUBTRACT -> checked(() -> Math.subtractExact(left, right));
            case MULTIPLY -> checked(() -> Math.multiplyExact(left, right));
            case DIVIDE -> {
                // Long.MIN_VALUE / -1 overflows
                if (right == 0 || (left == Long.MIN_VALUE && right == -1)) yield Optional.empty();
                yield Optional.of(left / right);
            }
            case REMAINDER -> {
                if (right == 0) yield Optional.empty();
                yield Optional.of(left % right);
            }
        };
    }

    private static Optional<Long> checked(LongOperation operation) {
        try {
            return Optional.of(operation.apply());
        } catch (ArithmeticException overflow) {
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface LongOperation {
        long apply();
    }
}
