package org.csu.calculator.engine;

import org.csu.calculator.compiler.lexer.Lexer;
import org.csu.calculator.compiler.parser.Parser;
import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryOperator;
import org.csu.calculator.compiler.parser.ast.expression.LiteralNode;
import org.csu.calculator.compiler.parser.ast.expression.UnaryExpressionNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private static Optional<Long> eval(String input) {
        ExpressionNode ast = new Parser(new Lexer(input).tokenize()).parse();
        Optional<Long> result = ExpressionEvaluator.evaluate(ast);
        System.out.println(input + " => " + result.map(String::valueOf).orElse("undefined"));
        return result;
    }

    @ParameterizedTest
    @CsvSource({
            "2 + 3 * 4, 14",
            "(2 + 3) * 4, 20",
            "10 - 3 - 2, 5",
            "--5, 5",
            "-5, -5",
            "(10 + 5) * -2, -30",
            "100 / 7 % 4, 2",
            "7 / 2, 3",
            "-7 / 2, -3",
            "7 % -2, 1",
            "-7 % 2, -1",
            "0 / 5, 0",
            "9223372036854775807, 9223372036854775807"
    })
    void testDefinedResults(String input, long expected) {
        assertEquals(Optional.of(expected), eval(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "10 / 0",
            "10 % 0",
            "1 / (2 - 2)",
            "(10 / 0) * 0",
            "0 * (10 % 0)",
            "-(5 / 0)",
            "1 + 2 * (3 - 4 / (1 - 1))"
    })
    void testDivisionByZeroPoisonsTheWholeTree(String input) {
        System.out.println("--- Goal: undefined must propagate to the root ---");
        assertEquals(Optional.empty(), eval(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "9223372036854775807 + 1",
            "-9223372036854775807 - 2",
            "4611686018427387904 * 2",
            "(9223372036854775807 + 1) * 0"
    })
    void testOverflowIsUndefined(String input) {
        assertEquals(Optional.empty(), eval(input));
    }

    @Test
    void testMinValueEdgeCases() {
        LiteralNode min = new LiteralNode(Long.MIN_VALUE);
        LiteralNode minusOne = new LiteralNode(-1);

        assertEquals(Optional.empty(), ExpressionEvaluator.evaluate(UnaryExpressionNode.negate(min)));
        assertEquals(Optional.empty(), ExpressionEvaluator.evaluate(
                new BinaryExpressionNode(min, BinaryOperator.DIVIDE, minusOne)));
        assertEquals(Optional.of(0L), ExpressionEvaluator.evaluate(
                new BinaryExpressionNode(min, BinaryOperator.REMAINDER, minusOne)));
        assertEquals(Optional.of(Long.MIN_VALUE), eval("-9223372036854775807 - 1"));
    }
}
