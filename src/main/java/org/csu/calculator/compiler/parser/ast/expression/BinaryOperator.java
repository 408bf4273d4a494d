package org.csu.calculator.compiler.parser.ast.expression;

import lombok.Getter;
import org.csu.calculator.compiler.lexer.TokenType;

/**
 * Infix operators. All of them are left-associative.
 */
@Getter
public enum BinaryOperator {
    ADD("+", 1),
    SUBTRACT("-", 1),
    MULTIPLY("*", 2),
    DIVIDE("/", 2),
    REMAINDER("%", 2);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public static BinaryOperator fromTokenType(TokenType type) {
        return switch (type) {
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case ASTERISK -> MULTIPLY;
            case SLASH -> DIVIDE;
            case PERCENT -> REMAINDER;
            default -> throw new IllegalArgumentException("Not a binary operator token: " + type);
        };
    }
}
