package org.csu.calculator.compiler.parser.ast.expression;

import lombok.Getter;

/**
 * Prefix operators. Rank 3 binds tighter than every binary operator.
 */
@Getter
public enum UnaryOperator {
    NEGATE("-", 3);

    private final String symbol;
    private final int precedence;

    UnaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }
}
