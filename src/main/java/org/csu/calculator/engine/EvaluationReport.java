package org.csu.calculator.engine;

import lombok.Builder;
import lombok.Getter;
import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;

import java.util.Optional;

/**
 * Everything the pipeline produced for one input line: either the renderings and
 * result of a parsed expression, or the message of the error that aborted it.
 */
@Getter
@Builder
public class EvaluationReport {

    private final String input;
    private final ExpressionNode expression;
    private final String canonical;
    private final String tree;
    /** null when the expression is undefined or did not parse */
    private final Long value;
    private final String errorMessage;

    public boolean isSuccessful() {
        return errorMessage == null;
    }

    public Optional<Long> getResult() {
        return Optional.ofNullable(value);
    }
}
