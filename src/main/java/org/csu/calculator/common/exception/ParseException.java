package org.csu.calculator.common.exception;

import lombok.Getter;
import org.csu.calculator.compiler.lexer.Token;

/**
 * Raised when the token sequence is not a single well-formed expression.
 */
@Getter
public class ParseException extends RuntimeException {

    private final Token token;

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                token.line(),
                token.column(),
                expected,
                token.lexeme(),
                token.type()));
        this.token = token;
    }
}
