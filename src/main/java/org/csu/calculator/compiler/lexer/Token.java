package org.csu.calculator.compiler.lexer;

/**
 * @param type   kind of the token
 * @param lexeme exact source text of the token, empty for {@link TokenType#EOF}
 * @param line   1-based line
 * @param column 1-based column of the first character
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    @Override
    public String toString() {
        return String.format("Token[Type=%-13s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
