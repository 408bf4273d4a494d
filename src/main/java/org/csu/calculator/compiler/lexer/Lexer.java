package org.csu.calculator.compiler.lexer;

import org.csu.calculator.common.exception.LexException;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的算术表达式分解为一系列的Token。每个输入字符串使用一个新的 Lexer。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the whole input.
     * @return the tokens in source order, always terminated by a single EOF token
     * @throws LexException on a character that starts no token, or on a number that does not fit into a long
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        if (isDigit(currentChar)) {
            return readNumber();
        }

        return switch (currentChar) {
            case '+' -> consumeAndReturn(TokenType.PLUS, "+");
            case '-' -> consumeAndReturn(TokenType.MINUS, "-");
            case '*' -> consumeAndReturn(TokenType.ASTERISK, "*");
            case '/' -> consumeAndReturn(TokenType.SLASH, "/");
            case '%' -> consumeAndReturn(TokenType.PERCENT, "%");
            case '(' -> consumeAndReturn(TokenType.LPAREN, "(");
            case ')' -> consumeAndReturn(TokenType.RPAREN, ")");
            default -> throw new LexException(String.valueOf(currentChar), line, column,
                    "Unexpected character '" + currentChar + "'");
        };
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        String number = input.substring(startPos, position);
        try {
            Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new LexException(number, line, startCol,
                    "Number literal '" + number + "' is out of range");
        }
        return new Token(TokenType.INTEGER_CONST, number, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
