package org.csu.calculator.compiler;

import org.csu.calculator.common.exception.LexException;
import org.csu.calculator.compiler.lexer.Lexer;
import org.csu.calculator.compiler.lexer.Token;
import org.csu.calculator.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private static List<Token> lex(String input) {
        List<Token> tokens = new Lexer(input).tokenize();
        System.out.println("Input: '" + input + "' -> " + tokens);
        return tokens;
    }

    @Test
    void testAllOperatorsAndParentheses() {
        System.out.println("--- Running test: testAllOperatorsAndParentheses ---");
        List<Token> tokens = lex("(1+2)-3*4/5%6");

        TokenType[] expectedTypes = {
                TokenType.LPAREN, TokenType.INTEGER_CONST, TokenType.PLUS, TokenType.INTEGER_CONST,
                TokenType.RPAREN, TokenType.MINUS, TokenType.INTEGER_CONST, TokenType.ASTERISK,
                TokenType.INTEGER_CONST, TokenType.SLASH, TokenType.INTEGER_CONST, TokenType.PERCENT,
                TokenType.INTEGER_CONST, TokenType.EOF
        };
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配");
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }
    }

    @Test
    void testNumberIsMaximalDigitRun() {
        List<Token> tokens = lex("  1234 56");
        assertEquals(3, tokens.size());
        assertEquals("1234", tokens.get(0).lexeme());
        assertEquals(3, tokens.get(0).column());
        assertEquals("56", tokens.get(1).lexeme());
        assertEquals(8, tokens.get(1).column());
        assertEquals(TokenType.EOF, tokens.get(2).type());
    }

    @Test
    void testMinusIsAlwaysTheSameToken() {
        List<TokenType> types = lex("--5 - -3").stream().map(Token::type).collect(Collectors.toList());
        assertEquals(List.of(TokenType.MINUS, TokenType.MINUS, TokenType.INTEGER_CONST,
                TokenType.MINUS, TokenType.MINUS, TokenType.INTEGER_CONST, TokenType.EOF), types);
    }

    @Test
    void testEmptyAndBlankInputYieldOnlyEof() {
        assertEquals(List.of(TokenType.EOF), lex("").stream().map(Token::type).collect(Collectors.toList()));
        assertEquals(List.of(TokenType.EOF), lex(" \t ").stream().map(Token::type).collect(Collectors.toList()));
    }

    @Test
    void testNewlineAdvancesLine() {
        List<Token> tokens = lex("1 +\n  2");
        assertEquals(1, tokens.get(1).line());
        assertEquals(2, tokens.get(2).line());
        assertEquals(3, tokens.get(2).column());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1+2", " ( 10 + 5 ) * - 2 ", "\t--5", "100 % (7 - 2) / 3", "0"})
    void testLexemesReconstructNonWhitespaceInput(String input) {
        String joined = lex(input).stream().map(Token::lexeme).collect(Collectors.joining());
        assertEquals(input.replaceAll("\\s", ""), joined);
    }

    @Test
    void testIllegalCharacter() {
        System.out.println("--- Running test: testIllegalCharacter ---");
        LexException e = assertThrows(LexException.class, () -> lex("10 @ 5"));
        System.out.println("Caught: " + e.getMessage());
        assertEquals("@", e.getOffendingText());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertTrue(e.getMessage().startsWith("Lexical Error at line 1, column 4"));
    }

    @Test
    void testDecimalPointIsNotPartOfTheGrammar() {
        LexException e = assertThrows(LexException.class, () -> lex("1.5"));
        assertEquals(".", e.getOffendingText());
        assertEquals(2, e.getColumn());
    }

    @Test
    void testNumberOutOfRange() {
        assertEquals("9223372036854775807", lex("9223372036854775807").get(0).lexeme());

        LexException e = assertThrows(LexException.class, () -> lex("1 + 9223372036854775808"));
        assertEquals("9223372036854775808", e.getOffendingText());
        assertEquals(5, e.getColumn());
        assertTrue(e.getMessage().contains("out of range"));
    }
}
