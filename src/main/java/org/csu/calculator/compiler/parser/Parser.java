package org.csu.calculator.compiler.parser;

import org.csu.calculator.common.exception.ParseException;
import org.csu.calculator.compiler.lexer.Token;
import org.csu.calculator.compiler.lexer.TokenType;
import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.calculator.compiler.parser.ast.expression.BinaryOperator;
import org.csu.calculator.compiler.parser.ast.expression.LiteralNode;
import org.csu.calculator.compiler.parser.ast.expression.UnaryExpressionNode;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * expression := term (("+" | "-") term)*
 * term       := unary (("*" | "/" | "%") unary)*
 * unary      := "-" unary | primary
 * primary    := INTEGER_CONST | "(" expression ")"
 * </pre>
 */
public class Parser {

    /** 语法树高度和括号嵌套的上限 */
    public static final int MAX_DEPTH = 1000;
    private static final String DEPTH_EXPECTATION = "a less deeply nested expression (at most " + MAX_DEPTH + " levels)";

    private final List<Token> tokens;
    private int position = 0;
    private int depth = 0;
    private final Map<ExpressionNode, Integer> heights = new IdentityHashMap<>();

    /**
     * @param tokens lexer output, terminated by an EOF token
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the complete token sequence into exactly one expression.
     * @throws ParseException if the input is empty, malformed, nested deeper than {@link #MAX_DEPTH},
     *                        or has tokens left after the expression
     */
    public ExpressionNode parse() {
        ExpressionNode expression = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of expression");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExpressionNode right = parseTerm();
            left = binary(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseUnary();
        while (match(TokenType.ASTERISK, TokenType.SLASH, TokenType.PERCENT)) {
            Token operator = previous();
            ExpressionNode right = parseUnary();
            left = binary(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (match(TokenType.MINUS)) {
            Token operator = previous();
            descend();
            ExpressionNode operand = parseUnary();
            depth--;
            return track(UnaryExpressionNode.negate(operand), heightOf(operand) + 1, operator);
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        if (match(TokenType.INTEGER_CONST)) {
            return new LiteralNode(Long.parseLong(previous().lexeme()));
        }
        if (match(TokenType.LPAREN)) {
            Token open = previous();
            descend();
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN, "')' to close '(' at column " + open.column());
            depth--;
            return expr;
        }
        throw new ParseException(peek(), "a number, '-' or '('");
    }

    // --- 深度限制 ---

    private ExpressionNode binary(ExpressionNode left, Token operator, ExpressionNode right) {
        ExpressionNode node = new BinaryExpressionNode(left, BinaryOperator.fromTokenType(operator.type()), right);
        return track(node, Math.max(heightOf(left), heightOf(right)) + 1, operator);
    }

    private ExpressionNode track(ExpressionNode node, int height, Token at) {
        if (height > MAX_DEPTH) {
            throw new ParseException(at, DEPTH_EXPECTATION);
        }
        heights.put(node, height);
        return node;
    }

    private int heightOf(ExpressionNode node) {
        return node instanceof LiteralNode ? 0 : heights.get(node);
    }

    /** Bounds the parser's own recursion: parentheses and prefix operators. */
    private void descend() {
        if (++depth > MAX_DEPTH) {
            throw new ParseException(previous(), DEPTH_EXPECTATION);
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
