package org.csu.calculator.compiler.lexer;

/**
 * @description: 词法单元（Token）的类型
 *
 * 算术表达式中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 常量 (Constants) ----
    INTEGER_CONST,  // 123

    // ---- 运算符 (Operators) ----
    PLUS,           // +
    MINUS,          // - (binary or unary, decided by the parser)
    ASTERISK,       // *
    SLASH,          // /
    PERCENT,        // %

    // ---- 分隔符 (Delimiters) ----
    LPAREN,         // (
    RPAREN,         // )

    // ---- 特殊 Token ----
    EOF             // end of input
}
