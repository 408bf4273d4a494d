package org.csu.calculator.common.exception;

import lombok.Getter;

/**
 * @description: 词法分析阶段的自定义异常
 *
 * 输入中出现无法构成任何 Token 的字符，或数字超出 long 范围时抛出。
 */
@Getter
public class LexException extends RuntimeException {

    private final String offendingText;
    private final int line;
    private final int column;

    public LexException(String offendingText, int line, int column, String detail) {
        super(String.format("Lexical Error at line %d, column %d: %s", line, column, detail));
        this.offendingText = offendingText;
        this.line = line;
        this.column = column;
    }
}
