package org.csu.calculator.engine;

import lombok.Getter;
import org.csu.calculator.cli.client.ShellSettings;
import org.csu.calculator.cli.tool.CanonicalExpressionFormatter;
import org.csu.calculator.cli.tool.SyntaxTreeFormatter;
import org.csu.calculator.common.exception.LexException;
import org.csu.calculator.common.exception.ParseException;
import org.csu.calculator.compiler.lexer.Lexer;
import org.csu.calculator.compiler.lexer.Token;
import org.csu.calculator.compiler.parser.Parser;
import org.csu.calculator.compiler.parser.ast.expression.ExpressionNode;

import java.util.List;
import java.util.Optional;

/**
 * Runs one input line through lexer, parser, evaluator and both formatters.
 * Holds no state between lines.
 */
public class ExpressionProcessor {

    public static final String UNDEFINED = "undefined";

    @Getter
    private final ShellSettings settings;

    public ExpressionProcessor() {
        this(ShellSettings.defaults());
    }

    public ExpressionProcessor(ShellSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws LexException   if the input contains an unrecognized character or an oversized number
     * @throws ParseException if the tokens do not form exactly one expression
     */
    public ExpressionNode parse(String input) {
        List<Token> tokens = new Lexer(input).tokenize();
        return new Parser(tokens).parse();
    }

    public Optional<Long> evaluate(ExpressionNode expression) {
        return ExpressionEvaluator.evaluate(expression);
    }

    public String renderCanonical(ExpressionNode expression) {
        return CanonicalExpressionFormatter.format(expression);
    }

    public String renderTree(ExpressionNode expression) {
        return SyntaxTreeFormatter.format(expression);
    }

    /**
     * Processes one line. Lexical and syntax errors end up in the report, they are not thrown.
     */
    public EvaluationReport process(String input) {
        ExpressionNode expression;
        try {
            expression = parse(input);
        } catch (LexException | ParseException e) {
            return EvaluationReport.builder()
                    .input(input)
                    .errorMessage(e.getMessage())
                    .build();
        }
        return EvaluationReport.builder()
                .input(input)
                .expression(expression)
                .canonical(renderCanonical(expression))
                .tree(renderTree(expression))
                .value(evaluate(expression).orElse(null))
                .build();
    }

    /**
     * Processes one line and formats the report the way the shell prints it.
     */
    public String executeAndGetResult(String input) {
        EvaluationReport report = process(input);
        if (!report.isSuccessful()) {
            return "Error: " + report.getErrorMessage();
        }

        StringBuilder sb = new StringBuilder();
        if (settings.isShowCanonical()) {
            sb.append("Expression:\n").append(report.getCanonical()).append("\n\n");
        }
        if (settings.isShowTree()) {
            sb.append("Syntax tree:\n").append(report.getTree()).append("\n\n");
        }
        sb.append("Result: ").append(report.getResult().map(String::valueOf).orElse(UNDEFINED));
        return sb.toString();
    }
}
