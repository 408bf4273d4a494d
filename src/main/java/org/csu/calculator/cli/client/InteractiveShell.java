package org.csu.calculator.cli.client;

import org.csu.calculator.engine.ExpressionProcessor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Read-evaluate-print loop around {@link ExpressionProcessor}. One line is one expression;
 * a failing line is reported and the loop goes on.
 */
public class InteractiveShell {

    private final ExpressionProcessor processor;
    private final BufferedReader in;
    private final PrintStream out;

    public InteractiveShell(ExpressionProcessor processor, BufferedReader in, PrintStream out) {
        this.processor = processor;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        ShellSettings settings;
        try {
            settings = ShellSettings.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: calculator [--prompt=<text>] [--exit=<kw1,kw2>] [--no-tree] [--no-canonical]");
            System.exit(2);
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            new InteractiveShell(new ExpressionProcessor(settings), in, System.out).run();
        } catch (IOException e) {
            System.err.println("Could not read input: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Runs until an exit keyword or end of input.
     * @throws IOException if reading the input fails
     */
    public void run() throws IOException {
        ShellSettings settings = processor.getSettings();
        out.println("=== Expression Calculator ===");
        out.println("Enter an arithmetic expression, or '" + settings.getExitKeywords().get(0) + "' to quit.");
        out.println("Examples: 10 + 20, (10 + 20) * 30, -5 + 3");
        out.println();

        while (true) {
            out.print(settings.getPrompt());
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            if (settings.isExitKeyword(line)) {
                break;
            }
            out.println(processor.executeAndGetResult(line.trim()));
            out.println();
        }
        out.println("Bye!");
    }
}
