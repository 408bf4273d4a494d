package org.csu.calculator.cli.client;

import lombok.Builder;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 交互式 shell 的配置。默认值写在这里，{@link #fromArgs(String[])} 用命令行参数覆盖。
 */
@Getter
@Builder(toBuilder = true)
public class ShellSettings {

    @Builder.Default
    private final String prompt = "calc> ";

    @Builder.Default
    private final List<String> exitKeywords = List.of("exit", "quit");

    @Builder.Default
    private final boolean showCanonical = true;

    @Builder.Default
    private final boolean showTree = true;

    public static ShellSettings defaults() {
        return ShellSettings.builder().build();
    }

    /**
     * Supported options: {@code --prompt=<text>}, {@code --exit=<kw1,kw2>}, {@code --no-tree}, {@code --no-canonical}.
     * @throws IllegalArgumentException on an unknown option or an empty keyword list
     */
    public static ShellSettings fromArgs(String[] args) {
        ShellSettingsBuilder builder = ShellSettings.builder();
        for (String arg : args) {
            if (arg.startsWith("--prompt=")) {
                builder.prompt(arg.substring("--prompt=".length()));
            } else if (arg.startsWith("--exit=")) {
                List<String> keywords = Arrays.stream(arg.substring("--exit=".length()).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList());
                if (keywords.isEmpty()) {
                    throw new IllegalArgumentException("--exit needs at least one keyword");
                }
                builder.exitKeywords(keywords);
            } else if (arg.equals("--no-tree")) {
                builder.showTree(false);
            } else if (arg.equals("--no-canonical")) {
                builder.showCanonical(false);
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return builder.build();
    }

    public boolean isExitKeyword(String line) {
        String normalized = line.trim().toLowerCase(Locale.ROOT);
        return exitKeywords.stream().anyMatch(k -> k.toLowerCase(Locale.ROOT).equals(normalized));
    }
}
