package io.quorum.cli.ui;

import io.quorum.core.consensus.CoverageStatus;
import io.quorum.core.consensus.Severity;

/// ANSI text styling for terminal output.
///
/// Every method returns the styled string; printing is the caller's job. With color
/// disabled the text is returned untouched, which is also what the report formats
/// rely on when writing to a file.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// out.println(styles.checkmark() + " " + styles.severity(Severity.HIGH, "HIGH"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String ORANGE = "\033[38;5;208m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final String RULE = "─".repeat(61);

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    public String gray(String text) {
        return style(text, GRAY);
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors text by finding severity, from red for critical to gray for info.
    public String severity(Severity severity, String text) {
        String code =
                switch (severity) {
                    case CRITICAL -> RED;
                    case HIGH -> ORANGE;
                    case MEDIUM -> YELLOW;
                    case LOW -> BLUE;
                    case INFO -> GRAY;
                };
        return style(text, code);
    }

    /// Colors text by unit coverage: green when covered, yellow when degraded, red when skipped.
    public String coverage(CoverageStatus status, String text) {
        String code =
                switch (status) {
                    case FULL, PARTIAL -> GREEN;
                    case DEGRADED -> YELLOW;
                    case SKIPPED -> RED;
                };
        return style(text, code);
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    /// Warning sign for escalations and incomplete reports.
    public String warnmark() {
        return style("!", YELLOW);
    }

    // --- Separators ---

    public String separatorTop() {
        return style("┌" + RULE, DIM);
    }

    public String separatorMid() {
        return style(" " + RULE, DIM);
    }

    public String separatorBottom() {
        return style("└" + RULE, DIM);
    }
}
