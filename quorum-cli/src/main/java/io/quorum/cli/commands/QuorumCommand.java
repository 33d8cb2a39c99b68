package io.quorum.cli.commands;

import java.util.concurrent.Callable;

/// Minimal abstract base for all Quorum CLI commands.
///
/// Owns the banner display and the {@link #call()} / {@link #execute()} contract.
/// The value returned by {@link #execute()} becomes the process exit code.
///
/// @see CorpusCommand
public abstract class QuorumCommand implements Callable<Integer> {

    /// The run completed and the report is complete.
    static final int EXIT_OK = 0;

    /// Invalid configuration, unreadable input, or an aborted run.
    static final int EXIT_ERROR = 1;

    /// The report was written but carries the `INCOMPLETE_ANALYSIS` warning.
    static final int EXIT_INCOMPLETE = 2;

    private static final String[] BANNER = {
        "",
        "   __ _ _   _  ___  _ __ _   _ _ __ ___",
        "  / _` | | | |/ _ \\| '__| | | | '_ ` _ \\",
        " | (_| | |_| | (_) | |  | |_| | | | | | |",
        "  \\__, |\\__,_|\\___/|_|   \\__,_|_| |_| |_|",
        "     |_|",
        "",
        " Consensus analysis across independent reviewers",
        ""
    };

    @Override
    public final Integer call() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    /// Whether the banner goes to standard output before the command runs.
    protected boolean showBanner() {
        return true;
    }

    protected abstract int execute();
}
