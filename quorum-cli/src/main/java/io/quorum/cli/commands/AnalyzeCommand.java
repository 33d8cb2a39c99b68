package io.quorum.cli.commands;

import io.quorum.cli.execution.VerboseRunListener;
import io.quorum.cli.report.ReportRenderer;
import io.quorum.cli.ui.AnsiStyles;
import io.quorum.cli.verify.GitStatusGroundTruth;
import io.quorum.cli.worker.CommandWorker;
import io.quorum.core.QuorumConfig;
import io.quorum.core.QuorumEnvironment;
import io.quorum.core.QuorumFactory;
import io.quorum.core.dispatch.CancellationSignal;
import io.quorum.core.exception.AnalysisAbortedException;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.execution.RunListener;
import io.quorum.core.partition.CorpusDescription;
import io.quorum.core.report.FinalReport;
import io.quorum.core.report.Priority;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.CompositeGroundTruth;
import io.quorum.core.verify.FileSystemGroundTruth;
import io.quorum.core.worker.stub.StubWorker;
import io.quorum.serialization.decode.JacksonStrictDecoder;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command that runs a full analysis and writes the final report.
///
/// ### Usage
/// ```bash
/// quorum analyze [--workers-command <cmd> | --stubs <dir>] [--worker <role>=<cmd>]...
///                [--format markdown|json] [-o <file>] [-v] [--no-color] [<dir>]
/// ```
///
/// ### Workers
/// - `--workers-command` runs one shell command for every role (see {@link CommandWorker})
/// - `--worker role=cmd` runs a dedicated command for one role
/// - `--stubs` replays canned responses from a directory (see {@link StubWorker})
///
/// Config property `quorum.workers.command` supplies the default command.
///
/// ### Exit Codes
/// - `0` - complete report
/// - `1` - configuration error, unreadable corpus, or aborted run
/// - `2` - report written with the `INCOMPLETE_ANALYSIS` warning
@Command(name = "analyze", description = "Analyze a directory with independent reviewers")
class AnalyzeCommand extends CorpusCommand {

    private static final Logger logger = Logger.getLogger(AnalyzeCommand.class.getName());

    /// How long an interrupted run may take to write its partial report before the JVM halts.
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    @Option(
            names = {"--workers-command"},
            description = "Shell command serving every role; prompt on stdin, report on stdout")
    private String workersCommand;

    @Option(
            names = {"--worker"},
            description = "Dedicated command for one role, e.g. --worker design='./review.sh'")
    private Map<String, String> roleCommands = new LinkedHashMap<>();

    @Option(
            names = {"--stubs"},
            description = "Directory of canned worker responses ({unit}/{role}.txt or {role}.txt)")
    private Path stubsDir;

    @Option(
            names = {"-f", "--format"},
            description = "Report format: markdown or json",
            defaultValue = "markdown")
    private String format = "markdown";

    @Option(
            names = {"-o", "--output"},
            description = "Write the report to a file instead of standard output")
    private Path outputFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show per-invocation progress")
    private boolean verbose = false;

    @Inject
    @ConfigProperty(name = "quorum.workers.command")
    Optional<String> defaultWorkersCommand;

    @Inject ReportRenderer renderer;

    @Override
    protected boolean showBanner() {
        // Keep machine-readable output on stdout clean
        return outputFile != null || !"json".equals(format);
    }

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);
        Path root = resolveCorpusDir();

        if (!renderer.getAvailableFormats().contains(format)) {
            System.err.printf(
                    "%s Unsupported format '%s'. Available: %s%n",
                    styles.crossmark(), format, String.join(", ", renderer.getAvailableFormats()));
            return EXIT_ERROR;
        }

        QuorumConfig config;
        CorpusDescription corpus;
        try {
            config = effectiveConfig();
            corpus = scanCorpus();
        } catch (ConfigurationException e) {
            System.err.println(styles.crossmark() + " Invalid configuration: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println(styles.crossmark() + " Cannot read corpus: " + e.getMessage());
            return EXIT_ERROR;
        }

        QuorumFactory.Builder builder;
        try {
            builder = configureWorkers(QuorumFactory.builder(), root);
        } catch (ConfigurationException e) {
            System.err.println(styles.crossmark() + " " + e.getMessage());
            return EXIT_ERROR;
        }

        if (showBanner()) {
            System.out.printf(
                    "%s Analyzing %s (%d files)%n",
                    styles.arrow(), styles.bold(root.toString()), corpus.entries().size());
        }

        CancellationSignal signal = new CancellationSignal();
        CountDownLatch reportWritten = new CountDownLatch(1);
        Thread cancelOnExit = cancellationHook(signal, reportWritten, SHUTDOWN_GRACE);
        Runtime.getRuntime().addShutdownHook(cancelOnExit);

        try (QuorumEnvironment environment =
                builder.config(config)
                        .strictDecoder(new JacksonStrictDecoder())
                        .groundTruth(
                                new CompositeGroundTruth(
                                        List.of(
                                                new FileSystemGroundTruth(root),
                                                new GitStatusGroundTruth(root))))
                        .build()) {
            RunListener listener =
                    verbose ? new VerboseRunListener(System.out, color) : RunListener.NOOP;
            FinalReport report = environment.getCoordinator().run(corpus, listener, signal);
            writeReport(report);
            printSummary(report, styles);
            return report.isIncomplete() ? EXIT_INCOMPLETE : EXIT_OK;
        } catch (AnalysisAbortedException e) {
            System.err.println(styles.crossmark() + " Analysis aborted: " + e.getMessage());
            writeQuietly(e.getPartialReport(), styles);
            return EXIT_ERROR;
        } catch (ConfigurationException e) {
            System.err.println(styles.crossmark() + " Invalid configuration: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println(styles.crossmark() + " Cannot write report: " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            reportWritten.countDown();
            removeHook(cancelOnExit);
        }
    }

    /// Builds the shutdown hook for an interrupted run.
    ///
    /// The hook cancels the run, then holds the JVM open until the report (complete or
    /// partial) has been written or `grace` has passed.
    static Thread cancellationHook(CancellationSignal signal, CountDownLatch reportWritten, Duration grace) {
        return new Thread(
                () -> {
                    signal.cancel();
                    try {
                        if (!reportWritten.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                            logger.warning("Partial report not written within " + grace.toSeconds() + "s");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                },
                "quorum-cancel");
    }

    /// Registers the workers selected on the command line.
    ///
    /// @throws ConfigurationException if no worker source is given, both a command and
    /// stubs are given, or a `--worker` key is not a role
    QuorumFactory.Builder configureWorkers(QuorumFactory.Builder builder, Path root)
            throws ConfigurationException {
        String command = workersCommand;
        if (command == null && defaultWorkersCommand != null) {
            command = defaultWorkersCommand.filter(c -> !c.isBlank()).orElse(null);
        }
        if (command != null && stubsDir != null) {
            throw new ConfigurationException("--stubs cannot be combined with a workers command");
        }

        if (stubsDir != null) {
            builder.defaultWorker(new StubWorker(stubsDir));
        } else if (command != null) {
            builder.defaultWorker(new CommandWorker(command, root));
        } else if (roleCommands.isEmpty()) {
            throw new ConfigurationException(
                    "No workers configured. Pass --workers-command, --worker or --stubs,"
                            + " or set quorum.workers.command");
        }

        for (Map.Entry<String, String> entry : roleCommands.entrySet()) {
            WorkerRole role =
                    WorkerRole.fromId(entry.getKey())
                            .orElseThrow(() -> new ConfigurationException(
                                    "Unknown role '" + entry.getKey() + "' in --worker"));
            builder.worker(role, new CommandWorker(entry.getValue(), root));
        }
        return builder;
    }

    private void writeReport(FinalReport report) throws IOException {
        String rendered = renderer.render(report, format);
        if (outputFile == null) {
            System.out.print(rendered);
            return;
        }
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, rendered, StandardCharsets.UTF_8);
    }

    private void writeQuietly(FinalReport partial, AnsiStyles styles) {
        if (partial == null) {
            return;
        }
        try {
            writeReport(partial);
        } catch (IOException e) {
            System.err.println(styles.crossmark() + " Cannot write partial report: " + e.getMessage());
        }
    }

    private void printSummary(FinalReport report, AnsiStyles styles) {
        // Summary lines go to stderr when stdout carries the JSON document
        PrintStream out = showBanner() ? System.out : System.err;
        out.println();
        if (report.isIncomplete()) {
            out.println(styles.warnmark() + " " + styles.warn(report.warning()));
        } else {
            out.printf(
                    "%s Analysis complete, coverage %s%n",
                    styles.checkmark(),
                    styles.success(String.format("%.1f%%", report.coveragePct() * 100.0)));
        }
        for (Priority priority : Priority.values()) {
            out.printf("  %s %s: %d%n", styles.bullet(), priority.name(), report.tier(priority).size());
        }
        out.printf(
                "  %s minority views: %d, escalations: %d%n",
                styles.bullet(), report.minorityViews().size(), report.escalations().size());
        if (outputFile != null) {
            out.printf("  %s report written to %s%n", styles.arrow(), outputFile);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.fine("JVM is shutting down, cancellation hook stays registered");
        }
    }
}
