package io.quorum.cli.commands;

import io.quorum.cli.corpus.FileSystemCorpusScanner;
import io.quorum.core.QuorumConfig;
import io.quorum.core.consensus.Severity;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.partition.CorpusDescription;
import io.quorum.core.roster.WorkerRole;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for commands that operate on a corpus directory.
///
/// Resolves the directory, scans it into a corpus, and layers the command-line
/// overrides on top of the injected {@link QuorumConfig}.
///
/// ### Corpus Directory Resolution
/// 1. CLI positional parameter
/// 2. Config property `quorum.corpus.dir`
/// 3. Current directory (`.`)
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see AnalyzeCommand
/// @see PlanCommand
public abstract class CorpusCommand extends QuorumCommand {

    @Parameters(index = "0", description = "Directory to analyze", arity = "0..1")
    protected Path corpusDir;

    @Option(
            names = {"--include"},
            description = "Glob of files to include, repeatable (e.g. '*.py', 'src/**')",
            split = ",")
    protected List<String> includes = new ArrayList<>();

    @Option(
            names = {"--exclude"},
            description = "Glob of files to exclude, repeatable",
            split = ",")
    protected List<String> excludes = new ArrayList<>();

    @Option(names = {"--concurrency"}, description = "Maximum simultaneous worker invocations")
    protected Integer concurrency;

    @Option(names = {"--timeout"}, description = "Per-invocation timeout in seconds")
    protected Long timeoutSeconds;

    @Option(names = {"--retries"}, description = "Retries after a transient failure or timeout")
    protected Integer retries;

    @Option(
            names = {"--retry-budget"},
            description = "Re-applications allowed before a mutation claim is escalated")
    protected Integer verificationRetryBudget;

    @Option(
            names = {"--min-coverage"},
            description = "Share of units that must reach two surviving roles (0..1)")
    protected Double minCoverage;

    @Option(names = {"--depth"}, description = "Directory depth used to split the corpus")
    protected Integer partitionDepth;

    @Option(
            names = {"--oversized-factor"},
            description = "Units larger than this multiple of the median get the complexity role")
    protected Double oversizedFactor;

    @Option(
            names = {"--threshold"},
            description = "Consensus threshold per severity, e.g. --threshold high=0.7")
    protected Map<String, Double> thresholds = new LinkedHashMap<>();

    @Option(
            names = {"--weight"},
            description = "Vote weight per role, e.g. --weight design=1.5")
    protected Map<String, Double> weights = new LinkedHashMap<>();

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    protected boolean color = true;

    @Inject
    @ConfigProperty(name = "quorum.corpus.dir", defaultValue = ".")
    String defaultCorpusDir;

    @Inject QuorumConfig quorumConfig;

    /// Returns the absolute corpus directory.
    ///
    /// Resolution priority: CLI parameter > config property `quorum.corpus.dir` >
    /// current directory.
    protected Path resolveCorpusDir() {
        Path effective;
        if (corpusDir != null) {
            effective = corpusDir;
        } else if (defaultCorpusDir != null && !defaultCorpusDir.isBlank()) {
            effective = Path.of(defaultCorpusDir);
        } else {
            effective = Path.of(".");
        }
        return effective.toAbsolutePath().normalize();
    }

    /// Scans the corpus directory with the include and exclude globs.
    protected CorpusDescription scanCorpus() throws IOException {
        return new FileSystemCorpusScanner(includes, excludes).scan(resolveCorpusDir());
    }

    /// Applies the command-line overrides to the injected configuration and validates it.
    ///
    /// @return the validated configuration, never null
    /// @throws ConfigurationException if an override names an unknown severity or role,
    /// or the resulting configuration is invalid
    protected QuorumConfig effectiveConfig() throws ConfigurationException {
        QuorumConfig config = quorumConfig != null ? quorumConfig : new QuorumConfig();
        if (concurrency != null) {
            config.setConcurrencyLimit(concurrency);
        }
        if (timeoutSeconds != null) {
            config.setInvocationTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (retries != null) {
            config.setInvocationRetries(retries);
        }
        if (verificationRetryBudget != null) {
            config.setVerificationRetryBudget(verificationRetryBudget);
        }
        if (minCoverage != null) {
            config.setMinCoveragePct(minCoverage);
        }
        if (partitionDepth != null) {
            config.setPartitionDepth(partitionDepth);
        }
        if (oversizedFactor != null) {
            config.setOversizedFactor(oversizedFactor);
        }
        for (Map.Entry<String, Double> entry : thresholds.entrySet()) {
            Severity severity =
                    Severity.parse(entry.getKey())
                            .filter(s -> s.label().equalsIgnoreCase(entry.getKey().trim()))
                            .orElseThrow(() -> new ConfigurationException(
                                    "Unknown severity '" + entry.getKey() + "' in --threshold"));
            config.setThreshold(severity, entry.getValue());
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            WorkerRole role =
                    WorkerRole.fromId(entry.getKey())
                            .orElseThrow(() -> new ConfigurationException(
                                    "Unknown role '" + entry.getKey() + "' in --weight"));
            config.setRoleWeight(role, entry.getValue());
        }
        config.validate();
        return config;
    }
}
