package io.quorum.cli.commands;

import io.quorum.cli.ui.AnsiStyles;
import io.quorum.core.QuorumConfig;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.partition.CorpusDescription;
import io.quorum.core.partition.DirectoryPartitioner;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRoster;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;

/// CLI command that shows how a directory would be analyzed, without dispatching anything.
///
/// Prints every WorkUnit with its scope, size and roster, followed by the number of
/// invocations a real run would make. Accepts the same partitioning and weight
/// options as `analyze`.
///
/// ### Usage
/// ```bash
/// quorum plan [--depth <n>] [--oversized-factor <x>] [--weight role=w]... [<dir>]
/// ```
@Command(name = "plan", description = "Show the partition and roster for a directory")
class PlanCommand extends CorpusCommand {

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        QuorumConfig config;
        CorpusDescription corpus;
        List<WorkUnit> units;
        WorkerRoster roster;
        try {
            config = effectiveConfig();
            corpus = scanCorpus();
            units =
                    new DirectoryPartitioner(config.getPartitionDepth(), config.getOversizedFactor())
                            .partition(corpus);
            roster = WorkerRoster.create(config.getRoleWeights());
        } catch (ConfigurationException e) {
            System.err.println(styles.crossmark() + " " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println(styles.crossmark() + " Cannot read corpus: " + e.getMessage());
            return EXIT_ERROR;
        }

        System.out.printf(
                "%s Plan for %s: %d files, %d lines%n",
                styles.arrow(),
                styles.bold(corpus.name()),
                corpus.entries().size(),
                corpus.totalSize());
        System.out.println(styles.separatorTop());

        int invocations = 0;
        for (WorkUnit unit : units) {
            List<WorkerAssignment> assignments = roster.rosterFor(unit);
            invocations += assignments.size();
            System.out.printf(
                    "  %s %-4s %s %s%n",
                    styles.bullet(),
                    styles.bold(unit.id()),
                    unit.label(),
                    styles.gray("(" + unit.estimatedSize() + " lines)"));
            if (unit.oversized()) {
                System.out.println("         " + styles.warn("oversized, complexity role added"));
            }
            System.out.println("         roles: " + describe(assignments));
        }

        System.out.println(styles.separatorBottom());
        System.out.printf(
                "%s %d units, %d invocations, consensus needs %.0f%% coverage%n",
                styles.checkmark(), units.size(), invocations, config.getMinCoveragePct() * 100.0);
        return EXIT_OK;
    }

    private static String describe(List<WorkerAssignment> assignments) {
        return assignments.stream()
                .map(a -> a.role().id() + String.format(Locale.ROOT, " (%.1f)", a.voteWeight()))
                .collect(Collectors.joining(", "));
    }
}
