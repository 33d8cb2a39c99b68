package io.quorum.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Quorum CLI application.
///
/// Registers the subcommands:
/// - `analyze` - run a full multi-role analysis of a directory and write the report
/// - `plan` - show how a directory would be partitioned and rostered, without dispatching
///
/// @see AnalyzeCommand
/// @see PlanCommand
@TopCommand
@Command(
        name = "quorum",
        mixinStandardHelpOptions = true,
        description = "Multi-role consensus analysis of source trees",
        subcommands = {AnalyzeCommand.class, PlanCommand.class})
public class QuorumCLI {}
