package io.quorum.cli.verify;

import io.quorum.core.verify.ExpectedSignal;
import io.quorum.core.verify.GroundTruth;
import io.quorum.core.verify.GroundTruthCheck;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/// Checks `MODIFIED` signals against the working tree of a git repository.
///
/// A target counts as modified when `git status --porcelain` lists it with any
/// status, including untracked (`??`) and deleted entries. Other signal kinds
/// are left to a file system ground truth.
///
/// The corpus root may be any directory inside the repository; porcelain paths are
/// translated from the repository root to the corpus root before matching.
///
/// @see io.quorum.core.verify.CompositeGroundTruth
public class GitStatusGroundTruth implements GroundTruth {

    private static final long GIT_TIMEOUT_SECONDS = 30;

    private final Path root;
    private final StatusQuery statusQuery;

    public GitStatusGroundTruth(Path root) {
        this(root, GitStatusGroundTruth::runGitStatus);
    }

    GitStatusGroundTruth(Path root, StatusQuery statusQuery) {
        this.root = root.toAbsolutePath().normalize();
        this.statusQuery = statusQuery;
    }

    @Override
    public boolean supports(ExpectedSignal.Kind kind) {
        return kind == ExpectedSignal.Kind.MODIFIED;
    }

    @Override
    public GroundTruthCheck check(String targetResource, ExpectedSignal signal) throws IOException {
        if (signal.kind() != ExpectedSignal.Kind.MODIFIED) {
            throw new IllegalArgumentException(
                    "Unsupported signal for git status checks: " + signal.asText());
        }
        Path target = root.resolve(targetResource).normalize();
        if (!target.startsWith(root)) {
            return GroundTruthCheck.unsatisfied(targetResource + " is outside " + root);
        }

        String relative = root.relativize(target).toString().replace('\\', '/');
        List<String> entries = statusQuery.porcelain(root, relative);
        for (String entry : entries) {
            if (entry.length() > 3 && refersTo(entry.substring(3), relative)) {
                return GroundTruthCheck.satisfied(
                        "git status reports '" + entry.substring(0, 2).trim() + "' for " + relative);
            }
        }
        return GroundTruthCheck.unsatisfied("git status shows no change for " + relative);
    }

    /// Porcelain paths are either `path` or `old -> new` for renames.
    private static boolean refersTo(String path, String relative) {
        int arrow = path.indexOf(" -> ");
        String current = arrow >= 0 ? path.substring(arrow + 4) : path;
        current = unquote(current);
        return current.equals(relative) || current.startsWith(relative + "/");
    }

    private static String unquote(String path) {
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

    private static List<String> runGitStatus(Path root, String relative) throws IOException {
        String prefix = runGit(root, "rev-parse", "--show-prefix").strip();
        String output = runGit(root, "status", "--porcelain", "--untracked-files=all", "--", relative);
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\n")) {
            if (line.length() > 3) {
                lines.add(line.substring(0, 3) + toCorpusRelative(line.substring(3), prefix));
            }
        }
        return lines;
    }

    /// Rewrites porcelain paths, which git reports from the repository root, relative to
    /// the corpus directory at `prefix` (as printed by `git rev-parse --show-prefix`).
    static String toCorpusRelative(String paths, String prefix) {
        if (prefix.isEmpty()) {
            return paths;
        }
        int arrow = paths.indexOf(" -> ");
        if (arrow >= 0) {
            return stripPrefix(paths.substring(0, arrow), prefix)
                    + " -> "
                    + stripPrefix(paths.substring(arrow + 4), prefix);
        }
        return stripPrefix(paths, prefix);
    }

    private static String stripPrefix(String path, String prefix) {
        boolean quoted = path.startsWith("\"");
        String bare = quoted ? path.substring(1) : path;
        if (bare.startsWith(prefix)) {
            bare = bare.substring(prefix.length());
        }
        return quoted ? "\"" + bare : bare;
    }

    private static String runGit(Path directory, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        String name = "git " + args[0];

        // Output is read only after waitFor, so the timeout bounds the whole call
        Path output = Files.createTempFile("quorum-git-", ".out");
        Process process = null;
        try {
            process =
                    new ProcessBuilder(command)
                            .directory(directory.toFile())
                            .redirectErrorStream(true)
                            .redirectOutput(output.toFile())
                            .start();
            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new IOException(name + " did not finish within " + GIT_TIMEOUT_SECONDS + "s");
            }
            String text = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException(
                        name + " failed (exit " + process.exitValue() + "): " + text.strip());
            }
            return text;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while waiting for " + name, e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(output);
        }
    }

    /// Lists porcelain status lines for a path under the corpus root, with paths
    /// relative to that root.
    @FunctionalInterface
    interface StatusQuery {
        List<String> porcelain(Path root, String relativePath) throws IOException;
    }
}
