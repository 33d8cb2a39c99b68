package io.quorum.cli.corpus;

import io.quorum.core.partition.CorpusDescription;
import io.quorum.core.partition.CorpusEntry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/// Builds a {@link CorpusDescription} from a directory tree.
///
/// Each regular text file becomes one entry sized by its line count. Hidden
/// directories and well-known build output directories are never entered, and
/// files that look binary (a NUL byte near the start) are skipped.
///
/// ### Glob matching
/// A pattern containing `/` is matched against the corpus-relative path
/// (`src/**/*.java`); a pattern without one is matched against the file name
/// (`*.py`). With no include patterns every file is included. Excludes win
/// over includes.
public class FileSystemCorpusScanner {

    private static final Logger logger = Logger.getLogger(FileSystemCorpusScanner.class.getName());

    static final Set<String> SKIPPED_DIRECTORIES =
            Set.of("node_modules", "target", "build", "dist", "__pycache__", "venv");

    private static final int BINARY_PROBE_BYTES = 8192;

    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;
    private final List<Boolean> includeOnPath;
    private final List<Boolean> excludeOnPath;

    public FileSystemCorpusScanner() {
        this(List.of(), List.of());
    }

    /// @param includes glob patterns a file must match, empty for all files
    /// @param excludes glob patterns that remove a file
    public FileSystemCorpusScanner(List<String> includes, List<String> excludes) {
        this.includes = compile(includes);
        this.excludes = compile(excludes);
        this.includeOnPath = includes.stream().map(p -> p.contains("/")).toList();
        this.excludeOnPath = excludes.stream().map(p -> p.contains("/")).toList();
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        return matchers;
    }

    /// Scans a directory.
    ///
    /// @param root the corpus root, must be a directory
    /// @return the corpus named after the root directory, entries sorted by path
    /// @throws IOException if the root is not a readable directory or a file cannot be read
    public CorpusDescription scan(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new IOException("Not a directory: " + root);
        }

        List<CorpusEntry> entries = new ArrayList<>();
        Files.walkFileTree(
                base,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        if (dir.equals(base)) {
                            return FileVisitResult.CONTINUE;
                        }
                        String name = dir.getFileName().toString();
                        if (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        if (!attrs.isRegularFile()) {
                            return FileVisitResult.CONTINUE;
                        }
                        Path relative = base.relativize(file);
                        if (accepts(relative)) {
                            long lines = countLines(file);
                            if (lines >= 0) {
                                entries.add(new CorpusEntry(toCorpusPath(relative), lines));
                            } else {
                                logger.fine("Skipping binary file " + relative);
                            }
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });

        entries.sort(Comparator.comparing(CorpusEntry::path));
        Path fileName = base.getFileName();
        String name = fileName != null ? fileName.toString() : base.toString();
        logger.info("Scanned " + entries.size() + " files under " + base);
        return new CorpusDescription(name, entries);
    }

    boolean accepts(Path relative) {
        if (!includes.isEmpty() && !matchesAny(relative, includes, includeOnPath)) {
            return false;
        }
        return !matchesAny(relative, excludes, excludeOnPath);
    }

    private static boolean matchesAny(Path relative, List<PathMatcher> matchers, List<Boolean> onPath) {
        for (int i = 0; i < matchers.size(); i++) {
            Path subject = onPath.get(i) ? relative : relative.getFileName();
            if (matchers.get(i).matches(subject)) {
                return true;
            }
        }
        return false;
    }

    private static String toCorpusPath(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    /// Counts lines, including a last line without a trailing newline.
    ///
    /// @return the line count, or `-1` if the file looks binary
    static long countLines(Path file) throws IOException {
        long lines = 0;
        long read = 0;
        boolean pendingLine = false;
        byte[] buffer = new byte[BINARY_PROBE_BYTES];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buffer)) > 0) {
                for (int i = 0; i < n; i++) {
                    byte b = buffer[i];
                    if (b == 0 && read + i < BINARY_PROBE_BYTES) {
                        return -1;
                    }
                    if (b == '\n') {
                        lines++;
                        pendingLine = false;
                    } else {
                        pendingLine = true;
                    }
                }
                read += n;
            }
        }
        return pendingLine ? lines + 1 : lines;
    }
}
