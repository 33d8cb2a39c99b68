package io.quorum.core.partition;

import java.util.Objects;

/// A single resource of the corpus with its size estimate.
///
/// @param path corpus-relative path using `/` separators, not null
/// @param size estimated size (line count for text files), not negative
public record CorpusEntry(String path, long size) {

    public CorpusEntry {
        Objects.requireNonNull(path, "path must not be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + path);
        }
        path = path.replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
    }

    /// Returns the directory portion of the path, or an empty string for root-level files.
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
