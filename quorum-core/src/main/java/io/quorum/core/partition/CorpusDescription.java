package io.quorum.core.partition;

import java.util.List;
import java.util.Objects;

/// Opaque description of the body of work to analyze.
///
/// @param name human-readable corpus name used in the report header, not null
/// @param entries the resources of the corpus, not null (may be empty)
public record CorpusDescription(String name, List<CorpusEntry> entries) {

    public CorpusDescription {
        Objects.requireNonNull(name, "name must not be null");
        entries = List.copyOf(Objects.requireNonNull(entries, "entries must not be null"));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long totalSize() {
        return entries.stream().mapToLong(CorpusEntry::size).sum();
    }
}
