package io.quorum.core.partition;

import java.util.List;
import java.util.Objects;

/// A bounded slice of the corpus analyzed as one unit.
///
/// Units are identified by `id` and never change after partitioning.
///
/// @param id unique identifier within the run (`U1`, `U2`, ...), not null
/// @param label human-readable name, usually the directory, not null
/// @param resourcePatterns glob patterns of the resources in scope, not empty
/// @param estimatedSize positive size estimate
/// @param oversized whether the unit is large enough to warrant the complexity role
public record WorkUnit(
        String id,
        String label,
        List<String> resourcePatterns,
        long estimatedSize,
        boolean oversized) {

    public WorkUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        resourcePatterns = List.copyOf(resourcePatterns);
        if (resourcePatterns.isEmpty()) {
            throw new IllegalArgumentException("WorkUnit " + id + " has no resource patterns");
        }
        if (estimatedSize <= 0) {
            throw new IllegalArgumentException(
                    "WorkUnit " + id + " must have a positive size, was " + estimatedSize);
        }
    }
}
