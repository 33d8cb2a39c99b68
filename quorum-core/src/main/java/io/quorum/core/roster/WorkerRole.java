package io.quorum.core.roster;

import java.util.Locale;
import java.util.Optional;

/// The analytic perspectives a WorkUnit is examined from.
///
/// Each role carries a default vote weight and a short focus description that
/// is handed to the worker through the prompt payload. `COMPLEXITY` is only
/// assigned to oversized units.
public enum WorkerRole {
    QUALITY(1.0, false, "code quality, readability, error handling and test gaps"),
    IMPLEMENTATION(1.0, false, "correctness, edge cases, concurrency and resource handling"),
    DESIGN(1.2, false, "architecture, coupling, boundaries and API shape"),
    COMPLEXITY(1.5, true, "size, nesting depth, duplication and candidates for splitting");

    private final double defaultWeight;
    private final boolean oversizedOnly;
    private final String focus;

    WorkerRole(double defaultWeight, boolean oversizedOnly, String focus) {
        this.defaultWeight = defaultWeight;
        this.oversizedOnly = oversizedOnly;
        this.focus = focus;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public boolean isOversizedOnly() {
        return oversizedOnly;
    }

    public String getFocus() {
        return focus;
    }

    /// Lowercase identifier used in prompts, configuration keys and reports.
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<WorkerRole> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (WorkerRole role : values()) {
            if (role.id().equalsIgnoreCase(id.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
