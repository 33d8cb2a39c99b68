package io.quorum.core.consensus;

/// How many rostered roles of a unit survived.
public enum CoverageStatus {
    /// Every rostered role succeeded.
    FULL,
    /// At least two roles succeeded, but not all.
    PARTIAL,
    /// Exactly one role succeeded; its findings are reported as minority views.
    DEGRADED,
    /// No role succeeded.
    SKIPPED;

    /// Whether the unit counts towards report coverage.
    public boolean isCovered() {
        return this == FULL || this == PARTIAL;
    }

    public static CoverageStatus of(int survivors, int rosterSize) {
        if (survivors <= 0) {
            return SKIPPED;
        }
        if (survivors == 1) {
            return DEGRADED;
        }
        return survivors >= rosterSize ? FULL : PARTIAL;
    }
}
