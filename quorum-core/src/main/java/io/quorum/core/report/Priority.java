package io.quorum.core.report;

import io.quorum.core.consensus.ConsensusLevel;
import io.quorum.core.consensus.Severity;

/// Report tiers, from fix-now to nice-to-have.
public enum Priority {
    P1("Critical, unanimous"),
    P2("Critical by majority, or High and unanimous"),
    P3("High by majority"),
    P4("Medium"),
    P5("Low and informational");

    private final String description;

    Priority(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /// Maps an accepted finding to its tier.
    ///
    /// @param severity the finding's final severity, not null
    /// @param level `UNANIMOUS` or `MAJORITY`
    /// @throws IllegalArgumentException for `MINORITY`, which has no tier
    public static Priority of(Severity severity, ConsensusLevel level) {
        if (level == ConsensusLevel.MINORITY) {
            throw new IllegalArgumentException("minority findings are not prioritized");
        }
        boolean unanimous = level == ConsensusLevel.UNANIMOUS;
        return switch (severity) {
            case CRITICAL -> unanimous ? P1 : P2;
            case HIGH -> unanimous ? P2 : P3;
            case MEDIUM -> P4;
            case LOW, INFO -> P5;
        };
    }
}
