package io.quorum.core.roster;

import java.util.Objects;

/// Pairing of a WorkUnit with one role and its vote weight.
///
/// @param workUnitId the unit this role will examine, not null
/// @param role the analytic perspective, not null
/// @param voteWeight positive weight of this role's votes
/// @param appliesOnlyIfOversized whether the role exists only because the unit is oversized
public record WorkerAssignment(
        String workUnitId, WorkerRole role, double voteWeight, boolean appliesOnlyIfOversized) {

    public WorkerAssignment {
        Objects.requireNonNull(workUnitId, "workUnitId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (!(voteWeight > 0)) {
            throw new IllegalArgumentException("voteWeight must be positive: " + voteWeight);
        }
    }
}
