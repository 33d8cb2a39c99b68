package io.quorum.core.consensus;

import java.util.List;
import java.util.Objects;

/// Consensus outcome of one WorkUnit.
///
/// @param workUnitId the unit, not null
/// @param coverage how many rostered roles survived
/// @param rosterSize number of rostered roles
/// @param survivors number of roles that succeeded and voted
/// @param denominatorWeight sum of the vote weights of the surviving roles
/// @param accepted tallies that cleared their threshold, highest score first
/// @param minority tallies that did not, highest score first
public record UnitTally(
        String workUnitId,
        CoverageStatus coverage,
        int rosterSize,
        int survivors,
        double denominatorWeight,
        List<VoteTally> accepted,
        List<VoteTally> minority) {

    public UnitTally {
        Objects.requireNonNull(workUnitId, "workUnitId must not be null");
        Objects.requireNonNull(coverage, "coverage must not be null");
        accepted = List.copyOf(accepted);
        minority = List.copyOf(minority);
    }

    /// A tally for a unit that produced nothing usable.
    public static UnitTally skipped(String workUnitId, int rosterSize) {
        return new UnitTally(workUnitId, CoverageStatus.SKIPPED, rosterSize, 0, 0.0, List.of(), List.of());
    }
}
