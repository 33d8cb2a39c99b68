package io.quorum.core.consensus;

import java.util.Objects;

/// The weighted vote on one distinct finding within one WorkUnit.
///
/// @param finding the clustered finding, with every role that raised it
/// @param weightedScore sum of the vote weights of the roles that raised it
/// @param consensusPct `weightedScore` over the weight of all surviving roles, in `[0, 1]`
/// @param accepted whether the finding cleared its severity threshold
/// @param level support level derived from acceptance and percentage
public record VoteTally(
        Finding finding,
        double weightedScore,
        double consensusPct,
        boolean accepted,
        ConsensusLevel level) {

    static final double EPSILON = 1e-9;

    public VoteTally {
        Objects.requireNonNull(finding, "finding must not be null");
        Objects.requireNonNull(level, "level must not be null");
    }

    /// Derives the level from the vote outcome.
    public static VoteTally of(Finding finding, double weightedScore, double consensusPct, boolean accepted) {
        ConsensusLevel level;
        if (!accepted) {
            level = ConsensusLevel.MINORITY;
        } else if (consensusPct >= 1.0 - EPSILON) {
            level = ConsensusLevel.UNANIMOUS;
        } else {
            level = ConsensusLevel.MAJORITY;
        }
        return new VoteTally(finding, weightedScore, consensusPct, accepted, level);
    }
}
