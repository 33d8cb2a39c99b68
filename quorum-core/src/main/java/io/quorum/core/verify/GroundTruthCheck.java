package io.quorum.core.verify;

/// Outcome of one ground-truth read.
///
/// @param satisfied whether the expected signal was observed
/// @param evidence what was actually observed, for the evidence trail
public record GroundTruthCheck(boolean satisfied, String evidence) {

    public static GroundTruthCheck satisfied(String evidence) {
        return new GroundTruthCheck(true, evidence);
    }

    public static GroundTruthCheck unsatisfied(String evidence) {
        return new GroundTruthCheck(false, evidence);
    }
}
