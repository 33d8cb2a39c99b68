package io.quorum.core.consensus;

/// How broadly a finding is supported.
///
/// `UNANIMOUS` and `MAJORITY` findings are accepted. `MINORITY` findings cleared no
/// threshold, or come from a unit with too few surviving roles to outvote anyone.
public enum ConsensusLevel {
    UNANIMOUS,
    MAJORITY,
    MINORITY
}
