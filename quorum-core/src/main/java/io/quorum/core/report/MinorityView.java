package io.quorum.core.report;

import io.quorum.core.consensus.VoteTally;

/// A finding that did not reach consensus, kept so dissent is never silent.
///
/// @param tally the unit-level tally
/// @param reason why it was not accepted
public record MinorityView(VoteTally tally, String reason) {}
