package io.quorum.core.verify;

import java.util.List;
import java.util.Objects;

/// Final outcome of verifying one claim.
///
/// @param claim the claim, not null
/// @param verified whether ground truth eventually confirmed it
/// @param state terminal state, `VERIFIED` or `ESCALATED`
/// @param attempts number of ground-truth checks made
/// @param evidence one entry per check, in order
/// @param escalation the escalation report, null when verified
public record VerificationResult(
        MutationClaim claim,
        boolean verified,
        ClaimState state,
        int attempts,
        List<String> evidence,
        EscalationReport escalation) {

    public VerificationResult {
        Objects.requireNonNull(claim, "claim must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("verification must end in a terminal state: " + state);
        }
        evidence = List.copyOf(evidence);
    }

    public boolean isEscalated() {
        return escalation != null;
    }
}
