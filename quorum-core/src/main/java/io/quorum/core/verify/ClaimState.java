package io.quorum.core.verify;

import java.util.EnumSet;
import java.util.Set;

/// States of a mutation claim.
///
/// `UNVERIFIED -> VERIFYING -> {VERIFIED | MISMATCHED}`, `MISMATCHED -> VERIFYING`
/// while retries remain, `MISMATCHED -> ESCALATED` once they are exhausted.
public enum ClaimState {
    UNVERIFIED,
    VERIFYING,
    VERIFIED,
    MISMATCHED,
    ESCALATED;

    public boolean isTerminal() {
        return this == VERIFIED || this == ESCALATED;
    }

    public boolean canTransitionTo(ClaimState next) {
        return successors().contains(next);
    }

    private Set<ClaimState> successors() {
        return switch (this) {
            case UNVERIFIED -> EnumSet.of(VERIFYING);
            case VERIFYING -> EnumSet.of(VERIFIED, MISMATCHED);
            case MISMATCHED -> EnumSet.of(VERIFYING, ESCALATED);
            case VERIFIED, ESCALATED -> EnumSet.noneOf(ClaimState.class);
        };
    }
}
