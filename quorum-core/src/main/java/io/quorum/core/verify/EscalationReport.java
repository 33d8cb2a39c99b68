package io.quorum.core.verify;

import java.util.List;
import java.util.Objects;

/// Surfaced to the operator when a claim could not be verified within its retry budget.
///
/// @param claim the unverified claim, not null
/// @param attempts number of ground-truth checks made
/// @param evidenceTrail one entry per check, in order
/// @param diagnosis best-effort explanation of why the claim never held
public record EscalationReport(
        MutationClaim claim, int attempts, List<String> evidenceTrail, String diagnosis) {

    public EscalationReport {
        Objects.requireNonNull(claim, "claim must not be null");
        evidenceTrail = List.copyOf(evidenceTrail);
        diagnosis = diagnosis == null ? "" : diagnosis;
    }
}
