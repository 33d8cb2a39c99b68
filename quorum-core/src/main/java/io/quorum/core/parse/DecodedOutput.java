package io.quorum.core.parse;

import java.util.List;

/// What one decoding stage extracted from a worker's raw output.
///
/// @param findings well-formed findings only, never null
/// @param healthScore the worker's 0-10 health score, null if absent
/// @param mutations claimed mutations, never null
/// @param affirmsNoFindings `true` if the output explicitly reports zero findings,
///        as opposed to the stage merely failing to find any
public record DecodedOutput(
        List<ReportedFinding> findings,
        Double healthScore,
        List<ReportedMutation> mutations,
        boolean affirmsNoFindings) {

    public DecodedOutput {
        findings = List.copyOf(findings);
        mutations = List.copyOf(mutations);
    }

    /// Returns `true` if the cascade may stop at this stage.
    public boolean isUsable() {
        return !findings.isEmpty() || affirmsNoFindings;
    }
}
