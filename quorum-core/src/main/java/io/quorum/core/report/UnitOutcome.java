package io.quorum.core.report;

import io.quorum.core.consensus.UnitTally;
import io.quorum.core.dispatch.Invocation;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.verify.VerificationResult;
import java.util.List;
import java.util.Objects;

/// Everything a finalized WorkUnit contributes to the report.
///
/// Built once, by the task that finalizes the unit.
///
/// @param unit the unit
/// @param invocations its terminal invocations, in roster order
/// @param tally its consensus tally
/// @param verifications results of verifying its mutation claims
public record UnitOutcome(
        WorkUnit unit,
        List<Invocation> invocations,
        UnitTally tally,
        List<VerificationResult> verifications) {

    public UnitOutcome {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(tally, "tally must not be null");
        invocations = List.copyOf(invocations);
        verifications = List.copyOf(verifications);
    }
}
