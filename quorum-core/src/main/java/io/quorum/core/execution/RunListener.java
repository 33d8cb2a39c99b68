package io.quorum.core.execution;

import io.quorum.core.dispatch.Invocation;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.report.FinalReport;
import io.quorum.core.report.UnitOutcome;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.VerificationResult;
import java.util.List;

/// Listener for run lifecycle events.
///
/// All methods have no-op defaults, so listeners override only what they need.
///
/// ### Callback order
/// ```
/// onPartitioned(units)
/// onInvocationStart(unit, role, attempt)    per attempt, concurrently
/// onInvocationComplete(invocation)          once per (unit, role)
/// onClaimVerified(result)                   per mutation claim of the unit
/// onUnitFinalized(outcome)                  once per unit
/// onReportBuilt(report)
/// ```
///
/// @implNote Must be thread-safe. Invocation and unit callbacks arrive from pool threads.
public interface RunListener {

    RunListener NOOP = new RunListener() {};

    default void onPartitioned(List<WorkUnit> units) {}

    default void onInvocationStart(WorkUnit unit, WorkerRole role, int attempt) {}

    default void onInvocationComplete(Invocation invocation) {}

    /// Called once per claim, whether it ended verified or escalated.
    default void onClaimVerified(VerificationResult result) {}

    default void onUnitFinalized(UnitOutcome outcome) {}

    default void onReportBuilt(FinalReport report) {}
}
