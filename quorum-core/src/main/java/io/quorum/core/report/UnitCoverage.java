package io.quorum.core.report;

import io.quorum.core.consensus.CoverageStatus;
import io.quorum.core.dispatch.InvocationStatus;
import io.quorum.core.roster.WorkerRole;
import java.util.Map;

/// Per-unit coverage line of the report.
///
/// @param workUnitId the unit
/// @param label the unit's label
/// @param status coverage status
/// @param rosterSize roles rostered
/// @param survivors roles that voted
/// @param roleStatuses terminal status of each rostered role
/// @param meanHealthScore mean of the reported health scores, null if none reported
public record UnitCoverage(
        String workUnitId,
        String label,
        CoverageStatus status,
        int rosterSize,
        int survivors,
        Map<WorkerRole, InvocationStatus> roleStatuses,
        Double meanHealthScore) {}
