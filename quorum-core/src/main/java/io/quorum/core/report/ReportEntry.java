package io.quorum.core.report;

import io.quorum.core.consensus.ConsensusLevel;
import io.quorum.core.consensus.Severity;
import io.quorum.core.roster.WorkerRole;
import java.util.Map;
import java.util.Set;

/// One accepted finding in the final report, possibly merged across units.
///
/// @param priority the tier
/// @param severity final severity, raised one level when cross-cutting
/// @param reportedSeverity most severe level reported by any unit before raising
/// @param location resource and line of the first occurrence
/// @param description description of the first occurrence
/// @param recommendation first non-empty recommendation
/// @param weightedScore sum of the per-unit weighted scores
/// @param consensusPct lowest per-unit consensus percentage
/// @param level `UNANIMOUS` only if every merged tally was unanimous
/// @param crossCutting whether the finding was raised in two or more units
/// @param provenance per unit id, the roles that raised it, in unit order
public record ReportEntry(
        Priority priority,
        Severity severity,
        Severity reportedSeverity,
        String location,
        String description,
        String recommendation,
        double weightedScore,
        double consensusPct,
        ConsensusLevel level,
        boolean crossCutting,
        Map<String, Set<WorkerRole>> provenance) {}
