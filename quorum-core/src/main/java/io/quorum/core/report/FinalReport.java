package io.quorum.core.report;

import io.quorum.core.verify.EscalationReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// The single result of a run.
///
/// @param corpusName name of the analyzed corpus
/// @param statistics timing and counters
/// @param coveragePct share of units with at least two surviving roles
/// @param warning `INCOMPLETE_ANALYSIS` banner, null when coverage is sufficient
/// @param findings accepted findings per tier, every tier present, best first
/// @param minorityViews findings that did not reach consensus
/// @param escalations claims that could not be verified
/// @param coverage per-unit coverage, in unit order
public record FinalReport(
        String corpusName,
        RunStatistics statistics,
        double coveragePct,
        String warning,
        Map<Priority, List<ReportEntry>> findings,
        List<MinorityView> minorityViews,
        List<EscalationReport> escalations,
        List<UnitCoverage> coverage) {

    public static final String INCOMPLETE_ANALYSIS = "INCOMPLETE_ANALYSIS";

    public boolean isIncomplete() {
        return warning != null;
    }

    /// All accepted findings, P1 first.
    public List<ReportEntry> allFindings() {
        List<ReportEntry> all = new ArrayList<>();
        for (Priority priority : Priority.values()) {
            all.addAll(findings.getOrDefault(priority, List.of()));
        }
        return all;
    }

    public List<ReportEntry> tier(Priority priority) {
        return findings.getOrDefault(priority, List.of());
    }
}
