package io.quorum.cli.report;

import io.quorum.core.consensus.ConsensusLevel;
import io.quorum.core.consensus.Severity;
import io.quorum.core.consensus.VoteTally;
import io.quorum.core.dispatch.InvocationStatus;
import io.quorum.core.report.FinalReport;
import io.quorum.core.report.MinorityView;
import io.quorum.core.report.Priority;
import io.quorum.core.report.ReportEntry;
import io.quorum.core.report.RunStatistics;
import io.quorum.core.report.UnitCoverage;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.EscalationReport;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/// Renders the report as a Markdown document.
///
/// ### Layout
/// ```
/// # Analysis Report: <corpus>
/// > INCOMPLETE_ANALYSIS banner, when coverage fell short
/// ## Summary           run statistics
/// ## Findings          one section per tier, P1 first, every tier present
/// ## Minority Views    findings without consensus, with the reason
/// ## Escalations       unverified claims with their evidence trail
/// ## Coverage          one row per unit
/// ```
@ApplicationScoped
public class MarkdownReportFormat implements ReportFormat {

    @Override
    public String getName() {
        return "markdown";
    }

    @Override
    public String render(FinalReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# Analysis Report: ").append(report.corpusName()).append("\n\n");

        if (report.isIncomplete()) {
            md.append("> ⚠️ **").append(report.warning()).append("**\n");
            md.append("> Findings below cover only part of the corpus.\n\n");
        }

        renderSummary(md, report);
        renderFindings(md, report);
        renderMinorityViews(md, report.minorityViews());
        renderEscalations(md, report.escalations());
        renderCoverage(md, report.coverage());
        return md.toString();
    }

    private void renderSummary(StringBuilder md, FinalReport report) {
        RunStatistics stats = report.statistics();
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Work units | ").append(stats.unitCount()).append(" |\n");
        md.append("| Coverage | ").append(percent(report.coveragePct())).append(" |\n");
        md.append("| Invocations | ").append(stats.invocationCount());
        md.append(statusBreakdown(stats.invocationsByStatus())).append(" |\n");
        md.append("| Accepted findings | ").append(report.allFindings().size()).append(" |\n");
        md.append("| Minority views | ").append(report.minorityViews().size()).append(" |\n");
        md.append("| Claims verified | ").append(stats.claimsVerified()).append(" |\n");
        md.append("| Claims escalated | ").append(stats.claimsEscalated()).append(" |\n");
        md.append("| Duration | ").append(duration(stats.duration())).append(" |\n\n");
    }

    private static String statusBreakdown(Map<InvocationStatus, Integer> byStatus) {
        StringJoiner parts = new StringJoiner(", ", " (", ")");
        parts.setEmptyValue("");
        for (InvocationStatus status : InvocationStatus.values()) {
            Integer count = byStatus.get(status);
            if (count != null && count > 0) {
                parts.add(status.name().toLowerCase(Locale.ROOT).replace('_', ' ') + " " + count);
            }
        }
        return parts.toString();
    }

    private void renderFindings(StringBuilder md, FinalReport report) {
        md.append("## Findings\n\n");
        for (Priority priority : Priority.values()) {
            List<ReportEntry> entries = report.tier(priority);
            md.append("### ")
                    .append(priority.name())
                    .append(": ")
                    .append(priority.getDescription())
                    .append(" (")
                    .append(entries.size())
                    .append(")\n\n");
            if (entries.isEmpty()) {
                md.append("_None._\n\n");
                continue;
            }
            int index = 1;
            for (ReportEntry entry : entries) {
                renderEntry(md, index++, entry);
            }
        }
    }

    private void renderEntry(StringBuilder md, int index, ReportEntry entry) {
        md.append(index)
                .append(". ")
                .append(icon(entry.severity()))
                .append(" **")
                .append(entry.severity().name())
                .append("** `")
                .append(entry.location())
                .append("`: ")
                .append(entry.description())
                .append("\n");
        if (!entry.recommendation().isEmpty()) {
            md.append("   - Recommendation: ").append(entry.recommendation()).append("\n");
        }
        md.append("   - Consensus: ")
                .append(level(entry.level()))
                .append(", ")
                .append(percent(entry.consensusPct()))
                .append(", weighted score ")
                .append(score(entry.weightedScore()))
                .append("\n");
        md.append("   - Raised by: ").append(provenance(entry.provenance())).append("\n");
        if (entry.crossCutting()) {
            md.append("   - Cross-cutting across ")
                    .append(entry.provenance().size())
                    .append(" units");
            if (entry.severity() != entry.reportedSeverity()) {
                md.append(", raised from ").append(entry.reportedSeverity().label());
            }
            md.append("\n");
        }
        md.append("\n");
    }

    private void renderMinorityViews(StringBuilder md, List<MinorityView> views) {
        md.append("## Minority Views\n\n");
        if (views.isEmpty()) {
            md.append("_None._\n\n");
            return;
        }
        for (MinorityView view : views) {
            VoteTally tally = view.tally();
            md.append("- ")
                    .append(icon(tally.finding().severity()))
                    .append(" **")
                    .append(tally.finding().severity().name())
                    .append("** `")
                    .append(tally.finding().location())
                    .append("`: ")
                    .append(tally.finding().description())
                    .append("\n");
            md.append("  - ")
                    .append(tally.finding().workUnitId())
                    .append(" ")
                    .append(roles(tally.finding().sourceRoles()))
                    .append(", ")
                    .append(percent(tally.consensusPct()))
                    .append(": ")
                    .append(view.reason())
                    .append("\n");
        }
        md.append("\n");
    }

    private void renderEscalations(StringBuilder md, List<EscalationReport> escalations) {
        md.append("## Escalations\n\n");
        if (escalations.isEmpty()) {
            md.append("_None. Every claimed change was confirmed._\n\n");
            return;
        }
        for (EscalationReport escalation : escalations) {
            md.append("### ").append(escalation.claim().describe()).append("\n\n");
            md.append("- Attempts: ").append(escalation.attempts()).append("\n");
            md.append("- Diagnosis: ").append(escalation.diagnosis()).append("\n");
            md.append("- Evidence:\n");
            int index = 1;
            for (String evidence : escalation.evidenceTrail()) {
                md.append("  ").append(index++).append(". ").append(evidence).append("\n");
            }
            md.append("\n");
        }
    }

    private void renderCoverage(StringBuilder md, List<UnitCoverage> coverage) {
        md.append("## Coverage\n\n");
        md.append("| Unit | Scope | Status | Roles | Health |\n");
        md.append("|------|-------|--------|-------|--------|\n");
        for (UnitCoverage unit : coverage) {
            md.append("| ")
                    .append(unit.workUnitId())
                    .append(" | ")
                    .append(unit.label())
                    .append(" | ")
                    .append(unit.status().name())
                    .append(" | ")
                    .append(unit.survivors())
                    .append("/")
                    .append(unit.rosterSize())
                    .append(failedRoles(unit.roleStatuses()))
                    .append(" | ")
                    .append(unit.meanHealthScore() == null
                            ? "-"
                            : String.format(Locale.ROOT, "%.1f/10", unit.meanHealthScore()))
                    .append(" |\n");
        }
        md.append("\n");
    }

    private static String failedRoles(Map<WorkerRole, InvocationStatus> statuses) {
        String failed =
                statuses.entrySet().stream()
                        .filter(e -> !e.getValue().isSurviving())
                        .map(e -> e.getKey().id() + " " + e.getValue().name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", "));
        return failed.isEmpty() ? "" : " (" + failed + ")";
    }

    static String icon(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "🔴";
            case HIGH -> "🟠";
            case MEDIUM -> "🟡";
            case LOW -> "🔵";
            case INFO -> "⚪";
        };
    }

    private static String level(ConsensusLevel level) {
        return level.name().toLowerCase(Locale.ROOT);
    }

    private static String provenance(Map<String, Set<WorkerRole>> provenance) {
        return provenance.entrySet().stream()
                .map(e -> e.getKey() + " " + roles(e.getValue()))
                .collect(Collectors.joining("; "));
    }

    private static String roles(Set<WorkerRole> roles) {
        return roles.stream().map(WorkerRole::id).collect(Collectors.joining(", ", "(", ")"));
    }

    static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }

    private static String score(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }

    static String duration(Duration duration) {
        if (duration == null) {
            return "-";
        }
        long seconds = duration.toSeconds();
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", duration.toMillis() / 1000.0);
        }
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
