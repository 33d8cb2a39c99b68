package io.quorum.core.report;

import io.quorum.core.consensus.ConsensusLevel;
import io.quorum.core.consensus.CoverageStatus;
import io.quorum.core.consensus.Finding;
import io.quorum.core.consensus.FindingMatcher;
import io.quorum.core.consensus.Severity;
import io.quorum.core.consensus.VoteTally;
import io.quorum.core.dispatch.Invocation;
import io.quorum.core.dispatch.InvocationStatus;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.EscalationReport;
import io.quorum.core.verify.VerificationResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Builds the final report from finalized units in one deterministic pass.
///
/// Accepted tallies that match across units are merged into one entry. An entry
/// raised in two or more units is cross-cutting and its severity is raised one
/// level. Entries are then grouped into tiers and sorted by weighted score.
///
/// When fewer than `minCoveragePct` of the units have two surviving roles, the
/// report carries an `INCOMPLETE_ANALYSIS` warning naming every degraded or
/// skipped unit.
public class ReportSynthesizer {

    private static final Logger logger = Logger.getLogger(ReportSynthesizer.class.getName());

    private static final Comparator<ReportEntry> ENTRY_ORDER =
            Comparator.comparingDouble(ReportEntry::weightedScore)
                    .reversed()
                    .thenComparing(ReportEntry::location)
                    .thenComparing(ReportEntry::description);

    private final double minCoveragePct;
    private final FindingMatcher matcher;

    public ReportSynthesizer(double minCoveragePct, FindingMatcher matcher) {
        this.minCoveragePct = minCoveragePct;
        this.matcher = matcher;
    }

    /// @param corpusName name shown in the report header
    /// @param outcomes finalized units, in unit order
    /// @param startedAt run start
    /// @param finishedAt run end
    /// @return the report, never null
    public FinalReport synthesize(
            String corpusName, List<UnitOutcome> outcomes, Instant startedAt, Instant finishedAt) {
        List<UnitCoverage> coverage = new ArrayList<>(outcomes.size());
        List<MinorityView> minorityViews = new ArrayList<>();
        List<EscalationReport> escalations = new ArrayList<>();
        List<Group> groups = new ArrayList<>();
        int covered = 0;

        for (UnitOutcome outcome : outcomes) {
            coverage.add(coverageOf(outcome));
            if (outcome.tally().coverage().isCovered()) {
                covered++;
            }
            for (VoteTally tally : outcome.tally().accepted()) {
                mergeInto(groups, tally);
            }
            for (VoteTally tally : outcome.tally().minority()) {
                minorityViews.add(new MinorityView(tally, minorityReason(outcome, tally)));
            }
            for (VerificationResult result : outcome.verifications()) {
                if (result.isEscalated()) {
                    escalations.add(result.escalation());
                }
            }
        }

        Map<Priority, List<ReportEntry>> tiers = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            tiers.put(priority, new ArrayList<>());
        }
        for (Group group : groups) {
            ReportEntry entry = group.toEntry();
            tiers.get(entry.priority()).add(entry);
        }
        for (Priority priority : Priority.values()) {
            List<ReportEntry> tier = tiers.get(priority);
            tier.sort(ENTRY_ORDER);
            tiers.put(priority, List.copyOf(tier));
        }

        double coveragePct = outcomes.isEmpty() ? 0.0 : (double) covered / outcomes.size();
        String warning = coveragePct < minCoveragePct ? warningFor(coveragePct, coverage) : null;
        if (warning != null) {
            logger.warning(warning);
        }

        RunStatistics statistics = statistics(outcomes, startedAt, finishedAt);
        logger.info(
                "Report built: " + groups.size() + " findings, " + minorityViews.size()
                        + " minority views, " + escalations.size() + " escalations, coverage "
                        + percent(coveragePct));

        return new FinalReport(
                corpusName,
                statistics,
                coveragePct,
                warning,
                Collections.unmodifiableMap(tiers),
                List.copyOf(minorityViews),
                List.copyOf(escalations),
                List.copyOf(coverage));
    }

    /// Adds a tally to the first matching group that holds nothing from the same unit.
    /// Tallies of one unit were already separated by consensus, so each group takes at
    /// most one tally per unit.
    private void mergeInto(List<Group> groups, VoteTally tally) {
        for (Group group : groups) {
            if (!group.hasUnit(tally.finding().workUnitId())
                    && matcher.matches(group.first.finding(), tally.finding())) {
                group.add(tally);
                return;
            }
        }
        groups.add(new Group(tally));
    }

    private String minorityReason(UnitOutcome outcome, VoteTally tally) {
        if (outcome.tally().coverage() == CoverageStatus.DEGRADED) {
            return "only one role of " + outcome.unit().id() + " survived";
        }
        return "consensus " + percent(tally.consensusPct()) + " below the "
                + tally.finding().severity().label() + " threshold";
    }

    private String warningFor(double coveragePct, List<UnitCoverage> coverage) {
        List<String> uncovered = new ArrayList<>();
        for (UnitCoverage unit : coverage) {
            if (!unit.status().isCovered()) {
                uncovered.add(unit.workUnitId() + " (" + unit.label() + ", "
                        + unit.status().name().toLowerCase(Locale.ROOT) + ")");
            }
        }
        return FinalReport.INCOMPLETE_ANALYSIS + ": coverage " + percent(coveragePct)
                + " is below the required " + percent(minCoveragePct)
                + ". Degraded or skipped units: " + String.join(", ", uncovered);
    }

    private static UnitCoverage coverageOf(UnitOutcome outcome) {
        Map<WorkerRole, InvocationStatus> statuses = new EnumMap<>(WorkerRole.class);
        double healthSum = 0.0;
        int healthCount = 0;
        for (Invocation invocation : outcome.invocations()) {
            statuses.put(invocation.role(), invocation.status());
            if (invocation.isSurviving() && invocation.parsedOutput().healthScore() != null) {
                healthSum += invocation.parsedOutput().healthScore();
                healthCount++;
            }
        }
        return new UnitCoverage(
                outcome.unit().id(),
                outcome.unit().label(),
                outcome.tally().coverage(),
                outcome.tally().rosterSize(),
                outcome.tally().survivors(),
                Collections.unmodifiableMap(statuses),
                healthCount == 0 ? null : healthSum / healthCount);
    }

    private static RunStatistics statistics(
            List<UnitOutcome> outcomes, Instant startedAt, Instant finishedAt) {
        Map<InvocationStatus, Integer> byStatus = new EnumMap<>(InvocationStatus.class);
        int invocations = 0;
        int verified = 0;
        int escalated = 0;
        for (UnitOutcome outcome : outcomes) {
            for (Invocation invocation : outcome.invocations()) {
                byStatus.merge(invocation.status(), 1, Integer::sum);
                invocations++;
            }
            for (VerificationResult result : outcome.verifications()) {
                if (result.verified()) {
                    verified++;
                } else {
                    escalated++;
                }
            }
        }
        return new RunStatistics(
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt),
                outcomes.size(),
                invocations,
                Collections.unmodifiableMap(byStatus),
                verified,
                escalated);
    }

    static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }

    /// Accepted tallies describing the same issue, in encounter order.
    private static final class Group {
        private final VoteTally first;
        private final List<VoteTally> members = new ArrayList<>();

        Group(VoteTally first) {
            this.first = first;
            members.add(first);
        }

        void add(VoteTally tally) {
            members.add(tally);
        }

        boolean hasUnit(String workUnitId) {
            for (VoteTally member : members) {
                if (member.finding().workUnitId().equals(workUnitId)) {
                    return true;
                }
            }
            return false;
        }

        ReportEntry toEntry() {
            Map<String, Set<WorkerRole>> provenance = new LinkedHashMap<>();
            Severity reported = first.finding().severity();
            String recommendation = "";
            double score = 0.0;
            double pct = 1.0;
            boolean unanimous = true;

            for (VoteTally member : members) {
                Finding finding = member.finding();
                provenance
                        .computeIfAbsent(finding.workUnitId(), id -> EnumSet.noneOf(WorkerRole.class))
                        .addAll(finding.sourceRoles());
                reported = Severity.mostSevere(reported, finding.severity());
                if (recommendation.isEmpty()) {
                    recommendation = finding.recommendation();
                }
                score += member.weightedScore();
                pct = Math.min(pct, member.consensusPct());
                unanimous &= member.level() == ConsensusLevel.UNANIMOUS;
            }

            boolean crossCutting = provenance.size() >= 2;
            Severity severity = crossCutting ? reported.raised() : reported;
            ConsensusLevel level = unanimous ? ConsensusLevel.UNANIMOUS : ConsensusLevel.MAJORITY;

            Map<String, Set<WorkerRole>> frozen = new LinkedHashMap<>();
            provenance.forEach(
                    (unit, roles) ->
                            frozen.put(unit, Collections.unmodifiableSet(EnumSet.copyOf(roles))));

            return new ReportEntry(
                    Priority.of(severity, level),
                    severity,
                    reported,
                    first.finding().location(),
                    first.finding().description(),
                    recommendation,
                    score,
                    pct,
                    level,
                    crossCutting,
                    Collections.unmodifiableMap(frozen));
        }
    }
}
