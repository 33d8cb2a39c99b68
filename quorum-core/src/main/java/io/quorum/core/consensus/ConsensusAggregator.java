package io.quorum.core.consensus;

import io.quorum.core.dispatch.Invocation;
import io.quorum.core.roster.WorkerRole;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Computes weighted-quorum acceptance of findings within a single WorkUnit.
///
/// ### Algorithm
/// 1. The voters are the invocations that ended `SUCCEEDED`; their weights form the
///    denominator. Nothing else counts, so a unit with four roles and one with three
///    are judged on the same scale.
/// 2. Findings are clustered in role order: a finding joins the first cluster with the
///    same resource path and a description similar enough to the cluster's first one.
/// 3. Each cluster's score is the weight of the distinct roles in it. A cluster takes
///    the most severe severity any of its roles reported.
/// 4. A cluster is accepted when its percentage clears the severity's threshold.
///    Critical findings need every surviving role.
/// 5. A unit with a single surviving role is `DEGRADED`: all its tallies are minority.
///
/// @implNote Stateless and deterministic. The same invocations always produce the
/// same tallies, in the same order.
public class ConsensusAggregator {

    private static final Logger logger = Logger.getLogger(ConsensusAggregator.class.getName());

    private static final Comparator<VoteTally> TALLY_ORDER =
            Comparator.comparingDouble(VoteTally::weightedScore)
                    .reversed()
                    .thenComparing(t -> t.finding().severity())
                    .thenComparing(t -> t.finding().location())
                    .thenComparing(t -> t.finding().description());

    private final Map<Severity, Double> thresholds;
    private final FindingMatcher matcher;

    public ConsensusAggregator(Map<Severity, Double> thresholds, FindingMatcher matcher) {
        this.thresholds = new EnumMap<>(thresholds);
        this.matcher = matcher;
    }

    /// Tallies the votes of one unit.
    ///
    /// @param workUnitId the unit, not null
    /// @param rosterSize number of roles rostered for the unit
    /// @param invocations the unit's terminal invocations, not null
    /// @return the unit tally, never null
    public UnitTally aggregate(String workUnitId, int rosterSize, List<Invocation> invocations) {
        List<Invocation> voters = new ArrayList<>();
        for (Invocation invocation : invocations) {
            if (invocation.isSurviving() && invocation.workUnitId().equals(workUnitId)) {
                voters.add(invocation);
            }
        }
        voters.sort(Comparator.comparing(Invocation::role));

        CoverageStatus coverage = CoverageStatus.of(voters.size(), rosterSize);
        if (coverage == CoverageStatus.SKIPPED) {
            logger.warning("Unit " + workUnitId + " has no surviving roles");
            return UnitTally.skipped(workUnitId, rosterSize);
        }

        Map<WorkerRole, Double> weights = new EnumMap<>(WorkerRole.class);
        double denominator = 0.0;
        for (Invocation voter : voters) {
            weights.put(voter.role(), voter.voteWeight());
            denominator += voter.voteWeight();
        }

        List<Cluster> clusters = cluster(voters);

        List<VoteTally> accepted = new ArrayList<>();
        List<VoteTally> minority = new ArrayList<>();
        for (Cluster cluster : clusters) {
            double score = 0.0;
            for (WorkerRole role : cluster.roles) {
                score += weights.get(role);
            }
            double pct = score / denominator;
            boolean passes =
                    coverage != CoverageStatus.DEGRADED && meetsThreshold(cluster.severity, pct);
            VoteTally tally = VoteTally.of(cluster.toFinding(), score, pct, passes);
            (passes ? accepted : minority).add(tally);
        }
        accepted.sort(TALLY_ORDER);
        minority.sort(TALLY_ORDER);

        logger.fine(
                "Unit " + workUnitId + ": " + voters.size() + "/" + rosterSize + " roles, "
                        + accepted.size() + " accepted, " + minority.size() + " minority");
        return new UnitTally(
                workUnitId, coverage, rosterSize, voters.size(), denominator, accepted, minority);
    }

    boolean meetsThreshold(Severity severity, double pct) {
        if (severity == Severity.CRITICAL) {
            return pct >= 1.0 - VoteTally.EPSILON;
        }
        return pct + VoteTally.EPSILON >= thresholds.get(severity);
    }

    private List<Cluster> cluster(List<Invocation> voters) {
        List<Cluster> clusters = new ArrayList<>();
        for (Invocation voter : voters) {
            for (Finding finding : voter.parsedOutput().findings()) {
                Cluster match = null;
                for (Cluster cluster : clusters) {
                    if (matcher.matches(cluster.first, finding)) {
                        match = cluster;
                        break;
                    }
                }
                if (match == null) {
                    clusters.add(new Cluster(finding, voter.role()));
                } else {
                    match.add(finding, voter.role());
                }
            }
        }
        return clusters;
    }

    private static final class Cluster {
        private final Finding first;
        private final Set<WorkerRole> roles = EnumSet.noneOf(WorkerRole.class);
        private Severity severity;
        private String recommendation;

        Cluster(Finding first, WorkerRole role) {
            this.first = first;
            this.severity = first.severity();
            this.recommendation = first.recommendation();
            roles.add(role);
        }

        void add(Finding finding, WorkerRole role) {
            roles.add(role);
            severity = Severity.mostSevere(severity, finding.severity());
            if (recommendation.isEmpty()) {
                recommendation = finding.recommendation();
            }
        }

        Finding toFinding() {
            return new Finding(
                    first.workUnitId(),
                    severity,
                    first.location(),
                    first.description(),
                    recommendation,
                    roles);
        }
    }
}
