package io.quorum.core.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.quorum.core.consensus.ConsensusLevel;
import io.quorum.core.consensus.CoverageStatus;
import io.quorum.core.consensus.Finding;
import io.quorum.core.consensus.FindingMatcher;
import io.quorum.core.consensus.Severity;
import io.quorum.core.consensus.TokenJaccardSimilarity;
import io.quorum.core.consensus.UnitTally;
import io.quorum.core.consensus.VoteTally;
import io.quorum.core.dispatch.Invocation;
import io.quorum.core.dispatch.InvocationStatus;
import io.quorum.core.parse.ParsedOutput;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.ClaimState;
import io.quorum.core.verify.EscalationReport;
import io.quorum.core.verify.ExpectedSignal;
import io.quorum.core.verify.MutationClaim;
import io.quorum.core.verify.VerificationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReportSynthesizerTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant END = Instant.parse("2026-03-01T10:02:30Z");
    private static final EnumSet<WorkerRole> THREE_ROLES =
            EnumSet.of(WorkerRole.QUALITY, WorkerRole.IMPLEMENTATION, WorkerRole.DESIGN);

    private ReportSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new ReportSynthesizer(0.7, new FindingMatcher(new TokenJaccardSimilarity(), 0.5));
    }

    private static WorkUnit unit(String id) {
        return new WorkUnit(id, "pkg/" + id.toLowerCase(), List.of("pkg/" + id.toLowerCase() + "/**"), 100, false);
    }

    private static VoteTally tally(String unitId, Severity severity, String location, String description,
            double score, double pct, boolean accepted) {
        Finding finding = new Finding(unitId, severity, location, description, "", THREE_ROLES);
        return VoteTally.of(finding, score, pct, accepted);
    }

    private static UnitOutcome full(String unitId, List<VoteTally> accepted, List<VoteTally> minority) {
        return new UnitOutcome(
                unit(unitId),
                succeededAll(unitId, null),
                new UnitTally(unitId, CoverageStatus.FULL, 3, 3, 3.2, accepted, minority),
                List.of());
    }

    private static List<Invocation> succeededAll(String unitId, Double health) {
        List<Invocation> invocations = new ArrayList<>();
        for (WorkerRole role : THREE_ROLES) {
            invocations.add(
                    Invocation.succeeded(
                            new WorkerAssignment(unitId, role, role.getDefaultWeight(), false),
                            1,
                            "raw",
                            new ParsedOutput("lines", List.of(), health, List.of()),
                            null));
        }
        return invocations;
    }

    private static UnitOutcome skipped(String unitId) {
        List<Invocation> invocations = new ArrayList<>();
        for (WorkerRole role : THREE_ROLES) {
            invocations.add(
                    Invocation.ended(
                            new WorkerAssignment(unitId, role, role.getDefaultWeight(), false),
                            InvocationStatus.TIMED_OUT, 2, null, "timed out", null));
        }
        return new UnitOutcome(unit(unitId), invocations, UnitTally.skipped(unitId, 3), List.of());
    }

    @Nested
    class CrossUnitMerge {

        @Test
        @DisplayName("the same critical finding in two units becomes one cross-cutting entry")
        void shouldMergeCriticalFindingAcrossUnits() {
            // given
            UnitOutcome u1 = full("U1", List.of(tally("U1", Severity.CRITICAL, "src/auth.py:12",
                    "hard-coded admin password", 3.2, 1.0, true)), List.of());
            UnitOutcome u2 = full("U2", List.of(tally("U2", Severity.CRITICAL, "src/auth.py:40",
                    "admin password hard-coded", 3.2, 1.0, true)), List.of());

            // when
            FinalReport report = synthesizer.synthesize("demo", List.of(u1, u2), START, END);

            // then
            assertThat(report.allFindings()).singleElement().satisfies(entry -> {
                assertThat(entry.crossCutting()).isTrue();
                assertThat(entry.severity()).isEqualTo(Severity.CRITICAL);
                assertThat(entry.priority()).isEqualTo(Priority.P1);
                assertThat(entry.provenance()).containsOnlyKeys("U1", "U2");
                assertThat(entry.weightedScore()).isCloseTo(6.4, within(1e-9));
                assertThat(entry.location()).isEqualTo("src/auth.py:12");
            });
        }

        @Test
        void shouldRaiseCrossCuttingHighToCritical() {
            UnitOutcome u1 = full("U1", List.of(tally("U1", Severity.HIGH, "lib/db.py",
                    "connection never closed", 2.2, 0.6875, true)), List.of());
            UnitOutcome u2 = full("U2", List.of(tally("U2", Severity.HIGH, "lib/db.py",
                    "connection never closed", 3.2, 1.0, true)), List.of());

            FinalReport report = synthesizer.synthesize("demo", List.of(u1, u2), START, END);

            assertThat(report.allFindings()).singleElement().satisfies(entry -> {
                assertThat(entry.reportedSeverity()).isEqualTo(Severity.HIGH);
                assertThat(entry.severity()).isEqualTo(Severity.CRITICAL);
                assertThat(entry.level()).isEqualTo(ConsensusLevel.MAJORITY);
                assertThat(entry.consensusPct()).isCloseTo(0.6875, within(1e-9));
                assertThat(entry.priority()).isEqualTo(Priority.P2);
            });
        }

        @Test
        @DisplayName("a group takes at most one tally from each unit")
        void shouldNotMergeTwoTalliesOfOneUnitIntoOneEntry() {
            // given: both U2 tallies resemble the U1 finding but not each other
            UnitOutcome u1 = full("U1", List.of(tally("U1", Severity.MEDIUM, "app/cache.py",
                    "alpha beta gamma delta", 3.2, 1.0, true)), List.of());
            UnitOutcome u2 = full("U2", List.of(
                    tally("U2", Severity.MEDIUM, "app/cache.py", "alpha beta gamma epsilon", 3.2, 1.0, true),
                    tally("U2", Severity.MEDIUM, "app/cache.py", "alpha beta delta zeta", 2.2, 0.6875, true)),
                    List.of());

            // when
            FinalReport report = synthesizer.synthesize("demo", List.of(u1, u2), START, END);

            // then
            assertThat(report.allFindings()).hasSize(2);
            assertThat(report.allFindings()).filteredOn(ReportEntry::crossCutting).singleElement()
                    .satisfies(entry -> {
                        assertThat(entry.description()).isEqualTo("alpha beta gamma delta");
                        assertThat(entry.weightedScore()).isCloseTo(6.4, within(1e-9));
                        assertThat(entry.provenance()).containsOnlyKeys("U1", "U2");
                    });
            assertThat(report.allFindings()).filteredOn(entry -> !entry.crossCutting()).singleElement()
                    .satisfies(entry -> {
                        assertThat(entry.description()).isEqualTo("alpha beta delta zeta");
                        assertThat(entry.provenance()).containsOnlyKeys("U2");
                    });
        }

        @Test
        void shouldKeepFindingsOnDifferentResourcesApart() {
            UnitOutcome u1 = full("U1", List.of(tally("U1", Severity.LOW, "a/x.py", "unused import", 3.2, 1.0, true)), List.of());
            UnitOutcome u2 = full("U2", List.of(tally("U2", Severity.LOW, "b/x.py", "unused import", 3.2, 1.0, true)), List.of());

            FinalReport report = synthesizer.synthesize("demo", List.of(u1, u2), START, END);

            assertThat(report.tier(Priority.P5)).hasSize(2).noneMatch(ReportEntry::crossCutting);
        }
    }

    @Test
    void shouldSortTiersByWeightedScore() {
        UnitOutcome u1 = full("U1", List.of(
                tally("U1", Severity.MEDIUM, "src/b.py", "long method", 2.0, 0.625, true),
                tally("U1", Severity.MEDIUM, "src/a.py", "god object", 3.2, 1.0, true),
                tally("U1", Severity.HIGH, "src/c.py", "missing auth check", 3.2, 1.0, true)), List.of());

        FinalReport report = synthesizer.synthesize("demo", List.of(u1), START, END);

        assertThat(report.findings()).containsOnlyKeys(Priority.values());
        assertThat(report.tier(Priority.P2)).extracting(ReportEntry::location).containsExactly("src/c.py");
        assertThat(report.tier(Priority.P4)).extracting(ReportEntry::location).containsExactly("src/a.py", "src/b.py");
        assertThat(report.tier(Priority.P1)).isEmpty();
    }

    @Nested
    class Coverage {

        @Test
        @DisplayName("one skipped unit out of seven keeps coverage above 70%")
        void shouldNotWarnWhenCoverageIsSufficient() {
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (int i = 1; i <= 6; i++) {
                outcomes.add(full("U" + i, List.of(), List.of()));
            }
            outcomes.add(skipped("U7"));

            FinalReport report = synthesizer.synthesize("demo", outcomes, START, END);

            assertThat(report.coveragePct()).isCloseTo(6.0 / 7.0, within(1e-9));
            assertThat(report.isIncomplete()).isFalse();
            assertThat(report.coverage().get(6).status()).isEqualTo(CoverageStatus.SKIPPED);
        }

        @Test
        void shouldWarnAndNameUncoveredUnits() {
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (int i = 1; i <= 4; i++) {
                outcomes.add(full("U" + i, List.of(), List.of()));
            }
            for (int i = 5; i <= 7; i++) {
                outcomes.add(skipped("U" + i));
            }

            FinalReport report = synthesizer.synthesize("demo", outcomes, START, END);

            assertThat(report.isIncomplete()).isTrue();
            assertThat(report.warning())
                    .startsWith("INCOMPLETE_ANALYSIS: coverage 57.1% is below the required 70.0%")
                    .contains("U5 (pkg/u5, skipped)", "U6 (pkg/u6, skipped)", "U7 (pkg/u7, skipped)")
                    .doesNotContain("U4");
        }

        @Test
        void shouldAverageHealthScoresOfSurvivors() {
            UnitOutcome outcome = new UnitOutcome(
                    unit("U1"),
                    succeededAll("U1", 6.0),
                    new UnitTally("U1", CoverageStatus.FULL, 3, 3, 3.2, List.of(), List.of()),
                    List.of());

            FinalReport report = synthesizer.synthesize("demo", List.of(outcome), START, END);

            assertThat(report.coverage().get(0).meanHealthScore()).isEqualTo(6.0);
            assertThat(report.coverage().get(0).roleStatuses())
                    .containsValues(InvocationStatus.SUCCEEDED)
                    .hasSize(3);
        }
    }

    @Test
    void shouldExplainMinorityViews() {
        UnitOutcome partial = full("U1", List.of(), List.of(
                tally("U1", Severity.MEDIUM, "src/big.py", "duplicated logic", 2.0, 2.0 / 4.7, false)));
        UnitOutcome degraded = new UnitOutcome(
                unit("U2"),
                List.of(),
                new UnitTally("U2", CoverageStatus.DEGRADED, 3, 1, 1.0,
                        List.of(), List.of(tally("U2", Severity.HIGH, "src/x.py", "leak", 1.0, 1.0, false))),
                List.of());

        FinalReport report = synthesizer.synthesize("demo", List.of(partial, degraded), START, END);

        assertThat(report.minorityViews()).extracting(MinorityView::reason)
                .containsExactly("consensus 42.6% below the medium threshold", "only one role of U2 survived");
        assertThat(report.allFindings()).isEmpty();
    }

    @Test
    void shouldCollectEscalationsAndStatistics() {
        MutationClaim claim = new MutationClaim("U1", WorkerRole.QUALITY, "out.txt", ExpectedSignal.present());
        EscalationReport escalation = new EscalationReport(claim, 3, List.of("a", "b", "c"), "never appeared");
        VerificationResult escalated = new VerificationResult(claim, false, ClaimState.ESCALATED, 3,
                List.of("a", "b", "c"), escalation);
        VerificationResult verified = new VerificationResult(claim, true, ClaimState.VERIFIED, 1, List.of("a"), null);
        UnitOutcome outcome = new UnitOutcome(
                unit("U1"),
                succeededAll("U1", null),
                new UnitTally("U1", CoverageStatus.FULL, 3, 3, 3.2, List.of(), List.of()),
                List.of(verified, escalated));

        FinalReport report = synthesizer.synthesize("demo", List.of(outcome, skipped("U2")), START, END);

        assertThat(report.escalations()).containsExactly(escalation);
        RunStatistics statistics = report.statistics();
        assertThat(statistics.unitCount()).isEqualTo(2);
        assertThat(statistics.invocationCount()).isEqualTo(6);
        assertThat(statistics.invocationsByStatus())
                .containsEntry(InvocationStatus.SUCCEEDED, 3)
                .containsEntry(InvocationStatus.TIMED_OUT, 3);
        assertThat(statistics.claimsVerified()).isEqualTo(1);
        assertThat(statistics.claimsEscalated()).isEqualTo(1);
        assertThat(statistics.duration()).hasSeconds(150);
    }
}
