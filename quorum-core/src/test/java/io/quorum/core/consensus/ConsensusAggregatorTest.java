package io.quorum.core.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.quorum.core.QuorumConfig;
import io.quorum.core.dispatch.Invocation;
import io.quorum.core.dispatch.InvocationStatus;
import io.quorum.core.parse.ParsedOutput;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRole;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConsensusAggregatorTest {

    private ConsensusAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator =
                new ConsensusAggregator(
                        new QuorumConfig().getSeverityThresholds(),
                        new FindingMatcher(new TokenJaccardSimilarity(), 0.5));
    }

    private static Finding finding(WorkerRole role, Severity severity, String location, String description) {
        return new Finding("U1", severity, location, description, "", EnumSet.of(role));
    }

    private static Invocation succeeded(WorkerRole role, Finding... findings) {
        WorkerAssignment assignment =
                new WorkerAssignment("U1", role, role.getDefaultWeight(), role.isOversizedOnly());
        return Invocation.succeeded(
                assignment, 1, "raw", new ParsedOutput("test", List.of(findings), null, List.of()), Duration.ZERO);
    }

    private static Invocation failed(WorkerRole role, InvocationStatus status) {
        WorkerAssignment assignment =
                new WorkerAssignment("U1", role, role.getDefaultWeight(), role.isOversizedOnly());
        return Invocation.ended(assignment, status, 2, null, "boom", Duration.ZERO);
    }

    @Nested
    class WeightedVote {

        @Test
        @DisplayName("three roles agreeing on a high finding reach unanimity")
        void shouldAcceptUnanimousFinding() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.HIGH, "src/db.py:42", "SQL built by string concatenation")),
                            succeeded(WorkerRole.IMPLEMENTATION,
                                    finding(WorkerRole.IMPLEMENTATION, Severity.HIGH, "src/db.py:42", "SQL built by string concatenation")),
                            succeeded(WorkerRole.DESIGN,
                                    finding(WorkerRole.DESIGN, Severity.HIGH, "src/db.py:44", "SQL query built by string concatenation")));

            // when
            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            // then
            assertThat(tally.coverage()).isEqualTo(CoverageStatus.FULL);
            assertThat(tally.denominatorWeight()).isCloseTo(3.2, within(1e-9));
            assertThat(tally.accepted()).singleElement().satisfies(t -> {
                assertThat(t.weightedScore()).isCloseTo(3.2, within(1e-9));
                assertThat(t.consensusPct()).isCloseTo(1.0, within(1e-9));
                assertThat(t.level()).isEqualTo(ConsensusLevel.UNANIMOUS);
                assertThat(t.finding().sourceRoles())
                        .containsExactly(WorkerRole.QUALITY, WorkerRole.IMPLEMENTATION, WorkerRole.DESIGN);
            });
            assertThat(tally.minority()).isEmpty();
        }

        @Test
        @DisplayName("two light roles on an oversized unit stay below the medium threshold")
        void shouldRejectFindingBelowThreshold() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.MEDIUM, "src/big.py:10", "duplicated parsing logic")),
                            succeeded(WorkerRole.IMPLEMENTATION,
                                    finding(WorkerRole.IMPLEMENTATION, Severity.MEDIUM, "src/big.py:12", "duplicated parsing logic")),
                            succeeded(WorkerRole.DESIGN),
                            succeeded(WorkerRole.COMPLEXITY));

            // when
            UnitTally tally = aggregator.aggregate("U1", 4, invocations);

            // then
            assertThat(tally.denominatorWeight()).isCloseTo(4.7, within(1e-9));
            assertThat(tally.accepted()).isEmpty();
            assertThat(tally.minority()).singleElement().satisfies(t -> {
                assertThat(t.weightedScore()).isCloseTo(2.0, within(1e-9));
                assertThat(t.consensusPct()).isCloseTo(2.0 / 4.7, within(1e-9));
                assertThat(t.level()).isEqualTo(ConsensusLevel.MINORITY);
            });
        }

        @Test
        void shouldAcceptMajorityAboveThreshold() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.MEDIUM, "src/a.py", "missing input validation")),
                            succeeded(WorkerRole.DESIGN,
                                    finding(WorkerRole.DESIGN, Severity.MEDIUM, "src/a.py", "missing input validation")),
                            succeeded(WorkerRole.IMPLEMENTATION));

            // when
            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            // then
            assertThat(tally.accepted()).singleElement().satisfies(t -> {
                assertThat(t.consensusPct()).isCloseTo(2.2 / 3.2, within(1e-9));
                assertThat(t.level()).isEqualTo(ConsensusLevel.MAJORITY);
            });
        }

        @Test
        void shouldLeaveUnrelatedFindingsInSeparateClusters() {
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.LOW, "src/a.py", "unused import"),
                                    finding(WorkerRole.QUALITY, Severity.LOW, "src/b.py", "unused import")),
                            succeeded(WorkerRole.IMPLEMENTATION,
                                    finding(WorkerRole.IMPLEMENTATION, Severity.LOW, "src/a.py", "race on shared counter")));

            UnitTally tally = aggregator.aggregate("U1", 2, invocations);

            assertThat(tally.accepted()).hasSize(3);
            assertThat(tally.accepted()).allSatisfy(t -> assertThat(t.consensusPct()).isCloseTo(0.5, within(1e-9)));
        }
    }

    @Nested
    class Critical {

        @Test
        void shouldRequireEverySurvivingRole() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.CRITICAL, "src/auth.py", "hard-coded admin password")),
                            succeeded(WorkerRole.IMPLEMENTATION,
                                    finding(WorkerRole.IMPLEMENTATION, Severity.CRITICAL, "src/auth.py", "hard-coded admin password")),
                            succeeded(WorkerRole.DESIGN));

            // when
            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            // then
            assertThat(tally.accepted()).isEmpty();
            assertThat(tally.minority()).singleElement()
                    .satisfies(t -> assertThat(t.finding().severity()).isEqualTo(Severity.CRITICAL));
        }

        @Test
        void shouldAcceptWhenFailedRoleIsExcludedFromDenominator() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.CRITICAL, "src/auth.py", "hard-coded admin password")),
                            succeeded(WorkerRole.IMPLEMENTATION,
                                    finding(WorkerRole.IMPLEMENTATION, Severity.CRITICAL, "src/auth.py", "hard-coded admin password")),
                            failed(WorkerRole.DESIGN, InvocationStatus.MALFORMED));

            // when
            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            // then
            assertThat(tally.coverage()).isEqualTo(CoverageStatus.PARTIAL);
            assertThat(tally.survivors()).isEqualTo(2);
            assertThat(tally.denominatorWeight()).isCloseTo(2.0, within(1e-9));
            assertThat(tally.accepted()).singleElement()
                    .satisfies(t -> assertThat(t.level()).isEqualTo(ConsensusLevel.UNANIMOUS));
        }

        @Test
        void shouldTakeMostSevereReportedSeverity() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.HIGH, "src/auth.py", "token logged in plain text")),
                            succeeded(WorkerRole.IMPLEMENTATION,
                                    finding(WorkerRole.IMPLEMENTATION, Severity.CRITICAL, "src/auth.py", "token logged in plain text")),
                            succeeded(WorkerRole.DESIGN,
                                    finding(WorkerRole.DESIGN, Severity.HIGH, "src/auth.py", "token logged in plain text")));

            // when
            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            // then
            assertThat(tally.accepted()).singleElement().satisfies(t -> {
                assertThat(t.finding().severity()).isEqualTo(Severity.CRITICAL);
                assertThat(t.level()).isEqualTo(ConsensusLevel.UNANIMOUS);
            });
        }
    }

    @Nested
    class Coverage {

        @Test
        void shouldReportEverythingAsMinorityWhenDegraded() {
            // given
            List<Invocation> invocations =
                    List.of(
                            succeeded(WorkerRole.QUALITY,
                                    finding(WorkerRole.QUALITY, Severity.HIGH, "src/a.py", "missing check")),
                            failed(WorkerRole.IMPLEMENTATION, InvocationStatus.TIMED_OUT),
                            failed(WorkerRole.DESIGN, InvocationStatus.FAILED));

            // when
            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            // then
            assertThat(tally.coverage()).isEqualTo(CoverageStatus.DEGRADED);
            assertThat(tally.accepted()).isEmpty();
            assertThat(tally.minority()).singleElement().satisfies(t -> {
                assertThat(t.consensusPct()).isCloseTo(1.0, within(1e-9));
                assertThat(t.accepted()).isFalse();
            });
        }

        @Test
        void shouldSkipUnitWithoutSurvivors() {
            List<Invocation> invocations =
                    List.of(
                            failed(WorkerRole.QUALITY, InvocationStatus.TIMED_OUT),
                            failed(WorkerRole.IMPLEMENTATION, InvocationStatus.MALFORMED));

            UnitTally tally = aggregator.aggregate("U1", 3, invocations);

            assertThat(tally.coverage()).isEqualTo(CoverageStatus.SKIPPED);
            assertThat(tally.accepted()).isEmpty();
            assertThat(tally.minority()).isEmpty();
            assertThat(tally.denominatorWeight()).isZero();
        }

        @Test
        void shouldAcceptUnitWithNoFindings() {
            UnitTally tally =
                    aggregator.aggregate(
                            "U1", 2, List.of(succeeded(WorkerRole.QUALITY), succeeded(WorkerRole.IMPLEMENTATION)));

            assertThat(tally.coverage()).isEqualTo(CoverageStatus.FULL);
            assertThat(tally.accepted()).isEmpty();
            assertThat(tally.minority()).isEmpty();
        }
    }

    @Test
    void shouldProduceSameTallyRegardlessOfInvocationOrder() {
        // given
        List<Invocation> invocations = new ArrayList<>(
                List.of(
                        succeeded(WorkerRole.DESIGN,
                                finding(WorkerRole.DESIGN, Severity.LOW, "src/a.py", "long method"),
                                finding(WorkerRole.DESIGN, Severity.MEDIUM, "src/b.py", "god object")),
                        succeeded(WorkerRole.QUALITY,
                                finding(WorkerRole.QUALITY, Severity.LOW, "src/a.py", "long method body")),
                        succeeded(WorkerRole.IMPLEMENTATION,
                                finding(WorkerRole.IMPLEMENTATION, Severity.MEDIUM, "src/b.py", "god object"))));

        // when
        UnitTally first = aggregator.aggregate("U1", 3, invocations);
        java.util.Collections.reverse(invocations);
        UnitTally second = aggregator.aggregate("U1", 3, invocations);

        // then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldIgnoreInvocationsOfOtherUnits() {
        WorkerAssignment foreign = new WorkerAssignment("U9", WorkerRole.DESIGN, 1.2, false);
        Invocation other =
                Invocation.succeeded(
                        foreign, 1, "raw",
                        new ParsedOutput("test",
                                List.of(new Finding("U9", Severity.LOW, "x.py", "noise", "", EnumSet.of(WorkerRole.DESIGN))),
                                null, List.of()),
                        Duration.ZERO);

        UnitTally tally =
                aggregator.aggregate("U1", 2, List.of(succeeded(WorkerRole.QUALITY), succeeded(WorkerRole.IMPLEMENTATION), other));

        assertThat(tally.survivors()).isEqualTo(2);
        assertThat(tally.minority()).isEmpty();
    }

    @Test
    void shouldCompareAgainstThresholdWithTolerance() {
        assertThat(aggregator.meetsThreshold(Severity.HIGH, 0.6 - 1e-12)).isTrue();
        assertThat(aggregator.meetsThreshold(Severity.HIGH, 0.59)).isFalse();
        assertThat(aggregator.meetsThreshold(Severity.CRITICAL, 0.999)).isFalse();
        assertThat(aggregator.meetsThreshold(Severity.CRITICAL, 1.0)).isTrue();
    }
}
