package io.quorum.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quorum.core.QuorumConfig;
import io.quorum.core.QuorumEnvironment;
import io.quorum.core.QuorumFactory;
import io.quorum.core.consensus.CoverageStatus;
import io.quorum.core.dispatch.CancellationSignal;
import io.quorum.core.exception.AnalysisAbortedException;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.partition.CorpusDescription;
import io.quorum.core.partition.CorpusEntry;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.report.FinalReport;
import io.quorum.core.report.Priority;
import io.quorum.core.report.UnitOutcome;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.FileSystemGroundTruth;
import io.quorum.core.verify.VerificationResult;
import io.quorum.core.worker.Worker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisCoordinatorTest {

    private QuorumConfig config;
    private QuorumEnvironment environment;

    @BeforeEach
    void setUp() {
        config =
                QuorumConfig.builder()
                        .concurrencyLimit(8)
                        .invocationTimeout(Duration.ofMillis(250))
                        .invocationRetries(0)
                        .retryBackoff(Duration.ZERO)
                        .verificationDelay(Duration.ZERO)
                        .build();
    }

    @AfterEach
    void tearDown() {
        if (environment != null) {
            environment.close();
        }
    }

    /// Seven packages of equal size, one unit each.
    private static CorpusDescription sevenPackages() {
        List<CorpusEntry> entries = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            entries.add(new CorpusEntry("pkg/m" + i + "/service.py", 120));
        }
        return new CorpusDescription("demo", entries);
    }

    /// Reports one issue on the unit's first file, agreed on by every role.
    private static String reportFor(String label) {
        return "- [HIGH] " + label + "/service.py:10 - missing null check on request body -> validate input\n"
                + "Health score: 6/10";
    }

    private static Worker hangingOn(Set<String> units) {
        return (unit, role, payload) -> {
            if (units.contains(unit.id())) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return reportFor(unit.label());
        };
    }

    private FinalReport run(Worker worker, CorpusDescription corpus) throws Exception {
        environment = QuorumFactory.builder().config(config).defaultWorker(worker).build();
        return environment.getCoordinator().run(corpus);
    }

    @Nested
    class Coverage {

        @Test
        void shouldAcceptUnanimousFindingOnEveryUnit() throws Exception {
            FinalReport report = run(hangingOn(Set.of()), sevenPackages());

            assertThat(report.isIncomplete()).isFalse();
            assertThat(report.coveragePct()).isEqualTo(1.0);
            assertThat(report.tier(Priority.P2)).hasSize(7);
            assertThat(report.tier(Priority.P2).get(0).recommendation()).isEqualTo("validate input");
            assertThat(report.coverage()).allSatisfy(c -> {
                assertThat(c.status()).isEqualTo(CoverageStatus.FULL);
                assertThat(c.meanHealthScore()).isEqualTo(6.0);
            });
        }

        @Test
        @DisplayName("a unit whose roles all time out is skipped without failing the run")
        void shouldSkipTimedOutUnit() throws Exception {
            FinalReport report = run(hangingOn(Set.of("U7")), sevenPackages());

            assertThat(report.coverage().get(6).workUnitId()).isEqualTo("U7");
            assertThat(report.coverage().get(6).status()).isEqualTo(CoverageStatus.SKIPPED);
            assertThat(report.coveragePct()).isEqualTo(6.0 / 7.0);
            assertThat(report.isIncomplete()).isFalse();
            assertThat(report.tier(Priority.P2)).hasSize(6);
        }

        @Test
        void shouldWarnWhenCoverageDropsBelowMinimum() throws Exception {
            FinalReport report = run(hangingOn(Set.of("U5", "U6", "U7")), sevenPackages());

            assertThat(report.isIncomplete()).isTrue();
            assertThat(report.warning()).contains("U5 (pkg/m5, skipped)", "U7 (pkg/m7, skipped)");
        }

        @Test
        void shouldReportSingleSurvivorAsMinority() throws Exception {
            Worker worker = (unit, role, payload) -> {
                if (unit.id().equals("U1") && role != WorkerRole.QUALITY) {
                    return "nothing to see";
                }
                return reportFor(unit.label());
            };

            FinalReport report = run(worker, sevenPackages());

            assertThat(report.coverage().get(0).status()).isEqualTo(CoverageStatus.DEGRADED);
            assertThat(report.minorityViews()).singleElement()
                    .satisfies(m -> assertThat(m.reason()).isEqualTo("only one role of U1 survived"));
        }
    }

    @Nested
    class Abort {

        @Test
        void shouldAbortWithPartialReportWhenNothingIsCovered() {
            Worker worker = (unit, role, payload) -> "no findings, no structure";

            assertThatThrownBy(() -> run(worker, sevenPackages()))
                    .isInstanceOfSatisfying(AnalysisAbortedException.class, e -> {
                        assertThat(e.getPartialReport()).isNotNull();
                        assertThat(e.getPartialReport().coverage())
                                .allMatch(c -> c.status() == CoverageStatus.SKIPPED);
                    });
        }

        @Test
        void shouldAbortCancelledRun() throws Exception {
            environment = QuorumFactory.builder().config(config).defaultWorker(hangingOn(Set.of())).build();
            CancellationSignal signal = new CancellationSignal();
            signal.cancel();

            assertThatThrownBy(() -> environment.getCoordinator().run(sevenPackages(), RunListener.NOOP, signal))
                    .isInstanceOf(AnalysisAbortedException.class);
        }

        @Test
        void shouldRejectMissingWorkerBeforeDispatch() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            environment =
                    QuorumFactory.builder()
                            .config(config)
                            .worker(WorkerRole.QUALITY, (unit, role, payload) -> {
                                calls.incrementAndGet();
                                return "";
                            })
                            .build();

            assertThatThrownBy(() -> environment.getCoordinator().run(sevenPackages()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("No worker registered for role implementation");
            assertThat(calls).hasValue(0);
        }

        @Test
        void shouldRejectEmptyCorpus() throws Exception {
            environment = QuorumFactory.builder().config(config).defaultWorker(hangingOn(Set.of())).build();

            assertThatThrownBy(() -> environment.getCoordinator().run(new CorpusDescription("empty", List.of())))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("has no resources");
        }
    }

    @Nested
    class MutationClaims {

        @TempDir Path workspace;

        @Test
        void shouldVerifyClaimAfterReapplyingAction() throws Exception {
            // given
            AtomicInteger qualityCalls = new AtomicInteger();
            Worker worker = (unit, role, payload) -> {
                if (role == WorkerRole.QUALITY && unit.id().equals("U1")) {
                    if (qualityCalls.incrementAndGet() > 1) {
                        try {
                            Files.writeString(workspace.resolve("fixed.txt"), "done");
                        } catch (IOException e) {
                            throw new IllegalStateException(e);
                        }
                    }
                    return reportFor(unit.label()) + "\nClaimed mutation: `fixed.txt` [present]";
                }
                return reportFor(unit.label());
            };
            List<VerificationResult> verified = new CopyOnWriteArrayList<>();
            RunListener listener = new RunListener() {
                @Override
                public void onClaimVerified(VerificationResult result) {
                    verified.add(result);
                }
            };
            environment =
                    QuorumFactory.builder()
                            .config(config)
                            .defaultWorker(worker)
                            .groundTruth(new FileSystemGroundTruth(workspace))
                            .build();

            // when
            FinalReport report = environment.getCoordinator().run(sevenPackages(), listener, new CancellationSignal());

            // then
            assertThat(verified).singleElement().satisfies(result -> {
                assertThat(result.verified()).isTrue();
                assertThat(result.attempts()).isEqualTo(2);
            });
            assertThat(report.escalations()).isEmpty();
            assertThat(report.statistics().claimsVerified()).isEqualTo(1);
        }

        @Test
        void shouldEscalateClaimThatNeverMaterializes() throws Exception {
            Worker worker = (unit, role, payload) -> {
                String report = reportFor(unit.label());
                return role == WorkerRole.DESIGN && unit.id().equals("U2")
                        ? report + "\nClaimed mutation: `ghost.txt` [present]"
                        : report;
            };
            environment =
                    QuorumFactory.builder()
                            .config(config)
                            .defaultWorker(worker)
                            .groundTruth(new FileSystemGroundTruth(workspace))
                            .build();

            FinalReport report = environment.getCoordinator().run(sevenPackages());

            assertThat(report.escalations()).singleElement().satisfies(e -> {
                assertThat(e.attempts()).isEqualTo(3);
                assertThat(e.evidenceTrail()).hasSize(3);
                assertThat(e.claim().targetResource()).isEqualTo("ghost.txt");
            });
            assertThat(report.tier(Priority.P2)).hasSize(7);
        }
    }

    @Test
    void shouldNotifyListenerInRunOrder() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        RunListener listener = new RunListener() {
            @Override
            public void onPartitioned(List<WorkUnit> units) {
                events.add("partitioned:" + units.size());
            }

            @Override
            public void onUnitFinalized(UnitOutcome outcome) {
                events.add("unit");
            }

            @Override
            public void onReportBuilt(FinalReport report) {
                events.add("report");
            }
        };
        environment = QuorumFactory.builder().config(config).defaultWorker(hangingOn(Set.of())).build();

        environment.getCoordinator().run(sevenPackages(), listener, new CancellationSignal());

        assertThat(events).first().isEqualTo("partitioned:7");
        assertThat(events).last().isEqualTo("report");
        assertThat(events).filteredOn("unit"::equals).hasSize(7);
    }
}
