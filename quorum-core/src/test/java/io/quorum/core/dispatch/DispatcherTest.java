package io.quorum.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quorum.core.QuorumConfig;
import io.quorum.core.execution.RunListener;
import io.quorum.core.parse.ResultParser;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.roster.WorkerRoster;
import io.quorum.core.template.SimpleTemplateResolver;
import io.quorum.core.worker.DefaultWorkerRegistry;
import io.quorum.core.worker.InvocationException;
import io.quorum.core.worker.TemplatePromptPayloadFactory;
import io.quorum.core.worker.Worker;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DispatcherTest {

    private static final String REPORT = "- [MEDIUM] src/a.py:3 - duplicated parsing logic";

    private static final WorkUnit UNIT = new WorkUnit("U1", "src", List.of("src/**"), 100, false);
    private static final WorkerAssignment QUALITY =
            new WorkerAssignment("U1", WorkerRole.QUALITY, 1.0, false);

    private ExecutorService dispatchPool;
    private ExecutorService callPool;
    private DefaultWorkerRegistry registry;
    private QuorumConfig config;

    @BeforeEach
    void setUp() {
        dispatchPool = Executors.newFixedThreadPool(4);
        callPool = Executors.newCachedThreadPool();
        registry = new DefaultWorkerRegistry();
        config =
                QuorumConfig.builder()
                        .invocationTimeout(Duration.ofMillis(300))
                        .invocationRetries(1)
                        .retryBackoff(Duration.ZERO)
                        .build();
    }

    @AfterEach
    void tearDown() {
        dispatchPool.shutdownNow();
        callPool.shutdownNow();
    }

    private Dispatcher dispatcher() {
        return new Dispatcher(
                config,
                registry,
                new TemplatePromptPayloadFactory(new SimpleTemplateResolver()),
                ResultParser.heuristic(),
                dispatchPool,
                callPool);
    }

    private Invocation invokeQuality(Worker worker) {
        registry.registerWorker(WorkerRole.QUALITY, worker);
        return dispatcher().invoke(UNIT, QUALITY, new CancellationSignal(), RunListener.NOOP);
    }

    @Nested
    class TerminalStatus {

        @Test
        void shouldSucceedWithParsedFindings() {
            Invocation invocation = invokeQuality((unit, role, payload) -> REPORT);

            assertThat(invocation.status()).isEqualTo(InvocationStatus.SUCCEEDED);
            assertThat(invocation.attemptCount()).isEqualTo(1);
            assertThat(invocation.parsedOutput().findings()).hasSize(1);
            assertThat(invocation.rawOutput()).isEqualTo(REPORT);
        }

        @Test
        void shouldMarkUndecodableOutputAsMalformedWithoutRetry() {
            AtomicInteger calls = new AtomicInteger();

            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        calls.incrementAndGet();
                        return "Looks fine to me.";
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.MALFORMED);
            assertThat(invocation.rawOutput()).isEqualTo("Looks fine to me.");
            assertThat(calls).hasValue(1);
        }

        @Test
        void shouldFailImmediatelyOnPermanentFailure() {
            AtomicInteger calls = new AtomicInteger();

            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        calls.incrementAndGet();
                        throw InvocationException.permanentFailure("bad credentials");
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.FAILED);
            assertThat(invocation.failureReason()).isEqualTo("bad credentials");
            assertThat(calls).hasValue(1);
        }

        @Test
        void shouldTreatRuntimeExceptionAsPermanent() {
            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        throw new IllegalStateException("worker bug");
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.FAILED);
            assertThat(invocation.attemptCount()).isEqualTo(1);
            assertThat(invocation.failureReason()).isEqualTo("worker bug");
        }

        @Test
        void shouldFailWhenNoWorkerIsRegistered() {
            Invocation invocation =
                    dispatcher().invoke(UNIT, QUALITY, new CancellationSignal(), RunListener.NOOP);

            assertThat(invocation.status()).isEqualTo(InvocationStatus.FAILED);
            assertThat(invocation.attemptCount()).isZero();
            assertThat(invocation.failureReason()).contains("no worker registered for role quality");
        }
    }

    @Nested
    class Retry {

        @Test
        void shouldRetryTransientFailureOnce() {
            AtomicInteger calls = new AtomicInteger();

            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        if (calls.incrementAndGet() == 1) {
                            throw InvocationException.transientFailure("rate limited");
                        }
                        return REPORT;
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.SUCCEEDED);
            assertThat(invocation.attemptCount()).isEqualTo(2);
        }

        @Test
        void shouldSucceedWhenRetryAfterTimeoutResponds() {
            AtomicInteger calls = new AtomicInteger();

            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        if (calls.incrementAndGet() == 1) {
                            sleepQuietly(5_000);
                        }
                        return REPORT;
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.SUCCEEDED);
            assertThat(invocation.attemptCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("a worker that times out twice ends TIMED_OUT after two attempts")
        void shouldEndTimedOutAfterSecondTimeout() {
            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        sleepQuietly(5_000);
                        return REPORT;
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.TIMED_OUT);
            assertThat(invocation.attemptCount()).isEqualTo(2);
            assertThat(invocation.failureReason()).isEqualTo("timed out after 300 ms");
        }

        @Test
        void shouldNotRetryWhenRetriesAreDisabled() {
            config.setInvocationRetries(0);

            Invocation invocation =
                    invokeQuality((unit, role, payload) -> {
                        throw InvocationException.transientFailure("busy");
                    });

            assertThat(invocation.status()).isEqualTo(InvocationStatus.FAILED);
            assertThat(invocation.attemptCount()).isEqualTo(1);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldNeverExceedDispatchPoolSize() throws Exception {
            // given
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            registry.registerDefault((unit, role, payload) -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                sleepQuietly(50);
                running.decrementAndGet();
                return REPORT;
            });
            List<WorkUnit> units =
                    List.of(
                            new WorkUnit("U1", "a", List.of("a/**"), 10, false),
                            new WorkUnit("U2", "b", List.of("b/**"), 10, false),
                            new WorkUnit("U3", "c", List.of("c/**"), 10, false),
                            new WorkUnit("U4", "d", List.of("d/**"), 10, false));

            // when
            Map<String, CompletableFuture<List<Invocation>>> results =
                    dispatcher().dispatch(units, WorkerRoster.withDefaultWeights(), new CancellationSignal(), RunListener.NOOP);
            for (CompletableFuture<List<Invocation>> future : results.values()) {
                future.get(10, TimeUnit.SECONDS);
            }

            // then
            assertThat(peak.get()).isLessThanOrEqualTo(4);
            assertThat(results).containsOnlyKeys("U1", "U2", "U3", "U4");
            assertThat(results.get("U1").join())
                    .extracting(Invocation::role)
                    .containsExactly(WorkerRole.QUALITY, WorkerRole.IMPLEMENTATION, WorkerRole.DESIGN);
        }

        @Test
        void shouldCompleteOtherUnitsWhileOneWorkerHangs() throws Exception {
            // given
            config.setInvocationTimeout(Duration.ofSeconds(5));
            config.setInvocationRetries(0);
            CountDownLatch release = new CountDownLatch(1);
            registry.registerDefault((unit, role, payload) -> {
                if (unit.id().equals("U1") && role == WorkerRole.QUALITY) {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return REPORT;
            });
            List<WorkUnit> units =
                    List.of(
                            new WorkUnit("U1", "a", List.of("a/**"), 10, false),
                            new WorkUnit("U2", "b", List.of("b/**"), 10, false));

            // when
            Map<String, CompletableFuture<List<Invocation>>> results =
                    dispatcher().dispatch(units, WorkerRoster.withDefaultWeights(), new CancellationSignal(), RunListener.NOOP);

            // then
            assertThat(results.get("U2").get(2, TimeUnit.SECONDS))
                    .allMatch(i -> i.status() == InvocationStatus.SUCCEEDED);
            assertThat(results.get("U1")).isNotDone();
            release.countDown();
            assertThat(results.get("U1").get(2, TimeUnit.SECONDS)).hasSize(3);
        }

        @Test
        void shouldNotifyListenerOfEveryAttempt() throws Exception {
            AtomicInteger starts = new AtomicInteger();
            AtomicInteger completions = new AtomicInteger();
            registry.registerDefault((unit, role, payload) -> REPORT);
            RunListener listener = new RunListener() {
                @Override
                public void onInvocationStart(WorkUnit unit, WorkerRole role, int attempt) {
                    starts.incrementAndGet();
                }

                @Override
                public void onInvocationComplete(Invocation invocation) {
                    completions.incrementAndGet();
                }
            };

            dispatcher().dispatch(List.of(UNIT), WorkerRoster.withDefaultWeights(), new CancellationSignal(), listener)
                    .get("U1")
                    .get(5, TimeUnit.SECONDS);

            assertThat(starts).hasValue(3);
            assertThat(completions).hasValue(3);
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldFailEveryInvocationOfCancelledRun() throws Exception {
            registry.registerDefault((unit, role, payload) -> REPORT);
            CancellationSignal signal = new CancellationSignal();
            signal.cancel();

            List<Invocation> invocations =
                    dispatcher().dispatch(List.of(UNIT), WorkerRoster.withDefaultWeights(), signal, RunListener.NOOP)
                            .get("U1")
                            .get(5, TimeUnit.SECONDS);

            assertThat(invocations).allSatisfy(i -> {
                assertThat(i.status()).isEqualTo(InvocationStatus.FAILED);
                assertThat(i.failureReason()).isEqualTo(Dispatcher.CANCELLED);
            });
        }

        @Test
        void shouldInterruptInFlightCallOnCancel() throws Exception {
            // given
            config.setInvocationTimeout(Duration.ofSeconds(30));
            CountDownLatch started = new CountDownLatch(1);
            registry.registerWorker(WorkerRole.QUALITY, (unit, role, payload) -> {
                started.countDown();
                sleepQuietly(30_000);
                return REPORT;
            });
            CancellationSignal signal = new CancellationSignal();
            CompletableFuture<Invocation> running =
                    CompletableFuture.supplyAsync(() -> dispatcher().invoke(UNIT, QUALITY, signal, RunListener.NOOP));

            // when
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            signal.cancel();

            // then
            Invocation invocation = running.get(5, TimeUnit.SECONDS);
            assertThat(invocation.status()).isEqualTo(InvocationStatus.FAILED);
            assertThat(invocation.failureReason()).isEqualTo(Dispatcher.CANCELLED);
        }
    }

    @Nested
    class Reapply {

        @Test
        void shouldInvokeWorkerAgainWithSamePayload() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            registry.registerWorker(WorkerRole.QUALITY, (unit, role, payload) -> {
                calls.incrementAndGet();
                assertThat(payload.workUnitId()).isEqualTo("U1");
                return "ignored";
            });

            dispatcher().reapply(UNIT, QUALITY, new CancellationSignal());

            assertThat(calls).hasValue(1);
        }

        @Test
        void shouldPropagateWorkerFailure() {
            registry.registerWorker(WorkerRole.QUALITY, (unit, role, payload) -> {
                throw InvocationException.permanentFailure("disk full");
            });

            assertThatThrownBy(() -> dispatcher().reapply(UNIT, QUALITY, new CancellationSignal()))
                    .isInstanceOf(InvocationException.class)
                    .hasMessage("disk full");
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
