package io.quorum.core.dispatch;

import io.quorum.core.QuorumConfig;
import io.quorum.core.execution.RunListener;
import io.quorum.core.parse.MalformedOutputException;
import io.quorum.core.parse.ParsedOutput;
import io.quorum.core.parse.ResultParser;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRoster;
import io.quorum.core.worker.InvocationException;
import io.quorum.core.worker.PromptPayload;
import io.quorum.core.worker.PromptPayloadFactory;
import io.quorum.core.worker.Worker;
import io.quorum.core.worker.WorkerRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Issues one asynchronous invocation per (WorkUnit, role) pair.
///
/// ### Execution model
/// Each pair runs as a task on the dispatch pool, whose size is the concurrency limit.
/// The task submits the worker call to a separate call pool and waits for it with the
/// invocation timeout, so a hung worker only ever holds its own task.
///
/// ### Retry policy
/// A timeout or a transient {@link InvocationException} is retried after the backoff,
/// up to `invocationRetries` times. Non-transient failures and unexpected runtime
/// exceptions end the invocation immediately.
///
/// ### Guarantees
/// - No invocation blocks another from completing
/// - Every pair ends with exactly one terminal status
/// - Cancellation ends pending and in-flight invocations as `FAILED`
///
/// @implNote The pools are owned by the caller and are not shut down here.
public class Dispatcher {

    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    static final String CANCELLED = "run cancelled";

    private final QuorumConfig config;
    private final WorkerRegistry workerRegistry;
    private final PromptPayloadFactory payloadFactory;
    private final ResultParser resultParser;
    private final ExecutorService dispatchPool;
    private final ExecutorService callPool;

    public Dispatcher(
            QuorumConfig config,
            WorkerRegistry workerRegistry,
            PromptPayloadFactory payloadFactory,
            ResultParser resultParser,
            ExecutorService dispatchPool,
            ExecutorService callPool) {
        this.config = config;
        this.workerRegistry = workerRegistry;
        this.payloadFactory = payloadFactory;
        this.resultParser = resultParser;
        this.dispatchPool = dispatchPool;
        this.callPool = callPool;
    }

    /// Dispatches the full cross-product of units and their rosters.
    ///
    /// @param units the units to analyze, not null
    /// @param roster the roster, not null
    /// @param signal run cancellation, not null
    /// @param listener progress callbacks, not null
    /// @return per unit, in input order, a future of its terminal invocations in roster order
    public Map<String, CompletableFuture<List<Invocation>>> dispatch(
            List<WorkUnit> units,
            WorkerRoster roster,
            CancellationSignal signal,
            RunListener listener) {
        Map<String, CompletableFuture<List<Invocation>>> byUnit = new LinkedHashMap<>();
        int total = 0;
        for (WorkUnit unit : units) {
            List<CompletableFuture<Invocation>> futures = new ArrayList<>();
            for (WorkerAssignment assignment : roster.rosterFor(unit)) {
                futures.add(submit(unit, assignment, signal, listener));
                total++;
            }
            byUnit.put(unit.id(), joinAll(futures));
        }
        logger.info(
                "Dispatched " + total + " invocations over " + units.size()
                        + " units (concurrency limit " + config.getConcurrencyLimit() + ")");
        return byUnit;
    }

    private CompletableFuture<Invocation> submit(
            WorkUnit unit, WorkerAssignment assignment, CancellationSignal signal, RunListener listener) {
        return CompletableFuture.supplyAsync(
                        () -> invoke(unit, assignment, signal, listener), dispatchPool)
                .exceptionally(
                        error -> {
                            logger.severe("Dispatch task for " + assignment.role().id() + "@"
                                    + unit.id() + " crashed: " + error);
                            return Invocation.ended(
                                    assignment,
                                    InvocationStatus.FAILED,
                                    0,
                                    null,
                                    "dispatch task crashed: " + error.getMessage(),
                                    Duration.ZERO);
                        })
                .whenComplete(
                        (invocation, error) -> {
                            if (invocation != null) {
                                listener.onInvocationComplete(invocation);
                            }
                        });
    }

    private static CompletableFuture<List<Invocation>> joinAll(
            List<CompletableFuture<Invocation>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(
                        ignored -> {
                            List<Invocation> results = new ArrayList<>(futures.size());
                            for (CompletableFuture<Invocation> future : futures) {
                                results.add(future.join());
                            }
                            return results;
                        });
    }

    /// Runs one pair to a terminal status, including its retry.
    Invocation invoke(
            WorkUnit unit, WorkerAssignment assignment, CancellationSignal signal, RunListener listener) {
        Instant start = Instant.now();
        String key = assignment.role().id() + "@" + unit.id();

        Optional<Worker> worker = workerRegistry.getWorker(assignment.role());
        if (worker.isEmpty()) {
            return Invocation.ended(
                    assignment, InvocationStatus.FAILED, 0, null,
                    "no worker registered for role " + assignment.role().id(), Duration.ZERO);
        }
        PromptPayload payload = payloadFactory.create(unit, assignment);

        int maxAttempts = 1 + config.getInvocationRetries();
        int attempts = 0;
        InvocationStatus lastStatus = InvocationStatus.FAILED;
        String lastReason = null;

        while (attempts < maxAttempts) {
            if (signal.isCancelled()) {
                return ended(assignment, InvocationStatus.FAILED, attempts, null, CANCELLED, start);
            }
            attempts++;
            listener.onInvocationStart(unit, assignment.role(), attempts);

            Future<String> call = callPool.submit(() -> worker.get().invoke(unit, assignment.role(), payload));
            signal.track(call);
            try {
                String raw = call.get(config.getInvocationTimeout().toMillis(), TimeUnit.MILLISECONDS);
                return parse(assignment, attempts, raw, start);
            } catch (TimeoutException e) {
                call.cancel(true);
                lastStatus = InvocationStatus.TIMED_OUT;
                lastReason = "timed out after " + config.getInvocationTimeout().toMillis() + " ms";
                logger.warning("Invocation " + key + " " + lastReason + " (attempt " + attempts + ")");
            } catch (CancellationException e) {
                return ended(assignment, InvocationStatus.FAILED, attempts, null, CANCELLED, start);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                lastStatus = InvocationStatus.FAILED;
                lastReason = cause.getMessage() != null ? cause.getMessage() : cause.toString();
                if (cause instanceof InvocationException ie && ie.isTransient()) {
                    logger.warning("Transient failure of " + key + ": " + lastReason
                            + " (attempt " + attempts + ")");
                } else {
                    logger.warning("Invocation " + key + " failed: " + lastReason);
                    return ended(assignment, InvocationStatus.FAILED, attempts, null, lastReason, start);
                }
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                return ended(assignment, InvocationStatus.FAILED, attempts, null, CANCELLED, start);
            } finally {
                signal.untrack(call);
            }

            if (attempts < maxAttempts && !backoff()) {
                return ended(assignment, InvocationStatus.FAILED, attempts, null, CANCELLED, start);
            }
        }

        return ended(assignment, lastStatus, attempts, null, lastReason, start);
    }

    private Invocation parse(WorkerAssignment assignment, int attempts, String raw, Instant start) {
        Duration elapsed = Duration.between(start, Instant.now());
        try {
            ParsedOutput parsed = resultParser.parse(raw, assignment.workUnitId(), assignment.role());
            return Invocation.succeeded(assignment, attempts, raw, parsed, elapsed);
        } catch (MalformedOutputException e) {
            logger.warning("Malformed output: " + e.getMessage());
            return Invocation.ended(
                    assignment, InvocationStatus.MALFORMED, attempts, raw, e.getMessage(), elapsed);
        }
    }

    private static Invocation ended(
            WorkerAssignment assignment,
            InvocationStatus status,
            int attempts,
            String raw,
            String reason,
            Instant start) {
        return Invocation.ended(
                assignment, status, attempts, raw, reason, Duration.between(start, Instant.now()));
    }

    private boolean backoff() {
        long millis = config.getRetryBackoff().toMillis();
        if (millis == 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /// Re-invokes the worker behind a claim with the payload of the original invocation.
    ///
    /// The output is discarded; only ground truth decides whether the action took effect.
    ///
    /// @throws InvocationException if the call fails, times out or the run is cancelled
    public void reapply(WorkUnit unit, WorkerAssignment assignment, CancellationSignal signal)
            throws InvocationException {
        Worker worker =
                workerRegistry
                        .getWorker(assignment.role())
                        .orElseThrow(() -> InvocationException.permanentFailure(
                                "no worker registered for role " + assignment.role().id()));
        PromptPayload payload = payloadFactory.create(unit, assignment);
        Future<String> call = callPool.submit(() -> worker.invoke(unit, assignment.role(), payload));
        signal.track(call);
        try {
            call.get(config.getInvocationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw InvocationException.transientFailure("re-apply timed out");
        } catch (CancellationException e) {
            throw InvocationException.permanentFailure(CANCELLED);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof InvocationException ie) {
                throw ie;
            }
            throw new InvocationException("re-apply failed: " + e.getCause(), false, e.getCause());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw InvocationException.permanentFailure(CANCELLED);
        } finally {
            signal.untrack(call);
        }
    }
}
