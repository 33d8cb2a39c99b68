package io.quorum.core.execution;

import io.quorum.core.consensus.ConsensusAggregator;
import io.quorum.core.consensus.UnitTally;
import io.quorum.core.dispatch.CancellationSignal;
import io.quorum.core.dispatch.Dispatcher;
import io.quorum.core.dispatch.Invocation;
import io.quorum.core.exception.AnalysisAbortedException;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.partition.CorpusDescription;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.partition.WorkUnitPartitioner;
import io.quorum.core.report.FinalReport;
import io.quorum.core.report.ReportSynthesizer;
import io.quorum.core.report.UnitOutcome;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.roster.WorkerRoster;
import io.quorum.core.verify.MutationClaim;
import io.quorum.core.verify.MutationVerifier;
import io.quorum.core.verify.VerificationResult;
import io.quorum.core.worker.WorkerRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Runs one analysis from corpus to final report.
///
/// ### Pipeline
/// 1. Partition the corpus into WorkUnits
/// 2. Dispatch every (unit, role) pair
/// 3. As soon as all invocations of a unit are terminal, finalize that unit on its own
///    task: verify its mutation claims, then aggregate its votes
/// 4. Once every unit is finalized, synthesize the report
///
/// A unit's records are only touched by the task that finalizes it, so units never
/// contend with each other. Failures local to a unit never abort the run; only a
/// configuration error or a run where no unit reached two surviving roles does.
///
/// @see RunListener for progress callbacks
public class AnalysisCoordinator {

    private static final Logger logger = Logger.getLogger(AnalysisCoordinator.class.getName());

    private final WorkUnitPartitioner partitioner;
    private final WorkerRoster roster;
    private final WorkerRegistry workerRegistry;
    private final Dispatcher dispatcher;
    private final MutationVerifier verifier;
    private final ConsensusAggregator aggregator;
    private final ReportSynthesizer synthesizer;
    private final ExecutorService finalizerPool;

    public AnalysisCoordinator(
            WorkUnitPartitioner partitioner,
            WorkerRoster roster,
            WorkerRegistry workerRegistry,
            Dispatcher dispatcher,
            MutationVerifier verifier,
            ConsensusAggregator aggregator,
            ReportSynthesizer synthesizer,
            ExecutorService finalizerPool) {
        this.partitioner = partitioner;
        this.roster = roster;
        this.workerRegistry = workerRegistry;
        this.dispatcher = dispatcher;
        this.verifier = verifier;
        this.aggregator = aggregator;
        this.synthesizer = synthesizer;
        this.finalizerPool = finalizerPool;
    }

    public FinalReport run(CorpusDescription corpus)
            throws ConfigurationException, AnalysisAbortedException {
        return run(corpus, RunListener.NOOP, new CancellationSignal());
    }

    /// Runs the analysis.
    ///
    /// @param corpus the corpus to analyze, not null
    /// @param listener progress callbacks, not null
    /// @param signal run cancellation; cancelled runs still return a report, not null
    /// @return the final report, never null
    /// @throws ConfigurationException if the corpus is empty or a role has no worker
    /// @throws AnalysisAbortedException if no unit reached two surviving roles
    public FinalReport run(CorpusDescription corpus, RunListener listener, CancellationSignal signal)
            throws ConfigurationException, AnalysisAbortedException {
        Instant startedAt = Instant.now();
        List<WorkUnit> units = partitioner.partition(corpus);
        requireWorkers(units);
        listener.onPartitioned(units);
        logger.info("Starting analysis of '" + corpus.name() + "' over " + units.size() + " units");

        Map<String, CompletableFuture<List<Invocation>>> dispatched =
                dispatcher.dispatch(units, roster, signal, listener);

        List<CompletableFuture<UnitOutcome>> finalized = new ArrayList<>(units.size());
        for (WorkUnit unit : units) {
            finalized.add(
                    dispatched
                            .get(unit.id())
                            .thenApplyAsync(
                                    invocations -> finalizeUnit(unit, invocations, signal, listener),
                                    finalizerPool)
                            .exceptionally(
                                    error -> {
                                        logger.severe("Finalizing unit " + unit.id()
                                                + " failed: " + error);
                                        return new UnitOutcome(
                                                unit,
                                                List.of(),
                                                UnitTally.skipped(unit.id(), roster.rosterFor(unit).size()),
                                                List.of());
                                    }));
        }

        awaitAll(finalized, signal);
        List<UnitOutcome> outcomes = new ArrayList<>(units.size());
        for (CompletableFuture<UnitOutcome> future : finalized) {
            outcomes.add(future.join());
        }

        FinalReport report = synthesizer.synthesize(corpus.name(), outcomes, startedAt, Instant.now());
        listener.onReportBuilt(report);

        boolean anyCovered = outcomes.stream().anyMatch(o -> o.tally().coverage().isCovered());
        if (!anyCovered) {
            logger.severe("No unit of '" + corpus.name() + "' reached two surviving roles, aborting");
            throw new AnalysisAbortedException(
                    "No work unit reached minimum coverage (" + units.size() + " units analyzed)",
                    report);
        }
        return report;
    }

    private void requireWorkers(List<WorkUnit> units) throws ConfigurationException {
        for (WorkUnit unit : units) {
            for (WorkerAssignment assignment : roster.rosterFor(unit)) {
                WorkerRole role = assignment.role();
                if (!workerRegistry.hasWorker(role)) {
                    throw new ConfigurationException("No worker registered for role " + role.id());
                }
            }
        }
    }

    private static void awaitAll(List<CompletableFuture<UnitOutcome>> futures, CancellationSignal signal) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get();
        } catch (InterruptedException e) {
            // Cancel so every outstanding invocation ends quickly, then collect what exists
            signal.cancel();
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.severe("Unexpected failure while awaiting units: " + e.getCause());
        }
    }

    UnitOutcome finalizeUnit(
            WorkUnit unit, List<Invocation> invocations, CancellationSignal signal, RunListener listener) {
        List<VerificationResult> verifications = new ArrayList<>();
        for (Invocation invocation : invocations) {
            if (!invocation.isSurviving()) {
                continue;
            }
            WorkerAssignment assignment =
                    new WorkerAssignment(
                            unit.id(),
                            invocation.role(),
                            invocation.voteWeight(),
                            invocation.role().isOversizedOnly());
            for (MutationClaim claim : invocation.parsedOutput().claims()) {
                VerificationResult result =
                        verifier.verify(
                                claim, c -> dispatcher.reapply(unit, assignment, signal), signal);
                verifications.add(result);
                listener.onClaimVerified(result);
            }
        }

        UnitTally tally = aggregator.aggregate(unit.id(), roster.rosterFor(unit).size(), invocations);
        UnitOutcome outcome = new UnitOutcome(unit, invocations, tally, verifications);
        logger.info(
                "Unit " + unit.id() + " (" + unit.label() + ") finalized: " + tally.coverage()
                        + ", " + tally.accepted().size() + " accepted, "
                        + tally.minority().size() + " minority");
        listener.onUnitFinalized(outcome);
        return outcome;
    }
}
