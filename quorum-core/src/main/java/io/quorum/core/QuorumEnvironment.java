package io.quorum.core;

import io.quorum.core.dispatch.Dispatcher;
import io.quorum.core.execution.AnalysisCoordinator;
import io.quorum.core.partition.WorkUnitPartitioner;
import io.quorum.core.roster.WorkerRoster;
import io.quorum.core.worker.WorkerRegistry;
import java.util.List;
import java.util.concurrent.ExecutorService;

/// Container for the fully wired components of an analysis run.
///
/// Created by {@link QuorumFactory}. Owns the thread pools and shuts them down on
/// {@link #close()}.
///
/// @implNote Thread-safe once built. One environment may run several analyses in sequence.
public final class QuorumEnvironment implements AutoCloseable {

    private final QuorumConfig config;
    private final WorkUnitPartitioner partitioner;
    private final WorkerRoster roster;
    private final WorkerRegistry workerRegistry;
    private final Dispatcher dispatcher;
    private final AnalysisCoordinator coordinator;
    private final List<ExecutorService> executors;

    QuorumEnvironment(
            QuorumConfig config,
            WorkUnitPartitioner partitioner,
            WorkerRoster roster,
            WorkerRegistry workerRegistry,
            Dispatcher dispatcher,
            AnalysisCoordinator coordinator,
            List<ExecutorService> executors) {
        this.config = config;
        this.partitioner = partitioner;
        this.roster = roster;
        this.workerRegistry = workerRegistry;
        this.dispatcher = dispatcher;
        this.coordinator = coordinator;
        this.executors = List.copyOf(executors);
    }

    public QuorumConfig getConfig() {
        return config;
    }

    public WorkUnitPartitioner getPartitioner() {
        return partitioner;
    }

    public WorkerRoster getRoster() {
        return roster;
    }

    public WorkerRegistry getWorkerRegistry() {
        return workerRegistry;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public AnalysisCoordinator getCoordinator() {
        return coordinator;
    }

    /// Shuts down the pools.
    ///
    /// @apiNote **Side effects**: worker calls still running are interrupted.
    @Override
    public void close() {
        for (ExecutorService executor : executors) {
            executor.shutdownNow();
        }
    }
}
