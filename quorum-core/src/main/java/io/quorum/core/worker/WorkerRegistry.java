package io.quorum.core.worker;

import io.quorum.core.roster.WorkerRole;
import java.util.Optional;

/// Maps roles to the workers that serve them.
///
/// @implNote Implementations must be thread-safe. Lookups happen from the
/// dispatch pool while the run is in progress.
///
/// @see DefaultWorkerRegistry
public interface WorkerRegistry {

    /// Returns the worker for a role, falling back to the default worker if one is set.
    Optional<Worker> getWorker(WorkerRole role);

    /// Registers a worker for a single role, replacing any previous one.
    void registerWorker(WorkerRole role, Worker worker);

    /// Registers a worker that serves every role without a dedicated worker.
    void registerDefault(Worker worker);

    boolean hasWorker(WorkerRole role);
}
