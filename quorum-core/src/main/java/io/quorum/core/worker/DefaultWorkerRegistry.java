package io.quorum.core.worker;

import io.quorum.core.roster.WorkerRole;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Thread-safe {@link WorkerRegistry} backed by a concurrent map.
public class DefaultWorkerRegistry implements WorkerRegistry {

    private static final Logger logger = Logger.getLogger(DefaultWorkerRegistry.class.getName());

    private final Map<WorkerRole, Worker> workers = new ConcurrentHashMap<>();
    private volatile Worker defaultWorker;

    public DefaultWorkerRegistry() {}

    /// Creates a registry where one worker serves every role.
    public static DefaultWorkerRegistry withDefault(Worker worker) {
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry();
        registry.registerDefault(worker);
        return registry;
    }

    @Override
    public Optional<Worker> getWorker(WorkerRole role) {
        Objects.requireNonNull(role, "role must not be null");
        Worker worker = workers.get(role);
        return Optional.ofNullable(worker != null ? worker : defaultWorker);
    }

    @Override
    public void registerWorker(WorkerRole role, Worker worker) {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(worker, "worker must not be null");
        workers.put(role, worker);
        logger.fine("Registered worker for role: " + role.id());
    }

    @Override
    public void registerDefault(Worker worker) {
        this.defaultWorker = Objects.requireNonNull(worker, "worker must not be null");
    }

    @Override
    public boolean hasWorker(WorkerRole role) {
        return workers.containsKey(role) || defaultWorker != null;
    }
}
