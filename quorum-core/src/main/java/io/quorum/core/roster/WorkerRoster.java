package io.quorum.core.roster;

import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.partition.WorkUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Decides which roles examine each WorkUnit and with which weight.
///
/// Every unit gets `QUALITY`, `IMPLEMENTATION` and `DESIGN`. Units flagged as
/// oversized additionally get `COMPLEXITY`. Assignments are returned in role
/// declaration order, which keeps downstream aggregation deterministic.
public class WorkerRoster {

    private final Map<WorkerRole, Double> weights;

    private WorkerRoster(Map<WorkerRole, Double> weights) {
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    /// Creates a roster with the default role weights.
    public static WorkerRoster withDefaultWeights() {
        Map<WorkerRole, Double> weights = new EnumMap<>(WorkerRole.class);
        for (WorkerRole role : WorkerRole.values()) {
            weights.put(role, role.getDefaultWeight());
        }
        return new WorkerRoster(weights);
    }

    /// Creates a roster from explicit weights.
    ///
    /// @param weights a weight for every role, not null
    /// @return the roster, never null
    /// @throws ConfigurationException if a role is missing or a weight is not a positive number
    public static WorkerRoster create(Map<WorkerRole, Double> weights)
            throws ConfigurationException {
        for (WorkerRole role : WorkerRole.values()) {
            Double weight = weights.get(role);
            if (weight == null) {
                throw new ConfigurationException("No weight configured for role " + role.id());
            }
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw new ConfigurationException(
                        "Weight for role " + role.id() + " must be positive, was " + weight);
            }
        }
        return new WorkerRoster(weights);
    }

    /// Returns the assignments for a single unit.
    public List<WorkerAssignment> rosterFor(WorkUnit unit) {
        List<WorkerAssignment> assignments = new ArrayList<>(WorkerRole.values().length);
        for (WorkerRole role : WorkerRole.values()) {
            if (role.isOversizedOnly() && !unit.oversized()) {
                continue;
            }
            assignments.add(
                    new WorkerAssignment(unit.id(), role, weights.get(role), role.isOversizedOnly()));
        }
        return assignments;
    }

    /// Returns the assignments for every unit, grouped by unit in input order.
    public List<WorkerAssignment> assignments(List<WorkUnit> units) {
        List<WorkerAssignment> all = new ArrayList<>();
        for (WorkUnit unit : units) {
            all.addAll(rosterFor(unit));
        }
        return all;
    }

    public double weightOf(WorkerRole role) {
        return weights.get(role);
    }

    public Map<WorkerRole, Double> getWeights() {
        return weights;
    }
}
