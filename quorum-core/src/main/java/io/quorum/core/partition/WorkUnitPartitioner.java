package io.quorum.core.partition;

import io.quorum.core.exception.ConfigurationException;
import java.util.List;

/// Splits a corpus into disjoint WorkUnits.
///
/// Implementations must be deterministic: the same corpus yields the same units,
/// in the same order, with the same identifiers.
@FunctionalInterface
public interface WorkUnitPartitioner {

    /// @param corpus the corpus to split, not null
    /// @return at least one unit, in a stable order
    /// @throws ConfigurationException if the corpus is empty or cannot be split
    List<WorkUnit> partition(CorpusDescription corpus) throws ConfigurationException;
}
