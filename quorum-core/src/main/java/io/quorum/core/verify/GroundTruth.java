package io.quorum.core.verify;

import java.io.IOException;

/// Authoritative, read-only view of the resources workers claim to change.
///
/// ### Contracts
/// - Checks are idempotent and free of side effects
/// - The store is never locked; it may change between two checks
///
/// @see FileSystemGroundTruth
/// @see CompositeGroundTruth
public interface GroundTruth {

    /// Reads `targetResource` and tests it against `signal`.
    ///
    /// @param targetResource the resource named in the claim, not null
    /// @param signal what should be observed, not null
    /// @return the check outcome with evidence, never null
    /// @throws IOException if the authoritative store could not be read
    GroundTruthCheck check(String targetResource, ExpectedSignal signal) throws IOException;

    /// Returns whether this ground truth can evaluate signals of the given kind.
    default boolean supports(ExpectedSignal.Kind kind) {
        return true;
    }
}
