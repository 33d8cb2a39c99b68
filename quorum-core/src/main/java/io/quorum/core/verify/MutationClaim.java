package io.quorum.core.verify;

import io.quorum.core.roster.WorkerRole;
import java.util.Objects;

/// A worker's assertion that it changed an external resource.
///
/// Claims are never trusted as reported. Each one is checked against ground truth
/// before its invocation's findings are aggregated.
///
/// @param workUnitId unit of the claiming invocation, not null
/// @param role role of the claiming invocation, not null
/// @param targetResource the resource said to have changed, not blank
/// @param expectedSignal what ground truth should show, not null
public record MutationClaim(
        String workUnitId, WorkerRole role, String targetResource, ExpectedSignal expectedSignal) {

    public MutationClaim {
        Objects.requireNonNull(workUnitId, "workUnitId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(expectedSignal, "expectedSignal must not be null");
        if (targetResource == null || targetResource.isBlank()) {
            throw new IllegalArgumentException("targetResource must not be blank");
        }
        targetResource = targetResource.trim();
    }

    public String describe() {
        return role.id() + "@" + workUnitId + " -> " + targetResource + " [" + expectedSignal.asText() + "]";
    }
}
