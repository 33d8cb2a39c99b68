package io.quorum.core.worker;

import io.quorum.core.roster.WorkerRole;
import java.util.Objects;

/// The rendered instructions handed to a worker.
///
/// Re-applying a claimed mutation reuses the payload of the original invocation.
///
/// @param workUnitId the unit being analyzed, not null
/// @param role the role being played, not null
/// @param text the rendered prompt, not null
public record PromptPayload(String workUnitId, WorkerRole role, String text) {

    public PromptPayload {
        Objects.requireNonNull(workUnitId, "workUnitId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
