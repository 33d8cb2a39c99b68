package io.quorum.core.worker;

import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerAssignment;

/// Builds the prompt payload for one assignment.
@FunctionalInterface
public interface PromptPayloadFactory {

    PromptPayload create(WorkUnit unit, WorkerAssignment assignment);
}
