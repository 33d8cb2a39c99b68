package io.quorum.core.worker;

import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerRole;

/// An opaque analyst that examines one WorkUnit from one role's perspective.
///
/// Workers are the unit of concurrency in a run. They receive a rendered prompt
/// payload and return free-form text; decoding that text into findings is the
/// job of the result parser, not the worker.
///
/// ### Contracts
/// - **Postcondition**: a normal return yields the raw output, possibly malformed
/// - A failure is signalled with {@link InvocationException}; unexpected runtime
///   exceptions are treated as non-transient failures by the dispatcher
///
/// @implNote Implementations must be thread-safe and should respond to thread
/// interruption, which is how timeouts and cancellation reach them.
@FunctionalInterface
public interface Worker {

    /// Runs one analysis.
    ///
    /// @param unit the unit to analyze, not null
    /// @param role the perspective to take, not null
    /// @param payload the rendered prompt, not null
    /// @return the raw worker output
    /// @throws InvocationException if no output could be produced
    String invoke(WorkUnit unit, WorkerRole role, PromptPayload payload)
            throws InvocationException;
}
