package io.quorum.core.verify;

import io.quorum.core.worker.InvocationException;

/// Re-applies the action behind a claim, typically by re-invoking the same worker
/// with the same payload.
@FunctionalInterface
public interface MutationReplay {

    void reapply(MutationClaim claim) throws InvocationException;
}
