package io.quorum.core.dispatch;

/// Lifecycle of a single (WorkUnit, role) invocation.
///
/// `PENDING -> RUNNING -> {SUCCEEDED | TIMED_OUT | FAILED | MALFORMED}`
public enum InvocationStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    TIMED_OUT,
    FAILED,
    MALFORMED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /// Only successful invocations vote.
    public boolean isSurviving() {
        return this == SUCCEEDED;
    }
}
