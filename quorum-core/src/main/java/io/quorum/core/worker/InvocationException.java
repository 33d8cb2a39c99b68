package io.quorum.core.worker;

import java.io.Serial;

/// Raised by a {@link Worker} when an invocation could not produce output.
///
/// Transient failures (rate limits, dropped connections, a busy backend) are
/// retried once by the dispatcher after the configured backoff. Non-transient
/// failures end the invocation as `FAILED` immediately.
public class InvocationException extends Exception {

    @Serial private static final long serialVersionUID = 7731406124470093165L;

    private final boolean transientFailure;

    public InvocationException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public InvocationException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /// Creates a transient failure that is worth one more attempt.
    public static InvocationException transientFailure(String message) {
        return new InvocationException(message, true);
    }

    /// Creates a permanent failure that must not be retried.
    public static InvocationException permanentFailure(String message) {
        return new InvocationException(message, false);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
