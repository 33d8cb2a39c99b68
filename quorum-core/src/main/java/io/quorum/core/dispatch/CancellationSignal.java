package io.quorum.core.dispatch;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Run-level cancellation shared by every task of a run.
///
/// Cancelling interrupts every tracked in-flight worker call. Calls started
/// after cancellation are interrupted as soon as they are tracked.
///
/// @implNote Thread-safe. Cancellation is one-way.
public final class CancellationSignal {

    private static final Logger logger = Logger.getLogger(CancellationSignal.class.getName());

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.warning("Run cancelled, interrupting " + inFlight.size() + " in-flight calls");
            for (Future<?> future : inFlight) {
                future.cancel(true);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// Registers an in-flight call so that {@link #cancel()} interrupts it.
    public void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
