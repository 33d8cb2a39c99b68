package io.quorum.core.verify;

import io.quorum.core.dispatch.CancellationSignal;
import io.quorum.core.worker.InvocationException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Drives each mutation claim through its verification state machine.
///
/// A claim is checked against ground truth. On a mismatch the claimed action is
/// re-applied through the supplied {@link MutationReplay}, the verifier waits a fixed
/// delay, and checks again. After `retryBudget` re-applications without a match the
/// claim is escalated.
///
/// Each ground-truth read runs on the check pool and is bounded by the check timeout.
/// A read that times out or is interrupted by run cancellation counts as a mismatch.
///
/// ### Contracts
/// - A claim verified on the first check is never re-applied and never escalated
/// - The evidence trail holds exactly one entry per ground-truth check
/// - Verification failures never throw; they end in `ESCALATED`
///
/// @implNote Thread-safe. Each call keeps its state on the stack; claims of
/// different units are verified concurrently.
public class MutationVerifier {

    private static final Logger logger = Logger.getLogger(MutationVerifier.class.getName());

    private final GroundTruth groundTruth;
    private final int retryBudget;
    private final Duration delay;
    private final Duration checkTimeout;
    private final ExecutorService checkPool;

    public MutationVerifier(
            GroundTruth groundTruth,
            int retryBudget,
            Duration delay,
            Duration checkTimeout,
            ExecutorService checkPool) {
        this.groundTruth = groundTruth;
        this.retryBudget = retryBudget;
        this.delay = delay;
        this.checkTimeout = checkTimeout;
        this.checkPool = checkPool;
    }

    /// Verifies one claim.
    ///
    /// @param claim the claim to verify, not null
    /// @param replay re-applies the claimed action on mismatch, not null
    /// @param signal run cancellation; a cancelled run stops retrying, not null
    /// @return the terminal result, never null
    public VerificationResult verify(
            MutationClaim claim, MutationReplay replay, CancellationSignal signal) {
        Transitions state = new Transitions(claim);
        List<String> evidence = new ArrayList<>();
        String lastObservation = "";
        String replayFailure = null;
        boolean cancelled = false;
        int maxAttempts = retryBudget + 1;
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            state.moveTo(ClaimState.VERIFYING);
            GroundTruthCheck check = checkSafely(claim, signal);
            lastObservation = check.evidence();

            if (check.satisfied()) {
                evidence.add("attempt " + attempt + ": verified, " + check.evidence());
                state.moveTo(ClaimState.VERIFIED);
                logger.fine("Verified " + claim.describe() + " on attempt " + attempt);
                return new VerificationResult(
                        claim, true, ClaimState.VERIFIED, attempt, evidence, null);
            }

            state.moveTo(ClaimState.MISMATCHED);
            logger.warning("Mismatch on attempt " + attempt + " for " + claim.describe()
                    + ": " + check.evidence());
            String entry = "attempt " + attempt + ": mismatch, " + check.evidence();

            if (attempt == maxAttempts) {
                evidence.add(entry);
                break;
            }
            if (signal.isCancelled() || Thread.currentThread().isInterrupted()) {
                evidence.add(entry + "; run cancelled");
                cancelled = true;
                break;
            }
            try {
                replay.reapply(claim);
            } catch (InvocationException e) {
                replayFailure = e.getMessage();
                entry = entry + "; re-apply failed: " + e.getMessage();
            }
            evidence.add(entry);

            if (!pause()) {
                cancelled = true;
                break;
            }
        }

        state.moveTo(ClaimState.ESCALATED);
        EscalationReport report =
                new EscalationReport(
                        claim,
                        attempt,
                        evidence,
                        diagnose(claim, lastObservation, replayFailure, cancelled));
        logger.warning("Escalating " + claim.describe() + " after " + attempt + " checks");
        return new VerificationResult(claim, false, ClaimState.ESCALATED, attempt, evidence, report);
    }

    private GroundTruthCheck checkSafely(MutationClaim claim, CancellationSignal signal) {
        Future<GroundTruthCheck> read =
                checkPool.submit(() -> groundTruth.check(claim.targetResource(), claim.expectedSignal()));
        signal.track(read);
        try {
            return read.get(checkTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            read.cancel(true);
            return GroundTruthCheck.unsatisfied(
                    "ground truth check timed out after " + checkTimeout.toMillis() + " ms");
        } catch (CancellationException e) {
            return GroundTruthCheck.unsatisfied("ground truth check cancelled");
        } catch (InterruptedException e) {
            read.cancel(true);
            Thread.currentThread().interrupt();
            return GroundTruthCheck.unsatisfied("ground truth check interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                return GroundTruthCheck.unsatisfied("ground truth unavailable: " + cause.getMessage());
            }
            if (cause instanceof IllegalArgumentException) {
                return GroundTruthCheck.unsatisfied("cannot check: " + cause.getMessage());
            }
            return GroundTruthCheck.unsatisfied("ground truth check failed: " + cause);
        } finally {
            signal.untrack(read);
        }
    }

    private boolean pause() {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String diagnose(
            MutationClaim claim, String lastObservation, String replayFailure, boolean cancelled) {
        if (cancelled) {
            return "run cancelled before " + claim.targetResource() + " could be confirmed";
        }
        if (replayFailure != null) {
            return "re-applying the action failed (" + replayFailure + "); last observation: "
                    + lastObservation;
        }
        return "ground truth never showed '" + claim.expectedSignal().asText() + "' for "
                + claim.targetResource() + "; last observation: " + lastObservation;
    }

    /// Guards the claim state machine against illegal transitions.
    private static final class Transitions {
        private final MutationClaim claim;
        private ClaimState current = ClaimState.UNVERIFIED;

        Transitions(MutationClaim claim) {
            this.claim = claim;
        }

        void moveTo(ClaimState next) {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException(
                        "Illegal transition " + current + " -> " + next + " for " + claim.describe());
            }
            current = next;
        }
    }
}
