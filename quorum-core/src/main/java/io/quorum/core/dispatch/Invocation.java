package io.quorum.core.dispatch;

import io.quorum.core.parse.ParsedOutput;
import io.quorum.core.roster.WorkerAssignment;
import io.quorum.core.roster.WorkerRole;
import java.time.Duration;
import java.util.Objects;

/// The record of one worker invocation.
///
/// Terminal records are produced once by the dispatcher and never change.
///
/// @param workUnitId the unit analyzed, not null
/// @param role the role played, not null
/// @param voteWeight the role's weight on this unit
/// @param status lifecycle status, not null
/// @param attemptCount attempts made, including the retry
/// @param rawOutput last raw output, null if the worker produced none
/// @param parsedOutput decoded output, set only for `SUCCEEDED`
/// @param failureReason why the invocation did not succeed, null for `SUCCEEDED`
/// @param elapsed wall-clock time across all attempts
public record Invocation(
        String workUnitId,
        WorkerRole role,
        double voteWeight,
        InvocationStatus status,
        int attemptCount,
        String rawOutput,
        ParsedOutput parsedOutput,
        String failureReason,
        Duration elapsed) {

    public Invocation {
        Objects.requireNonNull(workUnitId, "workUnitId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status == InvocationStatus.SUCCEEDED && parsedOutput == null) {
            throw new IllegalArgumentException("a succeeded invocation needs parsed output");
        }
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static Invocation pending(WorkerAssignment assignment) {
        return new Invocation(
                assignment.workUnitId(),
                assignment.role(),
                assignment.voteWeight(),
                InvocationStatus.PENDING,
                0,
                null,
                null,
                null,
                Duration.ZERO);
    }

    public static Invocation succeeded(
            WorkerAssignment assignment,
            int attempts,
            String rawOutput,
            ParsedOutput parsed,
            Duration elapsed) {
        return new Invocation(
                assignment.workUnitId(),
                assignment.role(),
                assignment.voteWeight(),
                InvocationStatus.SUCCEEDED,
                attempts,
                rawOutput,
                parsed,
                null,
                elapsed);
    }

    /// Creates a terminal record for an invocation that did not succeed.
    public static Invocation ended(
            WorkerAssignment assignment,
            InvocationStatus status,
            int attempts,
            String rawOutput,
            String reason,
            Duration elapsed) {
        if (!status.isTerminal() || status == InvocationStatus.SUCCEEDED) {
            throw new IllegalArgumentException("not a failure status: " + status);
        }
        return new Invocation(
                assignment.workUnitId(),
                assignment.role(),
                assignment.voteWeight(),
                status,
                attempts,
                rawOutput,
                null,
                reason,
                elapsed);
    }

    public boolean isSurviving() {
        return status.isSurviving();
    }

    public String key() {
        return role.id() + "@" + workUnitId;
    }
}
