package io.quorum.core.report;

import io.quorum.core.dispatch.InvocationStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/// Timing and counters of one run.
public record RunStatistics(
        Instant startedAt,
        Instant finishedAt,
        Duration duration,
        int unitCount,
        int invocationCount,
        Map<InvocationStatus, Integer> invocationsByStatus,
        int claimsVerified,
        int claimsEscalated) {}
