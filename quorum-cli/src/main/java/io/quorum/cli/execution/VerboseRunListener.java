package io.quorum.cli.execution;

import io.quorum.cli.ui.AnsiStyles;
import io.quorum.core.consensus.UnitTally;
import io.quorum.core.dispatch.Invocation;
import io.quorum.core.execution.RunListener;
import io.quorum.core.partition.WorkUnit;
import io.quorum.core.report.FinalReport;
import io.quorum.core.report.UnitOutcome;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.VerificationResult;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/// Run listener that prints progress to the terminal as units are analyzed.
///
/// ### Output Format
/// ```
/// ┌─────────────────────────────────────────────────────────────
///   * PARTITIONED 7 units
///  ─────────────────────────────────────────────────────────────
///   • U1 src/api (412 lines)
/// └─────────────────────────────────────────────────────────────
///   → design@U1 attempt 1
///   ✓ design@U1 succeeded (1 attempt, 2.3s)
///   ✗ quality@U2 timed_out (2 attempts): timed out after 60000 ms
///   ✓ U1 FULL: 3/3 roles, 2 accepted, 1 minority
/// ```
///
/// @implNote Thread-safe. Callbacks arrive from pool threads; each one prints
/// its lines under a lock so lines of different callbacks never interleave.
public class VerboseRunListener implements RunListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseRunListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public synchronized void onPartitioned(List<WorkUnit> units) {
        out.println(styles.separatorTop());
        out.printf("  %s %s %d units%n", styles.accent("*"), styles.bold("PARTITIONED"), units.size());
        out.println(styles.separatorMid());
        for (WorkUnit unit : units) {
            out.printf(
                    "  %s %s %s (%d lines)%s%n",
                    styles.bullet(),
                    styles.bold(unit.id()),
                    unit.label(),
                    unit.estimatedSize(),
                    unit.oversized() ? " " + styles.warn("oversized") : "");
        }
        out.println(styles.separatorBottom());
    }

    @Override
    public synchronized void onInvocationStart(WorkUnit unit, WorkerRole role, int attempt) {
        out.printf("  %s %s attempt %d%n", styles.arrow(), styles.gray(role.id() + "@" + unit.id()), attempt);
    }

    @Override
    public synchronized void onInvocationComplete(Invocation invocation) {
        boolean ok = invocation.isSurviving();
        String status = invocation.status().name().toLowerCase(Locale.ROOT);
        out.printf(
                "  %s %s %s (%d attempt%s, %.1fs)%s%n",
                ok ? styles.checkmark() : styles.crossmark(),
                invocation.role().id() + "@" + invocation.workUnitId(),
                ok ? styles.success(status) : styles.error(status),
                invocation.attemptCount(),
                invocation.attemptCount() == 1 ? "" : "s",
                invocation.elapsed().toMillis() / 1000.0,
                invocation.failureReason() != null ? ": " + invocation.failureReason() : "");
    }

    @Override
    public synchronized void onClaimVerified(VerificationResult result) {
        if (result.verified()) {
            out.printf(
                    "  %s claim %s verified after %d check%s%n",
                    styles.checkmark(),
                    result.claim().describe(),
                    result.attempts(),
                    result.attempts() == 1 ? "" : "s");
        } else {
            out.printf(
                    "  %s claim %s escalated: %s%n",
                    styles.warnmark(),
                    result.claim().describe(),
                    result.escalation().diagnosis());
        }
    }

    @Override
    public synchronized void onUnitFinalized(UnitOutcome outcome) {
        UnitTally tally = outcome.tally();
        String coverage = tally.coverage().name();
        out.printf(
                "  %s %s %s: %d/%d roles, %d accepted, %d minority%n",
                tally.coverage().isCovered() ? styles.checkmark() : styles.warnmark(),
                styles.bold(tally.workUnitId()),
                styles.coverage(tally.coverage(), coverage),
                tally.survivors(),
                tally.rosterSize(),
                tally.accepted().size(),
                tally.minority().size());
    }

    @Override
    public synchronized void onReportBuilt(FinalReport report) {
        out.println();
        out.printf(
                "  %s report built: %d findings, coverage %.1f%%%n",
                styles.accent("*"),
                report.allFindings().size(),
                report.coveragePct() * 100.0);
    }
}
