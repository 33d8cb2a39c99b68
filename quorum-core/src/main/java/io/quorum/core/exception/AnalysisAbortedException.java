package io.quorum.core.exception;

import io.quorum.core.report.FinalReport;
import java.io.Serial;

/// Thrown when a run finishes without a single WorkUnit reaching minimum coverage.
///
/// The run is considered failed as a whole, but everything collected so far is kept:
/// the best-effort report is attached and can still be rendered for the operator.
public class AnalysisAbortedException extends Exception {

    @Serial private static final long serialVersionUID = -2210937744189506152L;

    private final transient FinalReport partialReport;

    public AnalysisAbortedException(String message, FinalReport partialReport) {
        super(message);
        this.partialReport = partialReport;
    }

    /// Returns the report built from whatever the run managed to collect.
    ///
    /// @return the best-effort report, never null
    public FinalReport getPartialReport() {
        return partialReport;
    }
}
