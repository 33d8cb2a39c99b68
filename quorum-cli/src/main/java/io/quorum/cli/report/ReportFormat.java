package io.quorum.cli.report;

import io.quorum.core.report.FinalReport;

/// Strategy interface for writing a {@link FinalReport} in a given output format.
///
/// Implementations are discovered via CDI and looked up by name in {@link ReportRenderer}.
///
/// ### Built-in Formats
/// - `markdown` - human-readable report ({@link MarkdownReportFormat})
/// - `json` - machine-readable report ({@link JsonReportFormat})
public interface ReportFormat {

    /// @return format name used for CLI selection, never null
    String getName();

    /// Renders the report.
    ///
    /// @param report the report to render, not null
    /// @return the rendered document, never null
    String render(FinalReport report);
}
