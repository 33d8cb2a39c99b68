package io.quorum.cli.report;

import io.quorum.core.report.FinalReport;
import io.quorum.serialization.ReportSerializer;
import jakarta.enterprise.context.ApplicationScoped;

/// Writes the report as indented JSON through {@link ReportSerializer}.
@ApplicationScoped
public class JsonReportFormat implements ReportFormat {

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public String render(FinalReport report) {
        return ReportSerializer.toJson(report) + System.lineSeparator();
    }
}
