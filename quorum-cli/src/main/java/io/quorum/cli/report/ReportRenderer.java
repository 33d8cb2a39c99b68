package io.quorum.cli.report;

import io.quorum.core.report.FinalReport;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Registry of the available {@link ReportFormat}s.
///
/// @implNote Thread-safe after construction. The format map is never modified.
@ApplicationScoped
public class ReportRenderer {

    private final Map<String, ReportFormat> formats;

    @Inject
    public ReportRenderer(Instance<ReportFormat> formatInstances) {
        this(formatInstances.stream().toList());
    }

    public ReportRenderer(List<ReportFormat> formats) {
        this.formats =
                formats.stream()
                        .collect(
                                Collectors.toMap(
                                        ReportFormat::getName,
                                        Function.identity(),
                                        (a, b) -> a,
                                        TreeMap::new));
    }

    /// Renders the report in the named format.
    ///
    /// @throws IllegalArgumentException if no format has that name
    public String render(FinalReport report, String formatName) {
        ReportFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(report);
    }

    public Set<String> getAvailableFormats() {
        return formats.keySet();
    }
}
