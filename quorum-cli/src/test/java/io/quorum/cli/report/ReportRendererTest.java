package io.quorum.cli.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quorum.core.report.FinalReport;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReportRendererTest {

    private final ReportRenderer renderer =
            new ReportRenderer(List.of(new MarkdownReportFormat(), new JsonReportFormat()));

    @Test
    void shouldListRegisteredFormats() {
        assertThat(renderer.getAvailableFormats()).containsExactly("json", "markdown");
    }

    @Test
    void shouldRenderJsonThroughSerializer() {
        FinalReport report = MarkdownReportFormatTest.sampleReport(null);

        String json = renderer.render(report, "json");

        assertThat(json)
                .startsWith("{")
                .contains("\"corpusName\" : \"shop\"")
                .contains("\"description\" : \"hard-coded admin password\"")
                .endsWith("}" + System.lineSeparator());
    }

    @Test
    void shouldRejectUnknownFormat() {
        FinalReport report = MarkdownReportFormatTest.sampleReport(null);

        assertThatThrownBy(() -> renderer.render(report, "html"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported format: html. Available: json, markdown");
    }
}
