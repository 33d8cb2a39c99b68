package io.quorum.core.parse;

import io.quorum.core.consensus.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Decodes reports that group findings under severity headers.
///
/// {@snippet :
/// ## Critical
/// - `src/db.py:42` - SQL built by string concatenation. Fix: use bound parameters
///
/// ### 🔴 BLOCKING (1)
/// - **sql-injection**: query built from user input (`src/api.py:10`)
/// }
///
/// Items under a header without a severity word are ignored. An indented
/// `Fix:` line attaches a recommendation to the item above it.
public class SectionHeaderDecoder implements OutputDecoder {

    private static final Pattern MARKDOWN_HEADER = Pattern.compile("^\\s*#{1,6}\\s*(.+?)\\s*:?\\s*$");
    private static final Pattern BOLD_HEADER = Pattern.compile("^\\s*\\*\\*(.+?):?\\*\\*\\s*:?\\s*$");
    private static final Pattern PLAIN_HEADER =
            Pattern.compile("^\\s*([A-Za-z]+(?:\\s+[A-Za-z]+){0,3})\\s*(?:\\(\\d+\\))?\\s*:\\s*$");
    private static final Pattern ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(.+)$");
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");

    @Override
    public String name() {
        return "sections";
    }

    @Override
    public Optional<DecodedOutput> decode(String rawOutput) {
        List<ReportedFinding> findings = new ArrayList<>();
        List<ReportedMutation> mutations = new ArrayList<>();
        Severity current = null;
        boolean sawSeverityHeader = false;

        for (String line : rawOutput.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Optional<ReportedMutation> mutation = ReportText.mutationLine(line);
            if (mutation.isPresent()) {
                mutations.add(mutation.get());
                continue;
            }
            Optional<String> header = headerText(line);
            if (header.isPresent()) {
                current = severityIn(header.get()).orElse(null);
                sawSeverityHeader |= current != null;
                continue;
            }
            Optional<String> fix = ReportText.recommendationLine(line);
            if (fix.isPresent() && !findings.isEmpty()) {
                int last = findings.size() - 1;
                ReportedFinding previous = findings.get(last);
                if (previous.recommendation() == null || previous.recommendation().isBlank()) {
                    findings.set(last, previous.withRecommendation(fix.get()));
                }
                continue;
            }
            Matcher item = ITEM.matcher(line);
            if (current != null && item.matches()) {
                ReportedFinding finding = ReportText.toFinding(current, item.group(1));
                if (finding.isWellFormed()) {
                    findings.add(finding);
                }
            }
        }

        if (!sawSeverityHeader) {
            return Optional.empty();
        }
        return Optional.of(
                new DecodedOutput(findings, ReportText.healthScore(rawOutput), mutations, false));
    }

    private static Optional<String> headerText(String line) {
        Matcher markdown = MARKDOWN_HEADER.matcher(line);
        if (markdown.matches()) {
            return Optional.of(markdown.group(1));
        }
        Matcher bold = BOLD_HEADER.matcher(line);
        if (bold.matches()) {
            return Optional.of(bold.group(1));
        }
        Matcher plain = PLAIN_HEADER.matcher(line);
        if (plain.matches()) {
            return Optional.of(plain.group(1));
        }
        return Optional.empty();
    }

    private static Optional<Severity> severityIn(String header) {
        Matcher words = WORD.matcher(header);
        while (words.find()) {
            Optional<Severity> severity = Severity.parse(words.group());
            if (severity.isPresent()) {
                return severity;
            }
        }
        return Optional.empty();
    }
}
