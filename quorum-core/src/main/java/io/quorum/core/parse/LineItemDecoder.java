package io.quorum.core.parse;

import io.quorum.core.consensus.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Decodes reports where every finding is a single line tagged with its severity.
///
/// {@snippet :
/// - [HIGH] src/cache.py:88 - unbounded cache growth -> add an eviction policy
/// MEDIUM: src/util.py:12 - duplicated parsing logic
/// **LOW**: `docs/api.md` - outdated example
/// }
///
/// Lines whose tag is not a severity word are skipped.
public class LineItemDecoder implements OutputDecoder {

    private static final Pattern LINE_ITEM =
            Pattern.compile(
                    "^\\s*(?:[-*+]\\s+|\\d+[.)]\\s+)?"
                            + "(?:[\\[(]([A-Za-z]+)[\\])]\\s*[:|\\-\u2013\u2014]?"
                            + "|(?:\\*\\*)?([A-Za-z]+)(?:\\*\\*)?\\s*[:|\\-\u2013\u2014](?:\\*\\*)?)"
                            + "\\s*(.+)$");

    @Override
    public String name() {
        return "lines";
    }

    @Override
    public Optional<DecodedOutput> decode(String rawOutput) {
        List<ReportedFinding> findings = new ArrayList<>();
        List<ReportedMutation> mutations = new ArrayList<>();

        for (String line : rawOutput.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Optional<ReportedMutation> mutation = ReportText.mutationLine(line);
            if (mutation.isPresent()) {
                mutations.add(mutation.get());
                continue;
            }
            Optional<String> fix = ReportText.recommendationLine(line);
            if (fix.isPresent()) {
                if (!findings.isEmpty()) {
                    int last = findings.size() - 1;
                    ReportedFinding previous = findings.get(last);
                    if (previous.recommendation() == null || previous.recommendation().isBlank()) {
                        findings.set(last, previous.withRecommendation(fix.get()));
                    }
                }
                continue;
            }
            Matcher item = LINE_ITEM.matcher(line);
            if (!item.matches()) {
                continue;
            }
            String tag = item.group(1) != null ? item.group(1) : item.group(2);
            Optional<Severity> severity = Severity.parse(tag);
            if (severity.isEmpty()) {
                continue;
            }
            ReportedFinding finding = ReportText.toFinding(severity.get(), item.group(3));
            if (finding.isWellFormed()) {
                findings.add(finding);
            }
        }

        if (findings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(
                new DecodedOutput(findings, ReportText.healthScore(rawOutput), mutations, false));
    }
}
