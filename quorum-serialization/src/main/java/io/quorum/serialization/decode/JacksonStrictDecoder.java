package io.quorum.serialization.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quorum.core.consensus.Severity;
import io.quorum.core.parse.DecodedOutput;
import io.quorum.core.parse.OutputDecoder;
import io.quorum.core.parse.ReportedFinding;
import io.quorum.core.parse.ReportedMutation;
import io.quorum.core.verify.ExpectedSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Jackson-based strict decoding stage, the first stage of the cascade.
///
/// Accepts a JSON object with a `findings` array, optionally wrapped in a markdown
/// code fence or surrounded by prose:
///
/// ```json
/// {"findings": [{"severity": "high", "location": "src/db.py:42",
///                "description": "SQL built by string concatenation",
///                "recommendation": "use bound parameters"}],
///  "health_score": 6.5,
///  "claimed_mutations": [{"target": "src/db.py", "expected_signal": "modified"}]}
/// ```
///
/// ### Field aliases
/// - location: `location`, or `file` with an optional `line`
/// - description: `description`, `message`, `issue`
/// - recommendation: `recommendation`, `fix`, `suggestion`
/// - health score: `health_score`, `healthScore`
/// - mutations: `claimed_mutations`, `mutations`; target `target`, `path`, `resource`;
///   signal `expected_signal`, `signal` (default `present`)
///
/// Ill-formed findings are dropped one by one. An empty `findings` array is an
/// explicit "no findings" answer and stops the cascade.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class JacksonStrictDecoder implements OutputDecoder {

    private static final Logger logger = Logger.getLogger(JacksonStrictDecoder.class.getName());

    private final ObjectMapper objectMapper;

    public JacksonStrictDecoder() {
        this(new ObjectMapper());
    }

    /// @param objectMapper the mapper used to read the JSON tree, not null
    public JacksonStrictDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public Optional<DecodedOutput> decode(String rawOutput) {
        Objects.requireNonNull(rawOutput, "rawOutput must not be null");
        String json = extractJson(rawOutput);
        if (json == null) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.fine("Output is not valid JSON: " + e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode findingsNode = root.get("findings");
        if (findingsNode == null || !findingsNode.isArray()) {
            return Optional.empty();
        }

        List<ReportedFinding> findings = new ArrayList<>();
        int dropped = 0;
        for (JsonNode item : findingsNode) {
            ReportedFinding finding = toFinding(item);
            if (finding.isWellFormed()) {
                findings.add(finding);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            logger.fine("Dropped " + dropped + " ill-formed findings from JSON output");
        }

        return Optional.of(
                new DecodedOutput(
                        findings,
                        healthScore(root),
                        mutations(root),
                        findingsNode.isEmpty()));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static ReportedFinding toFinding(JsonNode item) {
        if (!item.isObject()) {
            return new ReportedFinding(null, null, null, null);
        }
        Severity severity = Severity.parse(text(item, "severity")).orElse(null);
        return new ReportedFinding(
                severity,
                location(item),
                text(item, "description", "message", "issue"),
                text(item, "recommendation", "fix", "suggestion"));
    }

    private static String location(JsonNode item) {
        String location = text(item, "location");
        if (location != null) {
            return location;
        }
        String file = text(item, "file", "path");
        if (file == null) {
            return null;
        }
        JsonNode line = item.get("line");
        return line != null && line.canConvertToInt() ? file + ":" + line.asInt() : file;
    }

    private static Double healthScore(JsonNode root) {
        JsonNode node = root.has("health_score") ? root.get("health_score") : root.get("healthScore");
        if (node == null || !node.isNumber()) {
            return null;
        }
        double score = node.asDouble();
        if (score > 10.0 && score <= 100.0) {
            score = score / 10.0;
        }
        return Math.max(0.0, Math.min(10.0, score));
    }

    private static List<ReportedMutation> mutations(JsonNode root) {
        JsonNode node = root.has("claimed_mutations") ? root.get("claimed_mutations") : root.get("mutations");
        List<ReportedMutation> mutations = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return mutations;
        }
        for (JsonNode item : node) {
            String target = text(item, "target", "path", "resource");
            if (target == null) {
                continue;
            }
            String signal = text(item, "expected_signal", "signal");
            try {
                mutations.add(
                        new ReportedMutation(
                                target,
                                signal == null ? ExpectedSignal.present() : ExpectedSignal.parse(signal)));
            } catch (IllegalArgumentException e) {
                logger.fine("Ignoring mutation claim on " + target + ": " + e.getMessage());
            }
        }
        return mutations;
    }

    /// Returns the first non-blank textual field among `names`, or null.
    private static String text(JsonNode item, String... names) {
        for (String name : names) {
            JsonNode value = item.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    /// Extracts the JSON object from worker output, stripping markdown fences.
    ///
    /// @param content raw output, not null
    /// @return the JSON candidate, or null if the output holds no object
    private static String extractJson(String content) {
        int start = content.indexOf("```json");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                String fenced = content.substring(start, end).trim();
                if (fenced.startsWith("{")) {
                    return fenced;
                }
            }
        }

        int objectStart = content.indexOf('{');
        int objectEnd = content.lastIndexOf('}');
        if (objectStart >= 0 && objectEnd > objectStart) {
            return content.substring(objectStart, objectEnd + 1);
        }
        return null;
    }
}
