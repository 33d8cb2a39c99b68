package io.quorum.core.parse;

import io.quorum.core.consensus.Severity;
import io.quorum.core.verify.ExpectedSignal;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Line-level patterns shared by the free-text decoding stages.
final class ReportText {

    private static final Logger logger = Logger.getLogger(ReportText.class.getName());

    /// `description (`path:line`)`, the layout many linters and review bots use.
    private static final Pattern TRAILING_LOCATION =
            Pattern.compile("^(.+?)\\s*\\(`([^`]+)`\\)\\s*$");

    private static final Pattern BACKTICK_LOCATION =
            Pattern.compile("^`([^`]+)`\\s*[-:\u2013\u2014]?\\s*(.+)$");

    private static final Pattern BOLD_LOCATION =
            Pattern.compile("^\\*\\*([^*]+)\\*\\*\\s*[-:\u2013\u2014]?\\s*(.+)$");

    private static final Pattern PLAIN_LOCATION =
            Pattern.compile("^(\\S+?(?::\\d+(?:-\\d+)?)?)(?:\\s+[-\u2013\u2014]\\s+|:\\s+)(.+)$");

    private static final Pattern INLINE_LOCATION =
            Pattern.compile(
                    "\\b(?:in|at)\\s+`?([\\w./-]+\\.\\w+(?::\\d+(?:-\\d+)?)?)`?",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern LINE_NUMBER = Pattern.compile(".*:\\d+(?:-\\d+)?$");

    private static final Pattern RECOMMENDATION_SPLIT =
            Pattern.compile(
                    "\\s*(?:\u2192|->|\\b(?:fix|recommendation|recommended|suggested fix)\\s*:)\\s*",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern RECOMMENDATION_LINE =
            Pattern.compile(
                    "^\\s*(?:[-*+]\\s*)?(?:fix|recommendation|suggested fix)\\s*:\\s*(.+)$",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern HEALTH_SCORE =
            Pattern.compile(
                    "health[ _-]?score\\W{0,3}\\s*(\\d+(?:\\.\\d+)?)(?:\\s*/\\s*(\\d+(?:\\.\\d+)?))?",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern MUTATION_LINE =
            Pattern.compile(
                    "^\\s*(?:[-*+]\\s+)?(?:claimed[ _-]?mutation|mutation|modified file|changed file)"
                            + "\\s*:\\s*`?([^`\\s]+)`?\\s*(?:\\[([^\\]]+)]|\\(([^)]+)\\))?\\s*$",
                    Pattern.CASE_INSENSITIVE);

    private ReportText() {}

    /// Turns the body of a list item into a finding of the given severity.
    ///
    /// The result may be ill-formed (no location found); callers filter with
    /// {@link ReportedFinding#isWellFormed()}.
    static ReportedFinding toFinding(Severity severity, String body) {
        String text = body.trim();
        String location = null;
        String rest = text;

        Matcher trailing = TRAILING_LOCATION.matcher(text);
        Matcher backtick = BACKTICK_LOCATION.matcher(text);
        Matcher bold = BOLD_LOCATION.matcher(text);
        Matcher plain = PLAIN_LOCATION.matcher(text);
        if (trailing.matches()) {
            location = trailing.group(2);
            rest = trailing.group(1);
        } else if (backtick.matches() && looksLikeLocation(backtick.group(1))) {
            location = backtick.group(1);
            rest = backtick.group(2);
        } else if (bold.matches() && looksLikeLocation(bold.group(1))) {
            location = bold.group(1);
            rest = bold.group(2);
        } else if (plain.matches() && looksLikeLocation(plain.group(1))) {
            location = plain.group(1);
            rest = plain.group(2);
        } else {
            Matcher inline = INLINE_LOCATION.matcher(text);
            if (inline.find()) {
                location = inline.group(1);
            }
        }

        String description = rest;
        String recommendation = null;
        Matcher split = RECOMMENDATION_SPLIT.matcher(rest);
        if (split.find() && split.start() > 0) {
            description = rest.substring(0, split.start());
            recommendation = rest.substring(split.end());
        }
        return new ReportedFinding(severity, location, stripMarkup(description), stripMarkup(recommendation));
    }

    static boolean looksLikeLocation(String token) {
        String t = token.trim();
        if (t.isEmpty() || t.contains(" ")) {
            return false;
        }
        return t.contains("/") || t.contains(".") || LINE_NUMBER.matcher(t).matches();
    }

    /// Returns the recommendation carried by a `Fix: ...` continuation line.
    static Optional<String> recommendationLine(String line) {
        Matcher matcher = RECOMMENDATION_LINE.matcher(line);
        return matcher.matches() ? Optional.of(stripMarkup(matcher.group(1))) : Optional.empty();
    }

    /// Finds a health score anywhere in the text and normalizes it to a 0-10 scale.
    static Double healthScore(String text) {
        Matcher matcher = HEALTH_SCORE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double score = Double.parseDouble(matcher.group(1));
        if (matcher.group(2) != null) {
            double scale = Double.parseDouble(matcher.group(2));
            if (scale <= 0) {
                return null;
            }
            score = score / scale * 10.0;
        } else if (score > 10.0 && score <= 100.0) {
            score = score / 10.0;
        }
        return Math.max(0.0, Math.min(10.0, score));
    }

    static Optional<ReportedMutation> mutationLine(String line) {
        Matcher matcher = MUTATION_LINE.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String signalText = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
        try {
            ExpectedSignal signal =
                    signalText == null ? ExpectedSignal.present() : ExpectedSignal.parse(signalText);
            return Optional.of(new ReportedMutation(matcher.group(1), signal));
        } catch (IllegalArgumentException e) {
            logger.fine("Ignoring mutation line with unknown signal: " + line);
            return Optional.empty();
        }
    }

    static String stripMarkup(String text) {
        if (text == null) {
            return null;
        }
        String stripped = text.replace("**", "").trim();
        while (stripped.endsWith(".") || stripped.endsWith(";")) {
            stripped = stripped.substring(0, stripped.length() - 1).trim();
        }
        return stripped;
    }
}
