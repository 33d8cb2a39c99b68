package io.quorum.core.consensus;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// Severity of a finding, ordered from most to least severe.
///
/// Besides the canonical names, {@link #parse(String)} accepts the vocabulary
/// workers commonly use in free-form reports (`BLOCKING`, `IMPORTANT`, `SUGGESTION`,
/// `MAJOR`, `MINOR` and a few more).
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    private static final Map<String, Severity> SYNONYMS =
            Map.ofEntries(
                    Map.entry("critical", CRITICAL),
                    Map.entry("blocker", CRITICAL),
                    Map.entry("blocking", CRITICAL),
                    Map.entry("high", HIGH),
                    Map.entry("major", HIGH),
                    Map.entry("medium", MEDIUM),
                    Map.entry("moderate", MEDIUM),
                    Map.entry("important", MEDIUM),
                    Map.entry("low", LOW),
                    Map.entry("minor", LOW),
                    Map.entry("suggestion", LOW),
                    Map.entry("info", INFO),
                    Map.entry("informational", INFO),
                    Map.entry("note", INFO),
                    Map.entry("nit", INFO));

    /// Returns the next more severe level. `CRITICAL` stays `CRITICAL`.
    public Severity raised() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() - 1];
    }

    /// Returns `true` if this level is strictly more severe than `other`.
    public boolean isMoreSevereThan(Severity other) {
        return ordinal() < other.ordinal();
    }

    /// Returns the more severe of the two levels.
    public static Severity mostSevere(Severity a, Severity b) {
        return a.isMoreSevereThan(b) ? a : b;
    }

    /// Parses a severity word, case-insensitively, including known synonyms.
    ///
    /// @param text the raw word, may be null
    /// @return the matching severity, or empty if the word is not a severity
    public static Optional<Severity> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        return Optional.ofNullable(SYNONYMS.get(key));
    }

    /// Lowercase label used in rendered reports.
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
