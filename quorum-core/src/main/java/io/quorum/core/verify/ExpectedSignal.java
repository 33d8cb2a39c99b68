package io.quorum.core.verify;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// What ground truth should show if a claimed mutation really happened.
///
/// ### Text form
/// - `present` (alias `exists`, `created`)
/// - `absent` (alias `deleted`, `removed`)
/// - `modified` (alias `changed`)
/// - `contains:<regex>` (alias `matches:<regex>`)
///
/// @param kind the signal type, not null
/// @param pattern regex for `CONTENT_MATCHES`, null otherwise
public record ExpectedSignal(Kind kind, String pattern) {

    public enum Kind {
        PRESENT,
        ABSENT,
        MODIFIED,
        CONTENT_MATCHES
    }

    public ExpectedSignal {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.CONTENT_MATCHES) {
            if (pattern == null || pattern.isEmpty()) {
                throw new IllegalArgumentException("contains: signal needs a pattern");
            }
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid content pattern: " + pattern, e);
            }
        } else if (pattern != null) {
            throw new IllegalArgumentException(kind + " signal does not take a pattern");
        }
    }

    public static ExpectedSignal present() {
        return new ExpectedSignal(Kind.PRESENT, null);
    }

    public static ExpectedSignal absent() {
        return new ExpectedSignal(Kind.ABSENT, null);
    }

    public static ExpectedSignal modified() {
        return new ExpectedSignal(Kind.MODIFIED, null);
    }

    public static ExpectedSignal contains(String regex) {
        return new ExpectedSignal(Kind.CONTENT_MATCHES, regex);
    }

    /// Parses the text form.
    ///
    /// @throws IllegalArgumentException if the text is not a known signal
    public static ExpectedSignal parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("signal must not be null");
        }
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            String prefix = trimmed.substring(0, colon).toLowerCase(Locale.ROOT);
            if (prefix.equals("contains") || prefix.equals("matches")) {
                return contains(trimmed.substring(colon + 1).trim());
            }
        }
        switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "present", "exists", "created":
                return present();
            case "absent", "deleted", "removed":
                return absent();
            case "modified", "changed":
                return modified();
            default:
                throw new IllegalArgumentException("Unknown expected signal: " + text);
        }
    }

    /// Returns the canonical text form, the inverse of {@link #parse(String)}.
    public String asText() {
        return switch (kind) {
            case PRESENT -> "present";
            case ABSENT -> "absent";
            case MODIFIED -> "modified";
            case CONTENT_MATCHES -> "contains:" + pattern;
        };
    }
}
