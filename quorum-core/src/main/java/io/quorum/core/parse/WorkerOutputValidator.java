package io.quorum.core.parse;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/// Screens raw worker output before any decoding stage sees it.
///
/// Worker output is untrusted text.
///
/// ### Checks
/// - **ASCII control characters**: null bytes and other non-printables reject the output
/// - **Unicode manipulation characters**: directional overrides, isolates, zero-width
///   characters and the BOM are stripped, since they hide text from the operator
/// - **Payload size**: outputs above {@link #MAX_OUTPUT_BYTES} are rejected
///
/// @implNote Stateless. Safe to call from any thread.
public final class WorkerOutputValidator {

    /// Excludes TAB, LF and CR, which are valid in free text.
    static final Pattern DANGEROUS_CONTROL =
            Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    static final Pattern UNICODE_TRICKS =
            Pattern.compile("[\\u202A-\\u202E\\u2066-\\u2069\\u200B-\\u200D\\uFEFF]");

    /// 4 MB. Anything larger is runaway generation.
    public static final int MAX_OUTPUT_BYTES = 4_194_304;

    private WorkerOutputValidator() {}

    /// Returns why the output must be rejected, or empty if it may be decoded.
    public static Optional<String> rejectionReason(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return Optional.of("empty output");
        }
        if (exceedsSizeLimit(rawOutput, MAX_OUTPUT_BYTES)) {
            return Optional.of("output exceeds " + MAX_OUTPUT_BYTES + " bytes");
        }
        if (containsDangerousChars(rawOutput)) {
            return Optional.of("output contains control characters");
        }
        return Optional.empty();
    }

    /// Removes invisible and directional Unicode characters.
    public static String stripUnicodeTricks(String value) {
        return value == null ? null : UNICODE_TRICKS.matcher(value).replaceAll("");
    }

    public static boolean containsDangerousChars(String value) {
        return value != null && DANGEROUS_CONTROL.matcher(value).find();
    }

    public static boolean containsUnicodeTricks(String value) {
        return value != null && UNICODE_TRICKS.matcher(value).find();
    }

    public static boolean exceedsSizeLimit(String value, int maxBytes) {
        // Cheap bound first: a UTF-8 char is at most 3 bytes per UTF-16 unit
        if (value == null || (long) value.length() * 3 <= maxBytes) {
            return false;
        }
        return value.getBytes(StandardCharsets.UTF_8).length > maxBytes;
    }
}
