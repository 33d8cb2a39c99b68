package io.quorum.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quorum.core.report.FinalReport;

/// Utility class for writing and reading final reports as JSON.
///
/// ### Usage
/// {@snippet :
/// String json = ReportSerializer.toJson(report);
/// FinalReport restored = ReportSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`.
///
/// @see QuorumJacksonModule for the registered type handlers
public final class ReportSerializer {

    private ReportSerializer() {}

    /// Serializes a report to pretty-printed JSON.
    ///
    /// @param report the report, not null
    /// @return the JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FinalReport report) {
        try {
            return createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    /// Deserializes a report written by {@link #toJson(FinalReport)}.
    ///
    /// @throws IllegalArgumentException if the document is not a valid report
    public static FinalReport fromJson(String json) {
        try {
            return createMapper().readValue(json, FinalReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize report: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for report serialization.
    ///
    /// Registers:
    /// - `QuorumJacksonModule` for the report model
    /// - `JavaTimeModule` for `Instant` and `Duration` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new QuorumJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
