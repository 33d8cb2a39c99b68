package io.quorum.core.parse;

import io.quorum.core.consensus.Severity;

/// A finding as a decoder extracted it, before it is attributed to a unit and role.
///
/// @param severity parsed severity, null if the worker gave none or an unknown word
/// @param location reported location, may be null
/// @param description reported description, may be null
/// @param recommendation reported fix, may be null
public record ReportedFinding(
        Severity severity, String location, String description, String recommendation) {

    /// Returns `true` if the finding carries the fields every finding needs.
    public boolean isWellFormed() {
        return severity != null
                && location != null
                && !location.isBlank()
                && description != null
                && !description.isBlank();
    }

    public ReportedFinding withRecommendation(String newRecommendation) {
        return new ReportedFinding(severity, location, description, newRecommendation);
    }
}
