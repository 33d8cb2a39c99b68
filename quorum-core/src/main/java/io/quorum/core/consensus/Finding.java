package io.quorum.core.consensus;

import io.quorum.core.roster.WorkerRole;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A single issue reported by one or more roles on one WorkUnit.
///
/// @param workUnitId the unit the finding was reported on, not null
/// @param severity the reported severity, not null
/// @param location resource path, optionally with a `:line` or `:start-end` suffix, not blank
/// @param description what is wrong, not blank
/// @param recommendation how to fix it, may be empty
/// @param sourceRoles the roles that raised it, not empty
public record Finding(
        String workUnitId,
        Severity severity,
        String location,
        String description,
        String recommendation,
        Set<WorkerRole> sourceRoles) {

    private static final Pattern LINE_SUFFIX = Pattern.compile("^(.*?)(?::\\d+(?:-\\d+)?)+$");

    public Finding {
        Objects.requireNonNull(workUnitId, "workUnitId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        location = location.trim();
        description = description.trim();
        recommendation = recommendation == null ? "" : recommendation.trim();
        if (sourceRoles == null || sourceRoles.isEmpty()) {
            throw new IllegalArgumentException("a finding needs at least one source role");
        }
        sourceRoles = Collections.unmodifiableSet(EnumSet.copyOf(sourceRoles));
    }

    /// Returns the location without any trailing line number.
    ///
    /// Findings on `src/a.py:10` and `src/a.py:14` share the resource `src/a.py`.
    public String resourcePath() {
        Matcher matcher = LINE_SUFFIX.matcher(location);
        String path = matcher.matches() ? matcher.group(1) : location;
        return path.replace('\\', '/');
    }

    public Finding withSourceRoles(Set<WorkerRole> roles) {
        return new Finding(workUnitId, severity, location, description, recommendation, roles);
    }

    public Finding withSeverity(Severity newSeverity) {
        return new Finding(workUnitId, newSeverity, location, description, recommendation, sourceRoles);
    }
}
