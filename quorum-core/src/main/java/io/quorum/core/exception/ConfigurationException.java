package io.quorum.core.exception;

import java.io.Serial;

/// Thrown when a run cannot start because its inputs are unusable.
///
/// Raised before any worker is dispatched. Common causes:
/// - The corpus is empty or describes no analyzable resources
/// - A role weight is missing, zero, negative or not finite
/// - Severity thresholds are outside `[0, 1]` or relax in the wrong direction
/// - A roster role has no worker registered for it
///
/// @see io.quorum.core.QuorumConfig#validate()
public class ConfigurationException extends Exception {

    @Serial private static final long serialVersionUID = 4127795069541839012L;

    /// Creates exception with message.
    ///
    /// @param message description of the invalid input
    public ConfigurationException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the invalid input
    /// @param cause the underlying exception
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
