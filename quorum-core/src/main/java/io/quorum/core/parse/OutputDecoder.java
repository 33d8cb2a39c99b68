package io.quorum.core.parse;

import java.util.Optional;

/// One stage of the result-parsing cascade.
///
/// Stages are pure functions of the raw output: they do not throw on garbage
/// and they return empty when the output is not in their format.
public interface OutputDecoder {

    /// Short stage name recorded on the parsed output, e.g. `"json"`.
    String name();

    /// Attempts to decode the raw output.
    ///
    /// @param rawOutput the worker's output, not null
    /// @return the decoded output, or empty if this stage does not recognize the format
    Optional<DecodedOutput> decode(String rawOutput);
}
