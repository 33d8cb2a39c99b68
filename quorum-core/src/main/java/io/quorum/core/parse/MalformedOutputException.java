package io.quorum.core.parse;

import java.io.Serial;

/// Thrown when no decoding stage could extract a well-formed finding from a worker's output.
///
/// The invocation is marked `MALFORMED`: it does not vote, but it is still counted
/// when coverage is computed.
///
/// @see ResultParser#parse
public class MalformedOutputException extends Exception {

    @Serial private static final long serialVersionUID = -3878032177105418842L;

    public MalformedOutputException(String message) {
        super(message);
    }
}
