package io.quorum.core.parse;

import io.quorum.core.consensus.Finding;
import io.quorum.core.verify.MutationClaim;
import java.util.List;

/// The parsed result of a successful invocation.
///
/// @param decoder name of the cascade stage that accepted the output
/// @param findings findings attributed to the invocation's unit and role
/// @param healthScore worker-reported health score on a 0-10 scale, null if absent
/// @param claims mutation claims awaiting verification
public record ParsedOutput(
        String decoder, List<Finding> findings, Double healthScore, List<MutationClaim> claims) {

    public ParsedOutput {
        findings = List.copyOf(findings);
        claims = List.copyOf(claims);
    }
}
