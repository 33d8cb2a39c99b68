package io.quorum.core.parse;

import io.quorum.core.consensus.Finding;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.verify.MutationClaim;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Turns raw worker output into findings through a cascade of decoding stages.
///
/// Stages are tried in order and the first usable result wins. The usual cascade
/// is strict JSON, then severity section headers, then severity-tagged line items.
/// Output that no stage can decode is malformed.
///
/// ### Contracts
/// - Each stage sees the same validated text, with invisible Unicode removed
/// - A stage result is usable if it holds at least one well-formed finding, or if the
///   output explicitly reports zero findings
/// - A stage that throws is logged and skipped
///
/// @implNote Stateless and thread-safe as long as the stages are.
public class ResultParser {

    private static final Logger logger = Logger.getLogger(ResultParser.class.getName());

    private final List<OutputDecoder> stages;

    /// @param stages decoding stages in cascade order, not empty
    public ResultParser(List<OutputDecoder> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("at least one decoding stage is required");
        }
        this.stages = List.copyOf(stages);
    }

    /// Creates a parser with only the free-text stages.
    public static ResultParser heuristic() {
        return new ResultParser(List.of(new SectionHeaderDecoder(), new LineItemDecoder()));
    }

    /// Creates a parser with `strict` as the first stage followed by the free-text stages.
    public static ResultParser withStrictStage(OutputDecoder strict) {
        return new ResultParser(List.of(strict, new SectionHeaderDecoder(), new LineItemDecoder()));
    }

    public List<OutputDecoder> getStages() {
        return stages;
    }

    /// Decodes the output of one invocation.
    ///
    /// @param rawOutput the worker's output, may be null
    /// @param workUnitId unit of the invocation, not null
    /// @param role role of the invocation, not null
    /// @return findings and claims attributed to the unit and role, never null
    /// @throws MalformedOutputException if the output is rejected or no stage can decode it
    public ParsedOutput parse(String rawOutput, String workUnitId, WorkerRole role)
            throws MalformedOutputException {
        Optional<String> rejection = WorkerOutputValidator.rejectionReason(rawOutput);
        if (rejection.isPresent()) {
            throw new MalformedOutputException(
                    role.id() + "@" + workUnitId + ": " + rejection.get());
        }
        String text = WorkerOutputValidator.stripUnicodeTricks(rawOutput);

        for (OutputDecoder stage : stages) {
            Optional<DecodedOutput> decoded;
            try {
                decoded = stage.decode(text);
            } catch (RuntimeException e) {
                logger.warning(
                        "Decoding stage '" + stage.name() + "' failed on output of " + role.id()
                                + "@" + workUnitId + ": " + e.getMessage());
                continue;
            }
            if (decoded.isPresent() && decoded.get().isUsable()) {
                logger.fine(
                        "Stage '" + stage.name() + "' decoded " + decoded.get().findings().size()
                                + " findings for " + role.id() + "@" + workUnitId);
                return attribute(stage.name(), decoded.get(), workUnitId, role);
            }
        }

        throw new MalformedOutputException(
                role.id() + "@" + workUnitId + ": no decoding stage recognized the output");
    }

    private static ParsedOutput attribute(
            String stageName, DecodedOutput decoded, String workUnitId, WorkerRole role) {
        List<Finding> findings = new ArrayList<>(decoded.findings().size());
        for (ReportedFinding reported : decoded.findings()) {
            findings.add(
                    new Finding(
                            workUnitId,
                            reported.severity(),
                            reported.location(),
                            reported.description(),
                            reported.recommendation(),
                            EnumSet.of(role)));
        }
        List<MutationClaim> claims = new ArrayList<>(decoded.mutations().size());
        for (ReportedMutation mutation : decoded.mutations()) {
            if (mutation.targetResource() == null || mutation.targetResource().isBlank()) {
                continue;
            }
            claims.add(
                    new MutationClaim(
                            workUnitId, role, mutation.targetResource(), mutation.expectedSignal()));
        }
        return new ParsedOutput(stageName, findings, decoded.healthScore(), claims);
    }
}
