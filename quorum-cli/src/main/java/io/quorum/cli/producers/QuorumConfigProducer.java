package io.quorum.cli.producers;

import io.quorum.core.QuorumConfig;
import io.quorum.core.consensus.Severity;
import io.quorum.core.roster.WorkerRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the run configuration.
///
/// Reads `quorum.*` keys from MicroProfile Config (`application.properties`,
/// system properties, `QUORUM_*` environment variables) on top of the
/// {@link QuorumConfig} defaults. Commands apply their own overrides to the
/// produced instance, so every injection point receives a fresh copy.
///
/// ### Configuration Properties
/// | Property | Type | Default |
/// |----------|------|---------|
/// | `quorum.concurrency-limit` | int | `100` |
/// | `quorum.invocation-timeout` | Duration | `60s` |
/// | `quorum.invocation-retries` | int | `1` |
/// | `quorum.retry-backoff` | Duration | `5s` |
/// | `quorum.verification.retry-budget` | int | `2` |
/// | `quorum.verification.delay` | Duration | `1s` |
/// | `quorum.min-coverage` | double | `0.70` |
/// | `quorum.similarity-threshold` | double | `0.5` |
/// | `quorum.oversized-factor` | double | `2.0` |
/// | `quorum.partition-depth` | int | `2` |
/// | `quorum.threshold.<severity>` | double | see {@link QuorumConfig} |
/// | `quorum.weight.<role>` | double | see {@link WorkerRole} |
///
/// Values are not validated here; {@link io.quorum.core.QuorumFactory} rejects an
/// invalid configuration before anything is dispatched.
@ApplicationScoped
public class QuorumConfigProducer {

    private static final Logger logger = Logger.getLogger(QuorumConfigProducer.class.getName());

    static final String PREFIX = "quorum.";

    @Inject Config config;

    @Produces
    public QuorumConfig quorumConfig() {
        QuorumConfig quorumConfig = new QuorumConfig();

        intValue("concurrency-limit").ifPresent(quorumConfig::setConcurrencyLimit);
        durationValue("invocation-timeout").ifPresent(quorumConfig::setInvocationTimeout);
        intValue("invocation-retries").ifPresent(quorumConfig::setInvocationRetries);
        durationValue("retry-backoff").ifPresent(quorumConfig::setRetryBackoff);
        intValue("verification.retry-budget").ifPresent(quorumConfig::setVerificationRetryBudget);
        durationValue("verification.delay").ifPresent(quorumConfig::setVerificationDelay);
        doubleValue("min-coverage").ifPresent(quorumConfig::setMinCoveragePct);
        doubleValue("similarity-threshold").ifPresent(quorumConfig::setSimilarityThreshold);
        doubleValue("oversized-factor").ifPresent(quorumConfig::setOversizedFactor);
        intValue("partition-depth").ifPresent(quorumConfig::setPartitionDepth);

        for (Severity severity : Severity.values()) {
            doubleValue("threshold." + severity.label())
                    .ifPresent(value -> quorumConfig.setThreshold(severity, value));
        }
        for (WorkerRole role : WorkerRole.values()) {
            doubleValue("weight." + role.id())
                    .ifPresent(value -> quorumConfig.setRoleWeight(role, value));
        }

        logger.fine(
                "Loaded run configuration (concurrency "
                        + quorumConfig.getConcurrencyLimit()
                        + ", timeout "
                        + quorumConfig.getInvocationTimeout()
                        + ")");
        return quorumConfig;
    }

    private Optional<Integer> intValue(String key) {
        return config.getOptionalValue(PREFIX + key, Integer.class);
    }

    private Optional<Double> doubleValue(String key) {
        return config.getOptionalValue(PREFIX + key, Double.class);
    }

    private Optional<Duration> durationValue(String key) {
        return config.getOptionalValue(PREFIX + key, Duration.class);
    }
}
