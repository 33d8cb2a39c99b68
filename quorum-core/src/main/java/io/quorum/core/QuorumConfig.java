package io.quorum.core;

import io.quorum.core.consensus.Severity;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.roster.WorkerRole;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/// Configuration options for an analysis run.
///
/// Controls dispatch concurrency, invocation timeouts and retries, verification
/// retries, consensus thresholds and coverage requirements. Use the {@link Builder}
/// for fluent configuration or the setters for mutable configuration.
///
/// ### Default Values
/// - `concurrencyLimit`: `100` simultaneous worker invocations
/// - `invocationTimeout`: `60s` per attempt
/// - `invocationRetries`: `1` retry after `retryBackoff` (`5s`)
/// - `verificationRetryBudget`: `2` re-applications before escalation
/// - `verificationDelay`: `1s` between re-application and re-check
/// - `minCoveragePct`: `0.70`
/// - `similarityThreshold`: `0.5` (token Jaccard)
/// - `oversizedFactor`: `2.0` times the median unit size
/// - `partitionDepth`: `2` directory levels
/// - severity thresholds: critical `1.0`, high `0.6`, medium `0.6`, low `0.5`, info `0.4`
/// - role weights: quality `1.0`, implementation `1.0`, design `1.2`, complexity `1.5`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link QuorumFactory}
/// and do not modify after the environment is built.
///
/// @see #validate()
public class QuorumConfig {

    private int concurrencyLimit = 100;
    private Duration invocationTimeout = Duration.ofSeconds(60);
    private int invocationRetries = 1;
    private Duration retryBackoff = Duration.ofSeconds(5);
    private int verificationRetryBudget = 2;
    private Duration verificationDelay = Duration.ofSeconds(1);
    private double minCoveragePct = 0.70;
    private double similarityThreshold = 0.5;
    private double oversizedFactor = 2.0;
    private int partitionDepth = 2;
    private final Map<Severity, Double> severityThresholds = defaultThresholds();
    private final Map<WorkerRole, Double> roleWeights = defaultWeights();

    public QuorumConfig() {}

    private static Map<Severity, Double> defaultThresholds() {
        Map<Severity, Double> thresholds = new EnumMap<>(Severity.class);
        thresholds.put(Severity.CRITICAL, 1.0);
        thresholds.put(Severity.HIGH, 0.6);
        thresholds.put(Severity.MEDIUM, 0.6);
        thresholds.put(Severity.LOW, 0.5);
        thresholds.put(Severity.INFO, 0.4);
        return thresholds;
    }

    private static Map<WorkerRole, Double> defaultWeights() {
        Map<WorkerRole, Double> weights = new EnumMap<>(WorkerRole.class);
        for (WorkerRole role : WorkerRole.values()) {
            weights.put(role, role.getDefaultWeight());
        }
        return weights;
    }

    /// Checks every option for a usable value.
    ///
    /// @throws ConfigurationException naming the first offending option
    public void validate() throws ConfigurationException {
        if (concurrencyLimit < 1) {
            throw new ConfigurationException(
                    "concurrencyLimit must be at least 1, was " + concurrencyLimit);
        }
        requirePositive("invocationTimeout", invocationTimeout);
        if (invocationRetries < 0) {
            throw new ConfigurationException("invocationRetries must not be negative");
        }
        requireNonNegative("retryBackoff", retryBackoff);
        if (verificationRetryBudget < 0) {
            throw new ConfigurationException("verificationRetryBudget must not be negative");
        }
        requireNonNegative("verificationDelay", verificationDelay);
        requireFraction("minCoveragePct", minCoveragePct);
        requireFraction("similarityThreshold", similarityThreshold);
        if (!(oversizedFactor > 0) || Double.isInfinite(oversizedFactor)) {
            throw new ConfigurationException(
                    "oversizedFactor must be a positive number, was " + oversizedFactor);
        }
        if (partitionDepth < 1) {
            throw new ConfigurationException("partitionDepth must be at least 1");
        }
        for (Severity severity : Severity.values()) {
            Double threshold = severityThresholds.get(severity);
            if (threshold == null) {
                throw new ConfigurationException("Missing threshold for severity " + severity);
            }
            requireFraction("threshold." + severity.label(), threshold);
            if (threshold == 0.0) {
                throw new ConfigurationException(
                        "threshold." + severity.label() + " must be greater than 0");
            }
        }
        if (severityThresholds.get(Severity.CRITICAL) != 1.0) {
            throw new ConfigurationException(
                    "threshold.critical must be 1.0, critical findings require unanimity");
        }
        Severity[] severities = Severity.values();
        for (int i = 1; i < severities.length; i++) {
            if (severityThresholds.get(severities[i]) > severityThresholds.get(severities[i - 1])) {
                throw new ConfigurationException(
                        "threshold."
                                + severities[i].label()
                                + " must not exceed threshold."
                                + severities[i - 1].label());
            }
        }
        for (WorkerRole role : WorkerRole.values()) {
            Double weight = roleWeights.get(role);
            if (weight == null || !(weight > 0) || Double.isInfinite(weight)) {
                throw new ConfigurationException(
                        "Weight for role '" + role.id() + "' must be a positive number, was "
                                + weight);
            }
        }
    }

    private static void requirePositive(String name, Duration value)
            throws ConfigurationException {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be a positive duration");
        }
    }

    private static void requireNonNegative(String name, Duration value)
            throws ConfigurationException {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(name + " must not be negative");
        }
    }

    private static void requireFraction(String name, double value) throws ConfigurationException {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0, 1], was " + value);
        }
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public void setConcurrencyLimit(int concurrencyLimit) {
        this.concurrencyLimit = concurrencyLimit;
    }

    /// Returns the wall-clock budget of a single invocation attempt.
    public Duration getInvocationTimeout() {
        return invocationTimeout;
    }

    public void setInvocationTimeout(Duration invocationTimeout) {
        this.invocationTimeout = invocationTimeout;
    }

    /// Returns how many extra attempts a transient failure or timeout gets.
    public int getInvocationRetries() {
        return invocationRetries;
    }

    public void setInvocationRetries(int invocationRetries) {
        this.invocationRetries = invocationRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public int getVerificationRetryBudget() {
        return verificationRetryBudget;
    }

    public void setVerificationRetryBudget(int verificationRetryBudget) {
        this.verificationRetryBudget = verificationRetryBudget;
    }

    public Duration getVerificationDelay() {
        return verificationDelay;
    }

    public void setVerificationDelay(Duration verificationDelay) {
        this.verificationDelay = verificationDelay;
    }

    /// Returns the share of units that must reach at least two surviving roles
    /// before the report is considered complete.
    public double getMinCoveragePct() {
        return minCoveragePct;
    }

    public void setMinCoveragePct(double minCoveragePct) {
        this.minCoveragePct = minCoveragePct;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public double getOversizedFactor() {
        return oversizedFactor;
    }

    public void setOversizedFactor(double oversizedFactor) {
        this.oversizedFactor = oversizedFactor;
    }

    public int getPartitionDepth() {
        return partitionDepth;
    }

    public void setPartitionDepth(int partitionDepth) {
        this.partitionDepth = partitionDepth;
    }

    /// Returns the minimum consensus percentage for the given severity.
    public double getThreshold(Severity severity) {
        return severityThresholds.get(severity);
    }

    public void setThreshold(Severity severity, double threshold) {
        severityThresholds.put(severity, threshold);
    }

    /// Returns a read-only view of all severity thresholds.
    public Map<Severity, Double> getSeverityThresholds() {
        return Map.copyOf(severityThresholds);
    }

    public double getRoleWeight(WorkerRole role) {
        return roleWeights.get(role);
    }

    public void setRoleWeight(WorkerRole role, double weight) {
        roleWeights.put(role, weight);
    }

    /// Returns a copy of the configured role weights.
    public Map<WorkerRole, Double> getRoleWeights() {
        return new EnumMap<>(roleWeights);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link QuorumConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it
    /// on {@link #build()}. Validation happens when the environment is built.
    public static class Builder {
        private final QuorumConfig config = new QuorumConfig();

        public Builder concurrencyLimit(int concurrencyLimit) {
            config.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder invocationTimeout(Duration invocationTimeout) {
            config.invocationTimeout = invocationTimeout;
            return this;
        }

        public Builder invocationRetries(int invocationRetries) {
            config.invocationRetries = invocationRetries;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            config.retryBackoff = retryBackoff;
            return this;
        }

        public Builder verificationRetryBudget(int verificationRetryBudget) {
            config.verificationRetryBudget = verificationRetryBudget;
            return this;
        }

        public Builder verificationDelay(Duration verificationDelay) {
            config.verificationDelay = verificationDelay;
            return this;
        }

        public Builder minCoveragePct(double minCoveragePct) {
            config.minCoveragePct = minCoveragePct;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            config.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder oversizedFactor(double oversizedFactor) {
            config.oversizedFactor = oversizedFactor;
            return this;
        }

        public Builder partitionDepth(int partitionDepth) {
            config.partitionDepth = partitionDepth;
            return this;
        }

        public Builder threshold(Severity severity, double threshold) {
            config.severityThresholds.put(severity, threshold);
            return this;
        }

        public Builder roleWeight(WorkerRole role, double weight) {
            config.roleWeights.put(role, weight);
            return this;
        }

        public QuorumConfig build() {
            return config;
        }
    }
}
