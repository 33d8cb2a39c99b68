package io.quorum.core;

import io.quorum.core.consensus.ConsensusAggregator;
import io.quorum.core.consensus.FindingMatcher;
import io.quorum.core.consensus.FindingSimilarity;
import io.quorum.core.consensus.TokenJaccardSimilarity;
import io.quorum.core.dispatch.Dispatcher;
import io.quorum.core.exception.ConfigurationException;
import io.quorum.core.execution.AnalysisCoordinator;
import io.quorum.core.parse.LineItemDecoder;
import io.quorum.core.parse.OutputDecoder;
import io.quorum.core.parse.ResultParser;
import io.quorum.core.parse.SectionHeaderDecoder;
import io.quorum.core.partition.DirectoryPartitioner;
import io.quorum.core.partition.WorkUnitPartitioner;
import io.quorum.core.report.ReportSynthesizer;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.roster.WorkerRoster;
import io.quorum.core.template.SimpleTemplateResolver;
import io.quorum.core.verify.FileSystemGroundTruth;
import io.quorum.core.verify.GroundTruth;
import io.quorum.core.verify.MutationVerifier;
import io.quorum.core.worker.DefaultWorkerRegistry;
import io.quorum.core.worker.PromptPayloadFactory;
import io.quorum.core.worker.TemplatePromptPayloadFactory;
import io.quorum.core.worker.Worker;
import io.quorum.core.worker.WorkerRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring analysis environments.
///
/// {@snippet :
/// try (var env = QuorumFactory.builder()
///         .config(QuorumConfig.builder().invocationTimeout(Duration.ofSeconds(30)).build())
///         .defaultWorker(new StubWorker(stubsDir))
///         .strictDecoder(new JacksonStrictDecoder())
///         .groundTruth(new FileSystemGroundTruth(projectRoot))
///         .build()) {
///     FinalReport report = env.getCoordinator().run(corpus);
/// }
/// }
///
/// @see QuorumEnvironment
/// @see QuorumConfig
public final class QuorumFactory {

    private static final Logger logger = Logger.getLogger(QuorumFactory.class.getName());

    private QuorumFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link QuorumEnvironment}.
    ///
    /// Everything except the workers has a default:
    /// - config: {@link QuorumConfig} defaults
    /// - decoding: section headers, then line items, optionally preceded by a strict stage
    /// - ground truth: {@link FileSystemGroundTruth} on the working directory
    /// - partitioner: {@link DirectoryPartitioner} with the configured depth and factor
    /// - prompts: {@link TemplatePromptPayloadFactory} with the default template
    /// - similarity: {@link TokenJaccardSimilarity}
    public static final class Builder {
        private QuorumConfig config = new QuorumConfig();
        private final WorkerRegistry workerRegistry = new DefaultWorkerRegistry();
        private OutputDecoder strictDecoder;
        private GroundTruth groundTruth;
        private WorkUnitPartitioner partitioner;
        private PromptPayloadFactory payloadFactory;
        private FindingSimilarity similarity = new TokenJaccardSimilarity();

        private Builder() {}

        public Builder config(QuorumConfig config) {
            this.config = config;
            return this;
        }

        public Builder worker(WorkerRole role, Worker worker) {
            workerRegistry.registerWorker(role, worker);
            return this;
        }

        /// Registers a worker serving every role without a dedicated one.
        public Builder defaultWorker(Worker worker) {
            workerRegistry.registerDefault(worker);
            return this;
        }

        /// Sets the first cascade stage, usually a strict schema decoder.
        public Builder strictDecoder(OutputDecoder strictDecoder) {
            this.strictDecoder = strictDecoder;
            return this;
        }

        public Builder groundTruth(GroundTruth groundTruth) {
            this.groundTruth = groundTruth;
            return this;
        }

        public Builder partitioner(WorkUnitPartitioner partitioner) {
            this.partitioner = partitioner;
            return this;
        }

        public Builder payloadFactory(PromptPayloadFactory payloadFactory) {
            this.payloadFactory = payloadFactory;
            return this;
        }

        public Builder similarity(FindingSimilarity similarity) {
            this.similarity = similarity;
            return this;
        }

        /// Validates the configuration and wires the environment.
        ///
        /// @apiNote **Side effects**: starts three thread pools, released by
        /// {@link QuorumEnvironment#close()}.
        ///
        /// @return the environment, never null
        /// @throws ConfigurationException if the configuration is invalid
        public QuorumEnvironment build() throws ConfigurationException {
            config.validate();
            WorkerRoster roster = WorkerRoster.create(config.getRoleWeights());

            List<OutputDecoder> stages = new ArrayList<>();
            if (strictDecoder != null) {
                stages.add(strictDecoder);
            }
            stages.add(new SectionHeaderDecoder());
            stages.add(new LineItemDecoder());
            ResultParser parser = new ResultParser(stages);

            WorkUnitPartitioner resolvedPartitioner =
                    partitioner != null
                            ? partitioner
                            : new DirectoryPartitioner(config.getPartitionDepth(), config.getOversizedFactor());
            PromptPayloadFactory resolvedPayloads =
                    payloadFactory != null
                            ? payloadFactory
                            : new TemplatePromptPayloadFactory(new SimpleTemplateResolver());
            GroundTruth resolvedGroundTruth =
                    groundTruth != null ? groundTruth : new FileSystemGroundTruth(Path.of(""));

            ExecutorService dispatchPool =
                    Executors.newFixedThreadPool(config.getConcurrencyLimit(), daemonThreads("quorum-dispatch"));
            ExecutorService callPool = Executors.newCachedThreadPool(daemonThreads("quorum-worker"));
            ExecutorService finalizerPool = Executors.newCachedThreadPool(daemonThreads("quorum-finalize"));

            Dispatcher dispatcher =
                    new Dispatcher(config, workerRegistry, resolvedPayloads, parser, dispatchPool, callPool);
            FindingMatcher matcher = new FindingMatcher(similarity, config.getSimilarityThreshold());
            AnalysisCoordinator coordinator =
                    new AnalysisCoordinator(
                            resolvedPartitioner,
                            roster,
                            workerRegistry,
                            dispatcher,
                            new MutationVerifier(
                                    resolvedGroundTruth,
                                    config.getVerificationRetryBudget(),
                                    config.getVerificationDelay(),
                                    config.getInvocationTimeout(),
                                    callPool),
                            new ConsensusAggregator(config.getSeverityThresholds(), matcher),
                            new ReportSynthesizer(config.getMinCoveragePct(), matcher),
                            finalizerPool);

            logger.info(
                    "Quorum environment ready (concurrency " + config.getConcurrencyLimit()
                            + ", timeout " + config.getInvocationTimeout().toSeconds() + "s, "
                            + stages.size() + " decoding stages)");
            return new QuorumEnvironment(
                    config,
                    resolvedPartitioner,
                    roster,
                    workerRegistry,
                    dispatcher,
                    coordinator,
                    List.of(dispatchPool, callPool, finalizerPool));
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
