package com.profitrate.reconciliation.pipeline;

import com.profitrate.reconciliation.config.ReconciliationConfig;
import com.profitrate.reconciliation.core.ReconciliationException;
import com.profitrate.reconciliation.core.model.ObservationSet;
import com.profitrate.reconciliation.core.model.Unit;
import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.derive.DerivedSeriesCalculator;
import com.profitrate.reconciliation.gap.GapAction;
import com.profitrate.reconciliation.gap.GapResolution;
import com.profitrate.reconciliation.gap.GapResolver;
import com.profitrate.reconciliation.identity.IdentityRule;
import com.profitrate.reconciliation.identity.IdentityValidation;
import com.profitrate.reconciliation.identity.IdentityValidator;
import com.profitrate.reconciliation.identity.ValidationResult;
import com.profitrate.reconciliation.logging.LogContext;
import com.profitrate.reconciliation.merge.MergeConflict;
import com.profitrate.reconciliation.merge.MergeOutcome;
import com.profitrate.reconciliation.merge.SeriesMerger;
import com.profitrate.reconciliation.metrics.MetricsService;
import com.profitrate.reconciliation.metrics.NoOpMetricsService;
import com.profitrate.reconciliation.report.FailedSource;
import com.profitrate.reconciliation.report.ReconciliationReport;
import com.profitrate.reconciliation.report.ReportBuilder;
import com.profitrate.reconciliation.report.ReportWriter;
import com.profitrate.reconciliation.report.SeriesCsvWriter;
import com.profitrate.reconciliation.source.CsvSourceAdapter;
import com.profitrate.reconciliation.source.SourceAdapter;
import com.profitrate.reconciliation.source.SourceDescriptor;
import com.profitrate.reconciliation.units.UnitNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs a full reconciliation.
 *
 * <p>Each variable chain (load, normalize, merge, gap-resolve) runs on a fixed worker
 * pool. Chains share no mutable state. Once every chain has finished, derived variables
 * are computed, identities are validated and the report is assembled. A failing source
 * or chain is recorded as a {@link FailedSource} and never aborts the run.</p>
 */
public class ReconciliationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final ReconciliationConfig config;
    private final ReconciliationOptions options;
    private final SourceAdapter sourceAdapter;
    private final MetricsService metricsService;
    private final UnitNormalizer normalizer;
    private final SeriesMerger merger = new SeriesMerger();
    private final GapResolver gapResolver = new GapResolver();
    private final DerivedSeriesCalculator derivedCalculator = new DerivedSeriesCalculator();
    private final IdentityValidator identityValidator = new IdentityValidator();
    private final ReportBuilder reportBuilder = new ReportBuilder();

    public ReconciliationPipeline(ReconciliationConfig config) {
        this(config, optionsFrom(config), new NoOpMetricsService());
    }

    public ReconciliationPipeline(ReconciliationConfig config, ReconciliationOptions options,
                                  MetricsService metricsService) {
        this(config, options, new CsvSourceAdapter(options.getReadTimeout()), metricsService);
    }

    public ReconciliationPipeline(ReconciliationConfig config, ReconciliationOptions options,
                                  SourceAdapter sourceAdapter, MetricsService metricsService) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.sourceAdapter = Objects.requireNonNull(sourceAdapter, "sourceAdapter is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.normalizer = new UnitNormalizer(config.getConversionTable());
    }

    /**
     * Options carrying the worker count and read timeout declared in the configuration.
     */
    public static ReconciliationOptions optionsFrom(ReconciliationConfig config) {
        ReconciliationOptions.Builder builder = ReconciliationOptions.builder().workers(config.getWorkers());
        if (config.getReadTimeout() != null) {
            builder.readTimeout(config.getReadTimeout());
        }
        return builder.build();
    }

    /**
     * Executes every stage and returns the resolved series with the report.
     */
    public ReconciliationRun run() {
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forRun(runId)) {
            long start = System.nanoTime();
            SortedSet<String> variables = config.getVariables();
            log.info("run.started variables={} identities={} derived={}",
                    variables, config.getIdentities().size(), config.getDerivedVariables().size());

            Map<String, String> digests = new TreeMap<>();
            config.getInputDigests().forEach((file, digest) -> digests.put(digestKey(file), digest));

            List<VariableChainResult> chains = runChains(variables, runId);

            Map<String, VariableSeries> series = new TreeMap<>();
            List<MergeConflict> conflicts = new ArrayList<>();
            List<GapAction> gapActions = new ArrayList<>();
            List<FailedSource> failures = new ArrayList<>();
            for (VariableChainResult chain : chains) {
                if (chain.isSuccess()) {
                    series.put(chain.variableId(), chain.series());
                }
                conflicts.addAll(chain.conflicts());
                gapActions.addAll(chain.gapActions());
                failures.addAll(chain.failures());
                digests.putAll(chain.digests());
            }

            Map<String, VariableSeries> all = timed("derive",
                    () -> derivedCalculator.calculateAll(config.getDerivedVariables(), series));

            List<IdentityValidation> validations = new ArrayList<>();
            for (IdentityRule rule : config.getIdentities()) {
                IdentityValidation validation = timed("validate", () -> identityValidator.validate(rule, all));
                for (ValidationResult result : validation.results()) {
                    metricsService.incrementClassification(rule.getName(), result.classification());
                }
                validation.bias().ifPresent(b -> metricsService.recordSystematicBias(rule.getName()));
                validations.add(validation);
            }

            ReconciliationReport report = timed("report",
                    () -> reportBuilder.build(all, conflicts, gapActions, validations, failures, digests));

            log.info("run.completed series={} {} durationMs={}", all.size(), report,
                    Duration.ofNanos(System.nanoTime() - start).toMillis());
            return new ReconciliationRun(runId, all, report);
        }
    }

    /**
     * Writes one CSV per series and the JSON report into {@code outputDir}.
     *
     * @return the written files
     */
    public List<Path> write(ReconciliationRun run, Path outputDir) {
        List<Path> written = new ArrayList<>(new SeriesCsvWriter().writeAll(run.series().values(), outputDir));
        written.add(new ReportWriter().write(run.report(), outputDir));
        return written;
    }

    private List<VariableChainResult> runChains(SortedSet<String> variables, String runId) {
        if (variables.isEmpty()) {
            return List.of();
        }
        int workers = options.workersFor(variables.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        log.debug("run.pool workers={} chainTimeoutMs={}", workers, options.getChainTimeout().toMillis());
        try {
            Map<String, CompletableFuture<VariableChainResult>> futures = new LinkedHashMap<>();
            for (String variable : variables) {
                futures.put(variable, CompletableFuture
                        .supplyAsync(() -> runChain(variable, runId), executor)
                        .orTimeout(options.getChainTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(e -> chainFailed(variable, e)));
            }
            // Barrier: identities need every chain.
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

            List<VariableChainResult> results = new ArrayList<>();
            for (CompletableFuture<VariableChainResult> future : futures.values()) {
                results.add(future.join());
            }
            return results;
        } finally {
            shutdown(executor);
        }
    }

    VariableChainResult runChain(String variableId, String runId) {
        try (LogContext ignored = LogContext.forVariable(variableId, "chain").with("runId", runId)) {
            long start = System.nanoTime();
            List<FailedSource> failures = new ArrayList<>();
            Map<String, String> digests = new TreeMap<>();

            List<ObservationSet> loaded = new ArrayList<>();
            for (SourceDescriptor descriptor : config.sourcesFor(variableId)) {
                try {
                    ObservationSet set = timed("load", () -> sourceAdapter.load(descriptor));
                    set.getContentDigest().ifPresent(d -> digests.put(digestKey(descriptor.getPath()), d));
                    loaded.add(set);
                } catch (ReconciliationException e) {
                    failures.add(failed(variableId, descriptor.getSourceId(), "load", e));
                }
            }
            if (loaded.isEmpty()) {
                log.warn("chain.noSources variableId={} failed={}", variableId, failures.size());
                return VariableChainResult.failure(variableId, failures, digests);
            }

            Unit canonical = config.canonicalUnitFor(variableId);
            List<ObservationSet> normalized = new ArrayList<>();
            try {
                for (ObservationSet set : loaded) {
                    normalized.add(timed("normalize", () -> normalizer.normalize(set,
                            canonical != null ? canonical : set.getUnit())));
                }
            } catch (ReconciliationException e) {
                failures.add(failed(variableId, null, "normalize", e));
                return VariableChainResult.failure(variableId, failures, digests);
            }

            MergeOutcome merged;
            try {
                merged = timed("merge", () -> merger.merge(normalized, config.priorityFor(variableId)));
            } catch (IllegalArgumentException | ReconciliationException e) {
                failures.add(failed(variableId, null, "merge", e));
                return VariableChainResult.failure(variableId, failures, digests);
            }
            metricsService.incrementMergeConflicts(variableId, merged.conflicts().size());

            GapResolution resolution;
            try {
                resolution = timed("gap-resolve", () -> gapResolver.resolveAll(merged.series(),
                        config.policiesFor(variableId), config.boundsFor(variableId)));
            } catch (IllegalArgumentException | ReconciliationException e) {
                failures.add(failed(variableId, null, "gap-resolve", e));
                return VariableChainResult.failure(variableId, failures, digests);
            }
            for (GapAction action : resolution.actions()) {
                if (action.isApplied()) {
                    metricsService.incrementGapFills(variableId, action.policy(), 1);
                }
            }

            log.info("chain.completed variableId={} sources={} failed={} conflicts={} gapActions={} durationMs={}",
                    variableId, loaded.size(), failures.size(), merged.conflicts().size(),
                    resolution.actions().size(), Duration.ofNanos(System.nanoTime() - start).toMillis());
            return VariableChainResult.success(resolution.series(), merged.conflicts(), resolution.actions(),
                    failures, digests);
        }
    }

    private VariableChainResult chainFailed(String variableId, Throwable error) {
        Throwable cause = unwrap(error);
        FailedSource failure = failed(variableId, null, "chain", cause);
        return VariableChainResult.failure(variableId, List.of(failure), Map.of());
    }

    private FailedSource failed(String variableId, String sourceId, String stage, Throwable error) {
        log.warn("chain.failed variableId={} sourceId={} stage={} error={}",
                variableId, sourceId, stage, error.getMessage());
        metricsService.incrementFailedSource(stage);
        return FailedSource.of(variableId, sourceId, stage, error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private <T> T timed(String stage, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            return work.get();
        } finally {
            metricsService.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Path as recorded in the run metadata: relative to the configuration directory when
     * possible, always with forward slashes.
     */
    String digestKey(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path base = config.getBaseDirectory();
        if (base != null && absolute.startsWith(base.toAbsolutePath().normalize())) {
            absolute = base.toAbsolutePath().normalize().relativize(absolute);
        }
        return absolute.toString().replace('\\', '/');
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
