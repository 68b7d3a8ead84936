package com.profitrate.reconciliation.metrics;

import com.profitrate.reconciliation.identity.Classification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.stage.duration} Timer (tag: stage)</li>
 *   <li>{@code reconciliation.merge.conflicts} Counter (tag: variable)</li>
 *   <li>{@code reconciliation.gap.fills} Counter (tags: variable, policy)</li>
 *   <li>{@code reconciliation.identity.results} Counter (tags: identity, classification)</li>
 *   <li>{@code reconciliation.sources.failed} Counter (tag: stage)</li>
 *   <li>{@code reconciliation.identity.bias} Counter (tag: identity)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("reconciliation.stage.duration")
                        .description("Duration of reconciliation stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMergeConflicts(String variableId, int count) {
        if (count <= 0) {
            return;
        }
        Counter counter = counterCache.computeIfAbsent("conflicts:" + variableId, k ->
                Counter.builder("reconciliation.merge.conflicts")
                        .description("Years where sources disagreed")
                        .tag("variable", variableId)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementGapFills(String variableId, String policy, int count) {
        if (count <= 0) {
            return;
        }
        Counter counter = counterCache.computeIfAbsent("gap:" + variableId + ":" + policy, k ->
                Counter.builder("reconciliation.gap.fills")
                        .description("Values written by a gap policy")
                        .tag("variable", variableId)
                        .tag("policy", policy)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementClassification(String identityName, Classification classification) {
        Counter counter = counterCache.computeIfAbsent("class:" + identityName + ":" + classification.name(), k ->
                Counter.builder("reconciliation.identity.results")
                        .description("Identity results by classification")
                        .tag("identity", identityName)
                        .tag("classification", classification.label())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementFailedSource(String stage) {
        Counter counter = counterCache.computeIfAbsent("failed:" + stage, k ->
                Counter.builder("reconciliation.sources.failed")
                        .description("Sources or variables downgraded to failed entries")
                        .tag("stage", stage)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSystematicBias(String identityName) {
        Counter counter = counterCache.computeIfAbsent("bias:" + identityName, k ->
                Counter.builder("reconciliation.identity.bias")
                        .description("Systematic bias findings")
                        .tag("identity", identityName)
                        .register(registry));
        counter.increment();
    }
}
