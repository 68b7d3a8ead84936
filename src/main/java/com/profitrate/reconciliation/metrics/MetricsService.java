package com.profitrate.reconciliation.metrics;

import com.profitrate.reconciliation.identity.Classification;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a
 * metrics backend.
 */
public interface MetricsService {

    /**
     * Records how long one stage took for one variable or identity.
     */
    void recordStageDuration(String stage, Duration duration);

    void incrementMergeConflicts(String variableId, int count);

    void incrementGapFills(String variableId, String policy, int count);

    void incrementClassification(String identityName, Classification classification);

    void incrementFailedSource(String stage);

    void recordSystematicBias(String identityName);
}
