package com.profitrate.reconciliation.metrics;

import com.profitrate.reconciliation.identity.Classification;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementMergeConflicts(String variableId, int count) {
    }

    @Override
    public void incrementGapFills(String variableId, String policy, int count) {
    }

    @Override
    public void incrementClassification(String identityName, Classification classification) {
    }

    @Override
    public void incrementFailedSource(String stage) {
    }

    @Override
    public void recordSystematicBias(String identityName) {
    }
}
