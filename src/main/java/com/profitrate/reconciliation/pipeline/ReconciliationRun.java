package com.profitrate.reconciliation.pipeline;

import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.report.ReconciliationReport;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Outputs of one reconciliation run: the resolved series, including derived ones, and
 * the report.
 *
 * @param runId  correlation id used in logs only
 * @param series resolved series by variable id, sorted
 * @param report the audit report
 */
public record ReconciliationRun(String runId, Map<String, VariableSeries> series, ReconciliationReport report) {

    public ReconciliationRun {
        Objects.requireNonNull(report, "report is required");
        series = Collections.unmodifiableMap(new TreeMap<>(series != null ? series : Map.of()));
    }
}
