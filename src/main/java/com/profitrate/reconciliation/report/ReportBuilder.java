package com.profitrate.reconciliation.report;

import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.gap.GapAction;
import com.profitrate.reconciliation.identity.ErrorDiagnostics;
import com.profitrate.reconciliation.identity.ErrorStatistics;
import com.profitrate.reconciliation.identity.IdentitySkip;
import com.profitrate.reconciliation.identity.IdentityValidation;
import com.profitrate.reconciliation.identity.SystematicBiasFinding;
import com.profitrate.reconciliation.identity.ValidationResult;
import com.profitrate.reconciliation.merge.MergeConflict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Aggregates the outputs of every stage into a {@link ReconciliationReport}.
 * Pure: sorts and checks its inputs, computes nothing new except series summaries.
 */
public class ReportBuilder {

    /**
     * Builds a report from the four core inputs.
     *
     * @throws IllegalStateException if an item appears twice for the same key
     */
    public ReconciliationReport build(Map<String, VariableSeries> seriesByVariable,
                                      List<MergeConflict> mergeConflicts,
                                      List<GapAction> gapActions,
                                      List<ValidationResult> validationResults) {
        return build(seriesByVariable, mergeConflicts, gapActions, validationResults,
                List.of(), List.of(), List.of(), List.of(), List.of(), Map.of());
    }

    /**
     * Builds a report from whole identity validations, failed sources and input digests.
     */
    public ReconciliationReport build(Map<String, VariableSeries> seriesByVariable,
                                      List<MergeConflict> mergeConflicts,
                                      List<GapAction> gapActions,
                                      List<IdentityValidation> validations,
                                      List<FailedSource> failedSources,
                                      Map<String, String> inputDigests) {
        List<ValidationResult> results = new ArrayList<>();
        List<IdentitySkip> skips = new ArrayList<>();
        List<SystematicBiasFinding> findings = new ArrayList<>();
        List<ErrorStatistics> statistics = new ArrayList<>();
        List<ErrorDiagnostics> diagnostics = new ArrayList<>();
        for (IdentityValidation validation : validations) {
            results.addAll(validation.results());
            skips.addAll(validation.skips());
            validation.bias().ifPresent(findings::add);
            statistics.addAll(validation.statistics());
            if (validation.diagnostics() != null) {
                diagnostics.add(validation.diagnostics());
            }
        }
        return build(seriesByVariable, mergeConflicts, gapActions, results, findings, skips,
                failedSources, statistics, diagnostics, inputDigests);
    }

    private ReconciliationReport build(Map<String, VariableSeries> seriesByVariable,
                                       List<MergeConflict> mergeConflicts,
                                       List<GapAction> gapActions,
                                       List<ValidationResult> validationResults,
                                       List<SystematicBiasFinding> findings,
                                       List<IdentitySkip> skips,
                                       List<FailedSource> failedSources,
                                       List<ErrorStatistics> statistics,
                                       List<ErrorDiagnostics> diagnostics,
                                       Map<String, String> inputDigests) {
        Objects.requireNonNull(seriesByVariable, "seriesByVariable is required");

        List<MergeConflict> conflicts = sortedUnique("merge conflict", mergeConflicts,
                c -> c.variableId() + "@" + c.year(),
                Comparator.comparing(MergeConflict::variableId).thenComparingInt(MergeConflict::year));
        List<GapAction> actions = sortedUnique("gap action", gapActions,
                a -> a.variableId() + "@" + a.year(),
                Comparator.comparing(GapAction::variableId).thenComparingInt(GapAction::year));
        List<ValidationResult> results = sortedUnique("validation result", validationResults,
                r -> r.identityName() + "@" + r.year(),
                Comparator.comparing(ValidationResult::identityName).thenComparingInt(ValidationResult::year));
        List<IdentitySkip> sortedSkips = sortedUnique("identity skip", skips,
                s -> s.identityName() + "@" + s.year(),
                Comparator.comparing(IdentitySkip::identityName).thenComparingInt(IdentitySkip::year));
        List<SystematicBiasFinding> sortedFindings = sortedUnique("bias finding", findings,
                SystematicBiasFinding::identityName,
                Comparator.comparing(SystematicBiasFinding::identityName));

        List<FailedSource> failures = new ArrayList<>(failedSources);
        failures.sort(Comparator.comparing(FailedSource::variableId)
                .thenComparing(f -> f.sourceId() == null ? "" : f.sourceId())
                .thenComparing(FailedSource::stage));

        List<ErrorStatistics> sortedStats = new ArrayList<>(statistics);
        sortedStats.sort(Comparator.comparing(ErrorStatistics::identityName)
                .thenComparing(ErrorStatistics::basis));
        List<ErrorDiagnostics> sortedDiagnostics = new ArrayList<>(diagnostics);
        sortedDiagnostics.sort(Comparator.comparing(ErrorDiagnostics::identityName));

        List<SeriesSummary> summaries = seriesByVariable.values().stream()
                .sorted(Comparator.comparing(VariableSeries::getVariableId))
                .map(SeriesSummary::of)
                .toList();

        return new ReconciliationReport(conflicts, actions, results, sortedFindings, sortedSkips, failures,
                sortedStats, sortedDiagnostics, summaries, inputDigests);
    }

    private static <T> List<T> sortedUnique(String kind, List<T> items, Function<T, String> key,
                                            Comparator<T> order) {
        Set<String> seen = new HashSet<>();
        for (T item : items) {
            if (!seen.add(key.apply(item))) {
                throw new IllegalStateException("Duplicate " + kind + " for " + key.apply(item));
            }
        }
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(order);
        return sorted;
    }
}
