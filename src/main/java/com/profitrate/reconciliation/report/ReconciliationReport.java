package com.profitrate.reconciliation.report;

import com.profitrate.reconciliation.gap.GapAction;
import com.profitrate.reconciliation.identity.ErrorDiagnostics;
import com.profitrate.reconciliation.identity.ErrorStatistics;
import com.profitrate.reconciliation.identity.IdentitySkip;
import com.profitrate.reconciliation.identity.SystematicBiasFinding;
import com.profitrate.reconciliation.identity.ValidationResult;
import com.profitrate.reconciliation.merge.MergeConflict;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The audit artifact of one reconciliation run.
 *
 * <p>Every list is sorted by its key (variable or identity, then year) and every merge
 * conflict, gap action and validation result appears exactly once. Instances are built
 * by {@link ReportBuilder} and are immutable.</p>
 */
public record ReconciliationReport(
        List<MergeConflict> mergeConflicts,
        List<GapAction> gapActions,
        List<ValidationResult> validationResults,
        List<SystematicBiasFinding> systematicBiasFindings,
        List<IdentitySkip> identitySkips,
        List<FailedSource> failedSources,
        List<ErrorStatistics> errorStatistics,
        List<ErrorDiagnostics> errorDiagnostics,
        List<SeriesSummary> seriesSummaries,
        Map<String, String> inputDigests
) {
    public ReconciliationReport {
        mergeConflicts = copy(mergeConflicts);
        gapActions = copy(gapActions);
        validationResults = copy(validationResults);
        systematicBiasFindings = copy(systematicBiasFindings);
        identitySkips = copy(identitySkips);
        failedSources = copy(failedSources);
        errorStatistics = copy(errorStatistics);
        errorDiagnostics = copy(errorDiagnostics);
        seriesSummaries = copy(seriesSummaries);
        inputDigests = Collections.unmodifiableMap(new TreeMap<>(inputDigests != null ? inputDigests : Map.of()));
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }

    public Optional<MergeConflict> findMergeConflict(String variableId, int year) {
        return mergeConflicts.stream()
                .filter(c -> c.variableId().equals(variableId) && c.year() == year)
                .findFirst();
    }

    public Optional<GapAction> findGapAction(String variableId, int year) {
        return gapActions.stream()
                .filter(a -> a.variableId().equals(variableId) && a.year() == year)
                .findFirst();
    }

    public Optional<ValidationResult> findValidationResult(String identityName, int year) {
        return validationResults.stream()
                .filter(r -> r.identityName().equals(identityName) && r.year() == year)
                .findFirst();
    }

    public Optional<IdentitySkip> findIdentitySkip(String identityName, int year) {
        return identitySkips.stream()
                .filter(s -> s.identityName().equals(identityName) && s.year() == year)
                .findFirst();
    }

    public Optional<SystematicBiasFinding> findBiasFinding(String identityName) {
        return systematicBiasFindings.stream()
                .filter(f -> f.identityName().equals(identityName))
                .findFirst();
    }

    public List<FailedSource> failuresFor(String variableId) {
        return failedSources.stream().filter(f -> f.variableId().equals(variableId)).toList();
    }

    public long flaggedCount() {
        return validationResults.stream().filter(ValidationResult::isFlagged).count();
    }

    public boolean hasFailures() {
        return !failedSources.isEmpty();
    }

    @Override
    public String toString() {
        return "ReconciliationReport{conflicts=" + mergeConflicts.size()
                + ", gapActions=" + gapActions.size()
                + ", results=" + validationResults.size()
                + ", flagged=" + flaggedCount()
                + ", biasFindings=" + systematicBiasFindings.size()
                + ", skips=" + identitySkips.size()
                + ", failedSources=" + failedSources.size() + '}';
    }
}
