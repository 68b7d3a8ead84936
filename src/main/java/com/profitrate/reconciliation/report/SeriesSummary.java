package com.profitrate.reconciliation.report;

import com.profitrate.reconciliation.core.model.ResolutionMethod;
import com.profitrate.reconciliation.core.model.VariableSeries;

/**
 * Coverage of one reconciled series, counted per resolution method. The first and last
 * years are those holding a value; missing years only show up in {@code missingCount}.
 */
public record SeriesSummary(
        String variableId,
        String unit,
        Integer firstYear,
        Integer lastYear,
        long nativeCount,
        long mergedCount,
        long gapFilledCount,
        long manualOverrideCount,
        long derivedCount,
        int missingCount
) {

    public static SeriesSummary of(VariableSeries series) {
        return new SeriesSummary(
                series.getVariableId(),
                series.getUnit().wireName(),
                series.getPoints().isEmpty() ? null : series.getPoints().firstKey(),
                series.getPoints().isEmpty() ? null : series.getPoints().lastKey(),
                series.count(ResolutionMethod.NATIVE),
                series.count(ResolutionMethod.MERGED),
                series.count(ResolutionMethod.GAP_FILLED_LINEAR),
                series.count(ResolutionMethod.MANUAL_OVERRIDE),
                series.count(ResolutionMethod.DERIVED),
                series.getMissingYears().size());
    }
}
