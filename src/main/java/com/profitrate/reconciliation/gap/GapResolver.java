package com.profitrate.reconciliation.gap;

import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ResolutionMethod;
import com.profitrate.reconciliation.core.model.SeriesPoint;
import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.core.model.YearRange;
import com.profitrate.reconciliation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies a named {@link GapPolicy} to a series and records every decision as a
 * {@link GapAction}. Nothing is filled unless a policy says so.
 */
public class GapResolver {
    private static final Logger log = LoggerFactory.getLogger(GapResolver.class);

    public static final String INTERPOLATED_SOURCE_ID = "interpolated";
    public static final String OVERRIDE_SOURCE_ID = "manual-override";

    /**
     * Applies one policy to the series.
     *
     * @param series the merged series; it is not modified
     * @param policy the policy to apply
     * @param bounds years eligible for filling
     * @return a new series and the actions taken
     * @throws MissingRationaleException if a manual override has a blank rationale
     */
    public GapResolution resolve(VariableSeries series, GapPolicy policy, YearRange bounds) {
        Objects.requireNonNull(series, "series is required");
        Objects.requireNonNull(policy, "policy is required");
        Objects.requireNonNull(bounds, "bounds is required");

        if (policy instanceof GapPolicy.LeaveMissing) {
            return new GapResolution(series, List.of());
        }
        if (policy instanceof GapPolicy.ManualOverride override) {
            return applyOverride(series, override, bounds);
        }
        if (policy instanceof GapPolicy.BoundedLinearInterpolation linear) {
            return interpolate(series, linear.maxGapYears(), bounds, Set.of());
        }
        throw new IllegalArgumentException("Unknown gap policy: " + policy);
    }

    /**
     * Applies several policies declared for one variable. Manual overrides run first, in
     * year order, so interpolation can anchor on them and every year gets at most one
     * action. An override without rationale is recorded as a failed action, its year is
     * left as it was, and the remaining policies still run.
     */
    public GapResolution resolveAll(VariableSeries series, List<GapPolicy> policies, YearRange bounds) {
        List<GapPolicy> ordered = new ArrayList<>(policies);
        ordered.sort(Comparator.comparingInt(GapResolver::applicationOrder)
                .thenComparingInt(p -> p instanceof GapPolicy.ManualOverride o ? o.year() : 0));

        VariableSeries current = series;
        List<GapAction> actions = new ArrayList<>();
        Set<Integer> decided = new HashSet<>();
        for (GapPolicy policy : ordered) {
            try {
                GapResolution step = policy instanceof GapPolicy.BoundedLinearInterpolation linear
                        ? interpolate(current, linear.maxGapYears(), bounds, decided)
                        : resolve(current, policy, bounds);
                current = step.series();
                step.actions().forEach(a -> decided.add(a.year()));
                actions.addAll(step.actions());
            } catch (MissingRationaleException e) {
                log.warn("gap.override.rejected variableId={} year={} error={}",
                        e.getVariableId(), e.getYear(), e.getMessage());
                actions.add(GapAction.failed(series.getVariableId(), e.getYear(), policy.name(), e.getMessage()));
                decided.add(e.getYear());
            } catch (IllegalArgumentException e) {
                if (!(policy instanceof GapPolicy.ManualOverride override)) {
                    throw e;
                }
                log.warn("gap.override.rejected variableId={} year={} error={}",
                        series.getVariableId(), override.year(), e.getMessage());
                actions.add(GapAction.failed(series.getVariableId(), override.year(), policy.name(), e.getMessage()));
                decided.add(override.year());
            }
        }
        return new GapResolution(current, actions);
    }

    private static int applicationOrder(GapPolicy policy) {
        return policy instanceof GapPolicy.ManualOverride ? 0 : 1;
    }

    private GapResolution applyOverride(VariableSeries series, GapPolicy.ManualOverride override, YearRange bounds) {
        String variableId = series.getVariableId();
        if (!override.hasRationale()) {
            throw new MissingRationaleException(variableId, override.year());
        }
        if (!bounds.contains(override.year())) {
            throw new IllegalArgumentException("Override year " + override.year() + " for " + variableId
                    + " lies outside bounds " + bounds);
        }

        Double previous = series.get(override.year()).map(SeriesPoint::value).orElse(null);
        Observation observation = Observation.of(variableId, override.year(), override.value(),
                series.getUnit(), OVERRIDE_SOURCE_ID);
        VariableSeries updated = series.toBuilder()
                .point(observation, ResolutionMethod.MANUAL_OVERRIDE)
                .build();

        log.info("gap.override variableId={} year={} value={} previous={} rationale='{}'",
                variableId, override.year(), override.value(), previous, override.rationale());
        return new GapResolution(updated, List.of(GapAction.overridden(variableId, override.year(),
                override.value(), previous, override.rationale().trim())));
    }

    /**
     * Fills short runs between present values. Years in {@code decided} already carry an
     * action from an earlier policy and are left alone.
     */
    private GapResolution interpolate(VariableSeries series, int maxGapYears, YearRange bounds,
                                      Set<Integer> decided) {
        String variableId = series.getVariableId();
        try (LogContext ignored = LogContext.forVariable(variableId, "gap-resolve")) {
            // Interpolated points never anchor further interpolation.
            NavigableMap<Integer, SeriesPoint> anchors = new TreeMap<>();
            for (Map.Entry<Integer, SeriesPoint> e : series.getPoints().entrySet()) {
                if (e.getValue().method() != ResolutionMethod.GAP_FILLED_LINEAR) {
                    anchors.put(e.getKey(), e.getValue());
                }
            }

            VariableSeries.Builder builder = series.toBuilder();
            List<GapAction> actions = new ArrayList<>();

            Map.Entry<Integer, SeriesPoint> lower = null;
            for (Map.Entry<Integer, SeriesPoint> upper : anchors.entrySet()) {
                if (lower != null) {
                    int y0 = lower.getKey();
                    int y1 = upper.getKey();
                    int gap = y1 - y0 - 1;
                    if (gap > 0) {
                        fillRun(series, lower.getValue(), upper.getValue(), gap, maxGapYears, bounds, decided,
                                builder, actions);
                    }
                }
                lower = upper;
            }

            // Missing years outside the anchored span can never be interpolated.
            Integer first = anchors.isEmpty() ? null : anchors.firstKey();
            Integer last = anchors.isEmpty() ? null : anchors.lastKey();
            for (int year : series.getMissingYears()) {
                boolean before = first == null || year < first;
                boolean after = last != null && year > last;
                if ((before || after) && bounds.contains(year) && !decided.contains(year)) {
                    actions.add(GapAction.skipped(variableId, year, after ? last : null, before ? first : null,
                            "no present value on both sides of " + year));
                }
            }

            actions.sort(Comparator.comparingInt(GapAction::year));
            VariableSeries filled = builder.build();
            log.info("gap.interpolated variableId={} maxGapYears={} filled={} skipped={}",
                    variableId, maxGapYears,
                    actions.stream().filter(GapAction::isApplied).count(),
                    actions.stream().filter(a -> a.status() == GapAction.Status.SKIPPED).count());
            return new GapResolution(filled, actions);
        }
    }

    private void fillRun(VariableSeries series, SeriesPoint p0, SeriesPoint p1, int gap, int maxGapYears,
                         YearRange bounds, Set<Integer> decided, VariableSeries.Builder builder,
                         List<GapAction> actions) {
        String variableId = series.getVariableId();
        int y0 = p0.year();
        int y1 = p1.year();
        for (int year = y0 + 1; year < y1; year++) {
            if (!bounds.contains(year) || decided.contains(year)) {
                continue;
            }
            if (gap > maxGapYears) {
                actions.add(GapAction.skipped(variableId, year, y0, y1,
                        "gap of " + gap + " years between " + y0 + " and " + y1
                                + " exceeds max " + maxGapYears));
                continue;
            }
            double value = interpolate(p0.value(), y0, p1.value(), y1, year);
            Observation observation = Observation.of(variableId, year, value, series.getUnit(),
                    INTERPOLATED_SOURCE_ID);
            builder.point(observation, ResolutionMethod.GAP_FILLED_LINEAR);
            actions.add(GapAction.interpolated(variableId, year, value, y0, y1,
                    "linear between " + y0 + " (" + p0.sourceId() + ") and " + y1 + " (" + p1.sourceId() + ")"));
        }
    }

    /**
     * Weighted form that gives exactly {@code (v0 + v1) / 2} at the midpoint of a two-year span.
     */
    static double interpolate(double v0, int y0, double v1, int y1, int year) {
        return (v0 * (y1 - year) + v1 * (year - y0)) / (y1 - y0);
    }
}
