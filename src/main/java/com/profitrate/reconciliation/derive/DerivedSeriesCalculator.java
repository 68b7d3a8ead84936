package com.profitrate.reconciliation.derive;

import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ResolutionMethod;
import com.profitrate.reconciliation.core.model.SeriesPoint;
import com.profitrate.reconciliation.core.model.VariableSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes derived series from resolved input series.
 * A year gets a derived value only when every input has a value and the result is finite;
 * every other year of the inputs is recorded as missing.
 */
public class DerivedSeriesCalculator {
    private static final Logger log = LoggerFactory.getLogger(DerivedSeriesCalculator.class);

    public VariableSeries calculate(DerivedVariable derived, Map<String, VariableSeries> seriesByVariable) {
        VariableSeries.Builder builder = VariableSeries.builder(derived.variableId(), derived.unit());
        List<String> inputs = derived.formula().getVariables();

        SortedSet<Integer> years = new TreeSet<>();
        for (String input : inputs) {
            VariableSeries s = seriesByVariable.get(input);
            if (s != null) {
                years.addAll(s.allYears());
            }
        }

        for (int year : years) {
            Map<String, Double> values = new HashMap<>();
            for (String input : inputs) {
                Optional<SeriesPoint> point = Optional.ofNullable(seriesByVariable.get(input))
                        .flatMap(s -> s.get(year));
                point.ifPresent(p -> values.put(input, p.value()));
            }
            if (values.size() < inputs.size()) {
                builder.missing(year);
                continue;
            }
            double value = derived.formula().evaluate(values);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                builder.missing(year);
                continue;
            }
            builder.point(Observation.of(derived.variableId(), year, value, derived.unit(), derived.sourceId()),
                    ResolutionMethod.DERIVED);
        }

        VariableSeries series = builder.build();
        log.info("derive.completed variableId={} formula='{}' values={} missing={}",
                derived.variableId(), derived.formula(), series.size(), series.getMissingYears().size());
        return series;
    }

    /**
     * Computes derived variables in declaration order; later ones may use earlier ones.
     *
     * @return the input map extended with every derived series
     */
    public Map<String, VariableSeries> calculateAll(List<DerivedVariable> derived,
                                                    Map<String, VariableSeries> seriesByVariable) {
        Map<String, VariableSeries> all = new LinkedHashMap<>(seriesByVariable);
        for (DerivedVariable d : derived) {
            if (all.containsKey(d.variableId())) {
                throw new IllegalArgumentException("Derived variable '" + d.variableId()
                        + "' collides with an existing series");
            }
            all.put(d.variableId(), calculate(d, all));
        }
        return all;
    }
}
