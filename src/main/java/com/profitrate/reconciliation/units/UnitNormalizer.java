package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ObservationSet;
import com.profitrate.reconciliation.core.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts observation sets into a canonical unit using only the declared
 * {@link UnitConversionTable}.
 *
 * <p>There is no fallback: a pair missing from the table always fails with
 * {@link UnsupportedConversionException}, whatever the magnitudes of the data.</p>
 */
public class UnitNormalizer {
    private static final Logger log = LoggerFactory.getLogger(UnitNormalizer.class);

    private final UnitConversionTable table;

    public UnitNormalizer() {
        this(DefaultConversionRules.createDefaultTable());
    }

    public UnitNormalizer(UnitConversionTable table) {
        this.table = Objects.requireNonNull(table, "table is required");
    }

    /**
     * Converts every value of the set into {@code target}. Missing values stay missing.
     *
     * <p>Normalizing to the set's own unit returns the set unchanged, unless the table
     * declares an {@code index -> index} rebasing rule for the variable, which is then
     * applied.</p>
     *
     * @throws UnsupportedConversionException if the pair is not declared
     */
    public ObservationSet normalize(ObservationSet set, Unit target) {
        Objects.requireNonNull(set, "set is required");
        Objects.requireNonNull(target, "target is required");
        Unit source = set.getUnit();

        Optional<ConversionRule> rule = table.find(source, target, set.getVariableId());
        if (rule.isEmpty()) {
            if (source == target) {
                return set;
            }
            throw new UnsupportedConversionException(set.getVariableId(), source, target);
        }

        ConversionRule conversion = rule.get();
        List<Observation> converted = new ArrayList<>(set.size());
        for (Observation o : set.getObservations()) {
            Double value = o.hasValue() ? conversion.apply(o.value()) : null;
            converted.add(o.withValue(value, target));
        }
        log.debug("units.normalized variableId={} sourceId={} rule='{}' observations={}",
                set.getVariableId(), set.getSourceId(), conversion.describe(), converted.size());
        return new ObservationSet(set.getVariableId(), set.getSourceId(), target, converted,
                set.getContentDigest().orElse(null));
    }

    /**
     * Checks whether {@link #normalize} would accept the pair, without converting anything.
     */
    public boolean canNormalize(Unit source, Unit target, String variableId) {
        return source == target || table.supports(source, target, variableId);
    }

    public UnitConversionTable getTable() {
        return table;
    }
}
