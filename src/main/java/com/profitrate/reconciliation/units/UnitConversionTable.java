package com.profitrate.reconciliation.units;

import com.profitrate.reconciliation.core.model.Unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The closed, declared set of permitted unit conversions.
 * A rule scoped to a variable takes precedence over a general rule for the same pair.
 */
public final class UnitConversionTable {
    private final Map<String, ConversionRule> rules;

    private UnitConversionTable(Map<String, ConversionRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * Finds the rule for a pair, preferring one scoped to {@code variableId}.
     */
    public Optional<ConversionRule> find(Unit from, Unit to, String variableId) {
        if (variableId != null) {
            ConversionRule scoped = rules.get(key(from, to, variableId));
            if (scoped != null) {
                return Optional.of(scoped);
            }
        }
        return Optional.ofNullable(rules.get(key(from, to, null)));
    }

    public boolean supports(Unit from, Unit to, String variableId) {
        return find(from, to, variableId).isPresent();
    }

    public List<ConversionRule> getRules() {
        return List.copyOf(rules.values());
    }

    public int size() {
        return rules.size();
    }

    private static String key(Unit from, Unit to, String variableId) {
        return from.name() + "->" + to.name() + "@" + (variableId == null ? "*" : variableId);
    }

    public static UnitConversionTable empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, ConversionRule> rules = new LinkedHashMap<>();

        /**
         * Adds a rule, replacing any earlier rule for the same pair and scope.
         */
        public Builder rule(ConversionRule rule) {
            Objects.requireNonNull(rule, "rule is required");
            rules.put(key(rule.from(), rule.to(), rule.variableId()), rule);
            return this;
        }

        public Builder rules(List<? extends ConversionRule> newRules) {
            new ArrayList<>(newRules).forEach(this::rule);
            return this;
        }

        public Builder multiplier(Unit from, Unit to, double factor) {
            return rule(new MultiplierRule(from, to, factor));
        }

        public UnitConversionTable build() {
            return new UnitConversionTable(rules);
        }
    }
}
