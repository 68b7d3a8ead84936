package com.profitrate.reconciliation.config;

import com.profitrate.reconciliation.core.model.Unit;
import com.profitrate.reconciliation.core.model.YearRange;
import com.profitrate.reconciliation.derive.DerivedVariable;
import com.profitrate.reconciliation.gap.GapPolicy;
import com.profitrate.reconciliation.identity.IdentityRule;
import com.profitrate.reconciliation.source.SourceDescriptor;
import com.profitrate.reconciliation.units.UnitConversionTable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A validated run configuration. Every source has a native unit, every variable has a
 * canonical unit reachable through the conversion table, and every contributing source
 * is ranked in its variable's priority list.
 */
public final class ReconciliationConfig {
    private final List<SourceDescriptor> sources;
    private final Map<String, List<String>> priorities;
    private final Map<String, Unit> canonicalUnits;
    private final UnitConversionTable conversionTable;
    private final Map<String, List<GapPolicy>> gapPolicies;
    private final Map<String, YearRange> bounds;
    private final List<IdentityRule> identities;
    private final List<DerivedVariable> derivedVariables;
    private final Duration readTimeout;
    private final Integer workers;
    private final Map<Path, String> inputDigests;
    private final Path baseDirectory;

    private ReconciliationConfig(Builder builder) {
        this.sources = List.copyOf(builder.sources);
        this.priorities = copyOfLists(builder.priorities);
        this.canonicalUnits = Collections.unmodifiableMap(new TreeMap<>(builder.canonicalUnits));
        this.conversionTable = Objects.requireNonNull(builder.conversionTable, "conversionTable is required");
        this.gapPolicies = copyOfLists(builder.gapPolicies);
        this.bounds = Collections.unmodifiableMap(new TreeMap<>(builder.bounds));
        this.identities = List.copyOf(builder.identities);
        this.derivedVariables = List.copyOf(builder.derivedVariables);
        this.readTimeout = builder.readTimeout;
        this.workers = builder.workers;
        this.inputDigests = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputDigests));
        this.baseDirectory = builder.baseDirectory;
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> map) {
        Map<String, List<T>> copy = new TreeMap<>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public List<SourceDescriptor> getSources() {
        return sources;
    }

    /**
     * Variables fed by at least one source, sorted.
     */
    public SortedSet<String> getVariables() {
        SortedSet<String> variables = new TreeSet<>();
        sources.forEach(s -> variables.add(s.getVariableId()));
        return variables;
    }

    public List<SourceDescriptor> sourcesFor(String variableId) {
        List<SourceDescriptor> result = new ArrayList<>();
        for (SourceDescriptor s : sources) {
            if (s.getVariableId().equals(variableId)) {
                result.add(s);
            }
        }
        return result;
    }

    public List<String> priorityFor(String variableId) {
        return priorities.getOrDefault(variableId, List.of());
    }

    public Unit canonicalUnitFor(String variableId) {
        return canonicalUnits.get(variableId);
    }

    public Map<String, Unit> getCanonicalUnits() {
        return canonicalUnits;
    }

    public UnitConversionTable getConversionTable() {
        return conversionTable;
    }

    /**
     * Declared policies for a variable; {@code leave-missing} when none were declared.
     */
    public List<GapPolicy> policiesFor(String variableId) {
        return gapPolicies.getOrDefault(variableId, List.of(GapPolicy.leaveMissing()));
    }

    public YearRange boundsFor(String variableId) {
        return bounds.getOrDefault(variableId, YearRange.unbounded());
    }

    public List<IdentityRule> getIdentities() {
        return identities;
    }

    public List<DerivedVariable> getDerivedVariables() {
        return derivedVariables;
    }

    /**
     * Per-source read timeout, or null to use the adapter default.
     */
    public Duration getReadTimeout() {
        return readTimeout;
    }

    /**
     * Declared worker count, or null to size the pool from the variable count.
     */
    public Integer getWorkers() {
        return workers;
    }

    /**
     * Configuration documents read to build this config, in load order.
     */
    public List<Path> getInputFiles() {
        return List.copyOf(inputDigests.keySet());
    }

    /**
     * SHA-256 of each configuration document, taken from the bytes that were parsed.
     */
    public Map<Path, String> getInputDigests() {
        return inputDigests;
    }

    /**
     * Directory that relative paths were resolved against, or null for programmatic configs.
     */
    public Path getBaseDirectory() {
        return baseDirectory;
    }

    @Override
    public String toString() {
        return "ReconciliationConfig{sources=" + sources.size() + ", variables=" + getVariables()
                + ", identities=" + identities.size() + ", derived=" + derivedVariables.size() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<SourceDescriptor> sources = new ArrayList<>();
        private final Map<String, List<String>> priorities = new TreeMap<>();
        private final Map<String, Unit> canonicalUnits = new TreeMap<>();
        private UnitConversionTable conversionTable = UnitConversionTable.empty();
        private final Map<String, List<GapPolicy>> gapPolicies = new TreeMap<>();
        private final Map<String, YearRange> bounds = new TreeMap<>();
        private final List<IdentityRule> identities = new ArrayList<>();
        private final List<DerivedVariable> derivedVariables = new ArrayList<>();
        private Duration readTimeout;
        private Integer workers;
        private final Map<Path, String> inputDigests = new LinkedHashMap<>();
        private Path baseDirectory;

        public Builder source(SourceDescriptor source) {
            this.sources.add(Objects.requireNonNull(source, "source is required"));
            return this;
        }

        public Builder priority(String variableId, List<String> sourceIds) {
            this.priorities.put(variableId, sourceIds);
            return this;
        }

        public Builder canonicalUnit(String variableId, Unit unit) {
            this.canonicalUnits.put(variableId, unit);
            return this;
        }

        public Builder conversionTable(UnitConversionTable conversionTable) {
            this.conversionTable = conversionTable;
            return this;
        }

        public Builder gapPolicies(String variableId, List<GapPolicy> policies) {
            this.gapPolicies.put(variableId, policies);
            return this;
        }

        public Builder bounds(String variableId, YearRange range) {
            this.bounds.put(variableId, range);
            return this;
        }

        public Builder identity(IdentityRule rule) {
            this.identities.add(Objects.requireNonNull(rule, "rule is required"));
            return this;
        }

        public Builder derivedVariable(DerivedVariable derived) {
            this.derivedVariables.add(Objects.requireNonNull(derived, "derived is required"));
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder workers(Integer workers) {
            this.workers = workers;
            return this;
        }

        public Builder inputFile(Path file, String digest) {
            this.inputDigests.put(file, digest);
            return this;
        }

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public ReconciliationConfig build() {
            return new ReconciliationConfig(this);
        }
    }
}
