package com.profitrate.reconciliation.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.profitrate.reconciliation.core.ContentDigest;
import com.profitrate.reconciliation.core.model.Unit;
import com.profitrate.reconciliation.core.model.YearRange;
import com.profitrate.reconciliation.derive.DerivedVariable;
import com.profitrate.reconciliation.gap.GapPolicy;
import com.profitrate.reconciliation.identity.Formula;
import com.profitrate.reconciliation.identity.FormulaParseException;
import com.profitrate.reconciliation.identity.IdentityRule;
import com.profitrate.reconciliation.identity.Tolerance;
import com.profitrate.reconciliation.source.SourceDescriptor;
import com.profitrate.reconciliation.source.SourceLayout;
import com.profitrate.reconciliation.units.ConversionRule;
import com.profitrate.reconciliation.units.DefaultConversionRules;
import com.profitrate.reconciliation.units.MultiplierRule;
import com.profitrate.reconciliation.units.RebaseRule;
import com.profitrate.reconciliation.units.UnitConversionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads the four JSON configuration documents and validates them into a
 * {@link ReconciliationConfig}.
 *
 * <p>Relative source paths resolve against the directory of the sources document. Every
 * problem is reported as a {@link ConfigurationException} naming the offending key,
 * before any source is read.</p>
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Loads and validates a run configuration.
     *
     * @throws ConfigurationException on any malformed, incomplete or inconsistent entry,
     *                                including a source file that does not exist
     */
    public ReconciliationConfig load(Path sourcesFile, Path unitsFile, Path gapPolicyFile, Path identitiesFile) {
        ReconciliationConfig.Builder builder = ReconciliationConfig.builder();
        SourcesConfig sources = read(sourcesFile, SourcesConfig.class, builder);
        UnitsConfig units = read(unitsFile, UnitsConfig.class, builder);
        GapPolicyConfig gaps = read(gapPolicyFile, GapPolicyConfig.class, builder);
        IdentitiesConfig identities = read(identitiesFile, IdentitiesConfig.class, builder);

        Map<String, Unit> nativeUnits = nativeUnits(units);
        Path baseDir = baseDirectory(sourcesFile);
        builder.baseDirectory(baseDir);
        List<SourceDescriptor> descriptors = sources(sources, nativeUnits, baseDir);
        descriptors.forEach(builder::source);

        SortedSet<String> variables = new TreeSet<>();
        descriptors.forEach(d -> variables.add(d.getVariableId()));

        applyRunSettings(sources, builder);
        applyPriorities(sources, descriptors, variables, builder);
        UnitConversionTable table = conversionTable(units);
        builder.conversionTable(table);
        applyCanonicalUnits(units, descriptors, variables, table, builder);
        checkUnusedNativeUnits(units, descriptors);
        applyGapPolicies(gaps, variables, builder);
        Set<String> known = new HashSet<>(variables);
        applyDerived(identities, known, builder);
        applyIdentities(identities, known, builder);

        ReconciliationConfig config = builder.build();
        log.info("config.loaded {}", config);
        return config;
    }

    private <T> T read(Path file, Class<T> type, ReconciliationConfig.Builder builder) {
        String key = file.getFileName().toString();
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException(key, "configuration file not found: " + file);
        }
        try {
            byte[] content = Files.readAllBytes(file);
            T value = objectMapper.readValue(content, type);
            if (value == null) {
                throw new ConfigurationException(key, "document is empty");
            }
            builder.inputFile(file, ContentDigest.sha256(content));
            return value;
        } catch (JsonMappingException e) {
            throw new ConfigurationException(key + pathOf(e), e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(key, "malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException(key, "cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static String pathOf(JsonMappingException e) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                sb.append('.').append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }

    private static Path baseDirectory(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : file.toAbsolutePath();
    }

    private Map<String, Unit> nativeUnits(UnitsConfig units) {
        Map<String, Unit> result = new HashMap<>();
        List<UnitsConfig.NativeUnitEntry> entries = units.nativeUnits() != null ? units.nativeUnits() : List.of();
        for (int i = 0; i < entries.size(); i++) {
            UnitsConfig.NativeUnitEntry entry = entries.get(i);
            String key = "nativeUnits[" + i + "]";
            require(entry.sourceId(), key + ".sourceId");
            require(entry.variableId(), key + ".variableId");
            Unit unit = unit(entry.unit(), key + ".unit");
            if (result.put(entry.sourceId() + "/" + entry.variableId(), unit) != null) {
                throw new ConfigurationException(key, "duplicate native unit for source '" + entry.sourceId()
                        + "' and variable '" + entry.variableId() + "'");
            }
        }
        return result;
    }

    private List<SourceDescriptor> sources(SourcesConfig config, Map<String, Unit> nativeUnits, Path baseDir) {
        List<SourcesConfig.SourceEntry> entries = config.sources();
        if (entries == null || entries.isEmpty()) {
            throw new ConfigurationException("sources", "at least one source is required");
        }
        List<SourceDescriptor> descriptors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            SourcesConfig.SourceEntry entry = entries.get(i);
            String key = "sources[" + i + "]";
            require(entry.sourceId(), key + ".sourceId");
            require(entry.variableId(), key + ".variableId");
            require(entry.path(), key + ".path");
            if (!seen.add(entry.sourceId() + "/" + entry.variableId())) {
                throw new ConfigurationException(key, "source '" + entry.sourceId()
                        + "' declared twice for variable '" + entry.variableId() + "'");
            }

            Path path = baseDir.resolve(entry.path()).normalize();
            if (!Files.isRegularFile(path)) {
                throw new ConfigurationException(key + ".path", "source file not found: " + path);
            }

            Unit unit = nativeUnits.get(entry.sourceId() + "/" + entry.variableId());
            if (unit == null) {
                throw new ConfigurationException("nativeUnits", "no native unit declared for source '"
                        + entry.sourceId() + "' and variable '" + entry.variableId() + "'");
            }

            SourceDescriptor.Builder descriptor = SourceDescriptor.builder()
                    .sourceId(entry.sourceId())
                    .variableId(entry.variableId())
                    .path(path)
                    .nativeUnit(unit);
            if (entry.layout() != null) {
                descriptor.layout(SourceLayout.fromName(entry.layout())
                        .orElseThrow(() -> new ConfigurationException(key + ".layout",
                                "unknown layout '" + entry.layout() + "', expected wide or long")));
            }
            if (entry.rowLabel() != null) descriptor.rowLabel(entry.rowLabel());
            if (entry.labelColumn() != null) descriptor.labelColumn(entry.labelColumn());
            if (entry.firstYearColumn() != null) descriptor.firstYearColumn(entry.firstYearColumn());
            if (entry.yearColumn() != null) descriptor.yearColumn(entry.yearColumn());
            if (entry.variableColumn() != null) descriptor.variableColumn(entry.variableColumn());
            if (entry.valueColumn() != null) descriptor.valueColumn(entry.valueColumn());
            descriptors.add(descriptor.build());
        }
        return descriptors;
    }

    private void applyRunSettings(SourcesConfig config, ReconciliationConfig.Builder builder) {
        if (config.readTimeoutSeconds() != null) {
            if (config.readTimeoutSeconds() <= 0) {
                throw new ConfigurationException("readTimeoutSeconds", "must be > 0, got "
                        + config.readTimeoutSeconds());
            }
            builder.readTimeout(Duration.ofSeconds(config.readTimeoutSeconds()));
        }
        if (config.workers() != null) {
            if (config.workers() < 1) {
                throw new ConfigurationException("workers", "must be >= 1, got " + config.workers());
            }
            builder.workers(config.workers());
        }
    }

    private void applyPriorities(SourcesConfig config, List<SourceDescriptor> descriptors,
                                 SortedSet<String> variables, ReconciliationConfig.Builder builder) {
        Map<String, List<String>> declared = config.priorities() != null ? config.priorities() : Map.of();
        for (String variable : declared.keySet()) {
            if (!variables.contains(variable)) {
                throw new ConfigurationException("priorities." + variable, "no source feeds variable '" + variable + "'");
            }
        }
        for (String variable : variables) {
            List<String> contributing = descriptors.stream()
                    .filter(d -> d.getVariableId().equals(variable))
                    .map(SourceDescriptor::getSourceId)
                    .toList();
            List<String> priority = declared.get(variable);
            String key = "priorities." + variable;
            if (priority == null) {
                if (contributing.size() > 1) {
                    throw new ConfigurationException(key, "variable has " + contributing.size()
                            + " sources " + contributing + " but no priority list");
                }
                builder.priority(variable, contributing);
                continue;
            }
            Set<String> unique = new LinkedHashSet<>(priority);
            if (unique.size() != priority.size()) {
                throw new ConfigurationException(key, "duplicate source in " + priority);
            }
            for (String sourceId : contributing) {
                if (!unique.contains(sourceId)) {
                    throw new ConfigurationException(key, "source '" + sourceId + "' is not ranked in " + priority);
                }
            }
            for (String sourceId : priority) {
                if (!contributing.contains(sourceId)) {
                    throw new ConfigurationException(key, "source '" + sourceId
                            + "' does not feed variable '" + variable + "'");
                }
            }
            builder.priority(variable, priority);
        }
    }

    private UnitConversionTable conversionTable(UnitsConfig units) {
        UnitConversionTable.Builder table = UnitConversionTable.builder();
        if (units.includeDefaults() == null || units.includeDefaults()) {
            table.rules(DefaultConversionRules.createDefaultTable().getRules());
        }
        List<UnitsConfig.ConversionEntry> entries = units.conversions() != null ? units.conversions() : List.of();
        for (int i = 0; i < entries.size(); i++) {
            table.rule(conversionRule(entries.get(i), "conversions[" + i + "]"));
        }
        return table.build();
    }

    private ConversionRule conversionRule(UnitsConfig.ConversionEntry entry, String key) {
        require(entry.type(), key + ".type");
        Unit from = unit(entry.from(), key + ".from");
        Unit to = unit(entry.to(), key + ".to");
        try {
            switch (entry.type()) {
                case "multiplier" -> {
                    require(entry.factor(), key + ".factor");
                    return new MultiplierRule(from, to, entry.factor(), entry.variableId());
                }
                case "rebase" -> {
                    require(entry.baseYear(), key + ".baseYear");
                    require(entry.baseValue(), key + ".baseValue");
                    double scale = entry.scale() != null ? entry.scale() : 100.0;
                    return new RebaseRule(from, to, entry.baseYear(), entry.baseValue(), scale, entry.variableId());
                }
                default -> throw new ConfigurationException(key + ".type",
                        "unknown conversion type '" + entry.type() + "', expected multiplier or rebase");
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, e.getMessage(), e);
        }
    }

    private void applyCanonicalUnits(UnitsConfig units, List<SourceDescriptor> descriptors,
                                     SortedSet<String> variables, UnitConversionTable table,
                                     ReconciliationConfig.Builder builder) {
        Map<String, String> declared = units.canonicalUnits() != null ? units.canonicalUnits() : Map.of();
        for (String variable : declared.keySet()) {
            if (!variables.contains(variable)) {
                throw new ConfigurationException("canonicalUnits." + variable,
                        "no source feeds variable '" + variable + "'");
            }
        }
        for (String variable : variables) {
            String key = "canonicalUnits." + variable;
            Unit canonical = unit(declared.get(variable), key);
            for (SourceDescriptor d : descriptors) {
                if (!d.getVariableId().equals(variable)) {
                    continue;
                }
                Unit nativeUnit = d.getNativeUnit();
                if (nativeUnit != canonical && !table.supports(nativeUnit, canonical, variable)) {
                    throw new ConfigurationException(key, "no declared conversion from " + nativeUnit
                            + " (source '" + d.getSourceId() + "') to " + canonical);
                }
            }
            builder.canonicalUnit(variable, canonical);
        }
    }

    private void checkUnusedNativeUnits(UnitsConfig units, List<SourceDescriptor> descriptors) {
        if (units.nativeUnits() == null) {
            return;
        }
        Set<String> declaredSources = new HashSet<>();
        descriptors.forEach(d -> declaredSources.add(d.getSourceId() + "/" + d.getVariableId()));
        for (int i = 0; i < units.nativeUnits().size(); i++) {
            UnitsConfig.NativeUnitEntry entry = units.nativeUnits().get(i);
            if (!declaredSources.contains(entry.sourceId() + "/" + entry.variableId())) {
                log.warn("config.unusedNativeUnit key=nativeUnits[{}] sourceId={} variableId={}",
                        i, entry.sourceId(), entry.variableId());
            }
        }
    }

    private void applyGapPolicies(GapPolicyConfig config, SortedSet<String> variables,
                                  ReconciliationConfig.Builder builder) {
        Map<String, List<GapPolicyConfig.PolicyEntry>> policies =
                config.policies() != null ? config.policies() : Map.of();
        for (Map.Entry<String, List<GapPolicyConfig.PolicyEntry>> e : policies.entrySet()) {
            String variable = e.getKey();
            String key = "policies." + variable;
            if (!variables.contains(variable)) {
                throw new ConfigurationException(key, "no source feeds variable '" + variable + "'");
            }
            List<GapPolicy> parsed = new ArrayList<>();
            Set<Integer> overrideYears = new HashSet<>();
            List<GapPolicyConfig.PolicyEntry> entries = e.getValue() != null ? e.getValue() : List.of();
            for (int i = 0; i < entries.size(); i++) {
                GapPolicy policy = gapPolicy(entries.get(i), key + "[" + i + "]");
                if (policy instanceof GapPolicy.ManualOverride override && !overrideYears.add(override.year())) {
                    throw new ConfigurationException(key + "[" + i + "].year",
                            "more than one manual override for year " + override.year());
                }
                parsed.add(policy);
            }
            long interpolations = parsed.stream()
                    .filter(p -> p instanceof GapPolicy.BoundedLinearInterpolation).count();
            if (interpolations > 1) {
                throw new ConfigurationException(key, "at most one bounded-linear-interpolation policy per variable");
            }
            builder.gapPolicies(variable, parsed);
        }

        Map<String, GapPolicyConfig.BoundsEntry> bounds = config.bounds() != null ? config.bounds() : Map.of();
        for (Map.Entry<String, GapPolicyConfig.BoundsEntry> e : bounds.entrySet()) {
            String key = "bounds." + e.getKey();
            if (!variables.contains(e.getKey())) {
                throw new ConfigurationException(key, "no source feeds variable '" + e.getKey() + "'");
            }
            GapPolicyConfig.BoundsEntry entry = e.getValue();
            if (entry == null) {
                throw new ConfigurationException(key, "bounds need from and to");
            }
            require(entry.from(), key + ".from");
            require(entry.to(), key + ".to");
            try {
                builder.bounds(e.getKey(), YearRange.of(entry.from(), entry.to()));
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException(key, ex.getMessage(), ex);
            }
        }
    }

    private GapPolicy gapPolicy(GapPolicyConfig.PolicyEntry entry, String key) {
        require(entry.type(), key + ".type");
        try {
            return switch (entry.type()) {
                case "leave-missing" -> GapPolicy.leaveMissing();
                case "bounded-linear-interpolation" -> {
                    require(entry.maxGapYears(), key + ".maxGapYears");
                    yield GapPolicy.boundedLinear(entry.maxGapYears());
                }
                case "manual-override" -> {
                    require(entry.year(), key + ".year");
                    require(entry.value(), key + ".value");
                    // A blank rationale is rejected when the override is applied and reported as a failed action.
                    yield GapPolicy.manualOverride(entry.year(), entry.value(), entry.rationale());
                }
                default -> throw new ConfigurationException(key + ".type", "unknown gap policy '" + entry.type()
                        + "', expected leave-missing, bounded-linear-interpolation or manual-override");
            };
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, e.getMessage(), e);
        }
    }

    private void applyDerived(IdentitiesConfig config, Set<String> known, ReconciliationConfig.Builder builder) {
        List<IdentitiesConfig.DerivedEntry> entries = config.derived() != null ? config.derived() : List.of();
        for (int i = 0; i < entries.size(); i++) {
            IdentitiesConfig.DerivedEntry entry = entries.get(i);
            String key = "derived[" + i + "]";
            require(entry.variableId(), key + ".variableId");
            if (known.contains(entry.variableId())) {
                throw new ConfigurationException(key + ".variableId", "variable '" + entry.variableId()
                        + "' already exists");
            }
            Formula formula = formula(entry.formula(), key + ".formula");
            checkKnown(formula, known, key + ".formula");
            Unit unit = unit(entry.unit(), key + ".unit");
            try {
                builder.derivedVariable(new DerivedVariable(entry.variableId(), formula, unit));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(key, e.getMessage(), e);
            }
            known.add(entry.variableId());
        }
    }

    private void applyIdentities(IdentitiesConfig config, Set<String> known, ReconciliationConfig.Builder builder) {
        List<IdentitiesConfig.IdentityEntry> entries = config.identities() != null ? config.identities() : List.of();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            IdentitiesConfig.IdentityEntry entry = entries.get(i);
            String key = "identities[" + i + "]";
            require(entry.name(), key + ".name");
            if (!names.add(entry.name())) {
                throw new ConfigurationException(key + ".name", "duplicate identity '" + entry.name() + "'");
            }
            Formula formula = formula(entry.formula(), key + ".formula");
            checkKnown(formula, known, key + ".formula");
            require(entry.observed(), key + ".observed");
            if (!known.contains(entry.observed())) {
                throw new ConfigurationException(key + ".observed", "unknown variable '" + entry.observed() + "'");
            }
            try {
                builder.identity(new IdentityRule(entry.name(), formula, entry.observed(), tolerance(entry.tolerance())));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(key, e.getMessage(), e);
            }
        }
    }

    private static Tolerance tolerance(IdentitiesConfig.ToleranceEntry entry) {
        if (entry == null) {
            return Tolerance.exact();
        }
        return new Tolerance(entry.absolute() != null ? entry.absolute() : 0.0,
                entry.relative() != null ? entry.relative() : 0.0);
    }

    private static Formula formula(String text, String key) {
        require(text, key);
        try {
            return Formula.parse(text);
        } catch (FormulaParseException e) {
            throw new ConfigurationException(key, e.getMessage(), e);
        }
    }

    private static void checkKnown(Formula formula, Set<String> known, String key) {
        for (String variable : formula.getVariables()) {
            if (!known.contains(variable)) {
                throw new ConfigurationException(key, "unknown variable '" + variable + "' in " + formula.getText());
            }
        }
    }

    private static Unit unit(String name, String key) {
        require(name, key);
        return Unit.fromName(name).orElseThrow(() -> new ConfigurationException(key, "unknown unit '" + name + "'"));
    }

    private static void require(Object value, String key) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new ConfigurationException(key, "value is required");
        }
    }
}
