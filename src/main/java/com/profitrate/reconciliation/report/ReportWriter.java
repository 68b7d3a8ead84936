package com.profitrate.reconciliation.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.profitrate.reconciliation.core.ReconciliationException;
import com.profitrate.reconciliation.gap.GapAction;
import com.profitrate.reconciliation.identity.ErrorDiagnostics;
import com.profitrate.reconciliation.identity.ErrorStatistics;
import com.profitrate.reconciliation.identity.IdentitySkip;
import com.profitrate.reconciliation.identity.SystematicBiasFinding;
import com.profitrate.reconciliation.identity.ValidationResult;
import com.profitrate.reconciliation.merge.MergeConflict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Serializes a {@link ReconciliationReport} to JSON.
 *
 * <p>Keys are snake_case and sorted, output is indented, and nothing time-dependent is
 * written, so the same report always produces the same bytes.</p>
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String REPORT_FILE_NAME = "reconciliation_report.json";

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Writes {@value #REPORT_FILE_NAME} into the output directory, creating it if needed.
     *
     * @return the written file
     */
    public Path write(ReconciliationReport report, Path outputDir) {
        Path target = outputDir.resolve(REPORT_FILE_NAME);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, toJson(report) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReconciliationException("Failed to write report to " + target, e);
        }
        log.info("report.written path={} {}", target, report);
        return target;
    }

    public String toJson(ReconciliationReport report) {
        try {
            return objectMapper.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new ReconciliationException("Failed to serialize report", e);
        }
    }

    Map<String, Object> toTree(ReconciliationReport report) {
        Map<String, Object> root = new TreeMap<>();
        root.put("merge_conflicts", list(report.mergeConflicts(), ReportWriter::conflict));
        root.put("gap_actions", list(report.gapActions(), ReportWriter::gapAction));
        root.put("validation_results", list(report.validationResults(), ReportWriter::validationResult));
        root.put("systematic_bias_findings", list(report.systematicBiasFindings(), ReportWriter::biasFinding));
        root.put("identity_skips", list(report.identitySkips(), ReportWriter::skip));
        root.put("failed_sources", list(report.failedSources(), ReportWriter::failedSource));
        root.put("error_statistics", list(report.errorStatistics(), ReportWriter::statistics));
        root.put("error_diagnostics", list(report.errorDiagnostics(), ReportWriter::diagnostics));
        root.put("series_summaries", list(report.seriesSummaries(), ReportWriter::summary));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("input_digests", new TreeMap<>(report.inputDigests()));
        root.put("run_metadata", metadata);
        return root;
    }

    private static <T> List<Map<String, Object>> list(List<T> items, Function<T, Map<String, Object>> mapper) {
        return items.stream().map(mapper).toList();
    }

    private static Map<String, Object> conflict(MergeConflict c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("variable_id", c.variableId());
        m.put("year", c.year());
        m.put("chosen_source_id", c.chosenSourceId());
        m.put("chosen_value", c.chosenValue());
        m.put("max_absolute_difference", c.maxAbsoluteDifference());
        m.put("rejected_alternatives", c.alternatives().stream().map(a -> {
            Map<String, Object> alt = new LinkedHashMap<>();
            alt.put("source_id", a.sourceId());
            alt.put("value", a.value());
            alt.put("absolute_difference", a.absoluteDifference());
            alt.put("relative_difference", a.relativeDifference());
            return alt;
        }).toList());
        m.put("rationale", c.rationale());
        return m;
    }

    private static Map<String, Object> gapAction(GapAction a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("variable_id", a.variableId());
        m.put("year", a.year());
        m.put("policy", a.policy());
        m.put("status", a.status().name().toLowerCase(Locale.ROOT));
        m.put("value", a.value());
        m.put("previous_value", a.previousValue());
        m.put("lower_anchor", a.lowerAnchor());
        m.put("upper_anchor", a.upperAnchor());
        m.put("rationale", a.rationale());
        return m;
    }

    private static Map<String, Object> validationResult(ValidationResult r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("identity_name", r.identityName());
        m.put("year", r.year());
        m.put("expected", r.expected());
        m.put("observed", r.observed());
        m.put("absolute_error", r.absoluteError());
        m.put("relative_error", r.relativeError());
        m.put("classification", r.classification().label());
        m.put("basis", r.basis().label());
        Map<String, String> methods = new TreeMap<>();
        r.inputMethods().forEach((k, v) -> methods.put(k, v.label()));
        m.put("input_methods", methods);
        m.put("rationale", rationale(r));
        return m;
    }

    private static String rationale(ValidationResult r) {
        return "expected " + r.expected() + " vs observed " + r.observed() + " is "
                + r.classification().label() + " on " + r.basis().label() + " inputs";
    }

    private static Map<String, Object> biasFinding(SystematicBiasFinding f) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("identity_name", f.identityName());
        m.put("sign", f.sign().label());
        m.put("mean_signed_error", f.meanSignedError());
        m.put("sign_share", f.signShare());
        m.put("year_count", f.yearCount());
        m.put("first_year", f.firstYear());
        m.put("last_year", f.lastYear());
        m.put("rationale", f.signShare() * 100 + "% of " + f.yearCount() + " years share a "
                + f.sign().label() + " error");
        return m;
    }

    private static Map<String, Object> skip(IdentitySkip s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("identity_name", s.identityName());
        m.put("year", s.year());
        m.put("reason", s.reason().label());
        m.put("missing_variables", s.missingVariables());
        return m;
    }

    private static Map<String, Object> failedSource(FailedSource f) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("variable_id", f.variableId());
        m.put("source_id", f.sourceId());
        m.put("stage", f.stage());
        m.put("error_type", f.errorType());
        m.put("message", f.message());
        return m;
    }

    private static Map<String, Object> statistics(ErrorStatistics s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("identity_name", s.identityName());
        m.put("basis", s.basis().label());
        m.put("count", s.count());
        m.put("mean_signed_error", s.meanSignedError());
        m.put("mean_absolute_error", s.meanAbsoluteError());
        m.put("max_absolute_error", s.maxAbsoluteError());
        m.put("flagged_count", s.flaggedCount());
        return m;
    }

    private static Map<String, Object> diagnostics(ErrorDiagnostics d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("identity_name", d.identityName());
        m.put("count", d.count());
        m.put("runs_z_score", d.runsZScore());
        m.put("errors_random", d.errorsRandom());
        m.put("lag1_autocorrelation", d.lag1Autocorrelation());
        m.put("errors_independent", d.errorsIndependent());
        m.put("magnitude_correlation", d.magnitudeCorrelation());
        m.put("magnitude_dependent", d.magnitudeDependent());
        m.put("trend_slope_per_year", d.trendSlopePerYear());
        return m;
    }

    private static Map<String, Object> summary(SeriesSummary s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("variable_id", s.variableId());
        m.put("unit", s.unit());
        m.put("first_year", s.firstYear());
        m.put("last_year", s.lastYear());
        m.put("native_count", s.nativeCount());
        m.put("merged_count", s.mergedCount());
        m.put("gap_filled_count", s.gapFilledCount());
        m.put("manual_override_count", s.manualOverrideCount());
        m.put("derived_count", s.derivedCount());
        m.put("missing_count", s.missingCount());
        return m;
    }
}
