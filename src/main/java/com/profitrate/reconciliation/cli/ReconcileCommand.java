package com.profitrate.reconciliation.cli;

import com.profitrate.reconciliation.config.ConfigLoader;
import com.profitrate.reconciliation.config.ConfigurationException;
import com.profitrate.reconciliation.config.ReconciliationConfig;
import com.profitrate.reconciliation.core.ReconciliationException;
import com.profitrate.reconciliation.metrics.MetricsService;
import com.profitrate.reconciliation.metrics.MicrometerMetricsService;
import com.profitrate.reconciliation.pipeline.ReconciliationPipeline;
import com.profitrate.reconciliation.pipeline.ReconciliationRun;
import com.profitrate.reconciliation.report.ReconciliationReport;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Command-line entry point.
 *
 * <pre>
 * reconcile --sources-config sources.json --units-config units.json \
 *           --gap-policy-config gap-policy.json --identities-config identities.json \
 *           --output-dir out/
 * </pre>
 *
 * <p>Exit codes: 0 when the run completed (flagged results included), 1 on a usage
 * error, 2 on a configuration error, a missing source file or a run that could not
 * complete.</p>
 */
public final class ReconcileCommand {
    private static final Logger log = LoggerFactory.getLogger(ReconcileCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_CONFIG = 2;

    static final List<String> OPTIONS = List.of(
            "--sources-config", "--units-config", "--gap-policy-config", "--identities-config", "--output-dir");

    private ReconcileCommand() {
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    /**
     * Runs the command and returns its exit code instead of exiting.
     */
    public static int execute(String[] args, PrintStream out, PrintStream err) {
        return execute(args, out, err, (config, metrics) -> new ReconciliationPipeline(config,
                ReconciliationPipeline.optionsFrom(config), metrics));
    }

    static int execute(String[] args, PrintStream out, PrintStream err,
                       BiFunction<ReconciliationConfig, MetricsService, ReconciliationPipeline> pipelines) {
        Map<String, String> options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }

        ReconciliationConfig config;
        try {
            config = new ConfigLoader().load(
                    Path.of(options.get("--sources-config")),
                    Path.of(options.get("--units-config")),
                    Path.of(options.get("--gap-policy-config")),
                    Path.of(options.get("--identities-config")));
        } catch (ConfigurationException e) {
            log.error("config.invalid key={} error={}", e.getKey(), e.getMessage());
            err.println("configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try {
            ReconciliationPipeline pipeline = pipelines.apply(config, new MicrometerMetricsService(registry));
            ReconciliationRun run = pipeline.run();
            Path outputDir = Path.of(options.get("--output-dir"));
            pipeline.write(run, outputDir);

            ReconciliationReport report = run.report();
            out.println("series: " + run.series().size()
                    + ", merge conflicts: " + report.mergeConflicts().size()
                    + ", gap actions: " + report.gapActions().size()
                    + ", validation results: " + report.validationResults().size()
                    + ", flagged: " + report.flaggedCount()
                    + ", bias findings: " + report.systematicBiasFindings().size()
                    + ", failed sources: " + report.failedSources().size());
            out.println("output: " + outputDir.toAbsolutePath());
            logMetrics(registry);
            return EXIT_OK;
        } catch (ReconciliationException e) {
            log.error("run.failed error={}", e.getMessage(), e);
            err.println("error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (RuntimeException e) {
            log.error("run.aborted errorType={} error={}", e.getClass().getSimpleName(), e.getMessage(), e);
            err.println("error: run aborted: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_CONFIG;
        } finally {
            registry.close();
        }
    }

    static Map<String, String> parse(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                value = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            } else {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + arg);
                }
                value = args[++i];
            }
            if (!OPTIONS.contains(arg)) {
                throw new IllegalArgumentException("unknown option " + arg);
            }
            if (value.isBlank()) {
                throw new IllegalArgumentException("empty value for " + arg);
            }
            if (options.put(arg, value) != null) {
                throw new IllegalArgumentException("option given twice: " + arg);
            }
        }
        for (String option : OPTIONS) {
            if (!options.containsKey(option)) {
                throw new IllegalArgumentException("missing required option " + option);
            }
        }
        return options;
    }

    static String usage() {
        return "usage: reconcile --sources-config <file> --units-config <file> --gap-policy-config <file>"
                + " --identities-config <file> --output-dir <dir>";
    }

    private static void logMetrics(SimpleMeterRegistry registry) {
        for (Meter meter : registry.getMeters()) {
            meter.measure().forEach(m -> log.debug("metrics name={} tags={} {}={}",
                    meter.getId().getName(), meter.getId().getTags(), m.getStatistic().getTagValueRepresentation(),
                    m.getValue()));
        }
    }
}
