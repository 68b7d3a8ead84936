package com.profitrate.reconciliation.pipeline;

import com.profitrate.reconciliation.config.ReconciliationConfig;
import com.profitrate.reconciliation.core.ContentDigest;
import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ObservationSet;
import com.profitrate.reconciliation.core.model.ResolutionMethod;
import com.profitrate.reconciliation.core.model.SeriesPoint;
import com.profitrate.reconciliation.core.model.Unit;
import com.profitrate.reconciliation.core.model.VariableSeries;
import com.profitrate.reconciliation.derive.DerivedVariable;
import com.profitrate.reconciliation.gap.GapAction;
import com.profitrate.reconciliation.gap.GapPolicy;
import com.profitrate.reconciliation.identity.IdentityRule;
import com.profitrate.reconciliation.identity.Tolerance;
import com.profitrate.reconciliation.identity.ValidationBasis;
import com.profitrate.reconciliation.metrics.MicrometerMetricsService;
import com.profitrate.reconciliation.metrics.NoOpMetricsService;
import com.profitrate.reconciliation.report.FailedSource;
import com.profitrate.reconciliation.report.ReconciliationReport;
import com.profitrate.reconciliation.report.ReportWriter;
import com.profitrate.reconciliation.source.SourceAdapter;
import com.profitrate.reconciliation.source.SourceDescriptor;
import com.profitrate.reconciliation.source.SourceFormatException;
import com.profitrate.reconciliation.source.SourceLayout;
import com.profitrate.reconciliation.units.DefaultConversionRules;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationPipeline Tests")
class ReconciliationPipelineTest {

    @TempDir
    Path tempDir;

    @Mock
    private SourceAdapter sourceAdapter;

    @BeforeEach
    void writeSources() throws IOException {
        Path data = Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(data.resolve("a.csv"), "variable,1970,1971,1972\nK,300000,310000,320000\n");
        Files.writeString(data.resolve("b.csv"), "variable,1972,1973,1974\nK,321,330,340\n");
        Files.writeString(data.resolve("sp.csv"),
                "year,variable,value\n1970,SP,120\n1971,SP,124\n1972,SP,128\n1973,SP,NA\n1974,SP,136\n");
        Files.writeString(data.resolve("u.csv"), "variable,1970,1971,1972,1973,1974\nu,80,80,80,80,80\n");
        Files.writeString(data.resolve("r.csv"), "variable,1970,1971,1972,1973,1974\nr,0.5,0.5,0.5,0.5,0.5\n");
    }

    private SourceDescriptor source(String sourceId, String variableId, String file, Unit unit) {
        return SourceDescriptor.builder()
                .sourceId(sourceId)
                .variableId(variableId)
                .path(tempDir.resolve("data").resolve(file))
                .nativeUnit(unit)
                .build();
    }

    private ReconciliationConfig.Builder profitRateConfig() {
        return ReconciliationConfig.builder()
                .baseDirectory(tempDir)
                .source(source("A", "K", "a.csv", Unit.CURRENCY_MILLIONS))
                .source(source("B", "K", "b.csv", Unit.CURRENCY_BILLIONS))
                .source(SourceDescriptor.builder()
                        .sourceId("nipa").variableId("SP").path(tempDir.resolve("data/sp.csv"))
                        .nativeUnit(Unit.CURRENCY_BILLIONS).layout(SourceLayout.LONG).build())
                .source(source("fed", "u", "u.csv", Unit.PERCENT))
                .source(source("pub", "r", "r.csv", Unit.FRACTION))
                .priority("K", List.of("A", "B"))
                .priority("SP", List.of("nipa"))
                .priority("u", List.of("fed"))
                .priority("r", List.of("pub"))
                .canonicalUnit("K", Unit.CURRENCY_BILLIONS)
                .canonicalUnit("SP", Unit.CURRENCY_BILLIONS)
                .canonicalUnit("u", Unit.FRACTION)
                .canonicalUnit("r", Unit.FRACTION)
                .conversionTable(DefaultConversionRules.createDefaultTable())
                .gapPolicies("SP", List.of(GapPolicy.boundedLinear(1)))
                .derivedVariable(DerivedVariable.of("Ku", "K * u", Unit.CURRENCY_BILLIONS))
                .identity(IdentityRule.of("rate-of-profit", "SP / (K * u)", "r", Tolerance.absolute(1e-9)));
    }

    @Nested
    @DisplayName("Full run")
    class FullRun {

        @Test
        @DisplayName("Should reconcile, fill, derive and validate every variable")
        void endToEnd() {
            ReconciliationRun run = new ReconciliationPipeline(profitRateConfig().build()).run();

            assertEquals(List.of("K", "Ku", "SP", "r", "u"), List.copyOf(run.series().keySet()));

            SeriesPoint k1972 = run.series().get("K").get(1972).orElseThrow();
            assertEquals(320.0, k1972.value(), 1e-9);
            assertEquals(ResolutionMethod.MERGED, k1972.method());
            assertEquals("A", k1972.sourceId());
            assertEquals(5, run.series().get("K").size());

            ReconciliationReport report = run.report();
            assertEquals(1, report.mergeConflicts().size());
            assertEquals("B", report.findMergeConflict("K", 1972).orElseThrow().alternatives().get(0).sourceId());

            GapAction fill = report.findGapAction("SP", 1973).orElseThrow();
            assertEquals(GapAction.Status.APPLIED, fill.status());
            assertEquals(132.0, fill.value(), 1e-12);

            assertEquals(5, report.validationResults().size());
            assertEquals(0, report.flaggedCount());
            assertEquals(ValidationBasis.GAP_FILLED,
                    report.findValidationResult("rate-of-profit", 1973).orElseThrow().basis());
            assertEquals(ValidationBasis.NATIVE,
                    report.findValidationResult("rate-of-profit", 1970).orElseThrow().basis());
            assertTrue(report.systematicBiasFindings().isEmpty());
            assertFalse(report.hasFailures());

            assertEquals(5, report.inputDigests().size());
            assertEquals(64, report.inputDigests().get("data/a.csv").length());
        }

        @Test
        @DisplayName("Should write one CSV per series and the report")
        void writesOutputs() throws IOException {
            ReconciliationPipeline pipeline = new ReconciliationPipeline(profitRateConfig().build());
            Path outputDir = tempDir.resolve("out");

            List<Path> written = pipeline.write(pipeline.run(), outputDir);

            assertEquals(6, written.size());
            assertTrue(Files.exists(outputDir.resolve("K.csv")));
            assertTrue(Files.exists(outputDir.resolve("Ku.csv")));
            assertTrue(Files.exists(outputDir.resolve(ReportWriter.REPORT_FILE_NAME)));
            List<String> sp = Files.readAllLines(outputDir.resolve("SP.csv"));
            assertEquals("1973,132.0,currency-billions,interpolated,gap-filled:linear", sp.get(4));
        }

        @Test
        @DisplayName("Two runs over the same inputs produce identical outputs")
        void deterministic() throws IOException {
            ReconciliationConfig config = profitRateConfig().build();
            ReconciliationPipeline first = new ReconciliationPipeline(config,
                    ReconciliationOptions.builder().workers(1).build(), new NoOpMetricsService());
            ReconciliationPipeline second = new ReconciliationPipeline(config,
                    ReconciliationOptions.builder().workers(4).build(), new NoOpMetricsService());

            first.write(first.run(), tempDir.resolve("run1"));
            second.write(second.run(), tempDir.resolve("run2"));

            for (String name : List.of("K.csv", "Ku.csv", "SP.csv", "r.csv", "u.csv", ReportWriter.REPORT_FILE_NAME)) {
                assertEquals(Files.readString(tempDir.resolve("run1").resolve(name)),
                        Files.readString(tempDir.resolve("run2").resolve(name)), name);
            }
        }

        @Test
        @DisplayName("Should record conflicts and gap fills as metrics")
        void metrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            ReconciliationConfig config = profitRateConfig().build();

            new ReconciliationPipeline(config, ReconciliationPipeline.optionsFrom(config),
                    new MicrometerMetricsService(registry)).run();

            assertEquals(1.0, registry.find("reconciliation.merge.conflicts").tag("variable", "K").counter().count());
            assertEquals(1.0, registry.find("reconciliation.gap.fills").tag("variable", "SP").counter().count());
            assertEquals(5.0, registry.find("reconciliation.identity.results").tag("identity", "rate-of-profit")
                    .counters().stream().mapToDouble(c -> c.count()).sum());
            assertNotNull(registry.find("reconciliation.stage.duration").tag("stage", "merge").timer());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        private ObservationSet capitalFromA() {
            return new ObservationSet("K", "A", Unit.CURRENCY_MILLIONS, List.of(
                    Observation.of("K", 1970, 300000.0, Unit.CURRENCY_MILLIONS, "A"),
                    Observation.of("K", 1971, 310000.0, Unit.CURRENCY_MILLIONS, "A")));
        }

        private ReconciliationConfig capitalOnly() {
            return ReconciliationConfig.builder()
                    .baseDirectory(tempDir)
                    .source(source("A", "K", "a.csv", Unit.CURRENCY_MILLIONS))
                    .source(source("B", "K", "b.csv", Unit.CURRENCY_BILLIONS))
                    .priority("K", List.of("A", "B"))
                    .canonicalUnit("K", Unit.CURRENCY_BILLIONS)
                    .conversionTable(DefaultConversionRules.createDefaultTable())
                    .build();
        }

        @Test
        @DisplayName("A failing source is reported and the remaining source is still merged")
        void failingSourceIsNotFatal() {
            when(sourceAdapter.load(any())).thenAnswer(invocation -> {
                SourceDescriptor descriptor = invocation.getArgument(0);
                if (descriptor.getSourceId().equals("B")) {
                    throw new SourceFormatException("B", "column count mismatch in row 3");
                }
                return capitalFromA();
            });

            ReconciliationRun run = new ReconciliationPipeline(capitalOnly(), ReconciliationOptions.defaults(),
                    sourceAdapter, new NoOpMetricsService()).run();

            VariableSeries k = run.series().get("K");
            assertEquals(2, k.size());
            assertEquals(300.0, k.get(1970).orElseThrow().value(), 1e-9);

            List<FailedSource> failures = run.report().failuresFor("K");
            assertEquals(1, failures.size());
            assertEquals("B", failures.get(0).sourceId());
            assertEquals("load", failures.get(0).stage());
            assertEquals("SourceFormatException", failures.get(0).errorType());
            verify(sourceAdapter, times(2)).load(any());
        }

        @Test
        @DisplayName("A variable whose sources all fail has no series and leaves other variables intact")
        void allSourcesFail() {
            ReconciliationConfig config = profitRateConfig()
                    .source(source("C", "W", "missing.csv", Unit.CURRENCY_BILLIONS))
                    .priority("W", List.of("C"))
                    .canonicalUnit("W", Unit.CURRENCY_BILLIONS)
                    .identity(IdentityRule.of("wage-share", "W / SP", "u", Tolerance.absolute(0.01)))
                    .build();

            ReconciliationRun run = new ReconciliationPipeline(config).run();

            assertFalse(run.series().containsKey("W"));
            assertTrue(run.series().containsKey("K"));
            FailedSource failure = run.report().failuresFor("W").get(0);
            assertEquals("C", failure.sourceId());
            assertEquals("load", failure.stage());
            assertEquals(List.of("W"), run.report().findIdentitySkip("wage-share", 1970).orElseThrow()
                    .missingVariables());
        }

        @Test
        @DisplayName("A normalization failure is recorded against the variable")
        void normalizationFailure() {
            ReconciliationConfig config = ReconciliationConfig.builder()
                    .baseDirectory(tempDir)
                    .source(source("A", "K", "a.csv", Unit.CURRENCY_MILLIONS))
                    .priority("K", List.of("A"))
                    .canonicalUnit("K", Unit.INDEX)
                    .build();

            ReconciliationRun run = new ReconciliationPipeline(config).run();

            assertTrue(run.series().isEmpty());
            FailedSource failure = run.report().failedSources().get(0);
            assertNull(failure.sourceId());
            assertEquals("normalize", failure.stage());
        }

        @Test
        @DisplayName("A chain exceeding its timeout is recorded as a chain failure")
        void chainTimeout() {
            when(sourceAdapter.load(any())).thenAnswer(invocation -> {
                Thread.sleep(500);
                return capitalFromA();
            });
            ReconciliationOptions options = ReconciliationOptions.builder()
                    .chainTimeout(Duration.ofMillis(50))
                    .build();

            ReconciliationRun run = new ReconciliationPipeline(capitalOnly(), options, sourceAdapter,
                    new NoOpMetricsService()).run();

            assertTrue(run.series().isEmpty());
            FailedSource failure = run.report().failuresFor("K").get(0);
            assertEquals("chain", failure.stage());
            assertEquals("TimeoutException", failure.errorType());
        }
    }

    @Nested
    @DisplayName("Input digests")
    class Digests {

        @Test
        @DisplayName("Digests come from the bytes each source was loaded from")
        void fromLoadedBytes() throws IOException {
            ReconciliationRun run = new ReconciliationPipeline(profitRateConfig().build()).run();

            assertEquals(ContentDigest.sha256(Files.readAllBytes(tempDir.resolve("data/a.csv"))),
                    run.report().inputDigests().get("data/a.csv"));
        }

        @Test
        @DisplayName("Digest keys are relative to the configuration directory")
        void relativeKeys() {
            ReconciliationPipeline pipeline = new ReconciliationPipeline(profitRateConfig().build());

            assertEquals("data/a.csv", pipeline.digestKey(tempDir.resolve("data/a.csv")));
        }

        @Test
        @DisplayName("An unreadable source fails only its own variable")
        void unreadableSource() throws IOException {
            Path data = tempDir.resolve("data");
            Files.delete(data.resolve("r.csv"));
            Files.createDirectories(data.resolve("r.csv"));

            ReconciliationRun run = new ReconciliationPipeline(profitRateConfig().build()).run();

            ReconciliationReport report = run.report();
            assertEquals(List.of("K", "Ku", "SP", "u"), List.copyOf(run.series().keySet()));
            FailedSource failure = report.failuresFor("r").get(0);
            assertEquals("load", failure.stage());
            assertEquals("pub", failure.sourceId());
            assertEquals(4, report.inputDigests().size());
            assertFalse(report.inputDigests().containsKey("data/r.csv"));
            assertEquals(5, report.identitySkips().size());
        }
    }
}
