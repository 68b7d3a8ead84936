package com.profitrate.reconciliation.cli;

import com.profitrate.reconciliation.pipeline.ReconciliationPipeline;
import com.profitrate.reconciliation.report.ReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ReconcileCommand Tests")
class ReconcileCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writeConfig() throws IOException {
        Path data = Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(data.resolve("k.csv"), "variable,1970,1971,1972\nK,300,,320\n");
        Files.writeString(data.resolve("r.csv"), "variable,1970,1971,1972\nr,0.5,0.5166667,0.6\n");
        Files.writeString(tempDir.resolve("sources.json"), """
                {"sources": [
                  {"sourceId": "bea", "variableId": "K", "path": "data/k.csv"},
                  {"sourceId": "pub", "variableId": "r", "path": "data/r.csv"}
                ]}
                """);
        Files.writeString(tempDir.resolve("units.json"), """
                {"nativeUnits": [
                  {"sourceId": "bea", "variableId": "K", "unit": "currency-billions"},
                  {"sourceId": "pub", "variableId": "r", "unit": "fraction-0to1"}
                 ],
                 "canonicalUnits": {"K": "currency-billions", "r": "fraction-0to1"}}
                """);
        Files.writeString(tempDir.resolve("gap_policy.json"), """
                {"policies": {"K": [{"type": "bounded-linear-interpolation", "maxGapYears": 1}]}}
                """);
        Files.writeString(tempDir.resolve("identities.json"), """
                {"identities": [{"name": "scaled", "formula": "K / 600", "observed": "r",
                                 "tolerance": {"absolute": 0.0001}}]}
                """);
    }

    private int run(String... args) {
        return ReconcileCommand.execute(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String[] args(String sources, Path outputDir) {
        return new String[]{
                "--sources-config", tempDir.resolve(sources).toString(),
                "--units-config", tempDir.resolve("units.json").toString(),
                "--gap-policy-config", tempDir.resolve("gap_policy.json").toString(),
                "--identities-config=" + tempDir.resolve("identities.json"),
                "--output-dir", outputDir.toString()};
    }

    @Test
    @DisplayName("A completed run exits 0 and writes every output, flagged results included")
    void successfulRun() throws IOException {
        Path outputDir = tempDir.resolve("out");

        int code = run(args("sources.json", outputDir));

        assertEquals(ReconcileCommand.EXIT_OK, code, err.toString(StandardCharsets.UTF_8));
        assertTrue(Files.exists(outputDir.resolve("K.csv")));
        assertTrue(Files.exists(outputDir.resolve("r.csv")));
        assertTrue(Files.exists(outputDir.resolve(ReportWriter.REPORT_FILE_NAME)));
        String summary = out.toString(StandardCharsets.UTF_8);
        assertTrue(summary.contains("flagged: 1"), summary);
        assertTrue(summary.contains("gap actions: 1"), summary);
    }

    @Test
    @DisplayName("A missing source file exits 2")
    void missingSourceFile() throws IOException {
        Files.delete(tempDir.resolve("data/r.csv"));

        int code = run(args("sources.json", tempDir.resolve("out")));

        assertEquals(ReconcileCommand.EXIT_CONFIG, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("sources[1].path"));
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    @DisplayName("An override without rationale inside a short gap still completes the run")
    void blankRationaleInsideGap() throws IOException {
        Files.writeString(tempDir.resolve("gap_policy.json"), """
                {"policies": {"K": [
                  {"type": "manual-override", "year": 1971, "value": 305.0, "rationale": " "},
                  {"type": "bounded-linear-interpolation", "maxGapYears": 1}
                ]}}
                """);
        Path outputDir = tempDir.resolve("out");

        int code = run(args("sources.json", outputDir));

        assertEquals(ReconcileCommand.EXIT_OK, code, err.toString(StandardCharsets.UTF_8));
        assertTrue(Files.exists(outputDir.resolve(ReportWriter.REPORT_FILE_NAME)));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("gap actions: 1"));
    }

    @Test
    @DisplayName("An unexpected failure during the run exits 2 with the error")
    void unexpectedFailure() {
        ReconciliationPipeline pipeline = mock(ReconciliationPipeline.class);
        when(pipeline.run()).thenThrow(new IllegalStateException("aggregate inconsistent"));

        int code = ReconcileCommand.execute(args("sources.json", tempDir.resolve("out")),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                (config, metrics) -> pipeline);

        assertEquals(ReconcileCommand.EXIT_CONFIG, code);
        String error = err.toString(StandardCharsets.UTF_8);
        assertTrue(error.contains("IllegalStateException"), error);
        assertTrue(error.contains("aggregate inconsistent"), error);
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    @DisplayName("A missing configuration file exits 2")
    void missingConfigFile() {
        assertEquals(ReconcileCommand.EXIT_CONFIG, run(args("absent.json", tempDir.resolve("out"))));
    }

    @Test
    @DisplayName("Missing options exit 1 with usage")
    void usageError() {
        int code = run("--sources-config", "sources.json");

        assertEquals(ReconcileCommand.EXIT_USAGE, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage:"));
    }

    @Nested
    @DisplayName("Argument parsing")
    class Parsing {

        @Test
        @DisplayName("Should accept both option forms")
        void bothForms() {
            Map<String, String> options = ReconcileCommand.parse(new String[]{
                    "--sources-config", "s.json", "--units-config=u.json", "--gap-policy-config", "g.json",
                    "--identities-config", "i.json", "--output-dir=out"});

            assertEquals("s.json", options.get("--sources-config"));
            assertEquals("u.json", options.get("--units-config"));
            assertEquals("out", options.get("--output-dir"));
        }

        @Test
        @DisplayName("Should reject unknown, repeated and empty options")
        void rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> ReconcileCommand.parse(new String[]{"--verbose", "true"}));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconcileCommand.parse(new String[]{"--output-dir", "a", "--output-dir", "b"}));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconcileCommand.parse(new String[]{"--output-dir="}));
            assertThrows(IllegalArgumentException.class,
                    () -> ReconcileCommand.parse(new String[]{"--output-dir"}));
        }
    }
}
