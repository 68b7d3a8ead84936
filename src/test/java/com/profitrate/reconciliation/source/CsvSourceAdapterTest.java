package com.profitrate.reconciliation.source;

import com.profitrate.reconciliation.config.ConfigurationException;
import com.profitrate.reconciliation.core.ContentDigest;
import com.profitrate.reconciliation.core.model.ObservationSet;
import com.profitrate.reconciliation.core.model.Unit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvSourceAdapter Tests")
class CsvSourceAdapterTest {

    @TempDir
    Path tempDir;

    private final CsvSourceAdapter adapter = new CsvSourceAdapter();

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private SourceDescriptor.Builder wide(Path path) {
        return SourceDescriptor.builder()
                .sourceId("A")
                .variableId("K")
                .path(path)
                .nativeUnit(Unit.CURRENCY_MILLIONS);
    }

    @Nested
    @DisplayName("Wide layout")
    class WideLayout {

        @Test
        @DisplayName("Should extract the labelled row with missing tokens")
        void extractsLabelledRow() throws IOException {
            Path file = write("wide.csv", """
                    variable,1958,1959,1960,1961
                    SP,1,2,3,4
                    K,301.2,NA,,310.8
                    """);

            ObservationSet set = adapter.load(wide(file).build());

            assertEquals("K", set.getVariableId());
            assertEquals("A", set.getSourceId());
            assertEquals(Unit.CURRENCY_MILLIONS, set.getUnit());
            assertEquals(4, set.size());
            assertEquals(2, set.valueCount());
            assertEquals(301.2, set.get(1958).orElseThrow().value());
            assertTrue(set.get(1959).orElseThrow().isMissing());
            assertTrue(set.get(1960).orElseThrow().isMissing());
        }

        @Test
        @DisplayName("Should honour a custom row label, BOM and comment lines")
        void customRowLabel() throws IOException {
            Path file = write("wide.csv", "\uFEFFlabel,1970,1971\n# comment\n\"Capital, net\",10,11\n");

            ObservationSet set = adapter.load(wide(file).rowLabel("Capital, net").build());

            assertEquals(11.0, set.get(1971).orElseThrow().value());
        }

        @Test
        @DisplayName("Should fail on a non-numeric year header")
        void nonNumericYear() throws IOException {
            Path file = write("wide.csv", "variable,1958,total\nK,1,2\n");

            SourceFormatException e = assertThrows(SourceFormatException.class,
                    () -> adapter.load(wide(file).build()));
            assertEquals("A", e.getSourceId());
            assertTrue(e.getMessage().contains("total"));
        }

        @Test
        @DisplayName("Should fail when the label row is absent")
        void missingLabelRow() throws IOException {
            Path file = write("wide.csv", "variable,1958\nSP,1\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(wide(file).build()));
        }

        @Test
        @DisplayName("Should fail on a wrong column count")
        void wrongColumnCount() throws IOException {
            Path file = write("wide.csv", "variable,1958,1959\nK,1\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(wide(file).build()));
        }

        @Test
        @DisplayName("Should fail on a non-numeric value")
        void nonNumericValue() throws IOException {
            Path file = write("wide.csv", "variable,1958\nK,abc\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(wide(file).build()));
        }

        @Test
        @DisplayName("Should fail on a duplicate year")
        void duplicateYear() throws IOException {
            Path file = write("wide.csv", "variable,1958,1958\nK,1,2\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(wide(file).build()));
        }

        @Test
        @DisplayName("Should fail on an empty file")
        void emptyFile() throws IOException {
            Path file = write("wide.csv", "\n\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(wide(file).build()));
        }

        @Test
        @DisplayName("Should fail when the file does not exist")
        void missingFile() {
            assertThrows(SourceFormatException.class,
                    () -> adapter.load(wide(tempDir.resolve("absent.csv")).build()));
        }
    }

    @Nested
    @DisplayName("Long layout")
    class LongLayout {

        @Test
        @DisplayName("Should extract rows of the variable only")
        void extractsVariableRows() throws IOException {
            Path file = write("long.csv", """
                    year,variable,value
                    1990,profits,401.1
                    1990,K,1200
                    1991,profits,NaN
                    """);

            ObservationSet set = adapter.load(SourceDescriptor.builder()
                    .sourceId("B")
                    .variableId("SP")
                    .rowLabel("profits")
                    .path(file)
                    .layout(SourceLayout.LONG)
                    .nativeUnit(Unit.CURRENCY_BILLIONS)
                    .build());

            assertEquals(2, set.size());
            assertEquals("SP", set.getVariableId());
            assertEquals(401.1, set.get(1990).orElseThrow().value());
            assertTrue(set.get(1991).orElseThrow().isMissing());
        }

        @Test
        @DisplayName("Should support renamed columns")
        void renamedColumns() throws IOException {
            Path file = write("long.csv", "series,yr,amount\nu,1980,80\n");

            ObservationSet set = adapter.load(SourceDescriptor.builder()
                    .sourceId("B").variableId("u").path(file)
                    .layout(SourceLayout.LONG).nativeUnit(Unit.PERCENT)
                    .yearColumn("yr").variableColumn("series").valueColumn("amount")
                    .build());

            assertEquals(80.0, set.get(1980).orElseThrow().value());
        }

        @Test
        @DisplayName("Should fail on a missing required column")
        void missingColumn() throws IOException {
            Path file = write("long.csv", "year,variable\n1990,K\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(SourceDescriptor.builder()
                    .sourceId("B").variableId("K").path(file)
                    .layout(SourceLayout.LONG).nativeUnit(Unit.INDEX).build()));
        }

        @Test
        @DisplayName("Should fail on a duplicate year for the variable")
        void duplicateYear() throws IOException {
            Path file = write("long.csv", "year,variable,value\n1990,K,1\n1990,K,2\n");

            assertThrows(SourceFormatException.class, () -> adapter.load(SourceDescriptor.builder()
                    .sourceId("B").variableId("K").path(file)
                    .layout(SourceLayout.LONG).nativeUnit(Unit.INDEX).build()));
        }
    }

    @Test
    @DisplayName("Descriptor without a native unit is a configuration error")
    void descriptorWithoutUnit() {
        assertThrows(ConfigurationException.class, () -> SourceDescriptor.builder()
                .sourceId("A").variableId("K").path(tempDir.resolve("x.csv")).build());
    }

    @Test
    @DisplayName("The loaded set carries the digest of the bytes that were read")
    void contentDigest() throws IOException {
        Path file = write("wide.csv", "variable,1958\nK,1\n");

        ObservationSet set = adapter.load(wide(file).build());

        assertEquals(ContentDigest.sha256(Files.readAllBytes(file)), set.getContentDigest().orElseThrow());
    }

    @Test
    @DisplayName("A path that cannot be read as a file fails as a format error")
    void unreadablePath() throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve("folder.csv"));

        SourceFormatException e = assertThrows(SourceFormatException.class,
                () -> adapter.load(wide(directory).build()));
        assertTrue(e.getMessage().contains("cannot read"));
    }

    @Test
    @DisplayName("A read exceeding the timeout fails as a format error")
    void readTimeout() throws IOException {
        Path file = write("wide.csv", "variable,1958\nK,1\n");
        Executor never = command -> { };
        CsvSourceAdapter slow = new CsvSourceAdapter(Duration.ofMillis(50), never);

        SourceFormatException e = assertThrows(SourceFormatException.class, () -> slow.load(wide(file).build()));
        assertTrue(e.getMessage().contains("timed out"));
    }
}
