package com.profitrate.reconciliation.report;

import com.profitrate.reconciliation.core.CsvFormat;
import com.profitrate.reconciliation.core.ReconciliationException;
import com.profitrate.reconciliation.core.model.SeriesPoint;
import com.profitrate.reconciliation.core.model.VariableSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Writes reconciled series as CSV, one file per variable.
 *
 * <p>Output format:</p>
 * <pre>
 * year,value,unit,source_id,resolution_method
 * 1958,120.5,currency-billions,A,native
 * 1959,,currency-billions,,missing
 * </pre>
 */
public class SeriesCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(SeriesCsvWriter.class);

    public static final String HEADER = "year,value,unit,source_id,resolution_method";
    public static final String MISSING_METHOD = "missing";

    /**
     * Writes {@code <variableId>.csv} for every series into the output directory.
     *
     * @return the written files, in variable order
     */
    public List<Path> writeAll(Collection<VariableSeries> series, Path outputDir) {
        List<VariableSeries> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparing(VariableSeries::getVariableId));
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
            for (VariableSeries s : ordered) {
                Path target = outputDir.resolve(s.getVariableId() + ".csv");
                try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                    int rows = write(s, writer);
                    log.debug("series.written variableId={} path={} rows={}", s.getVariableId(), target, rows);
                }
                written.add(target);
            }
        } catch (IOException e) {
            throw new ReconciliationException("Failed to write series to " + outputDir, e);
        }
        log.info("series.exported count={} dir={}", written.size(), outputDir);
        return written;
    }

    /**
     * Writes one series, present and missing years interleaved in year order.
     *
     * @return number of data rows written
     */
    public int write(VariableSeries series, Writer writer) {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        pw.print(HEADER);
        pw.print('\n');
        int rows = 0;
        String unit = CsvFormat.escape(series.getUnit().wireName());
        for (int year : series.allYears()) {
            SeriesPoint point = series.get(year).orElse(null);
            if (point == null) {
                pw.print(year + ",," + unit + ",," + MISSING_METHOD);
            } else {
                pw.print(year + "," + formatValue(point.value()) + "," + unit + ","
                        + CsvFormat.escape(point.sourceId()) + "," + point.method().label());
            }
            pw.print('\n');
            rows++;
        }
        pw.flush();
        return rows;
    }

    static String formatValue(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
