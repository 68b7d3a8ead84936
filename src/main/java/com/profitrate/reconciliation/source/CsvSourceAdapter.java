package com.profitrate.reconciliation.source;

import com.profitrate.reconciliation.core.ContentDigest;
import com.profitrate.reconciliation.core.CsvFormat;
import com.profitrate.reconciliation.core.model.Observation;
import com.profitrate.reconciliation.core.model.ObservationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CSV source adapter supporting the wide and long layouts.
 *
 * <p>Wide layout, variable labels in column 0 and years in the header row:</p>
 * <pre>
 * variable,1958,1959,1960
 * K,301.2,310.8,322.0
 * SP,45.1,44.0,
 * </pre>
 *
 * <p>Long layout, one observation per row:</p>
 * <pre>
 * year,variable,value
 * 1990,corporate_profits,401.1
 * 1991,corporate_profits,NA
 * </pre>
 *
 * <p>Empty cells and {@code NA}, {@code NaN}, {@code null} are read as missing values.
 * Anything else that does not match the declared layout fails with
 * {@link SourceFormatException}; the adapter never guesses.</p>
 */
public class CsvSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(CsvSourceAdapter.class);

    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    private static final Set<String> MISSING_TOKENS = Set.of("", "na", "n/a", "nan", "null", "-");

    private final Duration readTimeout;
    private final Executor readExecutor;

    public CsvSourceAdapter() {
        this(DEFAULT_READ_TIMEOUT);
    }

    public CsvSourceAdapter(Duration readTimeout) {
        this(readTimeout, ForkJoinPool.commonPool());
    }

    public CsvSourceAdapter(Duration readTimeout, Executor readExecutor) {
        if (readTimeout == null || readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        this.readTimeout = readTimeout;
        this.readExecutor = readExecutor;
    }

    @Override
    public ObservationSet load(SourceDescriptor descriptor) {
        log.debug("source.loading sourceId={} variableId={} path={} layout={}",
                descriptor.getSourceId(), descriptor.getVariableId(), descriptor.getPath(),
                descriptor.getLayout().wireName());

        byte[] content = readContent(descriptor);
        List<List<String>> rows = parseRows(descriptor, content);
        if (rows.isEmpty()) {
            throw new SourceFormatException(descriptor.getSourceId(), "file is empty: " + descriptor.getPath());
        }

        List<Observation> observations = switch (descriptor.getLayout()) {
            case WIDE -> extractWide(descriptor, rows);
            case LONG -> extractLong(descriptor, rows);
        };

        ObservationSet set = new ObservationSet(descriptor.getVariableId(), descriptor.getSourceId(),
                descriptor.getNativeUnit(), observations, ContentDigest.sha256(content));
        log.info("source.loaded sourceId={} variableId={} years={} values={}",
                descriptor.getSourceId(), descriptor.getVariableId(), set.size(), set.valueCount());
        return set;
    }

    /**
     * Reads the raw file bytes within the configured timeout.
     */
    private byte[] readContent(SourceDescriptor descriptor) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                        try {
                            return Files.readAllBytes(descriptor.getPath());
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    }, readExecutor)
                    .orTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw new SourceFormatException(descriptor.getSourceId(),
                        "read of " + descriptor.getPath() + " timed out after " + readTimeout, cause);
            }
            if (cause instanceof UncheckedIOException io && io.getCause() instanceof NoSuchFileException) {
                throw new SourceFormatException(descriptor.getSourceId(),
                        "file not found: " + descriptor.getPath(), io.getCause());
            }
            throw new SourceFormatException(descriptor.getSourceId(),
                    "cannot read " + descriptor.getPath() + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * Decodes UTF-8 and keeps non-blank, non-comment lines.
     */
    private List<List<String>> parseRows(SourceDescriptor descriptor, byte[] content) {
        List<String> lines;
        try {
            lines = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString()
                    .lines()
                    .toList();
        } catch (CharacterCodingException e) {
            throw new SourceFormatException(descriptor.getSourceId(),
                    "cannot read " + descriptor.getPath() + ": not valid UTF-8", e);
        }

        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = i == 0 ? stripBom(lines.get(i)) : lines.get(i);
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            try {
                rows.add(CsvFormat.parseLine(line));
            } catch (IllegalArgumentException e) {
                throw new SourceFormatException(descriptor.getSourceId(),
                        "line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return rows;
    }

    private List<Observation> extractWide(SourceDescriptor descriptor, List<List<String>> rows) {
        String sourceId = descriptor.getSourceId();
        List<String> header = rows.get(0);
        int firstYearColumn = descriptor.getFirstYearColumn();
        if (descriptor.getLabelColumn() >= header.size() || firstYearColumn >= header.size()) {
            throw new SourceFormatException(sourceId, "header has " + header.size()
                    + " columns; expected label column " + descriptor.getLabelColumn()
                    + " and years from column " + firstYearColumn);
        }

        List<Integer> years = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int col = firstYearColumn; col < header.size(); col++) {
            int year = parseYear(sourceId, header.get(col), "header column " + col);
            if (!seen.add(year)) {
                throw new SourceFormatException(sourceId, "duplicate year " + year + " in header");
            }
            years.add(year);
        }

        List<String> row = null;
        for (int r = 1; r < rows.size(); r++) {
            List<String> candidate = rows.get(r);
            if (descriptor.getLabelColumn() < candidate.size()
                    && descriptor.getRowLabel().equals(candidate.get(descriptor.getLabelColumn()))) {
                if (candidate.size() != header.size()) {
                    throw new SourceFormatException(sourceId, "row '" + descriptor.getRowLabel() + "' has "
                            + candidate.size() + " columns, header has " + header.size());
                }
                row = candidate;
                break;
            }
        }
        if (row == null) {
            throw new SourceFormatException(sourceId, "no row labelled '" + descriptor.getRowLabel()
                    + "' in column " + descriptor.getLabelColumn());
        }

        List<Observation> observations = new ArrayList<>(years.size());
        for (int i = 0; i < years.size(); i++) {
            int year = years.get(i);
            Double value = parseValue(sourceId, row.get(firstYearColumn + i), year);
            observations.add(new Observation(descriptor.getVariableId(), year, value,
                    descriptor.getNativeUnit(), sourceId));
        }
        return observations;
    }

    private List<Observation> extractLong(SourceDescriptor descriptor, List<List<String>> rows) {
        String sourceId = descriptor.getSourceId();
        List<String> header = rows.get(0);
        int yearIdx = requireColumn(sourceId, header, descriptor.getYearColumn());
        int variableIdx = requireColumn(sourceId, header, descriptor.getVariableColumn());
        int valueIdx = requireColumn(sourceId, header, descriptor.getValueColumn());

        List<Observation> observations = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int r = 1; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.size() != header.size()) {
                throw new SourceFormatException(sourceId, "data row " + r + " has " + row.size()
                        + " columns, header has " + header.size());
            }
            if (!descriptor.getRowLabel().equals(row.get(variableIdx))) {
                continue;
            }
            int year = parseYear(sourceId, row.get(yearIdx), "data row " + r);
            if (!seen.add(year)) {
                throw new SourceFormatException(sourceId, "duplicate year " + year
                        + " for variable '" + descriptor.getRowLabel() + "'");
            }
            Double value = parseValue(sourceId, row.get(valueIdx), year);
            observations.add(new Observation(descriptor.getVariableId(), year, value,
                    descriptor.getNativeUnit(), sourceId));
        }
        if (observations.isEmpty()) {
            throw new SourceFormatException(sourceId, "no rows for variable '" + descriptor.getRowLabel() + "'");
        }
        return observations;
    }

    private int requireColumn(String sourceId, List<String> header, String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        throw new SourceFormatException(sourceId, "missing required column '" + name + "' in header " + header);
    }

    private int parseYear(String sourceId, String text, String where) {
        int year;
        try {
            year = Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new SourceFormatException(sourceId, "non-numeric year '" + text + "' at " + where, e);
        }
        if (year < Observation.MIN_YEAR || year > Observation.MAX_YEAR) {
            throw new SourceFormatException(sourceId, "year " + year + " at " + where + " is outside "
                    + Observation.MIN_YEAR + "-" + Observation.MAX_YEAR);
        }
        return year;
    }

    private Double parseValue(String sourceId, String text, int year) {
        String trimmed = text.trim();
        if (MISSING_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            double value = Double.parseDouble(trimmed.replace("_", ""));
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            throw new SourceFormatException(sourceId, "non-numeric value '" + text + "' for year " + year, e);
        }
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
