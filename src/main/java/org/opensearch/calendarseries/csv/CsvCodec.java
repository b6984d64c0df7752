/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.calendarseries.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.calendarseries.core.address.DimensionAddress;
import org.opensearch.calendarseries.core.address.Odometer;
import org.opensearch.calendarseries.core.address.SeriesMetadata;
import org.opensearch.calendarseries.core.calendar.CalendarDates;
import org.opensearch.calendarseries.core.calendar.DimensionName;
import org.opensearch.calendarseries.core.errors.CsvFormatException;
import org.opensearch.calendarseries.core.errors.HeaderMismatchException;
import org.opensearch.calendarseries.core.store.BinaryStore;
import org.opensearch.calendarseries.core.utils.Constants;
import org.opensearch.calendarseries.metrics.CalendarSeriesMetrics;
import org.opensearch.calendarseries.settings.CalendarSeriesSettings;
import org.opensearch.common.settings.Settings;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Converts between series files and CSV documents.
 *
 * <p>A CSV document starts with a header naming the dimension columns, coarse to fine, followed
 * by {@code value}. Each data row holds the integer dimension values of one address and its value:</p>
 * <pre>
 * year,month,day,hour,value
 * 2024,2,29,0,1.5
 * </pre>
 *
 * <p>With {@link TimeColumns#ISO_DATE} the dimension columns are replaced by one ISO-8601 column
 * holding the instant that starts the address, {@code date} or {@code datetime} when the series
 * has hours. Import recognises that form from the header:</p>
 * <pre>
 * datetime,value
 * 2024-02-29T00:00:00,1.5
 * </pre>
 *
 * <p>Import places every row at the slot of its own address, so rows may come in any order unless
 * {@link CalendarSeriesSettings#CSV_ENFORCE_ROW_ORDER} is set. Export walks the series in odometer
 * order and may sum finer dimensions into coarser buckets according to an
 * {@link AggregationPolicy}. Values are written with {@link Double#toString(double)}, which parses
 * back to the identical double. Values are read as plain decimals with an optional exponent, or as
 * {@code NaN}, {@code Infinity} and {@code -Infinity}.</p>
 */
public class CsvCodec {

    private static final Logger logger = LogManager.getLogger(CsvCodec.class);

    private static final String UTF8_BOM = "\uFEFF";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Set<String> NON_FINITE = Set.of("NaN", "Infinity", "-Infinity");

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.TRIM_SPACES)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();
    private static final ObjectReader ROW_READER = MAPPER.readerFor(String[].class);

    private final boolean enforceRowOrder;
    private final int readBatchSize;

    public CsvCodec() {
        this(Settings.EMPTY);
    }

    public CsvCodec(Settings settings) {
        this.enforceRowOrder = CalendarSeriesSettings.CSV_ENFORCE_ROW_ORDER.get(settings);
        this.readBatchSize = CalendarSeriesSettings.CSV_READ_BATCH_SIZE.get(settings);
    }

    /**
     * Columns of a non-aggregated CSV document for a series.
     *
     * @param metadata the series
     * @return the dimension names, coarse to fine, followed by {@code value}
     */
    public static List<String> expectedHeader(SeriesMetadata metadata) {
        return expectedHeader(metadata, TimeColumns.DIMENSIONS);
    }

    /**
     * Columns of a non-aggregated CSV document for a series in the given time column form.
     */
    public static List<String> expectedHeader(SeriesMetadata metadata, TimeColumns timeColumns) {
        return header(metadata.dimensions(), timeColumns);
    }

    /**
     * Compare a header line against {@link #expectedHeader}, token by token. A header starting
     * with {@code date} or {@code datetime} is compared against the {@link TimeColumns#ISO_DATE}
     * form, any other against the {@link TimeColumns#DIMENSIONS} form. Column names may be quoted.
     *
     * @param line the raw header line
     * @param metadata the series
     * @return the time column form the header uses
     * @throws HeaderMismatchException listing expected and actual columns on mismatch
     */
    public static TimeColumns validateHeader(String line, SeriesMetadata metadata) {
        List<String> actual;
        try {
            actual = tokenizeHeader(line);
        } catch (IOException e) {
            throw new HeaderMismatchException(expectedHeader(metadata), List.of(line), e);
        }
        TimeColumns timeColumns = TimeColumns.detect(actual);
        List<String> expected = expectedHeader(metadata, timeColumns);
        if (expected.equals(actual) == false) {
            throw new HeaderMismatchException(expected, actual);
        }
        return timeColumns;
    }

    /**
     * Load a CSV document into a store. The header is validated before any value is written.
     *
     * @param csvPath the CSV document
     * @param store a writable store
     * @return the number of data rows written
     * @throws HeaderMismatchException if the header does not match the store's series
     * @throws CsvFormatException if a row is malformed or out of order while order is enforced; the
     *         exception carries the 1-based data row number, header and blank lines not counted
     * @throws org.opensearch.calendarseries.core.errors.AddressRangeException if a row addresses no valid instant
     * @throws IOException if reading the document or writing the store fails
     */
    public long csvToBin(Path csvPath, BinaryStore store) throws IOException {
        long startNanos = System.nanoTime();
        SeriesMetadata metadata = store.metadata();
        long rows = 0;
        long previousSlot = -1;

        try (BufferedReader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new HeaderMismatchException(expectedHeader(metadata), List.of());
            }
            TimeColumns timeColumns = validateHeader(headerLine, metadata);
            int columns = expectedHeader(metadata, timeColumns).size();

            try (MappingIterator<String[]> iterator = ROW_READER.readValues(reader)) {
                while (iterator.hasNextValue()) {
                    String[] row = iterator.nextValue();
                    rows++;
                    if (row.length != columns) {
                        throw new CsvFormatException(rows, "expected " + columns + " columns, got " + row.length);
                    }
                    DimensionAddress address = timeColumns == TimeColumns.ISO_DATE
                        ? parseDate(row[0], metadata, rows)
                        : parseAddress(row, metadata, rows);
                    double value = parseValue(row[columns - 1], rows);
                    long slot = BinaryStore.position(address, metadata);
                    if (enforceRowOrder && slot <= previousSlot) {
                        throw new CsvFormatException(rows, "address " + address + " does not follow the previous row");
                    }
                    previousSlot = slot;
                    store.writeSlots(slot, new double[] { value });
                }
            }
        }

        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        CalendarSeriesMetrics.incrementCounter(CalendarSeriesMetrics.CSV.rowsImported, rows);
        CalendarSeriesMetrics.recordHistogram(CalendarSeriesMetrics.CSV.conversionLatency, tookMillis);
        logger.info("Imported {} rows from {} into {} in {}ms", rows, csvPath, store.path(), tookMillis);
        return rows;
    }

    /**
     * Export a store to CSV.
     *
     * @param store an open store
     * @param csvPath the document to write, replaced if present
     * @param aggregate whether to sum the finest dimension into buckets of the next coarser one
     * @return the number of data rows written
     * @throws IOException if reading the store or writing the document fails
     */
    public long binToCsv(BinaryStore store, Path csvPath, boolean aggregate) throws IOException {
        return binToCsv(store, csvPath, aggregate ? AggregationPolicy.collapseFinest() : AggregationPolicy.none());
    }

    /**
     * Export a store to CSV, keeping the dimensions chosen by {@code policy} and summing the
     * values of every bucket they define.
     *
     * @param store an open store
     * @param csvPath the document to write, replaced if present
     * @param policy which dimensions to keep
     * @return the number of data rows written
     * @throws IllegalArgumentException if the policy does not fit the store's series
     * @throws IOException if reading the store or writing the document fails
     */
    public long binToCsv(BinaryStore store, Path csvPath, AggregationPolicy policy) throws IOException {
        return binToCsv(store, csvPath, policy, TimeColumns.DIMENSIONS);
    }

    /**
     * Export a store to CSV, keeping the dimensions chosen by {@code policy} and writing them in the
     * {@code timeColumns} form. With {@link TimeColumns#ISO_DATE} each row holds the instant
     * starting its bucket, e.g. {@code 2024-02-01} for February 2024 when keeping {@code [year, month]}.
     *
     * @param store an open store
     * @param csvPath the document to write, replaced if present
     * @param policy which dimensions to keep
     * @param timeColumns how the kept dimensions are written
     * @return the number of data rows written
     * @throws IllegalArgumentException if the policy does not fit the store's series
     * @throws IOException if reading the store or writing the document fails
     */
    public long binToCsv(BinaryStore store, Path csvPath, AggregationPolicy policy, TimeColumns timeColumns) throws IOException {
        long startNanos = System.nanoTime();
        SeriesMetadata metadata = store.metadata();
        int retained = policy.retainedLength(metadata);
        boolean aggregating = policy.aggregates(metadata);
        List<DimensionName> kept = metadata.dimensions().subList(0, retained);
        List<String> header = header(kept, timeColumns);

        CsvSchema schema = CsvSchema.builder()
            .addColumns(header, CsvSchema.ColumnType.STRING)
            .setUseHeader(false)
            .setColumnSeparator(Constants.Csv.SEPARATOR)
            .setLineSeparator(Constants.Csv.LINE_SEPARATOR)
            .build();
        ObjectWriter rowWriter = MAPPER.writerFor(String[].class).with(schema);

        long rows = 0;
        long totalSlots = store.totalSlots();
        Iterator<DimensionAddress> addresses = Odometer.iterate(metadata).iterator();

        try (
            Writer writer = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
            SequenceWriter output = rowWriter.writeValues(writer)
        ) {
            output.write(header.toArray(new String[0]));

            int[] bucket = null;
            double sum = 0;
            for (long slot = 0; slot < totalSlots; slot += readBatchSize) {
                double[] values = store.readSlots(slot, (int) Math.min(readBatchSize, totalSlots - slot));
                for (double value : values) {
                    DimensionAddress address = addresses.next();
                    if (aggregating == false) {
                        output.write(row(kept, address.values(), timeColumns, value));
                        rows++;
                        continue;
                    }
                    if (bucket != null && sameBucket(bucket, address, retained) == false) {
                        output.write(row(kept, bucket, timeColumns, sum));
                        rows++;
                        bucket = null;
                    }
                    if (bucket == null) {
                        bucket = address.values();
                        sum = 0;
                    }
                    sum += value;
                }
            }
            if (bucket != null) {
                output.write(row(kept, bucket, timeColumns, sum));
                rows++;
            }
        }

        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        CalendarSeriesMetrics.incrementCounter(CalendarSeriesMetrics.CSV.rowsExported, rows);
        CalendarSeriesMetrics.recordHistogram(CalendarSeriesMetrics.CSV.conversionLatency, tookMillis);
        logger.info(
            "Exported {} rows from {} to {} with policy {} and {} time columns in {}ms",
            rows,
            store.path(),
            csvPath,
            policy,
            timeColumns,
            tookMillis
        );
        return rows;
    }

    private static List<String> header(List<DimensionName> kept, TimeColumns timeColumns) {
        List<String> header = new ArrayList<>(kept.size() + 1);
        if (timeColumns == TimeColumns.ISO_DATE) {
            header.add(CalendarDates.hasTimeOfDay(kept) ? Constants.Csv.DATETIME_COLUMN : Constants.Csv.DATE_COLUMN);
        } else {
            for (DimensionName dimension : kept) {
                header.add(dimension.fieldName());
            }
        }
        header.add(Constants.Csv.VALUE_COLUMN);
        return header;
    }

    private static List<String> tokenizeHeader(String line) throws IOException {
        String stripped = line.startsWith(UTF8_BOM) ? line.substring(1) : line;
        try (MappingIterator<String[]> iterator = ROW_READER.readValues(stripped)) {
            return iterator.hasNextValue() ? Arrays.asList(iterator.nextValue()) : List.of();
        }
    }

    private static DimensionAddress parseAddress(String[] row, SeriesMetadata metadata, long rowNumber) {
        int[] values = new int[metadata.dimensionCount()];
        for (int i = 0; i < values.length; i++) {
            try {
                values[i] = Integer.parseInt(row[i]);
            } catch (NumberFormatException e) {
                throw new CsvFormatException(
                    rowNumber,
                    "invalid " + metadata.dimensionAt(i) + " value [" + row[i] + "], expected an integer",
                    e
                );
            }
        }
        return address(metadata, values);
    }

    private static DimensionAddress parseDate(String field, SeriesMetadata metadata, long rowNumber) {
        boolean withTime = CalendarDates.hasTimeOfDay(metadata.dimensions());
        LocalDateTime dateTime;
        try {
            dateTime = CalendarDates.parse(field, withTime);
        } catch (DateTimeParseException e) {
            String expected = withTime ? "an ISO-8601 date and time such as 2024-02-29T13:00:00" : "an ISO-8601 date such as 2024-02-29";
            throw new CsvFormatException(rowNumber, "invalid date [" + field + "], expected " + expected, e);
        }
        try {
            return address(metadata, CalendarDates.fromDateTime(dateTime, metadata.dimensions()));
        } catch (IllegalArgumentException e) {
            throw new CsvFormatException(rowNumber, e.getMessage(), e);
        }
    }

    private static DimensionAddress address(SeriesMetadata metadata, int[] values) {
        Map<DimensionName, Integer> map = new EnumMap<>(DimensionName.class);
        for (int i = 0; i < values.length; i++) {
            map.put(metadata.dimensionAt(i), values[i]);
        }
        return DimensionAddress.of(map);
    }

    private static double parseValue(String field, long rowNumber) {
        if (NON_FINITE.contains(field) == false && DECIMAL.matcher(field).matches() == false) {
            throw new CsvFormatException(rowNumber, "invalid value [" + field + "], expected a decimal number");
        }
        return Double.parseDouble(field);
    }

    private static boolean sameBucket(int[] bucket, DimensionAddress address, int retained) {
        for (int i = 0; i < retained; i++) {
            if (bucket[i] != address.valueAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static String[] row(List<DimensionName> kept, int[] values, TimeColumns timeColumns, double value) {
        if (timeColumns == TimeColumns.ISO_DATE) {
            String date = CalendarDates.format(CalendarDates.toDateTime(kept, values), CalendarDates.hasTimeOfDay(kept));
            return new String[] { date, Double.toString(value) };
        }
        String[] row = new String[kept.size() + 1];
        for (int i = 0; i < kept.size(); i++) {
            row[i] = Integer.toString(values[i]);
        }
        row[kept.size()] = Double.toString(value);
        return row;
    }
}
