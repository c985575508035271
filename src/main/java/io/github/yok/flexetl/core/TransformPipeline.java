package io.github.yok.flexetl.core;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.PipelineConfig;
import io.github.yok.flexetl.model.Batch;
import io.github.yok.flexetl.model.TransformedRecord;
import io.github.yok.flexetl.util.DateTimeValues;
import io.github.yok.flexetl.util.NumericValues;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the fixed sequence of cleaning, normalization and validation stages to one batch.
 *
 * <p>
 * Stages run strictly in this order; later stages see the effects of earlier ones:
 * </p>
 * <ol>
 * <li>clean: drop records with any {@code null} field</li>
 * <li>normalize: lowercase text, format date-times as {@code yyyy-MM-dd HH:mm:ss}</li>
 * <li>aggregate: with {@code category} and {@code amount}, one record per category holding the
 * summed amount</li>
 * <li>filter: with {@code status}, keep {@code status == "active"}</li>
 * <li>convert types: numeric text to numbers, {@code *date*} columns to date-times</li>
 * <li>remove duplicates</li>
 * <li>map fields: rename columns per {@code pipeline.fieldMapping}</li>
 * <li>validate: with {@code amount}, keep {@code 0 <= amount <= 1,000,000}</li>
 * <li>attach metadata: payload, tag, capture timestamp</li>
 * <li>project to {@code payload, date_time, tag}</li>
 * </ol>
 *
 * <p>
 * The pipeline keeps no state between batches. Value problems inside a stage never raise: a column
 * that cannot be made numeric stays as is and an unparseable date becomes {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TransformPipeline {

    static final String CATEGORY = "category";
    static final String AMOUNT = "amount";
    static final String STATUS = "status";
    static final String ACTIVE = "active";
    static final String DATE_MARKER = "date";

    static final BigDecimal MIN_AMOUNT = BigDecimal.ZERO;
    static final BigDecimal MAX_AMOUNT = BigDecimal.valueOf(1_000_000L);

    /**
     * Columns of every transformed batch.
     */
    public static final List<String> OUTPUT_COLUMNS = List.of(TransformedRecord.PAYLOAD,
            TransformedRecord.DATE_TIME, TransformedRecord.TAG);

    // Numbers first (by value), then text, then anything else grouped by type
    private static final Comparator<Object> CATEGORY_ORDER = Comparator
            .<Object>comparingInt(TransformPipeline::categoryRank)
            .thenComparing(TransformPipeline::compareSameRank);

    private final Map<String, String> fieldMapping;
    private final Clock clock;

    /**
     * Creates a pipeline using {@code pipeline.fieldMapping} and the system clock.
     *
     * @param config pipeline settings
     */
    public TransformPipeline(PipelineConfig config) {
        this(config.getFieldMapping(), Clock.systemDefaultZone());
    }

    /**
     * Creates a pipeline.
     *
     * @param fieldMapping column rename table (old name to new name), may be {@code null}
     * @param clock clock used for the capture timestamp
     */
    public TransformPipeline(Map<String, String> fieldMapping, Clock clock) {
        this.fieldMapping = fieldMapping == null ? Map.of() : new LinkedHashMap<>(fieldMapping);
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    }

    /**
     * Runs every stage on the batch.
     *
     * @param batch extracted batch
     * @param tableName source table name, used as tag
     * @return batch with the columns {@link #OUTPUT_COLUMNS}
     */
    public Batch transform(Batch batch, String tableName) {
        log.info("Starting data transformation. Table[{}] rows={}", tableName, batch.size());
        Batch current = batch;
        current = stage("clean", current, this::clean);
        current = stage("normalize", current, this::normalize);
        current = stage("aggregate", current, this::aggregate);
        current = stage("filter", current, this::filter);
        current = stage("convertTypes", current, this::convertTypes);
        current = stage("removeDuplicates", current, this::removeDuplicates);
        current = stage("mapFields", current, this::mapFields);
        current = stage("validate", current, this::validate);
        current = stage("attachMetadata", current, b -> attachMetadata(b, tableName));
        current = stage("project", current, this::project);
        log.info("Data transformation completed. Table[{}] rows={}", tableName, current.size());
        return current;
    }

    /**
     * Removes exact-duplicate records; the first occurrence is kept.
     *
     * @param batch input batch
     * @return batch without duplicates
     */
    public Batch removeDuplicates(Batch batch) {
        return batch.withRows(new ArrayList<>(new LinkedHashSet<>(batch.getRows())));
    }

    Batch clean(Batch batch) {
        List<Map<String, Object>> kept = batch.getRows().stream()
                .filter(row -> batch.getColumns().stream().allMatch(c -> row.get(c) != null))
                .collect(Collectors.toList());
        return batch.withRows(kept);
    }

    Batch normalize(Batch batch) {
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch.getRows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            row.forEach((column, value) -> out.put(column, normalizeValue(value)));
            rows.add(out);
        }
        return batch.withRows(rows);
    }

    Batch aggregate(Batch batch) {
        if (!batch.hasColumn(CATEGORY) || !batch.hasColumn(AMOUNT)) {
            return batch;
        }
        Map<Object, BigDecimal> sums = new TreeMap<>(CATEGORY_ORDER);
        boolean integral = true;
        for (Map<String, Object> row : batch.getRows()) {
            Object amount = row.get(AMOUNT);
            BigDecimal value = NumericValues.toBigDecimal(amount);
            if (value == null) {
                log.warn("Aggregation skipped: non-numeric {} value [{}]", AMOUNT, amount);
                return batch;
            }
            integral &= NumericValues.isIntegral(amount);
            sums.merge(row.get(CATEGORY), value, BigDecimal::add);
        }
        List<Map<String, Object>> rows = new ArrayList<>(sums.size());
        for (Map.Entry<Object, BigDecimal> entry : sums.entrySet()) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(CATEGORY, entry.getKey());
            out.put(AMOUNT, toSumValue(entry.getValue(), integral));
            rows.add(out);
        }
        return new Batch(List.of(CATEGORY, AMOUNT), rows);
    }

    Batch filter(Batch batch) {
        if (!batch.hasColumn(STATUS)) {
            return batch;
        }
        return batch.withRows(batch.getRows().stream()
                .filter(row -> ACTIVE.equals(row.get(STATUS))).collect(Collectors.toList()));
    }

    Batch convertTypes(Batch batch) {
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        batch.getRows().forEach(row -> rows.add(new LinkedHashMap<>(row)));

        for (String column : batch.getColumns()) {
            if (rows.stream().anyMatch(row -> row.get(column) instanceof String)) {
                convertNumericColumn(rows, column);
            }
        }
        for (String column : batch.getColumns()) {
            if (column.contains(DATE_MARKER)) {
                rows.forEach(row -> row.put(column,
                        DateTimeValues.parseDayFirst(row.get(column))));
            }
        }
        return batch.withRows(rows);
    }

    Batch mapFields(Batch batch) {
        if (fieldMapping.isEmpty()) {
            return batch;
        }
        List<String> columns = batch.getColumns().stream()
                .map(c -> fieldMapping.getOrDefault(c, c)).collect(Collectors.toList());
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch.getRows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            row.forEach((column, value) -> out.put(fieldMapping.getOrDefault(column, column),
                    value));
            rows.add(out);
        }
        return new Batch(columns, rows);
    }

    Batch validate(Batch batch) {
        if (!batch.hasColumn(AMOUNT)) {
            return batch;
        }
        return batch.withRows(batch.getRows().stream().filter(row -> {
            BigDecimal amount = NumericValues.toBigDecimal(row.get(AMOUNT));
            return amount != null && amount.compareTo(MIN_AMOUNT) >= 0
                    && amount.compareTo(MAX_AMOUNT) <= 0;
        }).collect(Collectors.toList()));
    }

    Batch attachMetadata(Batch batch, String tableName) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        boolean hasDateTime = batch.hasColumn(TransformedRecord.DATE_TIME);

        List<String> columns = new ArrayList<>(batch.getColumns());
        for (String column : OUTPUT_COLUMNS) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch.getRows()) {
            Map<String, Object> out = new LinkedHashMap<>(row);
            out.put(TransformedRecord.PAYLOAD, PayloadCodec.encode(row));
            out.put(TransformedRecord.TAG, tableName);
            LocalDateTime capturedAt = hasDateTime
                    ? DateTimeValues.parseDayFirst(row.get(TransformedRecord.DATE_TIME))
                    : null;
            out.put(TransformedRecord.DATE_TIME, Objects.requireNonNullElse(capturedAt, now));
            rows.add(out);
        }
        return new Batch(columns, rows);
    }

    Batch project(Batch batch) {
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch.getRows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            OUTPUT_COLUMNS.forEach(column -> out.put(column, row.get(column)));
            rows.add(out);
        }
        return new Batch(OUTPUT_COLUMNS, rows);
    }

    @VisibleForTesting
    static Object normalizeValue(Object value) {
        if (value instanceof String) {
            return ((String) value).toLowerCase(Locale.ROOT);
        }
        if (DateTimeValues.isDateTime(value)) {
            return DateTimeValues.formatCanonical(value);
        }
        return value;
    }

    private void convertNumericColumn(List<Map<String, Object>> rows, String column) {
        List<BigDecimal> parsed = new ArrayList<>(rows.size());
        boolean integral = true;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                parsed.add(null);
                continue;
            }
            BigDecimal number = NumericValues.toBigDecimal(value);
            if (number == null) {
                log.debug("Column [{}] kept as text: non-numeric value [{}]", column, value);
                return;
            }
            integral &= NumericValues.isIntegral(value) && NumericValues.fitsLong(number);
            parsed.add(number);
        }
        for (int i = 0; i < rows.size(); i++) {
            BigDecimal number = parsed.get(i);
            if (number != null) {
                rows.get(i).put(column, integral ? number.longValueExact() : number.doubleValue());
            }
        }
    }

    private static int categoryRank(Object category) {
        if (category instanceof Number) {
            return 0;
        }
        return category instanceof String ? 1 : 2;
    }

    private static int compareSameRank(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            BigDecimal x = NumericValues.toBigDecimal(a);
            BigDecimal y = NumericValues.toBigDecimal(b);
            if (x != null && y != null) {
                return x.compareTo(y);
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        int byType = a.getClass().getName().compareTo(b.getClass().getName());
        return byType != 0 ? byType : String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static Object toSumValue(BigDecimal sum, boolean integral) {
        if (integral && NumericValues.fitsLong(sum)) {
            return sum.longValueExact();
        }
        return sum;
    }

    private static Batch stage(String name, Batch input, UnaryOperator<Batch> operator) {
        Batch output = operator.apply(input);
        log.debug("Stage[{}] rows {} -> {}", name, input.size(), output.size());
        return output;
    }
}
