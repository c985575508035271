package io.github.yok.flexetl.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A bounded, ordered group of rows fetched from the source store in one round trip.
 *
 * <p>
 * A batch carries its column list and its records. Every record maps column names to scalar
 * values ({@link String}, {@link Number}, a {@code java.time} value, or {@code null}) in column
 * order. Batches are immutable: transform stages build a new batch instead of changing the one
 * they receive.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Batch {

    // Column names in source order
    private final List<String> columns;
    // Records; each map is unmodifiable and keeps column order
    private final List<Map<String, Object>> rows;

    /**
     * Creates a batch.
     *
     * @param columns column names
     * @param rows records (copied)
     */
    public Batch(List<String> columns, List<? extends Map<String, Object>> rows) {
        Preconditions.checkNotNull(columns, "columns must not be null");
        Preconditions.checkNotNull(rows, "rows must not be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a batch without records.
     *
     * @param columns column names
     * @return empty batch
     */
    public static Batch empty(List<String> columns) {
        return new Batch(columns, List.of());
    }

    /**
     * Returns a batch with the same columns and the given records.
     *
     * @param newRows records
     * @return new batch
     */
    public Batch withRows(List<? extends Map<String, Object>> newRows) {
        return new Batch(columns, newRows);
    }

    /**
     * Returns whether the batch has the given column.
     *
     * @param column column name
     * @return {@code true} if present
     */
    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
