package io.github.yok.flexetl.core;

import io.github.yok.flexetl.model.Batch;
import io.github.yok.flexetl.util.EtlException;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Forward-only, non-restartable sequence of {@link Batch}es backed by an open cursor.
 *
 * <p>
 * Each step reads up to {@code batchSize} rows. The stream ends when a fetch returns no rows, and
 * the cursor is released at that point, on a fetch error, or on {@link #close()}, whichever comes
 * first. Batches already handed out are not affected by a later error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchStream implements Iterator<Batch>, AutoCloseable {

    @Getter
    private final String tableName;
    private final Statement statement;
    private final ResultSet resultSet;
    private final int batchSize;
    @Getter
    private final List<String> columns;

    private Batch pending;
    private boolean closed;
    @Getter
    private int batchCount;

    BatchStream(String tableName, Statement statement, ResultSet resultSet, int batchSize)
            throws SQLException {
        this.tableName = tableName;
        this.statement = statement;
        this.resultSet = resultSet;
        this.batchSize = batchSize;
        this.columns = Collections.unmodifiableList(readColumns(resultSet.getMetaData()));
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        pending = fetch();
        if (pending == null) {
            log.debug("Table[{}] exhausted after {} batch(es)", tableName, batchCount);
            close();
            return false;
        }
        return true;
    }

    @Override
    public Batch next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more batches for table " + tableName);
        }
        Batch batch = pending;
        pending = null;
        return batch;
    }

    /**
     * Releases the cursor and its statement. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            resultSet.close();
        } catch (SQLException e) {
            log.warn("Table[{}] failed to close result set: {}", tableName, e.getMessage());
        }
        try {
            statement.close();
        } catch (SQLException e) {
            log.warn("Table[{}] failed to close statement: {}", tableName, e.getMessage());
        }
    }

    private Batch fetch() {
        List<Map<String, Object>> rows = new ArrayList<>();
        try {
            while (rows.size() < batchSize && resultSet.next()) {
                rows.add(readRow());
            }
        } catch (SQLException e) {
            close();
            log.error("Error fetching batch {} from [{}]: {}", batchCount + 1, tableName,
                    e.getMessage());
            throw new EtlException("Failed to fetch batch from table " + tableName, e);
        }
        if (rows.isEmpty()) {
            return null;
        }
        batchCount++;
        log.debug("Table[{}] batch {} fetched: rows={}", tableName, batchCount, rows.size());
        return new Batch(columns, rows);
    }

    private Map<String, Object> readRow() throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), toJavaValue(resultSet.getObject(i + 1)));
        }
        return row;
    }

    /**
     * Converts a JDBC value into the plain Java value carried by a {@link Batch}.
     *
     * @param value value returned by {@link ResultSet#getObject(int)}
     * @return converted value
     * @throws SQLException if a CLOB cannot be read
     */
    static Object toJavaValue(Object value) throws SQLException {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        return value;
    }

    private static List<String> readColumns(ResultSetMetaData md) throws SQLException {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            names.add(md.getColumnLabel(i));
        }
        return names;
    }
}
