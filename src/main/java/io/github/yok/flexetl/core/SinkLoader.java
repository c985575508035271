package io.github.yok.flexetl.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.SinkConfig;
import io.github.yok.flexetl.model.Batch;
import io.github.yok.flexetl.model.TransformedRecord;
import io.github.yok.flexetl.util.DateTimeValues;
import io.github.yok.flexetl.util.EtlException;
import io.github.yok.flexetl.util.SqlUtils;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes transformed batches into the sink table.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Create the destination table ({@code payload, captured_at, tag}) when it is missing.</li>
 * <li>Tell whether a source table was already loaded, by counting rows carrying its tag.</li>
 * <li>Append one batch with a single multi-row {@code INSERT}.</li>
 * </ul>
 *
 * <p>
 * The tag check works per source table, while appends happen per batch: a run interrupted in the
 * middle of a table leaves rows behind, and the next run skips that table entirely.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SinkLoader {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*"
            + "(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    @Getter
    private final String table;

    /**
     * Creates a loader writing into {@code sink.table}.
     *
     * @param sinkConfig sink settings
     */
    public SinkLoader(SinkConfig sinkConfig) {
        this(sinkConfig.getTable());
    }

    /**
     * Creates a loader writing into the given table.
     *
     * @param table destination table name ({@code name} or {@code database.name})
     */
    public SinkLoader(String table) {
        Preconditions.checkArgument(table != null && TABLE_NAME.matcher(table).matches(),
                "Invalid sink table name: %s", table);
        this.table = table;
    }

    /**
     * Creates the destination table if it does not exist. Safe to call on every run.
     *
     * @param conn sink connection
     * @throws EtlException if the DDL fails
     */
    public void ensureTable(Connection conn) {
        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " (payload String, "
                + "captured_at DateTime, tag String) ENGINE = MergeTree() ORDER BY captured_at";
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
            log.info("Ensured sink table [{}] exists with the expected schema.", table);
        } catch (SQLException e) {
            log.error("Error ensuring sink table [{}]: {}", table, e.getMessage());
            throw new EtlException("Failed to create sink table " + table, e);
        }
    }

    /**
     * Returns whether rows tagged with {@code tag} already exist.
     *
     * @param conn sink connection
     * @param tag source table name
     * @return {@code true} if at least one row carries the tag
     * @throws EtlException if the count query fails
     */
    public boolean alreadyLoaded(Connection conn, String tag) {
        log.info("Checking if records with tag [{}] already exist in [{}]...", tag, table);
        String sql = "SELECT COUNT(*) FROM " + table + " WHERE tag = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, tag);
            try (ResultSet rs = ps.executeQuery()) {
                long count = rs.next() ? rs.getLong(1) : 0L;
                log.debug("Tag[{}] existing rows={}", tag, count);
                return count > 0;
            }
        } catch (SQLException e) {
            log.error("Error counting rows with tag [{}]: {}", tag, e.getMessage());
            throw new EtlException("Failed to check existing records for tag " + tag, e);
        }
    }

    /**
     * Appends a transformed batch with one multi-row {@code INSERT}.
     *
     * <p>
     * The statement is not split: the caller keeps batches within the extraction batch size. There
     * is no transaction around it.
     * </p>
     *
     * @param conn sink connection
     * @param batch batch with the columns {@code payload, date_time, tag}
     * @return number of records appended
     * @throws EtlException if the insert fails
     */
    public int append(Connection conn, Batch batch) {
        if (batch.isEmpty()) {
            log.debug("Nothing to load into [{}]", table);
            return 0;
        }
        List<TransformedRecord> records = batch.getRows().stream().map(TransformedRecord::fromRow)
                .collect(Collectors.toList());
        log.info("Loading {} record(s) into [{}]...", records.size(), table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(buildInsertSql(records));
        } catch (SQLException e) {
            log.error("Error loading data into [{}]: {}", table, e.getMessage());
            throw new EtlException("Failed to load data into " + table, e);
        }
        log.info("Data loaded into [{}]: {} record(s)", table, records.size());
        return records.size();
    }

    String buildInsertSql(List<TransformedRecord> records) {
        String values = records.stream()
                .map(r -> "('" + r.getPayload() + "', '"
                        + r.getCapturedAt().format(DateTimeValues.CANONICAL) + "', "
                        + SqlUtils.quoteLiteral(r.getTag()) + ")")
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (payload, captured_at, tag) VALUES " + values;
    }
}
