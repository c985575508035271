package io.github.yok.flexetl.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.PipelineConfig;
import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.util.EtlException;
import io.github.yok.flexetl.util.SqlUtils;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads source tables in bounded batches.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>List the tables of the configured source schema ({@link #listTables(Connection)}).</li>
 * <li>Open a cursor over one table and hand it out as a {@link BatchStream}
 * ({@link #extractBatches(Connection, String)}).</li>
 * </ul>
 *
 * <p>
 * Query failures raise {@link EtlException} immediately; retries happen only when connections are
 * opened.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchExtractor {

    static final String LIST_TABLES_SQL = "SELECT table_name FROM information_schema.tables"
            + " WHERE table_schema = ? ORDER BY table_name";

    private final String schema;
    private final int batchSize;
    private final List<String> excludeTables;

    /**
     * Creates an extractor from the source and pipeline settings.
     *
     * @param sourceConfig source settings (schema)
     * @param pipelineConfig pipeline settings (batch size, excluded tables)
     */
    public BatchExtractor(SourceConfig sourceConfig, PipelineConfig pipelineConfig) {
        this(sourceConfig.getSchema(), pipelineConfig.getBatchSize(),
                pipelineConfig.getExcludeTables());
    }

    /**
     * Creates an extractor.
     *
     * @param schema source schema
     * @param batchSize maximum rows per batch
     * @param excludeTables table names never extracted (case-insensitive), may be {@code null}
     */
    public BatchExtractor(String schema, int batchSize, List<String> excludeTables) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        Preconditions.checkArgument(batchSize > 0, "batchSize must be > 0: %s", batchSize);
        this.schema = schema;
        this.batchSize = batchSize;
        this.excludeTables = excludeTables == null ? List.of() : List.copyOf(excludeTables);
    }

    /**
     * Lists the tables of the source schema in name order, without the excluded ones.
     *
     * @param conn source connection
     * @return table names
     * @throws EtlException if the listing query fails
     */
    public List<String> listTables(Connection conn) {
        log.info("Listing tables in source schema [{}]...", schema);
        List<String> tables = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(LIST_TABLES_SQL)) {
            ps.setString(1, schema);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String tableName = rs.getString(1);
                    boolean excluded =
                            excludeTables.stream().anyMatch(ex -> ex.equalsIgnoreCase(tableName));
                    if (excluded) {
                        log.info("Table [{}] is excluded; skipping", tableName);
                    } else {
                        tables.add(tableName);
                    }
                }
            }
        } catch (SQLException e) {
            log.error("Error listing tables in source schema [{}]: {}", schema, e.getMessage());
            throw new EtlException("Failed to list tables in schema " + schema, e);
        }
        log.info("Found tables in source: {}", tables);
        return tables;
    }

    /**
     * Opens a cursor over {@code SELECT *} of the table and returns it as a batch stream.
     *
     * <p>
     * The caller must close the stream; it also closes itself once exhausted or on a fetch error.
     * </p>
     *
     * @param conn source connection (auto-commit disabled for server-side cursors)
     * @param tableName table to read
     * @return lazy stream of batches of at most {@code batchSize} rows
     * @throws EtlException if the query cannot be started
     */
    public BatchStream extractBatches(Connection conn, String tableName) {
        log.info("Extracting data from table [{}] in source...", tableName);
        String sql = selectAllSql(tableName);
        Statement stmt = null;
        try {
            stmt = conn.createStatement();
            stmt.setFetchSize(batchSize);
            ResultSet rs = stmt.executeQuery(sql);
            return new BatchStream(tableName, stmt, rs, batchSize);
        } catch (SQLException e) {
            closeQuietly(stmt);
            log.error("Error extracting data from [{}] in source: {}", tableName, e.getMessage());
            throw new EtlException("Failed to extract data from table " + tableName, e);
        }
    }

    String selectAllSql(String tableName) {
        return "SELECT * FROM " + SqlUtils.quoteIdentifier(schema) + "."
                + SqlUtils.quoteIdentifier(tableName);
    }

    private static void closeQuietly(Statement stmt) {
        if (stmt == null) {
            return;
        }
        try {
            stmt.close();
        } catch (SQLException e) {
            log.warn("Failed to close statement: {}", e.getMessage());
        }
    }
}
