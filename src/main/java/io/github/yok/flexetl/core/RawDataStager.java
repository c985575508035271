package io.github.yok.flexetl.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.config.StagingConfig;
import io.github.yok.flexetl.db.ConnectionProvider;
import io.github.yok.flexetl.util.EtlException;
import io.github.yok.flexetl.util.SqlUtils;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Stages a raw CSV file into a table of the source schema so that it can be picked up by a later
 * ETL run.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Read the UTF-8 CSV file (first line is the header).</li>
 * <li>Keep a copy under {@code staging.processedDir} as {@code <table>.csv}.</li>
 * <li>Create {@code "schema"."table"} with every column as {@code TEXT} if it does not exist.</li>
 * <li>Insert the rows with JDBC batches of {@code staging.batchSize} rows and commit; roll back
 * on failure.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RawDataStager {

    private final ConnectionProvider connectionProvider;
    private final String schema;
    private final StagingConfig stagingConfig;

    /**
     * Creates a stager.
     *
     * @param connectionProvider opens the source connection (with retries)
     * @param sourceConfig source settings (target schema)
     * @param stagingConfig staging settings
     */
    public RawDataStager(ConnectionProvider connectionProvider, SourceConfig sourceConfig,
            StagingConfig stagingConfig) {
        this.connectionProvider = connectionProvider;
        this.schema = sourceConfig.getSchema();
        this.stagingConfig = stagingConfig;
    }

    /**
     * Stages the CSV file into {@code tableName}.
     *
     * @param csvFile CSV file with a header row
     * @param tableName target table in the source schema
     * @return number of rows inserted
     * @throws EtlException if the file cannot be read or copied, or the insert fails
     */
    public int stage(Path csvFile, String tableName) {
        Preconditions.checkArgument(StringUtils.isNotBlank(tableName), "tableName is required");
        Preconditions.checkArgument(stagingConfig.getBatchSize() > 0,
                "staging.batchSize must be > 0");
        log.info("Staging [{}] into [{}.{}]...", csvFile, schema, tableName);

        List<String> headers = new ArrayList<>();
        List<List<String>> rows = readCsv(csvFile, headers);
        keepProcessedCopy(csvFile, tableName);

        int inserted = insertRows(tableName, headers, rows);
        log.info("Staged {} row(s) into [{}.{}]", inserted, schema, tableName);
        return inserted;
    }

    private List<List<String>> readCsv(Path csvFile, List<String> headers) {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setTrim(true).build();
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(reader)) {
            headers.addAll(parser.getHeaderNames());
            if (headers.isEmpty()) {
                throw new EtlException("CSV file has no header: " + csvFile);
            }
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(headers.size());
                for (int i = 0; i < headers.size(); i++) {
                    values.add(i < record.size() ? record.get(i) : null);
                }
                rows.add(values);
            }
            log.debug("Read {} row(s) from [{}]", rows.size(), csvFile);
            return rows;
        } catch (IOException e) {
            throw new EtlException("Failed to read CSV file: " + csvFile, e);
        }
    }

    private void keepProcessedCopy(Path csvFile, String tableName) {
        File processedDir = new File(stagingConfig.getProcessedDir());
        File target = new File(processedDir, tableName + ".csv");
        try {
            FileUtils.forceMkdir(processedDir);
            FileUtils.copyFile(csvFile.toFile(), target);
            log.info("Processed copy written: {}", target.getPath());
        } catch (IOException e) {
            throw new EtlException("Failed to write processed copy: " + target, e);
        }
    }

    private int insertRows(String tableName, List<String> headers, List<List<String>> rows) {
        String qualified =
                SqlUtils.quoteIdentifier(schema) + "." + SqlUtils.quoteIdentifier(tableName);
        String columnList =
                headers.stream().map(SqlUtils::quoteIdentifier).collect(Collectors.joining(", "));
        String createSql = "CREATE TABLE IF NOT EXISTS " + qualified + " ("
                + headers.stream().map(h -> SqlUtils.quoteIdentifier(h) + " TEXT")
                        .collect(Collectors.joining(", "))
                + ")";
        String insertSql = "INSERT INTO " + qualified + " (" + columnList + ") VALUES ("
                + headers.stream().map(h -> "?").collect(Collectors.joining(", ")) + ")";

        Connection conn = connectionProvider.openSource();
        try {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(createSql);
            }
            int batchSize = stagingConfig.getBatchSize();
            int pending = 0;
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                for (List<String> row : rows) {
                    for (int i = 0; i < row.size(); i++) {
                        String value = row.get(i);
                        if (StringUtils.isEmpty(value)) {
                            ps.setNull(i + 1, Types.VARCHAR);
                        } else {
                            ps.setString(i + 1, value);
                        }
                    }
                    ps.addBatch();
                    if (++pending == batchSize) {
                        ps.executeBatch();
                        log.debug("Upload {}: {} row(s) flushed", tableName, pending);
                        pending = 0;
                    }
                }
                if (pending > 0) {
                    ps.executeBatch();
                    log.debug("Upload {}: {} row(s) flushed", tableName, pending);
                }
            }
            conn.commit();
            return rows.size();
        } catch (SQLException e) {
            rollback(conn);
            log.error("Error staging data into [{}.{}]: {}", schema, tableName, e.getMessage());
            throw new EtlException("Failed to stage data into " + schema + "." + tableName, e);
        } finally {
            close(conn);
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private void close(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close source connection: {}", e.getMessage());
        }
    }
}
