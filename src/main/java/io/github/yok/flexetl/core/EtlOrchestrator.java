package io.github.yok.flexetl.core;

import io.github.yok.flexetl.db.ConnectionProvider;
import io.github.yok.flexetl.model.Batch;
import io.github.yok.flexetl.model.TableLoadSummary;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one ETL run over every table of the source schema.
 *
 * <p>
 * <strong>Flow:</strong>
 * </p>
 * <ol>
 * <li>Open the source and sink connections ({@link ConnectionProvider}).</li>
 * <li>Make sure the sink table exists.</li>
 * <li>For each source table: skip it when its tag is already in the sink; otherwise extract it
 * batch by batch, transform each batch, remove remaining duplicates and append it.</li>
 * <li>Log a per-table summary.</li>
 * <li>Close both connections, on success and on failure.</li>
 * </ol>
 *
 * <p>
 * Everything runs sequentially on the calling thread. The first unretried error aborts the run;
 * batches loaded before it stay in the sink.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class EtlOrchestrator {

    private final ConnectionProvider connectionProvider;
    private final BatchExtractor extractor;
    private final TransformPipeline pipeline;
    private final SinkLoader loader;

    /**
     * Creates an orchestrator.
     *
     * @param connectionProvider opens the source and sink connections
     * @param extractor reads source tables in batches
     * @param pipeline transforms each batch
     * @param loader writes transformed batches to the sink
     */
    public EtlOrchestrator(ConnectionProvider connectionProvider, BatchExtractor extractor,
            TransformPipeline pipeline, SinkLoader loader) {
        this.connectionProvider = connectionProvider;
        this.extractor = extractor;
        this.pipeline = pipeline;
        this.loader = loader;
    }

    /**
     * Runs the ETL process.
     *
     * @throws io.github.yok.flexetl.util.RetryExhaustedException if a connection cannot be opened
     * @throws io.github.yok.flexetl.util.EtlException if a query fails
     */
    public void runEtl() {
        log.info("=== ETL run started ===");
        Connection source = connectionProvider.openSource();
        Connection sink = null;
        try {
            sink = connectionProvider.openSink();
            loader.ensureTable(sink);

            List<String> tables = extractor.listTables(source);
            Map<String, TableLoadSummary> summaryMap = new LinkedHashMap<>();
            for (String table : tables) {
                summaryMap.put(table, processTable(source, sink, table));
            }
            logSummary(summaryMap);
            log.info("All tables processed. Closing connections.");
        } finally {
            close(sink, "sink");
            close(source, "source");
        }
        log.info("=== ETL run completed ===");
    }

    private TableLoadSummary processTable(Connection source, Connection sink, String table) {
        if (loader.alreadyLoaded(sink, table)) {
            log.info("Skipping table [{}]: records with tag [{}] already exist.", table, table);
            log.warn("Table [{}] is skipped as a whole; rows left by an interrupted earlier load "
                    + "of this table are not completed.", table);
            return TableLoadSummary.skipped(table);
        }

        log.info("[{}] === Table load started ===", table);
        int batches = 0;
        long extracted = 0L;
        long loaded = 0L;
        try (BatchStream stream = extractor.extractBatches(source, table)) {
            while (stream.hasNext()) {
                Batch batch = stream.next();
                batches++;
                extracted += batch.size();

                Batch transformed = pipeline.transform(batch, table);
                Batch deduplicated = pipeline.removeDuplicates(transformed);
                loaded += loader.append(sink, deduplicated);
                log.info("[{}] Batch {} done: extracted={}, loaded={}", table, batches,
                        batch.size(), deduplicated.size());
            }
        }
        log.info("[{}] === Table load completed: batches={}, extracted={}, loaded={} ===", table,
                batches, extracted, loaded);
        return new TableLoadSummary(table, false, batches, extracted, loaded);
    }

    private void close(Connection conn, String name) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
            log.debug("Closed {} connection", name);
        } catch (SQLException e) {
            log.warn("Failed to close {} connection: {}", name, e.getMessage());
        }
    }

    private void logSummary(Map<String, TableLoadSummary> summaryMap) {
        log.info("===== Summary =====");
        int maxNameLen = summaryMap.keySet().stream().mapToInt(String::length).max().orElse(0);
        String fmt = "  Table[%-" + Math.max(maxNameLen, 1) + "s] %s";
        summaryMap.forEach((table, summary) -> log.info(String.format(fmt, table,
                summary.isSkipped() ? "SKIPPED"
                        : "Loaded=" + summary.getLoadedRows() + " (extracted="
                                + summary.getExtractedRows() + ", batches="
                                + summary.getBatches() + ")")));
    }
}
