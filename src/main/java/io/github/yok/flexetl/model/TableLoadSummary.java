package io.github.yok.flexetl.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one source table in a run, used for the summary log.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public class TableLoadSummary {

    // Source table name (also the tag)
    private final String table;
    // true when the table was skipped because its tag already exists in the sink
    private final boolean skipped;
    // Number of batches read from the source
    private final int batches;
    // Rows read from the source
    private final long extractedRows;
    // Records appended to the sink
    private final long loadedRows;

    /**
     * Summary for a table skipped by the idempotency check.
     *
     * @param table table name
     * @return summary
     */
    public static TableLoadSummary skipped(String table) {
        return new TableLoadSummary(table, true, 0, 0L, 0L);
    }
}
