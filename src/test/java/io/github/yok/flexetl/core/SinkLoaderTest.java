package io.github.yok.flexetl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexetl.config.SinkConfig;
import io.github.yok.flexetl.model.Batch;
import io.github.yok.flexetl.util.EtlException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SinkLoaderTest {

    private Connection conn;
    private Statement stmt;
    private SinkLoader loader;

    @BeforeEach
    void setup() throws Exception {
        conn = mock(Connection.class);
        stmt = mock(Statement.class);
        when(conn.createStatement()).thenReturn(stmt);
        loader = new SinkLoader(new SinkConfig());
    }

    private static Map<String, Object> output(String payload, Object dateTime, String tag) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("payload", payload);
        row.put("date_time", dateTime);
        row.put("tag", tag);
        return row;
    }

    @Test
    void constructor_異常ケース_不正な表名_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new SinkLoader("grupox; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> new SinkLoader((String) null));
        assertEquals("analytics.grupox", new SinkLoader("analytics.grupox").getTable());
    }

    @Test
    void ensureTable_正常ケース_呼び出す_CREATE_TABLE_IF_NOT_EXISTSが実行されること() throws Exception {
        loader.ensureTable(conn);

        verify(stmt).execute("CREATE TABLE IF NOT EXISTS grupox (payload String, "
                + "captured_at DateTime, tag String) ENGINE = MergeTree() ORDER BY captured_at");
        verify(stmt).close();
    }

    @Test
    void ensureTable_異常ケース_DDLに失敗する_EtlExceptionが送出されること() throws Exception {
        when(stmt.execute(anyString())).thenThrow(new SQLException("read only"));

        assertThrows(EtlException.class, () -> loader.ensureTable(conn));
    }

    @Test
    void alreadyLoaded_正常ケース_タグの行が存在する_trueが返ること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.prepareStatement("SELECT COUNT(*) FROM grupox WHERE tag = ?")).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(3L, 0L);

        assertTrue(loader.alreadyLoaded(conn, "orders"));
        assertFalse(loader.alreadyLoaded(conn, "orders"));
        verify(ps, times(2)).setString(1, "orders");
    }

    @Test
    void alreadyLoaded_異常ケース_問い合わせに失敗する_EtlExceptionが送出されること() throws Exception {
        when(conn.prepareStatement(anyString())).thenThrow(new SQLException("timeout"));

        assertThrows(EtlException.class, () -> loader.alreadyLoaded(conn, "orders"));
    }

    @Test
    void append_正常ケース_空のバッチ_文を実行せず0が返ること() throws Exception {
        assertEquals(0, loader.append(conn, Batch.empty(TransformPipeline.OUTPUT_COLUMNS)));
        verify(conn, never()).createStatement();
    }

    @Test
    void append_正常ケース_2件のバッチ_複数行INSERTが1回実行され件数が返ること() throws Exception {
        Batch batch = new Batch(TransformPipeline.OUTPUT_COLUMNS,
                List.of(output("{\"id\":1}", LocalDateTime.of(2024, 1, 5, 10, 0), "orders"),
                        output("{\"name\":\"o\\'neil\"}", LocalDateTime.of(2024, 1, 6, 8, 30, 15),
                                "orders")));

        assertEquals(2, loader.append(conn, batch));

        verify(stmt).execute("INSERT INTO grupox (payload, captured_at, tag) VALUES "
                + "('{\"id\":1}', '2024-01-05 10:00:00', 'orders'), "
                + "('{\"name\":\"o\\'neil\"}', '2024-01-06 08:30:15', 'orders')");
    }

    @Test
    void append_異常ケース_INSERTに失敗する_EtlExceptionが送出されること() throws Exception {
        when(stmt.execute(anyString())).thenThrow(new SQLException("too many parts"));
        Batch batch = new Batch(TransformPipeline.OUTPUT_COLUMNS,
                List.of(output("{}", LocalDateTime.of(2024, 1, 5, 10, 0), "orders")));

        EtlException ex = assertThrows(EtlException.class, () -> loader.append(conn, batch));
        assertEquals("Failed to load data into grupox", ex.getMessage());
    }
}
