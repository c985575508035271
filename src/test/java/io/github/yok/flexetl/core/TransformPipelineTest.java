package io.github.yok.flexetl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.model.Batch;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransformPipelineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    private TransformPipeline pipeline;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00.789Z"), ZoneOffset.UTC);
        pipeline = new TransformPipeline(Map.of("old_column_name", "new_column_name"), clock);
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void transform_正常ケース_カテゴリと金額を持つ表_大小文字を無視して集計された1件になること() {
        Batch batch = new Batch(List.of("category", "amount"),
                List.of(row("category", "A", "amount", 500), row("category", "a", "amount", 10)));

        Batch result = pipeline.transform(batch, "orders");

        assertEquals(TransformPipeline.OUTPUT_COLUMNS, result.getColumns());
        assertEquals(1, result.size());
        Map<String, Object> out = result.getRows().get(0);
        assertEquals("{\"category\":\"a\",\"amount\":510}", out.get("payload"));
        assertEquals(NOW, out.get("date_time"));
        assertEquals("orders", out.get("tag"));
    }

    @Test
    void transform_正常ケース_ordersの状態と作成日を含む2行_集計がフィルタより先に行われ510の1件になること() {
        Batch batch = new Batch(List.of("category", "amount", "status", "date_created"),
                List.of(row("category", "a", "amount", 500, "status", "active", "date_created",
                        "2024-01-05"),
                        row("category", "a", "amount", 10, "status", "inactive", "date_created",
                                "2024-01-06")));

        Batch result = pipeline.transform(batch, "orders");

        assertEquals(1, result.size());
        Map<String, Object> out = result.getRows().get(0);
        assertEquals("{\"category\":\"a\",\"amount\":510}", out.get("payload"));
        assertEquals("orders", out.get("tag"));
        assertNotNull(out.get("date_time"));
    }

    @Test
    void cleanとnormalize_正常ケース_nullを含むバッチに続けて適用する_件数が変わらずnullが再発しないこと() {
        Batch batch = new Batch(List.of("id", "name", "seen_at"),
                List.of(row("id", 1, "name", "Alice", "seen_at",
                        LocalDateTime.of(2024, 1, 5, 10, 0)),
                        row("id", 2, "name", null, "seen_at", LocalDateTime.of(2024, 1, 6, 0, 0)),
                        row("id", 3, "name", "BOB", "seen_at", LocalDateTime.of(2024, 1, 7, 0, 0)),
                        row("id", null, "name", "carol", "seen_at", null)));

        Batch cleaned = pipeline.clean(batch);
        Batch normalized = pipeline.normalize(cleaned);

        assertEquals(2, cleaned.size());
        assertEquals(cleaned.size(), normalized.size());
        for (Map<String, Object> out : normalized.getRows()) {
            for (String column : normalized.getColumns()) {
                assertNotNull(out.get(column));
            }
        }
        assertEquals("bob", normalized.getRows().get(1).get("name"));
        assertEquals("2024-01-07 00:00:00", normalized.getRows().get(1).get("seen_at"));
    }

    @Test
    void transform_正常ケース_statusを持つ表_null行が除去されactiveのみ残ること() {
        Batch batch = new Batch(List.of("id", "name", "status"),
                List.of(row("id", 1, "name", "Alice", "status", "ACTIVE"),
                        row("id", 2, "name", "Bob", "status", "inactive"),
                        row("id", 3, "name", null, "status", "active")));

        Batch result = pipeline.transform(batch, "users");

        assertEquals(1, result.size());
        assertEquals("{\"id\":1,\"name\":\"alice\",\"status\":\"active\"}",
                result.getRows().get(0).get("payload"));
        assertEquals("users", result.getRows().get(0).get("tag"));
    }

    @Test
    void transform_正常ケース_date_time列を持つ表_解釈できた値は保持され不正値は現在時刻になること() {
        Batch batch = new Batch(List.of("id", "date_time"),
                List.of(row("id", 1, "date_time", "05/01/2024 10:00"),
                        row("id", 2, "date_time", "garbage")));

        Batch result = pipeline.transform(batch, "events");

        assertEquals(2, result.size());
        Map<String, Object> first = result.getRows().get(0);
        assertEquals("{\"id\":1,\"date_time\":\"2024-01-05 10:00:00\"}", first.get("payload"));
        assertEquals(LocalDateTime.of(2024, 1, 5, 10, 0), first.get("date_time"));
        Map<String, Object> second = result.getRows().get(1);
        assertEquals("{\"id\":2,\"date_time\":null}", second.get("payload"));
        assertEquals(NOW, second.get("date_time"));
    }

    @Test
    void transform_正常ケース_大小文字のみ異なる重複行_1件にまとめられること() {
        Batch batch = new Batch(List.of("id", "name"),
                List.of(row("id", 1, "name", "X"), row("id", 1, "name", "x")));

        Batch result = pipeline.transform(batch, "t");

        assertEquals(1, result.size());
    }

    @Test
    void transform_正常ケース_シングルクォートを含む値_ペイロード内でエスケープされること() {
        Batch batch = new Batch(List.of("name"), List.of(row("name", "O'Neil")));

        Batch result = pipeline.transform(batch, "people");

        assertEquals("{\"name\":\"o\\'neil\"}", result.getRows().get(0).get("payload"));
    }

    @Test
    void transform_正常ケース_空のバッチ_出力列のみの空バッチが返ること() {
        Batch result = pipeline.transform(Batch.empty(List.of("id", "amount")), "empty");

        assertTrue(result.isEmpty());
        assertEquals(TransformPipeline.OUTPUT_COLUMNS, result.getColumns());
    }

    @Test
    void transform_正常ケース_全行がnullを含む_空バッチが返ること() {
        Batch batch = new Batch(List.of("id", "name"),
                List.of(row("id", 1, "name", null), row("id", null, "name", "a")));

        assertTrue(pipeline.transform(batch, "t").isEmpty());
    }

    @Test
    void transform_正常ケース_出力の各行_3列すべてがnullでないこと() {
        Batch batch = new Batch(List.of("id", "created_date", "amount"),
                List.of(row("id", 1, "created_date", "bad", "amount", 5),
                        row("id", 2, "created_date", "2024-02-03", "amount", 7)));

        Batch result = pipeline.transform(batch, "t");

        assertEquals(2, result.size());
        for (Map<String, Object> out : result.getRows()) {
            assertNotNull(out.get("payload"));
            assertNotNull(out.get("date_time"));
            assertNotNull(out.get("tag"));
        }
    }

    @Test
    void clean_正常ケース_nullを含む行_除去されること() {
        Batch batch = new Batch(List.of("a", "b"),
                List.of(row("a", 1, "b", 2), row("a", null, "b", 2), row("a", 1, "b", null)));

        assertEquals(List.of(row("a", 1, "b", 2)), pipeline.clean(batch).getRows());
    }

    @Test
    void normalize_正常ケース_文字列と日時と数値_文字列は小文字で日時は標準形式になること() {
        Batch batch = new Batch(List.of("s", "t", "n"), List.of(
                row("s", "HeLLo", "t", LocalDateTime.of(2024, 1, 5, 10, 11, 12), "n", 42)));

        Map<String, Object> out = pipeline.normalize(batch).getRows().get(0);

        assertEquals("hello", out.get("s"));
        assertEquals("2024-01-05 10:11:12", out.get("t"));
        assertEquals(42, out.get("n"));
    }

    @Test
    void aggregate_正常ケース_小数の金額_BigDecimalで合計されカテゴリ順に並ぶこと() {
        Batch batch = new Batch(List.of("category", "amount", "note"),
                List.of(row("category", "b", "amount", 1.5d, "note", "x"),
                        row("category", "a", "amount", 2.25d, "note", "y"),
                        row("category", "b", "amount", 1.0d, "note", "z")));

        Batch result = pipeline.aggregate(batch);

        assertEquals(List.of("category", "amount"), result.getColumns());
        assertEquals(2, result.size());
        assertEquals("a", result.getRows().get(0).get("category"));
        assertEquals(0, new BigDecimal("2.25")
                .compareTo((BigDecimal) result.getRows().get(0).get("amount")));
        assertEquals("b", result.getRows().get(1).get("category"));
        assertEquals(0, new BigDecimal("2.5")
                .compareTo((BigDecimal) result.getRows().get(1).get("amount")));
    }

    @Test
    void aggregate_正常ケース_文字列と数値で同じ表記のカテゴリ_別のグループとして集計されること() {
        Batch batch = new Batch(List.of("category", "amount"),
                List.of(row("category", "1", "amount", 5), row("category", 1L, "amount", 7),
                        row("category", "1", "amount", 2), row("category", 1, "amount", 3)));

        Batch result = pipeline.aggregate(batch);

        assertEquals(List.of(row("category", 1L, "amount", 10L),
                row("category", "1", "amount", 7L)), result.getRows());
    }

    @Test
    void aggregate_正常ケース_金額に非数値を含む_バッチが変更されないこと() {
        Batch batch = new Batch(List.of("category", "amount"),
                List.of(row("category", "a", "amount", 1), row("category", "a", "amount", "n/a")));

        assertSame(batch, pipeline.aggregate(batch));
    }

    @Test
    void aggregate_正常ケース_金額列がない_バッチが変更されないこと() {
        Batch batch = new Batch(List.of("category"), List.of(row("category", "a")));

        assertSame(batch, pipeline.aggregate(batch));
    }

    @Test
    void filter_正常ケース_status列がない_全行が残ること() {
        Batch batch = new Batch(List.of("id"), List.of(row("id", 1), row("id", 2)));

        assertEquals(2, pipeline.filter(batch).size());
    }

    @Test
    void convertTypes_正常ケース_数値文字列と日付列_整数はLongで小数はDoubleで日付はLocalDateTimeになること() {
        Batch batch = new Batch(List.of("qty", "price", "name", "order_date", "ship_date"),
                List.of(row("qty", "1", "price", "1.5", "name", "x", "order_date", "05/01/2024",
                        "ship_date", "bad"),
                        row("qty", "2", "price", "2", "name", "1", "order_date", "2024-03-04",
                                "ship_date", "01/02/2024")));

        Batch result = pipeline.convertTypes(batch);

        Map<String, Object> first = result.getRows().get(0);
        Map<String, Object> second = result.getRows().get(1);
        assertEquals(1L, first.get("qty"));
        assertEquals(2L, second.get("qty"));
        assertEquals(1.5d, first.get("price"));
        assertEquals(2.0d, second.get("price"));
        assertEquals("x", first.get("name"));
        assertEquals("1", second.get("name"));
        assertEquals(LocalDateTime.of(2024, 1, 5, 0, 0), first.get("order_date"));
        assertEquals(LocalDateTime.of(2024, 3, 4, 0, 0), second.get("order_date"));
        assertNull(first.get("ship_date"));
        assertEquals(LocalDateTime.of(2024, 2, 1, 0, 0), second.get("ship_date"));
    }

    @Test
    void convertTypes_異常ケース_doubleの範囲を超える指数表記を含む_列が文字列のまま残ること() {
        Batch batch = new Batch(List.of("qty"),
                List.of(row("qty", "1"), row("qty", "1e999999999")));

        Batch result = pipeline.convertTypes(batch);

        assertEquals("1", result.getRows().get(0).get("qty"));
        assertEquals("1e999999999", result.getRows().get(1).get("qty"));
    }

    @Test
    void mapFields_正常ケース_対応表にある列_列名が変更されること() {
        Batch batch = new Batch(List.of("id", "old_column_name"),
                List.of(row("id", 1, "old_column_name", "v")));

        Batch result = pipeline.mapFields(batch);

        assertEquals(List.of("id", "new_column_name"), result.getColumns());
        assertEquals(row("id", 1, "new_column_name", "v"), result.getRows().get(0));
    }

    @Test
    void validate_正常ケース_境界値を含む金額_0以上1000000以下のみ残ること() {
        Batch batch = new Batch(List.of("amount"),
                List.of(row("amount", 0L), row("amount", 1_000_000L),
                        row("amount", new BigDecimal("-0.01")),
                        row("amount", new BigDecimal("1000000.01")), row("amount", "x"),
                        row("amount", 999.5d)));

        Batch result = pipeline.validate(batch);

        assertEquals(List.of(row("amount", 0L), row("amount", 1_000_000L), row("amount", 999.5d)),
                result.getRows());
    }

    @Test
    void removeDuplicates_正常ケース_同一行を含む_最初の出現のみ残ること() {
        Batch batch = new Batch(List.of("a"),
                List.of(row("a", 1), row("a", 2), row("a", 1)));

        assertEquals(List.of(row("a", 1), row("a", 2)),
                pipeline.removeDuplicates(batch).getRows());
    }

    @Test
    void normalizeValue_正常ケース_日付のみの値_変更されないこと() {
        java.time.LocalDate date = java.time.LocalDate.of(2024, 1, 5);

        assertSame(date, TransformPipeline.normalizeValue(date));
    }
}
