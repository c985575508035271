package io.github.yok.flexetl.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class SqlUtilsTest {

    @Test
    void quoteIdentifier_正常ケース_ダブルクォートを含む名前を指定する_二重化されて囲まれること() {
        assertEquals("\"orders\"", SqlUtils.quoteIdentifier("orders"));
        assertEquals("\"a\"\"b\"", SqlUtils.quoteIdentifier("a\"b"));
    }

    @Test
    void escapeLiteral_正常ケース_シングルクォートとバックスラッシュを含む_エスケープされること() {
        assertEquals("it\\'s", SqlUtils.escapeLiteral("it's"));
        assertEquals("c:\\\\tmp", SqlUtils.escapeLiteral("c:\\tmp"));
        assertEquals("'o\\'neil'", SqlUtils.quoteLiteral("o'neil"));
    }

    @Test
    void unescapeLiteral_正常ケース_エスケープ済み文字列を指定する_元の文字列に戻ること() {
        String raw = "{\"name\":\"o'neil\",\"path\":\"a\\\\b\"}";
        assertEquals(raw, SqlUtils.unescapeLiteral(SqlUtils.escapeLiteral(raw)));
    }
}
