package io.github.yok.clickload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class ColumnNameCleanerTest {

    @Test
    void clean_正常ケース_BOMと前後空白を含む_除去されること() {
        assertEquals("Name", ColumnNameCleaner.clean("\uFEFF  Name  "));
    }

    @Test
    void clean_正常ケース_内部空白を含む_アンダースコアに置換されること() {
        assertEquals("Order_Date", ColumnNameCleaner.clean("Order   Date"));
        assertEquals("a_b", ColumnNameCleaner.clean("a\tb"));
    }

    @Test
    void clean_正常ケース_記号を含む_記号が除去されること() {
        assertEquals("Amount_", ColumnNameCleaner.clean("Amount ($)"));
        assertEquals("userid", ColumnNameCleaner.clean("user-id"));
    }

    @Test
    void clean_正常ケース_非ASCII文字を含む_文字が保持されること() {
        assertEquals("Ärger", ColumnNameCleaner.clean("Ärger"));
        assertEquals("売上_金額", ColumnNameCleaner.clean("売上 金額"));
    }

    @Test
    void clean_正常ケース_nullを指定する_空文字となること() {
        assertEquals("", ColumnNameCleaner.clean(null));
    }
}
