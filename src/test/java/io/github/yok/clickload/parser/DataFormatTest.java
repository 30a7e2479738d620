package io.github.yok.clickload.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DataFormatTest {

    @Test
    void fromExtension_正常ケース_既知の拡張子_大文字小文字を問わず判定されること() {
        assertEquals(Optional.of(DataFormat.CSV), DataFormat.fromExtension("CSV"));
        assertEquals(Optional.of(DataFormat.TSV), DataFormat.fromExtension("tab"));
        assertEquals(Optional.of(DataFormat.PARQUET), DataFormat.fromExtension("parquet"));
        assertEquals(Optional.of(DataFormat.NDJSON), DataFormat.fromExtension("jsonl"));
    }

    @Test
    void fromExtension_正常ケース_未知の拡張子_空となること() {
        assertEquals(Optional.empty(), DataFormat.fromExtension("xlsx"));
        assertEquals(Optional.empty(), DataFormat.fromExtension(""));
    }

    @Test
    void isDelimitedText_正常ケース_テキスト形式のみtrueとなること() {
        assertTrue(DataFormat.CSV.isDelimitedText());
        assertTrue(DataFormat.TSV.isDelimitedText());
        assertFalse(DataFormat.PARQUET.isDelimitedText());
        assertFalse(DataFormat.NDJSON.isDelimitedText());
    }
}
