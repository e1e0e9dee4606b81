package com.resreg.tabular;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CsvResourceTableCodecTest {

    @Test
    void parseShouldHandleQuotesEscapesAndMultilineFields() {
        String text = "keys,de_DE\r\n"
                + "plain,Wert\r\n"
                + "quoted,\"Sag \"\"Hallo\"\", bitte\"\r\n"
                + "multi,\"erste\nzweite\"\r\n";

        List<List<String>> lines = CsvResourceTableCodec.parse(text);

        assertEquals(4, lines.size());
        assertEquals(List.of("plain", "Wert"), lines.get(1));
        assertEquals(List.of("quoted", "Sag \"Hallo\", bitte"), lines.get(2));
        assertEquals(List.of("multi", "erste\nzweite"), lines.get(3));
    }

    @Test
    void parseShouldSkipByteOrderMarkAndBlankLines() {
        List<List<String>> lines = CsvResourceTableCodec.parse("\uFEFFkeys,en_US\n\nk,v\n");

        assertEquals(List.of(List.of("keys", "en_US"), List.of("k", "v")), lines);
    }

    @Test
    void parseShouldKeepTrailingEmptyCell() {
        assertEquals(List.of(List.of("k", "")), CsvResourceTableCodec.parse("k,\r\n"));
    }

    @Test
    void formatLineShouldQuoteOnlyWhenNeeded() {
        assertEquals("a,b", CsvResourceTableCodec.formatLine(List.of("a", "b")));
        assertEquals("\"a,b\",\"say \"\"x\"\"\"", CsvResourceTableCodec.formatLine(List.of("a,b", "say \"x\"")));
        assertEquals("\" padded\",", CsvResourceTableCodec.formatLine(Arrays.asList(" padded", null)));
    }
}
