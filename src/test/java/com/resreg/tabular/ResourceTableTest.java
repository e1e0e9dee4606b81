package com.resreg.tabular;

import com.resreg.errors.ResourcesException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResourceTableTest {

    @Test
    void fromCellsShouldPadShortRowsAndSkipRowsWithoutKey() {
        ResourceTable table = ResourceTable.fromCells(List.of(
                List.of("Keys", "de_DE", "en_US"),
                List.of("a", "eins"),
                List.of("", "ignored", "ignored"),
                List.of(" b ", "zwei", "two")
        ), "memory");

        assertEquals(List.of("de_DE", "en_US"), table.getLocales());
        assertEquals(2, table.getRows().size());
        assertEquals(List.of("eins", ""), table.getRows().get(0).getValues());
        assertEquals("b", table.getRows().get(1).getKey());
    }

    @Test
    void fromCellsShouldRequireKeysHeader() {
        assertThrows(ResourcesException.class, () -> ResourceTable.fromCells(List.of(), "empty"));
        assertThrows(ResourcesException.class,
                () -> ResourceTable.fromCells(List.of(List.of("id", "de_DE")), "bad"));
        assertThrows(ResourcesException.class,
                () -> ResourceTable.fromCells(List.of(List.of("keys", " ")), "blank-locale"));
    }

    @Test
    void toCellsShouldStartWithHeader() {
        ResourceTable table = new ResourceTable(List.of("de_DE"),
                List.of(new ResourceTable.Row("k", List.of("v"))));

        assertEquals(List.of(List.of("keys", "de_DE"), List.of("k", "v")), table.toCells());
    }

    @Test
    void codecShouldFollowFileExtension() {
        assertEquals(XlsxResourceTableCodec.class,
                ResourceTableCodec.forPath(java.nio.file.Path.of("out", "table.XLSX")).getClass());
        assertEquals(CsvResourceTableCodec.class,
                ResourceTableCodec.forPath(java.nio.file.Path.of("table.txt")).getClass());
    }
}
