package com.resreg.tabular;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * File format of an exported resource table.
 */
public interface ResourceTableCodec {

    void write(ResourceTable table, Path target) throws IOException;

    ResourceTable read(Path source) throws IOException;

    /**
     * XLSX for {@code .xlsx} files, CSV for everything else.
     */
    static ResourceTableCodec forPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx")) {
            return new XlsxResourceTableCodec();
        }
        return new CsvResourceTableCodec();
    }
}
