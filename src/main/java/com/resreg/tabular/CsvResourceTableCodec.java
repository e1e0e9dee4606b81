package com.resreg.tabular;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Comma separated, {@code "}-quoted UTF-8. Quoted fields may span lines.
 */
public final class CsvResourceTableCodec implements ResourceTableCodec {
    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';

    @Override
    public void write(ResourceTable table, Path target) throws IOException {
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (List<String> line : table.toCells()) {
                out.write(formatLine(line));
                out.write("\r\n");
            }
        }
    }

    @Override
    public ResourceTable read(Path source) throws IOException {
        String text = Files.readString(source, StandardCharsets.UTF_8);
        return ResourceTable.fromCells(parse(text), source.toString());
    }

    static String formatLine(List<String> cells) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.append(SEPARATOR);
            }
            out.append(quoteIfNeeded(cells.get(i)));
        }
        return out.toString();
    }

    static List<List<String>> parse(String text) {
        List<List<String>> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = text.charAt(0) == '\uFEFF' ? 1 : 0;
        List<String> current = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuote = false;
        boolean lineHasContent = false;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inQuote) {
                if (ch == QUOTE) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == QUOTE) {
                        cell.append(QUOTE);
                        i++;
                    } else {
                        inQuote = false;
                    }
                } else {
                    cell.append(ch);
                }
                continue;
            }
            if (ch == QUOTE) {
                inQuote = true;
                lineHasContent = true;
            } else if (ch == SEPARATOR) {
                current.add(cell.toString());
                cell.setLength(0);
                lineHasContent = true;
            } else if (ch == '\r' || ch == '\n') {
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                if (lineHasContent || cell.length() > 0) {
                    current.add(cell.toString());
                    lines.add(current);
                }
                current = new ArrayList<>();
                cell.setLength(0);
                lineHasContent = false;
            } else {
                cell.append(ch);
                lineHasContent = true;
            }
        }
        if (lineHasContent || cell.length() > 0) {
            current.add(cell.toString());
            lines.add(current);
        }
        return lines;
    }

    private static String quoteIfNeeded(String value) {
        String v = value == null ? "" : value;
        boolean needsQuote = v.indexOf(SEPARATOR) >= 0
                || v.indexOf(QUOTE) >= 0
                || v.indexOf('\n') >= 0
                || v.indexOf('\r') >= 0
                || (!v.isEmpty() && (Character.isWhitespace(v.charAt(0)) || Character.isWhitespace(v.charAt(v.length() - 1))));
        if (!needsQuote) {
            return v;
        }
        return QUOTE + v.replace("\"", "\"\"") + QUOTE;
    }
}
