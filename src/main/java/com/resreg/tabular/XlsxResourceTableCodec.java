package com.resreg.tabular;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Excel workbook with the table on its first sheet.
 */
public final class XlsxResourceTableCodec implements ResourceTableCodec {
    private static final String SHEET_NAME = "resources";

    @Override
    public void write(ResourceTable table, Path target) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(SHEET_NAME);
            List<List<String>> cells = table.toCells();
            for (int r = 0; r < cells.size(); r++) {
                Row row = sheet.createRow(r);
                List<String> line = cells.get(r);
                for (int c = 0; c < line.size(); c++) {
                    row.createCell(c).setCellValue(line.get(c));
                }
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                wb.write(out);
            }
        }
    }

    @Override
    public ResourceTable read(Path source) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             Workbook wb = WorkbookFactory.create(in)) {
            if (wb.getNumberOfSheets() == 0) {
                return ResourceTable.fromCells(List.of(), source.toString());
            }
            Sheet sheet = wb.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            List<List<String>> lines = new ArrayList<>();
            for (int r = 0; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<String> line = new ArrayList<>();
                if (row != null) {
                    int last = Math.max(0, row.getLastCellNum());
                    for (int c = 0; c < last; c++) {
                        line.add(getCellText(row, c, formatter));
                    }
                }
                lines.add(line);
            }
            return ResourceTable.fromCells(lines, source.toString());
        }
    }

    private String getCellText(Row row, int colIndex, DataFormatter formatter) {
        Cell cell = row.getCell(colIndex);
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell);
    }
}
