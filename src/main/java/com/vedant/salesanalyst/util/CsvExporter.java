package com.vedant.salesanalyst.util;

import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/** Writes result rows as CSV with OpenCSV. Nulls become empty cells. */
public class CsvExporter {

    private CsvExporter() {}

    public static String toCsv(List<String> columnNames, List<List<Object>> rows) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            if (columnNames != null && !columnNames.isEmpty()) {
                writer.writeNext(columnNames.toArray(new String[0]));
            }
            for (List<Object> row : rows) {
                String[] cells = new String[row.size()];
                for (int i = 0; i < cells.length; i++) {
                    Object v = row.get(i);
                    cells[i] = v == null ? "" : v.toString();
                }
                writer.writeNext(cells);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("CSV export failed", e);
        }
        return out.toString();
    }
}
