package com.vedant.salesanalyst.util;

import com.vedant.salesanalyst.model.GoldenExample;
import com.vedant.salesanalyst.model.KnowledgeWorkbook;
import com.vedant.salesanalyst.model.KnowledgeWorkbook.ColumnEntry;
import com.vedant.salesanalyst.model.KnowledgeWorkbook.TableEntry;
import com.vedant.salesanalyst.model.Relationship;
import com.vedant.salesanalyst.model.RelationshipOrigin;
import org.apache.poi.ss.usermodel.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Reads the knowledge workbook with Apache POI. Sheets are taken by position:
 * 1 Tables [name, description], 2 Columns [table, column, type, comment],
 * 3 Queries [question, sql]. The first row of every sheet is a header.
 */
public class KnowledgeWorkbookParser {

    private static final List<String> JOIN_INDICATORS = List.of("id", "number", "key", "code");

    private KnowledgeWorkbookParser() {}

    public static KnowledgeWorkbook parse(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() < 3) {
                throw new IllegalArgumentException("Workbook needs 3 sheets (Tables, Columns, Queries), found "
                        + workbook.getNumberOfSheets());
            }

            List<TableEntry> tables = new ArrayList<>();
            for (Row r : dataRows(workbook.getSheetAt(0))) {
                String name = cellToString(r.getCell(0));
                if (name == null || name.isBlank()) continue;
                String description = cellToString(r.getCell(1));
                tables.add(new TableEntry(cleanTableName(name), description == null ? "" : description.trim()));
            }

            List<ColumnEntry> columns = new ArrayList<>();
            for (Row r : dataRows(workbook.getSheetAt(1))) {
                String table = cellToString(r.getCell(0));
                String column = cellToString(r.getCell(1));
                if (table == null || table.isBlank() || column == null || column.isBlank()) continue;
                String type = cellToString(r.getCell(2));
                String comment = cellToString(r.getCell(3));
                columns.add(new ColumnEntry(
                        table.trim().toLowerCase(Locale.ROOT),
                        column.trim().toLowerCase(Locale.ROOT),
                        type == null || type.isBlank() ? "character varying" : type.trim().toLowerCase(Locale.ROOT),
                        comment == null || comment.isBlank() ? null : comment.trim()));
            }

            List<GoldenExample> queries = new ArrayList<>();
            for (Row r : dataRows(workbook.getSheetAt(2))) {
                String question = cellToString(r.getCell(0));
                String sql = cellToString(r.getCell(1));
                if (question == null || question.isBlank() || sql == null || sql.isBlank()) continue;
                queries.add(new GoldenExample(question.trim(), sql.trim()));
            }

            return new KnowledgeWorkbook(tables, columns, queries);
        }
    }

    // "Customer Orders Table " -> "customer orders"
    static String cleanTableName(String raw) {
        String name = raw.trim().toLowerCase(Locale.ROOT);
        if (name.endsWith(" table")) {
            name = name.substring(0, name.length() - " table".length()).trim();
        }
        return name;
    }

    /**
     * Join edges guessed from key-like column names shared by two or more tables. The
     * alphabetically first table is the target; every other table references it.
     */
    public static List<Relationship> detectJoinColumns(List<ColumnEntry> columns) {
        Map<String, SortedSet<String>> tablesByColumn = new LinkedHashMap<>();
        for (ColumnEntry c : columns) {
            tablesByColumn.computeIfAbsent(c.column(), k -> new TreeSet<>()).add(c.table());
        }

        List<Relationship> rels = new ArrayList<>();
        for (Map.Entry<String, SortedSet<String>> e : tablesByColumn.entrySet()) {
            String column = e.getKey();
            SortedSet<String> tables = e.getValue();
            if (tables.size() < 2 || JOIN_INDICATORS.stream().noneMatch(column::contains)) {
                continue;
            }
            String target = tables.first();
            for (String source : tables.tailSet(target)) {
                if (source.equals(target)) continue;
                rels.add(new Relationship(source, column, target, column, RelationshipOrigin.YAML,
                        source + " references " + target + " via " + column));
            }
        }
        return rels;
    }

    private static List<Row> dataRows(Sheet sheet) {
        List<Row> rows = new ArrayList<>();
        Iterator<Row> it = sheet.iterator();
        if (!it.hasNext()) return rows;
        it.next(); // header
        while (it.hasNext()) {
            rows.add(it.next());
        }
        return rows;
    }

    private static String cellToString(Cell c) {
        if (c == null) return null;
        return switch (c.getCellType()) {
            case STRING -> c.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(c)) yield c.getLocalDateTimeCellValue().toString();
                double d = c.getNumericCellValue();
                yield d == Math.rint(d) ? Long.toString((long) d) : Double.toString(d);
            }
            case BOOLEAN -> Boolean.toString(c.getBooleanCellValue());
            case FORMULA -> c.getCellFormula();
            default -> null;
        };
    }
}
