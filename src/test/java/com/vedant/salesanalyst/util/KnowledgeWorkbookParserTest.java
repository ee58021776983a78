package com.vedant.salesanalyst.util;

import com.vedant.salesanalyst.model.KnowledgeWorkbook;
import com.vedant.salesanalyst.model.KnowledgeWorkbook.ColumnEntry;
import com.vedant.salesanalyst.model.Relationship;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KnowledgeWorkbookParserTest {

    public static byte[] workbook() throws IOException {
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet tables = wb.createSheet("Tables");
            addRow(tables, 0, "Tables", "Description");
            addRow(tables, 1, "Customers Table", "People and companies that buy");
            addRow(tables, 2, " ORDERS ", null);

            Sheet columns = wb.createSheet("Columns");
            addRow(columns, 0, "table_name", "column_name", "data_type", "comment");
            addRow(columns, 1, "Customers", "CustomerID", "character varying", "Customer code");
            addRow(columns, 2, "customers", "companyname", null, null);
            addRow(columns, 3, "orders", "orderid", "integer", null);
            addRow(columns, 4, "orders", "customerid", "character varying", "Buyer");
            addRow(columns, 5, "orders", "companyname", "character varying", null);
            addRow(columns, 6, "", "orphan", "integer", null);

            Sheet queries = wb.createSheet("Queries");
            addRow(queries, 0, "User Question", "Expected Query");
            addRow(queries, 1, "How many customers are there?", "SELECT count(*) FROM northwind.customers");
            addRow(queries, 2, "No SQL yet", null);

            wb.write(out);
            return out.toByteArray();
        }
    }

    private static void addRow(Sheet sheet, int index, String... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                row.createCell(i).setCellValue(values[i]);
            }
        }
    }

    @Test
    void parsesAllThreeSheets() throws IOException {
        KnowledgeWorkbook parsed = KnowledgeWorkbookParser.parse(new ByteArrayInputStream(workbook()));

        assertEquals(List.of("customers", "orders"), parsed.tables().stream().map(KnowledgeWorkbook.TableEntry::name).toList());
        assertEquals("", parsed.tables().get(1).description());

        assertEquals(5, parsed.columns().size());
        ColumnEntry first = parsed.columns().get(0);
        assertEquals(new ColumnEntry("customers", "customerid", "character varying", "Customer code"), first);
        assertEquals("character varying", parsed.columns().get(1).dataType());
        assertNull(parsed.columns().get(1).comment());

        assertEquals(1, parsed.queries().size());
        assertEquals("SELECT count(*) FROM northwind.customers", parsed.queries().get(0).sql());
    }

    @Test
    void workbookWithoutThreeSheetsIsRejected() throws IOException {
        byte[] bytes;
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            wb.createSheet("Tables");
            wb.write(out);
            bytes = out.toByteArray();
        }
        assertThrows(IllegalArgumentException.class, () -> KnowledgeWorkbookParser.parse(new ByteArrayInputStream(bytes)));
    }

    @Test
    void joinColumnsAreSharedKeyLikeNames() {
        List<ColumnEntry> columns = List.of(
                new ColumnEntry("orders", "customerid", "text", null),
                new ColumnEntry("customers", "customerid", "text", null),
                new ColumnEntry("invoices", "customerid", "text", null),
                new ColumnEntry("orders", "companyname", "text", null),
                new ColumnEntry("customers", "companyname", "text", null),
                new ColumnEntry("orders", "orderid", "integer", null));

        List<Relationship> rels = KnowledgeWorkbookParser.detectJoinColumns(columns);

        assertEquals(2, rels.size());
        assertEquals("invoices.customerid", rels.get(0).source());
        assertEquals("customers.customerid", rels.get(0).target());
        assertEquals("orders.customerid", rels.get(1).source());
        assertEquals("orders references customers via customerid", rels.get(1).description());
    }

    @Test
    void tableSuffixIsStripped() {
        assertEquals("order details", KnowledgeWorkbookParser.cleanTableName("Order Details TABLE "));
    }
}
