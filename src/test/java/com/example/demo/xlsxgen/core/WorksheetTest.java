package com.example.demo.xlsxgen.core;

import com.example.demo.xlsxgen.exception.ParameterException;
import com.example.demo.xlsxgen.model.CellValue;
import com.example.demo.xlsxgen.model.Chart;
import com.example.demo.xlsxgen.model.ChartSeriesCacheData;
import com.example.demo.xlsxgen.model.ChartType;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.model.Table;
import com.example.demo.xlsxgen.model.TableColumn;
import com.example.demo.xlsxgen.model.TableFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Worksheet model")
public class WorksheetTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "Sheet[1]", "a:b", "a*b", "a?b", "a/b", "a\\b", "'quoted", "quoted'",
            "History", "history", "ThisNameIsLongerThanThirtyOneChars"})
    @DisplayName("Invalid worksheet names are rejected")
    void invalidNames(String name) {
        Worksheet worksheet = new Worksheet();
        assertThrows(ParameterException.class, () -> worksheet.setName(name));
    }

    @Test
    @DisplayName("Formats get local indices in first-use order, 0 being the default")
    void localFormatIndices() {
        Worksheet worksheet = new Worksheet("Sheet1");
        Format bold = new Format().withBold();

        worksheet.writeNumber(0, 0, 1);
        worksheet.writeNumber(0, 1, 2, bold);
        worksheet.writeString(1, 0, "x", new Format().withItalic());
        worksheet.writeString(1, 1, "y", new Format().withBold());

        assertEquals(0, worksheet.getCell(0, 0).getFormatIndex());
        assertEquals(1, worksheet.getCell(0, 1).getFormatIndex());
        assertEquals(2, worksheet.getCell(1, 0).getFormatIndex());
        assertEquals(1, worksheet.getCell(1, 1).getFormatIndex());
        assertEquals(3, worksheet.getLocalFormats().size());
    }

    @Test
    @DisplayName("Global indices are required before cells can be written out")
    void globalIndicesRequired() {
        Worksheet worksheet = new Worksheet("Sheet1");
        worksheet.writeNumber(0, 0, 1, new Format().withBold());

        assertThrows(IllegalStateException.class, () -> worksheet.globalFormatIndex(0));
        assertThrows(IllegalArgumentException.class, () -> worksheet.setGlobalFormatIndices(new int[] {0}));

        worksheet.setGlobalFormatIndices(new int[] {0, 7});
        assertEquals(7, worksheet.globalFormatIndex(1));
    }

    @Test
    @DisplayName("Writes outside Excel's grid are rejected")
    void dimensionLimits() {
        Worksheet worksheet = new Worksheet("Sheet1");

        assertThrows(ParameterException.class, () -> worksheet.writeNumber(Worksheet.MAX_ROWS, 0, 1));
        assertThrows(ParameterException.class, () -> worksheet.writeNumber(0, Worksheet.MAX_COLS, 1));
        assertThrows(ParameterException.class, () -> worksheet.writeNumber(-1, 0, 1));
    }

    @Test
    @DisplayName("Usage flags follow the kind of data written")
    void usageFlags() {
        Worksheet worksheet = new Worksheet("Sheet1");
        worksheet.writeNumber(0, 0, 1);
        assertFalse(worksheet.usesStringTable());

        worksheet.writeDynamicFormula(1, 0, "=SORT(A1:A3)");
        worksheet.writeUrl(2, 0, "https://example.com");

        assertTrue(worksheet.usesStringTable());
        assertTrue(worksheet.hasDynamicArrays());
        assertTrue(worksheet.hasHyperlinkStyle());
        assertEquals("SORT(A1:A3)", worksheet.getCell(1, 0).getText());
        assertEquals(1, worksheet.getHyperlinks().size());
    }

    @Test
    @DisplayName("Links with an explicit format don't need the hyperlink style")
    void explicitLinkFormat() {
        Worksheet worksheet = new Worksheet("Sheet1");

        worksheet.writeUrl(0, 0, "internal:Sheet2!A1", "", new Format().withBold());

        assertFalse(worksheet.hasHyperlinkStyle());
        assertEquals("Sheet2!A1", worksheet.getCell(0, 0).getText());
        assertTrue(worksheet.getHyperlinks().get(0).isInternal());
    }

    @Test
    @DisplayName("Tables write their header row and need at least one data row")
    void tables() {
        Worksheet worksheet = new Worksheet("Sheet1");
        worksheet.addTable(0, 0, 3, 2, new Table().setColumnHeaders(List.of("Name", "Salary")));

        assertEquals("Name", worksheet.getCell(0, 0).getText());
        assertEquals("Salary", worksheet.getCell(0, 1).getText());
        assertEquals("Column3", worksheet.getCell(0, 2).getText());

        assertThrows(ParameterException.class, () -> worksheet.addTable(5, 0, 5, 2, new Table()));
    }

    @Test
    @DisplayName("Table column formulas fill the data rows and the total row gets labels and subtotals")
    void tableColumnsAndTotalRow() {
        // Given
        Worksheet worksheet = new Worksheet("Sheet1");
        Table table = new Table()
                .setTotalRow(true)
                .setColumns(List.of(
                        new TableColumn().setHeader("Product").setTotalLabel("Totals"),
                        new TableColumn().setHeader("Q[1]").setTotalFunction(TableFunction.SUM),
                        new TableColumn().setHeader("Year").setTotalFunction(TableFunction.AVERAGE)
                                .setFormula("=SUM(Table1[@[Q[1]]])")));

        // When
        worksheet.addTable(0, 0, 4, 2, table);

        // Then
        assertEquals("Year", worksheet.getCell(0, 2).getText());
        assertEquals("SUM(Table1[[#This Row],[Q[1]]])", worksheet.getCell(1, 2).getText());
        assertEquals(CellValue.Type.FORMULA, worksheet.getCell(3, 2).getType());
        assertEquals("Totals", worksheet.getCell(4, 0).getText());
        assertEquals("SUBTOTAL(109,[Q'[1']])", worksheet.getCell(4, 1).getText());
        assertEquals("SUBTOTAL(101,[Year])", worksheet.getCell(4, 2).getText());
        assertEquals(1, worksheet.getTables().get(0).firstDataRow());
        assertEquals(3, worksheet.getTables().get(0).lastDataRow());
    }

    @Test
    @DisplayName("A total row needs a data row between it and the header")
    void tableTotalRowNeedsData() {
        Worksheet worksheet = new Worksheet("Sheet1");

        assertThrows(ParameterException.class,
                () -> worksheet.addTable(0, 0, 1, 1, new Table().setTotalRow(true)));
        worksheet.addTable(0, 0, 1, 1, new Table().setTotalRow(true).setHeaderRow(false));
        assertEquals(1, worksheet.getTables().size());
    }

    @Test
    @DisplayName("Any cell written with a hyperlink based format needs the hyperlink style")
    void explicitHyperlinkFormat() {
        Worksheet worksheet = new Worksheet("Sheet1");
        worksheet.writeString(0, 0, "styled", Format.hyperlinkStyle());

        assertTrue(worksheet.hasHyperlinkStyle());
    }

    @Test
    @DisplayName("Charts need at least one series")
    void chartWithoutSeries() {
        Worksheet worksheet = new Worksheet("Sheet1");

        assertThrows(ParameterException.class, () -> worksheet.insertChart(0, 0, new Chart(ChartType.LINE)));
    }

    @Test
    @DisplayName("Cache data is read row by row and stops at the last used row")
    void cacheData() {
        Worksheet worksheet = new Worksheet("Sheet1");
        worksheet.writeNumber(0, 0, 1);
        worksheet.writeBoolean(0, 1, true);
        worksheet.writeFormula(1, 0, "=A1*2", 2, null);
        worksheet.writeBlank(1, 1, new Format().withBold());

        ChartSeriesCacheData whole = worksheet.getCacheData(0, 0, Worksheet.MAX_ROWS - 1, 1);

        assertEquals(List.of("1", "1", "2", ""), whole.getData());
        assertFalse(whole.isNumeric());
        assertTrue(worksheet.getCacheData(0, 0, 1, 0).isNumeric());
    }

    @Test
    @DisplayName("Numbers are cached without a trailing .0")
    void numberText() {
        assertEquals("3", CellValue.formatNumber(3.0));
        assertEquals("-2.5", CellValue.formatNumber(-2.5));
    }
}
