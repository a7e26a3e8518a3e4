package com.example.demo.xlsxgen.util;

import org.apache.poi.ss.formula.SheetNameFormatter;
import org.apache.poi.ss.util.CellReference;

/**
 * A1-style reference helpers built on the POI reference utilities.
 */
public final class CellRefs {

    private CellRefs() {
    }

    /**
     * Quotes a sheet name when a formula needs it, e.g. {@code 'Sales Data'}.
     */
    public static String quoteSheetName(String sheetName) {
        return SheetNameFormatter.format(sheetName);
    }

    public static String cell(int row, int col) {
        return new CellReference(row, col).formatAsString();
    }

    public static String absoluteCell(int row, int col) {
        return new CellReference(row, col, true, true).formatAsString();
    }

    /**
     * Relative range such as {@code A1:D10}; a single cell collapses to
     * {@code A1}.
     */
    public static String range(int firstRow, int firstCol, int lastRow, int lastCol) {
        String first = cell(firstRow, firstCol);
        if (firstRow == lastRow && firstCol == lastCol) {
            return first;
        }
        return first + ":" + cell(lastRow, lastCol);
    }

    public static String absoluteRange(int firstRow, int firstCol, int lastRow, int lastCol) {
        String first = absoluteCell(firstRow, firstCol);
        if (firstRow == lastRow && firstCol == lastCol) {
            return first;
        }
        return first + ":" + absoluteCell(lastRow, lastCol);
    }

    public static String columnName(int col) {
        return CellReference.convertNumToColString(col);
    }

    public static String absoluteColumns(int firstCol, int lastCol) {
        return "$" + columnName(firstCol) + ":$" + columnName(lastCol);
    }

    public static String absoluteRows(int firstRow, int lastRow) {
        return "$" + (firstRow + 1) + ":$" + (lastRow + 1);
    }
}
