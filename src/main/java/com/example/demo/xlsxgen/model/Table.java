package com.example.demo.xlsxgen.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A worksheet table (list object). The cell range is assigned when the
 * table is added to a worksheet.
 */
@Getter
public class Table {
    private String name = "";
    private boolean headerRow = true;
    private boolean totalRow;
    private boolean autofilter = true;
    private boolean firstColumn;
    private boolean lastColumn;
    private boolean bandedRows = true;
    private boolean bandedColumns;
    private String styleName = "TableStyleMedium9";
    private final List<TableColumn> columns = new ArrayList<>();

    private int firstRow;
    private int firstCol;
    private int lastRow;
    private int lastCol;

    public Table setName(String name) {
        this.name = name;
        return this;
    }

    public Table setHeaderRow(boolean headerRow) {
        this.headerRow = headerRow;
        return this;
    }

    /**
     * Turns on a total row as the last row of the table range.
     */
    public Table setTotalRow(boolean totalRow) {
        this.totalRow = totalRow;
        return this;
    }

    public Table setAutofilter(boolean autofilter) {
        this.autofilter = autofilter;
        return this;
    }

    /**
     * Highlights the first column of the table.
     */
    public Table setFirstColumn(boolean firstColumn) {
        this.firstColumn = firstColumn;
        return this;
    }

    /**
     * Highlights the last column of the table.
     */
    public Table setLastColumn(boolean lastColumn) {
        this.lastColumn = lastColumn;
        return this;
    }

    public Table setBandedRows(boolean bandedRows) {
        this.bandedRows = bandedRows;
        return this;
    }

    public Table setBandedColumns(boolean bandedColumns) {
        this.bandedColumns = bandedColumns;
        return this;
    }

    public Table setStyleName(String styleName) {
        this.styleName = styleName;
        return this;
    }

    public Table setColumns(List<TableColumn> columns) {
        this.columns.clear();
        this.columns.addAll(columns);
        return this;
    }

    public Table setColumnHeaders(List<String> headers) {
        columns.clear();
        for (String header : headers) {
            columns.add(new TableColumn().setHeader(header));
        }
        return this;
    }

    /**
     * Copy of this table bound to a cell range.
     */
    public Table placedAt(int firstRow, int firstCol, int lastRow, int lastCol) {
        Table placed = new Table();
        placed.name = name;
        placed.headerRow = headerRow;
        placed.totalRow = totalRow;
        placed.autofilter = autofilter;
        placed.firstColumn = firstColumn;
        placed.lastColumn = lastColumn;
        placed.bandedRows = bandedRows;
        placed.bandedColumns = bandedColumns;
        placed.styleName = styleName;
        for (TableColumn column : columns) {
            placed.columns.add(column.copy());
        }
        placed.firstRow = firstRow;
        placed.firstCol = firstCol;
        placed.lastRow = lastRow;
        placed.lastCol = lastCol;
        return placed;
    }

    /**
     * Name written to the package; unnamed tables take their workbook-wide id.
     */
    public String resolvedName(int tableId) {
        return name.isEmpty() ? "Table" + tableId : name;
    }

    public int columnCount() {
        return lastCol - firstCol + 1;
    }

    /**
     * Options of the given zero-based column; columns without explicit
     * options get the defaults.
     */
    public TableColumn column(int index) {
        return index < columns.size() ? columns.get(index) : new TableColumn();
    }

    /**
     * Header text of the given zero-based column, defaulting to
     * {@code Column1}, {@code Column2}, ...
     */
    public String columnHeader(int index) {
        String header = column(index).getHeader();
        return header.isEmpty() ? "Column" + (index + 1) : header;
    }

    public int firstDataRow() {
        return headerRow ? firstRow + 1 : firstRow;
    }

    public int lastDataRow() {
        return totalRow ? lastRow - 1 : lastRow;
    }
}
