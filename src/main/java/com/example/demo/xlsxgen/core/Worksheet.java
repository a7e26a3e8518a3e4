package com.example.demo.xlsxgen.core;

import com.example.demo.xlsxgen.exception.ParameterException;
import com.example.demo.xlsxgen.model.CellValue;
import com.example.demo.xlsxgen.model.Chart;
import com.example.demo.xlsxgen.model.ChartSeriesCacheData;
import com.example.demo.xlsxgen.model.DefinedName;
import com.example.demo.xlsxgen.model.DefinedNameType;
import com.example.demo.xlsxgen.model.DrawingObject;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.model.HeaderImagePosition;
import com.example.demo.xlsxgen.model.Hyperlink;
import com.example.demo.xlsxgen.model.Image;
import com.example.demo.xlsxgen.model.Table;
import com.example.demo.xlsxgen.model.TableColumn;
import com.example.demo.xlsxgen.model.TableFunction;
import com.example.demo.xlsxgen.util.CellRefs;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * A worksheet and everything anchored to it.
 *
 * Formats used by cells are collected in a local list so a worksheet can be
 * built without a reference to its workbook; local index 0 is the default
 * format. The workbook translates local indices to global style indices at
 * save time.
 */
@Getter
public class Worksheet {
    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLS = 16_384;
    public static final int MAX_NAME_LENGTH = 31;

    private static final String INVALID_NAME_CHARS = "[]:*?/\\";

    private String name;
    private boolean hidden;
    private boolean active;
    private boolean firstSheet;

    @Getter(lombok.AccessLevel.NONE)
    private final NavigableMap<Integer, NavigableMap<Integer, CellValue>> cells = new TreeMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<Format> localFormats = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<Format, Integer> localFormatIndices = new HashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private int[] globalFormatIndices;

    private final NavigableMap<Integer, Double> columnWidths = new TreeMap<>();
    private final List<DrawingObject> drawingObjects = new ArrayList<>();
    private final List<Table> tables = new ArrayList<>();
    private final List<Hyperlink> hyperlinks = new ArrayList<>();
    private final Map<HeaderImagePosition, Image> headerImages = new EnumMap<>(HeaderImagePosition.class);

    private int[] autofilterRange;
    private int[] printAreaRange;
    private int[] repeatRows;
    private int[] repeatColumns;
    private String header = "";
    private String footer = "";

    @Getter(lombok.AccessLevel.NONE)
    private boolean usesStringTable;
    @Getter(lombok.AccessLevel.NONE)
    private boolean hasDynamicArrays;
    @Getter(lombok.AccessLevel.NONE)
    private boolean hasHyperlinkStyle;

    public Worksheet() {
        Format defaultFormat = new Format();
        localFormats.add(defaultFormat);
        localFormatIndices.put(defaultFormat, 0);
    }

    public Worksheet(String name) {
        this();
        setName(name);
    }

    /**
     * Sets the tab name. Excel limits names to 31 characters, forbids
     * {@code []:*?/\} and leading or trailing apostrophes, and reserves
     * "History".
     */
    public Worksheet setName(String name) {
        if (name == null || name.isEmpty()) {
            throw new ParameterException("Worksheet name cannot be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ParameterException("Worksheet name '" + name + "' exceeds Excel's limit of 31 characters");
        }
        for (char c : name.toCharArray()) {
            if (INVALID_NAME_CHARS.indexOf(c) >= 0) {
                throw new ParameterException("Worksheet name '" + name + "' cannot contain any of the characters `[]:*?/\\`");
            }
        }
        if (name.startsWith("'") || name.endsWith("'")) {
            throw new ParameterException("Worksheet name '" + name + "' cannot start or end with an apostrophe");
        }
        if (name.toLowerCase(Locale.ROOT).equals("history")) {
            throw new ParameterException("Worksheet name 'History' is reserved in Excel");
        }
        this.name = name;
        return this;
    }

    public Worksheet setHidden(boolean hidden) {
        this.hidden = hidden;
        return this;
    }

    public Worksheet setActive(boolean active) {
        this.active = active;
        if (active) {
            this.hidden = false;
        }
        return this;
    }

    /**
     * Makes this the first visible tab when the workbook has more tabs than
     * fit on screen.
     */
    public Worksheet setFirstSheet(boolean firstSheet) {
        this.firstSheet = firstSheet;
        return this;
    }

    // -----------------------------------------------------------------------
    // Cell data.
    // -----------------------------------------------------------------------

    public Worksheet writeNumber(int row, int col, double value) {
        return writeNumber(row, col, value, null);
    }

    public Worksheet writeNumber(int row, int col, double value, Format format) {
        return storeCell(row, col, CellValue.number(value, formatIndex(format)));
    }

    public Worksheet writeString(int row, int col, String value) {
        return writeString(row, col, value, null);
    }

    public Worksheet writeString(int row, int col, String value, Format format) {
        usesStringTable = true;
        return storeCell(row, col, CellValue.string(value, formatIndex(format)));
    }

    public Worksheet writeBoolean(int row, int col, boolean value) {
        return writeBoolean(row, col, value, null);
    }

    public Worksheet writeBoolean(int row, int col, boolean value, Format format) {
        return storeCell(row, col, CellValue.bool(value, formatIndex(format)));
    }

    public Worksheet writeFormula(int row, int col, String formula) {
        return writeFormula(row, col, formula, 0, null);
    }

    /**
     * Writes a formula with the result Excel shows until it recalculates.
     */
    public Worksheet writeFormula(int row, int col, String formula, double result, Format format) {
        return storeCell(row, col, CellValue.formula(stripEquals(formula), result, formatIndex(format)));
    }

    /**
     * Writes a formula that can spill into neighbouring cells. Workbooks
     * with such formulas need the cell metadata part.
     */
    public Worksheet writeDynamicFormula(int row, int col, String formula) {
        return writeDynamicFormula(row, col, formula, 0, null);
    }

    public Worksheet writeDynamicFormula(int row, int col, String formula, double result, Format format) {
        hasDynamicArrays = true;
        return storeCell(row, col, CellValue.dynamicFormula(stripEquals(formula), result, formatIndex(format)));
    }

    public Worksheet writeBlank(int row, int col, Format format) {
        return storeCell(row, col, CellValue.blank(formatIndex(format)));
    }

    public Worksheet writeUrl(int row, int col, String url) {
        return writeUrl(row, col, url, url, null);
    }

    /**
     * Writes a link with display text. Without an explicit format the cell
     * takes the workbook's built-in hyperlink style.
     */
    public Worksheet writeUrl(int row, int col, String url, String text, Format format) {
        if (url == null || url.isEmpty()) {
            throw new ParameterException("Hyperlink URL cannot be blank");
        }
        Format cellFormat = format == null ? Format.hyperlinkStyle() : format;
        String display = text;
        if (display == null || display.isEmpty()) {
            display = url.startsWith(Hyperlink.INTERNAL_PREFIX) ? url.substring(Hyperlink.INTERNAL_PREFIX.length()) : url;
        }
        writeString(row, col, display, cellFormat);
        hyperlinks.add(new Hyperlink(row, col, url, ""));
        return this;
    }

    public Worksheet setColumnWidth(int col, double width) {
        checkDimensions(0, col);
        columnWidths.put(col, width);
        return this;
    }

    private Worksheet storeCell(int row, int col, CellValue value) {
        checkDimensions(row, col);
        cells.computeIfAbsent(row, r -> new TreeMap<>()).put(col, value);
        return this;
    }

    private int formatIndex(Format format) {
        if (format == null) {
            return 0;
        }
        // Formats based on the hyperlink cell style need it in the styles part.
        if (format.isHyperlink()) {
            hasHyperlinkStyle = true;
        }
        return localFormatIndices.computeIfAbsent(format, f -> {
            localFormats.add(f);
            return localFormats.size() - 1;
        });
    }

    private static String stripEquals(String formula) {
        return formula.startsWith("=") ? formula.substring(1) : formula;
    }

    private static void checkDimensions(int row, int col) {
        if (row < 0 || col < 0 || row >= MAX_ROWS || col >= MAX_COLS) {
            throw new ParameterException("Cell (" + row + ", " + col + ") is outside Excel's worksheet limits");
        }
    }

    private static void checkRange(int firstRow, int firstCol, int lastRow, int lastCol) {
        checkDimensions(firstRow, firstCol);
        checkDimensions(lastRow, lastCol);
        if (firstRow > lastRow || firstCol > lastCol) {
            throw new ParameterException("Range first cell must be above and left of the last cell");
        }
    }

    public boolean usesStringTable() {
        return usesStringTable;
    }

    public boolean hasDynamicArrays() {
        return hasDynamicArrays;
    }

    public boolean hasHyperlinkStyle() {
        return hasHyperlinkStyle;
    }

    public CellValue getCell(int row, int col) {
        NavigableMap<Integer, CellValue> rowCells = cells.get(row);
        return rowCells == null ? null : rowCells.get(col);
    }

    public NavigableMap<Integer, NavigableMap<Integer, CellValue>> getRows() {
        return Collections.unmodifiableNavigableMap(cells);
    }

    /**
     * Local formats in index order, index 0 being the default format.
     */
    public List<Format> getLocalFormats() {
        return Collections.unmodifiableList(localFormats);
    }

    /**
     * Installs the local to global translation produced by the format
     * registry. Cells keep their local indices; the translation is applied
     * when the worksheet is written.
     */
    public void setGlobalFormatIndices(int[] globalIndices) {
        if (globalIndices.length != localFormats.size()) {
            throw new IllegalArgumentException("Expected " + localFormats.size() + " global indices, got " + globalIndices.length);
        }
        this.globalFormatIndices = globalIndices.clone();
    }

    public int globalFormatIndex(int localIndex) {
        if (globalFormatIndices == null) {
            throw new IllegalStateException("Worksheet formats have not been translated");
        }
        return globalFormatIndices[localIndex];
    }

    /**
     * Clears state derived during a previous save.
     */
    void reset() {
        globalFormatIndices = null;
    }

    // -----------------------------------------------------------------------
    // Structural ranges.
    // -----------------------------------------------------------------------

    public Worksheet autofilter(int firstRow, int firstCol, int lastRow, int lastCol) {
        checkRange(firstRow, firstCol, lastRow, lastCol);
        autofilterRange = new int[] {firstRow, firstCol, lastRow, lastCol};
        return this;
    }

    public Worksheet setPrintArea(int firstRow, int firstCol, int lastRow, int lastCol) {
        checkRange(firstRow, firstCol, lastRow, lastCol);
        printAreaRange = new int[] {firstRow, firstCol, lastRow, lastCol};
        return this;
    }

    public Worksheet setRepeatRows(int firstRow, int lastRow) {
        checkRange(firstRow, 0, lastRow, 0);
        repeatRows = new int[] {firstRow, lastRow};
        return this;
    }

    public Worksheet setRepeatColumns(int firstCol, int lastCol) {
        checkRange(0, firstCol, 0, lastCol);
        repeatColumns = new int[] {firstCol, lastCol};
        return this;
    }

    /**
     * Defined names implied by the autofilter, print area and print title
     * settings. Only features in use produce a name.
     */
    public List<DefinedName> structuralDefinedNames() {
        List<DefinedName> names = new ArrayList<>();
        String quoted = CellRefs.quoteSheetName(name);

        if (autofilterRange != null) {
            names.add(structuralName(DefinedNameType.AUTOFILTER, quoted, quoted + "!" + absoluteRange(autofilterRange)));
        }
        if (printAreaRange != null) {
            names.add(structuralName(DefinedNameType.PRINT_AREA, quoted, quoted + "!" + absoluteRange(printAreaRange)));
        }
        if (repeatRows != null || repeatColumns != null) {
            List<String> parts = new ArrayList<>();
            if (repeatColumns != null) {
                parts.add(quoted + "!" + CellRefs.absoluteColumns(repeatColumns[0], repeatColumns[1]));
            }
            if (repeatRows != null) {
                parts.add(quoted + "!" + CellRefs.absoluteRows(repeatRows[0], repeatRows[1]));
            }
            names.add(structuralName(DefinedNameType.PRINT_TITLES, quoted, String.join(",", parts)));
        }
        return names;
    }

    private static DefinedName structuralName(DefinedNameType type, String quotedSheetName, String range) {
        DefinedName definedName = DefinedName.builder()
                .type(type)
                .quotedSheetName(quotedSheetName)
                .range(range)
                .build();
        definedName.setName(definedName.xmlName());
        return definedName;
    }

    private static String absoluteRange(int[] range) {
        return CellRefs.absoluteRange(range[0], range[1], range[2], range[3]);
    }

    // -----------------------------------------------------------------------
    // Page setup, drawings and tables.
    // -----------------------------------------------------------------------

    public Worksheet setHeader(String header) {
        this.header = header;
        return this;
    }

    public Worksheet setFooter(String footer) {
        this.footer = footer;
        return this;
    }

    public Worksheet setHeaderImage(Image image, HeaderImagePosition position) {
        headerImages.put(position, image);
        return this;
    }

    public boolean hasHeaderFooterImages() {
        return !headerImages.isEmpty();
    }

    public Worksheet insertChart(int row, int col, Chart chart) {
        checkDimensions(row, col);
        if (chart.getSeries().isEmpty()) {
            throw new ParameterException("Chart must have at least one data series");
        }
        drawingObjects.add(DrawingObject.chart(row, col, chart));
        return this;
    }

    public Worksheet insertImage(int row, int col, Image image) {
        checkDimensions(row, col);
        drawingObjects.add(DrawingObject.image(row, col, image));
        return this;
    }

    public List<Chart> getCharts() {
        List<Chart> charts = new ArrayList<>();
        for (DrawingObject object : drawingObjects) {
            if (object.isChart()) {
                charts.add(object.getChart());
            }
        }
        return charts;
    }

    public boolean hasDrawing() {
        return !drawingObjects.isEmpty();
    }

    /**
     * Adds a table over the given range. The header row, when enabled, is
     * written as string cells; column formulas fill every data row and the
     * total row, when enabled, takes the last row of the range.
     */
    public Worksheet addTable(int firstRow, int firstCol, int lastRow, int lastCol, Table table) {
        checkRange(firstRow, firstCol, lastRow, lastCol);
        Table placed = table.placedAt(firstRow, firstCol, lastRow, lastCol);
        if (placed.firstDataRow() > placed.lastDataRow()) {
            throw new ParameterException("Table needs at least one data row besides its header and total rows");
        }
        for (int i = 0; i < placed.columnCount(); i++) {
            int col = firstCol + i;
            TableColumn column = placed.column(i);
            if (placed.isHeaderRow()) {
                writeString(firstRow, col, placed.columnHeader(i));
            }
            if (column.hasFormula()) {
                for (int row = placed.firstDataRow(); row <= placed.lastDataRow(); row++) {
                    writeFormula(row, col, column.getFormula());
                }
            }
            if (placed.isTotalRow()) {
                writeTotalCell(lastRow, col, column, placed.columnHeader(i));
            }
        }
        tables.add(placed);
        return this;
    }

    private void writeTotalCell(int row, int col, TableColumn column, String header) {
        if (!column.getTotalLabel().isEmpty()) {
            writeString(row, col, column.getTotalLabel());
        } else if (column.getTotalFunction() != TableFunction.NONE) {
            writeFormula(row, col, "SUBTOTAL(" + column.getTotalFunction().subtotalNumber() + ",["
                    + structuredReferenceName(header) + "])");
        }
    }

    // Brackets, '#' and apostrophes in a column name are escaped with an apostrophe.
    private static String structuredReferenceName(String header) {
        StringBuilder escaped = new StringBuilder(header.length());
        for (char c : header.toCharArray()) {
            if (c == '[' || c == ']' || c == '#' || c == '\'') {
                escaped.append('\'');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    // -----------------------------------------------------------------------
    // Chart data.
    // -----------------------------------------------------------------------

    /**
     * Literal values of a cell range, row by row, as cached in charts.
     * Missing cells give empty strings; any text cell makes the cache a
     * string cache.
     */
    public ChartSeriesCacheData getCacheData(int firstRow, int firstCol, int lastRow, int lastCol) {
        List<String> data = new ArrayList<>();
        boolean numeric = true;
        int lastDataRow = cells.isEmpty() ? -1 : Math.min(lastRow, cells.lastKey());
        for (int row = firstRow; row <= lastDataRow; row++) {
            for (int col = firstCol; col <= lastCol; col++) {
                CellValue cell = getCell(row, col);
                if (cell == null) {
                    data.add("");
                    continue;
                }
                if (!cell.isNumeric() && cell.getType() != CellValue.Type.BLANK) {
                    numeric = false;
                }
                data.add(cell.displayText());
            }
        }
        return ChartSeriesCacheData.of(numeric, data);
    }
}
