package com.example.demo.xlsxgen.model;

import com.example.demo.xlsxgen.util.CellRefs;
import lombok.Getter;
import lombok.Setter;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellReference;

/**
 * A chart reference to a worksheet range, such as {@code =Sheet1!$A$1:$A$5},
 * together with the cell values cached for it at save time.
 */
@Getter
public class ChartRange {
    private final String formula;
    private final ChartCacheKey key;

    @Setter
    private ChartSeriesCacheData cacheData = ChartSeriesCacheData.empty();

    private ChartRange(String formula, ChartCacheKey key) {
        this.formula = formula;
        this.key = key;
    }

    public static ChartRange empty() {
        return new ChartRange("", null);
    }

    /**
     * Parses a sheet qualified range. A formula that can't be parsed still
     * yields a range, but one without a cache key.
     */
    public static ChartRange parse(String formula) {
        String text = formula.startsWith("=") ? formula.substring(1) : formula;
        if (text.isEmpty()) {
            return empty();
        }
        try {
            AreaReference area = new AreaReference(text, SpreadsheetVersion.EXCEL2007);
            CellReference first = area.getFirstCell();
            CellReference last = area.getLastCell();
            if (first.getSheetName() == null) {
                return new ChartRange(text, null);
            }
            ChartCacheKey key = new ChartCacheKey(first.getSheetName(),
                    first.getRow(), first.getCol(), last.getRow(), last.getCol());
            return new ChartRange(text, key);
        } catch (IllegalArgumentException | IllegalStateException e) {
            return new ChartRange(text, null);
        }
    }

    public static ChartRange of(String sheetName, int firstRow, int firstCol, int lastRow, int lastCol) {
        String formula = CellRefs.quoteSheetName(sheetName) + "!" + CellRefs.absoluteRange(firstRow, firstCol, lastRow, lastCol);
        return new ChartRange(formula, new ChartCacheKey(sheetName, firstRow, firstCol, lastRow, lastCol));
    }

    public boolean hasData() {
        return key != null;
    }
}
