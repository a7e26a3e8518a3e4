package com.example.demo.xlsxgen.model;

import lombok.Value;

/**
 * Identifies a worksheet cell range referenced from a chart. Identical keys
 * share one resolved cache.
 */
@Value
public class ChartCacheKey {
    String sheetName;
    int firstRow;
    int firstCol;
    int lastRow;
    int lastCol;
}
