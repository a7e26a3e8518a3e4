package com.example.demo.xlsxgen.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Literal cell values cached inside a chart part so that consumers which
 * don't calculate worksheets can still draw the chart.
 */
@Value
public class ChartSeriesCacheData {
    private static final ChartSeriesCacheData EMPTY = new ChartSeriesCacheData(true, Collections.emptyList());

    boolean numeric;
    List<String> data;

    public static ChartSeriesCacheData empty() {
        return EMPTY;
    }

    public static ChartSeriesCacheData of(boolean numeric, List<String> data) {
        return new ChartSeriesCacheData(numeric, List.copyOf(data));
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }
}
