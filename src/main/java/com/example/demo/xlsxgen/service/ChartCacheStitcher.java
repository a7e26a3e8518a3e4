package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.model.Chart;
import com.example.demo.xlsxgen.model.ChartCacheKey;
import com.example.demo.xlsxgen.model.ChartRange;
import com.example.demo.xlsxgen.model.ChartSeries;
import com.example.demo.xlsxgen.model.ChartSeriesCacheData;
import com.example.demo.xlsxgen.model.ChartTitle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Fills chart caches with the worksheet values their ranges point at.
 *
 * A chart may reference data on any worksheet, so the work is split in
 * three passes: collect every distinct range key, resolve each key once
 * against the worksheet it names, then copy the shared result into every
 * range with that key. Ranges that can't be resolved get an empty cache.
 */
@Slf4j
public class ChartCacheStitcher {

    /**
     * @param worksheets  worksheets whose charts are updated
     * @param sheetLookup finds a worksheet by its exact name
     * @return the number of distinct ranges resolved
     */
    public int stitch(List<Worksheet> worksheets, Function<String, Optional<Worksheet>> sheetLookup) {
        List<ChartRange> ranges = new ArrayList<>();
        for (Worksheet worksheet : worksheets) {
            for (Chart chart : worksheet.getCharts()) {
                collectRanges(chart, ranges);
            }
        }
        if (ranges.isEmpty()) {
            return 0;
        }

        Map<ChartCacheKey, ChartSeriesCacheData> caches = new LinkedHashMap<>();
        for (ChartRange range : ranges) {
            caches.putIfAbsent(range.getKey(), null);
        }

        for (Map.Entry<ChartCacheKey, ChartSeriesCacheData> entry : caches.entrySet()) {
            entry.setValue(resolve(entry.getKey(), sheetLookup));
        }

        for (ChartRange range : ranges) {
            range.setCacheData(caches.get(range.getKey()));
        }

        log.debug("Resolved {} chart cache ranges for {} chart references", caches.size(), ranges.size());
        return caches.size();
    }

    private ChartSeriesCacheData resolve(ChartCacheKey key, Function<String, Optional<Worksheet>> sheetLookup) {
        Optional<Worksheet> worksheet = sheetLookup.apply(key.getSheetName());
        if (worksheet.isEmpty()) {
            log.warn("Chart references unknown worksheet '{}', leaving its cache empty", key.getSheetName());
            return ChartSeriesCacheData.empty();
        }
        return worksheet.get().getCacheData(key.getFirstRow(), key.getFirstCol(), key.getLastRow(), key.getLastCol());
    }

    private static void collectRanges(Chart chart, List<ChartRange> ranges) {
        addTitle(chart.getTitle(), ranges);
        addTitle(chart.getXAxisTitle(), ranges);
        addTitle(chart.getYAxisTitle(), ranges);

        for (ChartSeries series : chart.getSeries()) {
            addTitle(series.getName(), ranges);
            addRange(series.getValues(), ranges);
            addRange(series.getCategories(), ranges);
            for (ChartTitle label : series.getCustomDataLabels()) {
                addTitle(label, ranges);
            }
        }
    }

    private static void addTitle(ChartTitle title, List<ChartRange> ranges) {
        addRange(title.getRange(), ranges);
    }

    private static void addRange(ChartRange range, List<ChartRange> ranges) {
        if (range.hasData()) {
            ranges.add(range);
        }
    }
}
