package com.example.demo.xlsxgen.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class ChartSeries {
    private ChartTitle name = ChartTitle.none();
    private ChartRange values = ChartRange.empty();
    private ChartRange categories = ChartRange.empty();
    private final List<ChartTitle> customDataLabels = new ArrayList<>();

    public ChartSeries setName(String name) {
        this.name = ChartTitle.of(name);
        return this;
    }

    public ChartSeries setValues(String formula) {
        this.values = ChartRange.parse(formula);
        return this;
    }

    public ChartSeries setValues(String sheetName, int firstRow, int firstCol, int lastRow, int lastCol) {
        this.values = ChartRange.of(sheetName, firstRow, firstCol, lastRow, lastCol);
        return this;
    }

    public ChartSeries setCategories(String formula) {
        this.categories = ChartRange.parse(formula);
        return this;
    }

    public ChartSeries setCategories(String sheetName, int firstRow, int firstCol, int lastRow, int lastCol) {
        this.categories = ChartRange.of(sheetName, firstRow, firstCol, lastRow, lastCol);
        return this;
    }

    /**
     * Adds a label for the next data point. Use an empty string to keep the
     * default label of a point.
     */
    public ChartSeries addCustomDataLabel(String value) {
        customDataLabels.add(value.isEmpty() ? ChartTitle.none() : ChartTitle.of(value));
        return this;
    }
}
