package com.example.demo.xlsxgen.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A chart embedded in a worksheet drawing.
 */
@Getter
public class Chart {
    public static final int DEFAULT_WIDTH = 480;
    public static final int DEFAULT_HEIGHT = 288;

    private final ChartType type;
    private ChartTitle title = ChartTitle.none();
    private ChartTitle xAxisTitle = ChartTitle.none();
    private ChartTitle yAxisTitle = ChartTitle.none();
    private final List<ChartSeries> series = new ArrayList<>();
    private int width = DEFAULT_WIDTH;
    private int height = DEFAULT_HEIGHT;

    public Chart(ChartType type) {
        this.type = type;
    }

    public ChartSeries addSeries() {
        ChartSeries added = new ChartSeries();
        series.add(added);
        return added;
    }

    public Chart setTitle(String title) {
        this.title = ChartTitle.of(title);
        return this;
    }

    public Chart setXAxisTitle(String title) {
        this.xAxisTitle = ChartTitle.of(title);
        return this;
    }

    public Chart setYAxisTitle(String title) {
        this.yAxisTitle = ChartTitle.of(title);
        return this;
    }

    public Chart setSize(int width, int height) {
        this.width = width;
        this.height = height;
        return this;
    }
}
