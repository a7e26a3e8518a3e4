package com.example.demo.xlsxgen.model;

import lombok.Getter;

/**
 * Title text for a chart, an axis, a series name or a data label. It is
 * either literal text or a reference to a worksheet cell.
 */
@Getter
public class ChartTitle {
    private final String text;
    private final ChartRange range;

    private ChartTitle(String text, ChartRange range) {
        this.text = text;
        this.range = range;
    }

    public static ChartTitle none() {
        return new ChartTitle("", ChartRange.empty());
    }

    /**
     * Text starting with '=' is treated as a cell reference.
     */
    public static ChartTitle of(String value) {
        if (value.startsWith("=")) {
            return new ChartTitle("", ChartRange.parse(value));
        }
        return new ChartTitle(value, ChartRange.empty());
    }

    public boolean isSet() {
        return !text.isEmpty() || range.hasData();
    }
}
