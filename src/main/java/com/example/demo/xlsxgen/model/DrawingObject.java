package com.example.demo.xlsxgen.model;

import lombok.Value;

/**
 * A chart or an image anchored at a worksheet cell, in insertion order.
 */
@Value
public class DrawingObject {
    int row;
    int col;
    Chart chart;
    Image image;

    public static DrawingObject chart(int row, int col, Chart chart) {
        return new DrawingObject(row, col, chart, null);
    }

    public static DrawingObject image(int row, int col, Image image) {
        return new DrawingObject(row, col, null, image);
    }

    public boolean isChart() {
        return chart != null;
    }

    public int widthPixels() {
        return isChart() ? chart.getWidth() : image.getWidth();
    }

    public int heightPixels() {
        return isChart() ? chart.getHeight() : image.getHeight();
    }
}
