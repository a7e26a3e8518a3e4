package com.example.demo.xlsxgen.model;

public enum ChartType {
    AREA("c:areaChart", null, true),
    BAR("c:barChart", "bar", true),
    COLUMN("c:barChart", "col", true),
    LINE("c:lineChart", null, true),
    PIE("c:pieChart", null, false),
    DOUGHNUT("c:doughnutChart", null, false),
    SCATTER("c:scatterChart", null, true);

    private final String element;
    private final String barDirection;
    private final boolean hasAxes;

    ChartType(String element, String barDirection, boolean hasAxes) {
        this.element = element;
        this.barDirection = barDirection;
        this.hasAxes = hasAxes;
    }

    public String element() {
        return element;
    }

    public String barDirection() {
        return barDirection;
    }

    public boolean hasAxes() {
        return hasAxes;
    }
}
