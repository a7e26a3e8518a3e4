package com.example.demo.xlsxgen.model;

/**
 * Horizontal and vertical alignment values. {@code GENERAL} is the
 * default for both directions and is not written.
 */
public enum FormatAlign {
    GENERAL(null, null),
    LEFT("left", null),
    CENTER("center", null),
    RIGHT("right", null),
    FILL("fill", null),
    JUSTIFY("justify", null),
    CENTER_ACROSS("centerContinuous", null),
    DISTRIBUTED("distributed", null),
    TOP(null, "top"),
    VERTICAL_CENTER(null, "center"),
    BOTTOM(null, "bottom"),
    VERTICAL_JUSTIFY(null, "justify"),
    VERTICAL_DISTRIBUTED(null, "distributed");

    private final String horizontal;
    private final String vertical;

    FormatAlign(String horizontal, String vertical) {
        this.horizontal = horizontal;
        this.vertical = vertical;
    }

    public String horizontal() {
        return horizontal;
    }

    public String vertical() {
        return vertical;
    }
}
