package com.example.demo.xlsxgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Pattern fill of a cell. Colors use the authoring convention: the
 * background color is the visible one for a solid fill.
 */
@Value
@With
@Builder(toBuilder = true)
public class Fill {
    public static final Fill DEFAULT = Fill.builder().build();
    public static final Fill GRAY125 = Fill.builder().pattern(FormatPattern.GRAY125).build();

    @Builder.Default
    FormatPattern pattern = FormatPattern.NONE;
    @Builder.Default
    Color foregroundColor = Color.DEFAULT;
    @Builder.Default
    Color backgroundColor = Color.DEFAULT;

    /**
     * Converts the fill to the stored form. Solid fills swap their color
     * roles, and a lone color without a pattern becomes a solid fill.
     */
    public Fill normalized() {
        boolean solidOrNone = pattern == FormatPattern.NONE || pattern == FormatPattern.SOLID;

        if (pattern == FormatPattern.SOLID && foregroundColor.isSet() && backgroundColor.isSet()) {
            return new Fill(pattern, backgroundColor, foregroundColor);
        }
        if (solidOrNone && backgroundColor.isSet() && !foregroundColor.isSet()) {
            return new Fill(FormatPattern.SOLID, backgroundColor, Color.DEFAULT);
        }
        if (solidOrNone && foregroundColor.isSet() && !backgroundColor.isSet()) {
            return new Fill(FormatPattern.SOLID, foregroundColor, Color.DEFAULT);
        }
        return this;
    }
}
