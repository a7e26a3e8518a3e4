package com.example.demo.xlsxgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Font part of a {@link Format}. Deduplicated into the font sub-table of
 * the styles part.
 */
@Value
@With
@Builder(toBuilder = true)
public class Font {
    public static final Font DEFAULT = Font.builder().build();

    @Builder.Default
    String name = "Calibri";
    @Builder.Default
    double size = 11.0;
    boolean bold;
    boolean italic;
    @Builder.Default
    FormatUnderline underline = FormatUnderline.NONE;
    boolean strikethrough;
    @Builder.Default
    Color color = Color.DEFAULT;
    @Builder.Default
    int family = 2;
    @Builder.Default
    String scheme = "minor";
}
