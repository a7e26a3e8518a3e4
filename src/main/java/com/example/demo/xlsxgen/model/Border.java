package com.example.demo.xlsxgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@With
@Builder(toBuilder = true)
public class Border {
    public static final Border DEFAULT = Border.builder().build();

    @Builder.Default
    FormatBorder left = FormatBorder.NONE;
    @Builder.Default
    FormatBorder right = FormatBorder.NONE;
    @Builder.Default
    FormatBorder top = FormatBorder.NONE;
    @Builder.Default
    FormatBorder bottom = FormatBorder.NONE;
    @Builder.Default
    Color leftColor = Color.DEFAULT;
    @Builder.Default
    Color rightColor = Color.DEFAULT;
    @Builder.Default
    Color topColor = Color.DEFAULT;
    @Builder.Default
    Color bottomColor = Color.DEFAULT;

    public static Border all(FormatBorder style) {
        return Border.builder().left(style).right(style).top(style).bottom(style).build();
    }
}
