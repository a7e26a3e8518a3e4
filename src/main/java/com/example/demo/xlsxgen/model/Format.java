package com.example.demo.xlsxgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable description of a cell style. Every modifier returns a new
 * value, so formats can be shared freely between cells and worksheets.
 * Two formats with equal fields map to the same style index at save time.
 *
 * <pre>
 * Format money = new Format().withNumFormat("$#,##0.00").withBold();
 * Format header = new Format().withBold().withBackgroundColor(Color.YELLOW);
 * </pre>
 */
@Value
@With
@Builder(toBuilder = true)
@AllArgsConstructor
public class Format {
    @Builder.Default
    Font font = Font.DEFAULT;
    @Builder.Default
    Fill fill = Fill.DEFAULT;
    @Builder.Default
    Border border = Border.DEFAULT;
    @Builder.Default
    String numFormat = "";
    int numFormatIndex;
    @Builder.Default
    FormatAlign horizontalAlign = FormatAlign.GENERAL;
    @Builder.Default
    FormatAlign verticalAlign = FormatAlign.GENERAL;
    boolean textWrap;
    int indent;
    int rotation;
    boolean shrink;
    @Builder.Default
    boolean locked = true;
    boolean hidden;
    boolean quotePrefix;
    boolean hyperlink;

    public Format() {
        this(Font.DEFAULT, Fill.DEFAULT, Border.DEFAULT, "", 0, FormatAlign.GENERAL, FormatAlign.GENERAL,
                false, 0, 0, false, true, false, false, false);
    }

    /**
     * The built-in style used for cells written with a URL.
     */
    public static Format hyperlinkStyle() {
        Font font = Font.DEFAULT.toBuilder()
                .color(Color.theme(10))
                .underline(FormatUnderline.SINGLE)
                .scheme("")
                .build();
        return new Format().withFont(font).withHyperlink(true);
    }

    public Format withBold() {
        return withFont(font.withBold(true));
    }

    public Format withItalic() {
        return withFont(font.withItalic(true));
    }

    public Format withUnderline(FormatUnderline underline) {
        return withFont(font.withUnderline(underline));
    }

    public Format withStrikethrough() {
        return withFont(font.withStrikethrough(true));
    }

    public Format withFontName(String name) {
        return withFont(font.withName(name));
    }

    public Format withFontSize(double size) {
        return withFont(font.withSize(size));
    }

    public Format withFontColor(Color color) {
        return withFont(font.withColor(color));
    }

    public Format withPattern(FormatPattern pattern) {
        return withFill(fill.withPattern(pattern));
    }

    public Format withBackgroundColor(Color color) {
        return withFill(fill.withBackgroundColor(color));
    }

    public Format withForegroundColor(Color color) {
        return withFill(fill.withForegroundColor(color));
    }

    public Format withBorder(FormatBorder style) {
        return toBuilder().border(border.toBuilder().left(style).right(style).top(style).bottom(style).build()).build();
    }

    public Format withBorderColor(Color color) {
        return toBuilder().border(border.toBuilder()
                .leftColor(color).rightColor(color).topColor(color).bottomColor(color).build()).build();
    }

    /**
     * Applies a horizontal or a vertical alignment, depending on which
     * direction the value belongs to.
     */
    public Format withAlign(FormatAlign align) {
        if (align.vertical() != null) {
            return withVerticalAlign(align);
        }
        return withHorizontalAlign(align);
    }

    public Format withTextWrap() {
        return withTextWrap(true);
    }

    public Format withUnlocked() {
        return withLocked(false);
    }

    public Format withQuotePrefix() {
        return withQuotePrefix(true);
    }

    public boolean hasAlignment() {
        return horizontalAlign != FormatAlign.GENERAL || verticalAlign != FormatAlign.GENERAL
                || textWrap || indent != 0 || rotation != 0 || shrink;
    }

    public boolean hasProtection() {
        return !locked || hidden;
    }
}
