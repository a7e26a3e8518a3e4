package com.example.demo.xlsxgen.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A cell color. {@link #DEFAULT} means "not set" and is never written.
 * Theme colors carry the theme slot instead of an RGB value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Color {
    public static final Color DEFAULT = new Color(Kind.DEFAULT, 0);
    public static final Color AUTOMATIC = new Color(Kind.AUTOMATIC, 0);

    public static final Color BLACK = rgb(0x000000);
    public static final Color WHITE = rgb(0xFFFFFF);
    public static final Color RED = rgb(0xFF0000);
    public static final Color GREEN = rgb(0x008000);
    public static final Color BLUE = rgb(0x0000FF);
    public static final Color YELLOW = rgb(0xFFFF00);
    public static final Color GRAY = rgb(0x808080);

    public enum Kind {
        DEFAULT,
        AUTOMATIC,
        RGB,
        THEME
    }

    Kind kind;
    int value;

    public static Color rgb(int rgb) {
        return new Color(Kind.RGB, rgb & 0xFFFFFF);
    }

    public static Color theme(int slot) {
        return new Color(Kind.THEME, slot);
    }

    public boolean isSet() {
        return kind != Kind.DEFAULT;
    }

    /**
     * ARGB hex string as stored in the styles part, e.g. {@code FFFF0000}.
     */
    public String argbHex() {
        return String.format("FF%06X", value);
    }
}
