package com.example.demo.xlsxgen.model;

import lombok.Value;

import java.time.Instant;

/**
 * A user defined document property written to {@code docProps/custom.xml}.
 */
@Value
public class CustomProperty {
    public enum Kind {
        TEXT("lpwstr"),
        NUMBER("r8"),
        INTEGER("i4"),
        BOOLEAN("bool"),
        DATE_TIME("filetime");

        private final String variantType;

        Kind(String variantType) {
            this.variantType = variantType;
        }

        public String variantType() {
            return variantType;
        }
    }

    String name;
    Kind kind;
    String value;

    public static CustomProperty text(String name, String value) {
        return new CustomProperty(name, Kind.TEXT, value);
    }

    public static CustomProperty number(String name, double value) {
        return new CustomProperty(name, Kind.NUMBER, formatNumber(value));
    }

    public static CustomProperty integer(String name, int value) {
        return new CustomProperty(name, Kind.INTEGER, Integer.toString(value));
    }

    public static CustomProperty bool(String name, boolean value) {
        return new CustomProperty(name, Kind.BOOLEAN, value ? "true" : "false");
    }

    public static CustomProperty dateTime(String name, Instant value) {
        return new CustomProperty(name, Kind.DATE_TIME, DocProperties.W3CDTF.format(value));
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
