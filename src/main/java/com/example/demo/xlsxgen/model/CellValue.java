package com.example.demo.xlsxgen.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One stored worksheet cell. The format index refers to the owning
 * worksheet's local format list until the workbook translates it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CellValue {
    public enum Type {
        NUMBER,
        STRING,
        BOOLEAN,
        FORMULA,
        DYNAMIC_FORMULA,
        BLANK
    }

    Type type;
    double number;
    String text;
    boolean bool;
    int formatIndex;

    public static CellValue number(double value, int formatIndex) {
        return new CellValue(Type.NUMBER, value, null, false, formatIndex);
    }

    public static CellValue string(String value, int formatIndex) {
        return new CellValue(Type.STRING, 0, value, false, formatIndex);
    }

    public static CellValue bool(boolean value, int formatIndex) {
        return new CellValue(Type.BOOLEAN, 0, null, value, formatIndex);
    }

    /**
     * A formula with an optional cached numeric result.
     */
    public static CellValue formula(String formula, double result, int formatIndex) {
        return new CellValue(Type.FORMULA, result, formula, false, formatIndex);
    }

    public static CellValue dynamicFormula(String formula, double result, int formatIndex) {
        return new CellValue(Type.DYNAMIC_FORMULA, result, formula, false, formatIndex);
    }

    public static CellValue blank(int formatIndex) {
        return new CellValue(Type.BLANK, 0, null, false, formatIndex);
    }

    public boolean isNumeric() {
        return type == Type.NUMBER || type == Type.FORMULA || type == Type.DYNAMIC_FORMULA;
    }

    /**
     * Text form of the value as it appears in a chart cache.
     */
    public String displayText() {
        switch (type) {
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "1" : "0";
            case BLANK:
                return "";
            default:
                return formatNumber(number);
        }
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
