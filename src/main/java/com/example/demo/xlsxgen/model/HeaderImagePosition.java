package com.example.demo.xlsxgen.model;

/**
 * Slot of a header or footer image. The code is the VML shape id suffix
 * Excel uses for that slot.
 */
public enum HeaderImagePosition {
    LEFT_HEADER("LH"),
    CENTER_HEADER("CH"),
    RIGHT_HEADER("RH"),
    LEFT_FOOTER("LF"),
    CENTER_FOOTER("CF"),
    RIGHT_FOOTER("RF");

    private final String code;

    HeaderImagePosition(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
