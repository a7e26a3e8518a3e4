package com.example.demo.xlsxgen.model;

/**
 * Cell fill patterns, in the order of their patternType names.
 */
public enum FormatPattern {
    NONE("none"),
    SOLID("solid"),
    MEDIUM_GRAY("mediumGray"),
    DARK_GRAY("darkGray"),
    LIGHT_GRAY("lightGray"),
    DARK_HORIZONTAL("darkHorizontal"),
    DARK_VERTICAL("darkVertical"),
    DARK_DOWN("darkDown"),
    DARK_UP("darkUp"),
    DARK_GRID("darkGrid"),
    DARK_TRELLIS("darkTrellis"),
    LIGHT_HORIZONTAL("lightHorizontal"),
    LIGHT_VERTICAL("lightVertical"),
    LIGHT_DOWN("lightDown"),
    LIGHT_UP("lightUp"),
    LIGHT_GRID("lightGrid"),
    LIGHT_TRELLIS("lightTrellis"),
    GRAY125("gray125"),
    GRAY0625("gray0625");

    private final String xmlName;

    FormatPattern(String xmlName) {
        this.xmlName = xmlName;
    }

    public String xmlName() {
        return xmlName;
    }
}
