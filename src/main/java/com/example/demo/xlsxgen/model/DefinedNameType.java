package com.example.demo.xlsxgen.model;

/**
 * Scope and origin of a defined name. The last three are synthesized from
 * worksheet settings rather than typed by the user.
 */
public enum DefinedNameType {
    GLOBAL,
    LOCAL,
    AUTOFILTER,
    PRINT_AREA,
    PRINT_TITLES;

    public boolean isStructural() {
        return this == AUTOFILTER || this == PRINT_AREA || this == PRINT_TITLES;
    }
}
