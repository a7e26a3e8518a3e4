package com.example.demo.xlsxgen.model;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.Locale;

/**
 * A workbook or worksheet scoped name for a range or formula.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DefinedName {
    private String name;

    /**
     * Range or formula text without the leading '='.
     */
    private String range;

    @Builder.Default
    private DefinedNameType type = DefinedNameType.GLOBAL;

    /**
     * Sheet name as it appears in the name key, possibly quoted. Empty for
     * global names.
     */
    @Builder.Default
    private String quotedSheetName = "";

    /**
     * Zero-based worksheet index, set for local and structural names once
     * the name has been resolved.
     */
    private int sheetIndex;

    /**
     * Name as written to the workbook part.
     */
    public String xmlName() {
        switch (type) {
            case AUTOFILTER:
                return "_xlnm._FilterDatabase";
            case PRINT_AREA:
                return "_xlnm.Print_Area";
            case PRINT_TITLES:
                return "_xlnm.Print_Titles";
            default:
                return name;
        }
    }

    public String unquotedSheetName() {
        String sheet = quotedSheetName;
        if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
            sheet = sheet.substring(1, sheet.length() - 1).replace("''", "'");
        }
        return sheet;
    }

    /**
     * Key used to order names the way Excel lists them: the name without
     * the {@code _xlnm.} prefix or a leading backslash, lower-cased, then the
     * sheet it belongs to.
     */
    public String sortKey() {
        String sortName = xmlName();
        if (sortName.startsWith("_xlnm.")) {
            sortName = sortName.substring("_xlnm.".length());
        }
        if (sortName.startsWith("\\")) {
            sortName = sortName.substring(1);
        }
        return sortName.toLowerCase(Locale.ROOT) + "::" + unquotedSheetName();
    }

    /**
     * Entry for the named-range list in the extended properties part, or
     * an empty string when the name isn't listed there.
     */
    public String appName() {
        switch (type) {
            case LOCAL:
                return quotedSheetName + "!" + name;
            case PRINT_AREA:
                return quotedSheetName + "!Print_Area";
            case PRINT_TITLES:
                return quotedSheetName + "!Print_Titles";
            case GLOBAL:
                return range != null && range.contains("!") ? name : "";
            default:
                return "";
        }
    }
}
