package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.model.DefinedName;
import com.example.demo.xlsxgen.model.DefinedNameType;

import java.util.List;

/**
 * Renders {@code xl/workbook.xml}: the sheet list, the workbook view and
 * the defined names. Sheet {@code n} (1-based) uses relationship
 * {@code rIdn}.
 */
public class WorkbookRenderer implements PartRenderer {
    static final String XMLNS_MAIN = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    static final String XMLNS_R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    private final List<Worksheet> worksheets;
    private final List<DefinedName> definedNames;
    private final int activeTab;
    private final int firstSheet;
    private final boolean readOnlyRecommended;

    public WorkbookRenderer(List<Worksheet> worksheets, List<DefinedName> definedNames,
                            int activeTab, int firstSheet, boolean readOnlyRecommended) {
        this.worksheets = worksheets;
        this.definedNames = definedNames;
        this.activeTab = activeTab;
        this.firstSheet = firstSheet;
        this.readOnlyRecommended = readOnlyRecommended;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("workbook", "xmlns", XMLNS_MAIN, "xmlns:r", XMLNS_R);
        writer.emptyTag("fileVersion", "appName", "xl", "lastEdited", "4", "lowestEdited", "4", "rupBuild", "4505");
        if (readOnlyRecommended) {
            writer.emptyTag("fileSharing", "readOnlyRecommended", "1");
        }
        writer.emptyTag("workbookPr", "defaultThemeVersion", "124226");

        writer.startTag("bookViews");
        writeWorkbookView(writer);
        writer.endTag("bookViews");

        writer.startTag("sheets");
        for (int i = 0; i < worksheets.size(); i++) {
            Worksheet worksheet = worksheets.get(i);
            String sheetId = Integer.toString(i + 1);
            if (worksheet.isHidden()) {
                writer.emptyTag("sheet", "name", worksheet.getName(), "sheetId", sheetId,
                        "state", "hidden", "r:id", "rId" + sheetId);
            } else {
                writer.emptyTag("sheet", "name", worksheet.getName(), "sheetId", sheetId, "r:id", "rId" + sheetId);
            }
        }
        writer.endTag("sheets");

        if (!definedNames.isEmpty()) {
            writeDefinedNames(writer);
        }

        writer.emptyTag("calcPr", "calcId", "124519", "fullCalcOnLoad", "1");
        return writer.endTag("workbook").toString();
    }

    private void writeWorkbookView(XmlWriter writer) {
        String[] base = {"xWindow", "240", "yWindow", "15", "windowWidth", "16095", "windowHeight", "9660"};
        if (firstSheet > 0 && activeTab > 0) {
            writer.emptyTag("workbookView", concat(base,
                    "firstSheet", Integer.toString(firstSheet + 1), "activeTab", Integer.toString(activeTab)));
        } else if (firstSheet > 0) {
            writer.emptyTag("workbookView", concat(base, "firstSheet", Integer.toString(firstSheet + 1)));
        } else if (activeTab > 0) {
            writer.emptyTag("workbookView", concat(base, "activeTab", Integer.toString(activeTab)));
        } else {
            writer.emptyTag("workbookView", base);
        }
    }

    private void writeDefinedNames(XmlWriter writer) {
        writer.startTag("definedNames");
        for (DefinedName definedName : definedNames) {
            String name = definedName.xmlName();
            if (definedName.getType() == DefinedNameType.GLOBAL) {
                writer.dataElement("definedName", definedName.getRange(), "name", name);
            } else if (definedName.getType() == DefinedNameType.AUTOFILTER) {
                writer.dataElement("definedName", definedName.getRange(), "name", name,
                        "localSheetId", Integer.toString(definedName.getSheetIndex()), "hidden", "1");
            } else {
                writer.dataElement("definedName", definedName.getRange(), "name", name,
                        "localSheetId", Integer.toString(definedName.getSheetIndex()));
            }
        }
        writer.endTag("definedNames");
    }

    private static String[] concat(String[] base, String... extra) {
        String[] all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }
}
