package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.model.CellValue;
import com.example.demo.xlsxgen.model.Hyperlink;
import com.example.demo.xlsxgen.util.CellRefs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Renders {@code xl/worksheets/sheetN.xml}. Cell styles are written as
 * global indices; strings go through the shared string table.
 */
public class WorksheetRenderer implements PartRenderer {
    private final Worksheet worksheet;
    private final SharedStringTable sharedStrings;
    private final SheetPlan plan;

    WorksheetRenderer(Worksheet worksheet, SharedStringTable sharedStrings, SheetPlan plan) {
        this.worksheet = worksheet;
        this.sharedStrings = sharedStrings;
        this.plan = plan;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("worksheet", "xmlns", WorkbookRenderer.XMLNS_MAIN, "xmlns:r", WorkbookRenderer.XMLNS_R);

        writer.emptyTag("dimension", "ref", dimension());
        writer.startTag("sheetViews");
        if (worksheet.isActive()) {
            writer.emptyTag("sheetView", "tabSelected", "1", "workbookViewId", "0");
        } else {
            writer.emptyTag("sheetView", "workbookViewId", "0");
        }
        writer.endTag("sheetViews");
        writer.emptyTag("sheetFormatPr", "defaultRowHeight", "15");

        writeColumns(writer);
        writeSheetData(writer);

        int[] filter = worksheet.getAutofilterRange();
        if (filter != null) {
            writer.emptyTag("autoFilter", "ref", CellRefs.range(filter[0], filter[1], filter[2], filter[3]));
        }
        writeHyperlinks(writer);

        writer.emptyTag("pageMargins", "left", "0.7", "right", "0.7", "top", "0.75", "bottom", "0.75",
                "header", "0.3", "footer", "0.3");
        writeHeaderFooter(writer);

        if (plan.hasDrawing()) {
            writer.emptyTag("drawing", "r:id", plan.getDrawingRelId());
        }
        if (plan.hasVml()) {
            writer.emptyTag("legacyDrawingHF", "r:id", plan.getVmlRelId());
        }
        List<String> tableRelIds = plan.getTableRelIds();
        if (!tableRelIds.isEmpty()) {
            writer.startTag("tableParts", "count", Integer.toString(tableRelIds.size()));
            for (String relId : tableRelIds) {
                writer.emptyTag("tablePart", "r:id", relId);
            }
            writer.endTag("tableParts");
        }
        return writer.endTag("worksheet").toString();
    }

    private String dimension() {
        NavigableMap<Integer, NavigableMap<Integer, CellValue>> rows = worksheet.getRows();
        if (rows.isEmpty()) {
            return "A1";
        }
        int minCol = Integer.MAX_VALUE;
        int maxCol = 0;
        for (NavigableMap<Integer, CellValue> row : rows.values()) {
            minCol = Math.min(minCol, row.firstKey());
            maxCol = Math.max(maxCol, row.lastKey());
        }
        return CellRefs.range(rows.firstKey(), minCol, rows.lastKey(), maxCol);
    }

    private void writeColumns(XmlWriter writer) {
        NavigableMap<Integer, Double> widths = worksheet.getColumnWidths();
        if (widths.isEmpty()) {
            return;
        }
        writer.startTag("cols");
        for (Map.Entry<Integer, Double> entry : widths.entrySet()) {
            String col = Integer.toString(entry.getKey() + 1);
            writer.emptyTag("col", "min", col, "max", col,
                    "width", CellValue.formatNumber(storedWidth(entry.getValue())), "customWidth", "1");
        }
        writer.endTag("cols");
    }

    // Character width to the stored width, which includes cell padding.
    private static double storedWidth(double width) {
        if (width <= 0) {
            return 0;
        }
        int pixels = width < 1 ? (int) (width * 12 + 0.5) : (int) (width * 7 + 0.5) + 5;
        return Math.floor(pixels / 7.0 * 256) / 256;
    }

    private void writeSheetData(XmlWriter writer) {
        NavigableMap<Integer, NavigableMap<Integer, CellValue>> rows = worksheet.getRows();
        if (rows.isEmpty()) {
            writer.emptyTag("sheetData");
            return;
        }
        writer.startTag("sheetData");
        for (Map.Entry<Integer, NavigableMap<Integer, CellValue>> row : rows.entrySet()) {
            NavigableMap<Integer, CellValue> cells = row.getValue();
            String spans = (cells.firstKey() + 1) + ":" + (cells.lastKey() + 1);
            writer.startTag("row", "r", Integer.toString(row.getKey() + 1), "spans", spans);
            for (Map.Entry<Integer, CellValue> cell : cells.entrySet()) {
                writeCell(writer, row.getKey(), cell.getKey(), cell.getValue());
            }
            writer.endTag("row");
        }
        writer.endTag("sheetData");
    }

    private void writeCell(XmlWriter writer, int row, int col, CellValue cell) {
        List<String> attributes = new ArrayList<>();
        attributes.add("r");
        attributes.add(CellRefs.cell(row, col));
        int style = worksheet.globalFormatIndex(cell.getFormatIndex());
        if (style != 0) {
            attributes.add("s");
            attributes.add(Integer.toString(style));
        }

        switch (cell.getType()) {
            case STRING:
                attributes.add("t");
                attributes.add("s");
                writer.startTag("c", toArray(attributes));
                writer.dataElement("v", Integer.toString(sharedStrings.indexOf(cell.getText())));
                writer.endTag("c");
                break;
            case BOOLEAN:
                attributes.add("t");
                attributes.add("b");
                writer.startTag("c", toArray(attributes));
                writer.dataElement("v", cell.isBool() ? "1" : "0");
                writer.endTag("c");
                break;
            case NUMBER:
                writer.startTag("c", toArray(attributes));
                writer.dataElement("v", CellValue.formatNumber(cell.getNumber()));
                writer.endTag("c");
                break;
            case FORMULA:
                writer.startTag("c", toArray(attributes));
                writer.dataElement("f", cell.getText());
                writer.dataElement("v", CellValue.formatNumber(cell.getNumber()));
                writer.endTag("c");
                break;
            case DYNAMIC_FORMULA:
                attributes.add("cm");
                attributes.add("1");
                writer.startTag("c", toArray(attributes));
                writer.dataElement("f", cell.getText(), "t", "array", "ref", CellRefs.cell(row, col));
                writer.dataElement("v", CellValue.formatNumber(cell.getNumber()));
                writer.endTag("c");
                break;
            default:
                writer.emptyTag("c", toArray(attributes));
                break;
        }
    }

    private void writeHyperlinks(XmlWriter writer) {
        List<Hyperlink> hyperlinks = worksheet.getHyperlinks();
        if (hyperlinks.isEmpty()) {
            return;
        }
        writer.startTag("hyperlinks");
        for (int i = 0; i < hyperlinks.size(); i++) {
            Hyperlink link = hyperlinks.get(i);
            String ref = CellRefs.cell(link.getRow(), link.getCol());
            List<String> attributes = new ArrayList<>(List.of("ref", ref));
            if (link.isInternal()) {
                attributes.add("location");
                attributes.add(link.location());
            } else {
                attributes.add("r:id");
                attributes.add(plan.getHyperlinkRelIds().get(i));
            }
            if (!link.getTooltip().isEmpty()) {
                attributes.add("tooltip");
                attributes.add(link.getTooltip());
            }
            writer.emptyTag("hyperlink", toArray(attributes));
        }
        writer.endTag("hyperlinks");
    }

    private void writeHeaderFooter(XmlWriter writer) {
        String header = pictureCodes(worksheet.getHeader());
        String footer = pictureCodes(worksheet.getFooter());
        if (header.isEmpty() && footer.isEmpty()) {
            return;
        }
        writer.startTag("headerFooter");
        if (!header.isEmpty()) {
            writer.stringElement("oddHeader", header);
        }
        if (!footer.isEmpty()) {
            writer.stringElement("oddFooter", footer);
        }
        writer.endTag("headerFooter");
    }

    // "&[Picture]" is the user facing placeholder for Excel's "&G" code.
    private static String pictureCodes(String text) {
        return text.replace("&[Picture]", "&G");
    }

    private static String[] toArray(List<String> attributes) {
        return attributes.toArray(new String[0]);
    }
}
