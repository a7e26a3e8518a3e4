package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.Table;
import com.example.demo.xlsxgen.model.TableColumn;
import com.example.demo.xlsxgen.model.TableFunction;
import com.example.demo.xlsxgen.util.CellRefs;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code xl/tables/tableN.xml}.
 */
public class TableRenderer implements PartRenderer {
    private final Table table;
    private final int tableId;

    public TableRenderer(Table table, int tableId) {
        this.table = table;
        this.tableId = tableId;
    }

    @Override
    public String render() {
        String name = table.resolvedName(tableId);
        String ref = CellRefs.range(table.getFirstRow(), table.getFirstCol(), table.getLastRow(), table.getLastCol());

        List<String> attributes = new ArrayList<>(List.of("xmlns", WorkbookRenderer.XMLNS_MAIN,
                "id", Integer.toString(tableId), "name", name, "displayName", name, "ref", ref));
        if (!table.isHeaderRow()) {
            attributes.addAll(List.of("headerRowCount", "0"));
        }
        if (table.isTotalRow()) {
            attributes.addAll(List.of("totalsRowCount", "1"));
        } else {
            attributes.addAll(List.of("totalsRowShown", "0"));
        }

        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("table", attributes.toArray(new String[0]));
        // The filter covers the header and data rows only.
        if (table.isHeaderRow() && table.isAutofilter()) {
            writer.emptyTag("autoFilter", "ref", CellRefs.range(table.getFirstRow(), table.getFirstCol(),
                    table.lastDataRow(), table.getLastCol()));
        }

        writer.startTag("tableColumns", "count", Integer.toString(table.columnCount()));
        for (int i = 0; i < table.columnCount(); i++) {
            writeColumn(writer, i);
        }
        writer.endTag("tableColumns");

        writer.emptyTag("tableStyleInfo", "name", table.getStyleName(),
                "showFirstColumn", flag(table.isFirstColumn()),
                "showLastColumn", flag(table.isLastColumn()),
                "showRowStripes", flag(table.isBandedRows()),
                "showColumnStripes", flag(table.isBandedColumns()));
        return writer.endTag("table").toString();
    }

    private void writeColumn(XmlWriter writer, int index) {
        TableColumn column = table.column(index);
        List<String> attributes = new ArrayList<>(List.of("id", Integer.toString(index + 1),
                "name", table.columnHeader(index)));
        if (table.isTotalRow()) {
            if (!column.getTotalLabel().isEmpty()) {
                attributes.addAll(List.of("totalsRowLabel", column.getTotalLabel()));
            } else if (column.getTotalFunction() != TableFunction.NONE) {
                attributes.addAll(List.of("totalsRowFunction", column.getTotalFunction().xmlName()));
            }
        }
        String[] columnAttributes = attributes.toArray(new String[0]);
        if (!column.hasFormula()) {
            writer.emptyTag("tableColumn", columnAttributes);
            return;
        }
        writer.startTag("tableColumn", columnAttributes);
        writer.dataElement("calculatedColumnFormula", column.getFormula());
        writer.endTag("tableColumn");
    }

    private static String flag(boolean value) {
        return value ? "1" : "0";
    }
}
