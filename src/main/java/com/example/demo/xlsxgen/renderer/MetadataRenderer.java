package com.example.demo.xlsxgen.renderer;

/**
 * Renders {@code xl/metadata.xml}, which flags dynamic array formulas.
 * Cells refer to its single cell metadata record with {@code cm="1"}.
 */
public class MetadataRenderer implements PartRenderer {

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("metadata",
                "xmlns", WorkbookRenderer.XMLNS_MAIN,
                "xmlns:xda", "http://schemas.microsoft.com/office/spreadsheetml/2017/dynamicarray");
        writer.startTag("metadataTypes", "count", "1");
        writer.emptyTag("metadataType", "name", "XLDAPR", "minSupportedVersion", "120000",
                "copy", "1", "pasteAll", "1", "pasteValues", "1", "merge", "1", "splitFirst", "1",
                "rowColShift", "1", "clearFormats", "1", "clearComments", "1", "assign", "1",
                "coerce", "1", "cellMeta", "1");
        writer.endTag("metadataTypes");
        writer.startTag("futureMetadata", "name", "XLDAPR", "count", "1");
        writer.startTag("bk").startTag("extLst");
        writer.startTag("ext", "uri", "{bdbb8cdc-fa1e-496e-a857-3c3f30c029c3}");
        writer.emptyTag("xda:dynamicArrayProperties", "fDynamic", "1", "fCollapsed", "0");
        writer.endTag("ext").endTag("extLst").endTag("bk");
        writer.endTag("futureMetadata");
        writer.startTag("cellMetadata", "count", "1");
        writer.startTag("bk").emptyTag("rc", "t", "1", "v", "0").endTag("bk");
        writer.endTag("cellMetadata");
        return writer.endTag("metadata").toString();
    }
}
