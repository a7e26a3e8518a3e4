package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.CustomProperty;

import java.util.List;

/**
 * Renders {@code docProps/custom.xml}. Property ids start at 2, as in files
 * saved by Excel.
 */
public class CustomPropertiesRenderer implements PartRenderer {
    private static final String FMTID = "{D5CDD505-2E9C-101B-9397-08002B2CF9AE}";

    private final List<CustomProperty> properties;

    public CustomPropertiesRenderer(List<CustomProperty> properties) {
        this.properties = properties;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("Properties",
                "xmlns", "http://schemas.openxmlformats.org/officeDocument/2006/custom-properties",
                "xmlns:vt", "http://schemas.openxmlformats.org/officeDocument/2006/docPropsVTypes");
        int pid = 2;
        for (CustomProperty property : properties) {
            writer.startTag("property", "fmtid", FMTID, "pid", Integer.toString(pid++), "name", property.getName());
            writer.dataElement("vt:" + property.getKind().variantType(), property.getValue());
            writer.endTag("property");
        }
        return writer.endTag("Properties").toString();
    }
}
