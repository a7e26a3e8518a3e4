package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.DocProperties;

/**
 * Renders {@code docProps/app.xml}: application name, part titles and the
 * company/manager fields.
 */
public class AppPropertiesRenderer implements PartRenderer {
    private static final String XMLNS = "http://schemas.openxmlformats.org/officeDocument/2006/extended-properties";
    private static final String XMLNS_VT = "http://schemas.openxmlformats.org/officeDocument/2006/docPropsVTypes";

    private final PackageManifest manifest;

    public AppPropertiesRenderer(PackageManifest manifest) {
        this.manifest = manifest;
    }

    @Override
    public String render() {
        DocProperties properties = manifest.getProperties();
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("Properties", "xmlns", XMLNS, "xmlns:vt", XMLNS_VT);
        writer.dataElement("Application", manifest.getApplicationName());
        writer.dataElement("DocSecurity", Integer.toString(manifest.getDocSecurity()));
        writer.dataElement("ScaleCrop", "false");

        writeHeadingPairs(writer);
        writeTitlesOfParts(writer);

        if (!properties.getManager().isEmpty()) {
            writer.dataElement("Manager", properties.getManager());
        }
        writer.dataElement("Company", properties.getCompany());
        writer.dataElement("LinksUpToDate", "false");
        writer.dataElement("SharedDoc", "false");
        if (!properties.getHyperlinkBase().isEmpty()) {
            writer.dataElement("HyperlinkBase", properties.getHyperlinkBase());
        }
        writer.dataElement("HyperlinksChanged", "false");
        writer.dataElement("AppVersion", manifest.getAppVersion());
        return writer.endTag("Properties").toString();
    }

    private void writeHeadingPairs(XmlWriter writer) {
        boolean hasNames = !manifest.getDefinedNames().isEmpty();
        writer.startTag("HeadingPairs");
        writer.startTag("vt:vector", "size", hasNames ? "4" : "2", "baseType", "variant");
        writeHeadingPair(writer, "Worksheets", manifest.getNumWorksheets());
        if (hasNames) {
            writeHeadingPair(writer, "Named Ranges", manifest.getDefinedNames().size());
        }
        writer.endTag("vt:vector");
        writer.endTag("HeadingPairs");
    }

    private static void writeHeadingPair(XmlWriter writer, String heading, int count) {
        writer.startTag("vt:variant").dataElement("vt:lpstr", heading).endTag("vt:variant");
        writer.startTag("vt:variant").dataElement("vt:i4", Integer.toString(count)).endTag("vt:variant");
    }

    private void writeTitlesOfParts(XmlWriter writer) {
        int size = manifest.getWorksheetNames().size() + manifest.getDefinedNames().size();
        writer.startTag("TitlesOfParts");
        writer.startTag("vt:vector", "size", Integer.toString(size), "baseType", "lpstr");
        for (String name : manifest.getWorksheetNames()) {
            writer.dataElement("vt:lpstr", name);
        }
        for (String name : manifest.getDefinedNames()) {
            writer.dataElement("vt:lpstr", name);
        }
        writer.endTag("vt:vector");
        writer.endTag("TitlesOfParts");
    }
}
