package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.DocProperties;

/**
 * Renders {@code docProps/core.xml}.
 */
public class CorePropertiesRenderer implements PartRenderer {
    private final DocProperties properties;

    public CorePropertiesRenderer(DocProperties properties) {
        this.properties = properties;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("cp:coreProperties",
                "xmlns:cp", "http://schemas.openxmlformats.org/package/2006/metadata/core-properties",
                "xmlns:dc", "http://purl.org/dc/elements/1.1/",
                "xmlns:dcterms", "http://purl.org/dc/terms/",
                "xmlns:dcmitype", "http://purl.org/dc/dcmitype/",
                "xmlns:xsi", "http://www.w3.org/2001/XMLSchema-instance");

        optional(writer, "dc:title", properties.getTitle());
        optional(writer, "dc:subject", properties.getSubject());
        writer.dataElement("dc:creator", properties.getAuthor());
        optional(writer, "cp:keywords", properties.getKeywords());
        optional(writer, "dc:description", properties.getComment());
        writer.dataElement("cp:lastModifiedBy", properties.getAuthor());

        String created = properties.creationTimeW3c();
        writer.dataElement("dcterms:created", created, "xsi:type", "dcterms:W3CDTF");
        writer.dataElement("dcterms:modified", created, "xsi:type", "dcterms:W3CDTF");

        optional(writer, "cp:category", properties.getCategory());
        optional(writer, "cp:contentStatus", properties.getStatus());
        return writer.endTag("cp:coreProperties").toString();
    }

    private static void optional(XmlWriter writer, String tag, String value) {
        if (!value.isEmpty()) {
            writer.dataElement(tag, value);
        }
    }
}
