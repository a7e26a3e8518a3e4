package com.example.demo.xlsxgen.renderer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code [Content_Types].xml} manifest. Parts are covered either by a
 * default for their file extension or by an override for their exact name.
 */
public class ContentTypes implements PartRenderer {
    static final String SPREADSHEETML = "application/vnd.openxmlformats-officedocument.spreadsheetml.";
    static final String OFFICE_DOCUMENT = "application/vnd.openxmlformats-officedocument.";

    public static final String WORKBOOK = SPREADSHEETML + "sheet.main+xml";
    public static final String WORKSHEET = SPREADSHEETML + "worksheet+xml";
    public static final String STYLES = SPREADSHEETML + "styles+xml";
    public static final String THEME = OFFICE_DOCUMENT + "theme+xml";
    public static final String APP_PROPERTIES = OFFICE_DOCUMENT + "extended-properties+xml";
    public static final String CORE_PROPERTIES = "application/vnd.openxmlformats-package.core-properties+xml";
    public static final String SHARED_STRINGS = SPREADSHEETML + "sharedStrings+xml";
    public static final String TABLE = SPREADSHEETML + "table+xml";
    public static final String METADATA = SPREADSHEETML + "sheetMetadata+xml";
    public static final String DRAWING = OFFICE_DOCUMENT + "drawing+xml";
    public static final String CHART = OFFICE_DOCUMENT + "drawingml.chart+xml";
    public static final String VML_DRAWING = OFFICE_DOCUMENT + "vmlDrawing";
    public static final String CUSTOM_PROPERTIES = OFFICE_DOCUMENT + "custom-properties+xml";

    private final Map<String, String> defaults = new LinkedHashMap<>();
    private final List<String[]> overrides = new ArrayList<>();

    public ContentTypes() {
        defaults.put("rels", "application/vnd.openxmlformats-package.relationships+xml");
        defaults.put("xml", "application/xml");

        addOverride("/docProps/app.xml", APP_PROPERTIES);
        addOverride("/docProps/core.xml", CORE_PROPERTIES);
        addOverride("/xl/styles.xml", STYLES);
        addOverride("/xl/theme/theme1.xml", THEME);
        addOverride("/xl/workbook.xml", WORKBOOK);
    }

    /**
     * Registers an extension default once; later calls for the same
     * extension are ignored.
     */
    public void addDefault(String extension, String contentType) {
        defaults.putIfAbsent(extension, contentType);
    }

    public void addOverride(String partName, String contentType) {
        overrides.add(new String[] {partName, contentType});
    }

    public void addWorksheet(int index) {
        addOverride("/xl/worksheets/sheet" + index + ".xml", WORKSHEET);
    }

    public void addDrawing(int index) {
        addOverride("/xl/drawings/drawing" + index + ".xml", DRAWING);
    }

    public void addChart(int index) {
        addOverride("/xl/charts/chart" + index + ".xml", CHART);
    }

    public void addTable(int index) {
        addOverride("/xl/tables/table" + index + ".xml", TABLE);
    }

    public void addSharedStrings() {
        addOverride("/xl/sharedStrings.xml", SHARED_STRINGS);
    }

    public void addMetadata() {
        addOverride("/xl/metadata.xml", METADATA);
    }

    public void addCustomProperties() {
        addOverride("/docProps/custom.xml", CUSTOM_PROPERTIES);
    }

    /**
     * Whether a part at the given path has a content type entry. Every
     * {@code .xml} part needs its own override; the generic {@code xml}
     * default is not a valid type for any part of a spreadsheet package.
     */
    public boolean covers(String partPath) {
        return contentTypeOf(partPath) != null;
    }

    /**
     * Content type a reader resolves for the part, or {@code null} when the
     * part is not covered.
     */
    public String contentTypeOf(String partPath) {
        String partName = partPath.startsWith("/") ? partPath : "/" + partPath;
        for (String[] override : overrides) {
            if (override[0].equals(partName)) {
                return override[1];
            }
        }
        int dot = partName.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        String extension = partName.substring(dot + 1);
        if (extension.equals("xml")) {
            return null;
        }
        return defaults.get(extension);
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("Types", "xmlns", "http://schemas.openxmlformats.org/package/2006/content-types");
        for (Map.Entry<String, String> entry : defaults.entrySet()) {
            writer.emptyTag("Default", "Extension", entry.getKey(), "ContentType", entry.getValue());
        }
        for (String[] override : overrides) {
            writer.emptyTag("Override", "PartName", override[0], "ContentType", override[1]);
        }
        return writer.endTag("Types").toString();
    }
}
