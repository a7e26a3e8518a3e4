package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.DrawingObject;

import java.util.List;

/**
 * Renders {@code xl/drawings/drawingN.xml}: one two-cell anchor per chart
 * or image, in insertion order. Anchors are computed against the default
 * column width (64px) and row height (20px).
 */
public class DrawingRenderer implements PartRenderer {
    static final String XMLNS_XDR = "http://schemas.openxmlformats.org/drawingml/2006/spreadsheetDrawing";
    static final String XMLNS_A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    static final String XMLNS_C = "http://schemas.openxmlformats.org/drawingml/2006/chart";

    static final int DEFAULT_COL_PIXELS = 64;
    static final int DEFAULT_ROW_PIXELS = 20;
    static final int EMU_PER_PIXEL = 9525;

    private final List<DrawingObject> objects;
    private final List<String> relIds;

    public DrawingRenderer(List<DrawingObject> objects, List<String> relIds) {
        this.objects = objects;
        this.relIds = relIds;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("xdr:wsDr", "xmlns:xdr", XMLNS_XDR, "xmlns:a", XMLNS_A);
        int chartCount = 0;
        int imageCount = 0;
        for (int i = 0; i < objects.size(); i++) {
            DrawingObject object = objects.get(i);
            int shapeId = i + 2;
            writer.startTag("xdr:twoCellAnchor", "editAs", "oneCell");
            writeMarker(writer, "xdr:from", object.getCol() * DEFAULT_COL_PIXELS, object.getRow() * DEFAULT_ROW_PIXELS);
            writeMarker(writer, "xdr:to",
                    object.getCol() * DEFAULT_COL_PIXELS + object.widthPixels(),
                    object.getRow() * DEFAULT_ROW_PIXELS + object.heightPixels());
            if (object.isChart()) {
                chartCount++;
                writeGraphicFrame(writer, shapeId, "Chart " + chartCount, relIds.get(i));
            } else {
                imageCount++;
                writePicture(writer, shapeId, "Picture " + imageCount, relIds.get(i), object);
            }
            writer.emptyTag("xdr:clientData");
            writer.endTag("xdr:twoCellAnchor");
        }
        return writer.endTag("xdr:wsDr").toString();
    }

    private static void writeMarker(XmlWriter writer, String tag, int xPixels, int yPixels) {
        writer.startTag(tag);
        writer.dataElement("xdr:col", Integer.toString(xPixels / DEFAULT_COL_PIXELS));
        writer.dataElement("xdr:colOff", Long.toString((long) (xPixels % DEFAULT_COL_PIXELS) * EMU_PER_PIXEL));
        writer.dataElement("xdr:row", Integer.toString(yPixels / DEFAULT_ROW_PIXELS));
        writer.dataElement("xdr:rowOff", Long.toString((long) (yPixels % DEFAULT_ROW_PIXELS) * EMU_PER_PIXEL));
        writer.endTag(tag);
    }

    private static void writeGraphicFrame(XmlWriter writer, int shapeId, String name, String relId) {
        writer.startTag("xdr:graphicFrame", "macro", "");
        writer.startTag("xdr:nvGraphicFramePr");
        writer.emptyTag("xdr:cNvPr", "id", Integer.toString(shapeId), "name", name);
        writer.emptyTag("xdr:cNvGraphicFramePr");
        writer.endTag("xdr:nvGraphicFramePr");
        writer.startTag("xdr:xfrm");
        writer.emptyTag("a:off", "x", "0", "y", "0");
        writer.emptyTag("a:ext", "cx", "0", "cy", "0");
        writer.endTag("xdr:xfrm");
        writer.startTag("a:graphic");
        writer.startTag("a:graphicData", "uri", XMLNS_C);
        writer.emptyTag("c:chart", "xmlns:c", XMLNS_C, "xmlns:r", WorkbookRenderer.XMLNS_R, "r:id", relId);
        writer.endTag("a:graphicData");
        writer.endTag("a:graphic");
        writer.endTag("xdr:graphicFrame");
    }

    private static void writePicture(XmlWriter writer, int shapeId, String name, String relId, DrawingObject object) {
        writer.startTag("xdr:pic");
        writer.startTag("xdr:nvPicPr");
        writer.emptyTag("xdr:cNvPr", "id", Integer.toString(shapeId), "name", name);
        writer.startTag("xdr:cNvPicPr");
        writer.emptyTag("a:picLocks", "noChangeAspect", "1");
        writer.endTag("xdr:cNvPicPr");
        writer.endTag("xdr:nvPicPr");
        writer.startTag("xdr:blipFill");
        writer.emptyTag("a:blip", "xmlns:r", WorkbookRenderer.XMLNS_R, "r:embed", relId);
        writer.startTag("a:stretch");
        writer.emptyTag("a:fillRect");
        writer.endTag("a:stretch");
        writer.endTag("xdr:blipFill");
        writer.startTag("xdr:spPr");
        writer.startTag("a:xfrm");
        writer.emptyTag("a:off",
                "x", Long.toString((long) object.getCol() * DEFAULT_COL_PIXELS * EMU_PER_PIXEL),
                "y", Long.toString((long) object.getRow() * DEFAULT_ROW_PIXELS * EMU_PER_PIXEL));
        writer.emptyTag("a:ext",
                "cx", Long.toString((long) object.widthPixels() * EMU_PER_PIXEL),
                "cy", Long.toString((long) object.heightPixels() * EMU_PER_PIXEL));
        writer.endTag("a:xfrm");
        writer.startTag("a:prstGeom", "prst", "rect");
        writer.emptyTag("a:avLst");
        writer.endTag("a:prstGeom");
        writer.endTag("xdr:spPr");
        writer.endTag("xdr:pic");
    }
}
