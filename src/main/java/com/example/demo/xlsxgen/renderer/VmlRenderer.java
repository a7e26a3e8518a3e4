package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.HeaderImagePosition;
import com.example.demo.xlsxgen.model.Image;

import java.util.List;
import java.util.Map;

/**
 * Renders {@code xl/drawings/vmlDrawingN.vml}, the legacy drawing that holds
 * header and footer images. Shape ids follow Excel's numbering of 1024
 * shapes per drawing.
 */
public class VmlRenderer implements PartRenderer {
    private static final String[] SHAPE_FORMULAS = {
        "if lineDrawn pixelLineWidth 0",
        "sum @0 1 0",
        "sum 0 0 @1",
        "prod @2 1 2",
        "prod @3 21600 pixelWidth",
        "prod @3 21600 pixelHeight",
        "sum @0 0 1",
        "prod @6 1 2",
        "prod @7 21600 pixelWidth",
        "sum @8 21600 0",
        "prod @7 21600 pixelHeight",
        "sum @10 21600 0",
    };

    private final int vmlNumber;
    private final Map<HeaderImagePosition, Image> images;
    private final List<String> relIds;
    private final List<Integer> mediaNumbers;

    /**
     * @param relIds       relationship ids parallel to the iteration order of {@code images}
     * @param mediaNumbers media part numbers parallel to the iteration order of {@code images}
     */
    public VmlRenderer(int vmlNumber, Map<HeaderImagePosition, Image> images, List<String> relIds,
                       List<Integer> mediaNumbers) {
        this.vmlNumber = vmlNumber;
        this.images = images;
        this.relIds = relIds;
        this.mediaNumbers = mediaNumbers;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter();
        writer.startTag("xml", "xmlns:v", "urn:schemas-microsoft-com:vml",
                "xmlns:o", "urn:schemas-microsoft-com:office:office",
                "xmlns:x", "urn:schemas-microsoft-com:office:excel");
        writer.startTag("o:shapelayout", "v:ext", "edit");
        writer.emptyTag("o:idmap", "v:ext", "edit", "data", Integer.toString(vmlNumber));
        writer.endTag("o:shapelayout");

        writer.startTag("v:shapetype", "id", "_x0000_t75", "coordsize", "21600,21600", "o:spt", "75",
                "o:preferrelative", "t", "path", "m@4@5l@4@11@9@11@9@5xe", "filled", "f", "stroked", "f");
        writer.emptyTag("v:stroke", "joinstyle", "miter");
        writer.startTag("v:formulas");
        for (String formula : SHAPE_FORMULAS) {
            writer.emptyTag("v:f", "eqn", formula);
        }
        writer.endTag("v:formulas");
        writer.emptyTag("v:path", "o:extrusionok", "f", "gradientshapeok", "t", "o:connecttype", "rect");
        writer.emptyTag("o:lock", "v:ext", "edit", "aspectratio", "t");
        writer.endTag("v:shapetype");

        int shapeId = vmlNumber * 1024 + 1;
        int i = 0;
        for (Map.Entry<HeaderImagePosition, Image> entry : images.entrySet()) {
            Image image = entry.getValue();
            String style = "position:absolute;margin-left:0;margin-top:0;"
                    + "width:" + points(image.getWidth()) + "pt;height:" + points(image.getHeight()) + "pt;"
                    + "z-index:" + (i + 1);
            writer.startTag("v:shape", "id", entry.getKey().code(), "o:spid", "_x0000_s" + shapeId,
                    "type", "#_x0000_t75", "style", style);
            writer.emptyTag("v:imagedata", "o:relid", relIds.get(i), "o:title", "image" + mediaNumbers.get(i));
            writer.emptyTag("o:lock", "v:ext", "edit", "rotation", "t");
            writer.endTag("v:shape");
            shapeId++;
            i++;
        }
        return writer.endTag("xml").toString();
    }

    private static String points(int pixels) {
        double points = pixels * 0.75;
        return points == Math.rint(points) ? Long.toString((long) points) : Double.toString(points);
    }
}
