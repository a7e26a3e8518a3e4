package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.Border;
import com.example.demo.xlsxgen.model.CellValue;
import com.example.demo.xlsxgen.model.Color;
import com.example.demo.xlsxgen.model.Fill;
import com.example.demo.xlsxgen.model.Font;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.model.FormatBorder;
import com.example.demo.xlsxgen.model.FormatPattern;
import com.example.demo.xlsxgen.model.FormatUnderline;
import com.example.demo.xlsxgen.service.FormatRegistry;
import com.example.demo.xlsxgen.service.XfRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code xl/styles.xml} from a prepared {@link FormatRegistry}.
 */
public class StylesRenderer implements PartRenderer {
    private final FormatRegistry registry;

    public StylesRenderer(FormatRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("styleSheet", "xmlns", WorkbookRenderer.XMLNS_MAIN);

        writeNumFormats(writer);
        writeFonts(writer);
        writeFills(writer);
        writeBorders(writer);
        writeCellStyleXfs(writer);
        writeCellXfs(writer);
        writeCellStyles(writer);

        writer.emptyTag("dxfs", "count", "0");
        writer.emptyTag("tableStyles", "count", "0", "defaultTableStyle", "TableStyleMedium9",
                "defaultPivotStyle", "PivotStyleLight16");
        return writer.endTag("styleSheet").toString();
    }

    private void writeNumFormats(XmlWriter writer) {
        List<String> numFormats = registry.getNumFormats();
        if (numFormats.isEmpty()) {
            return;
        }
        writer.startTag("numFmts", "count", Integer.toString(numFormats.size()));
        for (int i = 0; i < numFormats.size(); i++) {
            writer.emptyTag("numFmt",
                    "numFmtId", Integer.toString(FormatRegistry.FIRST_CUSTOM_NUM_FORMAT + i),
                    "formatCode", numFormats.get(i));
        }
        writer.endTag("numFmts");
    }

    private void writeFonts(XmlWriter writer) {
        List<Font> fonts = registry.getFonts();
        writer.startTag("fonts", "count", Integer.toString(fonts.size()));
        for (Font font : fonts) {
            writer.startTag("font");
            if (font.isBold()) {
                writer.emptyTag("b");
            }
            if (font.isItalic()) {
                writer.emptyTag("i");
            }
            if (font.isStrikethrough()) {
                writer.emptyTag("strike");
            }
            if (font.getUnderline() == FormatUnderline.SINGLE) {
                writer.emptyTag("u");
            } else if (font.getUnderline() != FormatUnderline.NONE) {
                writer.emptyTag("u", "val", font.getUnderline().xmlName());
            }
            writer.emptyTag("sz", "val", CellValue.formatNumber(font.getSize()));
            if (font.getColor().isSet()) {
                writeColor(writer, "color", font.getColor());
            } else {
                writer.emptyTag("color", "theme", "1");
            }
            writer.emptyTag("name", "val", font.getName());
            writer.emptyTag("family", "val", Integer.toString(font.getFamily()));
            if (!font.getScheme().isEmpty()) {
                writer.emptyTag("scheme", "val", font.getScheme());
            }
            writer.endTag("font");
        }
        writer.endTag("fonts");
    }

    private void writeFills(XmlWriter writer) {
        List<Fill> fills = registry.getFills();
        writer.startTag("fills", "count", Integer.toString(fills.size()));
        for (Fill fill : fills) {
            writer.startTag("fill");
            FormatPattern pattern = fill.getPattern();
            if (pattern == FormatPattern.NONE || pattern == FormatPattern.GRAY125) {
                writer.emptyTag("patternFill", "patternType", pattern.xmlName());
            } else {
                writer.startTag("patternFill", "patternType", pattern.xmlName());
                if (fill.getForegroundColor().isSet()) {
                    writeColor(writer, "fgColor", fill.getForegroundColor());
                }
                if (fill.getBackgroundColor().isSet()) {
                    writeColor(writer, "bgColor", fill.getBackgroundColor());
                } else {
                    writer.emptyTag("bgColor", "indexed", "64");
                }
                writer.endTag("patternFill");
            }
            writer.endTag("fill");
        }
        writer.endTag("fills");
    }

    private void writeBorders(XmlWriter writer) {
        List<Border> borders = registry.getBorders();
        writer.startTag("borders", "count", Integer.toString(borders.size()));
        for (Border border : borders) {
            writer.startTag("border");
            writeBorderSide(writer, "left", border.getLeft(), border.getLeftColor());
            writeBorderSide(writer, "right", border.getRight(), border.getRightColor());
            writeBorderSide(writer, "top", border.getTop(), border.getTopColor());
            writeBorderSide(writer, "bottom", border.getBottom(), border.getBottomColor());
            writer.emptyTag("diagonal");
            writer.endTag("border");
        }
        writer.endTag("borders");
    }

    private static void writeBorderSide(XmlWriter writer, String side, FormatBorder style, Color color) {
        if (style == FormatBorder.NONE) {
            writer.emptyTag(side);
            return;
        }
        writer.startTag(side, "style", style.xmlName());
        if (color.isSet()) {
            writeColor(writer, "color", color);
        } else {
            writer.emptyTag("color", "auto", "1");
        }
        writer.endTag(side);
    }

    private void writeCellStyleXfs(XmlWriter writer) {
        boolean hyperlink = registry.isHasHyperlinkStyle();
        writer.startTag("cellStyleXfs", "count", hyperlink ? "2" : "1");
        writer.emptyTag("xf", "numFmtId", "0", "fontId", "0", "fillId", "0", "borderId", "0");
        if (hyperlink) {
            XfRecord record = registry.getXfRecords().get(FormatRegistry.HYPERLINK_INDEX);
            writer.startTag("xf", "numFmtId", "0", "fontId", Integer.toString(record.getFontIndex()),
                    "fillId", "0", "borderId", "0", "applyNumberFormat", "0", "applyFill", "0",
                    "applyBorder", "0", "applyAlignment", "0", "applyProtection", "0");
            writer.emptyTag("alignment", "vertical", "top");
            writer.emptyTag("protection", "locked", "0");
            writer.endTag("xf");
        }
        writer.endTag("cellStyleXfs");
    }

    private void writeCellXfs(XmlWriter writer) {
        List<XfRecord> records = registry.getXfRecords();
        writer.startTag("cellXfs", "count", Integer.toString(records.size()));
        for (XfRecord record : records) {
            Format format = record.getFormat();
            List<String> attributes = new ArrayList<>();
            add(attributes, "numFmtId", Integer.toString(record.getNumFmtId()));
            add(attributes, "fontId", Integer.toString(record.getFontIndex()));
            add(attributes, "fillId", Integer.toString(record.getFillIndex()));
            add(attributes, "borderId", Integer.toString(record.getBorderIndex()));
            add(attributes, "xfId", format.isHyperlink() ? "1" : "0");
            if (format.isQuotePrefix()) {
                add(attributes, "quotePrefix", "1");
            }
            if (record.getNumFmtId() > 0) {
                add(attributes, "applyNumberFormat", "1");
            }
            if (record.getFontIndex() > 0 && !format.isHyperlink()) {
                add(attributes, "applyFont", "1");
            }
            if (record.getFillIndex() > 0) {
                add(attributes, "applyFill", "1");
            }
            if (record.getBorderIndex() > 0) {
                add(attributes, "applyBorder", "1");
            }
            if (format.hasAlignment()) {
                add(attributes, "applyAlignment", "1");
            }
            if (format.hasProtection()) {
                add(attributes, "applyProtection", "1");
            }

            String[] xfAttributes = attributes.toArray(new String[0]);
            if (!format.hasAlignment() && !format.hasProtection()) {
                writer.emptyTag("xf", xfAttributes);
                continue;
            }
            writer.startTag("xf", xfAttributes);
            if (format.hasAlignment()) {
                writeAlignment(writer, format);
            }
            if (format.hasProtection()) {
                writer.emptyTag("protection", "locked", format.isLocked() ? "1" : "0",
                        "hidden", format.isHidden() ? "1" : "0");
            }
            writer.endTag("xf");
        }
        writer.endTag("cellXfs");
    }

    private static void writeAlignment(XmlWriter writer, Format format) {
        List<String> attributes = new ArrayList<>();
        if (format.getHorizontalAlign().horizontal() != null) {
            add(attributes, "horizontal", format.getHorizontalAlign().horizontal());
        }
        if (format.getVerticalAlign().vertical() != null) {
            add(attributes, "vertical", format.getVerticalAlign().vertical());
        }
        if (format.getIndent() != 0) {
            add(attributes, "indent", Integer.toString(format.getIndent()));
        }
        if (format.getRotation() != 0) {
            add(attributes, "textRotation", Integer.toString(format.getRotation()));
        }
        if (format.isTextWrap()) {
            add(attributes, "wrapText", "1");
        }
        if (format.isShrink()) {
            add(attributes, "shrinkToFit", "1");
        }
        writer.emptyTag("alignment", attributes.toArray(new String[0]));
    }

    private void writeCellStyles(XmlWriter writer) {
        boolean hyperlink = registry.isHasHyperlinkStyle();
        writer.startTag("cellStyles", "count", hyperlink ? "2" : "1");
        if (hyperlink) {
            writer.emptyTag("cellStyle", "name", "Hyperlink", "xfId", "1", "builtinId", "8");
        }
        writer.emptyTag("cellStyle", "name", "Normal", "xfId", "0", "builtinId", "0");
        writer.endTag("cellStyles");
    }

    private static void writeColor(XmlWriter writer, String tag, Color color) {
        switch (color.getKind()) {
            case THEME:
                writer.emptyTag(tag, "theme", Integer.toString(color.getValue()));
                break;
            case AUTOMATIC:
                writer.emptyTag(tag, "auto", "1");
                break;
            default:
                writer.emptyTag(tag, "rgb", color.argbHex());
                break;
        }
    }

    private static void add(List<String> attributes, String name, String value) {
        attributes.add(name);
        attributes.add(value);
    }
}
