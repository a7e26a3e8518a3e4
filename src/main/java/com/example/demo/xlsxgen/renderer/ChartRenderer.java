package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.Chart;
import com.example.demo.xlsxgen.model.ChartRange;
import com.example.demo.xlsxgen.model.ChartSeries;
import com.example.demo.xlsxgen.model.ChartSeriesCacheData;
import com.example.demo.xlsxgen.model.ChartTitle;
import com.example.demo.xlsxgen.model.ChartType;

import java.util.List;

/**
 * Renders {@code xl/charts/chartN.xml}. Every worksheet reference is written
 * with the literal values cached for it by the chart cache stitcher.
 */
public class ChartRenderer implements PartRenderer {
    static final String CATEGORY_AXIS_ID = "50010001";
    static final String VALUE_AXIS_ID = "50010002";

    private final Chart chart;

    public ChartRenderer(Chart chart) {
        this.chart = chart;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("c:chartSpace", "xmlns:c", DrawingRenderer.XMLNS_C, "xmlns:a", DrawingRenderer.XMLNS_A,
                "xmlns:r", WorkbookRenderer.XMLNS_R);
        writer.emptyTag("c:lang", "val", "en-US");
        writer.startTag("c:chart");
        if (chart.getTitle().isSet()) {
            writeTitle(writer, chart.getTitle());
        }
        writer.startTag("c:plotArea");
        writer.emptyTag("c:layout");
        writeChartGroup(writer);
        if (chart.getType().hasAxes()) {
            writeAxes(writer);
        }
        writer.endTag("c:plotArea");
        writer.startTag("c:legend");
        writer.emptyTag("c:legendPos", "val", "r");
        writer.emptyTag("c:overlay", "val", "0");
        writer.endTag("c:legend");
        writer.emptyTag("c:plotVisOnly", "val", "1");
        writer.endTag("c:chart");
        return writer.endTag("c:chartSpace").toString();
    }

    private void writeChartGroup(XmlWriter writer) {
        ChartType type = chart.getType();
        writer.startTag(type.element());
        switch (type) {
            case BAR:
            case COLUMN:
                writer.emptyTag("c:barDir", "val", type.barDirection());
                writer.emptyTag("c:grouping", "val", "clustered");
                break;
            case AREA:
            case LINE:
                writer.emptyTag("c:grouping", "val", "standard");
                break;
            case SCATTER:
                writer.emptyTag("c:scatterStyle", "val", "lineMarker");
                writer.emptyTag("c:varyColors", "val", "0");
                break;
            default:
                writer.emptyTag("c:varyColors", "val", "1");
                break;
        }

        List<ChartSeries> series = chart.getSeries();
        for (int i = 0; i < series.size(); i++) {
            writeSeries(writer, series.get(i), i);
        }

        switch (type) {
            case LINE:
                writer.emptyTag("c:marker", "val", "1");
                break;
            case PIE:
                writer.emptyTag("c:firstSliceAng", "val", "0");
                break;
            case DOUGHNUT:
                writer.emptyTag("c:firstSliceAng", "val", "0");
                writer.emptyTag("c:holeSize", "val", "50");
                break;
            default:
                break;
        }
        if (type.hasAxes()) {
            writer.emptyTag("c:axId", "val", CATEGORY_AXIS_ID);
            writer.emptyTag("c:axId", "val", VALUE_AXIS_ID);
        }
        writer.endTag(type.element());
    }

    private void writeSeries(XmlWriter writer, ChartSeries series, int index) {
        boolean scatter = chart.getType() == ChartType.SCATTER;
        writer.startTag("c:ser");
        writer.emptyTag("c:idx", "val", Integer.toString(index));
        writer.emptyTag("c:order", "val", Integer.toString(index));
        if (series.getName().isSet()) {
            writeSeriesName(writer, series.getName());
        }
        if (chart.getType() == ChartType.BAR || chart.getType() == ChartType.COLUMN) {
            writer.emptyTag("c:invertIfNegative", "val", "0");
        }
        if (!series.getCustomDataLabels().isEmpty()) {
            writeDataLabels(writer, series.getCustomDataLabels());
        }
        if (series.getCategories().hasData() || !series.getCategories().getFormula().isEmpty()) {
            writer.startTag(scatter ? "c:xVal" : "c:cat");
            writeCategoryReference(writer, series.getCategories());
            writer.endTag(scatter ? "c:xVal" : "c:cat");
        }
        writer.startTag(scatter ? "c:yVal" : "c:val");
        writeNumberReference(writer, series.getValues());
        writer.endTag(scatter ? "c:yVal" : "c:val");
        if (scatter) {
            writer.emptyTag("c:smooth", "val", "0");
        }
        writer.endTag("c:ser");
    }

    private static void writeSeriesName(XmlWriter writer, ChartTitle name) {
        writer.startTag("c:tx");
        if (name.getRange().hasData()) {
            writeStringReference(writer, name.getRange());
        } else {
            writer.dataElement("c:v", name.getText());
        }
        writer.endTag("c:tx");
    }

    // Points with an unset label keep the default label.
    private static void writeDataLabels(XmlWriter writer, List<ChartTitle> labels) {
        writer.startTag("c:dLbls");
        for (int i = 0; i < labels.size(); i++) {
            ChartTitle label = labels.get(i);
            if (!label.isSet()) {
                continue;
            }
            writer.startTag("c:dLbl");
            writer.emptyTag("c:idx", "val", Integer.toString(i));
            writer.emptyTag("c:layout");
            writer.startTag("c:tx");
            if (label.getRange().hasData()) {
                writeStringReference(writer, label.getRange());
            } else {
                writeRichText(writer, label.getText());
            }
            writer.endTag("c:tx");
            writeShowFlags(writer);
            writer.endTag("c:dLbl");
        }
        writeShowFlags(writer);
        writer.endTag("c:dLbls");
    }

    private static void writeShowFlags(XmlWriter writer) {
        writer.emptyTag("c:showLegendKey", "val", "0");
        writer.emptyTag("c:showVal", "val", "1");
        writer.emptyTag("c:showCatName", "val", "0");
        writer.emptyTag("c:showSerName", "val", "0");
        writer.emptyTag("c:showPercent", "val", "0");
        writer.emptyTag("c:showBubbleSize", "val", "0");
    }

    private static void writeCategoryReference(XmlWriter writer, ChartRange range) {
        ChartSeriesCacheData cache = range.getCacheData();
        if (!cache.isEmpty() && cache.isNumeric()) {
            writeNumberReference(writer, range);
        } else {
            writeStringReference(writer, range);
        }
    }

    private static void writeNumberReference(XmlWriter writer, ChartRange range) {
        ChartSeriesCacheData cache = range.getCacheData();
        writer.startTag("c:numRef");
        writer.dataElement("c:f", range.getFormula());
        if (!cache.isEmpty()) {
            writer.startTag("c:numCache");
            writer.dataElement("c:formatCode", "General");
            writer.emptyTag("c:ptCount", "val", Integer.toString(cache.getData().size()));
            List<String> data = cache.getData();
            for (int i = 0; i < data.size(); i++) {
                if (isNumber(data.get(i))) {
                    writer.startTag("c:pt", "idx", Integer.toString(i));
                    writer.dataElement("c:v", data.get(i));
                    writer.endTag("c:pt");
                }
            }
            writer.endTag("c:numCache");
        }
        writer.endTag("c:numRef");
    }

    private static void writeStringReference(XmlWriter writer, ChartRange range) {
        ChartSeriesCacheData cache = range.getCacheData();
        writer.startTag("c:strRef");
        writer.dataElement("c:f", range.getFormula());
        if (!cache.isEmpty()) {
            writer.startTag("c:strCache");
            writer.emptyTag("c:ptCount", "val", Integer.toString(cache.getData().size()));
            List<String> data = cache.getData();
            for (int i = 0; i < data.size(); i++) {
                if (!data.get(i).isEmpty()) {
                    writer.startTag("c:pt", "idx", Integer.toString(i));
                    writer.dataElement("c:v", data.get(i));
                    writer.endTag("c:pt");
                }
            }
            writer.endTag("c:strCache");
        }
        writer.endTag("c:strRef");
    }

    private static void writeTitle(XmlWriter writer, ChartTitle title) {
        writer.startTag("c:title");
        writer.startTag("c:tx");
        if (title.getRange().hasData()) {
            writeStringReference(writer, title.getRange());
        } else {
            writeRichText(writer, title.getText());
        }
        writer.endTag("c:tx");
        writer.emptyTag("c:overlay", "val", "0");
        writer.endTag("c:title");
    }

    private static void writeRichText(XmlWriter writer, String text) {
        writer.startTag("c:rich");
        writer.emptyTag("a:bodyPr");
        writer.emptyTag("a:lstStyle");
        writer.startTag("a:p");
        writer.startTag("a:r");
        writer.dataElement("a:t", text);
        writer.endTag("a:r");
        writer.endTag("a:p");
        writer.endTag("c:rich");
    }

    private void writeAxes(XmlWriter writer) {
        boolean horizontalBars = chart.getType() == ChartType.BAR;
        String categoryPosition = horizontalBars ? "l" : "b";
        String valuePosition = horizontalBars ? "b" : "l";

        if (chart.getType() == ChartType.SCATTER) {
            writeValueAxis(writer, CATEGORY_AXIS_ID, VALUE_AXIS_ID, categoryPosition, chart.getXAxisTitle(), false);
        } else {
            writer.startTag("c:catAx");
            writer.emptyTag("c:axId", "val", CATEGORY_AXIS_ID);
            writeScaling(writer);
            writer.emptyTag("c:delete", "val", "0");
            writer.emptyTag("c:axPos", "val", categoryPosition);
            if (chart.getXAxisTitle().isSet()) {
                writeTitle(writer, chart.getXAxisTitle());
            }
            writer.emptyTag("c:tickLblPos", "val", "nextTo");
            writer.emptyTag("c:crossAx", "val", VALUE_AXIS_ID);
            writer.emptyTag("c:crosses", "val", "autoZero");
            writer.emptyTag("c:auto", "val", "1");
            writer.emptyTag("c:lblAlgn", "val", "ctr");
            writer.emptyTag("c:lblOffset", "val", "100");
            writer.endTag("c:catAx");
        }
        writeValueAxis(writer, VALUE_AXIS_ID, CATEGORY_AXIS_ID, valuePosition, chart.getYAxisTitle(), true);
    }

    private void writeValueAxis(XmlWriter writer, String axisId, String crossAxisId, String position,
                                ChartTitle title, boolean gridlines) {
        writer.startTag("c:valAx");
        writer.emptyTag("c:axId", "val", axisId);
        writeScaling(writer);
        writer.emptyTag("c:delete", "val", "0");
        writer.emptyTag("c:axPos", "val", position);
        if (gridlines) {
            writer.emptyTag("c:majorGridlines");
        }
        if (title.isSet()) {
            writeTitle(writer, title);
        }
        writer.emptyTag("c:numFmt", "formatCode", "General", "sourceLinked", "1");
        writer.emptyTag("c:tickLblPos", "val", "nextTo");
        writer.emptyTag("c:crossAx", "val", crossAxisId);
        writer.emptyTag("c:crosses", "val", "autoZero");
        writer.emptyTag("c:crossBetween", "val", chart.getType() == ChartType.SCATTER ? "midCat" : "between");
        writer.endTag("c:valAx");
    }

    private static void writeScaling(XmlWriter writer) {
        writer.startTag("c:scaling");
        writer.emptyTag("c:orientation", "val", "minMax");
        writer.endTag("c:scaling");
    }

    private static boolean isNumber(String value) {
        if (value.isEmpty()) {
            return false;
        }
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
