package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.core.Workbook;
import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.model.Chart;
import com.example.demo.xlsxgen.model.ChartType;
import com.example.demo.xlsxgen.model.CustomProperty;
import com.example.demo.xlsxgen.model.DocProperties;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.model.HeaderImagePosition;
import com.example.demo.xlsxgen.model.Image;
import com.example.demo.xlsxgen.model.Table;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Package assembly")
public class PackagerTest {

    private static final Pattern RELATIONSHIP_REFERENCE = Pattern.compile("r:(?:id|embed)=\"(rId\\d+)\"|o:relid=\"(rId\\d+)\"");

    private Workbook workbook;

    /**
     * Minimal PNG: signature plus an IHDR chunk carrying the size.
     */
    static byte[] png(int width, int height) {
        ByteBuffer buffer = ByteBuffer.allocate(33);
        buffer.put(new byte[] {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'});
        buffer.putInt(13);
        buffer.put("IHDR".getBytes(StandardCharsets.US_ASCII));
        buffer.putInt(width);
        buffer.putInt(height);
        buffer.put(new byte[] {8, 6, 0, 0, 0});
        buffer.putInt(0);
        return buffer.array();
    }

    private static Map<String, byte[]> unzip(byte[] bytes) throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                assertFalse(entries.containsKey(entry.getName()), "Part written twice: " + entry.getName());
                entries.put(entry.getName(), zip.readAllBytes());
            }
        }
        return entries;
    }

    private static String expectedContentType(String partName) {
        Map<String, String> byPattern = new LinkedHashMap<>();
        byPattern.put("xl/workbook\\.xml", ContentTypes.WORKBOOK);
        byPattern.put("xl/worksheets/sheet\\d+\\.xml", ContentTypes.WORKSHEET);
        byPattern.put("xl/styles\\.xml", ContentTypes.STYLES);
        byPattern.put("xl/theme/theme1\\.xml", ContentTypes.THEME);
        byPattern.put("xl/sharedStrings\\.xml", ContentTypes.SHARED_STRINGS);
        byPattern.put("xl/metadata\\.xml", ContentTypes.METADATA);
        byPattern.put("xl/drawings/drawing\\d+\\.xml", ContentTypes.DRAWING);
        byPattern.put("xl/charts/chart\\d+\\.xml", ContentTypes.CHART);
        byPattern.put("xl/tables/table\\d+\\.xml", ContentTypes.TABLE);
        byPattern.put("docProps/app\\.xml", ContentTypes.APP_PROPERTIES);
        byPattern.put("docProps/core\\.xml", ContentTypes.CORE_PROPERTIES);
        byPattern.put("docProps/custom\\.xml", ContentTypes.CUSTOM_PROPERTIES);
        for (Map.Entry<String, String> entry : byPattern.entrySet()) {
            if (partName.matches(entry.getKey())) {
                return entry.getValue();
            }
        }
        return fail("Unexpected xml part " + partName);
    }

    private static Document parse(byte[] xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    }

    @BeforeEach
    void setup() {
        workbook = new Workbook();
        DocProperties properties = new DocProperties();
        properties.setTitle("Quarterly report");
        properties.setAuthor("Finance");
        properties.setCreationTime(Instant.parse("2024-03-01T08:00:00Z"));
        properties.addCustomProperty(CustomProperty.text("Checked by", "Audit"));
        properties.addCustomProperty(CustomProperty.integer("Revision", 3));
        workbook.setProperties(properties);

        Image logo = Image.fromBytes(png(120, 40));

        Worksheet data = workbook.addWorksheet().setName("Data");
        data.writeString(0, 0, "Region", new Format().withBold());
        data.writeString(0, 1, "Sales", new Format().withBold());
        String[] regions = {"North", "South", "East", "West"};
        for (int i = 0; i < regions.length; i++) {
            data.writeString(i + 1, 0, regions[i]);
            data.writeNumber(i + 1, 1, (i + 1) * 100, new Format().withNumFormat("$#,##0"));
        }
        data.writeDynamicFormula(6, 0, "=SORT(B2:B5)");
        data.writeUrl(8, 0, "https://example.com/report");
        data.writeUrl(9, 0, "internal:Charts!A1", "Go to charts", null);
        data.autofilter(0, 0, 4, 1);
        data.setPrintArea(0, 0, 9, 3);
        data.setRepeatRows(0, 0);
        data.setColumnWidth(0, 20);
        data.setHeader("&C&[Picture]");
        data.setHeaderImage(logo, HeaderImagePosition.CENTER_HEADER);
        data.insertImage(12, 0, logo);

        Worksheet charts = workbook.addWorksheet().setName("Charts");
        Chart column = new Chart(ChartType.COLUMN).setTitle("Sales by region");
        column.addSeries()
                .setName("=Data!$B$1")
                .setCategories("=Data!$A$2:$A$5")
                .setValues("=Data!$B$2:$B$5")
                .addCustomDataLabel("Top");
        charts.insertChart(0, 0, column);
        Chart pie = new Chart(ChartType.DOUGHNUT);
        pie.addSeries().setCategories("=Data!$A$2:$A$5").setValues("=Data!$B$2:$B$5");
        charts.insertChart(0, 8, pie);
        charts.insertImage(20, 0, logo);

        Worksheet people = workbook.addWorksheet().setName("People");
        people.addTable(0, 0, 3, 1, new Table().setColumnHeaders(List.of("Name", "Age")));
        people.addTable(5, 0, 8, 1, new Table().setName("Staff").setAutofilter(false));
        workbook.defineName("Exchange_rate", "=0.96");
        workbook.readOnlyRecommended();
    }

    @Test
    @DisplayName("Parts are written in the fixed package order")
    void partOrder() throws Exception {
        List<String> names = new ArrayList<>(unzip(workbook.saveToBuffer()).keySet());

        assertEquals(List.of(
                "[Content_Types].xml",
                "_rels/.rels",
                "docProps/app.xml",
                "docProps/core.xml",
                "docProps/custom.xml",
                "xl/workbook.xml",
                "xl/_rels/workbook.xml.rels",
                "xl/worksheets/sheet1.xml",
                "xl/worksheets/_rels/sheet1.xml.rels",
                "xl/worksheets/sheet2.xml",
                "xl/worksheets/_rels/sheet2.xml.rels",
                "xl/worksheets/sheet3.xml",
                "xl/worksheets/_rels/sheet3.xml.rels",
                "xl/drawings/drawing1.xml",
                "xl/drawings/_rels/drawing1.xml.rels",
                "xl/drawings/drawing2.xml",
                "xl/drawings/_rels/drawing2.xml.rels",
                "xl/charts/chart1.xml",
                "xl/charts/chart2.xml",
                "xl/drawings/vmlDrawing1.vml",
                "xl/drawings/_rels/vmlDrawing1.vml.rels",
                "xl/tables/table1.xml",
                "xl/tables/table2.xml",
                "xl/media/image1.png",
                "xl/styles.xml",
                "xl/theme/theme1.xml",
                "xl/sharedStrings.xml",
                "xl/metadata.xml"), names);
    }

    @Test
    @DisplayName("Every part has a content type and every relationship target exists")
    void contentTypesAndRelationshipsAreComplete() throws Exception {
        Map<String, byte[]> parts = unzip(workbook.saveToBuffer());

        Document types = parse(parts.get("[Content_Types].xml"));
        Map<String, String> defaults = new HashMap<>();
        NodeList defaultNodes = types.getElementsByTagNameNS("*", "Default");
        for (int i = 0; i < defaultNodes.getLength(); i++) {
            Element element = (Element) defaultNodes.item(i);
            defaults.put(element.getAttribute("Extension"), element.getAttribute("ContentType"));
        }
        Map<String, String> overrides = new HashMap<>();
        NodeList overrideNodes = types.getElementsByTagNameNS("*", "Override");
        for (int i = 0; i < overrideNodes.getLength(); i++) {
            Element element = (Element) overrideNodes.item(i);
            String partName = element.getAttribute("PartName");
            overrides.put(partName, element.getAttribute("ContentType"));
            assertTrue(parts.containsKey(partName.substring(1)), "Override for a missing part: " + partName);
        }

        for (String name : parts.keySet()) {
            if (name.equals("[Content_Types].xml")) {
                continue;
            }
            if (name.endsWith(".xml")) {
                assertEquals(expectedContentType(name), overrides.get("/" + name), "Content type of " + name);
                continue;
            }
            String extension = name.substring(name.lastIndexOf('.') + 1);
            assertTrue(overrides.containsKey("/" + name) || defaults.containsKey(extension),
                    "No content type for " + name);
        }

        for (Map.Entry<String, byte[]> part : parts.entrySet()) {
            if (!part.getKey().endsWith(".rels")) {
                continue;
            }
            String source = part.getKey().replace("_rels/", "").replaceAll("\\.rels$", "");
            Set<String> ids = new HashSet<>();
            NodeList relationships = parse(part.getValue()).getElementsByTagNameNS("*", "Relationship");
            for (int i = 0; i < relationships.getLength(); i++) {
                Element relationship = (Element) relationships.item(i);
                assertEquals("rId" + (i + 1), relationship.getAttribute("Id"));
                ids.add(relationship.getAttribute("Id"));
                if ("External".equals(relationship.getAttribute("TargetMode"))) {
                    continue;
                }
                String target = URI.create("/" + source).resolve(relationship.getAttribute("Target")).getPath();
                if (source.isEmpty()) {
                    target = "/" + relationship.getAttribute("Target");
                }
                assertTrue(parts.containsKey(target.substring(1)),
                        part.getKey() + " points at missing part " + target);
            }

            byte[] sourcePart = parts.get(source);
            if (sourcePart != null) {
                Matcher matcher = RELATIONSHIP_REFERENCE.matcher(new String(sourcePart, StandardCharsets.UTF_8));
                while (matcher.find()) {
                    String id = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                    assertTrue(ids.contains(id), source + " references unknown relationship " + id);
                }
            }
        }
    }

    @Test
    @DisplayName("Identical images are stored once")
    void imagesDeduplicated() throws Exception {
        Map<String, byte[]> parts = unzip(workbook.saveToBuffer());

        long media = parts.keySet().stream().filter(name -> name.startsWith("xl/media/")).count();
        assertEquals(1, media);
        String types = new String(parts.get("[Content_Types].xml"), StandardCharsets.UTF_8);
        assertTrue(types.contains("<Default Extension=\"png\" ContentType=\"image/png\"/>"));
        assertTrue(types.contains("<Default Extension=\"vml\""));
    }

    @Test
    @DisplayName("Worksheet relationships list hyperlinks, drawing, header drawing and tables in that order")
    void worksheetRelationshipOrder() throws Exception {
        Map<String, byte[]> parts = unzip(workbook.saveToBuffer());

        String rels = new String(parts.get("xl/worksheets/_rels/sheet1.xml.rels"), StandardCharsets.UTF_8);
        assertTrue(rels.indexOf("https://example.com/report") < rels.indexOf("drawing1.xml"));
        assertTrue(rels.indexOf("drawing1.xml") < rels.indexOf("vmlDrawing1.vml"));

        String sheet = new String(parts.get("xl/worksheets/sheet1.xml"), StandardCharsets.UTF_8);
        assertTrue(sheet.contains("<hyperlink ref=\"A9\" r:id=\"rId1\"/>"));
        assertTrue(sheet.contains("<hyperlink ref=\"A10\" location=\"Charts!A1\"/>"));
        assertTrue(sheet.contains("<drawing r:id=\"rId2\"/>"));
        assertTrue(sheet.contains("<legacyDrawingHF r:id=\"rId3\"/>"));
        assertTrue(sheet.contains("<oddHeader>&amp;C&amp;G</oddHeader>"));
        assertTrue(sheet.contains("cm=\"1\""));
    }

    @Test
    @DisplayName("Chart parts carry the cached worksheet values")
    void chartCaches() throws Exception {
        Map<String, byte[]> parts = unzip(workbook.saveToBuffer());

        String chart = new String(parts.get("xl/charts/chart1.xml"), StandardCharsets.UTF_8);
        assertTrue(chart.contains("<c:f>Data!$B$2:$B$5</c:f><c:numCache>"));
        assertTrue(chart.contains("<c:pt idx=\"3\"><c:v>400</c:v></c:pt>"));
        assertTrue(chart.contains("<c:strCache><c:ptCount val=\"4\"/><c:pt idx=\"0\"><c:v>North</c:v>"));
        assertTrue(chart.contains("<c:barDir val=\"col\"/>"));
        assertTrue(chart.contains("<a:t>Top</a:t>"));

        String doughnut = new String(parts.get("xl/charts/chart2.xml"), StandardCharsets.UTF_8);
        assertTrue(doughnut.contains("<c:holeSize val=\"50\"/>"));
        assertFalse(doughnut.contains("c:catAx"));
    }

    @Test
    @DisplayName("Workbook part carries structural names and the read-only hint")
    void workbookPart() throws Exception {
        Map<String, byte[]> parts = unzip(workbook.saveToBuffer());

        String xml = new String(parts.get("xl/workbook.xml"), StandardCharsets.UTF_8);
        assertTrue(xml.contains("<fileSharing readOnlyRecommended=\"1\"/>"));
        assertTrue(xml.contains("<definedName name=\"_xlnm._FilterDatabase\" localSheetId=\"0\" hidden=\"1\">Data!$A$1:$B$5</definedName>"));
        assertTrue(xml.contains("<definedName name=\"_xlnm.Print_Titles\" localSheetId=\"0\">Data!$1:$1</definedName>"));
        assertTrue(xml.contains("<definedName name=\"Exchange_rate\">0.96</definedName>"));

        String app = new String(parts.get("docProps/app.xml"), StandardCharsets.UTF_8);
        assertTrue(app.contains("<DocSecurity>2</DocSecurity>"));
        assertTrue(app.contains("<vt:lpstr>Data!Print_Area</vt:lpstr>"));
    }

    @Test
    @DisplayName("The assembled package opens in POI")
    void packageReadableByPoi() throws Exception {
        byte[] bytes = workbook.saveToBuffer();

        try (XSSFWorkbook reopened = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertEquals(3, reopened.getNumberOfSheets());
            assertEquals("Quarterly report", reopened.getProperties().getCoreProperties().getTitle());
            assertEquals("Audit", reopened.getProperties().getCustomProperties().getProperty("Checked by").getLpwstr());
            assertEquals(2, reopened.getSheet("People").getTables().size());
            assertEquals("Staff", reopened.getSheet("People").getTables().get(1).getName());
            assertEquals(2, reopened.getSheet("Charts").getDrawingPatriarch().getCharts().size());
            assertEquals(1, reopened.getAllPictures().size());
        }
    }
}
