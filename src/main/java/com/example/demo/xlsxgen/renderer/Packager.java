package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.exception.SheetNameReusedException;
import com.example.demo.xlsxgen.exception.TableNameReusedException;
import com.example.demo.xlsxgen.model.Chart;
import com.example.demo.xlsxgen.model.DefinedName;
import com.example.demo.xlsxgen.model.DrawingObject;
import com.example.demo.xlsxgen.model.Image;
import com.example.demo.xlsxgen.model.Table;
import com.example.demo.xlsxgen.service.FormatRegistry;
import com.example.demo.xlsxgen.util.IndexedTable;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Turns a prepared workbook into the parts of an xlsx package and writes
 * them as zip entries.
 *
 * {@link #prepare()} validates the workbook and assigns every part number
 * and relationship id without touching the output. {@link #assemble} then
 * renders and writes the parts in a fixed order. Entries carry a constant
 * timestamp, so the same workbook always produces the same bytes.
 */
@Slf4j
public class Packager {
    static final LocalDateTime ZIP_ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    private final PackageManifest manifest;
    private final List<Worksheet> worksheets;
    private final FormatRegistry registry;
    private final List<DefinedName> definedNames;
    private final int compressionLevel;

    private final ContentTypes contentTypes = new ContentTypes();
    private final List<SheetPlan> sheetPlans = new ArrayList<>();
    private final IndexedTable<String> mediaDigests = new IndexedTable<>(1);
    private final List<Image> mediaImages = new ArrayList<>();
    private final List<String> partNames = new ArrayList<>();
    private boolean prepared;

    public Packager(PackageManifest manifest, List<Worksheet> worksheets, FormatRegistry registry,
                    List<DefinedName> definedNames, int compressionLevel) {
        this.manifest = manifest;
        this.worksheets = worksheets;
        this.registry = registry;
        this.definedNames = definedNames;
        this.compressionLevel = compressionLevel;
    }

    /**
     * Validates names and plans the package layout.
     *
     * @throws SheetNameReusedException when two worksheets share a name
     * @throws TableNameReusedException when two tables share a name, ignoring case
     */
    public void prepare() {
        validateSheetNames();
        validateTableNames();
        planParts();
        prepared = true;
    }

    private void validateSheetNames() {
        Set<String> seen = new HashSet<>();
        for (Worksheet worksheet : worksheets) {
            if (!seen.add(worksheet.getName())) {
                throw new SheetNameReusedException(worksheet.getName());
            }
        }
    }

    private void validateTableNames() {
        Set<String> seen = new HashSet<>();
        int tableId = 0;
        for (Worksheet worksheet : worksheets) {
            for (Table table : worksheet.getTables()) {
                tableId++;
                String name = table.resolvedName(tableId);
                if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                    throw new TableNameReusedException(name);
                }
            }
        }
    }

    private void planParts() {
        int chartNumber = 0;
        int drawingNumber = 0;
        int vmlNumber = 0;
        int tableNumber = 0;

        for (int i = 0; i < worksheets.size(); i++) {
            Worksheet worksheet = worksheets.get(i);
            SheetPlan plan = new SheetPlan(i + 1);
            Relationships rels = plan.getSheetRelationships();
            contentTypes.addWorksheet(plan.getSheetNumber());

            worksheet.getHyperlinks().forEach(link -> plan.getHyperlinkRelIds().add(
                    link.isInternal() ? null : rels.addExternalRelationship("/hyperlink", link.getUrl())));

            if (worksheet.hasDrawing()) {
                drawingNumber++;
                plan.setDrawingNumber(drawingNumber);
                plan.setDrawingRelId(rels.addDocumentRelationship("/drawing",
                        "../drawings/drawing" + drawingNumber + ".xml"));
                contentTypes.addDrawing(drawingNumber);
                for (DrawingObject object : worksheet.getDrawingObjects()) {
                    String relId;
                    if (object.isChart()) {
                        chartNumber++;
                        plan.getChartNumbers().add(chartNumber);
                        contentTypes.addChart(chartNumber);
                        relId = plan.getDrawingRelationships().addDocumentRelationship("/chart",
                                "../charts/chart" + chartNumber + ".xml");
                    } else {
                        relId = plan.getDrawingRelationships().addDocumentRelationship("/image",
                                mediaTarget(object.getImage()));
                    }
                    plan.getDrawingObjectRelIds().add(relId);
                }
            }

            if (worksheet.hasHeaderFooterImages()) {
                vmlNumber++;
                plan.setVmlNumber(vmlNumber);
                plan.setVmlRelId(rels.addDocumentRelationship("/vmlDrawing",
                        "../drawings/vmlDrawing" + vmlNumber + ".vml"));
                contentTypes.addDefault("vml", ContentTypes.VML_DRAWING);
                for (Image image : worksheet.getHeaderImages().values()) {
                    plan.getHeaderImageRelIds().add(
                            plan.getVmlRelationships().addDocumentRelationship("/image", mediaTarget(image)));
                    plan.getHeaderImageMediaNumbers().add(mediaDigests.indexOf(image.getDigest()));
                }
            }

            for (int t = 0; t < worksheet.getTables().size(); t++) {
                tableNumber++;
                plan.getTableNumbers().add(tableNumber);
                plan.getTableRelIds().add(rels.addDocumentRelationship("/table",
                        "../tables/table" + tableNumber + ".xml"));
                contentTypes.addTable(tableNumber);
            }
            sheetPlans.add(plan);
        }

        if (manifest.isHasSharedStrings()) {
            contentTypes.addSharedStrings();
        }
        if (manifest.isHasDynamicArrays()) {
            contentTypes.addMetadata();
        }
        if (manifest.hasCustomProperties()) {
            contentTypes.addCustomProperties();
        }

        log.debug("Planned package: {} worksheets, {} drawings, {} charts, {} tables, {} media files",
                worksheets.size(), drawingNumber, chartNumber, tableNumber, mediaImages.size());
    }

    // Identical image bytes share one media part.
    private String mediaTarget(Image image) {
        boolean known = mediaDigests.contains(image.getDigest());
        int number = mediaDigests.indexOf(image.getDigest());
        if (!known) {
            mediaImages.add(image);
            contentTypes.addDefault(image.getType().extension(), image.getType().contentType());
        }
        return "../media/image" + number + "." + image.getType().extension();
    }

    /**
     * Writes every part to the stream. The stream is finished as a zip
     * archive but not closed.
     */
    public void assemble(OutputStream out) throws IOException {
        if (!prepared) {
            throw new IllegalStateException("Packager.prepare() must run before assemble()");
        }
        ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8);
        zip.setLevel(compressionLevel);

        writePart(zip, "[Content_Types].xml", contentTypes);
        writePart(zip, "_rels/.rels", rootRelationships());
        writePart(zip, "docProps/app.xml", new AppPropertiesRenderer(manifest));
        writePart(zip, "docProps/core.xml", new CorePropertiesRenderer(manifest.getProperties()));
        if (manifest.hasCustomProperties()) {
            writePart(zip, "docProps/custom.xml",
                    new CustomPropertiesRenderer(manifest.getProperties().getCustomProperties()));
        }

        writePart(zip, "xl/workbook.xml", new WorkbookRenderer(worksheets, definedNames,
                manifest.getActiveTab(), manifest.getFirstSheet(), manifest.isReadOnlyRecommended()));
        writePart(zip, "xl/_rels/workbook.xml.rels", workbookRelationships());

        SharedStringTable sharedStrings = new SharedStringTable();
        for (int i = 0; i < worksheets.size(); i++) {
            SheetPlan plan = sheetPlans.get(i);
            String sheetPart = "sheet" + plan.getSheetNumber() + ".xml";
            writePart(zip, "xl/worksheets/" + sheetPart, new WorksheetRenderer(worksheets.get(i), sharedStrings, plan));
            if (!plan.getSheetRelationships().isEmpty()) {
                writePart(zip, "xl/worksheets/_rels/" + sheetPart + ".rels", plan.getSheetRelationships());
            }
        }

        writeDrawings(zip);
        writeHeaderFooterDrawings(zip);
        writeTables(zip);
        writeMedia(zip);

        writePart(zip, "xl/styles.xml", new StylesRenderer(registry));
        writePart(zip, "xl/theme/theme1.xml", new ThemeRenderer());
        if (manifest.isHasSharedStrings()) {
            writePart(zip, "xl/sharedStrings.xml", sharedStrings);
        }
        if (manifest.isHasDynamicArrays()) {
            writePart(zip, "xl/metadata.xml", new MetadataRenderer());
        }
        zip.finish();
        log.debug("Wrote {} package parts", partNames.size());
    }

    private void writeDrawings(ZipOutputStream zip) throws IOException {
        for (int i = 0; i < worksheets.size(); i++) {
            SheetPlan plan = sheetPlans.get(i);
            if (!plan.hasDrawing()) {
                continue;
            }
            List<DrawingObject> objects = worksheets.get(i).getDrawingObjects();
            String drawingPart = "drawing" + plan.getDrawingNumber() + ".xml";
            writePart(zip, "xl/drawings/" + drawingPart, new DrawingRenderer(objects, plan.getDrawingObjectRelIds()));
            writePart(zip, "xl/drawings/_rels/" + drawingPart + ".rels", plan.getDrawingRelationships());

            int chart = 0;
            for (DrawingObject object : objects) {
                if (object.isChart()) {
                    Chart model = object.getChart();
                    writePart(zip, "xl/charts/chart" + plan.getChartNumbers().get(chart) + ".xml",
                            new ChartRenderer(model));
                    chart++;
                }
            }
        }
    }

    private void writeHeaderFooterDrawings(ZipOutputStream zip) throws IOException {
        for (int i = 0; i < worksheets.size(); i++) {
            SheetPlan plan = sheetPlans.get(i);
            if (!plan.hasVml()) {
                continue;
            }
            String vmlPart = "vmlDrawing" + plan.getVmlNumber() + ".vml";
            writePart(zip, "xl/drawings/" + vmlPart, new VmlRenderer(plan.getVmlNumber(),
                    worksheets.get(i).getHeaderImages(), plan.getHeaderImageRelIds(),
                    plan.getHeaderImageMediaNumbers()));
            writePart(zip, "xl/drawings/_rels/" + vmlPart + ".rels", plan.getVmlRelationships());
        }
    }

    private void writeTables(ZipOutputStream zip) throws IOException {
        for (int i = 0; i < worksheets.size(); i++) {
            SheetPlan plan = sheetPlans.get(i);
            List<Table> tables = worksheets.get(i).getTables();
            for (int t = 0; t < tables.size(); t++) {
                int tableNumber = plan.getTableNumbers().get(t);
                writePart(zip, "xl/tables/table" + tableNumber + ".xml", new TableRenderer(tables.get(t), tableNumber));
            }
        }
    }

    private void writeMedia(ZipOutputStream zip) throws IOException {
        for (int i = 0; i < mediaImages.size(); i++) {
            Image image = mediaImages.get(i);
            writeEntry(zip, "xl/media/image" + (i + 1) + "." + image.getType().extension(), image.getData());
        }
    }

    private Relationships rootRelationships() {
        Relationships rels = new Relationships();
        rels.addDocumentRelationship("/officeDocument", "xl/workbook.xml");
        rels.addPackageRelationship("/metadata/core-properties", "docProps/core.xml");
        rels.addDocumentRelationship("/extended-properties", "docProps/app.xml");
        if (manifest.hasCustomProperties()) {
            rels.addDocumentRelationship("/custom-properties", "docProps/custom.xml");
        }
        return rels;
    }

    private Relationships workbookRelationships() {
        Relationships rels = new Relationships();
        for (SheetPlan plan : sheetPlans) {
            rels.addDocumentRelationship("/worksheet", "worksheets/sheet" + plan.getSheetNumber() + ".xml");
        }
        rels.addDocumentRelationship("/theme", "theme/theme1.xml");
        rels.addDocumentRelationship("/styles", "styles.xml");
        if (manifest.isHasSharedStrings()) {
            rels.addDocumentRelationship("/sharedStrings", "sharedStrings.xml");
        }
        if (manifest.isHasDynamicArrays()) {
            rels.addDocumentRelationship("/sheetMetadata", "metadata.xml");
        }
        return rels;
    }

    private void writePart(ZipOutputStream zip, String name, PartRenderer renderer) throws IOException {
        writeEntry(zip, name, renderer.render().getBytes(StandardCharsets.UTF_8));
    }

    private void writeEntry(ZipOutputStream zip, String name, byte[] data) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTimeLocal(ZIP_ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(data);
        zip.closeEntry();
        partNames.add(name);
        log.debug("Wrote part {} ({} bytes)", name, data.length);
    }

    public ContentTypes getContentTypes() {
        return contentTypes;
    }

    /**
     * Zip entry names in write order.
     */
    public List<String> getPartNames() {
        return Collections.unmodifiableList(partNames);
    }

    /**
     * Number of distinct images stored under {@code xl/media}.
     */
    public int getMediaCount() {
        return mediaImages.size();
    }
}
