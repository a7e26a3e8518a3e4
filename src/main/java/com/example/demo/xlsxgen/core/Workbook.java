package com.example.demo.xlsxgen.core;

import com.example.demo.xlsxgen.config.PackagerProperties;
import com.example.demo.xlsxgen.exception.PackageWriteException;
import com.example.demo.xlsxgen.exception.ParameterException;
import com.example.demo.xlsxgen.exception.UnknownWorksheetException;
import com.example.demo.xlsxgen.model.DefinedName;
import com.example.demo.xlsxgen.model.DocProperties;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.renderer.PackageManifest;
import com.example.demo.xlsxgen.renderer.Packager;
import com.example.demo.xlsxgen.service.ChartCacheStitcher;
import com.example.demo.xlsxgen.service.DefinedNameResolver;
import com.example.demo.xlsxgen.service.FormatRegistry;
import com.example.demo.xlsxgen.service.ResolvedNames;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The spreadsheet document. Owns its worksheets, the format registry and
 * the defined names, and drives the save pipeline:
 *
 * <ol>
 *   <li>reset state derived by the previous save</li>
 *   <li>translate every worksheet's local formats to global indices</li>
 *   <li>resolve defined names</li>
 *   <li>fill chart caches</li>
 *   <li>derive the package manifest and validate names</li>
 *   <li>write the package</li>
 * </ol>
 *
 * Nothing is written to the target until every validation step has passed.
 * A workbook is not safe for use by more than one thread.
 */
@Slf4j
public class Workbook {
    private final List<Worksheet> worksheets = new ArrayList<>();
    private final FormatRegistry formatRegistry = new FormatRegistry();
    private final DefinedNameResolver nameResolver = new DefinedNameResolver();
    private final ChartCacheStitcher chartCacheStitcher = new ChartCacheStitcher();
    private final List<DefinedName> userDefinedNames = new ArrayList<>();
    private final PackagerProperties packagerProperties;

    private List<DefinedName> definedNames = Collections.emptyList();
    private DocProperties properties = new DocProperties();
    private boolean readOnlyRecommended;

    public Workbook() {
        this(new PackagerProperties());
    }

    public Workbook(PackagerProperties packagerProperties) {
        this.packagerProperties = packagerProperties;
    }

    // -----------------------------------------------------------------------
    // Worksheets.
    // -----------------------------------------------------------------------

    /**
     * Adds a worksheet named {@code SheetN}, N being its 1-based position.
     */
    public Worksheet addWorksheet() {
        Worksheet worksheet = new Worksheet("Sheet" + (worksheets.size() + 1));
        worksheets.add(worksheet);
        return worksheet;
    }

    /**
     * Adds a worksheet built independently of the workbook. Unnamed
     * worksheets get the default {@code SheetN} name.
     */
    public Worksheet pushWorksheet(Worksheet worksheet) {
        if (worksheet.getName() == null) {
            worksheet.setName("Sheet" + (worksheets.size() + 1));
        }
        worksheets.add(worksheet);
        return worksheet;
    }

    public Worksheet worksheetFromIndex(int index) {
        if (index < 0 || index >= worksheets.size()) {
            throw new UnknownWorksheetException("Worksheet index " + index + " is out of range, workbook has "
                    + worksheets.size() + " worksheets");
        }
        return worksheets.get(index);
    }

    public Worksheet worksheetFromName(String name) {
        return findWorksheet(name)
                .orElseThrow(() -> new UnknownWorksheetException("Unknown worksheet name '" + name + "'"));
    }

    Optional<Worksheet> findWorksheet(String name) {
        for (Worksheet worksheet : worksheets) {
            if (worksheet.getName().equals(name)) {
                return Optional.of(worksheet);
            }
        }
        return Optional.empty();
    }

    public List<Worksheet> getWorksheets() {
        return Collections.unmodifiableList(worksheets);
    }

    // -----------------------------------------------------------------------
    // Workbook level settings.
    // -----------------------------------------------------------------------

    /**
     * Defines a workbook name such as {@code Exchange_rate}, or a worksheet
     * local name such as {@code Sheet2!Sales}. The name is validated
     * immediately; the sheet of a local name is checked at save time.
     */
    public Workbook defineName(String name, String formula) {
        userDefinedNames.add(nameResolver.parse(name, formula));
        return this;
    }

    public Workbook setProperties(DocProperties properties) {
        if (properties == null) {
            throw new ParameterException("Document properties cannot be null");
        }
        this.properties = properties.copy();
        return this;
    }

    public DocProperties getProperties() {
        return properties;
    }

    /**
     * Asks Excel to suggest opening the file read-only.
     */
    public Workbook readOnlyRecommended() {
        this.readOnlyRecommended = true;
        return this;
    }

    /**
     * Registers a format with the workbook's format registry and returns its
     * global index. The registry is rebuilt on every save, so the index is
     * only meaningful until then.
     */
    public int registerFormat(Format format) {
        return formatRegistry.register(format);
    }

    /**
     * Defined names in the order of the last save.
     */
    public List<DefinedName> getDefinedNames() {
        return definedNames;
    }

    FormatRegistry getFormatRegistry() {
        return formatRegistry;
    }

    // -----------------------------------------------------------------------
    // Saving.
    // -----------------------------------------------------------------------

    public void save(Path path) {
        Packager packager = prepare();
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            packager.assemble(out);
        } catch (IOException e) {
            throw new PackageWriteException("Failed to write workbook to " + path, e);
        }
        log.info("Saved workbook to {}: {} worksheets, {} parts", path, worksheets.size(),
                packager.getPartNames().size());
    }

    public byte[] saveToBuffer() {
        Packager packager = prepare();
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            packager.assemble(out);
            log.info("Saved workbook to buffer: {} worksheets, {} parts, {} bytes", worksheets.size(),
                    packager.getPartNames().size(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new PackageWriteException("Failed to write workbook to buffer", e);
        }
    }

    /**
     * Runs every pipeline step up to, but not including, writing the parts.
     */
    Packager prepare() {
        reset();
        if (worksheets.isEmpty()) {
            addWorksheet();
        }
        int activeTab = activeTab();
        int firstSheet = firstSheet();

        translateFormats();

        ResolvedNames resolved = nameResolver.resolve(userDefinedNames, worksheets);
        definedNames = resolved.getDefinedNames();

        int cachedRanges = chartCacheStitcher.stitch(worksheets, this::findWorksheet);
        log.debug("Stitched {} chart cache ranges", cachedRanges);

        PackageManifest manifest = buildManifest(resolved, activeTab, firstSheet);
        Packager packager = new Packager(manifest, worksheets, formatRegistry, definedNames,
                packagerProperties.getCompressionLevel());
        packager.prepare();
        return packager;
    }

    private void reset() {
        formatRegistry.reset();
        definedNames = Collections.emptyList();
        for (Worksheet worksheet : worksheets) {
            worksheet.reset();
        }
    }

    // The last worksheet marked active wins; without one the first worksheet is active.
    private int activeTab() {
        int active = -1;
        for (int i = 0; i < worksheets.size(); i++) {
            if (worksheets.get(i).isActive()) {
                active = i;
            }
        }
        if (active < 0) {
            active = 0;
        }
        for (int i = 0; i < worksheets.size(); i++) {
            worksheets.get(i).setActive(i == active);
        }
        return active;
    }

    private int firstSheet() {
        for (int i = 0; i < worksheets.size(); i++) {
            if (worksheets.get(i).isFirstSheet()) {
                return i;
            }
        }
        return 0;
    }

    private void translateFormats() {
        boolean hyperlinks = worksheets.stream().anyMatch(Worksheet::hasHyperlinkStyle);
        if (hyperlinks) {
            formatRegistry.registerHyperlinkStyle();
        }
        for (Worksheet worksheet : worksheets) {
            worksheet.setGlobalFormatIndices(formatRegistry.translate(worksheet.getLocalFormats()));
        }
        formatRegistry.prepareFormatProperties();
        log.debug("Translated formats of {} worksheets into {} global formats", worksheets.size(),
                formatRegistry.size());
    }

    private PackageManifest buildManifest(ResolvedNames resolved, int activeTab, int firstSheet) {
        PackageManifest manifest = new PackageManifest();
        manifest.setNumWorksheets(worksheets.size());
        for (Worksheet worksheet : worksheets) {
            manifest.getWorksheetNames().add(worksheet.getName());
            if (worksheet.usesStringTable()) {
                manifest.setHasSharedStrings(true);
            }
            if (worksheet.hasDynamicArrays()) {
                manifest.setHasDynamicArrays(true);
            }
        }
        manifest.setReadOnlyRecommended(readOnlyRecommended);
        manifest.setDocSecurity(readOnlyRecommended ? 2 : 0);
        manifest.setActiveTab(activeTab);
        manifest.setFirstSheet(firstSheet);
        manifest.setDefinedNames(new ArrayList<>(resolved.getAppNames()));
        manifest.setProperties(properties.copy());
        manifest.setApplicationName(packagerProperties.getApplicationName());
        manifest.setAppVersion(packagerProperties.getAppVersion());
        return manifest;
    }
}
