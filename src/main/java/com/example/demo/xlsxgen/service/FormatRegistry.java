package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.model.Border;
import com.example.demo.xlsxgen.model.Fill;
import com.example.demo.xlsxgen.model.Font;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.util.IndexedTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.BuiltinFormats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Workbook-wide table of unique cell formats.
 *
 * Worksheets collect formats locally while they are written. At save time
 * each local list is translated through {@link #translate(List)} and, once
 * every worksheet has contributed, {@link #prepareFormatProperties()} splits
 * the formats into the font, fill, border and number format sub-tables of
 * the styles part. Index 0 is always the default format.
 */
@Slf4j
public class FormatRegistry {
    /**
     * First id available to number formats that aren't built into Excel.
     */
    public static final int FIRST_CUSTOM_NUM_FORMAT = 164;

    public static final int HYPERLINK_INDEX = 1;

    private final List<Format> xfFormats = new ArrayList<>();
    private final Map<Format, Integer> xfIndices = new HashMap<>();

    @Getter
    private boolean hasHyperlinkStyle;

    private final IndexedTable<Font> fonts = new IndexedTable<>();
    private final IndexedTable<Fill> fills = new IndexedTable<>();
    private final IndexedTable<Border> borders = new IndexedTable<>();
    private final IndexedTable<String> numFormats = new IndexedTable<>(FIRST_CUSTOM_NUM_FORMAT);
    private List<XfRecord> xfRecords = Collections.emptyList();

    public FormatRegistry() {
        reset();
    }

    /**
     * Drops all registered formats and derived sub-tables.
     */
    public void reset() {
        xfFormats.clear();
        xfIndices.clear();
        hasHyperlinkStyle = false;
        fonts.clear();
        fills.clear();
        borders.clear();
        numFormats.clear();
        xfRecords = Collections.emptyList();

        Format defaultFormat = new Format();
        xfFormats.add(defaultFormat);
        xfIndices.put(defaultFormat, 0);
    }

    /**
     * Returns the global index of the format, adding it when it hasn't been
     * seen before.
     */
    public int register(Format format) {
        Integer index = xfIndices.get(format);
        if (index != null) {
            return index;
        }
        int next = xfFormats.size();
        xfFormats.add(format);
        xfIndices.put(format, next);
        return next;
    }

    /**
     * Reserves index 1 for the built-in hyperlink style. Must run before
     * any other format is registered.
     */
    public void registerHyperlinkStyle() {
        Format hyperlink = Format.hyperlinkStyle();
        hasHyperlinkStyle = true;
        if (xfIndices.containsKey(hyperlink)) {
            return;
        }
        if (xfFormats.size() != HYPERLINK_INDEX) {
            throw new IllegalStateException("Hyperlink style must be registered before other formats");
        }
        register(hyperlink);
    }

    /**
     * Maps a worksheet's local format list to global indices, position by
     * position.
     */
    public int[] translate(List<Format> localFormats) {
        int[] indices = new int[localFormats.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = register(localFormats.get(i));
        }
        return indices;
    }

    /**
     * Builds the font, fill, border and number format sub-tables from the
     * registered formats, in registration order.
     */
    public void prepareFormatProperties() {
        fonts.clear();
        fills.clear();
        borders.clear();
        numFormats.clear();

        // Two fills are mandatory and always come first.
        fills.indexOf(Fill.DEFAULT);
        fills.indexOf(Fill.GRAY125);

        List<XfRecord> records = new ArrayList<>(xfFormats.size());
        for (Format format : xfFormats) {
            Fill fill = format.getFill().normalized();
            records.add(new XfRecord(format, fill,
                    fonts.indexOf(format.getFont()),
                    fills.indexOf(fill),
                    borders.indexOf(format.getBorder()),
                    numFormatId(format)));
        }
        xfRecords = Collections.unmodifiableList(records);

        log.debug("Prepared {} formats: {} fonts, {} fills, {} borders, {} number formats",
                records.size(), fonts.size(), fills.size(), borders.size(), numFormats.size());
    }

    private int numFormatId(Format format) {
        if (format.getNumFormatIndex() > 0) {
            return format.getNumFormatIndex();
        }
        String code = format.getNumFormat();
        if (code.isEmpty()) {
            return 0;
        }
        int builtin = BuiltinFormats.getBuiltinFormat(code);
        if (builtin >= 0) {
            return builtin;
        }
        return numFormats.indexOf(code);
    }

    public int size() {
        return xfFormats.size();
    }

    public List<Format> getFormats() {
        return Collections.unmodifiableList(xfFormats);
    }

    public List<XfRecord> getXfRecords() {
        return xfRecords;
    }

    public List<Font> getFonts() {
        return fonts.values();
    }

    public List<Fill> getFills() {
        return fills.values();
    }

    public List<Border> getBorders() {
        return borders.values();
    }

    /**
     * Custom number format codes; the id of entry {@code i} is
     * {@code FIRST_CUSTOM_NUM_FORMAT + i}.
     */
    public List<String> getNumFormats() {
        return numFormats.values();
    }
}
