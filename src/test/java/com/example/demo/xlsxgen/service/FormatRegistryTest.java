package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.model.Color;
import com.example.demo.xlsxgen.model.Fill;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.model.FormatBorder;
import com.example.demo.xlsxgen.model.FormatPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Format registry")
public class FormatRegistryTest {

    private FormatRegistry registry;

    @BeforeEach
    void setup() {
        registry = new FormatRegistry();
    }

    @Test
    @DisplayName("Index 0 is the default format")
    void defaultFormatIsIndexZero() {
        assertEquals(1, registry.size());
        assertEquals(0, registry.register(new Format()));
    }

    @Test
    @DisplayName("Registering an equal format twice returns the same index")
    void registerIsIdempotent() {
        int first = registry.register(new Format().withBold());
        int second = registry.register(new Format().withBold());

        assertEquals(first, second);
        assertEquals(2, registry.size());
    }

    @Test
    @DisplayName("New formats get sequential indices in call order")
    void indicesFollowCallOrder() {
        assertEquals(1, registry.register(new Format().withBold()));
        assertEquals(2, registry.register(new Format().withItalic()));
        assertEquals(1, registry.register(new Format().withBold()));
        assertEquals(3, registry.register(new Format().withFontColor(Color.RED)));
    }

    @Test
    @DisplayName("Translation maps local positions to global indices")
    void translateIsPositional() {
        registry.register(new Format().withItalic());

        int[] indices = registry.translate(List.of(new Format(), new Format().withBold(), new Format().withItalic()));

        assertArrayEquals(new int[] {0, 2, 1}, indices);
    }

    @Test
    @DisplayName("Hyperlink style is reserved at index 1")
    void hyperlinkStyleAtIndexOne() {
        registry.registerHyperlinkStyle();
        int bold = registry.register(new Format().withBold());

        assertTrue(registry.isHasHyperlinkStyle());
        assertEquals(FormatRegistry.HYPERLINK_INDEX, registry.register(Format.hyperlinkStyle()));
        assertEquals(2, bold);
    }

    @Test
    @DisplayName("Hyperlink style can't be injected after other formats")
    void hyperlinkStyleMustComeFirst() {
        registry.register(new Format().withBold());

        assertThrows(IllegalStateException.class, registry::registerHyperlinkStyle);
    }

    @Test
    @DisplayName("Reset leaves only the default format")
    void resetClearsRegistry() {
        registry.registerHyperlinkStyle();
        registry.register(new Format().withBold());

        registry.reset();

        assertEquals(1, registry.size());
        assertFalse(registry.isHasHyperlinkStyle());
    }

    @Test
    @DisplayName("Fill table starts with the two mandatory fills and stores normalized fills")
    void fillSubTable() {
        registry.register(new Format().withBackgroundColor(Color.YELLOW));
        registry.register(new Format().withPattern(FormatPattern.SOLID).withBackgroundColor(Color.YELLOW));

        registry.prepareFormatProperties();

        List<Fill> fills = registry.getFills();
        assertEquals(3, fills.size());
        assertEquals(Fill.DEFAULT, fills.get(0));
        assertEquals(Fill.GRAY125, fills.get(1));
        assertEquals(FormatPattern.SOLID, fills.get(2).getPattern());
        assertEquals(Color.YELLOW, fills.get(2).getForegroundColor());

        List<XfRecord> records = registry.getXfRecords();
        assertEquals(2, records.get(1).getFillIndex());
        assertEquals(2, records.get(2).getFillIndex());
    }

    @Test
    @DisplayName("Fonts and borders are deduplicated across formats")
    void fontAndBorderSubTables() {
        registry.register(new Format().withBold());
        registry.register(new Format().withBold().withBorder(FormatBorder.THIN));
        registry.register(new Format().withBorder(FormatBorder.THIN));

        registry.prepareFormatProperties();

        assertEquals(2, registry.getFonts().size());
        assertEquals(2, registry.getBorders().size());
        List<XfRecord> records = registry.getXfRecords();
        assertEquals(1, records.get(1).getFontIndex());
        assertEquals(0, records.get(1).getBorderIndex());
        assertEquals(1, records.get(2).getFontIndex());
        assertEquals(1, records.get(2).getBorderIndex());
        assertEquals(0, records.get(3).getFontIndex());
    }

    @Test
    @DisplayName("Custom number formats are numbered from 164, built-ins keep their id")
    void numberFormatIds() {
        registry.register(new Format().withNumFormat("0.00"));
        registry.register(new Format().withNumFormat("#,##0.000"));
        registry.register(new Format().withNumFormat("[Red]0.0"));
        registry.register(new Format().withNumFormat("#,##0.000").withBold());
        registry.register(new Format().withNumFormatIndex(14));

        registry.prepareFormatProperties();

        List<XfRecord> records = registry.getXfRecords();
        assertEquals(0, records.get(0).getNumFmtId());
        assertEquals(2, records.get(1).getNumFmtId());
        assertEquals(164, records.get(2).getNumFmtId());
        assertEquals(165, records.get(3).getNumFmtId());
        assertEquals(164, records.get(4).getNumFmtId());
        assertEquals(14, records.get(5).getNumFmtId());
        assertEquals(List.of("#,##0.000", "[Red]0.0"), registry.getNumFormats());
    }
}
