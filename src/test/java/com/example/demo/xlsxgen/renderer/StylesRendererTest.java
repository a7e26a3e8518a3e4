package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.Color;
import com.example.demo.xlsxgen.model.Format;
import com.example.demo.xlsxgen.model.FormatAlign;
import com.example.demo.xlsxgen.model.FormatBorder;
import com.example.demo.xlsxgen.service.FormatRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Styles part")
public class StylesRendererTest {

    private FormatRegistry registry;

    @BeforeEach
    void setup() {
        registry = new FormatRegistry();
    }

    private String render() {
        registry.prepareFormatProperties();
        return new StylesRenderer(registry).render();
    }

    @Test
    @DisplayName("Default styles hold the mandatory fills and the Normal style")
    void defaults() {
        String xml = render();

        assertFalse(xml.contains("<numFmts"));
        assertTrue(xml.contains("<fills count=\"2\"><fill><patternFill patternType=\"none\"/></fill>"
                + "<fill><patternFill patternType=\"gray125\"/></fill></fills>"));
        assertTrue(xml.contains("<cellXfs count=\"1\"><xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\" xfId=\"0\"/></cellXfs>"));
        assertTrue(xml.contains("<cellStyles count=\"1\"><cellStyle name=\"Normal\" xfId=\"0\" builtinId=\"0\"/></cellStyles>"));
    }

    @Test
    @DisplayName("Hyperlink style adds a second cell style")
    void hyperlinkStyle() {
        registry.registerHyperlinkStyle();

        String xml = render();

        assertTrue(xml.contains("<cellStyleXfs count=\"2\">"));
        assertTrue(xml.contains("<cellStyle name=\"Hyperlink\" xfId=\"1\" builtinId=\"8\"/>"));
        assertTrue(xml.contains("<xf numFmtId=\"0\" fontId=\"1\" fillId=\"0\" borderId=\"0\" xfId=\"1\"/>"));
        assertTrue(xml.contains("<u/>"));
        assertTrue(xml.contains("<color theme=\"10\"/>"));
    }

    @Test
    @DisplayName("Solid fills store the visible color as foreground")
    void solidFill() {
        registry.register(new Format().withBackgroundColor(Color.RED));

        String xml = render();

        assertTrue(xml.contains("<fill><patternFill patternType=\"solid\"><fgColor rgb=\"FFFF0000\"/>"
                + "<bgColor indexed=\"64\"/></patternFill></fill>"));
        assertTrue(xml.contains("fillId=\"2\" borderId=\"0\" xfId=\"0\" applyFill=\"1\""));
    }

    @Test
    @DisplayName("Number formats, borders, alignment and protection are applied")
    void applyFlags() {
        registry.register(new Format()
                .withNumFormat("0.000%")
                .withBorder(FormatBorder.THIN)
                .withAlign(FormatAlign.CENTER)
                .withUnlocked());

        String xml = render();

        assertTrue(xml.contains("<numFmts count=\"1\"><numFmt numFmtId=\"164\" formatCode=\"0.000%\"/></numFmts>"));
        assertTrue(xml.contains("<left style=\"thin\"><color auto=\"1\"/></left>"));
        assertTrue(xml.contains("applyNumberFormat=\"1\" applyBorder=\"1\" applyAlignment=\"1\" applyProtection=\"1\">"
                + "<alignment horizontal=\"center\"/><protection locked=\"0\" hidden=\"0\"/></xf>"));
    }
}
