package com.example.demo.xlsxgen.renderer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Content types manifest")
public class ContentTypesTest {

    @Test
    @DisplayName("Fixed parts are covered from the start")
    void fixedParts() {
        ContentTypes contentTypes = new ContentTypes();

        assertTrue(contentTypes.covers("xl/workbook.xml"));
        assertTrue(contentTypes.covers("/xl/styles.xml"));
        assertTrue(contentTypes.covers("_rels/.rels"));
        assertFalse(contentTypes.covers("xl/media/image1.png"));
    }

    @Test
    @DisplayName("Extension defaults are registered once")
    void defaultsRegisteredOnce() {
        ContentTypes contentTypes = new ContentTypes();
        contentTypes.addDefault("png", "image/png");
        contentTypes.addDefault("png", "image/x-png");

        String xml = contentTypes.render();

        assertTrue(xml.contains("<Default Extension=\"png\" ContentType=\"image/png\"/>"));
        assertFalse(xml.contains("image/x-png"));
        assertTrue(contentTypes.covers("xl/media/image7.png"));
    }

    @Test
    @DisplayName("Numbered parts get an override each")
    void numberedOverrides() {
        ContentTypes contentTypes = new ContentTypes();
        contentTypes.addWorksheet(2);
        contentTypes.addChart(1);
        contentTypes.addTable(3);

        String xml = contentTypes.render();

        assertTrue(xml.contains("<Override PartName=\"/xl/worksheets/sheet2.xml\" ContentType=\"" + ContentTypes.WORKSHEET + "\"/>"));
        assertTrue(contentTypes.covers("xl/charts/chart1.xml"));
        assertTrue(contentTypes.covers("xl/tables/table3.xml"));
        assertFalse(contentTypes.covers("xl/tables/table1.xml"));
    }

    @Test
    @DisplayName("Xml parts need an override of their own")
    void xmlPartsNeedOverride() {
        // Given
        ContentTypes contentTypes = new ContentTypes();
        contentTypes.addDefault("png", "image/png");

        // When
        contentTypes.addDrawing(1);

        // Then
        assertFalse(contentTypes.covers("xl/drawings/drawing2.xml"));
        assertFalse(contentTypes.covers("xl/sharedStrings.xml"));
        assertNull(contentTypes.contentTypeOf("docProps/custom.xml"));
        assertEquals(ContentTypes.DRAWING, contentTypes.contentTypeOf("xl/drawings/drawing1.xml"));
        assertEquals(ContentTypes.WORKBOOK, contentTypes.contentTypeOf("/xl/workbook.xml"));
        assertEquals("image/png", contentTypes.contentTypeOf("xl/media/image1.png"));
    }
}
