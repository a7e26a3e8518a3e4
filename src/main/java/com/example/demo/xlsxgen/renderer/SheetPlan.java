package com.example.demo.xlsxgen.renderer;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Part numbers and relationship ids assigned to one worksheet before any
 * part is written. Relationship ids are allocated in the order hyperlinks,
 * drawing, header/footer VML, tables.
 */
@Data
class SheetPlan {
    private final int sheetNumber;
    private final Relationships sheetRelationships = new Relationships();

    // Parallel to the worksheet's hyperlinks; null for internal links.
    private final List<String> hyperlinkRelIds = new ArrayList<>();

    private int drawingNumber;
    private String drawingRelId;
    private final Relationships drawingRelationships = new Relationships();
    // Parallel to the worksheet's drawing objects.
    private final List<String> drawingObjectRelIds = new ArrayList<>();
    private final List<Integer> chartNumbers = new ArrayList<>();

    private int vmlNumber;
    private String vmlRelId;
    private final Relationships vmlRelationships = new Relationships();
    private final List<String> headerImageRelIds = new ArrayList<>();
    private final List<Integer> headerImageMediaNumbers = new ArrayList<>();

    private final List<Integer> tableNumbers = new ArrayList<>();
    private final List<String> tableRelIds = new ArrayList<>();

    boolean hasDrawing() {
        return drawingRelId != null;
    }

    boolean hasVml() {
        return vmlRelId != null;
    }
}
