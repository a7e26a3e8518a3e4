package com.example.demo.xlsxgen.renderer;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code .rels} part. Ids are assigned sequentially as {@code rId1},
 * {@code rId2}, ... in the order relationships are added.
 */
public class Relationships implements PartRenderer {
    static final String DOCUMENT_SCHEMA = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    static final String PACKAGE_SCHEMA = "http://schemas.openxmlformats.org/package/2006/relationships";

    private final List<String[]> relationships = new ArrayList<>();

    /**
     * Adds a relationship with an officeDocument type such as
     * {@code /worksheet} and returns its id.
     */
    public String addDocumentRelationship(String type, String target) {
        return add(DOCUMENT_SCHEMA + type, target, null);
    }

    public String addPackageRelationship(String type, String target) {
        return add(PACKAGE_SCHEMA + type, target, null);
    }

    public String addExternalRelationship(String type, String target) {
        return add(DOCUMENT_SCHEMA + type, target, "External");
    }

    private String add(String type, String target, String targetMode) {
        relationships.add(new String[] {type, target, targetMode});
        return "rId" + relationships.size();
    }

    public boolean isEmpty() {
        return relationships.isEmpty();
    }

    public int size() {
        return relationships.size();
    }

    public List<String> getTargets() {
        List<String> targets = new ArrayList<>();
        for (String[] relationship : relationships) {
            targets.add(relationship[1]);
        }
        return targets;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("Relationships", "xmlns", PACKAGE_SCHEMA);
        for (int i = 0; i < relationships.size(); i++) {
            String[] relationship = relationships.get(i);
            String id = "rId" + (i + 1);
            if (relationship[2] == null) {
                writer.emptyTag("Relationship", "Id", id, "Type", relationship[0], "Target", relationship[1]);
            } else {
                writer.emptyTag("Relationship", "Id", id, "Type", relationship[0], "Target", relationship[1],
                        "TargetMode", relationship[2]);
            }
        }
        return writer.endTag("Relationships").toString();
    }
}
