package com.example.demo.xlsxgen.renderer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Workbook-wide string table. Strings are numbered in first-use order while
 * the worksheets are written; {@code count} tracks every reference.
 */
public class SharedStringTable implements PartRenderer {
    private final Map<String, Integer> strings = new LinkedHashMap<>();
    private int count;

    public int indexOf(String text) {
        count++;
        Integer index = strings.get(text);
        if (index == null) {
            index = strings.size();
            strings.put(text, index);
        }
        return index;
    }

    public int getCount() {
        return count;
    }

    public int getUniqueCount() {
        return strings.size();
    }

    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public String render() {
        XmlWriter writer = new XmlWriter().declaration();
        writer.startTag("sst", "xmlns", WorkbookRenderer.XMLNS_MAIN,
                "count", Integer.toString(count), "uniqueCount", Integer.toString(strings.size()));
        for (String text : strings.keySet()) {
            writer.startTag("si");
            if (needsPreserve(text)) {
                writer.stringElement("t", text, "xml:space", "preserve");
            } else {
                writer.stringElement("t", text);
            }
            writer.endTag("si");
        }
        return writer.endTag("sst").toString();
    }

    private static boolean needsPreserve(String text) {
        if (text.isEmpty()) {
            return false;
        }
        return Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1))
                || text.indexOf('\n') >= 0
                || text.indexOf('\t') >= 0;
    }
}
