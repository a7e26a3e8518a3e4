package com.example.demo.xlsxgen.renderer;

import java.util.regex.Pattern;

/**
 * Minimal XML emitter for package parts. Callers are responsible for tag
 * nesting; the writer only escapes text and attribute values.
 */
public class XmlWriter {
    private static final Pattern LITERAL_ESCAPE = Pattern.compile("(_x[0-9A-Fa-f]{4}_)");

    private final StringBuilder buffer = new StringBuilder(4096);

    public XmlWriter declaration() {
        buffer.append("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n");
        return this;
    }

    public XmlWriter startTag(String tag, String... attributes) {
        buffer.append('<').append(tag);
        appendAttributes(attributes);
        buffer.append('>');
        return this;
    }

    public XmlWriter endTag(String tag) {
        buffer.append("</").append(tag).append('>');
        return this;
    }

    public XmlWriter emptyTag(String tag, String... attributes) {
        buffer.append('<').append(tag);
        appendAttributes(attributes);
        buffer.append("/>");
        return this;
    }

    /**
     * Writes {@code <tag attrs>text</tag>}.
     */
    public XmlWriter dataElement(String tag, String text, String... attributes) {
        startTag(tag, attributes);
        buffer.append(escapeText(text));
        return endTag(tag);
    }

    /**
     * Like {@link #dataElement} for Excel string content, where a literal
     * {@code _xHHHH_} sequence must itself be escaped.
     */
    public XmlWriter stringElement(String tag, String text, String... attributes) {
        startTag(tag, attributes);
        buffer.append(escapeString(text));
        return endTag(tag);
    }

    /**
     * Appends pre-built markup without escaping.
     */
    public XmlWriter raw(String markup) {
        buffer.append(markup);
        return this;
    }

    @Override
    public String toString() {
        return buffer.toString();
    }

    // Attributes are passed as name, value pairs.
    private void appendAttributes(String[] attributes) {
        if (attributes.length % 2 != 0) {
            throw new IllegalArgumentException("Attributes must be name/value pairs");
        }
        for (int i = 0; i < attributes.length; i += 2) {
            buffer.append(' ').append(attributes[i]).append("=\"").append(escapeAttribute(attributes[i + 1])).append('"');
        }
    }

    static String escapeText(String text) {
        if (text.indexOf('&') >= 0 || text.indexOf('<') >= 0 || text.indexOf('>') >= 0) {
            text = text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
        }
        if (!hasControlChars(text)) {
            return text;
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isControlChar(c)) {
                escaped.append(String.format("_x%04X_", (int) c));
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }

    // Control characters have no representation in an XML 1.0 attribute.
    static String escapeAttribute(String value) {
        if (hasControlChars(value)) {
            StringBuilder stripped = new StringBuilder(value.length());
            for (int i = 0; i < value.length(); i++) {
                if (!isControlChar(value.charAt(i))) {
                    stripped.append(value.charAt(i));
                }
            }
            value = stripped.toString();
        }
        return escapeText(value).replace("\"", "&quot;").replace("\n", "&#xA;");
    }

    static String escapeString(String text) {
        if (text.contains("_x")) {
            text = LITERAL_ESCAPE.matcher(text).replaceAll("_x005F$1");
        }
        return escapeText(text);
    }

    private static boolean hasControlChars(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isControlChar(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isControlChar(char c) {
        return c < 0x20 && c != '\t' && c != '\n' && c != '\r';
    }
}
