package com.example.demo.xlsxgen.renderer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("XML writer escaping")
public class XmlWriterTest {

    @Test
    @DisplayName("Markup characters are escaped in text and attributes")
    void markup() {
        String xml = new XmlWriter().dataElement("t", "a < b & c", "v", "say \"hi\"").toString();

        assertEquals("<t v=\"say &quot;hi&quot;\">a &lt; b &amp; c</t>", xml);
    }

    @Test
    @DisplayName("Control characters in text become _xHHHH_ escapes")
    void controlCharactersInText() {
        String xml = new XmlWriter().dataElement("t", "a\u0001b\tc\u001F").toString();

        assertEquals("<t>a_x0001_b\tc_x001F_</t>", xml);
    }

    @Test
    @DisplayName("Control characters are dropped from attribute values")
    void controlCharactersInAttributes() {
        String xml = new XmlWriter().emptyTag("c", "name", "x\u0000y\u000Bz").toString();

        assertEquals("<c name=\"xyz\"/>", xml);
    }

    @Test
    @DisplayName("String content escapes a literal _xHHHH_ sequence")
    void literalEscapeSequence() {
        String xml = new XmlWriter().stringElement("t", "_x0041_ and \u0002").toString();

        assertEquals("<t>_x005F_x0041_ and _x0002_</t>", xml);
        assertEquals("<t>_x0041_</t>", new XmlWriter().dataElement("t", "_x0041_").toString());
    }
}
