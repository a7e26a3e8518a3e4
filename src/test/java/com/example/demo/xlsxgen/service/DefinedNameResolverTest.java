package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.exception.ParameterException;
import com.example.demo.xlsxgen.model.DefinedName;
import com.example.demo.xlsxgen.model.DefinedNameType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Defined name resolver")
public class DefinedNameResolverTest {

    private DefinedNameResolver resolver;
    private List<Worksheet> worksheets;

    @BeforeEach
    void setup() {
        resolver = new DefinedNameResolver();
        worksheets = new ArrayList<>();
        worksheets.add(new Worksheet("Sheet1"));
        worksheets.add(new Worksheet("Sheet2"));
    }

    @Test
    @DisplayName("Name without a sheet is global and keeps its range text")
    void globalName() {
        DefinedName name = resolver.parse("Exchange_rate", "=0.96");

        assertEquals(DefinedNameType.GLOBAL, name.getType());
        assertEquals("Exchange_rate", name.getName());
        assertEquals("0.96", name.getRange());
    }

    @Test
    @DisplayName("Sheet qualified name is local to that sheet's index")
    void localNameResolvesToSheetIndex() {
        DefinedName parsed = resolver.parse("Sheet2!Sales", "=Sheet2!$G$1:$G$10");

        ResolvedNames resolved = resolver.resolve(List.of(parsed), worksheets);

        assertEquals(1, resolved.getDefinedNames().size());
        DefinedName name = resolved.getDefinedNames().get(0);
        assertEquals(DefinedNameType.LOCAL, name.getType());
        assertEquals("Sales", name.getName());
        assertEquals(1, name.getSheetIndex());
        assertEquals(List.of("Sheet2!Sales"), resolved.getAppNames());
    }

    @ParameterizedTest
    @ValueSource(strings = {".foo", "1abc", "my name", "a,b", "a/b", "a*b", "a[b", "a]b", "a:b", "a\"b", "a'b", "Sheet1!"})
    @DisplayName("Names breaking Excel's rules are rejected")
    void invalidNamesRejected(String key) {
        assertThrows(ParameterException.class, () -> resolver.parse(key, ""));
    }

    @Test
    @DisplayName("Names may start with an underscore or a backslash")
    void underscoreAndBackslashAccepted() {
        assertEquals("_hidden", resolver.parse("_hidden", "=1").getName());
        assertEquals("\\path", resolver.parse("\\path", "=1").getName());
    }

    @Test
    @DisplayName("Local name on an unknown sheet fails at resolution")
    void unknownSheetFails() {
        DefinedName parsed = resolver.parse("Missing!Total", "=Missing!$A$1");

        ParameterException error = assertThrows(ParameterException.class,
                () -> resolver.resolve(List.of(parsed), worksheets));
        assertEquals("PARAMETER_ERROR", error.getCode());
    }

    @Test
    @DisplayName("Quoted sheet names resolve to the unquoted sheet")
    void quotedSheetName() {
        worksheets.add(new Worksheet("Sales Data"));
        DefinedName parsed = resolver.parse("'Sales Data'!Region", "='Sales Data'!$A$1:$A$4");

        ResolvedNames resolved = resolver.resolve(List.of(parsed), worksheets);

        assertEquals(2, resolved.getDefinedNames().get(0).getSheetIndex());
    }

    @Test
    @DisplayName("Names are sorted case-insensitively, ignoring the _xlnm prefix")
    void sortOrder() {
        worksheets.get(0).setPrintArea(0, 0, 9, 3);
        worksheets.get(0).autofilter(0, 0, 9, 3);
        List<DefinedName> userNames = List.of(
                resolver.parse("zeta", "=Sheet1!$A$1"),
                resolver.parse("Sheet2!alpha", "=Sheet2!$A$1"),
                resolver.parse("Sheet1!alpha", "=Sheet1!$A$1"),
                resolver.parse("Print_Rate", "=0.5"));

        ResolvedNames resolved = resolver.resolve(userNames, worksheets);

        List<String> order = new ArrayList<>();
        for (DefinedName name : resolved.getDefinedNames()) {
            order.add(name.xmlName() + "@" + name.unquotedSheetName());
        }
        assertEquals(List.of(
                "_xlnm._FilterDatabase@Sheet1",
                "alpha@Sheet1",
                "alpha@Sheet2",
                "_xlnm.Print_Area@Sheet1",
                "Print_Rate@",
                "zeta@"), order);
    }

    @Test
    @DisplayName("Structural names are built from the sheet settings")
    void structuralNames() {
        Worksheet sheet = new Worksheet("My Data");
        sheet.setRepeatRows(0, 1);
        sheet.setRepeatColumns(0, 0);
        sheet.setPrintArea(0, 0, 19, 4);

        ResolvedNames resolved = resolver.resolve(List.of(), List.of(sheet));

        DefinedName printArea = resolved.getDefinedNames().get(0);
        DefinedName printTitles = resolved.getDefinedNames().get(1);
        assertEquals("_xlnm.Print_Area", printArea.xmlName());
        assertEquals("'My Data'!$A$1:$E$20", printArea.getRange());
        assertEquals("_xlnm.Print_Titles", printTitles.xmlName());
        assertEquals("'My Data'!$A:$A,'My Data'!$1:$2", printTitles.getRange());
        assertEquals(List.of("'My Data'!Print_Area", "'My Data'!Print_Titles"), resolved.getAppNames());
    }

    @Test
    @DisplayName("Resolution doesn't modify the user defined names")
    void userNamesUntouched() {
        DefinedName parsed = resolver.parse("Sheet2!Sales", "=Sheet2!$G$1:$G$10");

        resolver.resolve(List.of(parsed), worksheets);

        assertEquals(0, parsed.getSheetIndex());
    }
}
