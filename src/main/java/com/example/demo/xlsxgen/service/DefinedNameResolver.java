package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.core.Worksheet;
import com.example.demo.xlsxgen.exception.ParameterException;
import com.example.demo.xlsxgen.model.DefinedName;
import com.example.demo.xlsxgen.model.DefinedNameType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses user defined names and merges them with the names worksheets
 * derive from autofilters, print areas and print titles.
 */
@Slf4j
public class DefinedNameResolver {
    private static final String INVALID_CHARS = " ,/*[]:\"'";

    private static final Comparator<DefinedName> EXCEL_ORDER = Comparator
            .comparing(DefinedName::sortKey)
            .thenComparing(DefinedName::getRange);

    /**
     * Parses a name key such as {@code Exchange_rate} (global) or
     * {@code Sheet2!Sales} (local to Sheet2) and validates it.
     *
     * @throws ParameterException if the name breaks Excel's naming rules
     */
    public DefinedName parse(String key, String formula) {
        if (key == null || key.isEmpty()) {
            throw new ParameterException("Defined name cannot be blank");
        }

        DefinedName.DefinedNameBuilder builder = DefinedName.builder();
        String name;
        int separator = key.indexOf('!');
        if (separator >= 0) {
            builder.quotedSheetName(key.substring(0, separator)).type(DefinedNameType.LOCAL);
            name = key.substring(separator + 1);
        } else {
            builder.type(DefinedNameType.GLOBAL);
            name = key;
        }

        if (name.isEmpty()) {
            throw new ParameterException("Defined name '" + key + "' has no name after the sheet reference");
        }

        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_' && first != '\\') {
            throw new ParameterException("Name '" + name + "' must start with a letter or underscore in Excel");
        }

        for (char c : name.toCharArray()) {
            if (INVALID_CHARS.indexOf(c) >= 0) {
                throw new ParameterException("Name '" + name
                        + "' cannot contain any of the characters `,/*[]:\"'` or `space` in Excel");
            }
        }

        String range = formula == null ? "" : formula;
        if (range.startsWith("=")) {
            range = range.substring(1);
        }

        return builder.name(name).range(range).build();
    }

    /**
     * Merges user and worksheet names, binds local names to their sheet
     * index and sorts the result the way Excel lists names.
     *
     * @throws ParameterException if a local name refers to an unknown sheet
     */
    public ResolvedNames resolve(List<DefinedName> userNames, List<Worksheet> worksheets) {
        List<DefinedName> merged = new ArrayList<>();
        for (DefinedName userName : userNames) {
            merged.add(userName.toBuilder().build());
        }

        Map<String, Integer> sheetIndices = new HashMap<>();
        for (int i = 0; i < worksheets.size(); i++) {
            Worksheet worksheet = worksheets.get(i);
            sheetIndices.putIfAbsent(worksheet.getName(), i);
            merged.addAll(worksheet.structuralDefinedNames());
        }

        for (DefinedName definedName : merged) {
            String sheetName = definedName.unquotedSheetName();
            if (sheetName.isEmpty()) {
                continue;
            }
            Integer index = sheetIndices.get(sheetName);
            if (index == null) {
                throw new ParameterException("Unknown worksheet name '" + sheetName
                        + "' in defined name '" + definedName.getName() + "'");
            }
            definedName.setSheetIndex(index);
        }

        merged.sort(EXCEL_ORDER);

        List<String> appNames = new ArrayList<>();
        for (DefinedName definedName : merged) {
            String appName = definedName.appName();
            if (!appName.isEmpty()) {
                appNames.add(appName);
            }
        }

        log.debug("Resolved {} defined names ({} user defined)", merged.size(), userNames.size());
        return new ResolvedNames(merged, appNames);
    }
}
