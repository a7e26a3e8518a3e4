package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.model.DefinedName;
import lombok.Value;

import java.util.List;

/**
 * Output of one name resolution pass: the sorted names for the workbook
 * part and the named-range entries for the extended properties part.
 */
@Value
public class ResolvedNames {
    List<DefinedName> definedNames;
    List<String> appNames;
}
