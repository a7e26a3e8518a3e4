package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.model.Fill;
import com.example.demo.xlsxgen.model.Format;
import lombok.Value;

/**
 * One entry of the global cell style table with the indices of its font,
 * fill, border and number format sub-records.
 */
@Value
public class XfRecord {
    Format format;
    Fill fill;
    int fontIndex;
    int fillIndex;
    int borderIndex;
    int numFmtId;
}
