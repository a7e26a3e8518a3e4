package com.example.demo.xlsxgen.service;

import com.example.demo.xlsxgen.config.PackagerProperties;
import com.example.demo.xlsxgen.core.Workbook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Helper service to serialize workbooks to bytes for HTTP responses or
 * storage, and to create workbooks that use the configured package
 * settings.
 */
@Slf4j
@Service
public class WorkbookOutputService {
    private final PackagerProperties packagerProperties;

    public WorkbookOutputService(PackagerProperties packagerProperties) {
        this.packagerProperties = packagerProperties;
    }

    public Workbook newWorkbook() {
        return new Workbook(packagerProperties);
    }

    public byte[] toBytes(Workbook workbook) {
        long start = System.currentTimeMillis();
        byte[] bytes = workbook.saveToBuffer();
        log.info("Serialized workbook with {} worksheets to {} bytes in {} ms",
                workbook.getWorksheets().size(), bytes.length, System.currentTimeMillis() - start);
        return bytes;
    }

    public Path save(Workbook workbook, Path target) {
        long start = System.currentTimeMillis();
        workbook.save(target);
        log.info("Saved workbook to {} in {} ms", target, System.currentTimeMillis() - start);
        return target;
    }
}
