package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.model.DocProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Workbook level facts the packager needs to decide which parts exist.
 * Rebuilt on every save.
 */
@Data
public class PackageManifest {
    private int numWorksheets;
    private List<String> worksheetNames = new ArrayList<>();
    private int docSecurity;
    private boolean readOnlyRecommended;
    private int activeTab;
    private int firstSheet;
    private boolean hasSharedStrings;
    private boolean hasDynamicArrays;
    private List<String> definedNames = new ArrayList<>();
    private DocProperties properties = new DocProperties();
    private String applicationName = "Microsoft Excel";
    private String appVersion = "12.0000";

    public boolean hasCustomProperties() {
        return !properties.getCustomProperties().isEmpty();
    }
}
