package com.example.demo.xlsxgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Package writer settings.
 *
 * Example application.yml:
 *
 * xlsxgen:
 *   package:
 *     compression-level: 6
 *     application-name: Microsoft Excel
 *     app-version: "12.0000"
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "xlsxgen.package")
public class PackagerProperties {

    /**
     * Deflate level for zip entries, 0 (store) to 9
     */
    private int compressionLevel = 6;

    /**
     * Value of the Application field in docProps/app.xml
     */
    private String applicationName = "Microsoft Excel";

    /**
     * Value of the AppVersion field in docProps/app.xml
     */
    private String appVersion = "12.0000";

}
