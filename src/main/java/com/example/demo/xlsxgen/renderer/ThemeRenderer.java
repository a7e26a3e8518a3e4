package com.example.demo.xlsxgen.renderer;

import com.example.demo.xlsxgen.exception.PackageWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Supplies {@code xl/theme/theme1.xml}. The theme is a fixed classpath
 * resource and is read once per JVM.
 */
@Slf4j
public class ThemeRenderer implements PartRenderer {
    static final String THEME_RESOURCE = "xlsxgen/theme1.xml";

    private static volatile String cachedTheme;

    @Override
    public String render() {
        String theme = cachedTheme;
        if (theme == null) {
            theme = loadTheme();
            cachedTheme = theme;
        }
        return theme;
    }

    private static String loadTheme() {
        ClassPathResource resource = new ClassPathResource(THEME_RESOURCE);
        try (InputStream in = resource.getInputStream()) {
            String theme = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Loaded theme from classpath resource: {}", THEME_RESOURCE);
            return theme;
        } catch (IOException e) {
            throw new PackageWriteException("Theme resource not found on classpath: " + THEME_RESOURCE, e);
        }
    }
}
