package com.example.demo.xlsxgen.model;

import lombok.Data;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Document metadata for the core, extended and custom property parts.
 * The creation time defaults to the moment the object is created so that
 * repeated saves of one workbook produce the same timestamp.
 */
@Data
public class DocProperties {
    static final DateTimeFormatter W3CDTF = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
            .withZone(ZoneOffset.UTC);

    private String title = "";
    private String subject = "";
    private String author = "";
    private String manager = "";
    private String company = "";
    private String category = "";
    private String keywords = "";
    private String comment = "";
    private String status = "";
    private String hyperlinkBase = "";
    private Instant creationTime = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    private List<CustomProperty> customProperties = new ArrayList<>();

    public DocProperties addCustomProperty(CustomProperty property) {
        customProperties.add(property);
        return this;
    }

    public String creationTimeW3c() {
        return W3CDTF.format(creationTime);
    }

    /**
     * Copy with unset (null) text fields replaced by empty strings.
     */
    public DocProperties copy() {
        DocProperties copy = new DocProperties();
        copy.setTitle(orEmpty(title));
        copy.setSubject(orEmpty(subject));
        copy.setAuthor(orEmpty(author));
        copy.setManager(orEmpty(manager));
        copy.setCompany(orEmpty(company));
        copy.setCategory(orEmpty(category));
        copy.setKeywords(orEmpty(keywords));
        copy.setComment(orEmpty(comment));
        copy.setStatus(orEmpty(status));
        copy.setHyperlinkBase(orEmpty(hyperlinkBase));
        if (creationTime != null) {
            copy.setCreationTime(creationTime);
        }
        if (customProperties != null) {
            copy.setCustomProperties(new ArrayList<>(customProperties));
        }
        return copy;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
