package com.imagemeta.domain;

import java.util.Locale;

/**
 * Namespaces a metadata field can live in. Keys never collide across namespaces.
 */
public enum MetadataNamespace {
    EXIF("exif"),
    PNG_TEXT("png_text"),
    XMP("xmp");

    private final String wireName;

    MetadataNamespace(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static MetadataNamespace fromWireName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MetadataNamespace namespace : values()) {
            if (namespace.wireName.equals(normalized) || namespace.name().equalsIgnoreCase(normalized)) {
                return namespace;
            }
        }
        return null;
    }
}
