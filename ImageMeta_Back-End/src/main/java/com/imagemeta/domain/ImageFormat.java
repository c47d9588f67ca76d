package com.imagemeta.domain;

import java.util.Locale;

/**
 * Raster containers the service knows how to classify.
 */
public enum ImageFormat {
    JPEG,
    PNG,
    TIFF,
    WEBP,
    UNKNOWN;

    /**
     * Resolves a user supplied format name, accepting the usual aliases (JPG, TIF).
     * @return the format, or {@link #UNKNOWN} when the name is not recognized
     */
    public static ImageFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "JPEG":
            case "JPG":
                return JPEG;
            case "PNG":
                return PNG;
            case "TIFF":
            case "TIF":
                return TIFF;
            case "WEBP":
                return WEBP;
            default:
                return UNKNOWN;
        }
    }
}
