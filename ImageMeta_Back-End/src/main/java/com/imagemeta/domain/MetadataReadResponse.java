package com.imagemeta.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result of a read: container format, dimensions when the header exposes them, and one
 * map per namespace. Empty namespaces are left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetadataReadResponse {

    private String format;
    private Integer width;
    private Integer height;
    private Map<String, String> exif;
    @JsonProperty("png_text")
    private Map<String, String> pngText;
    private Map<String, String> xmp;

    public MetadataReadResponse() {
    }

    public MetadataReadResponse(String format, Integer width, Integer height,
                                Map<String, String> exif, Map<String, String> pngText, Map<String, String> xmp) {
        this.format = format;
        this.width = width;
        this.height = height;
        this.exif = emptyToNull(exif);
        this.pngText = emptyToNull(pngText);
        this.xmp = emptyToNull(xmp);
    }

    private static Map<String, String> emptyToNull(Map<String, String> map) {
        return map == null || map.isEmpty() ? null : map;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public Map<String, String> getExif() {
        return exif;
    }

    public void setExif(Map<String, String> exif) {
        this.exif = exif;
    }

    public Map<String, String> getPngText() {
        return pngText;
    }

    public void setPngText(Map<String, String> pngText) {
        this.pngText = pngText;
    }

    public Map<String, String> getXmp() {
        return xmp;
    }

    public void setXmp(Map<String, String> xmp) {
        this.xmp = xmp;
    }
}
