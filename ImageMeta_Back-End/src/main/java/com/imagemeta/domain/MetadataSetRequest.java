package com.imagemeta.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Write request. {@code format} only asserts the detected container, {@code namespace}
 * overrides the default routing of keys (exif, xmp or png_text).
 */
public class MetadataSetRequest {

    @NotBlank
    @JsonProperty("image_base64")
    private String imageBase64;

    @NotNull
    private Map<String, String> set = new LinkedHashMap<>();

    private String format;

    private String namespace;

    public MetadataSetRequest() {
    }

    public String getImageBase64() {
        return imageBase64;
    }

    public void setImageBase64(String imageBase64) {
        this.imageBase64 = imageBase64;
    }

    public Map<String, String> getSet() {
        return set;
    }

    public void setSet(Map<String, String> set) {
        this.set = set;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }
}
