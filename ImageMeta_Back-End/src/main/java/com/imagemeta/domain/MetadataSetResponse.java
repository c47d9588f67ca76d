package com.imagemeta.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public class MetadataSetResponse {

    @JsonProperty("image_base64")
    private String imageBase64;
    private String format;
    private Map<String, String> updated;

    public MetadataSetResponse() {
    }

    public MetadataSetResponse(String imageBase64, String format, Map<String, String> updated) {
        this.imageBase64 = imageBase64;
        this.format = format;
        this.updated = updated;
    }

    public String getImageBase64() {
        return imageBase64;
    }

    public void setImageBase64(String imageBase64) {
        this.imageBase64 = imageBase64;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Map<String, String> getUpdated() {
        return updated;
    }

    public void setUpdated(Map<String, String> updated) {
        this.updated = updated;
    }
}
