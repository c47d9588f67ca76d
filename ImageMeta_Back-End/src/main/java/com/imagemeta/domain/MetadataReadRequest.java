package com.imagemeta.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public class MetadataReadRequest {

    @NotBlank
    @JsonProperty("image_base64")
    private String imageBase64;

    public MetadataReadRequest() {
    }

    public MetadataReadRequest(String imageBase64) {
        this.imageBase64 = imageBase64;
    }

    public String getImageBase64() {
        return imageBase64;
    }

    public void setImageBase64(String imageBase64) {
        this.imageBase64 = imageBase64;
    }
}
