package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataNamespace;

/**
 * Thrown by every codec when a buffer cannot be read or a field cannot be written.
 * Carries the offending key and namespace when the failure is tied to one field.
 */
public class MetadataCodecException extends RuntimeException {

    private final MetadataError error;
    private final String key;
    private final MetadataNamespace namespace;

    public MetadataCodecException(MetadataError error, String message) {
        this(error, message, null, null, null);
    }

    public MetadataCodecException(MetadataError error, String message, Throwable cause) {
        this(error, message, null, null, cause);
    }

    public MetadataCodecException(MetadataError error, String message, String key, MetadataNamespace namespace) {
        this(error, message, key, namespace, null);
    }

    public MetadataCodecException(MetadataError error, String message, String key, MetadataNamespace namespace, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.key = key;
        this.namespace = namespace;
    }

    public MetadataError getError() {
        return error;
    }

    public String getKey() {
        return key;
    }

    public MetadataNamespace getNamespace() {
        return namespace;
    }

    /**
     * Attaches the field being processed, keeping any key already recorded closer to the failure.
     */
    public MetadataCodecException forField(String fieldKey, MetadataNamespace fieldNamespace) {
        if (key != null && namespace != null) {
            return this;
        }
        MetadataCodecException enriched = new MetadataCodecException(error, getMessage(),
            key != null ? key : fieldKey,
            namespace != null ? namespace : fieldNamespace,
            getCause());
        enriched.setStackTrace(getStackTrace());
        return enriched;
    }
}
