package com.imagemeta.domain;

import java.util.Map;

/**
 * Outcome of a write: the rewritten container bytes and the values that were applied.
 */
public final class MetadataWriteResult {

    private final ImageFormat format;
    private final byte[] data;
    private final Map<String, String> updated;

    public MetadataWriteResult(ImageFormat format, byte[] data, Map<String, String> updated) {
        this.format = format;
        this.data = data;
        this.updated = updated;
    }

    public ImageFormat getFormat() {
        return format;
    }

    public byte[] getData() {
        return data;
    }

    public Map<String, String> getUpdated() {
        return updated;
    }
}
