package com.imagemeta.domain;

import java.util.Objects;

/**
 * A single decoded metadata value, keyed within its namespace.
 */
public final class MetadataField {

    public enum TypeHint {
        ASCII,
        BYTE,
        SHORT,
        LONG,
        RATIONAL,
        DATETIME,
        UNDEFINED,
        LATIN1_TEXT,
        UTF8_TEXT
    }

    private final MetadataNamespace namespace;
    private final String key;
    private final String value;
    private final TypeHint typeHint;

    public MetadataField(MetadataNamespace namespace, String key, String value, TypeHint typeHint) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.key = Objects.requireNonNull(key, "key");
        this.value = value != null ? value : "";
        this.typeHint = typeHint;
    }

    public MetadataNamespace getNamespace() {
        return namespace;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public TypeHint getTypeHint() {
        return typeHint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetadataField)) {
            return false;
        }
        MetadataField that = (MetadataField) o;
        return namespace == that.namespace && key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, key, value);
    }

    @Override
    public String toString() {
        return namespace.getWireName() + ":" + key + "=" + value;
    }
}
