package com.imagemeta.domain;

/**
 * Failure codes surfaced to callers. Every one of them is terminal for the request.
 */
public enum MetadataError {
    UNRECOGNIZED_FORMAT,
    TRUNCATED_IFD,
    OFFSET_OUT_OF_BOUNDS,
    UNSUPPORTED_TAG_TYPE,
    CHUNK_CRC_MISMATCH,
    CHUNK_TOO_LARGE,
    TRUNCATED_CHUNK,
    INVALID_FIELD_VALUE,
    UNSUPPORTED_OPERATION,
    RESOURCE_LIMIT_EXCEEDED,
    MALFORMED_PACKET,
    INVALID_PAYLOAD
}
