package com.imagemeta.domain;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * One PNG chunk. A chunk read from a file keeps the CRC stored after it; a chunk built in
 * memory gets its CRC computed from type and data.
 */
public final class PngChunk {

    public static final String IHDR = "IHDR";
    public static final String IDAT = "IDAT";
    public static final String IEND = "IEND";
    public static final String TEXT = "tEXt";
    public static final String COMPRESSED_TEXT = "zTXt";
    public static final String INTERNATIONAL_TEXT = "iTXt";
    public static final String EXIF = "eXIf";

    private final String type;
    private final byte[] data;
    private final int crc;

    public PngChunk(String type, byte[] data, int crc) {
        this.type = type;
        this.data = data;
        this.crc = crc;
    }

    public static PngChunk of(String type, byte[] data) {
        return new PngChunk(type, data, computeCrc(type, data));
    }

    public static int computeCrc(String type, byte[] data) {
        CRC32 crc32 = new CRC32();
        crc32.update(type.getBytes(StandardCharsets.US_ASCII));
        crc32.update(data, 0, data.length);
        return (int) crc32.getValue();
    }

    public String getType() {
        return type;
    }

    public byte[] getData() {
        return data;
    }

    public int getCrc() {
        return crc;
    }

    public boolean isText() {
        return TEXT.equals(type) || COMPRESSED_TEXT.equals(type) || INTERNATIONAL_TEXT.equals(type);
    }

    /**
     * @return length + type + data + crc, 12 bytes more than the data
     */
    public int getEncodedLength() {
        return data.length + 12;
    }
}
