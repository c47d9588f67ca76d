package com.imagemeta.domain;

/**
 * A classified input buffer. Built fresh for every request and never shared between requests.
 * The ordered segments of the buffer are parsed on demand by the codec for its format:
 * {@link JpegSegmentList} for JPEG and {@link PngChunkStream} for PNG. TIFF and WebP are
 * walked directly in {@link #getData()}.
 */
public final class ImageContainer {

    private final ImageFormat format;
    private final byte[] data;
    private final Integer width;
    private final Integer height;

    public ImageContainer(ImageFormat format, byte[] data, Integer width, Integer height) {
        this.format = format;
        this.data = data;
        this.width = width;
        this.height = height;
    }

    public ImageFormat getFormat() {
        return format;
    }

    public byte[] getData() {
        return data;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }
}
