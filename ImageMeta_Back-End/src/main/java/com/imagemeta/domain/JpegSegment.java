package com.imagemeta.domain;

/**
 * A JPEG marker segment from the header area (everything before the first SOS).
 * Standalone markers (RSTn, TEM) carry no payload.
 */
public final class JpegSegment {

    public static final int APP0 = 0xE0;
    public static final int APP1 = 0xE1;

    private final int marker;
    private final byte[] payload;

    public JpegSegment(int marker, byte[] payload) {
        this.marker = marker;
        this.payload = payload;
    }

    public int getMarker() {
        return marker;
    }

    /**
     * @return the bytes after the 2 byte length field, or null for a standalone marker
     */
    public byte[] getPayload() {
        return payload;
    }

    public boolean isStandalone() {
        return payload == null;
    }

    public boolean startsWith(byte[] label) {
        if (payload == null || payload.length < label.length) {
            return false;
        }
        for (int i = 0; i < label.length; i++) {
            if (payload[i] != label[i]) {
                return false;
            }
        }
        return true;
    }
}
