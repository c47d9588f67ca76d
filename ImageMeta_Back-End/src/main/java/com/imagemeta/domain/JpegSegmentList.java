package com.imagemeta.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Header segments of a JPEG file in file order, followed by the untouched remainder
 * (scan data and everything after it).
 */
public final class JpegSegmentList {

    private final List<JpegSegment> segments;
    private final byte[] remainder;

    public JpegSegmentList(List<JpegSegment> segments, byte[] remainder) {
        this.segments = new ArrayList<>(segments);
        this.remainder = remainder != null ? remainder : new byte[0];
    }

    public List<JpegSegment> getSegments() {
        return segments;
    }

    public byte[] getRemainder() {
        return remainder;
    }
}
