package com.imagemeta.domain;

import java.util.Arrays;

/**
 * One 12-byte IFD record. {@code value} always holds the resolved value bytes in the
 * directory's byte order; {@code valueOffset} is the position they were read from when
 * they did not fit inline (-1 otherwise). Entries read from a buffer keep their original
 * 12 bytes so they can be written back untouched.
 */
public final class IfdEntry {

    public static final int INLINE_CAPACITY = 4;

    private final int tagId;
    private final TiffFieldType type;
    private final long count;
    private final byte[] value;
    private final int valueOffset;
    private final byte[] rawRecord;

    public IfdEntry(int tagId, TiffFieldType type, long count, byte[] value, int valueOffset, byte[] rawRecord) {
        this.tagId = tagId;
        this.type = type;
        this.count = count;
        this.value = value;
        this.valueOffset = valueOffset;
        this.rawRecord = rawRecord;
    }

    /**
     * A new entry that has not been placed in any buffer yet.
     */
    public static IfdEntry of(int tagId, TiffFieldType type, byte[] value) {
        return new IfdEntry(tagId, type, value.length / type.getUnitSize(), value, -1, null);
    }

    public int getTagId() {
        return tagId;
    }

    public TiffFieldType getType() {
        return type;
    }

    public long getCount() {
        return count;
    }

    public byte[] getValue() {
        return value;
    }

    public int getValueOffset() {
        return valueOffset;
    }

    public byte[] getRawRecord() {
        return rawRecord;
    }

    public boolean isInline() {
        return value.length <= INLINE_CAPACITY;
    }

    public boolean sameValueAs(IfdEntry other) {
        return other != null && type == other.type && count == other.count && Arrays.equals(value, other.value);
    }
}
