package com.imagemeta.domain;

/**
 * TIFF 6.0 field types, plus the IFD pointer type from TIFF Technical Note 1, with their
 * unit size in bytes.
 */
public enum TiffFieldType {
    BYTE(1, 1),
    ASCII(2, 1),
    SHORT(3, 2),
    LONG(4, 4),
    RATIONAL(5, 8),
    SBYTE(6, 1),
    UNDEFINED(7, 1),
    SSHORT(8, 2),
    SLONG(9, 4),
    SRATIONAL(10, 8),
    FLOAT(11, 4),
    DOUBLE(12, 8),
    IFD(13, 4);

    private final int id;
    private final int unitSize;

    TiffFieldType(int id, int unitSize) {
        this.id = id;
        this.unitSize = unitSize;
    }

    public int getId() {
        return id;
    }

    public int getUnitSize() {
        return unitSize;
    }

    /**
     * @return the type, or null for an id outside the table
     */
    public static TiffFieldType fromId(int id) {
        for (TiffFieldType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        return null;
    }
}
