package com.imagemeta.service;

import com.drew.metadata.Directory;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifInteropDirectory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.imagemeta.domain.IfdEntry;
import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataField;
import com.imagemeta.domain.MetadataNamespace;
import com.imagemeta.domain.TiffFieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads and edits TIFF Image File Directories, independent of the container holding them
 * (a whole TIFF file, or the payload of a JPEG APP1 "Exif" segment after its 6 byte label).
 *
 * Edits never move bytes they do not own: a rewritten directory goes back to its original
 * slot when the new entry list fits, otherwise it is appended and the pointer to it updated.
 * Values too large to sit inline reuse their previous slot when big enough, else they are
 * appended too. Untouched entries are copied as their original 12 byte records.
 */
@Service
public class TiffIfdCodec {

    private static final Logger log = LoggerFactory.getLogger(TiffIfdCodec.class);

    public static final int TAG_IMAGE_DESCRIPTION = 0x010E;
    public static final int TAG_SOFTWARE = 0x0131;
    public static final int TAG_DATETIME = 0x0132;
    public static final int TAG_ARTIST = 0x013B;
    public static final int TAG_XML_PACKET = 0x02BC;
    public static final int TAG_COPYRIGHT = 0x8298;
    public static final int TAG_EXIF_IFD_POINTER = 0x8769;
    public static final int TAG_GPS_IFD_POINTER = 0x8825;
    public static final int TAG_USER_COMMENT = 0x9286;
    public static final int TAG_INTEROP_IFD_POINTER = 0xA005;

    // Windows XPTitle .. XPSubject, UTF-16LE in BYTE arrays
    private static final int TAG_XP_FIRST = 0x9C9B;
    private static final int TAG_XP_LAST = 0x9C9F;

    public static final String KEY_DESCRIPTION = "description";
    public static final String KEY_ARTIST = "artist";
    public static final String KEY_COPYRIGHT = "copyright";
    public static final String KEY_SOFTWARE = "software";
    public static final String KEY_DATETIME = DateTimeNormalizer.DATETIME_KEY;
    public static final String KEY_USER_COMMENT = "user_comment";

    public static final Set<String> RECOGNIZED_KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        KEY_DESCRIPTION, KEY_ARTIST, KEY_COPYRIGHT, KEY_SOFTWARE, KEY_DATETIME, KEY_USER_COMMENT)));

    private static final byte[] ASCII_PREFIX = {'A', 'S', 'C', 'I', 'I', 0, 0, 0};
    private static final byte[] UNICODE_PREFIX = {'U', 'N', 'I', 'C', 'O', 'D', 'E', 0};
    private static final byte[] JIS_PREFIX = {'J', 'I', 'S', 0, 0, 0, 0, 0};

    private static final int MAX_RENDERED_BINARY = 64;

    private enum DirectoryKind {
        IFD0(new ExifIFD0Directory()),
        EXIF(new ExifSubIFDDirectory()),
        GPS(new GpsDirectory()),
        INTEROP(new ExifInteropDirectory());

        private final Directory names;

        DirectoryKind(Directory names) {
            this.names = names;
        }
    }

    static final class TiffDirectory {
        final int offset;
        final int declaredCount;
        final List<IfdEntry> entries;
        final long nextIfdOffset;

        TiffDirectory(int offset, int declaredCount, List<IfdEntry> entries, long nextIfdOffset) {
            this.offset = offset;
            this.declaredCount = declaredCount;
            this.entries = entries;
            this.nextIfdOffset = nextIfdOffset;
        }

        IfdEntry find(int tagId) {
            for (IfdEntry entry : entries) {
                if (entry.getTagId() == tagId) {
                    return entry;
                }
            }
            return null;
        }
    }

    private final int maxIfdEntries;
    private final int maxIfdCount;
    private final DateTimeNormalizer dateTimeNormalizer;

    public TiffIfdCodec(
        @Value("${app.metadata.max-ifd-entries:1024}") int maxIfdEntries,
        @Value("${app.metadata.max-ifd-count:16}") int maxIfdCount,
        DateTimeNormalizer dateTimeNormalizer
    ) {
        this.maxIfdEntries = Math.max(1, maxIfdEntries);
        this.maxIfdCount = Math.max(1, maxIfdCount);
        this.dateTimeNormalizer = dateTimeNormalizer;
    }

    // ---- Read path ----

    /**
     * Walks IFD0, the rest of its chain, and the EXIF / GPS / Interoperability sub-directories.
     * The six recognized fields come out under their short names, every other tag under its
     * canonical EXIF name. The first occurrence of a name wins.
     */
    public List<MetadataField> read(byte[] tiff) {
        ByteOrder order = readByteOrder(tiff);
        ByteBuffer buf = ByteBuffer.wrap(tiff).order(order);
        Map<String, MetadataField> fields = new LinkedHashMap<>();
        Set<Long> visited = new HashSet<>();

        long next = buf.getInt(4) & 0xFFFFFFFFL;
        boolean first = true;
        while (next != 0) {
            TiffDirectory directory = visit(buf, next, tiff.length, visited);
            collect(directory, first ? DirectoryKind.IFD0 : null, order, buf, tiff.length, visited, fields);
            first = false;
            next = directory.nextIfdOffset;
        }
        log.debug("Read {} EXIF fields from {} directories ({} byte order)", fields.size(), visited.size(), order);
        return new ArrayList<>(fields.values());
    }

    /**
     * @return the raw XMLPacket (tag 700) of IFD0, or null when there is none
     */
    public byte[] readXmpPacket(byte[] tiff) {
        ByteOrder order = readByteOrder(tiff);
        ByteBuffer buf = ByteBuffer.wrap(tiff).order(order);
        long ifd0 = buf.getInt(4) & 0xFFFFFFFFL;
        if (ifd0 == 0) {
            return null;
        }
        IfdEntry entry = readDirectory(buf, ifd0, tiff.length).find(TAG_XML_PACKET);
        return entry != null ? entry.getValue() : null;
    }

    private TiffDirectory visit(ByteBuffer buf, long offset, int length, Set<Long> visited) {
        if (!visited.add(offset)) {
            throw new MetadataCodecException(MetadataError.OFFSET_OUT_OF_BOUNDS,
                "IFD chain loops back to offset " + offset);
        }
        if (visited.size() > maxIfdCount) {
            throw new MetadataCodecException(MetadataError.RESOURCE_LIMIT_EXCEEDED,
                "More than " + maxIfdCount + " IFDs in one TIFF structure");
        }
        return readDirectory(buf, offset, length);
    }

    private void collect(TiffDirectory directory, DirectoryKind kind, ByteOrder order, ByteBuffer buf, int length,
                         Set<Long> visited, Map<String, MetadataField> fields) {
        DirectoryKind names = kind != null ? kind : DirectoryKind.IFD0;
        for (IfdEntry entry : directory.entries) {
            int tag = entry.getTagId();
            DirectoryKind child = kind != null ? childKind(kind, tag) : null;
            if (child != null) {
                long childOffset = pointerValue(entry, order);
                if (childOffset != 0) {
                    collect(visit(buf, childOffset, length, visited), child, order, buf, length, visited, fields);
                }
                continue;
            }
            String key = kind != null ? recognizedKey(kind, tag) : null;
            MetadataField.TypeHint hint = hintFor(entry, key);
            if (key == null) {
                key = names.names.hasTagName(tag) ? names.names.getTagName(tag) : String.format("Unknown tag (0x%04x)", tag);
            }
            if (!fields.containsKey(key)) {
                fields.put(key, new MetadataField(MetadataNamespace.EXIF, key, render(entry, order), hint));
            }
        }
    }

    private static DirectoryKind childKind(DirectoryKind parent, int tag) {
        if (parent == DirectoryKind.IFD0 && tag == TAG_EXIF_IFD_POINTER) {
            return DirectoryKind.EXIF;
        }
        if (parent == DirectoryKind.IFD0 && tag == TAG_GPS_IFD_POINTER) {
            return DirectoryKind.GPS;
        }
        if (parent == DirectoryKind.EXIF && tag == TAG_INTEROP_IFD_POINTER) {
            return DirectoryKind.INTEROP;
        }
        return null;
    }

    private static String recognizedKey(DirectoryKind kind, int tag) {
        if (kind == DirectoryKind.IFD0) {
            switch (tag) {
                case TAG_IMAGE_DESCRIPTION:
                    return KEY_DESCRIPTION;
                case TAG_ARTIST:
                    return KEY_ARTIST;
                case TAG_COPYRIGHT:
                    return KEY_COPYRIGHT;
                case TAG_SOFTWARE:
                    return KEY_SOFTWARE;
                case TAG_DATETIME:
                    return KEY_DATETIME;
                default:
                    return null;
            }
        }
        if (kind == DirectoryKind.EXIF && tag == TAG_USER_COMMENT) {
            return KEY_USER_COMMENT;
        }
        return null;
    }

    private static MetadataField.TypeHint hintFor(IfdEntry entry, String key) {
        if (KEY_DATETIME.equals(key)) {
            return MetadataField.TypeHint.DATETIME;
        }
        switch (entry.getType()) {
            case ASCII:
                return MetadataField.TypeHint.ASCII;
            case BYTE:
            case SBYTE:
                return MetadataField.TypeHint.BYTE;
            case SHORT:
            case SSHORT:
                return MetadataField.TypeHint.SHORT;
            case RATIONAL:
            case SRATIONAL:
                return MetadataField.TypeHint.RATIONAL;
            case UNDEFINED:
                return MetadataField.TypeHint.UNDEFINED;
            default:
                return MetadataField.TypeHint.LONG;
        }
    }

    ByteOrder readByteOrder(byte[] tiff) {
        if (tiff == null || tiff.length < 8) {
            throw new MetadataCodecException(MetadataError.TRUNCATED_IFD,
                "TIFF header truncated: " + (tiff == null ? 0 : tiff.length) + " bytes");
        }
        ByteOrder order;
        if (tiff[0] == 'I' && tiff[1] == 'I') {
            order = ByteOrder.LITTLE_ENDIAN;
        } else if (tiff[0] == 'M' && tiff[1] == 'M') {
            order = ByteOrder.BIG_ENDIAN;
        } else {
            throw new MetadataCodecException(MetadataError.UNRECOGNIZED_FORMAT,
                "Invalid TIFF byte order marker: " + tiff[0] + ", " + tiff[1]);
        }
        int magic = ByteBuffer.wrap(tiff).order(order).getShort(2) & 0xFFFF;
        if (magic != 42) {
            throw new MetadataCodecException(MetadataError.UNRECOGNIZED_FORMAT, "Not a TIFF structure (magic=" + magic + ")");
        }
        return order;
    }

    TiffDirectory readDirectory(ByteBuffer buf, long offset, int length) {
        if (offset < 8 || offset + 2 > length) {
            throw new MetadataCodecException(MetadataError.OFFSET_OUT_OF_BOUNDS,
                "IFD offset out of range: " + offset + " (size: " + length + ")");
        }
        int start = (int) offset;
        int count = buf.getShort(start) & 0xFFFF;
        long entriesEnd = offset + 2 + 12L * count;
        if (entriesEnd > length) {
            throw new MetadataCodecException(MetadataError.TRUNCATED_IFD,
                "IFD at offset " + offset + " declares " + count + " entries but only "
                    + (length - offset - 2) + " bytes remain");
        }
        if (count > maxIfdEntries) {
            throw new MetadataCodecException(MetadataError.RESOURCE_LIMIT_EXCEEDED,
                "IFD at offset " + offset + " declares " + count + " entries (limit " + maxIfdEntries + ")");
        }

        List<IfdEntry> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int entryOffset = start + 2 + i * 12;
            int tag = buf.getShort(entryOffset) & 0xFFFF;
            int typeId = buf.getShort(entryOffset + 2) & 0xFFFF;
            TiffFieldType type = TiffFieldType.fromId(typeId);
            if (type == null) {
                throw new MetadataCodecException(MetadataError.UNSUPPORTED_TAG_TYPE,
                    String.format("Tag 0x%04x uses unsupported field type %d", tag, typeId));
            }
            long itemCount = buf.getInt(entryOffset + 4) & 0xFFFFFFFFL;
            long valueSize = itemCount * type.getUnitSize();

            byte[] raw = new byte[12];
            buf.get(entryOffset, raw);
            byte[] value;
            int valueOffset = -1;
            if (valueSize <= IfdEntry.INLINE_CAPACITY) {
                value = Arrays.copyOfRange(raw, 8, 8 + (int) valueSize);
            } else {
                long target = buf.getInt(entryOffset + 8) & 0xFFFFFFFFL;
                if (target + valueSize > length) {
                    throw new MetadataCodecException(MetadataError.OFFSET_OUT_OF_BOUNDS,
                        String.format("Value of tag 0x%04x at offset %d (%d bytes) lies outside the buffer (%d bytes)",
                            tag, target, valueSize, length));
                }
                valueOffset = (int) target;
                value = new byte[(int) valueSize];
                buf.get(valueOffset, value);
            }
            entries.add(new IfdEntry(tag, type, itemCount, value, valueOffset, raw));
        }

        long next = entriesEnd + 4 <= length ? buf.getInt((int) entriesEnd) & 0xFFFFFFFFL : 0;
        return new TiffDirectory(start, count, entries, next);
    }

    private static long pointerValue(IfdEntry entry, ByteOrder order) {
        byte[] value = entry.getValue();
        if (value.length < 4) {
            return value.length >= 2 ? ByteBuffer.wrap(value).order(order).getShort(0) & 0xFFFF : 0;
        }
        return ByteBuffer.wrap(value).order(order).getInt(0) & 0xFFFFFFFFL;
    }

    private String render(IfdEntry entry, ByteOrder order) {
        byte[] value = entry.getValue();
        ByteBuffer buf = ByteBuffer.wrap(value).order(order);
        int tag = entry.getTagId();
        switch (entry.getType()) {
            case ASCII:
                return stripNuls(new String(value, StandardCharsets.UTF_8));
            case UNDEFINED:
                if (tag == TAG_USER_COMMENT) {
                    return decodeUserComment(value, order);
                }
                return renderBinary(value);
            case BYTE:
                if (tag >= TAG_XP_FIRST && tag <= TAG_XP_LAST) {
                    return stripNuls(new String(value, StandardCharsets.UTF_16LE));
                }
                return joinNumbers(value.length, i -> Integer.toString(value[i] & 0xFF));
            case SBYTE:
                return joinNumbers(value.length, i -> Integer.toString(value[i]));
            case SHORT:
                return joinNumbers(value.length / 2, i -> Integer.toString(buf.getShort(i * 2) & 0xFFFF));
            case SSHORT:
                return joinNumbers(value.length / 2, i -> Integer.toString(buf.getShort(i * 2)));
            case LONG:
            case IFD:
                return joinNumbers(value.length / 4, i -> Long.toString(buf.getInt(i * 4) & 0xFFFFFFFFL));
            case SLONG:
                return joinNumbers(value.length / 4, i -> Integer.toString(buf.getInt(i * 4)));
            case RATIONAL:
                return joinNumbers(value.length / 8,
                    i -> (buf.getInt(i * 8) & 0xFFFFFFFFL) + "/" + (buf.getInt(i * 8 + 4) & 0xFFFFFFFFL));
            case SRATIONAL:
                return joinNumbers(value.length / 8, i -> buf.getInt(i * 8) + "/" + buf.getInt(i * 8 + 4));
            case FLOAT:
                return joinNumbers(value.length / 4, i -> Float.toString(buf.getFloat(i * 4)));
            case DOUBLE:
                return joinNumbers(value.length / 8, i -> Double.toString(buf.getDouble(i * 8)));
            default:
                return renderBinary(value);
        }
    }

    private interface IndexedRenderer {
        String render(int index);
    }

    private static String joinNumbers(int count, IndexedRenderer renderer) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(renderer.render(i));
        }
        return sb.toString();
    }

    private static String renderBinary(byte[] value) {
        boolean printable = true;
        for (byte b : value) {
            int c = b & 0xFF;
            if (c != 0 && (c < 0x20 || c > 0x7E)) {
                printable = false;
                break;
            }
        }
        if (printable) {
            return stripNuls(new String(value, StandardCharsets.US_ASCII));
        }
        if (value.length > MAX_RENDERED_BINARY) {
            return "(" + value.length + " bytes binary data)";
        }
        StringBuilder sb = new StringBuilder(value.length * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b & 0xFF));
        }
        return sb.toString();
    }

    /**
     * Decodes UserComment according to its 8 byte character code prefix.
     */
    String decodeUserComment(byte[] value, ByteOrder order) {
        if (value.length < 8) {
            return stripNuls(new String(value, StandardCharsets.UTF_8)).trim();
        }
        byte[] prefix = Arrays.copyOfRange(value, 0, 8);
        byte[] body = Arrays.copyOfRange(value, 8, value.length);
        if (Arrays.equals(prefix, ASCII_PREFIX)) {
            return stripNuls(new String(body, StandardCharsets.US_ASCII));
        }
        if (Arrays.equals(prefix, UNICODE_PREFIX)) {
            Charset charset;
            if (body.length >= 2 && ((body[0] & 0xFF) == 0xFE && (body[1] & 0xFF) == 0xFF
                || (body[0] & 0xFF) == 0xFF && (body[1] & 0xFF) == 0xFE)) {
                charset = StandardCharsets.UTF_16;
            } else {
                charset = order == ByteOrder.BIG_ENDIAN ? StandardCharsets.UTF_16BE : StandardCharsets.UTF_16LE;
            }
            return stripNuls(new String(body, charset));
        }
        if (Arrays.equals(prefix, JIS_PREFIX)) {
            return stripNuls(new String(body, Charset.forName("Shift_JIS")));
        }
        // undefined code: all-zero prefix, or a writer that skipped the prefix altogether
        boolean zeroPrefix = true;
        for (byte b : prefix) {
            if (b != 0) {
                zeroPrefix = false;
                break;
            }
        }
        byte[] text = zeroPrefix ? body : value;
        return stripNuls(new String(text, StandardCharsets.UTF_8)).trim();
    }

    private static String stripNuls(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\0') {
            end--;
        }
        String trimmed = text.substring(0, end);
        int nul = trimmed.indexOf('\0');
        return nul >= 0 ? trimmed.substring(0, nul) : trimmed;
    }

    // ---- Write path ----

    /**
     * Applies the recognized fields to a TIFF structure.
     * @param tiff the existing structure, or null to synthesize a minimal one
     * @return the edited structure; the input itself when every value was already present
     */
    public byte[] write(byte[] tiff, Map<String, String> fields) {
        byte[] base = tiff != null ? tiff : emptyStructure();
        ByteOrder order = readByteOrder(base);

        Map<Integer, IfdEntry> ifd0Edits = new TreeMap<>();
        Map<Integer, IfdEntry> exifEdits = new TreeMap<>();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            String key = field.getKey();
            String value = field.getValue();
            try {
                switch (key) {
                    case KEY_DESCRIPTION:
                        ifd0Edits.put(TAG_IMAGE_DESCRIPTION, asciiEntry(TAG_IMAGE_DESCRIPTION, key, value));
                        break;
                    case KEY_ARTIST:
                        ifd0Edits.put(TAG_ARTIST, asciiEntry(TAG_ARTIST, key, value));
                        break;
                    case KEY_COPYRIGHT:
                        ifd0Edits.put(TAG_COPYRIGHT, asciiEntry(TAG_COPYRIGHT, key, value));
                        break;
                    case KEY_SOFTWARE:
                        ifd0Edits.put(TAG_SOFTWARE, asciiEntry(TAG_SOFTWARE, key, value));
                        break;
                    case KEY_DATETIME:
                        String normalized = dateTimeNormalizer.toExif(value, MetadataNamespace.EXIF);
                        ifd0Edits.put(TAG_DATETIME, asciiEntry(TAG_DATETIME, key, normalized));
                        break;
                    case KEY_USER_COMMENT:
                        exifEdits.put(TAG_USER_COMMENT, IfdEntry.of(TAG_USER_COMMENT, TiffFieldType.UNDEFINED,
                            encodeUserComment(key, value, order)));
                        break;
                    default:
                        throw new MetadataCodecException(MetadataError.UNSUPPORTED_OPERATION,
                            "No EXIF equivalent for key '" + key + "'", key, MetadataNamespace.EXIF);
                }
            } catch (MetadataCodecException e) {
                throw e.forField(key, MetadataNamespace.EXIF);
            }
        }

        if (ifd0Edits.isEmpty() && exifEdits.isEmpty()) {
            return base;
        }

        ByteBuffer buf = ByteBuffer.wrap(base).order(order);
        long ifd0Offset = buf.getInt(4) & 0xFFFFFFFFL;
        TiffDirectory ifd0 = ifd0Offset != 0 ? readDirectory(buf, ifd0Offset, base.length) : null;
        TiffBuffer out = new TiffBuffer(base, order);

        if (!exifEdits.isEmpty()) {
            IfdEntry pointer = ifd0 != null ? ifd0.find(TAG_EXIF_IFD_POINTER) : null;
            long exifOffset = pointer != null ? pointerValue(pointer, order) : 0;
            TiffDirectory exif = exifOffset != 0 ? readDirectory(buf, exifOffset, base.length) : null;
            int placed = placeDirectory(out, exif, exifEdits.values());
            ifd0Edits.put(TAG_EXIF_IFD_POINTER, IfdEntry.of(TAG_EXIF_IFD_POINTER, TiffFieldType.LONG, longBytes(placed, order)));
        }

        int placedIfd0 = placeDirectory(out, ifd0, ifd0Edits.values());
        if (ifd0 == null || placedIfd0 != ifd0.offset) {
            out.putInt(4, placedIfd0);
        }
        if (!out.isModified()) {
            log.debug("EXIF values already present, TIFF structure left untouched");
            return base;
        }
        log.debug("EXIF structure rewritten: {} -> {} bytes, IFD0 at {}", base.length, out.size(), placedIfd0);
        return out.toByteArray();
    }

    private static byte[] emptyStructure() {
        return new byte[] {'I', 'I', 0x2A, 0x00, 0, 0, 0, 0};
    }

    private static IfdEntry asciiEntry(int tag, String key, String value) {
        checkText(key, value);
        byte[] text = value.getBytes(StandardCharsets.UTF_8);
        byte[] terminated = Arrays.copyOf(text, text.length + 1);
        return IfdEntry.of(tag, TiffFieldType.ASCII, terminated);
    }

    private static byte[] encodeUserComment(String key, String value, ByteOrder order) {
        checkText(key, value);
        boolean ascii = StandardCharsets.US_ASCII.newEncoder().canEncode(value);
        byte[] prefix = ascii ? ASCII_PREFIX : UNICODE_PREFIX;
        Charset charset = ascii ? StandardCharsets.US_ASCII
            : order == ByteOrder.BIG_ENDIAN ? StandardCharsets.UTF_16BE : StandardCharsets.UTF_16LE;
        byte[] body = value.getBytes(charset);
        byte[] encoded = Arrays.copyOf(prefix, prefix.length + body.length);
        System.arraycopy(body, 0, encoded, prefix.length, body.length);
        return encoded;
    }

    private static void checkText(String key, String value) {
        if (value == null) {
            throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                "Missing value for EXIF field '" + key + "'", key, MetadataNamespace.EXIF);
        }
        if (value.indexOf('\0') >= 0) {
            throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                "EXIF field '" + key + "' must not contain NUL characters", key, MetadataNamespace.EXIF);
        }
    }

    private static byte[] longBytes(long value, ByteOrder order) {
        return ByteBuffer.allocate(4).order(order).putInt((int) value).array();
    }

    /**
     * Merges the edits into a directory and writes it out.
     * @param directory the directory as read, or null when it does not exist yet
     * @return where the directory now lives
     */
    private int placeDirectory(TiffBuffer out, TiffDirectory directory, Collection<IfdEntry> edits) {
        List<IfdEntry> merged = directory != null ? new ArrayList<>(directory.entries) : new ArrayList<>();
        Set<Integer> changed = new HashSet<>();
        for (IfdEntry edit : edits) {
            int index = indexOfTag(merged, edit.getTagId());
            if (index >= 0) {
                if (merged.get(index).sameValueAs(edit)) {
                    continue;
                }
                merged.set(index, edit);
            } else {
                merged.add(edit);
            }
            changed.add(edit.getTagId());
        }
        if (changed.isEmpty() && directory != null) {
            return directory.offset;
        }
        merged.sort(Comparator.comparingInt(IfdEntry::getTagId));

        int count = merged.size();
        int blockSize = 2 + 12 * count + 4;
        long next = directory != null ? directory.nextIfdOffset : 0;
        int offset;
        if (directory != null && count <= directory.declaredCount && directory.offset + blockSize <= out.size()) {
            offset = directory.offset;
            int oldSize = Math.min(2 + 12 * directory.declaredCount + 4, out.size() - offset);
            out.fill(offset, oldSize);
            log.debug("Rewriting IFD in place at {} ({} -> {} entries)", offset, directory.declaredCount, count);
        } else {
            offset = out.append(blockSize);
            log.debug("Appending IFD at {} with {} entries", offset, count);
        }

        out.putShort(offset, count);
        for (int i = 0; i < count; i++) {
            IfdEntry entry = merged.get(i);
            int position = offset + 2 + 12 * i;
            if (!changed.contains(entry.getTagId()) && entry.getRawRecord() != null) {
                out.put(position, entry.getRawRecord());
                continue;
            }
            out.putShort(position, entry.getTagId());
            out.putShort(position + 2, entry.getType().getId());
            out.putInt(position + 4, entry.getCount());
            byte[] value = entry.getValue();
            if (entry.isInline()) {
                out.put(position + 8, Arrays.copyOf(value, IfdEntry.INLINE_CAPACITY));
                continue;
            }
            IfdEntry previous = directory != null ? directory.find(entry.getTagId()) : null;
            int valuePosition;
            if (previous != null && !previous.isInline() && previous.getValue().length >= value.length) {
                valuePosition = previous.getValueOffset();
                out.fill(valuePosition, previous.getValue().length);
            } else {
                valuePosition = out.append(value.length);
            }
            out.put(valuePosition, value);
            out.putInt(position + 8, valuePosition);
        }
        out.putInt(offset + 2 + 12 * count, next);
        return offset;
    }

    private static int indexOfTag(List<IfdEntry> entries, int tagId) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getTagId() == tagId) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Growable copy of the structure being edited. Appended blocks start on a word boundary.
     */
    private static final class TiffBuffer {
        private final ByteOrder order;
        private byte[] data;
        private int size;
        private boolean modified;

        TiffBuffer(byte[] initial, ByteOrder order) {
            this.order = order;
            this.data = Arrays.copyOf(initial, Math.max(16, initial.length + initial.length / 4));
            this.size = initial.length;
        }

        int size() {
            return size;
        }

        boolean isModified() {
            return modified;
        }

        int append(int length) {
            if (size % 2 != 0) {
                ensureCapacity(size + 1);
                size++;
            }
            int at = size;
            ensureCapacity(size + length);
            size += length;
            modified = true;
            return at;
        }

        void put(int offset, byte[] bytes) {
            System.arraycopy(bytes, 0, data, offset, bytes.length);
            modified = true;
        }

        void fill(int offset, int length) {
            Arrays.fill(data, offset, offset + length, (byte) 0);
            modified = true;
        }

        void putShort(int offset, int value) {
            ByteBuffer.wrap(data).order(order).putShort(offset, (short) value);
            modified = true;
        }

        void putInt(int offset, long value) {
            ByteBuffer.wrap(data).order(order).putInt(offset, (int) value);
            modified = true;
        }

        byte[] toByteArray() {
            return Arrays.copyOf(data, size);
        }

        private void ensureCapacity(int capacity) {
            if (capacity > data.length) {
                data = Arrays.copyOf(data, Math.max(capacity, data.length * 2));
            }
        }
    }
}
