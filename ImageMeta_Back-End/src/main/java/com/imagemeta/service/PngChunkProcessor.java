package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataField;
import com.imagemeta.domain.MetadataNamespace;
import com.imagemeta.domain.PngChunk;
import com.imagemeta.domain.PngChunkStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Parses a PNG chunk stream, reads and edits its text chunks (tEXt, zTXt, iTXt), and
 * reassembles it. Chunks that are not touched by an edit are written back byte for byte,
 * in their original order.
 */
@Service
public class PngChunkProcessor {

    private static final Logger log = LoggerFactory.getLogger(PngChunkProcessor.class);

    public static final String XMP_KEYWORD = "XML:com.adobe.xmp";

    private static final int MAX_KEYWORD_LENGTH = 79;
    private static final byte[] EXIF_PREFIX = {'E', 'x', 'i', 'f', 0, 0};

    private final long maxChunkSize;
    private final int maxInflatedTextSize;

    public PngChunkProcessor(
        @Value("${app.metadata.max-chunk-size:16777216}") long maxChunkSize,
        @Value("${app.metadata.max-inflated-text-size:4194304}") int maxInflatedTextSize
    ) {
        this.maxChunkSize = maxChunkSize;
        this.maxInflatedTextSize = maxInflatedTextSize;
    }

    /**
     * Decoded form of one text chunk. Compression flag, language tag and translated keyword
     * only carry meaning for iTXt.
     */
    private static final class TextEntry {
        final String chunkType;
        final String keyword;
        final String value;
        final boolean compressed;
        final String languageTag;
        final String translatedKeyword;

        TextEntry(String chunkType, String keyword, String value, boolean compressed,
                  String languageTag, String translatedKeyword) {
            this.chunkType = chunkType;
            this.keyword = keyword;
            this.value = value;
            this.compressed = compressed;
            this.languageTag = languageTag;
            this.translatedKeyword = translatedKeyword;
        }
    }

    // ---- Chunk stream ----

    public PngChunkStream parse(byte[] png) {
        if (png == null || png.length < FormatSniffer.PNG_SIGNATURE.length
            || !Arrays.equals(Arrays.copyOf(png, FormatSniffer.PNG_SIGNATURE.length), FormatSniffer.PNG_SIGNATURE)) {
            throw new MetadataCodecException(MetadataError.UNRECOGNIZED_FORMAT, "Missing PNG signature");
        }

        List<PngChunk> chunks = new ArrayList<>();
        int offset = FormatSniffer.PNG_SIGNATURE.length;
        while (true) {
            if (offset + 8 > png.length) {
                throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                    "PNG chunk stream ends at byte " + offset + " without an IEND chunk");
            }
            long length = FormatSniffer.readIntBE(png, offset) & 0xFFFFFFFFL;
            String type = new String(png, offset + 4, 4, StandardCharsets.US_ASCII);
            if (length > maxChunkSize) {
                throw new MetadataCodecException(MetadataError.CHUNK_TOO_LARGE,
                    "Chunk " + type + " at byte " + offset + " declares " + length + " bytes, limit is " + maxChunkSize);
            }
            if (offset + 12L + length > png.length) {
                throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                    "Chunk " + type + " at byte " + offset + " declares " + length + " bytes, only "
                        + (png.length - offset - 12) + " remain");
            }
            int dataStart = offset + 8;
            byte[] data = Arrays.copyOfRange(png, dataStart, dataStart + (int) length);
            int storedCrc = FormatSniffer.readIntBE(png, dataStart + (int) length);
            if (PngChunk.computeCrc(type, data) != storedCrc) {
                throw new MetadataCodecException(MetadataError.CHUNK_CRC_MISMATCH,
                    "CRC mismatch in chunk " + type + " at byte " + offset);
            }
            chunks.add(new PngChunk(type, data, storedCrc));
            offset = dataStart + (int) length + 4;
            if (PngChunk.IEND.equals(type)) {
                break;
            }
        }

        byte[] trailer = Arrays.copyOfRange(png, offset, png.length);
        if (trailer.length > 0) {
            log.debug("Keeping {} bytes found after IEND", trailer.length);
        }
        log.debug("Parsed {} PNG chunks", chunks.size());
        return new PngChunkStream(chunks, trailer);
    }

    public byte[] assemble(PngChunkStream stream) {
        int size = FormatSniffer.PNG_SIGNATURE.length + stream.getTrailer().length;
        for (PngChunk chunk : stream.getChunks()) {
            size += chunk.getEncodedLength();
        }
        ByteBuffer out = ByteBuffer.allocate(size);
        out.put(FormatSniffer.PNG_SIGNATURE);
        for (PngChunk chunk : stream.getChunks()) {
            out.putInt(chunk.getData().length);
            out.put(chunk.getType().getBytes(StandardCharsets.US_ASCII));
            out.put(chunk.getData());
            out.putInt(chunk.getCrc());
        }
        out.put(stream.getTrailer());
        return out.array();
    }

    // ---- Read path ----

    /**
     * Every text chunk except the XMP packet, first occurrence of a keyword wins.
     */
    public List<MetadataField> readText(PngChunkStream stream) {
        Map<String, MetadataField> fields = new LinkedHashMap<>();
        for (PngChunk chunk : stream.getChunks()) {
            if (!chunk.isText()) {
                continue;
            }
            TextEntry entry = decode(chunk);
            if (XMP_KEYWORD.equals(entry.keyword) || fields.containsKey(entry.keyword)) {
                continue;
            }
            MetadataField.TypeHint hint = PngChunk.INTERNATIONAL_TEXT.equals(entry.chunkType)
                ? MetadataField.TypeHint.UTF8_TEXT
                : MetadataField.TypeHint.LATIN1_TEXT;
            fields.put(entry.keyword, new MetadataField(MetadataNamespace.PNG_TEXT, entry.keyword, entry.value, hint));
        }
        return new ArrayList<>(fields.values());
    }

    /**
     * @return the UTF-8 bytes of the first XMP text chunk, or null
     */
    public byte[] readXmpPacket(PngChunkStream stream) {
        int index = findText(stream.getChunks(), XMP_KEYWORD, 0);
        if (index < 0) {
            return null;
        }
        return decode(stream.getChunks().get(index)).value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the TIFF structure held by the first eXIf chunk, or null
     */
    public byte[] readExif(PngChunkStream stream) {
        int index = stream.indexOf(PngChunk.EXIF);
        if (index < 0) {
            return null;
        }
        byte[] data = stream.getChunks().get(index).getData();
        if (data.length > EXIF_PREFIX.length && Arrays.equals(Arrays.copyOf(data, EXIF_PREFIX.length), EXIF_PREFIX)) {
            return Arrays.copyOfRange(data, EXIF_PREFIX.length, data.length);
        }
        return data;
    }

    // ---- Write path ----

    /**
     * Sets each keyword to its value. An existing chunk is rewritten where it stands, keeping
     * its kind unless the new value needs UTF-8, and later chunks with the same keyword are
     * dropped. A new keyword gets a tEXt chunk (iTXt when not Latin-1) just before IEND.
     *
     * @return true when at least one chunk changed
     */
    public boolean upsertText(PngChunkStream stream, Map<String, String> values) {
        boolean changed = false;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String keyword = entry.getKey();
            validateKeyword(keyword);
            if (XMP_KEYWORD.equals(keyword)) {
                throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                    "Keyword " + XMP_KEYWORD + " is reserved for the XMP packet", keyword, MetadataNamespace.PNG_TEXT);
            }
            validateValue(keyword, entry.getValue());
            changed |= upsert(stream, keyword, entry.getValue());
        }
        return changed;
    }

    /**
     * Stores the serialized XMP packet in an uncompressed iTXt chunk.
     */
    public boolean upsertXmpPacket(PngChunkStream stream, byte[] packet) {
        return upsert(stream, XMP_KEYWORD, new String(packet, StandardCharsets.UTF_8), true);
    }

    /**
     * Replaces the eXIf chunk payload, or inserts one before the first IDAT.
     * This is the one write that touches a non-text chunk, and it only happens when the caller
     * routes keys to the exif namespace explicitly. Text and XMP writes leave every other chunk as is.
     */
    public boolean upsertExif(PngChunkStream stream, byte[] tiff) {
        List<PngChunk> chunks = stream.getChunks();
        int index = stream.indexOf(PngChunk.EXIF);
        if (index >= 0) {
            if (Arrays.equals(readExif(stream), tiff)) {
                return false;
            }
            chunks.set(index, PngChunk.of(PngChunk.EXIF, tiff));
            return true;
        }
        int idat = stream.indexOf(PngChunk.IDAT);
        chunks.add(idat >= 0 ? idat : endIndex(stream), PngChunk.of(PngChunk.EXIF, tiff));
        log.debug("Inserted eXIf chunk ({} bytes)", tiff.length);
        return true;
    }

    private boolean upsert(PngChunkStream stream, String keyword, String value) {
        return upsert(stream, keyword, value, false);
    }

    private boolean upsert(PngChunkStream stream, String keyword, String value, boolean forceInternational) {
        List<PngChunk> chunks = stream.getChunks();
        int first = findText(chunks, keyword, 0);
        if (first < 0) {
            PngChunk created = forceInternational || !isLatin1(value)
                ? encodeInternational(keyword, value, false, "", "")
                : encodeText(keyword, value);
            chunks.add(endIndex(stream), created);
            log.debug("Inserted {} chunk for keyword '{}'", created.getType(), keyword);
            return true;
        }

        TextEntry existing = decode(chunks.get(first));
        if (existing.value.equals(value)) {
            return false;
        }
        chunks.set(first, rebuild(existing, value, forceInternational));
        int duplicate;
        while ((duplicate = findText(chunks, keyword, first + 1)) >= 0) {
            chunks.remove(duplicate);
            log.debug("Dropped duplicate text chunk for keyword '{}'", keyword);
        }
        log.debug("Rewrote {} chunk for keyword '{}' in place", chunks.get(first).getType(), keyword);
        return true;
    }

    private PngChunk rebuild(TextEntry existing, String value, boolean forceInternational) {
        boolean latin1 = isLatin1(value);
        if (!forceInternational && latin1 && PngChunk.TEXT.equals(existing.chunkType)) {
            return encodeText(existing.keyword, value);
        }
        if (!forceInternational && latin1 && PngChunk.COMPRESSED_TEXT.equals(existing.chunkType)) {
            return encodeCompressedText(existing.keyword, value);
        }
        if (PngChunk.INTERNATIONAL_TEXT.equals(existing.chunkType)) {
            return encodeInternational(existing.keyword, value, existing.compressed,
                existing.languageTag, existing.translatedKeyword);
        }
        return encodeInternational(existing.keyword, value, false, "", "");
    }

    private static int endIndex(PngChunkStream stream) {
        int end = stream.indexOf(PngChunk.IEND);
        return end >= 0 ? end : stream.getChunks().size();
    }

    private static int findText(List<PngChunk> chunks, String keyword, int from) {
        for (int i = from; i < chunks.size(); i++) {
            PngChunk chunk = chunks.get(i);
            if (chunk.isText() && keyword.equals(keywordOf(chunk))) {
                return i;
            }
        }
        return -1;
    }

    private static String keywordOf(PngChunk chunk) {
        byte[] data = chunk.getData();
        int nul = indexOf(data, 0);
        return new String(data, 0, nul >= 0 ? nul : data.length, StandardCharsets.ISO_8859_1);
    }

    // ---- Validation ----

    static void validateKeyword(String keyword) {
        String problem = null;
        if (keyword == null || keyword.isEmpty() || keyword.length() > MAX_KEYWORD_LENGTH) {
            problem = "must be 1 to " + MAX_KEYWORD_LENGTH + " characters";
        } else if (keyword.startsWith(" ") || keyword.endsWith(" ") || keyword.contains("  ")) {
            problem = "must not have leading, trailing or consecutive spaces";
        } else {
            for (int i = 0; i < keyword.length(); i++) {
                char c = keyword.charAt(i);
                if (c < 32 || (c > 126 && c < 161) || c > 255) {
                    problem = "must be printable Latin-1";
                    break;
                }
            }
        }
        if (problem != null) {
            throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                "Invalid PNG text keyword '" + keyword + "': " + problem, keyword, MetadataNamespace.PNG_TEXT);
        }
    }

    private static void validateValue(String keyword, String value) {
        if (value.indexOf('\0') >= 0) {
            throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                "PNG text values cannot contain NUL characters", keyword, MetadataNamespace.PNG_TEXT);
        }
    }

    private static boolean isLatin1(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0xFF) {
                return false;
            }
        }
        return true;
    }

    // ---- Text chunk codecs ----

    private TextEntry decode(PngChunk chunk) {
        byte[] data = chunk.getData();
        String type = chunk.getType();
        int nul = indexOf(data, 0);
        if (nul < 0) {
            throw truncatedText(type, "keyword terminator");
        }
        String keyword = new String(data, 0, nul, StandardCharsets.ISO_8859_1);

        if (PngChunk.TEXT.equals(type)) {
            String value = new String(data, nul + 1, data.length - nul - 1, StandardCharsets.ISO_8859_1);
            return new TextEntry(type, keyword, value, false, "", "");
        }

        if (PngChunk.COMPRESSED_TEXT.equals(type)) {
            if (nul + 1 >= data.length) {
                throw truncatedText(type, "compression method");
            }
            requireDeflate(data[nul + 1], keyword);
            byte[] text = inflate(data, nul + 2, keyword);
            return new TextEntry(type, keyword, new String(text, StandardCharsets.ISO_8859_1), true, "", "");
        }

        // iTXt: keyword 0 flag method language 0 translated-keyword 0 text
        if (nul + 3 > data.length) {
            throw truncatedText(type, "compression flag");
        }
        boolean compressed = data[nul + 1] != 0;
        if (compressed) {
            requireDeflate(data[nul + 2], keyword);
        }
        int languageStart = nul + 3;
        int languageEnd = indexOf(data, languageStart);
        if (languageEnd < 0) {
            throw truncatedText(type, "language tag terminator");
        }
        int translatedEnd = indexOf(data, languageEnd + 1);
        if (translatedEnd < 0) {
            throw truncatedText(type, "translated keyword terminator");
        }
        String languageTag = new String(data, languageStart, languageEnd - languageStart, StandardCharsets.US_ASCII);
        String translated = new String(data, languageEnd + 1, translatedEnd - languageEnd - 1, StandardCharsets.UTF_8);
        byte[] text = compressed
            ? inflate(data, translatedEnd + 1, keyword)
            : Arrays.copyOfRange(data, translatedEnd + 1, data.length);
        return new TextEntry(type, keyword, new String(text, StandardCharsets.UTF_8), compressed, languageTag, translated);
    }

    private static PngChunk encodeText(String keyword, String value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keyword.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.writeBytes(value.getBytes(StandardCharsets.ISO_8859_1));
        return PngChunk.of(PngChunk.TEXT, out.toByteArray());
    }

    private static PngChunk encodeCompressedText(String keyword, String value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keyword.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(0);
        out.writeBytes(deflate(value.getBytes(StandardCharsets.ISO_8859_1)));
        return PngChunk.of(PngChunk.COMPRESSED_TEXT, out.toByteArray());
    }

    private static PngChunk encodeInternational(String keyword, String value, boolean compressed,
                                                String languageTag, String translatedKeyword) {
        byte[] text = value.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keyword.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(compressed ? 1 : 0);
        out.write(0);
        out.writeBytes(languageTag.getBytes(StandardCharsets.US_ASCII));
        out.write(0);
        out.writeBytes(translatedKeyword.getBytes(StandardCharsets.UTF_8));
        out.write(0);
        out.writeBytes(compressed ? deflate(text) : text);
        return PngChunk.of(PngChunk.INTERNATIONAL_TEXT, out.toByteArray());
    }

    private byte[] inflate(byte[] data, int offset, String keyword) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data, offset, data.length - offset);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                        "Compressed text for keyword '" + keyword + "' ends early", keyword, MetadataNamespace.PNG_TEXT);
                }
                if (out.size() + n > maxInflatedTextSize) {
                    throw new MetadataCodecException(MetadataError.RESOURCE_LIMIT_EXCEEDED,
                        "Compressed text for keyword '" + keyword + "' inflates past " + maxInflatedTextSize + " bytes",
                        keyword, MetadataNamespace.PNG_TEXT);
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                "Corrupt compressed text for keyword '" + keyword + "'", keyword, MetadataNamespace.PNG_TEXT, e);
        } finally {
            inflater.end();
        }
    }

    private static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static void requireDeflate(byte method, String keyword) {
        if (method != 0) {
            throw new MetadataCodecException(MetadataError.UNSUPPORTED_OPERATION,
                "Unknown compression method " + (method & 0xFF) + " for keyword '" + keyword + "'",
                keyword, MetadataNamespace.PNG_TEXT);
        }
    }

    private static MetadataCodecException truncatedText(String type, String missing) {
        return new MetadataCodecException(MetadataError.TRUNCATED_CHUNK, type + " chunk is missing its " + missing);
    }

    private static int indexOf(byte[] data, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == 0) {
                return i;
            }
        }
        return -1;
    }
}
