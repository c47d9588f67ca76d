package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks the RIFF chunks of a WebP file to find the embedded EXIF and XMP payloads.
 * Read only: WebP files are never rewritten.
 */
@Service
public class WebpChunkReader {

    private static final Logger log = LoggerFactory.getLogger(WebpChunkReader.class);

    private static final String EXIF_CHUNK = "EXIF";
    private static final String XMP_CHUNK = "XMP ";
    private static final byte[] EXIF_PREFIX = {'E', 'x', 'i', 'f', 0, 0};

    private final long maxChunkSize;

    public WebpChunkReader(@Value("${app.metadata.max-chunk-size:16777216}") long maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
    }

    /**
     * @return chunk payloads keyed by FourCC, first occurrence of each
     */
    Map<String, byte[]> chunks(byte[] webp) {
        Map<String, byte[]> chunks = new LinkedHashMap<>();
        int offset = 12;
        while (offset + 8 <= webp.length) {
            String fourCc = new String(webp, offset, 4, StandardCharsets.US_ASCII);
            long size = FormatSniffer.readIntLE(webp, offset + 4) & 0xFFFFFFFFL;
            if (size > maxChunkSize) {
                throw new MetadataCodecException(MetadataError.CHUNK_TOO_LARGE,
                    "WebP chunk '" + fourCc + "' declares " + size + " bytes, limit is " + maxChunkSize);
            }
            if (offset + 8L + size > webp.length) {
                throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                    "WebP chunk '" + fourCc + "' at byte " + offset + " runs past the end of the file");
            }
            chunks.putIfAbsent(fourCc, Arrays.copyOfRange(webp, offset + 8, offset + 8 + (int) size));
            // payloads are padded to an even length
            offset += 8 + (int) size + (int) (size & 1);
        }
        log.debug("WebP chunks: {}", chunks.keySet());
        return chunks;
    }

    public byte[] readExif(byte[] webp) {
        byte[] exif = chunks(webp).get(EXIF_CHUNK);
        if (exif != null && exif.length > EXIF_PREFIX.length
            && Arrays.equals(Arrays.copyOf(exif, EXIF_PREFIX.length), EXIF_PREFIX)) {
            return Arrays.copyOfRange(exif, EXIF_PREFIX.length, exif.length);
        }
        return exif;
    }

    public byte[] readXmpPacket(byte[] webp) {
        return chunks(webp).get(XMP_CHUNK);
    }
}
