package com.imagemeta.service;

import com.imagemeta.domain.ImageContainer;
import com.imagemeta.domain.ImageFormat;
import com.imagemeta.domain.JpegSegmentList;
import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataField;
import com.imagemeta.domain.MetadataNamespace;
import com.imagemeta.domain.MetadataReadResponse;
import com.imagemeta.domain.MetadataWriteResult;
import com.imagemeta.domain.PngChunkStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for reads and writes. Detects the container, runs every codec that applies to it,
 * and for writes routes each key to the codec that owns it before reassembling the file once.
 */
@Service
public class MetadataService {

    private static final Logger log = LoggerFactory.getLogger(MetadataService.class);

    /**
     * Applies one namespace worth of values to the file being edited.
     */
    @FunctionalInterface
    private interface NamespaceWriter {
        boolean write(EditSession session, Map<String, String> values);
    }

    /**
     * Parsed, mutable view of the file being edited. Only the structure matching the format is set.
     */
    private static final class EditSession {
        final ImageContainer container;
        JpegSegmentList jpeg;
        PngChunkStream png;
        byte[] tiff;

        EditSession(ImageContainer container) {
            this.container = container;
        }
    }

    private final FormatSniffer formatSniffer;
    private final TiffIfdCodec tiffIfdCodec;
    private final PngChunkProcessor pngChunkProcessor;
    private final JpegSegmentCodec jpegSegmentCodec;
    private final XmpPacketCodec xmpPacketCodec;
    private final WebpChunkReader webpChunkReader;
    private final MetadataNamespace pngDefaultNamespace;

    private final Map<ImageFormat, Map<MetadataNamespace, NamespaceWriter>> writers = new EnumMap<>(ImageFormat.class);

    public MetadataService(
        FormatSniffer formatSniffer,
        TiffIfdCodec tiffIfdCodec,
        PngChunkProcessor pngChunkProcessor,
        JpegSegmentCodec jpegSegmentCodec,
        XmpPacketCodec xmpPacketCodec,
        WebpChunkReader webpChunkReader,
        @Value("${app.metadata.png.default-write-namespace:xmp}") String pngDefaultNamespace
    ) {
        this.formatSniffer = formatSniffer;
        this.tiffIfdCodec = tiffIfdCodec;
        this.pngChunkProcessor = pngChunkProcessor;
        this.jpegSegmentCodec = jpegSegmentCodec;
        this.xmpPacketCodec = xmpPacketCodec;
        this.webpChunkReader = webpChunkReader;
        this.pngDefaultNamespace = MetadataNamespace.fromWireName(pngDefaultNamespace);
        if (this.pngDefaultNamespace == null) {
            throw new IllegalArgumentException("Unknown app.metadata.png.default-write-namespace: " + pngDefaultNamespace);
        }

        Map<MetadataNamespace, NamespaceWriter> jpeg = new EnumMap<>(MetadataNamespace.class);
        jpeg.put(MetadataNamespace.EXIF, this::writeJpegExif);
        jpeg.put(MetadataNamespace.XMP, this::writeJpegXmp);
        writers.put(ImageFormat.JPEG, jpeg);

        Map<MetadataNamespace, NamespaceWriter> png = new EnumMap<>(MetadataNamespace.class);
        png.put(MetadataNamespace.PNG_TEXT, (session, values) -> pngChunkProcessor.upsertText(session.png, values));
        png.put(MetadataNamespace.XMP, this::writePngXmp);
        png.put(MetadataNamespace.EXIF, this::writePngExif);
        writers.put(ImageFormat.PNG, png);

        // XMP is never embedded in TIFF, those keys go to the EXIF directory instead
        Map<MetadataNamespace, NamespaceWriter> tiff = new EnumMap<>(MetadataNamespace.class);
        tiff.put(MetadataNamespace.EXIF, this::writeTiffExif);
        tiff.put(MetadataNamespace.XMP, this::writeTiffExif);
        writers.put(ImageFormat.TIFF, tiff);

        log.info("MetadataService initialized, PNG writes default to namespace '{}'", this.pngDefaultNamespace.getWireName());
    }

    // ---- Read ----

    public MetadataReadResponse read(byte[] data) {
        ImageContainer container = formatSniffer.sniff(data);
        Map<String, String> exif = new LinkedHashMap<>();
        Map<String, String> pngText = new LinkedHashMap<>();
        Map<String, String> xmp = new LinkedHashMap<>();

        switch (container.getFormat()) {
            case JPEG: {
                JpegSegmentList segments = jpegSegmentCodec.parse(data);
                putAll(exif, readExif(jpegSegmentCodec.readExif(segments)));
                putAll(xmp, readXmp(jpegSegmentCodec.readXmpPacket(segments)));
                break;
            }
            case PNG: {
                PngChunkStream stream = pngChunkProcessor.parse(data);
                putAll(pngText, pngChunkProcessor.readText(stream));
                putAll(xmp, readXmp(pngChunkProcessor.readXmpPacket(stream)));
                putAll(exif, readExif(pngChunkProcessor.readExif(stream)));
                break;
            }
            case TIFF:
                putAll(exif, tiffIfdCodec.read(data));
                putAll(xmp, readXmp(tiffIfdCodec.readXmpPacket(data)));
                break;
            case WEBP:
                putAll(exif, readExif(webpChunkReader.readExif(data)));
                putAll(xmp, readXmp(webpChunkReader.readXmpPacket(data)));
                break;
            default:
                break;
        }

        log.info("Read {} image ({} bytes): {} exif, {} png_text, {} xmp fields",
            container.getFormat(), data.length, exif.size(), pngText.size(), xmp.size());
        return new MetadataReadResponse(container.getFormat().name(), container.getWidth(), container.getHeight(),
            exif, pngText, xmp);
    }

    private List<MetadataField> readExif(byte[] tiff) {
        return tiff != null ? tiffIfdCodec.read(tiff) : Collections.emptyList();
    }

    private List<MetadataField> readXmp(byte[] packet) {
        return packet != null ? xmpPacketCodec.read(packet) : Collections.emptyList();
    }

    private static void putAll(Map<String, String> target, List<MetadataField> fields) {
        for (MetadataField field : fields) {
            target.putIfAbsent(field.getKey(), field.getValue());
        }
    }

    // ---- Write ----

    /**
     * @param expectedFormat optional container name the input must match, since transcoding is not offered
     * @param namespace optional namespace that receives every key instead of the default routing
     */
    public MetadataWriteResult write(byte[] data, Map<String, String> values, String expectedFormat, String namespace) {
        ImageContainer container = formatSniffer.sniff(data);
        ImageFormat format = container.getFormat();
        checkExpectedFormat(format, expectedFormat);
        MetadataNamespace override = parseNamespace(namespace);

        Map<String, String> requested = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    requested.put(key, value);
                }
            });
        }

        Map<MetadataNamespace, Map<String, String>> routed = route(format, requested, override);
        Map<MetadataNamespace, NamespaceWriter> table = writers.getOrDefault(format, Collections.emptyMap());
        for (Map.Entry<MetadataNamespace, Map<String, String>> group : routed.entrySet()) {
            if (!table.containsKey(group.getKey())) {
                String key = group.getValue().keySet().iterator().next();
                throw new MetadataCodecException(MetadataError.UNSUPPORTED_OPERATION,
                    "Writing " + group.getKey().getWireName() + " metadata to " + format + " is not supported",
                    key, group.getKey());
            }
        }

        EditSession session = open(container);
        boolean changed = false;
        for (Map.Entry<MetadataNamespace, Map<String, String>> group : routed.entrySet()) {
            try {
                changed |= table.get(group.getKey()).write(session, group.getValue());
            } catch (MetadataCodecException e) {
                log.debug("Write to {} {} failed: {}", format, group.getKey().getWireName(), e.getMessage());
                throw e.forField(e.getKey(), group.getKey());
            }
        }

        byte[] output = changed ? reassemble(session) : data;
        log.info("Updated {} image ({} -> {} bytes), keys {} routed to {}{}",
            format, data.length, output.length, requested.keySet(), routed.keySet(), changed ? "" : ", nothing changed");
        return new MetadataWriteResult(format, output, requested);
    }

    private static void checkExpectedFormat(ImageFormat actual, String expectedFormat) {
        if (expectedFormat == null || expectedFormat.isBlank()) {
            return;
        }
        ImageFormat expected = ImageFormat.fromName(expectedFormat);
        if (expected != actual) {
            throw new MetadataCodecException(MetadataError.UNSUPPORTED_OPERATION,
                "Requested format '" + expectedFormat + "' does not match the detected " + actual + " container");
        }
    }

    private static MetadataNamespace parseNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            return null;
        }
        MetadataNamespace parsed = MetadataNamespace.fromWireName(namespace);
        if (parsed == null) {
            throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                "Unknown namespace '" + namespace + "', expected exif, xmp or png_text");
        }
        return parsed;
    }

    private Map<MetadataNamespace, Map<String, String>> route(ImageFormat format, Map<String, String> values,
                                                              MetadataNamespace override) {
        Map<MetadataNamespace, Map<String, String>> routed = new EnumMap<>(MetadataNamespace.class);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            MetadataNamespace target = override != null ? override : defaultNamespace(format, entry.getKey());
            routed.computeIfAbsent(target, ns -> new LinkedHashMap<>()).put(entry.getKey(), entry.getValue());
        }
        return routed;
    }

    private MetadataNamespace defaultNamespace(ImageFormat format, String key) {
        switch (format) {
            case JPEG:
                return TiffIfdCodec.RECOGNIZED_KEYS.contains(key) ? MetadataNamespace.EXIF : MetadataNamespace.XMP;
            case PNG:
                return pngDefaultNamespace;
            default:
                return MetadataNamespace.EXIF;
        }
    }

    private EditSession open(ImageContainer container) {
        EditSession session = new EditSession(container);
        switch (container.getFormat()) {
            case JPEG:
                session.jpeg = jpegSegmentCodec.parse(container.getData());
                break;
            case PNG:
                session.png = pngChunkProcessor.parse(container.getData());
                break;
            case TIFF:
                session.tiff = container.getData();
                break;
            default:
                break;
        }
        return session;
    }

    private byte[] reassemble(EditSession session) {
        switch (session.container.getFormat()) {
            case JPEG:
                return jpegSegmentCodec.assemble(session.jpeg);
            case PNG:
                return pngChunkProcessor.assemble(session.png);
            case TIFF:
                return session.tiff;
            default:
                throw new MetadataCodecException(MetadataError.UNSUPPORTED_OPERATION,
                    "Cannot rewrite " + session.container.getFormat() + " containers");
        }
    }

    // ---- Writers ----

    private boolean writeJpegExif(EditSession session, Map<String, String> values) {
        byte[] tiff = jpegSegmentCodec.readExif(session.jpeg);
        byte[] updated = tiffIfdCodec.write(tiff, values);
        return updated != tiff && jpegSegmentCodec.upsertExif(session.jpeg, updated);
    }

    private boolean writeJpegXmp(EditSession session, Map<String, String> values) {
        byte[] packet = jpegSegmentCodec.readXmpPacket(session.jpeg);
        byte[] merged = xmpPacketCodec.merge(packet, values);
        return merged != packet && jpegSegmentCodec.upsertXmpPacket(session.jpeg, merged);
    }

    private boolean writePngXmp(EditSession session, Map<String, String> values) {
        byte[] packet = pngChunkProcessor.readXmpPacket(session.png);
        byte[] merged = xmpPacketCodec.merge(packet, values);
        return merged != packet && pngChunkProcessor.upsertXmpPacket(session.png, merged);
    }

    private boolean writePngExif(EditSession session, Map<String, String> values) {
        byte[] tiff = pngChunkProcessor.readExif(session.png);
        byte[] updated = tiffIfdCodec.write(tiff, values);
        return updated != tiff && pngChunkProcessor.upsertExif(session.png, updated);
    }

    private boolean writeTiffExif(EditSession session, Map<String, String> values) {
        byte[] updated = tiffIfdCodec.write(session.tiff, values);
        if (updated == session.tiff) {
            return false;
        }
        session.tiff = updated;
        return true;
    }
}
