package com.imagemeta.service;

import com.imagemeta.domain.JpegSegment;
import com.imagemeta.domain.JpegSegmentList;
import com.imagemeta.domain.MetadataError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a JPEG into its header segments and the scan data behind them, and swaps the
 * APP1 segments that carry EXIF and XMP.
 */
@Service
public class JpegSegmentCodec {

    private static final Logger log = LoggerFactory.getLogger(JpegSegmentCodec.class);

    static final byte[] EXIF_LABEL = {'E', 'x', 'i', 'f', 0, 0};
    static final byte[] XMP_LABEL = "http://ns.adobe.com/xap/1.0/\0".getBytes(StandardCharsets.US_ASCII);

    // 16 bit length field minus its own two bytes
    private static final int MAX_PAYLOAD = 0xFFFF - 2;

    private static final int SOI = 0xD8;
    private static final int EOI = 0xD9;
    private static final int SOS = 0xDA;
    private static final int TEM = 0x01;

    public JpegSegmentList parse(byte[] jpeg) {
        if (jpeg == null || jpeg.length < 2 || (jpeg[0] & 0xFF) != 0xFF || (jpeg[1] & 0xFF) != SOI) {
            throw new MetadataCodecException(MetadataError.UNRECOGNIZED_FORMAT, "Missing JPEG start-of-image marker");
        }

        List<JpegSegment> segments = new ArrayList<>();
        int offset = 2;
        while (offset < jpeg.length) {
            if ((jpeg[offset] & 0xFF) != 0xFF || offset + 1 >= jpeg.length) {
                log.debug("No marker at byte {}, keeping the rest of the file as is", offset);
                break;
            }
            int marker = jpeg[offset + 1] & 0xFF;
            if (marker == 0xFF) {
                // fill byte
                offset++;
                continue;
            }
            if (marker == SOS || marker == EOI) {
                break;
            }
            if ((marker >= 0xD0 && marker <= 0xD7) || marker == TEM) {
                segments.add(new JpegSegment(marker, null));
                offset += 2;
                continue;
            }
            if (offset + 4 > jpeg.length) {
                throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                    String.format("Segment 0xFF%02X at byte %d has no length field", marker, offset));
            }
            int segmentLength = ((jpeg[offset + 2] & 0xFF) << 8) | (jpeg[offset + 3] & 0xFF);
            if (segmentLength < 2 || offset + 2 + segmentLength > jpeg.length) {
                throw new MetadataCodecException(MetadataError.TRUNCATED_CHUNK,
                    String.format("Segment 0xFF%02X at byte %d declares %d bytes past the end of the file",
                        marker, offset, segmentLength));
            }
            segments.add(new JpegSegment(marker, Arrays.copyOfRange(jpeg, offset + 4, offset + 2 + segmentLength)));
            offset += 2 + segmentLength;
        }

        log.debug("Parsed {} JPEG header segments, {} bytes of scan data follow", segments.size(), jpeg.length - offset);
        return new JpegSegmentList(segments, Arrays.copyOfRange(jpeg, Math.min(offset, jpeg.length), jpeg.length));
    }

    public byte[] assemble(JpegSegmentList list) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0xFF);
        out.write(SOI);
        for (JpegSegment segment : list.getSegments()) {
            out.write(0xFF);
            out.write(segment.getMarker());
            if (segment.isStandalone()) {
                continue;
            }
            int segmentLength = segment.getPayload().length + 2;
            out.write((segmentLength >> 8) & 0xFF);
            out.write(segmentLength & 0xFF);
            out.writeBytes(segment.getPayload());
        }
        out.writeBytes(list.getRemainder());
        return out.toByteArray();
    }

    /**
     * @return the TIFF structure inside the first "Exif" APP1 segment, or null
     */
    public byte[] readExif(JpegSegmentList list) {
        return labelledPayload(list, EXIF_LABEL);
    }

    /**
     * @return the XMP packet inside the first APP1 segment carrying the XMP namespace label, or null
     */
    public byte[] readXmpPacket(JpegSegmentList list) {
        return labelledPayload(list, XMP_LABEL);
    }

    /**
     * Replaces the EXIF segment, or inserts one right after the leading APP0 (JFIF) segments.
     */
    public boolean upsertExif(JpegSegmentList list, byte[] tiff) {
        return upsert(list, EXIF_LABEL, tiff, false);
    }

    /**
     * Replaces the XMP segment, or inserts one after the leading APP0 and APP1 segments.
     */
    public boolean upsertXmpPacket(JpegSegmentList list, byte[] packet) {
        return upsert(list, XMP_LABEL, packet, true);
    }

    private boolean upsert(JpegSegmentList list, byte[] label, byte[] body, boolean afterApp1) {
        if (label.length + body.length > MAX_PAYLOAD) {
            throw new MetadataCodecException(MetadataError.RESOURCE_LIMIT_EXCEEDED,
                "Segment body of " + body.length + " bytes does not fit in one APP1 segment");
        }
        byte[] payload = new byte[label.length + body.length];
        System.arraycopy(label, 0, payload, 0, label.length);
        System.arraycopy(body, 0, payload, label.length, body.length);

        List<JpegSegment> segments = list.getSegments();
        int existing = find(list, label);
        if (existing >= 0) {
            if (Arrays.equals(segments.get(existing).getPayload(), payload)) {
                return false;
            }
            segments.set(existing, new JpegSegment(JpegSegment.APP1, payload));
            log.debug("Replaced APP1 segment #{} ({} bytes)", existing, payload.length);
            return true;
        }

        int index = 0;
        while (index < segments.size()) {
            int marker = segments.get(index).getMarker();
            if (marker != JpegSegment.APP0 && !(afterApp1 && marker == JpegSegment.APP1)) {
                break;
            }
            index++;
        }
        segments.add(index, new JpegSegment(JpegSegment.APP1, payload));
        log.debug("Inserted APP1 segment at position {} ({} bytes)", index, payload.length);
        return true;
    }

    private static int find(JpegSegmentList list, byte[] label) {
        List<JpegSegment> segments = list.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            JpegSegment segment = segments.get(i);
            if (segment.getMarker() == JpegSegment.APP1 && segment.startsWith(label)) {
                return i;
            }
        }
        return -1;
    }

    private static byte[] labelledPayload(JpegSegmentList list, byte[] label) {
        int index = find(list, label);
        if (index < 0) {
            return null;
        }
        byte[] payload = list.getSegments().get(index).getPayload();
        return Arrays.copyOfRange(payload, label.length, payload.length);
    }
}
