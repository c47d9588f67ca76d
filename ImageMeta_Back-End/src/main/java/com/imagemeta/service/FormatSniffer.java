package com.imagemeta.service;

import com.imagemeta.domain.ImageContainer;
import com.imagemeta.domain.ImageFormat;
import com.imagemeta.domain.MetadataError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Classifies a buffer by its magic bytes and pulls the pixel dimensions out of the header
 * when they are cheap to reach. Nothing past the header is interpreted here.
 */
@Service
public class FormatSniffer {

    private static final Logger log = LoggerFactory.getLogger(FormatSniffer.class);

    static final byte[] PNG_SIGNATURE = new byte[] {
        (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };

    private static final int TAG_IMAGE_WIDTH = 0x0100;
    private static final int TAG_IMAGE_LENGTH = 0x0101;

    /**
     * @throws MetadataCodecException with {@link MetadataError#UNRECOGNIZED_FORMAT} when no magic matches
     */
    public ImageContainer sniff(byte[] data) {
        ImageFormat format = detect(data);
        if (format == ImageFormat.UNKNOWN) {
            throw new MetadataCodecException(MetadataError.UNRECOGNIZED_FORMAT,
                "Unrecognized image format (" + (data == null ? 0 : data.length) + " bytes)");
        }

        int[] dimensions = null;
        switch (format) {
            case JPEG:
                dimensions = jpegDimensions(data);
                break;
            case PNG:
                dimensions = pngDimensions(data);
                break;
            case TIFF:
                dimensions = tiffDimensions(data);
                break;
            case WEBP:
                dimensions = webpDimensions(data);
                break;
            default:
                break;
        }
        log.debug("Sniffed {} ({} bytes), dimensions={}", format, data.length,
            dimensions != null ? dimensions[0] + "x" + dimensions[1] : "n/a");
        if (dimensions == null) {
            return new ImageContainer(format, data, null, null);
        }
        return new ImageContainer(format, data, dimensions[0], dimensions[1]);
    }

    public ImageFormat detect(byte[] data) {
        if (data == null) {
            return ImageFormat.UNKNOWN;
        }
        if (data.length >= 2 && (data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xD8) {
            return ImageFormat.JPEG;
        }
        if (startsWith(data, PNG_SIGNATURE)) {
            return ImageFormat.PNG;
        }
        if (data.length >= 4
            && ((data[0] == 'I' && data[1] == 'I' && data[2] == 0x2A && data[3] == 0x00)
            || (data[0] == 'M' && data[1] == 'M' && data[2] == 0x00 && data[3] == 0x2A))) {
            return ImageFormat.TIFF;
        }
        if (data.length >= 12
            && data[0] == 'R' && data[1] == 'I' && data[2] == 'F' && data[3] == 'F'
            && data[8] == 'W' && data[9] == 'E' && data[10] == 'B' && data[11] == 'P') {
            return ImageFormat.WEBP;
        }
        return ImageFormat.UNKNOWN;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private int[] pngDimensions(byte[] data) {
        // signature(8) + length(4) + "IHDR"(4) + width(4) + height(4)
        if (data.length < 24 || data[12] != 'I' || data[13] != 'H' || data[14] != 'D' || data[15] != 'R') {
            return null;
        }
        return new int[] {readIntBE(data, 16), readIntBE(data, 20)};
    }

    private int[] jpegDimensions(byte[] data) {
        int index = 2;
        while (index + 3 < data.length) {
            if ((data[index] & 0xFF) != 0xFF) {
                return null;
            }
            int marker = data[index + 1] & 0xFF;
            if (marker == 0xFF) {
                index++;
                continue;
            }
            if (marker == 0xD9 || marker == 0xDA) {
                return null;
            }
            if ((marker >= 0xD0 && marker <= 0xD7) || marker == 0x01) {
                index += 2;
                continue;
            }
            int segmentLength = ((data[index + 2] & 0xFF) << 8) | (data[index + 3] & 0xFF);
            if (segmentLength < 2 || index + 2 + segmentLength > data.length) {
                return null;
            }
            if (isStartOfFrame(marker) && segmentLength >= 7) {
                int height = ((data[index + 5] & 0xFF) << 8) | (data[index + 6] & 0xFF);
                int width = ((data[index + 7] & 0xFF) << 8) | (data[index + 8] & 0xFF);
                return new int[] {width, height};
            }
            index += 2 + segmentLength;
        }
        return null;
    }

    private static boolean isStartOfFrame(int marker) {
        return marker >= 0xC0 && marker <= 0xCF && marker != 0xC4 && marker != 0xC8 && marker != 0xCC;
    }

    private int[] tiffDimensions(byte[] data) {
        if (data.length < 8) {
            return null;
        }
        ByteBuffer buf = ByteBuffer.wrap(data).order(data[0] == 'I' ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        long ifdOffset = buf.getInt(4) & 0xFFFFFFFFL;
        if (ifdOffset < 8 || ifdOffset + 2 > data.length) {
            return null;
        }
        int count = buf.getShort((int) ifdOffset) & 0xFFFF;
        Integer width = null;
        Integer height = null;
        for (int i = 0; i < count; i++) {
            int entry = (int) ifdOffset + 2 + i * 12;
            if (entry + 12 > data.length) {
                break;
            }
            int tag = buf.getShort(entry) & 0xFFFF;
            int type = buf.getShort(entry + 2) & 0xFFFF;
            if (tag != TAG_IMAGE_WIDTH && tag != TAG_IMAGE_LENGTH) {
                continue;
            }
            // SHORT or LONG, always inline for a single value
            int value = type == 3 ? buf.getShort(entry + 8) & 0xFFFF : buf.getInt(entry + 8);
            if (tag == TAG_IMAGE_WIDTH) {
                width = value;
            } else {
                height = value;
            }
        }
        return width != null && height != null ? new int[] {width, height} : null;
    }

    private int[] webpDimensions(byte[] data) {
        int offset = 12;
        if (offset + 8 > data.length) {
            return null;
        }
        int payload = offset + 8;
        String fourCc = new String(data, offset, 4, StandardCharsets.US_ASCII);
        int chunkSize = readIntLE(data, offset + 4);
        if (chunkSize < 0 || payload + chunkSize > data.length) {
            return null;
        }
        switch (fourCc) {
            case "VP8X":
                if (chunkSize < 10) {
                    return null;
                }
                return new int[] {readUInt24LE(data, payload + 4) + 1, readUInt24LE(data, payload + 7) + 1};
            case "VP8 ":
                // frame tag(3) + start code 9D 01 2A + 14-bit width/height
                if (chunkSize < 10 || (data[payload + 3] & 0xFF) != 0x9D
                    || (data[payload + 4] & 0xFF) != 0x01 || (data[payload + 5] & 0xFF) != 0x2A) {
                    return null;
                }
                int width = ((data[payload + 6] & 0xFF) | ((data[payload + 7] & 0xFF) << 8)) & 0x3FFF;
                int height = ((data[payload + 8] & 0xFF) | ((data[payload + 9] & 0xFF) << 8)) & 0x3FFF;
                return new int[] {width, height};
            case "VP8L":
                if (chunkSize < 5 || (data[payload] & 0xFF) != 0x2F) {
                    return null;
                }
                int bits = readIntLE(data, payload + 1);
                return new int[] {(bits & 0x3FFF) + 1, ((bits >>> 14) & 0x3FFF) + 1};
            default:
                return null;
        }
    }

    static int readIntBE(byte[] data, int offset) {
        return ((data[offset] & 0xFF) << 24)
            | ((data[offset + 1] & 0xFF) << 16)
            | ((data[offset + 2] & 0xFF) << 8)
            | (data[offset + 3] & 0xFF);
    }

    static int readIntLE(byte[] data, int offset) {
        return (data[offset] & 0xFF)
            | ((data[offset + 1] & 0xFF) << 8)
            | ((data[offset + 2] & 0xFF) << 16)
            | ((data[offset + 3] & 0xFF) << 24);
    }

    private static int readUInt24LE(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8) | ((data[offset + 2] & 0xFF) << 16);
    }
}
