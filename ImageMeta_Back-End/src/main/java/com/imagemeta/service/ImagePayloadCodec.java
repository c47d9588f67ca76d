package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Converts the base64 text carried by requests and responses to raw image bytes and back.
 * Accepts an optional {@code data:<mime>;base64,} prefix and ignores embedded whitespace.
 */
@Component
public class ImagePayloadCodec {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public byte[] decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MetadataCodecException(MetadataError.INVALID_PAYLOAD, "image_base64 is empty");
        }
        String text = payload.trim();
        if (text.startsWith("data:")) {
            int comma = text.indexOf(',');
            if (comma < 0) {
                throw new MetadataCodecException(MetadataError.INVALID_PAYLOAD, "Data URL without a ',' separator");
            }
            text = text.substring(comma + 1);
        }
        text = WHITESPACE.matcher(text).replaceAll("");
        try {
            byte[] data = Base64.getDecoder().decode(text);
            if (data.length == 0) {
                throw new MetadataCodecException(MetadataError.INVALID_PAYLOAD, "image_base64 decodes to zero bytes");
            }
            return data;
        } catch (IllegalArgumentException e) {
            throw new MetadataCodecException(MetadataError.INVALID_PAYLOAD, "Invalid base64 image data: " + e.getMessage(), e);
        }
    }

    public String encode(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }
}
