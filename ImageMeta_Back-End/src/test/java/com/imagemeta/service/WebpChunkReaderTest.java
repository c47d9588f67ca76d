package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebpChunkReaderTest {

    private final WebpChunkReader reader = new WebpChunkReader(1024 * 1024);

    @Test
    void findsExifWithOrWithoutLabel() {
        byte[] tiff = TestImages.tiffIfdCodec().write(null, Map.of("artist", "odd length!"));
        byte[] labelled = new byte[6 + tiff.length];
        System.arraycopy(new byte[] {'E', 'x', 'i', 'f', 0, 0}, 0, labelled, 0, 6);
        System.arraycopy(tiff, 0, labelled, 6, tiff.length);

        assertThat(reader.readExif(TestImages.webp(2, 2, tiff, null))).isEqualTo(tiff);
        assertThat(reader.readExif(TestImages.webp(2, 2, labelled, null))).isEqualTo(tiff);
    }

    @Test
    void findsXmpAfterOddSizedChunk() {
        byte[] xmp = "<x:xmpmeta xmlns:x='adobe:ns:meta/'/>".getBytes(StandardCharsets.UTF_8);
        byte[] odd = {1, 2, 3};

        assertThat(reader.readXmpPacket(TestImages.webp(2, 2, odd, xmp))).isEqualTo(xmp);
        assertThat(reader.readXmpPacket(TestImages.webp(2, 2, null, null))).isNull();
    }

    @Test
    void rejectsChunkRunningPastTheEnd() {
        byte[] webp = TestImages.webp(2, 2, new byte[40], null);
        byte[] cut = Arrays.copyOf(webp, webp.length - 10);

        assertThatThrownBy(() -> reader.readExif(cut))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.TRUNCATED_CHUNK));
    }
}
