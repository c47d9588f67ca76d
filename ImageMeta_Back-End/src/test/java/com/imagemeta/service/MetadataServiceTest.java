package com.imagemeta.service;

import com.imagemeta.domain.ImageFormat;
import com.imagemeta.domain.JpegSegmentList;
import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataNamespace;
import com.imagemeta.domain.MetadataReadResponse;
import com.imagemeta.domain.MetadataWriteResult;
import com.imagemeta.domain.PngChunk;
import com.imagemeta.domain.PngChunkStream;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataServiceTest {

    private final MetadataService service = TestImages.metadataService("xmp");

    @Test
    void jpegDescriptionRoundTripKeepsDimensions() {
        byte[] jpeg = TestImages.jpeg(10, 10);

        MetadataWriteResult written = service.write(jpeg, Map.of("description", "hello"), null, null);
        MetadataReadResponse read = service.read(written.getData());

        assertThat(written.getFormat()).isEqualTo(ImageFormat.JPEG);
        assertThat(written.getUpdated()).containsExactly(Map.entry("description", "hello"));
        assertThat(read.getExif()).containsEntry("description", "hello");
        assertThat(read.getWidth()).isEqualTo(10);
        assertThat(read.getHeight()).isEqualTo(10);
        assertThat(read.getFormat()).isEqualTo("JPEG");
    }

    @Test
    void jpegDescriptionCanBeRoutedToXmp() {
        byte[] written = service.write(TestImages.jpeg(10, 10), Map.of("description", "hello"), "jpg", "xmp").getData();
        MetadataReadResponse read = service.read(written);

        assertThat(read.getXmp()).containsEntry("description", "hello");
        assertThat(read.getExif()).isNull();
    }

    @Test
    void jpegCustomKeysGoToXmpAndRecognizedKeysToExif() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("artist", "me");
        values.put("reviewed", "true");

        MetadataReadResponse read = service.read(service.write(TestImages.jpeg(8, 8), values, null, null).getData());

        assertThat(read.getExif()).containsEntry("artist", "me");
        assertThat(read.getXmp()).containsEntry("reviewed", "true");
    }

    @Test
    void secondIdenticalWriteIsByteIdentical() {
        Map<String, String> values = Map.of("description", "hello", "user_comment", "note", "reviewed", "yes");
        byte[] once = service.write(TestImages.jpeg(10, 10), values, null, null).getData();
        byte[] twice = service.write(once, values, null, null).getData();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void rejectsExifWithEntryCountPastTheEnd() {
        ByteBuffer tiff = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        tiff.put((byte) 'I').put((byte) 'I').putShort((short) 42).putInt(8).putShort((short) 500);
        byte[] jpeg = TestImages.jpegWithExif(TestImages.jpeg(4, 4), tiff.array());

        assertThatThrownBy(() -> service.read(jpeg))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.TRUNCATED_IFD));
        assertThatThrownBy(() -> service.write(jpeg, Map.of("artist", "x"), null, null))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.TRUNCATED_IFD));
    }

    @Test
    void pngWritesDefaultToXmp() {
        byte[] png = TestImages.png(6, 3);

        MetadataReadResponse read = service.read(service.write(png, Map.of("description", "hello"), "PNG", null).getData());

        assertThat(read.getXmp()).containsEntry("description", "hello");
        assertThat(read.getPngText()).isNull();
        assertThat(read.getWidth()).isEqualTo(6);
    }

    @Test
    void pngTextRoutingKeepsEveryOtherChunk() {
        byte[] png = TestImages.png(6, 3);
        PngChunkProcessor processor = TestImages.pngChunkProcessor();
        List<PngChunk> before = processor.parse(png).getChunks().stream().filter(c -> !c.isText()).collect(Collectors.toList());

        byte[] written = service.write(png, Map.of("Title", "hello"), null, "png_text").getData();
        PngChunkStream after = processor.parse(written);

        List<PngChunk> nonText = after.getChunks().stream().filter(c -> !c.isText()).collect(Collectors.toList());
        assertThat(nonText).hasSameSizeAs(before);
        for (int i = 0; i < before.size(); i++) {
            assertThat(nonText.get(i).getType()).isEqualTo(before.get(i).getType());
            assertThat(nonText.get(i).getData()).isEqualTo(before.get(i).getData());
            assertThat(nonText.get(i).getCrc()).isEqualTo(before.get(i).getCrc());
        }
        assertThat(service.read(written).getPngText()).containsEntry("Title", "hello");
    }

    @Test
    void pngDefaultNamespaceIsConfigurable() {
        MetadataService textFirst = TestImages.metadataService("png_text");

        byte[] written = textFirst.write(TestImages.png(2, 2), Map.of("Comment", "hi"), null, null).getData();

        assertThat(textFirst.read(written).getPngText()).containsEntry("Comment", "hi");
    }

    @Test
    void pngExifGoesToExifChunk() {
        byte[] written = service.write(TestImages.png(2, 2), Map.of("artist", "me"), null, "exif").getData();

        assertThat(service.read(written).getExif()).containsEntry("artist", "me");
    }

    @Test
    void pngExifWriteOnlyAddsTheExifChunk() {
        byte[] png = TestImages.png(2, 2);
        PngChunkProcessor processor = TestImages.pngChunkProcessor();
        List<PngChunk> before = processor.parse(png).getChunks();

        byte[] written = service.write(png, Map.of("artist", "me"), null, "exif").getData();
        List<PngChunk> after = processor.parse(written).getChunks().stream()
            .filter(c -> !PngChunk.EXIF.equals(c.getType()))
            .collect(Collectors.toList());

        assertThat(after).hasSameSizeAs(before);
        for (int i = 0; i < before.size(); i++) {
            assertThat(after.get(i).getType()).isEqualTo(before.get(i).getType());
            assertThat(after.get(i).getData()).isEqualTo(before.get(i).getData());
        }
        assertThat(processor.parse(written).indexOf(PngChunk.EXIF))
            .isLessThan(processor.parse(written).indexOf(PngChunk.IDAT));
    }

    @Test
    void tiffXmpRequestsFallBackToExif() {
        byte[] tiff = TestImages.tiff(5, 4);

        byte[] written = service.write(tiff, Map.of("copyright", "(c) me"), null, "xmp").getData();
        MetadataReadResponse read = service.read(written);

        assertThat(read.getExif()).containsEntry("copyright", "(c) me");
        assertThat(read.getWidth()).isEqualTo(5);
    }

    @Test
    void tiffRejectsKeysWithoutExifEquivalent() {
        assertThatThrownBy(() -> service.write(TestImages.tiff(2, 2), Map.of("rating", "5"), null, null))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> {
                assertThat(e.getError()).isEqualTo(MetadataError.UNSUPPORTED_OPERATION);
                assertThat(e.getKey()).isEqualTo("rating");
            });
    }

    @Test
    void tiffRejectsPngTextNamespace() {
        assertThatThrownBy(() -> service.write(TestImages.tiff(2, 2), Map.of("Title", "x"), null, "png_text"))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> {
                assertThat(e.getError()).isEqualTo(MetadataError.UNSUPPORTED_OPERATION);
                assertThat(e.getNamespace()).isEqualTo(MetadataNamespace.PNG_TEXT);
            });
    }

    @Test
    void webpIsReadOnly() {
        byte[] tiff = TestImages.tiffIfdCodec().write(null, Map.of("artist", "webp author"));
        byte[] xmp = TestImages.xmpPacketCodec().merge(null, Map.of("reviewed", "true"));
        byte[] webp = TestImages.webp(20, 10, tiff, xmp);

        MetadataReadResponse read = service.read(webp);
        assertThat(read.getFormat()).isEqualTo("WEBP");
        assertThat(read.getExif()).containsEntry("artist", "webp author");
        assertThat(read.getXmp()).containsEntry("reviewed", "true");
        assertThat(read.getWidth()).isEqualTo(20);

        assertThatThrownBy(() -> service.write(webp, Map.of("artist", "x"), null, null))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.UNSUPPORTED_OPERATION));
    }

    @Test
    void formatAssertionMustMatchDetectedContainer() {
        assertThatThrownBy(() -> service.write(TestImages.jpeg(2, 2), Map.of("artist", "x"), "png", null))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.UNSUPPORTED_OPERATION));
    }

    @Test
    void rejectsUnknownNamespace() {
        assertThatThrownBy(() -> service.write(TestImages.jpeg(2, 2), Map.of("artist", "x"), null, "iptc"))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.INVALID_FIELD_VALUE));
    }

    @Test
    void nullValuesAreSkipped() {
        byte[] jpeg = TestImages.jpeg(2, 2);
        Map<String, String> values = new HashMap<>();
        values.put("artist", null);

        MetadataWriteResult result = service.write(jpeg, values, null, null);

        assertThat(result.getUpdated()).isEmpty();
        assertThat(result.getData()).isEqualTo(jpeg);
    }

    @Test
    void oneFailingFieldAbortsTheWholeWrite() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("description", "fine");
        values.put("datetime", "not a date");

        assertThatThrownBy(() -> service.write(TestImages.jpeg(2, 2), values, null, null))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> {
                assertThat(e.getError()).isEqualTo(MetadataError.INVALID_FIELD_VALUE);
                assertThat(e.getKey()).isEqualTo("datetime");
                assertThat(e.getNamespace()).isEqualTo(MetadataNamespace.EXIF);
            });
    }

    @Test
    void rejectsUnrecognizedInput() {
        assertThatThrownBy(() -> service.read("plain text".getBytes(StandardCharsets.US_ASCII)))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.UNRECOGNIZED_FORMAT));
    }

    @Test
    void customXmpKeyReadsBackOverForeignPropertyWithSameName() {
        JpegSegmentCodec segments = new JpegSegmentCodec();
        JpegSegmentList list = segments.parse(TestImages.jpeg(4, 4));
        segments.upsertXmpPacket(list, XmpPacketCodecTest.AUX_CITY_PACKET.getBytes(StandardCharsets.UTF_8));
        byte[] jpeg = segments.assemble(list);

        byte[] written = service.write(jpeg, Map.of("City", "Rome"), null, null).getData();

        assertThat(service.read(written).getXmp()).containsEntry("City", "Rome");
    }
}
