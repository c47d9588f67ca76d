package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataField;
import com.imagemeta.domain.PngChunk;
import com.imagemeta.domain.PngChunkStream;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.Deflater;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PngChunkProcessorTest {

    private final PngChunkProcessor processor = TestImages.pngChunkProcessor();

    private static final PngChunk PRIVATE_CHUNK = PngChunk.of("prVt", new byte[] {1, 2, 3, 4, 5});
    private static final PngChunk IDAT = PngChunk.of(PngChunk.IDAT, new byte[] {0x78, (byte) 0x9C, 0x03, 0x00, 0x00, 0x00, 0x00, 0x01});

    private static byte[] sample(PngChunk... extra) {
        List<PngChunk> chunks = new ArrayList<>();
        chunks.add(TestImages.ihdr(1, 1));
        chunks.add(PRIVATE_CHUNK);
        chunks.addAll(Arrays.asList(extra));
        chunks.add(IDAT);
        chunks.add(TestImages.iend());
        return TestImages.pngFromChunks(chunks);
    }

    private Map<String, String> readText(byte[] png) {
        Map<String, String> map = new LinkedHashMap<>();
        for (MetadataField field : processor.readText(processor.parse(png))) {
            map.put(field.getKey(), field.getValue());
        }
        return map;
    }

    private static List<String> types(PngChunkStream stream) {
        return stream.getChunks().stream().map(PngChunk::getType).collect(Collectors.toList());
    }

    @Test
    void parseAndAssembleReproduceTheFile() {
        byte[] png = TestImages.png(4, 4);

        assertThat(processor.assemble(processor.parse(png))).isEqualTo(png);
    }

    @Test
    void keepsBytesAfterIend() {
        byte[] png = sample();
        byte[] withTrailer = Arrays.copyOf(png, png.length + 3);
        withTrailer[png.length] = 'x';

        assertThat(processor.assemble(processor.parse(withTrailer))).isEqualTo(withTrailer);
    }

    @Test
    void readsAllThreeTextChunkKinds() {
        byte[] png = sample(
            TestImages.text("Title", "plain latin-1 é"),
            PngChunk.of(PngChunk.COMPRESSED_TEXT, compressedText("Comment", "squeezed")),
            PngChunk.of(PngChunk.INTERNATIONAL_TEXT, internationalText("Author", "ja", "作者", "山田", true)));

        assertThat(readText(png))
            .containsEntry("Title", "plain latin-1 é")
            .containsEntry("Comment", "squeezed")
            .containsEntry("Author", "山田");
    }

    @Test
    void firstOccurrenceOfAKeywordWins() {
        byte[] png = sample(TestImages.text("Title", "first"), TestImages.text("Title", "second"));

        assertThat(readText(png)).containsEntry("Title", "first").hasSize(1);
    }

    @Test
    void xmpKeywordIsNotReportedAsText() {
        byte[] png = sample(PngChunk.of(PngChunk.INTERNATIONAL_TEXT,
            internationalText(PngChunkProcessor.XMP_KEYWORD, "", "", "<x:xmpmeta/>", false)));
        PngChunkStream stream = processor.parse(png);

        assertThat(processor.readText(stream)).isEmpty();
        assertThat(new String(processor.readXmpPacket(stream), StandardCharsets.UTF_8)).isEqualTo("<x:xmpmeta/>");
    }

    @Test
    void insertsNewTextBeforeIendAndLeavesOtherChunksUntouched() {
        byte[] png = sample();
        PngChunkStream stream = processor.parse(png);

        assertThat(processor.upsertText(stream, Map.of("Title", "hello"))).isTrue();
        byte[] written = processor.assemble(stream);
        PngChunkStream reparsed = processor.parse(written);

        assertThat(types(reparsed)).containsExactly("IHDR", "prVt", "IDAT", "tEXt", "IEND");
        assertThat(reparsed.getChunks().get(1).getData()).isEqualTo(PRIVATE_CHUNK.getData());
        assertThat(reparsed.getChunks().get(1).getCrc()).isEqualTo(PRIVATE_CHUNK.getCrc());
        assertThat(readText(written)).containsEntry("Title", "hello");
    }

    @Test
    void nonLatin1ValuesGoToInternationalText() {
        PngChunkStream stream = processor.parse(sample());

        processor.upsertText(stream, Map.of("Title", "Привет"));

        assertThat(types(stream)).contains("iTXt");
        assertThat(readText(processor.assemble(stream))).containsEntry("Title", "Привет");
    }

    @Test
    void replacesExistingChunkInPlaceAndDropsDuplicates() {
        byte[] png = sample(TestImages.text("Title", "old"), TestImages.text("Other", "x"), TestImages.text("Title", "stale"));
        PngChunkStream stream = processor.parse(png);

        processor.upsertText(stream, Map.of("Title", "new"));

        assertThat(types(stream)).containsExactly("IHDR", "prVt", "tEXt", "tEXt", "IDAT", "IEND");
        assertThat(readText(processor.assemble(stream))).containsEntry("Title", "new").containsEntry("Other", "x");
    }

    @Test
    void replacementKeepsCompressedTextCompressed() {
        byte[] png = sample(PngChunk.of(PngChunk.COMPRESSED_TEXT, compressedText("Comment", "old")));
        PngChunkStream stream = processor.parse(png);

        processor.upsertText(stream, Map.of("Comment", "new"));

        assertThat(types(stream)).containsExactly("IHDR", "prVt", "zTXt", "IDAT", "IEND");
        assertThat(readText(processor.assemble(stream))).containsEntry("Comment", "new");
    }

    @Test
    void writingTheSameValueTwiceIsByteIdentical() {
        PngChunkStream first = processor.parse(sample());
        processor.upsertText(first, Map.of("Title", "hello", "Author", "Ünïcode ✓"));
        byte[] once = processor.assemble(first);

        PngChunkStream second = processor.parse(once);
        assertThat(processor.upsertText(second, Map.of("Title", "hello", "Author", "Ünïcode ✓"))).isFalse();
        assertThat(processor.assemble(second)).isEqualTo(once);
    }

    @Test
    void rejectsCrcMismatch() {
        byte[] png = sample(TestImages.text("Title", "hello"));
        // flip a byte inside the tEXt payload
        int at = indexOf(png, "hello".getBytes(StandardCharsets.US_ASCII));
        png[at] = 'j';

        assertError(png, MetadataError.CHUNK_CRC_MISMATCH);
    }

    @Test
    void rejectsChunksAboveTheConfiguredLimit() {
        PngChunkProcessor strict = new PngChunkProcessor(4, 1024);

        assertThatThrownBy(() -> strict.parse(sample()))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.CHUNK_TOO_LARGE));
    }

    @Test
    void rejectsChunkRunningPastTheEnd() {
        byte[] png = sample();
        byte[] cut = Arrays.copyOf(png, png.length - 20);

        assertError(cut, MetadataError.TRUNCATED_CHUNK);
    }

    @Test
    void rejectsStreamWithoutIend() {
        byte[] png = TestImages.pngFromChunks(List.of(TestImages.ihdr(1, 1), IDAT));

        assertError(png, MetadataError.TRUNCATED_CHUNK);
    }

    @Test
    void boundsInflatedText() {
        PngChunkProcessor strict = new PngChunkProcessor(1024 * 1024, 100);
        String big = "a".repeat(10_000);
        PngChunkStream stream = strict.parse(sample(PngChunk.of(PngChunk.COMPRESSED_TEXT, compressedText("Comment", big))));

        assertThatThrownBy(() -> strict.readText(stream))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.RESOURCE_LIMIT_EXCEEDED));
    }

    @Test
    void rejectsInvalidKeywords() {
        PngChunkStream stream = processor.parse(sample());

        for (String keyword : new String[] {"", " lead", "trail ", "dou  ble", "k".repeat(80), "tab\there", "emoji😀"}) {
            assertThatThrownBy(() -> processor.upsertText(stream, Map.of(keyword, "v")))
                .isInstanceOfSatisfying(MetadataCodecException.class,
                    e -> assertThat(e.getError()).isEqualTo(MetadataError.INVALID_FIELD_VALUE));
        }
        assertThatThrownBy(() -> processor.upsertText(stream, Map.of(PngChunkProcessor.XMP_KEYWORD, "v")))
            .isInstanceOf(MetadataCodecException.class);
    }

    @Test
    void rejectsNulInValues() {
        PngChunkStream stream = processor.parse(sample());

        assertThatThrownBy(() -> processor.upsertText(stream, Map.of("Title", "a\0b")))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> {
                assertThat(e.getError()).isEqualTo(MetadataError.INVALID_FIELD_VALUE);
                assertThat(e.getKey()).isEqualTo("Title");
            });
    }

    @Test
    void insertsExifChunkBeforeImageData() {
        PngChunkStream stream = processor.parse(sample());
        byte[] tiff = TestImages.tiffIfdCodec().write(null, Map.of("artist", "me"));

        assertThat(processor.upsertExif(stream, tiff)).isTrue();
        assertThat(types(stream)).containsExactly("IHDR", "prVt", "eXIf", "IDAT", "IEND");
        assertThat(processor.readExif(stream)).isEqualTo(tiff);
        assertThat(processor.upsertExif(stream, tiff)).isFalse();
    }

    private void assertError(byte[] png, MetadataError expected) {
        assertThatThrownBy(() -> processor.parse(png))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> assertThat(e.getError()).isEqualTo(expected));
    }

    private static int indexOf(byte[] data, byte[] needle) {
        outer:
        for (int i = 0; i <= data.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater();
        deflater.setInput(input);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[1024];
        while (!deflater.finished()) {
            out.write(buffer, 0, deflater.deflate(buffer));
        }
        deflater.end();
        return out.toByteArray();
    }

    private static byte[] compressedText(String keyword, String value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keyword.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(0);
        out.writeBytes(deflate(value.getBytes(StandardCharsets.ISO_8859_1)));
        return out.toByteArray();
    }

    private static byte[] internationalText(String keyword, String language, String translated, String value, boolean compressed) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(keyword.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(compressed ? 1 : 0);
        out.write(0);
        out.writeBytes(language.getBytes(StandardCharsets.US_ASCII));
        out.write(0);
        out.writeBytes(translated.getBytes(StandardCharsets.UTF_8));
        out.write(0);
        byte[] text = value.getBytes(StandardCharsets.UTF_8);
        out.writeBytes(compressed ? deflate(text) : text);
        return out.toByteArray();
    }
}
