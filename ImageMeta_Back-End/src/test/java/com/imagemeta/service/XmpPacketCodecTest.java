package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataField;
import com.imagemeta.domain.MetadataNamespace;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmpPacketCodecTest {

    private static final String FOREIGN_PACKET =
        "<?xpacket begin=\"\uFEFF\" id=\"W5M0MpCehiHzreSzNTczkc9d\"?>\n"
            + "<x:xmpmeta xmlns:x=\"adobe:ns:meta/\">\n"
            + " <rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\">\n"
            + "  <rdf:Description rdf:about=\"\"\n"
            + "    xmlns:vendor=\"http://vendor.example/ns/1.0/\"\n"
            + "    xmlns:dc=\"http://purl.org/dc/elements/1.1/\">\n"
            + "   <vendor:Approved>True</vendor:Approved>\n"
            + "   <dc:subject><rdf:Bag><rdf:li>cats</rdf:li><rdf:li>dogs</rdf:li></rdf:Bag></dc:subject>\n"
            + "  </rdf:Description>\n"
            + " </rdf:RDF>\n"
            + "</x:xmpmeta>\n"
            + "<?xpacket end=\"w\"?>";

    static final String AUX_CITY_PACKET =
        "<x:xmpmeta xmlns:x=\"adobe:ns:meta/\">\n"
            + " <rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\">\n"
            + "  <rdf:Description rdf:about=\"\"\n"
            + "    xmlns:aux=\"http://ns.adobe.com/exif/1.0/aux/\"\n"
            + "    aux:City=\"Paris\"/>\n"
            + " </rdf:RDF>\n"
            + "</x:xmpmeta>";

    private final XmpPacketCodec codec = TestImages.xmpPacketCodec();

    private Map<String, String> read(byte[] packet) {
        Map<String, String> map = new LinkedHashMap<>();
        for (MetadataField field : codec.read(packet)) {
            assertThat(field.getNamespace()).isEqualTo(MetadataNamespace.XMP);
            map.put(field.getKey(), field.getValue());
        }
        return map;
    }

    @Test
    void mapsRecognizedNamesToStandardProperties() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("description", "hello");
        values.put("artist", "Ansel Adams");
        values.put("copyright", "(c) nobody");
        values.put("software", "imagemeta");
        values.put("user_comment", "a label");
        values.put("datetime", "2024:03:01 14:05:09");

        byte[] packet = codec.merge(null, values);
        String xml = new String(packet, StandardCharsets.UTF_8);

        assertThat(xml).contains("dc:description", "dc:creator", "dc:rights", "xmp:CreatorTool", "xmp:Label", "xmp:ModifyDate");
        assertThat(read(packet))
            .containsEntry("description", "hello")
            .containsEntry("artist", "Ansel Adams")
            .containsEntry("copyright", "(c) nobody")
            .containsEntry("software", "imagemeta")
            .containsEntry("user_comment", "a label")
            .containsEntry("datetime", "2024-03-01T14:05:09");
    }

    @Test
    void customKeysGoToTheServiceNamespace() {
        byte[] packet = codec.merge(null, Map.of("reviewed", "true"));

        assertThat(new String(packet, StandardCharsets.UTF_8)).contains(XmpPacketCodec.NS_IMS);
        assertThat(read(packet)).containsEntry("reviewed", "true");
    }

    @Test
    void unknownPropertiesSurviveAnUnrelatedWrite() {
        byte[] merged = codec.merge(FOREIGN_PACKET.getBytes(StandardCharsets.UTF_8), Map.of("description", "hello"));
        String xml = new String(merged, StandardCharsets.UTF_8);

        assertThat(read(merged)).containsEntry("Approved", "True").containsEntry("description", "hello");
        assertThat(xml).contains("http://vendor.example/ns/1.0/", "cats", "dogs");
    }

    @Test
    void returnsTheExistingPacketWhenNothingChanges() {
        byte[] packet = codec.merge(null, Map.of("description", "hello", "rating", "5"));

        assertThat(codec.merge(packet, Map.of("description", "hello", "rating", "5"))).isSameAs(packet);
    }

    @Test
    void replacesFirstCreatorOnly() {
        byte[] packet = codec.merge(null, Map.of("artist", "first"));
        byte[] updated = codec.merge(packet, Map.of("artist", "second"));

        assertThat(read(updated)).containsEntry("artist", "second");
    }

    @Test
    void rejectsKeysThatAreNotXmlNames() {
        assertThatThrownBy(() -> codec.merge(null, Map.of("1bad key", "v")))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> {
                assertThat(e.getError()).isEqualTo(MetadataError.INVALID_FIELD_VALUE);
                assertThat(e.getKey()).isEqualTo("1bad key");
                assertThat(e.getNamespace()).isEqualTo(MetadataNamespace.XMP);
            });
    }

    @Test
    void rejectsMalformedDatetime() {
        assertThatThrownBy(() -> codec.merge(null, Map.of("datetime", "soon")))
            .isInstanceOfSatisfying(MetadataCodecException.class, e -> {
                assertThat(e.getError()).isEqualTo(MetadataError.INVALID_FIELD_VALUE);
                assertThat(e.getKey()).isEqualTo("datetime");
            });
    }

    @Test
    void rejectsMalformedPackets() {
        assertThatThrownBy(() -> codec.read("<x:xmpmeta><unclosed>".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.MALFORMED_PACKET));
    }

    @Test
    void rejectsPacketsAboveTheSizeLimit() {
        XmpPacketCodec small = new XmpPacketCodec(200, TestImages.dateTimeNormalizer());

        assertThatThrownBy(() -> small.merge(null, Map.of("note", "x".repeat(500))))
            .isInstanceOfSatisfying(MetadataCodecException.class,
                e -> assertThat(e.getError()).isEqualTo(MetadataError.RESOURCE_LIMIT_EXCEEDED));
    }

    @Test
    void customKeyWinsOverSameLocalNameInOtherSchemas() {
        byte[] merged = codec.merge(AUX_CITY_PACKET.getBytes(StandardCharsets.UTF_8), Map.of("City", "Rome"));

        assertThat(read(merged)).containsEntry("City", "Rome");
        assertThat(new String(merged, StandardCharsets.UTF_8)).contains("Paris");
    }

    @Test
    void otherSchemasStillSurfaceWhenNoCustomKeyExists() {
        assertThat(read(AUX_CITY_PACKET.getBytes(StandardCharsets.UTF_8))).containsEntry("City", "Paris");
    }
}
