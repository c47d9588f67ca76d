package com.imagemeta.service;

import com.adobe.internal.xmp.XMPConst;
import com.adobe.internal.xmp.XMPException;
import com.adobe.internal.xmp.XMPIterator;
import com.adobe.internal.xmp.XMPMeta;
import com.adobe.internal.xmp.XMPMetaFactory;
import com.adobe.internal.xmp.options.IteratorOptions;
import com.adobe.internal.xmp.options.PropertyOptions;
import com.adobe.internal.xmp.options.SerializeOptions;
import com.adobe.internal.xmp.properties.XMPProperty;
import com.adobe.internal.xmp.properties.XMPPropertyInfo;
import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataField;
import com.imagemeta.domain.MetadataNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads and merges XMP packets. The six well known names map onto Dublin Core and XMP basic
 * properties; any other key lives in the service namespace. Existing packets are edited in
 * place, so properties written by other tools are serialized back untouched.
 */
@Service
public class XmpPacketCodec {

    private static final Logger log = LoggerFactory.getLogger(XmpPacketCodec.class);

    public static final String NS_IMS = "https://example.com/image-metadata-service/1.0/";
    public static final String PREFIX_IMS = "ims";

    private static final String X_DEFAULT = XMPConst.X_DEFAULT;
    private static final Pattern NC_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9._-]*$");

    private final int maxPacketSize;
    private final DateTimeNormalizer dateTimeNormalizer;

    public XmpPacketCodec(
        @Value("${app.metadata.max-xmp-packet-size:65502}") int maxPacketSize,
        DateTimeNormalizer dateTimeNormalizer
    ) {
        this.maxPacketSize = maxPacketSize;
        this.dateTimeNormalizer = dateTimeNormalizer;
        try {
            XMPMetaFactory.getSchemaRegistry().registerNamespace(NS_IMS, PREFIX_IMS);
        } catch (XMPException e) {
            throw new IllegalStateException("Cannot register XMP namespace " + NS_IMS, e);
        }
    }

    public XMPMeta parse(byte[] packet) {
        try {
            return XMPMetaFactory.parseFromBuffer(packet);
        } catch (XMPException e) {
            throw new MetadataCodecException(MetadataError.MALFORMED_PACKET,
                "Embedded XMP packet is not well-formed: " + e.getMessage(), null, MetadataNamespace.XMP, e);
        }
    }

    // ---- Read path ----

    public List<MetadataField> read(byte[] packet) {
        XMPMeta meta = parse(packet);
        Map<String, MetadataField> fields = new LinkedHashMap<>();
        try {
            putIfPresent(fields, TiffIfdCodec.KEY_DESCRIPTION, localized(meta, XMPConst.NS_DC, "description"), MetadataField.TypeHint.UTF8_TEXT);
            XMPProperty creator = meta.doesPropertyExist(XMPConst.NS_DC, "creator")
                ? meta.getArrayItem(XMPConst.NS_DC, "creator", 1)
                : null;
            putIfPresent(fields, TiffIfdCodec.KEY_ARTIST, creator != null ? creator.getValue() : null, MetadataField.TypeHint.UTF8_TEXT);
            putIfPresent(fields, TiffIfdCodec.KEY_COPYRIGHT, localized(meta, XMPConst.NS_DC, "rights"), MetadataField.TypeHint.UTF8_TEXT);
            putIfPresent(fields, TiffIfdCodec.KEY_SOFTWARE, meta.getPropertyString(XMPConst.NS_XMP, "CreatorTool"), MetadataField.TypeHint.UTF8_TEXT);
            putIfPresent(fields, TiffIfdCodec.KEY_DATETIME, meta.getPropertyString(XMPConst.NS_XMP, "ModifyDate"), MetadataField.TypeHint.DATETIME);
            putIfPresent(fields, TiffIfdCodec.KEY_USER_COMMENT, meta.getPropertyString(XMPConst.NS_XMP, "Label"), MetadataField.TypeHint.UTF8_TEXT);

            XMPIterator iterator = meta.iterator(new IteratorOptions().setJustLeafnodes(true).setOmitQualifiers(true));
            while (iterator.hasNext()) {
                XMPPropertyInfo info = (XMPPropertyInfo) iterator.next();
                String path = info.getPath();
                if (path == null || info.getValue() == null || !isTopLevelSimple(path) || isMapped(info.getNamespace(), path)) {
                    continue;
                }
                String key = path.substring(path.indexOf(':') + 1);
                String value = info.getValue().toString();
                if (NS_IMS.equals(info.getNamespace()) && !TiffIfdCodec.RECOGNIZED_KEYS.contains(key)) {
                    // our own namespace owns custom keys, whatever other schemas share the local name
                    fields.put(key, new MetadataField(MetadataNamespace.XMP, key, value, MetadataField.TypeHint.UTF8_TEXT));
                } else {
                    putIfPresent(fields, key, value, MetadataField.TypeHint.UTF8_TEXT);
                }
            }
        } catch (XMPException e) {
            throw new MetadataCodecException(MetadataError.MALFORMED_PACKET,
                "Cannot read XMP properties: " + e.getMessage(), null, MetadataNamespace.XMP, e);
        }
        log.debug("Read {} XMP properties", fields.size());
        return new ArrayList<>(fields.values());
    }

    private static boolean isTopLevelSimple(String path) {
        return path.indexOf('/') < 0 && path.indexOf('[') < 0 && path.indexOf(':') > 0;
    }

    private static boolean isMapped(String namespace, String path) {
        if (!XMPConst.NS_XMP.equals(namespace)) {
            return false;
        }
        String local = path.substring(path.indexOf(':') + 1);
        return "CreatorTool".equals(local) || "ModifyDate".equals(local) || "Label".equals(local);
    }

    private static void putIfPresent(Map<String, MetadataField> fields, String key, String value, MetadataField.TypeHint hint) {
        if (value != null && !fields.containsKey(key)) {
            fields.put(key, new MetadataField(MetadataNamespace.XMP, key, value, hint));
        }
    }

    private static String localized(XMPMeta meta, String namespace, String name) throws XMPException {
        if (!meta.doesPropertyExist(namespace, name)) {
            return null;
        }
        XMPProperty property = meta.getLocalizedText(namespace, name, "", X_DEFAULT);
        return property != null ? property.getValue() : null;
    }

    // ---- Write path ----

    /**
     * Merges the values into the existing packet (or a new one when {@code existing} is null).
     *
     * @return the serialized packet, or {@code existing} itself when every value was already stored
     */
    public byte[] merge(byte[] existing, Map<String, String> values) {
        XMPMeta meta = existing != null ? parse(existing) : XMPMetaFactory.create();
        boolean changed = false;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey();
            try {
                changed |= apply(meta, key, entry.getValue());
            } catch (XMPException e) {
                throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                    "Cannot store XMP property: " + e.getMessage(), key, MetadataNamespace.XMP, e);
            } catch (MetadataCodecException e) {
                throw e.forField(key, MetadataNamespace.XMP);
            }
        }
        if (!changed && existing != null) {
            return existing;
        }
        return serialize(meta);
    }

    private boolean apply(XMPMeta meta, String key, String value) throws XMPException {
        validateValue(key, value);
        switch (key) {
            case TiffIfdCodec.KEY_DESCRIPTION:
                return setLocalized(meta, XMPConst.NS_DC, "description", value);
            case TiffIfdCodec.KEY_COPYRIGHT:
                return setLocalized(meta, XMPConst.NS_DC, "rights", value);
            case TiffIfdCodec.KEY_ARTIST:
                return setFirstCreator(meta, value);
            case TiffIfdCodec.KEY_SOFTWARE:
                return setSimple(meta, XMPConst.NS_XMP, "CreatorTool", value);
            case TiffIfdCodec.KEY_USER_COMMENT:
                return setSimple(meta, XMPConst.NS_XMP, "Label", value);
            case TiffIfdCodec.KEY_DATETIME:
                return setSimple(meta, XMPConst.NS_XMP, "ModifyDate", dateTimeNormalizer.toXmp(value, MetadataNamespace.XMP));
            default:
                if (!NC_NAME.matcher(key).matches()) {
                    throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                        "XMP property name '" + key + "' is not a valid XML name", key, MetadataNamespace.XMP);
                }
                return setSimple(meta, NS_IMS, key, value);
        }
    }

    private static boolean setSimple(XMPMeta meta, String namespace, String name, String value) throws XMPException {
        if (value.equals(meta.getPropertyString(namespace, name))) {
            return false;
        }
        meta.setProperty(namespace, name, value);
        return true;
    }

    private static boolean setLocalized(XMPMeta meta, String namespace, String name, String value) throws XMPException {
        if (value.equals(localized(meta, namespace, name))) {
            return false;
        }
        meta.setLocalizedText(namespace, name, "", X_DEFAULT, value);
        return true;
    }

    private static boolean setFirstCreator(XMPMeta meta, String value) throws XMPException {
        if (meta.doesPropertyExist(XMPConst.NS_DC, "creator") && meta.countArrayItems(XMPConst.NS_DC, "creator") > 0) {
            XMPProperty first = meta.getArrayItem(XMPConst.NS_DC, "creator", 1);
            if (first != null && value.equals(first.getValue())) {
                return false;
            }
            meta.setArrayItem(XMPConst.NS_DC, "creator", 1, value);
            return true;
        }
        meta.appendArrayItem(XMPConst.NS_DC, "creator", new PropertyOptions().setArrayOrdered(true), value, null);
        return true;
    }

    private static void validateValue(String key, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                    String.format("Character U+%04X cannot be stored in XMP", (int) c), key, MetadataNamespace.XMP);
            }
        }
    }

    private byte[] serialize(XMPMeta meta) {
        byte[] packet;
        try {
            packet = XMPMetaFactory.serializeToBuffer(meta, new SerializeOptions().setUseCompactFormat(true).setPadding(0));
        } catch (XMPException e) {
            throw new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
                "Cannot serialize XMP packet: " + e.getMessage(), null, MetadataNamespace.XMP, e);
        }
        if (packet.length > maxPacketSize) {
            throw new MetadataCodecException(MetadataError.RESOURCE_LIMIT_EXCEEDED,
                "Serialized XMP packet is " + packet.length + " bytes, limit is " + maxPacketSize, null, MetadataNamespace.XMP);
        }
        log.debug("Serialized XMP packet ({} bytes)", packet.length);
        return packet;
    }
}
