package com.imagemeta.service;

import com.imagemeta.domain.MetadataError;
import com.imagemeta.domain.MetadataNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Normalizes user supplied timestamps to the representations each metadata family expects.
 * Accepted inputs:
 * 1. EXIF style YYYY:MM:DD HH:MM:SS (e.g., 2024:03:01 14:05:09)
 * 2. ISO-8601 local date-time, with 'T' or a space separator (e.g., 2024-03-01T14:05:09)
 * 3. ISO-8601 date-time with offset (e.g., 2024-03-01T14:05:09+02:00, 2024-03-01T12:05:09Z)
 * 4. ISO-8601 date (e.g., 2024-03-01), taken as midnight
 */
@Service
public class DateTimeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DateTimeNormalizer.class);

    public static final String DATETIME_KEY = "datetime";

    private static final DateTimeFormatter EXIF_FORMATTER =
        DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter SPACED_ISO_FORMATTER =
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter XMP_LOCAL_FORMATTER = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter XMP_OFFSET_FORMATTER = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssXXX");

    private static final Pattern EXIF_PATTERN = Pattern.compile("^\\d{4}:\\d{2}:\\d{2} \\d{2}:\\d{2}:\\d{2}$");
    private static final Pattern SPACED_ISO_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}$");

    /**
     * Converts to the fixed-width 19 character EXIF form. An offset, when present, is dropped
     * and the local wall-clock time kept.
     */
    public String toExif(String value, MetadataNamespace namespace) {
        Object parsed = parse(value, namespace);
        LocalDateTime local = parsed instanceof OffsetDateTime
            ? ((OffsetDateTime) parsed).toLocalDateTime()
            : (LocalDateTime) parsed;
        return local.format(EXIF_FORMATTER);
    }

    /**
     * Converts to the ISO-8601 form used by xmp:ModifyDate, keeping the offset when one was given.
     */
    public String toXmp(String value, MetadataNamespace namespace) {
        Object parsed = parse(value, namespace);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).format(XMP_OFFSET_FORMATTER);
        }
        return ((LocalDateTime) parsed).format(XMP_LOCAL_FORMATTER);
    }

    private Object parse(String value, MetadataNamespace namespace) {
        if (value == null || value.isBlank()) {
            throw invalid(value, namespace, null);
        }
        String trimmed = value.trim();
        try {
            if (EXIF_PATTERN.matcher(trimmed).matches()) {
                return LocalDateTime.parse(trimmed, EXIF_FORMATTER);
            }
            if (SPACED_ISO_PATTERN.matcher(trimmed).matches()) {
                return LocalDateTime.parse(trimmed, SPACED_ISO_FORMATTER);
            }
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
            }
            if (hasOffset(trimmed)) {
                return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).truncatedTo(ChronoUnit.SECONDS);
            }
            return LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException e) {
            log.debug("Failed to parse datetime '{}': {}", trimmed, e.getMessage());
            throw invalid(trimmed, namespace, e);
        }
    }

    private static boolean hasOffset(String value) {
        int timeStart = value.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = value.substring(timeStart);
        return time.endsWith("Z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }

    private static MetadataCodecException invalid(String value, MetadataNamespace namespace, Throwable cause) {
        return new MetadataCodecException(MetadataError.INVALID_FIELD_VALUE,
            "Malformed datetime value '" + value + "', expected YYYY:MM:DD HH:MM:SS or ISO-8601",
            DATETIME_KEY, namespace, cause);
    }
}
