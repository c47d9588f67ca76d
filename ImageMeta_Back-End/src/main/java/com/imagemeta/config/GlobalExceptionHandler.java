package com.imagemeta.config;

import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.imagemeta.domain.MetadataError;
import com.imagemeta.service.MetadataCodecException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the application.
 * Every codec failure gets its own status and an {error, message, key?, namespace?} body.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MetadataCodecException.class)
    public ResponseEntity<Map<String, String>> handleMetadataCodecException(MetadataCodecException exc, HttpServletRequest request) {
        HttpStatus status = statusFor(exc.getError());
        log.warn("{} {} failed with {} (key={}, namespace={}): {}", request.getMethod(), request.getRequestURI(),
            exc.getError(), exc.getKey(), exc.getNamespace() != null ? exc.getNamespace().getWireName() : null, exc.getMessage());

        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", exc.getError().name());
        body.put("message", exc.getMessage());
        if (exc.getKey() != null) {
            body.put("key", exc.getKey());
        }
        if (exc.getNamespace() != null) {
            body.put("namespace", exc.getNamespace().getWireName());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationException(MethodArgumentNotValidException exc, HttpServletRequest request) {
        String message = exc.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody("INVALID_REQUEST", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException exc, HttpServletRequest request) {
        for (Throwable cause = exc.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof StreamConstraintsException) {
                log.warn("{} {} exceeds the payload limit: {}", request.getMethod(), request.getRequestURI(), cause.getMessage());
                return ResponseEntity.status(statusFor(MetadataError.RESOURCE_LIMIT_EXCEEDED))
                    .body(errorBody(MetadataError.RESOURCE_LIMIT_EXCEEDED.name(), "Request payload exceeds the configured size limit"));
            }
        }
        log.warn("{} {} has an unreadable body: {}", request.getMethod(), request.getRequestURI(), exc.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody("INVALID_REQUEST", "Request body is not valid JSON"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMediaType(HttpMediaTypeNotSupportedException exc, HttpServletRequest request) {
        log.warn("{} {} sent {}", request.getMethod(), request.getRequestURI(), exc.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(errorBody("INVALID_REQUEST", exc.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResourceFoundException(NoResourceFoundException exc, HttpServletRequest request) {
        log.warn("Resource not found: {}", exc.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody("NOT_FOUND", "Resource not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception exc, HttpServletRequest request) {
        log.error("Unexpected error on {} {}: {}", request.getMethod(), request.getRequestURI(), exc.getMessage(), exc);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    static HttpStatus statusFor(MetadataError error) {
        switch (error) {
            case INVALID_FIELD_VALUE:
            case INVALID_PAYLOAD:
                return HttpStatus.BAD_REQUEST;
            case UNRECOGNIZED_FORMAT:
                return HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case TRUNCATED_IFD:
            case OFFSET_OUT_OF_BOUNDS:
            case UNSUPPORTED_TAG_TYPE:
            case CHUNK_CRC_MISMATCH:
            case TRUNCATED_CHUNK:
            case MALFORMED_PACKET:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case CHUNK_TOO_LARGE:
            case RESOURCE_LIMIT_EXCEEDED:
                return HttpStatus.PAYLOAD_TOO_LARGE;
            case UNSUPPORTED_OPERATION:
                return HttpStatus.NOT_IMPLEMENTED;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static Map<String, String> errorBody(String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
