package com.imagemeta.controller;

import com.imagemeta.domain.MetadataReadRequest;
import com.imagemeta.domain.MetadataReadResponse;
import com.imagemeta.domain.MetadataSetRequest;
import com.imagemeta.domain.MetadataSetResponse;
import com.imagemeta.domain.MetadataWriteResult;
import com.imagemeta.service.ImagePayloadCodec;
import com.imagemeta.service.MetadataService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata endpoints. Images travel as base64 text in JSON bodies.
 */
@RestController
public class MetadataRestController {

    private static final Logger log = LoggerFactory.getLogger(MetadataRestController.class);

    @Autowired
    private MetadataService metadataService;

    @Autowired
    private ImagePayloadCodec imagePayloadCodec;

    @Value("${app.service-name:image-metadata}")
    private String serviceName;

    @Value("${app.version:1.0.0}")
    private String version;

    @PostMapping(value = "/metadata/read", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MetadataReadResponse> read(@Valid @RequestBody MetadataReadRequest request) {
        byte[] image = imagePayloadCodec.decode(request.getImageBase64());
        log.debug("POST /metadata/read with {} bytes", image.length);
        return ResponseEntity.ok(metadataService.read(image));
    }

    @PostMapping(value = "/metadata/set", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MetadataSetResponse> set(@Valid @RequestBody MetadataSetRequest request) {
        byte[] image = imagePayloadCodec.decode(request.getImageBase64());
        log.debug("POST /metadata/set with {} bytes, keys {}", image.length, request.getSet().keySet());
        MetadataWriteResult result = metadataService.write(image, request.getSet(), request.getFormat(), request.getNamespace());
        return ResponseEntity.ok(new MetadataSetResponse(
            imagePayloadCodec.encode(result.getData()), result.getFormat().name(), result.getUpdated()));
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", serviceName);
        info.put("version", version);
        info.put("endpoints", Arrays.asList("/metadata/read", "/metadata/set"));
        return ResponseEntity.ok(info);
    }
}
