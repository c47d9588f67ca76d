package com.imagemeta.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Images travel as one base64 string per request, so the JSON string limit is the real request size limit.
 */
@Configuration
public class JacksonConfig {

    private static final Logger log = LoggerFactory.getLogger(JacksonConfig.class);

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer payloadSizeCustomizer(
        @Value("${app.metadata.max-payload-length:140000000}") int maxPayloadLength
    ) {
        log.info("JSON string values limited to {} characters", maxPayloadLength);
        StreamReadConstraints constraints = StreamReadConstraints.builder()
            .maxStringLength(maxPayloadLength)
            .build();
        return builder -> builder.postConfigurer(mapper -> mapper.getFactory().setStreamReadConstraints(constraints));
    }
}
