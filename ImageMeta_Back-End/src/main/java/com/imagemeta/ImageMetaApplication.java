package com.imagemeta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication(scanBasePackages = {"com.imagemeta"})
public class ImageMetaApplication {

    private static final Logger log = LoggerFactory.getLogger(ImageMetaApplication.class);

    @Value("${app.service-name:image-metadata}")
    private String serviceName;

    @Value("${app.version:1.0.0}")
    private String version;

    public static void main(String[] args) {
        SpringApplication.run(ImageMetaApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("{} {} is ready (Java {})", serviceName, version, System.getProperty("java.version"));
    }
}
