package com.previewstudio.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PreviewStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(PreviewStudioApplication.class, args);
    }
}
