package com.example.inventoryjobs.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Local file storage configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /**
     * Root directory; every stored path is relative to it
     */
    @NotBlank
    private String basePath = "./data/uploads";
}
