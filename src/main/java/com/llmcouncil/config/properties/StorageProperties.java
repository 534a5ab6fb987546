package com.llmcouncil.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "council.storage")
public class StorageProperties {

    /** Directory holding one JSON file per conversation. */
    @NotBlank
    private final String dataDir;

    @ConstructorBinding
    public StorageProperties(String dataDir) {
        this.dataDir = dataDir == null || dataDir.isBlank() ? "data/conversations" : dataDir;
    }

    public String getDataDir() {
        return dataDir;
    }
}
