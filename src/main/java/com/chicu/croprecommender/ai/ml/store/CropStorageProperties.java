package com.chicu.croprecommender.ai.ml.store;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "crop.storage")
public class CropStorageProperties {
    private String modelsDir = "./models";
    private String dataDir = "./data";
}
