package com.chicu.croprecommender.ai.ml;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "crop.batch")
public class BatchProperties {
    private int maxSize = 100;
}
