package com.chicu.croprecommender.ai.ml;

import com.chicu.croprecommender.ai.ml.store.CropStorageProperties;
import com.chicu.croprecommender.ai.retrain.RetrainProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        CropModelProperties.class,
        CropStorageProperties.class,
        RetrainProperties.class,
        BatchProperties.class
})
public class MlConfig {
}
