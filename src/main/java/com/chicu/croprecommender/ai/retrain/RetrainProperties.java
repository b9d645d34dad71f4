package com.chicu.croprecommender.ai.retrain;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "crop.retrain")
public class RetrainProperties {

    /** Абсолютный минимум точности на hold-out. */
    private double minAccuracy = 0.80;

    /** Допустимое падение точности относительно текущей модели. */
    private double maxRegression = 0.02;

    /** Страховочный таймаут стадии обучения. */
    private Duration timeout = Duration.ofMinutes(10);

    /** classpath:... или имя файла внутри crop.storage.data-dir. */
    private String defaultDataset = "classpath:data/crop_recommendation.csv";

    /** Сколько завершённых задач держать для /model/retrain/{id}. */
    private int historySize = 20;
}
