package com.chicu.croprecommender.ai.ml.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Неизменяемый комплект: классификатор + трансформация фич + метрики + метки.
 * Заменяется целиком при переобучении, поля живого снапшота не мутируются.
 */
@Builder
public record ModelSnapshot(
        String version,
        Instant createdAt,
        CropClassifier classifier,
        FeatureTransform transform,
        ModelMetrics metrics,
        List<String> labels
) {

    public ModelSnapshot {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(labels, "labels");
        labels = List.copyOf(labels);
        if (createdAt == null) createdAt = Instant.now();
    }

    public ModelKind kind() {
        return classifier.kind();
    }
}
