package com.chicu.croprecommender.ai.ml.model;

import java.io.Serializable;
import java.util.Optional;

/**
 * Обученный классификатор над отмасштабированным вектором фич.
 * Индекс класса = индекс метки в {@link com.chicu.croprecommender.common.enums.CropType#labels()}.
 */
public interface CropClassifier extends Serializable {

    ModelKind kind();

    int classCount();

    /**
     * Апостериорные вероятности по классам (сырые, без нормализации).
     */
    double[] posteriori(double[] scaledFeatures);

    /**
     * Важность фич в порядке схемы; пусто, если тип модели её не даёт.
     */
    Optional<double[]> importance();
}
