package com.chicu.croprecommender.ai.ml.dataset;

import com.chicu.croprecommender.ai.ml.features.CropFeatureEngineer;
import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import com.chicu.croprecommender.common.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * TrainingDatasetBuilder
 * ======================
 * Собирает датасет для обучения:
 * - X: double[][], вектора фич того же CropFeatureEngineer, что и на инференсе
 * - y: int[], индекс культуры в CropType.labels()
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDatasetBuilder {

    private final CropFeatureEngineer featureEngineer;

    /**
     * Готовый датасет.
     * X: матрица [n_samples][n_features], y: массив меток [n_samples]
     */
    public record Dataset(
            String datasetId,
            double[][] X,
            int[] y,
            int samples,
            int features
    ) {}

    public Dataset build(String datasetId, List<LabeledSample> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new TrainingFailedException("dataset is empty");
        }

        int n = rows.size();
        int f = FeatureSchema.CROP.size();
        double[][] X = new double[n][];
        int[] y = new int[n];
        Set<CropType> seen = EnumSet.noneOf(CropType.class);

        for (int i = 0; i < n; i++) {
            LabeledSample row = rows.get(i);
            CropType crop = CropType.fromLabel(row.label())
                    .orElseThrow(() -> new TrainingFailedException(
                            "line " + row.line() + ": unknown crop label '" + row.label() + "'"));
            try {
                X[i] = featureEngineer.engineer(row.sample()).toArray();
            } catch (ValidationException e) {
                throw new TrainingFailedException("line " + row.line() + ": " + e.getMessage(), e);
            }
            y[i] = crop.ordinal();
            seen.add(crop);
        }

        if (seen.size() != CropType.count()) {
            Set<CropType> missing = EnumSet.complementOf(EnumSet.copyOf(seen));
            throw new TrainingFailedException("dataset does not cover the full label set, missing: "
                    + missing.stream().map(CropType::label).sorted().collect(Collectors.joining(", ")));
        }

        String id = (datasetId == null || datasetId.isBlank())
                ? UUID.randomUUID().toString()
                : datasetId.trim();

        log.info("📦 Dataset built: id={} samples={} features={} classes={}", id, n, f, seen.size());

        return new Dataset(id, X, y, n, f);
    }
}
