package com.chicu.croprecommender.ai.ml;

import com.chicu.croprecommender.ai.ml.features.CropFeatureEngineer;
import com.chicu.croprecommender.ai.ml.features.EngineeredFeatureVector;
import com.chicu.croprecommender.ai.ml.features.RawSample;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.common.error.InferenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * validate -> engineer -> scale -> classifier -> simplex -> arg-max.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CropPredictionService {

    private final CropFeatureEngineer featureEngineer;
    private final ModelStore modelStore;

    public PredictionResult predict(RawSample raw) {
        EngineeredFeatureVector vector = featureEngineer.engineer(raw);
        return predict(vector, modelStore.current());
    }

    /**
     * Инференс против конкретного снапшота (батч читает снапшот один раз).
     */
    PredictionResult predict(RawSample raw, ModelSnapshot snapshot) {
        return predict(featureEngineer.engineer(raw), snapshot);
    }

    private PredictionResult predict(EngineeredFeatureVector vector, ModelSnapshot snapshot) {
        double[] raw;
        try {
            double[] x = snapshot.transform().apply(vector);
            raw = snapshot.classifier().posteriori(x);
        } catch (RuntimeException e) {
            log.warn("🧠 PREDICT FAIL model={} err={}", snapshot.version(), e.toString());
            throw new InferenceException("Model inference failed", e);
        }

        List<String> labels = snapshot.labels();
        double[] p = normalize(raw, labels.size());

        int best = 0;
        for (int i = 1; i < p.length; i++) {
            if (p[i] > p[best] || (p[i] == p[best] && labels.get(i).compareTo(labels.get(best)) < 0)) {
                best = i;
            }
        }

        Map<String, Double> all = new LinkedHashMap<>();
        for (int i = 0; i < p.length; i++) {
            all.put(labels.get(i), p[i]);
        }

        log.debug("🧠 PREDICT OK model={} label={} prob={}", snapshot.version(), labels.get(best), p[best]);

        return PredictionResult.builder()
                .predictedCrop(labels.get(best))
                .confidence(p[best])
                .allProbabilities(all)
                .modelVersion(snapshot.version())
                .build();
    }

    /**
     * Проекция на симплекс: неотрицательные конечные значения, делим на сумму.
     */
    static double[] normalize(double[] raw, int classes) {
        if (raw == null || raw.length != classes) {
            throw new InferenceException("Model returned " + (raw == null ? "no" : raw.length)
                    + " class scores, expected " + classes);
        }
        double sum = 0.0;
        for (double v : raw) {
            if (!Double.isFinite(v) || v < 0.0) {
                throw new InferenceException("Model returned an invalid probability: " + v);
            }
            sum += v;
        }
        if (sum <= 0.0) {
            throw new InferenceException("Model returned an all-zero probability vector");
        }
        double[] p = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            p[i] = raw[i] / sum;
        }
        return p;
    }
}
