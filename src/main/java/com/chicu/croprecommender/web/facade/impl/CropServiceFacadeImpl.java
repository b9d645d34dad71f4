package com.chicu.croprecommender.web.facade.impl;

import com.chicu.croprecommender.ai.ml.BatchPredictionService;
import com.chicu.croprecommender.ai.ml.CropPredictionService;
import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.ai.ml.features.RawSample;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.ai.retrain.RetrainJob;
import com.chicu.croprecommender.ai.retrain.RetrainOrchestrator;
import com.chicu.croprecommender.ai.retrain.RetrainRequest;
import com.chicu.croprecommender.common.error.NotAvailableException;
import com.chicu.croprecommender.common.error.RetrainJobNotFoundException;
import com.chicu.croprecommender.web.dto.BatchPredictionRequest;
import com.chicu.croprecommender.web.dto.BatchPredictionResponse;
import com.chicu.croprecommender.web.dto.CropPredictionRequest;
import com.chicu.croprecommender.web.dto.CropPredictionResponse;
import com.chicu.croprecommender.web.dto.FeatureImportanceResponse;
import com.chicu.croprecommender.web.dto.HealthResponse;
import com.chicu.croprecommender.web.dto.ModelInfoResponse;
import com.chicu.croprecommender.web.dto.ModelMetricsDto;
import com.chicu.croprecommender.web.dto.RetrainJobResponse;
import com.chicu.croprecommender.web.facade.CropServiceFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CropServiceFacadeImpl implements CropServiceFacade {

    private final ModelStore modelStore;
    private final CropPredictionService predictionService;
    private final BatchPredictionService batchPredictionService;
    private final RetrainOrchestrator retrainOrchestrator;

    @Override
    public HealthResponse health() {
        Optional<ModelSnapshot> snapshot = modelStore.find();
        boolean loaded = snapshot.isPresent();

        return HealthResponse.builder()
                .status(loaded ? "healthy" : "unhealthy")
                .message(loaded ? "Crop Recommendation API is running" : "Model not loaded")
                .modelLoaded(loaded)
                .modelVersion(snapshot.map(ModelSnapshot::version).orElse(null))
                .retrainRunning(retrainOrchestrator.isRunning())
                .timestamp(Instant.now().toString())
                .build();
    }

    @Override
    public ModelInfoResponse modelInfo() {
        ModelSnapshot s = modelStore.current();
        List<String> features = s.transform().featureNames();

        return ModelInfoResponse.builder()
                .modelName(s.kind().displayName())
                .modelKind(s.kind().name())
                .modelVersion(s.version())
                .createdAt(s.createdAt().toString())
                .features(features)
                .featureCount(features.size())
                .supportedCrops(s.labels())
                .classCount(s.labels().size())
                .accuracy(s.metrics().testAccuracy())
                .metrics(ModelMetricsDto.from(s.metrics()))
                .build();
    }

    @Override
    public FeatureImportanceResponse featureImportance() {
        ModelSnapshot s = modelStore.current();

        double[] raw = s.classifier().importance()
                .orElseThrow(() -> new NotAvailableException(
                        "Feature importance not available for model type " + s.kind().displayName()));

        List<String> names = s.transform().featureNames();
        return new FeatureImportanceResponse(normalizeSorted(names, raw), s.version());
    }

    @Override
    public CropPredictionResponse predict(CropPredictionRequest request) {
        RawSample sample = request != null ? request.toSample() : null;
        return CropPredictionResponse.from(predictionService.predict(sample));
    }

    @Override
    public BatchPredictionResponse predictBatch(BatchPredictionRequest request) {
        List<CropPredictionRequest> items = request != null ? request.predictions() : null;

        List<RawSample> samples = null;
        if (items != null) {
            samples = new ArrayList<>(items.size());
            for (CropPredictionRequest r : items) {
                // null-элемент уйдёт в ошибку по своему индексу
                samples.add(r != null ? r.toSample() : null);
            }
        }
        return BatchPredictionResponse.from(batchPredictionService.predictBatch(samples));
    }

    @Override
    public RetrainJobResponse retrain(String dataPath) {
        RetrainJob job = retrainOrchestrator.submit(RetrainRequest.builder()
                .dataset(dataPath)
                .reason("api")
                .build());
        return RetrainJobResponse.accepted(job);
    }

    @Override
    public RetrainJobResponse retrainStatus(String jobId) {
        Optional<RetrainJob> job = jobId == null
                ? retrainOrchestrator.latest()
                : retrainOrchestrator.job(jobId);

        return job.map(RetrainJobResponse::status)
                .orElseThrow(() -> new RetrainJobNotFoundException(jobId));
    }

    // =====================================================
    // helpers
    // =====================================================

    /**
     * По убыванию, сумма = 1. Нулевая сумма -> отдаём как есть.
     * Несовпадение длины с {@link FeatureSchema} -> обрезаем по меньшему.
     */
    static Map<String, Double> normalizeSorted(List<String> names, double[] raw) {
        int n = Math.min(names.size(), raw.length);

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += Math.max(0.0, raw[i]);
        }

        List<Map.Entry<String, Double>> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double v = Math.max(0.0, raw[i]);
            entries.add(Map.entry(names.get(i), sum > 0 ? v / sum : v));
        }
        entries.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));

        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : entries) {
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }
}
