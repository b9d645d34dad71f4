package com.chicu.croprecommender.web.facade;

import com.chicu.croprecommender.web.dto.BatchPredictionRequest;
import com.chicu.croprecommender.web.dto.BatchPredictionResponse;
import com.chicu.croprecommender.web.dto.CropPredictionRequest;
import com.chicu.croprecommender.web.dto.CropPredictionResponse;
import com.chicu.croprecommender.web.dto.FeatureImportanceResponse;
import com.chicu.croprecommender.web.dto.HealthResponse;
import com.chicu.croprecommender.web.dto.ModelInfoResponse;
import com.chicu.croprecommender.web.dto.RetrainJobResponse;

/**
 * Точка входа для REST-слоя. Стор модели не мутирует:
 * публикация новой модели идёт только через оркестратор переобучения.
 */
public interface CropServiceFacade {

    HealthResponse health();

    ModelInfoResponse modelInfo();

    FeatureImportanceResponse featureImportance();

    CropPredictionResponse predict(CropPredictionRequest request);

    BatchPredictionResponse predictBatch(BatchPredictionRequest request);

    RetrainJobResponse retrain(String dataPath);

    /**
     * jobId == null -> последняя задача.
     */
    RetrainJobResponse retrainStatus(String jobId);
}
