package com.chicu.croprecommender.web.facade.impl;

import com.chicu.croprecommender.ai.ml.BatchPredictionService;
import com.chicu.croprecommender.ai.ml.CropPredictionService;
import com.chicu.croprecommender.ai.ml.model.ModelKind;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.ai.retrain.RetrainOrchestrator;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.InferenceException;
import com.chicu.croprecommender.common.error.NotAvailableException;
import com.chicu.croprecommender.common.error.RetrainJobNotFoundException;
import com.chicu.croprecommender.support.TestSnapshots;
import com.chicu.croprecommender.web.dto.FeatureImportanceResponse;
import com.chicu.croprecommender.web.dto.HealthResponse;
import com.chicu.croprecommender.web.dto.ModelInfoResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CropServiceFacadeImplTest {

    @Mock CropPredictionService predictionService;
    @Mock BatchPredictionService batchPredictionService;
    @Mock RetrainOrchestrator retrainOrchestrator;

    ModelStore store;
    CropServiceFacadeImpl facade;

    @BeforeEach
    void setUp() {
        store = new ModelStore();
        facade = new CropServiceFacadeImpl(store, predictionService, batchPredictionService, retrainOrchestrator);
    }

    @Test
    void healthWithoutModelIsUnhealthy() {
        HealthResponse h = facade.health();

        assertEquals("unhealthy", h.status());
        assertFalse(h.modelLoaded());
        assertNull(h.modelVersion());
    }

    @Test
    void healthAndInfoReflectPublishedModel() {
        store.publish(TestSnapshots.snapshot("v1", TestSnapshots.oneHot(CropType.RICE)));

        HealthResponse h = facade.health();
        assertEquals("healthy", h.status());
        assertEquals("v1", h.modelVersion());

        ModelInfoResponse info = facade.modelInfo();
        assertEquals(ModelKind.GRADIENT_BOOSTING.displayName(), info.modelName());
        assertEquals(13, info.featureCount());
        assertEquals(22, info.classCount());
        assertEquals(CropType.labels(), info.supportedCrops());
        assertEquals(0.95, info.accuracy(), 1e-12);
    }

    @Test
    void modelInfoWithoutModelIsUnavailable() {
        InferenceException e = assertThrows(InferenceException.class, facade::modelInfo);
        assertTrue(e.isModelUnavailable());
    }

    @Test
    void featureImportanceIsNormalizedAndSortedDescending() {
        store.publish(TestSnapshots.snapshot("v1", TestSnapshots.oneHot(CropType.RICE)));

        FeatureImportanceResponse r = facade.featureImportance();

        Map<String, Double> imp = r.featureImportance();
        assertEquals(13, imp.size());
        assertEquals(1.0, imp.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);

        List<Double> values = new ArrayList<>(imp.values());
        for (int i = 1; i < values.size(); i++) {
            assertTrue(values.get(i - 1) >= values.get(i));
        }
        // фиксированный классификатор даёт важность i+1 -> последняя фича схемы на первом месте
        assertEquals("ph_rainfall_interaction", imp.keySet().iterator().next());
    }

    @Test
    void logisticModelHasNoFeatureImportance() {
        store.publish(TestSnapshots.snapshot("v-lr", new TestSnapshots.FixedClassifier(
                TestSnapshots.oneHot(CropType.RICE), ModelKind.LOGISTIC_REGRESSION), 0.9));

        assertThrows(NotAvailableException.class, facade::featureImportance);
    }

    @Test
    void retrainStatusWithoutJobsIsNotFound() {
        when(retrainOrchestrator.latest()).thenReturn(Optional.empty());
        when(retrainOrchestrator.job("nope")).thenReturn(Optional.empty());

        assertThrows(RetrainJobNotFoundException.class, () -> facade.retrainStatus(null));
        assertThrows(RetrainJobNotFoundException.class, () -> facade.retrainStatus("nope"));
    }

    @Test
    void normalizeSortedBreaksTiesByName() {
        Map<String, Double> out = CropServiceFacadeImpl.normalizeSorted(List.of("b", "a", "c"), new double[]{1, 1, 2});

        assertEquals(List.of("c", "a", "b"), new ArrayList<>(out.keySet()));
        assertEquals(0.5, out.get("c"), 1e-12);
    }
}
