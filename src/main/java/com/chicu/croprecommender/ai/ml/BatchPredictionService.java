package com.chicu.croprecommender.ai.ml;

import com.chicu.croprecommender.ai.ml.features.RawSample;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.common.error.BatchTooLargeException;
import com.chicu.croprecommender.common.error.CropServiceException;
import com.chicu.croprecommender.common.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Батч до maxSize элементов. Ошибка одного элемента не роняет соседей;
 * порядок результатов = порядок входа.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchPredictionService {

    private final CropPredictionService predictionService;
    private final ModelStore modelStore;
    private final BatchProperties props;

    public List<BatchItemOutcome> predictBatch(List<RawSample> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("predictions", "min 1 item", "Batch must contain at least one item");
        }
        int max = props.getMaxSize();
        if (items.size() > max) {
            throw new BatchTooLargeException(items.size(), max);
        }

        // один снапшот на весь батч
        ModelSnapshot snapshot = modelStore.current();

        List<BatchItemOutcome> out = new ArrayList<>(items.size());
        int failed = 0;
        for (int i = 0; i < items.size(); i++) {
            try {
                out.add(BatchItemOutcome.ok(i, predictionService.predict(items.get(i), snapshot)));
            } catch (CropServiceException e) {
                failed++;
                out.add(BatchItemOutcome.failed(i, e));
            }
        }

        if (failed > 0) {
            log.info("🧠 BATCH done model={} size={} failed={}", snapshot.version(), items.size(), failed);
        } else {
            log.debug("🧠 BATCH done model={} size={}", snapshot.version(), items.size());
        }
        return out;
    }
}
