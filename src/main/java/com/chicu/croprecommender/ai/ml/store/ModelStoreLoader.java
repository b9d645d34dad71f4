package com.chicu.croprecommender.ai.ml.store;

import com.chicu.croprecommender.ai.ml.CropModelProperties;
import com.chicu.croprecommender.ai.ml.dataset.TrainingDataLoader;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.training.ModelTrainer;
import com.chicu.croprecommender.common.error.CropServiceException;
import com.chicu.croprecommender.common.error.ModelLoadException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Загрузка модели на старте. Без модели сервис не поднимается:
 * ModelLoadException из @PostConstruct валит контекст.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelStoreLoader {

    private final ModelArtifactRepository repository;
    private final ModelStore store;
    private final CropModelProperties props;
    private final TrainingDataLoader dataLoader;
    private final ModelTrainer trainer;

    @PostConstruct
    public void load() {
        Optional<ModelSnapshot> loaded = repository.loadCurrent();
        if (loaded.isPresent()) {
            store.publish(loaded.get());
            return;
        }

        if (!props.isBootstrapIfMissing()) {
            log.error("❌ No model artifacts found, refusing to serve without a model");
            throw new ModelLoadException("no model artifacts found; train a model first or enable "
                    + "crop.model.bootstrap-if-missing");
        }

        log.warn("⚠️ No model artifacts found, bootstrapping from the default dataset");
        try {
            ModelSnapshot snapshot = trainer.train(dataLoader.load(dataLoader.resolve(null)));
            repository.save(snapshot);
            store.publish(snapshot);
        } catch (ModelLoadException e) {
            throw e;
        } catch (CropServiceException e) {
            throw new ModelLoadException("bootstrap training failed: " + e.getMessage(), e);
        }
    }
}
