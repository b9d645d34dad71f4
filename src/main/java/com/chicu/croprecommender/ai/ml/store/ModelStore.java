package com.chicu.croprecommender.ai.ml.store;

import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.ai.ml.model.FeatureTransform;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.InferenceException;
import com.chicu.croprecommender.common.error.ModelLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Держит активный снапшот. Публикация: одна замена ссылки:
 * читатель видит либо старый, либо новый снапшот целиком.
 */
@Slf4j
@Component
public class ModelStore {

    private final AtomicReference<ModelSnapshot> current = new AtomicReference<>();

    /**
     * Последний опубликованный снапшот. Не блокируется на переобучении.
     */
    public ModelSnapshot current() {
        ModelSnapshot s = current.get();
        if (s == null) throw InferenceException.modelNotLoaded();
        return s;
    }

    public Optional<ModelSnapshot> find() {
        return Optional.ofNullable(current.get());
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public void publish(ModelSnapshot snapshot) {
        verifyCompatible(snapshot);
        ModelSnapshot previous = current.getAndSet(snapshot);
        log.info("📌 MODEL PUBLISHED version={} kind={} testAcc={} previous={}",
                snapshot.version(),
                snapshot.kind(),
                snapshot.metrics().testAccuracy(),
                previous != null ? previous.version() : "none");
    }

    /**
     * Совместимость снапшота с текущей сборкой: метки, схема фич, пороги, размерности.
     */
    public static void verifyCompatible(ModelSnapshot s) {
        if (s == null) throw new ModelLoadException("snapshot=null");

        if (!CropType.labels().equals(s.labels())) {
            throw new ModelLoadException("label set mismatch for model " + s.version()
                    + ": expected " + CropType.count() + " fixed crop labels, got " + s.labels().size());
        }

        FeatureTransform t = s.transform();
        FeatureSchema schema = FeatureSchema.CROP;
        if (!schema.schemaHash().equals(t.schemaHash()) || !schema.sameAs(t.featureNames())) {
            throw new ModelLoadException("feature schema mismatch for model " + s.version());
        }
        if (!t.matchesCompiledThresholds()) {
            throw new ModelLoadException("feature thresholds of model " + s.version()
                    + " differ from the serving thresholds");
        }
        if (t.scaler().size() != schema.size()) {
            throw new ModelLoadException("scaler of model " + s.version() + " has "
                    + t.scaler().size() + " features, expected " + schema.size());
        }
        if (s.classifier().classCount() != CropType.count()) {
            throw new ModelLoadException("classifier of model " + s.version() + " has "
                    + s.classifier().classCount() + " classes, expected " + CropType.count());
        }
    }
}
