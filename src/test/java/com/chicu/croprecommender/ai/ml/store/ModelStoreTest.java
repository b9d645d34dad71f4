package com.chicu.croprecommender.ai.ml.store;

import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.ai.ml.model.FeatureScaler;
import com.chicu.croprecommender.ai.ml.model.FeatureTransform;
import com.chicu.croprecommender.ai.ml.model.ModelKind;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.InferenceException;
import com.chicu.croprecommender.common.error.ModelLoadException;
import com.chicu.croprecommender.support.TestSnapshots;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelStoreTest {

    private final ModelStore store = new ModelStore();

    @Test
    void emptyStoreHasNoModel() {
        assertFalse(store.isLoaded());
        assertTrue(store.find().isEmpty());

        InferenceException e = assertThrows(InferenceException.class, store::current);
        assertTrue(e.isModelUnavailable());
    }

    @Test
    void publishReplacesSnapshotAndOldReferenceStaysIntact() {
        ModelSnapshot v1 = TestSnapshots.snapshot("v1", TestSnapshots.oneHot(CropType.RICE));
        ModelSnapshot v2 = TestSnapshots.snapshot("v2", TestSnapshots.oneHot(CropType.MAIZE));

        store.publish(v1);
        ModelSnapshot held = store.current();
        store.publish(v2);

        assertSame(v2, store.current());
        assertEquals("v1", held.version());
    }

    @Test
    void rejectsForeignLabelSet() {
        List<String> labels = new ArrayList<>(CropType.labels());
        Collections.reverse(labels);

        ModelSnapshot s = ModelSnapshot.builder()
                .version("v-labels")
                .classifier(new TestSnapshots.FixedClassifier(TestSnapshots.oneHot(CropType.RICE),
                        ModelKind.GRADIENT_BOOSTING))
                .transform(TestSnapshots.identityTransform())
                .metrics(TestSnapshots.metrics(0.9))
                .labels(labels)
                .build();

        assertThrows(ModelLoadException.class, () -> store.publish(s));
        assertFalse(store.isLoaded());
    }

    @Test
    void rejectsForeignFeatureSchema() {
        FeatureSchema other = new FeatureSchema("N", "P", "K");
        FeatureTransform t = FeatureTransform.of(other, new FeatureScaler(new double[3], new double[]{1, 1, 1}));

        ModelSnapshot s = ModelSnapshot.builder()
                .version("v-schema")
                .classifier(new TestSnapshots.FixedClassifier(TestSnapshots.oneHot(CropType.RICE),
                        ModelKind.GRADIENT_BOOSTING))
                .transform(t)
                .metrics(TestSnapshots.metrics(0.9))
                .labels(CropType.labels())
                .build();

        ModelLoadException e = assertThrows(ModelLoadException.class, () -> store.publish(s));
        assertTrue(e.getMessage().contains("schema"));
    }
}
