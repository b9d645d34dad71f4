package com.chicu.croprecommender.ai.ml.training;

import com.chicu.croprecommender.ai.ml.CropModelProperties;
import com.chicu.croprecommender.ai.ml.dataset.CropDatasetReader;
import com.chicu.croprecommender.ai.ml.dataset.TrainingDataLoader;
import com.chicu.croprecommender.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.croprecommender.ai.ml.features.CropFeatureEngineer;
import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.ai.ml.model.ModelKind;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.store.CropStorageProperties;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.ai.retrain.RetrainProperties;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SmileModelTrainerTest {

    static TrainingDatasetBuilder.Dataset dataset;

    @BeforeAll
    static void loadDataset() {
        TrainingDataLoader loader = new TrainingDataLoader(
                new CropDatasetReader(),
                new TrainingDatasetBuilder(new CropFeatureEngineer()),
                new CropStorageProperties(),
                new RetrainProperties()
        );
        dataset = loader.load(loader.resolve(null));
    }

    @Test
    void gradientBoostingLearnsTheBundledDataset() {
        CropModelProperties props = new CropModelProperties();
        props.setTrees(20);

        ModelSnapshot s = new SmileModelTrainer(props, new ModelVersionFactory()).train(dataset);

        assertEquals(ModelKind.GRADIENT_BOOSTING, s.kind());
        assertTrue(s.version().startsWith("gradient_boosting-"), s.version());
        assertEquals(CropType.labels(), s.labels());
        assertEquals(440, s.metrics().testSamples());
        assertEquals(1760, s.metrics().trainSamples());
        assertTrue(s.metrics().testAccuracy() >= 0.80, "testAcc=" + s.metrics().testAccuracy());

        double[] importance = s.classifier().importance().orElseThrow();
        assertEquals(FeatureSchema.CROP.size(), importance.length);

        assertDoesNotThrow(() -> ModelStore.verifyCompatible(s));
    }

    @Test
    void logisticRegressionHasNoFeatureImportance() {
        CropModelProperties props = new CropModelProperties();
        props.setKind(ModelKind.LOGISTIC_REGRESSION);

        ModelSnapshot s = new SmileModelTrainer(props, new ModelVersionFactory()).train(dataset);

        assertEquals(ModelKind.LOGISTIC_REGRESSION, s.kind());
        assertTrue(s.classifier().importance().isEmpty());
        assertEquals(CropType.count(), s.classifier().classCount());
        assertTrue(s.metrics().testAccuracy() > 0.5, "testAcc=" + s.metrics().testAccuracy());
    }

    @Test
    void stratifiedSplitIsSeededAndCoversEveryClass() {
        SmileModelTrainer.Split a = SmileModelTrainer.stratifiedSplit(dataset.y(), CropType.count(), 0.2, 42L);
        SmileModelTrainer.Split b = SmileModelTrainer.stratifiedSplit(dataset.y(), CropType.count(), 0.2, 42L);

        assertArrayEquals(a.train(), b.train());
        assertArrayEquals(a.test(), b.test());
        assertEquals(dataset.samples(), a.train().length + a.test().length);

        Set<Integer> testClasses = new HashSet<>();
        for (int i : a.test()) testClasses.add(dataset.y()[i]);
        assertEquals(CropType.count(), testClasses.size());

        Set<Integer> seen = new HashSet<>();
        Arrays.stream(a.train()).forEach(seen::add);
        Arrays.stream(a.test()).forEach(i -> assertFalse(seen.contains(i), "overlap at " + i));
    }

    @Test
    void invalidTestSizeFails() {
        assertThrows(TrainingFailedException.class,
                () -> SmileModelTrainer.stratifiedSplit(dataset.y(), CropType.count(), 1.0, 42L));
    }

    @Test
    void argMaxPrefersLowerIndexOnTie() {
        assertEquals(1, SmileModelTrainer.argMax(new double[]{0.1, 0.45, 0.45}));
    }
}
