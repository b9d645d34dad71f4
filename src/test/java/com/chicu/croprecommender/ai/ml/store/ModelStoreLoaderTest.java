package com.chicu.croprecommender.ai.ml.store;

import com.chicu.croprecommender.ai.ml.CropModelProperties;
import com.chicu.croprecommender.ai.ml.dataset.TrainingDataLoader;
import com.chicu.croprecommender.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.croprecommender.ai.ml.training.ModelTrainer;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.ModelLoadException;
import com.chicu.croprecommender.support.TestSnapshots;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelStoreLoaderTest {

    @TempDir
    Path modelsDir;

    @Mock
    TrainingDataLoader dataLoader;

    @Mock
    ModelTrainer trainer;

    ObjectMapper mapper = new ObjectMapper();
    ModelArtifactRepository repository;
    ModelStore store;
    CropModelProperties props;

    @BeforeEach
    void setUp() {
        CropStorageProperties storage = new CropStorageProperties();
        storage.setModelsDir(modelsDir.toString());
        repository = new ModelArtifactRepository(mapper, storage);
        store = new ModelStore();
        props = new CropModelProperties();
    }

    @Test
    void missingArtifactsAreFatalWithoutBootstrap() {
        props.setBootstrapIfMissing(false);
        ModelStoreLoader loader = new ModelStoreLoader(repository, store, props, dataLoader, trainer);

        ModelLoadException e = assertThrows(ModelLoadException.class, loader::load);

        assertTrue(e.getMessage().contains("no model artifacts"), e.getMessage());
        assertTrue(store.find().isEmpty());
        verifyNoInteractions(dataLoader, trainer);
    }

    @Test
    void incompatibleArtifactsAreNeverBootstrappedOver() throws Exception {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));
        Path transform = modelsDir.resolve("v-one").resolve(ModelArtifactRepository.TRANSFORM_FILE);
        ObjectNode node = (ObjectNode) mapper.readTree(transform.toFile());
        node.put("phAcidicBelow", 6.0);
        mapper.writeValue(transform.toFile(), node);

        props.setBootstrapIfMissing(true);
        ModelStoreLoader loader = new ModelStoreLoader(repository, store, props, dataLoader, trainer);

        assertThrows(ModelLoadException.class, loader::load);

        assertTrue(store.find().isEmpty());
        verifyNoInteractions(dataLoader, trainer);
        ObjectNode after = (ObjectNode) mapper.readTree(transform.toFile());
        assertEquals(6.0, after.get("phAcidicBelow").asDouble());
    }

    @Test
    void existingArtifactsArePublished() {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));
        ModelStoreLoader loader = new ModelStoreLoader(repository, store, props, dataLoader, trainer);

        loader.load();

        assertEquals("v-one", store.current().version());
        verifyNoInteractions(trainer);
    }

    @Test
    void bootstrapTrainsPersistsAndPublishesWhenEnabled() {
        TrainingDataLoader.DatasetRef ref = new TrainingDataLoader.DatasetRef("crop_recommendation.csv", null);
        TrainingDatasetBuilder.Dataset dataset =
                new TrainingDatasetBuilder.Dataset("crop_recommendation.csv", new double[0][], new int[0], 0, 13);
        when(dataLoader.resolve(isNull())).thenReturn(ref);
        when(dataLoader.load(ref)).thenReturn(dataset);
        when(trainer.train(any())).thenReturn(
                TestSnapshots.snapshot("v-boot", TestSnapshots.oneHot(CropType.MAIZE)));

        props.setBootstrapIfMissing(true);
        new ModelStoreLoader(repository, store, props, dataLoader, trainer).load();

        assertEquals("v-boot", store.current().version());
        assertEquals("v-boot", repository.loadCurrent().orElseThrow().version());
        verify(trainer).train(dataset);
    }
}
