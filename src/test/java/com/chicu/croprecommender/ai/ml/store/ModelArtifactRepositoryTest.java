package com.chicu.croprecommender.ai.ml.store;

import com.chicu.croprecommender.ai.ml.CropPredictionService;
import com.chicu.croprecommender.ai.ml.PredictionResult;
import com.chicu.croprecommender.ai.ml.features.CropFeatureEngineer;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.ModelLoadException;
import com.chicu.croprecommender.support.TestSnapshots;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ModelArtifactRepositoryTest {

    @TempDir
    Path modelsDir;

    ObjectMapper mapper = new ObjectMapper();
    ModelArtifactRepository repository;

    @BeforeEach
    void setUp() {
        CropStorageProperties props = new CropStorageProperties();
        props.setModelsDir(modelsDir.toString());
        repository = new ModelArtifactRepository(mapper, props);
    }

    @Test
    void missingArtifactsIsEmptyNotError() {
        assertFalse(repository.hasArtifacts());
        assertTrue(repository.loadCurrent().isEmpty());
    }

    @Test
    void savedSnapshotLoadsBackWithIdenticalPredictions() {
        double[] raw = new double[CropType.count()];
        for (int i = 0; i < raw.length; i++) raw[i] = i + 1;
        ModelSnapshot saved = TestSnapshots.snapshot("gradient_boosting-20261018T000000Z-abcdef12-0001", raw);

        repository.save(saved);
        Optional<ModelSnapshot> loaded = repository.loadCurrent();

        assertTrue(repository.hasArtifacts());
        assertTrue(loaded.isPresent());
        assertEquals(saved.version(), loaded.get().version());
        assertEquals(saved.metrics(), loaded.get().metrics());
        assertEquals(saved.labels(), loaded.get().labels());
        assertEquals(saved.createdAt(), loaded.get().createdAt());

        PredictionResult a = predict(saved);
        PredictionResult b = predict(loaded.get());
        assertEquals(a, b);
    }

    @Test
    void currentPointerFollowsLatestSave() {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));
        repository.save(TestSnapshots.snapshot("v-two", TestSnapshots.oneHot(CropType.MAIZE)));

        assertEquals("v-two", repository.loadCurrent().orElseThrow().version());
        assertTrue(Files.isDirectory(modelsDir.resolve("v-one")));
    }

    @Test
    void versionMismatchBetweenArtifactsIsRejected() throws Exception {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));

        Path metrics = modelsDir.resolve("v-one").resolve(ModelArtifactRepository.METRICS_FILE);
        ObjectNode node = (ObjectNode) mapper.readTree(metrics.toFile());
        node.put("version", "v-other");
        mapper.writeValue(metrics.toFile(), node);

        ModelLoadException e = assertThrows(ModelLoadException.class, repository::loadCurrent);
        assertTrue(e.getMessage().contains("version mismatch"));
        assertFalse(e.getMessage().contains(modelsDir.toString()));
    }

    @Test
    void changedPhThresholdIsRejected() throws Exception {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));
        editTransform("v-one", node -> node.put("phNeutralMax", 8.0));

        ModelLoadException e = assertThrows(ModelLoadException.class, repository::loadCurrent);
        assertTrue(e.getMessage().contains("thresholds"), e.getMessage());
    }

    @Test
    void changedRainfallBinsAreRejected() throws Exception {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));
        editTransform("v-one", node -> {
            ArrayNode bins = node.putArray("rainfallBins");
            bins.add(50.0).add(120.0).add(200.0);
        });

        ModelLoadException e = assertThrows(ModelLoadException.class, repository::loadCurrent);
        assertTrue(e.getMessage().contains("thresholds"), e.getMessage());
    }

    @Test
    void incompleteArtifactSetIsRejected() throws Exception {
        repository.save(TestSnapshots.snapshot("v-one", TestSnapshots.oneHot(CropType.RICE)));
        Files.delete(modelsDir.resolve("v-one").resolve(ModelArtifactRepository.TRANSFORM_FILE));

        ModelLoadException e = assertThrows(ModelLoadException.class, repository::loadCurrent);
        assertTrue(e.getMessage().contains(ModelArtifactRepository.TRANSFORM_FILE));
    }

    @Test
    void pointerToUnknownVersionIsRejected() throws Exception {
        Files.writeString(modelsDir.resolve(ModelArtifactRepository.CURRENT_FILE), "../escape",
                StandardCharsets.UTF_8);

        assertThrows(ModelLoadException.class, repository::loadCurrent);
    }

    // ===== helpers =====

    private void editTransform(String version, Consumer<ObjectNode> edit) throws Exception {
        Path transform = modelsDir.resolve(version).resolve(ModelArtifactRepository.TRANSFORM_FILE);
        ObjectNode node = (ObjectNode) mapper.readTree(transform.toFile());
        edit.accept(node);
        mapper.writeValue(transform.toFile(), node);
    }

    private static PredictionResult predict(ModelSnapshot snapshot) {
        ModelStore store = new ModelStore();
        store.publish(snapshot);
        return new CropPredictionService(new CropFeatureEngineer(), store).predict(TestSnapshots.riceSample());
    }
}
