package com.chicu.croprecommender.ai.ml.store;

import com.chicu.croprecommender.ai.ml.model.CropClassifier;
import com.chicu.croprecommender.ai.ml.model.FeatureScaler;
import com.chicu.croprecommender.ai.ml.model.FeatureTransform;
import com.chicu.croprecommender.ai.ml.model.ModelKind;
import com.chicu.croprecommender.ai.ml.model.ModelMetrics;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.common.error.ModelLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Файловое хранилище артефактов модели.
 *
 * <pre>
 * models/
 *   CURRENT                       версия активного комплекта
 *   &lt;version&gt;/classifier.bin
 *   &lt;version&gt;/feature-transform.json
 *   &lt;version&gt;/metrics.json
 * </pre>
 *
 * Три файла версионируются вместе: комплект с разными версиями внутри не загрузится.
 * Сообщения об ошибках называют артефакт и версию, но не абсолютный путь.
 */
@Slf4j
@Component
public class ModelArtifactRepository {

    static final String CURRENT_FILE = "CURRENT";
    static final String CLASSIFIER_FILE = "classifier.bin";
    static final String TRANSFORM_FILE = "feature-transform.json";
    static final String METRICS_FILE = "metrics.json";

    private final ObjectMapper objectMapper;
    private final Path modelsDir;

    public ModelArtifactRepository(ObjectMapper objectMapper, CropStorageProperties props) {
        this.objectMapper = objectMapper;
        this.modelsDir = Path.of(props.getModelsDir()).toAbsolutePath().normalize();
    }

    public boolean hasArtifacts() {
        return Files.exists(modelsDir.resolve(CURRENT_FILE));
    }

    // =========================================================
    // save
    // =========================================================

    public synchronized void save(ModelSnapshot snapshot) {
        String version = snapshot.version();
        Path tmpDir = modelsDir.resolve(version + ".tmp");
        Path dir = modelsDir.resolve(version);

        try {
            Files.createDirectories(modelsDir);
            deleteRecursively(tmpDir);
            Files.createDirectories(tmpDir);

            writeClassifier(tmpDir.resolve(CLASSIFIER_FILE), new ClassifierEnvelope(
                    version,
                    snapshot.kind(),
                    snapshot.labels(),
                    snapshot.transform().schemaHash(),
                    snapshot.classifier()
            ));
            objectMapper.writeValue(tmpDir.resolve(TRANSFORM_FILE).toFile(),
                    TransformArtifact.from(version, snapshot.transform()));
            objectMapper.writeValue(tmpDir.resolve(METRICS_FILE).toFile(), new MetricsArtifact(
                    version,
                    snapshot.createdAt().toString(),
                    snapshot.kind(),
                    snapshot.labels(),
                    snapshot.metrics()
            ));

            deleteRecursively(dir);
            Files.move(tmpDir, dir);

            Path pointerTmp = modelsDir.resolve(CURRENT_FILE + ".tmp");
            Files.writeString(pointerTmp, version, StandardCharsets.UTF_8);
            moveAtomically(pointerTmp, modelsDir.resolve(CURRENT_FILE));

            log.info("💾 Model artifacts saved: version={}", version);
        } catch (IOException e) {
            throw new ModelLoadException("failed to persist artifacts for model " + version, e);
        }
    }

    // =========================================================
    // load
    // =========================================================

    /**
     * Пусто, если артефактов нет вовсе. Неполный или несовместимый комплект: ModelLoadException.
     */
    public Optional<ModelSnapshot> loadCurrent() {
        Path pointer = modelsDir.resolve(CURRENT_FILE);
        if (!Files.exists(pointer)) {
            return Optional.empty();
        }

        String version;
        try {
            version = Files.readString(pointer, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new ModelLoadException("failed to read " + CURRENT_FILE + " pointer", e);
        }
        if (version.isEmpty()) {
            throw new ModelLoadException(CURRENT_FILE + " pointer is empty");
        }
        if (!version.matches("[A-Za-z0-9_.-]+") || version.contains("..")) {
            throw new ModelLoadException(CURRENT_FILE + " pointer holds an invalid version");
        }

        Path dir = modelsDir.resolve(version);
        for (String f : List.of(CLASSIFIER_FILE, TRANSFORM_FILE, METRICS_FILE)) {
            if (!Files.isRegularFile(dir.resolve(f))) {
                throw new ModelLoadException("artifact set for model " + version + " is incomplete: missing " + f);
            }
        }

        ClassifierEnvelope envelope = readClassifier(dir.resolve(CLASSIFIER_FILE), version);
        TransformArtifact transform = readJson(dir.resolve(TRANSFORM_FILE), TransformArtifact.class, version);
        MetricsArtifact metrics = readJson(dir.resolve(METRICS_FILE), MetricsArtifact.class, version);

        if (!version.equals(envelope.version())
                || !version.equals(transform.version())
                || !version.equals(metrics.version())) {
            throw new ModelLoadException("artifact version mismatch for model " + version
                    + ": classifier=" + envelope.version()
                    + " transform=" + transform.version()
                    + " metrics=" + metrics.version());
        }
        if (envelope.classifier() == null || envelope.kind() != envelope.classifier().kind()) {
            throw new ModelLoadException("classifier artifact of model " + version + " is inconsistent");
        }
        if (!envelope.labels().equals(metrics.labels())) {
            throw new ModelLoadException("label set mismatch between artifacts of model " + version);
        }
        if (!envelope.schemaHash().equals(transform.schemaHash())) {
            throw new ModelLoadException("feature schema mismatch between artifacts of model " + version);
        }

        ModelSnapshot snapshot;
        try {
            snapshot = ModelSnapshot.builder()
                    .version(version)
                    .createdAt(Instant.parse(metrics.createdAt()))
                    .classifier(envelope.classifier())
                    .transform(transform.toTransform())
                    .metrics(metrics.metrics())
                    .labels(envelope.labels())
                    .build();
        } catch (RuntimeException e) {
            throw new ModelLoadException("artifacts of model " + version + " are malformed", e);
        }

        ModelStore.verifyCompatible(snapshot);
        log.info("📂 Model artifacts loaded: version={} kind={}", version, snapshot.kind());
        return Optional.of(snapshot);
    }

    // =========================================================
    // helpers
    // =========================================================

    private static void writeClassifier(Path file, ClassifierEnvelope envelope) throws IOException {
        try (OutputStream os = Files.newOutputStream(file);
             ObjectOutputStream out = new ObjectOutputStream(os)) {
            out.writeObject(envelope);
        }
    }

    private static ClassifierEnvelope readClassifier(Path file, String version) {
        try (InputStream is = Files.newInputStream(file);
             ObjectInputStream in = new ObjectInputStream(is)) {
            Object o = in.readObject();
            if (!(o instanceof ClassifierEnvelope envelope)) {
                throw new ModelLoadException(CLASSIFIER_FILE + " of model " + version + " has unexpected content");
            }
            return envelope;
        } catch (IOException | ClassNotFoundException e) {
            throw new ModelLoadException("failed to read " + CLASSIFIER_FILE + " of model " + version, e);
        }
    }

    private <T> T readJson(Path file, Class<T> type, String version) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new ModelLoadException("failed to read " + file.getFileName() + " of model " + version, e);
        }
    }

    private static void moveAtomically(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path p) throws IOException {
        if (!Files.exists(p)) return;
        try (Stream<Path> walk = Files.walk(p)) {
            for (Path x : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(x);
            }
        }
    }

    // =========================================================
    // artifact formats
    // =========================================================

    record ClassifierEnvelope(
            String version,
            ModelKind kind,
            List<String> labels,
            String schemaHash,
            CropClassifier classifier
    ) implements Serializable {
        private static final long serialVersionUID = 1L;
    }

    record TransformArtifact(
            String version,
            String schemaHash,
            List<String> featureNames,
            double[] rainfallBins,
            double phAcidicBelow,
            double phNeutralMax,
            double[] scalerMean,
            double[] scalerScale
    ) {
        static TransformArtifact from(String version, FeatureTransform t) {
            return new TransformArtifact(
                    version,
                    t.schemaHash(),
                    t.featureNames(),
                    t.rainfallBins(),
                    t.phAcidicBelow(),
                    t.phNeutralMax(),
                    t.scaler().mean(),
                    t.scaler().scale()
            );
        }

        FeatureTransform toTransform() {
            return new FeatureTransform(
                    schemaHash,
                    featureNames,
                    rainfallBins,
                    phAcidicBelow,
                    phNeutralMax,
                    new FeatureScaler(scalerMean, scalerScale)
            );
        }
    }

    record MetricsArtifact(
            String version,
            String createdAt,
            ModelKind kind,
            List<String> labels,
            ModelMetrics metrics
    ) {}
}
