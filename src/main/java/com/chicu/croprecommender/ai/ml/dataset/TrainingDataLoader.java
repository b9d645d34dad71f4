package com.chicu.croprecommender.ai.ml.dataset;

import com.chicu.croprecommender.ai.ml.store.CropStorageProperties;
import com.chicu.croprecommender.ai.retrain.RetrainProperties;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import com.chicu.croprecommender.common.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Ссылка на датасет -> Resource -> Dataset.
 * Ссылки: "classpath:..." или имя файла внутри crop.storage.data-dir.
 * Абсолютные пути и выход за пределы data-dir отклоняются.
 */
@Slf4j
@Component
public class TrainingDataLoader {

    static final String CLASSPATH_PREFIX = "classpath:";
    static final String FIELD = "data_path";

    private final CropDatasetReader reader;
    private final TrainingDatasetBuilder builder;
    private final Path dataDir;
    private final String defaultDataset;

    public TrainingDataLoader(CropDatasetReader reader,
                              TrainingDatasetBuilder builder,
                              CropStorageProperties storage,
                              RetrainProperties retrain) {
        this.reader = reader;
        this.builder = builder;
        this.dataDir = Path.of(storage.getDataDir()).toAbsolutePath().normalize();
        this.defaultDataset = retrain.getDefaultDataset();
    }

    public record DatasetRef(String name, Resource resource) {}

    /**
     * Синхронная проверка ссылки (до принятия задачи). Файл не читается.
     */
    public DatasetRef resolve(String reference) {
        String ref = (reference == null || reference.isBlank()) ? defaultDataset : reference.trim();

        if (ref.startsWith(CLASSPATH_PREFIX)) {
            String path = ref.substring(CLASSPATH_PREFIX.length());
            if (path.isBlank() || path.contains("..")) {
                throw new ValidationException(FIELD, "valid reference", "Invalid classpath dataset reference");
            }
            ClassPathResource resource = new ClassPathResource(path);
            if (!resource.exists()) {
                throw new ValidationException(FIELD, "exists", "Dataset '" + ref + "' not found");
            }
            return new DatasetRef(ref, resource);
        }

        Path candidate;
        try {
            Path given = Path.of(ref);
            if (given.isAbsolute()) {
                throw new ValidationException(FIELD, "relative to data dir",
                        "Dataset reference must be relative to the data directory");
            }
            candidate = dataDir.resolve(given).normalize();
        } catch (InvalidPathException e) {
            throw new ValidationException(FIELD, "valid reference", "Invalid dataset reference");
        }
        if (!candidate.startsWith(dataDir)) {
            throw new ValidationException(FIELD, "within data dir",
                    "Dataset reference must stay inside the data directory");
        }

        FileSystemResource resource = new FileSystemResource(candidate);
        if (!resource.exists() || !resource.isReadable()) {
            throw new ValidationException(FIELD, "exists", "Dataset '" + ref + "' not found");
        }
        return new DatasetRef(ref, resource);
    }

    public TrainingDatasetBuilder.Dataset load(DatasetRef ref) {
        try (InputStream in = ref.resource().getInputStream()) {
            return builder.build(ref.name(), reader.read(in, ref.name()));
        } catch (IOException e) {
            throw new TrainingFailedException("failed to open dataset '" + ref.name() + "'", e);
        }
    }
}
