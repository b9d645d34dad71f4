package com.chicu.croprecommender.ai.ml.training;

import com.chicu.croprecommender.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;

/**
 * Обучает кандидата. Ничего не публикует: решение принимает оркестратор.
 */
public interface ModelTrainer {

    ModelSnapshot train(TrainingDatasetBuilder.Dataset dataset);
}
