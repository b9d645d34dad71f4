package com.chicu.croprecommender.ai.ml;

import com.chicu.croprecommender.ai.ml.model.ModelKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "crop.model")
public class CropModelProperties {

    private ModelKind kind = ModelKind.GRADIENT_BOOSTING;

    /** Seed для стратифицированного сплита и Smile. */
    private long seed = 42L;

    /** Доля hold-out выборки. */
    private double testSize = 0.2;

    // --- gradient boosting (как n_estimators=100, learning_rate=0.1, max_depth=6) ---
    private int trees = 100;
    private int maxDepth = 6;
    private int maxNodes = 32;
    private int nodeSize = 5;
    private double shrinkage = 0.1;
    private double subsample = 1.0;

    // --- logistic regression ---
    private double logisticLambda = 0.1;
    private double logisticTolerance = 1e-5;
    private int logisticMaxIter = 500;

    /**
     * Если артефактов нет, обучить первую модель на crop.retrain.default-dataset.
     * Несовместимые артефакты никогда не перезаписываются.
     */
    private boolean bootstrapIfMissing = false;
}
