package com.chicu.croprecommender.ai.ml.training;

import com.chicu.croprecommender.ai.ml.CropModelProperties;
import com.chicu.croprecommender.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.ai.ml.model.CropClassifier;
import com.chicu.croprecommender.ai.ml.model.FeatureScaler;
import com.chicu.croprecommender.ai.ml.model.FeatureTransform;
import com.chicu.croprecommender.ai.ml.model.GradientBoostingCropClassifier;
import com.chicu.croprecommender.ai.ml.model.LogisticCropClassifier;
import com.chicu.croprecommender.ai.ml.model.ModelKind;
import com.chicu.croprecommender.ai.ml.model.ModelMetrics;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.common.enums.CropType;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.math.MathEx;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Обучение на Smile: стратифицированный сплит -> скейлер по train -> классификатор -> метрики.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmileModelTrainer implements ModelTrainer {

    private final CropModelProperties props;
    private final ModelVersionFactory versionFactory;

    @Override
    public ModelSnapshot train(TrainingDatasetBuilder.Dataset dataset) {
        if (dataset == null) throw new IllegalArgumentException("dataset=null");

        FeatureSchema schema = FeatureSchema.CROP;
        if (dataset.features() != schema.size()) {
            throw new TrainingFailedException("dataset has " + dataset.features()
                    + " features, schema expects " + schema.size());
        }

        ModelKind kind = props.getKind();
        int classes = CropType.count();
        long started = System.currentTimeMillis();

        log.info("🧠 TRAIN START kind={} dataset={} samples={} testSize={} seed={}",
                kind, dataset.datasetId(), dataset.samples(), props.getTestSize(), props.getSeed());

        Split split = stratifiedSplit(dataset.y(), classes, props.getTestSize(), props.getSeed());

        double[][] xTrainRaw = rows(dataset.X(), split.train());
        double[][] xTestRaw = rows(dataset.X(), split.test());
        int[] yTrain = labels(dataset.y(), split.train());
        int[] yTest = labels(dataset.y(), split.test());

        FeatureScaler scaler = FeatureScaler.fit(xTrainRaw);
        double[][] xTrain = scaler.transform(xTrainRaw);
        double[][] xTest = scaler.transform(xTestRaw);

        CropClassifier classifier;
        try {
            MathEx.setSeed(props.getSeed());
            classifier = fit(kind, xTrain, yTrain, schema.featureNames(), classes);
        } catch (RuntimeException e) {
            throw new TrainingFailedException("classifier fit failed: " + e.getMessage(), e);
        }

        double trainAccuracy = accuracy(classifier, xTrain, yTrain);
        double testAccuracy = accuracy(classifier, xTest, yTest);

        ModelMetrics metrics = ModelMetrics.builder()
                .trainAccuracy(trainAccuracy)
                .testAccuracy(testAccuracy)
                .trainSamples(xTrain.length)
                .testSamples(xTest.length)
                .features(schema.size())
                .classes(classes)
                .datasetId(dataset.datasetId())
                .build();

        Instant now = Instant.now();
        String version = versionFactory.build(kind, schema.schemaHash(), now);

        log.info("🧠 TRAIN OK version={} trainAcc={} testAcc={} tookMs={}",
                version, fmt(trainAccuracy), fmt(testAccuracy), System.currentTimeMillis() - started);

        return ModelSnapshot.builder()
                .version(version)
                .createdAt(now)
                .classifier(classifier)
                .transform(FeatureTransform.of(schema, scaler))
                .metrics(metrics)
                .labels(CropType.labels())
                .build();
    }

    private CropClassifier fit(ModelKind kind, double[][] x, int[] y, String[] names, int classes) {
        return switch (kind) {
            case GRADIENT_BOOSTING -> GradientBoostingCropClassifier.fit(
                    x, y, names, classes,
                    props.getTrees(),
                    props.getMaxDepth(),
                    props.getMaxNodes(),
                    props.getNodeSize(),
                    props.getShrinkage(),
                    props.getSubsample()
            );
            case LOGISTIC_REGRESSION -> LogisticCropClassifier.fit(
                    x, y, classes,
                    props.getLogisticLambda(),
                    props.getLogisticTolerance(),
                    props.getLogisticMaxIter()
            );
        };
    }

    // =========================================================
    // helpers
    // =========================================================

    static double accuracy(CropClassifier classifier, double[][] x, int[] y) {
        if (x.length == 0) return 0.0;
        int hit = 0;
        for (int i = 0; i < x.length; i++) {
            if (argMax(classifier.posteriori(x[i])) == y[i]) hit++;
        }
        return (double) hit / x.length;
    }

    /** При равенстве выигрывает меньший индекс = лексикографически меньшая метка. */
    static int argMax(double[] p) {
        int best = 0;
        for (int i = 1; i < p.length; i++) {
            if (p[i] > p[best]) best = i;
        }
        return best;
    }

    /**
     * Сплит по классам: в train и test попадает каждый класс.
     */
    static Split stratifiedSplit(int[] y, int classes, double testSize, long seed) {
        if (testSize <= 0.0 || testSize >= 1.0) {
            throw new TrainingFailedException("testSize must be in (0,1), got " + testSize);
        }

        List<List<Integer>> byClass = new ArrayList<>();
        for (int c = 0; c < classes; c++) byClass.add(new ArrayList<>());
        for (int i = 0; i < y.length; i++) byClass.get(y[i]).add(i);

        Random rnd = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();

        for (int c = 0; c < classes; c++) {
            List<Integer> idx = byClass.get(c);
            if (idx.size() < 2) {
                throw new TrainingFailedException("class '" + CropType.labels().get(c)
                        + "' needs at least 2 samples, got " + idx.size());
            }
            Collections.shuffle(idx, rnd);
            int nTest = (int) Math.round(idx.size() * testSize);
            nTest = Math.max(1, Math.min(idx.size() - 1, nTest));
            test.addAll(idx.subList(0, nTest));
            train.addAll(idx.subList(nTest, idx.size()));
        }

        Collections.shuffle(train, rnd);
        return new Split(
                train.stream().mapToInt(Integer::intValue).toArray(),
                test.stream().mapToInt(Integer::intValue).toArray()
        );
    }

    private static double[][] rows(double[][] x, int[] idx) {
        double[][] out = new double[idx.length][];
        for (int i = 0; i < idx.length; i++) out[i] = x[idx[i]].clone();
        return out;
    }

    private static int[] labels(int[] y, int[] idx) {
        int[] out = new int[idx.length];
        for (int i = 0; i < idx.length; i++) out[i] = y[idx[i]];
        return out;
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }

    record Split(int[] train, int[] test) {}
}
