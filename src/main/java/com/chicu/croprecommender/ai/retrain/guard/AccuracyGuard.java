package com.chicu.croprecommender.ai.retrain.guard;

import com.chicu.croprecommender.ai.ml.model.ModelMetrics;
import com.chicu.croprecommender.ai.retrain.RetrainProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Ворота публикации кандидата:
 * testAccuracy >= minAccuracy и testAccuracy >= previous - maxRegression.
 */
@Component
@RequiredArgsConstructor
public class AccuracyGuard {

    private final RetrainProperties props;

    /**
     * @param previous метрики активной модели, null если модели нет
     */
    public GuardDecision checkCandidate(ModelMetrics previous, ModelMetrics candidate) {
        double min = props.getMinAccuracy();
        if (candidate == null) {
            return GuardDecision.reject("candidate has no metrics", Double.NaN, min);
        }

        double acc = candidate.testAccuracy();
        if (!Double.isFinite(acc)) {
            return GuardDecision.reject("candidate accuracy is not a number", acc, min);
        }
        if (acc < min) {
            return GuardDecision.reject(String.format(Locale.ROOT,
                    "held-out accuracy %.4f is below the minimum %.4f", acc, min), acc, min);
        }

        double required = min;
        if (previous != null) {
            double floor = previous.testAccuracy() - props.getMaxRegression();
            required = Math.max(min, floor);
            if (acc < floor) {
                return GuardDecision.reject(String.format(Locale.ROOT,
                        "held-out accuracy %.4f regresses below %.4f (current %.4f, tolerance %.4f)",
                        acc, floor, previous.testAccuracy(), props.getMaxRegression()), acc, required);
            }
        }
        return GuardDecision.accept(acc, required);
    }
}
