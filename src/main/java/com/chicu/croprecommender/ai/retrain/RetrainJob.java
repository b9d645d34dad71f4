package com.chicu.croprecommender.ai.retrain;

import com.chicu.croprecommender.ai.ml.model.ModelMetrics;
import lombok.Builder;

import java.time.Instant;

/**
 * Неизменяемый слепок статуса задачи переобучения.
 */
@Builder(toBuilder = true)
public record RetrainJob(
        String jobId,
        RetrainState state,
        String dataset,
        String reason,
        Instant submittedAt,
        Instant updatedAt,
        String message,
        String error,             // тип ошибки для FAILED
        String previousVersion,   // версия, активная на момент запуска
        String resultVersion,     // опубликованная версия (только SUCCEEDED)
        ModelMetrics candidateMetrics
) {

    RetrainJob transition(RetrainState next, String message) {
        return toBuilder()
                .state(next)
                .message(message)
                .updatedAt(Instant.now())
                .build();
    }
}
