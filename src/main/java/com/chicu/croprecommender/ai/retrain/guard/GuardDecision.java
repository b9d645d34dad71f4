package com.chicu.croprecommender.ai.retrain.guard;

import lombok.Builder;

/**
 * Решение по кандидату. requiredAccuracy: порог, с которым сравнивали
 * (max из абсолютного минимума и допуска регрессии).
 */
@Builder
public record GuardDecision(
        boolean allowed,
        String reason,
        double candidateAccuracy,
        double requiredAccuracy
) {
    public static GuardDecision accept(double candidateAccuracy, double requiredAccuracy) {
        return GuardDecision.builder()
                .allowed(true)
                .reason("OK")
                .candidateAccuracy(candidateAccuracy)
                .requiredAccuracy(requiredAccuracy)
                .build();
    }

    public static GuardDecision reject(String reason, double candidateAccuracy, double requiredAccuracy) {
        return GuardDecision.builder()
                .allowed(false)
                .reason(reason)
                .candidateAccuracy(candidateAccuracy)
                .requiredAccuracy(requiredAccuracy)
                .build();
    }
}
