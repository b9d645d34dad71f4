package com.chicu.croprecommender.ai.retrain;

/**
 * QUEUED -> TRAINING -> VALIDATING -> PUBLISHING -> SUCCEEDED
 * QUEUED/TRAINING/VALIDATING/PUBLISHING -> FAILED
 */
public enum RetrainState {
    QUEUED,
    TRAINING,
    VALIDATING,
    PUBLISHING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
