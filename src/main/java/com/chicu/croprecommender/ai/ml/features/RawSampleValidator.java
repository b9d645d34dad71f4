package com.chicu.croprecommender.ai.ml.features;

import com.chicu.croprecommender.common.error.ValidationException;

/**
 * Fail-fast проверка: первое же нарушение -> ValidationException с именем поля.
 * Значения не клампятся.
 */
public final class RawSampleValidator {

    private RawSampleValidator() {
    }

    public static void validate(RawSample sample) {
        if (sample == null) {
            throw new ValidationException("sample", "required", "Input sample is required");
        }
        for (AgronomicField f : AgronomicField.values()) {
            Double v = f.read(sample);
            if (v == null) {
                throw ValidationException.missing(f.key());
            }
            if (!Double.isFinite(v)) {
                throw ValidationException.notFinite(f.key(), v);
            }
            if (v < f.min() || v > f.max()) {
                throw ValidationException.outOfRange(f.key(), v, f.min(), f.max());
            }
        }
    }
}
