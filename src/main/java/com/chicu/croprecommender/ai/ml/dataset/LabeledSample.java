package com.chicu.croprecommender.ai.ml.dataset;

import com.chicu.croprecommender.ai.ml.features.RawSample;

public record LabeledSample(
        int line,          // номер строки в источнике (для сообщений об ошибках)
        RawSample sample,
        String label
) {}
