package com.chicu.croprecommender.ai.retrain;

import lombok.Builder;

@Builder
public record RetrainRequest(
        // classpath:... или имя файла в data-dir; null -> датасет по умолчанию
        String dataset,
        // кто/зачем запустил (api/manual/...)
        String reason
) {}
