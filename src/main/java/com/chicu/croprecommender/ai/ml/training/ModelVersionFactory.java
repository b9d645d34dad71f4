package com.chicu.croprecommender.ai.ml.training;

import com.chicu.croprecommender.ai.ml.model.ModelKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class ModelVersionFactory {

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    /**
     * Пример: gradient_boosting-20261018T120000Z-1a2b3c4d-7f3e
     * Версия используется как имя каталога артефактов, поэтому только [a-z0-9_-].
     */
    public String build(ModelKind kind, String schemaHash, Instant at) {
        String k = kind != null ? kind.name().toLowerCase(Locale.ROOT) : "unknown";
        String sh = (schemaHash != null && schemaHash.length() >= 8) ? schemaHash.substring(0, 8) : "noschema";
        String salt = String.format("%04x", ThreadLocalRandom.current().nextInt(0x10000));
        return k + "-" + TS.format(at) + "-" + sh + "-" + salt;
    }
}
