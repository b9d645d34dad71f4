package com.chicu.croprecommender.ai.ml.features;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Упорядоченный список имён фич + хэш схемы.
 * Хэш пишется в артефакты: модель, обученная на другой схеме, не загрузится.
 */
public class FeatureSchema {

    public static final FeatureSchema CROP = new FeatureSchema(
            "N", "P", "K", "temperature", "humidity", "ph", "rainfall",
            "NPK_avg", "THI", "rainfall_level", "ph_category",
            "temp_rainfall_interaction", "ph_rainfall_interaction"
    );

    private final List<String> names;
    private final String schemaHash;

    public FeatureSchema(String... names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("feature schema is empty");
        }
        this.names = List.of(names);
        this.schemaHash = digest(this.names);
    }

    public String[] featureNames() {
        return names.toArray(new String[0]);
    }

    public List<String> featureNameList() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public String schemaHash() {
        return schemaHash;
    }

    /** Те же имена в том же порядке. */
    public boolean sameAs(List<String> other) {
        return names.equals(other);
    }

    // ===== helpers =====

    private static String digest(List<String> names) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            for (String n : names) {
                md.update(n.getBytes(StandardCharsets.UTF_8));
                md.update((byte) '|');
            }
            return HexFormat.of().formatHex(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
