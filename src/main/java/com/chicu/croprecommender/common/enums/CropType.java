package com.chicu.croprecommender.common.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Фиксированный набор из 22 культур.
 * Порядок констант = лексикографический порядок меток, индекс метки = ordinal().
 */
public enum CropType {
    APPLE,
    BANANA,
    BLACKGRAM,
    CHICKPEA,
    COCONUT,
    COFFEE,
    COTTON,
    GRAPES,
    JUTE,
    KIDNEYBEANS,
    LENTIL,
    MAIZE,
    MANGO,
    MOTHBEANS,
    MUNGBEAN,
    MUSKMELON,
    ORANGE,
    PAPAYA,
    PIGEONPEAS,
    POMEGRANATE,
    RICE,
    WATERMELON;

    private static final List<String> LABELS = Arrays.stream(values())
            .map(CropType::label)
            .toList();

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Метки всех культур в порядке индексов классификатора. */
    public static List<String> labels() {
        return LABELS;
    }

    public static int count() {
        return LABELS.size();
    }

    public static Optional<CropType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String key = label.trim().toUpperCase(Locale.ROOT);
        for (CropType c : values()) {
            if (c.name().equals(key)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
