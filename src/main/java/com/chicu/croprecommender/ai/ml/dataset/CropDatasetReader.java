package com.chicu.croprecommender.ai.ml.dataset;

import com.chicu.croprecommender.ai.ml.features.AgronomicField;
import com.chicu.croprecommender.ai.ml.features.RawSample;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Читает размеченный CSV: N,P,K,temperature,humidity,ph,rainfall,label.
 * Порядок колонок берётся из заголовка, лишние колонки игнорируются.
 */
@Slf4j
@Component
public class CropDatasetReader {

    static final String LABEL_COLUMN = "label";

    public List<LabeledSample> read(InputStream in, String datasetId) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String header = reader.readLine();
            if (header == null || header.isBlank()) {
                throw new TrainingFailedException("dataset '" + datasetId + "' is empty");
            }

            String[] columns = split(stripBom(header));
            Map<AgronomicField, Integer> fieldIdx = new EnumMap<>(AgronomicField.class);
            int labelIdx = -1;

            for (int i = 0; i < columns.length; i++) {
                String c = columns[i];
                if (LABEL_COLUMN.equalsIgnoreCase(c)) {
                    labelIdx = i;
                    continue;
                }
                for (AgronomicField f : AgronomicField.values()) {
                    if (f.key().equalsIgnoreCase(c)) fieldIdx.put(f, i);
                }
            }

            if (labelIdx < 0) {
                throw new TrainingFailedException("dataset '" + datasetId + "' has no '" + LABEL_COLUMN + "' column");
            }
            for (AgronomicField f : AgronomicField.values()) {
                if (!fieldIdx.containsKey(f)) {
                    throw new TrainingFailedException("dataset '" + datasetId + "' has no '" + f.key() + "' column");
                }
            }

            List<LabeledSample> out = new ArrayList<>();
            String line;
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;

                String[] cells = split(line);
                if (cells.length < columns.length) {
                    throw new TrainingFailedException("dataset '" + datasetId + "' line " + lineNo
                            + ": expected " + columns.length + " columns, got " + cells.length);
                }

                RawSample sample = new RawSample(
                        number(cells, fieldIdx.get(AgronomicField.N), datasetId, lineNo),
                        number(cells, fieldIdx.get(AgronomicField.P), datasetId, lineNo),
                        number(cells, fieldIdx.get(AgronomicField.K), datasetId, lineNo),
                        number(cells, fieldIdx.get(AgronomicField.TEMPERATURE), datasetId, lineNo),
                        number(cells, fieldIdx.get(AgronomicField.HUMIDITY), datasetId, lineNo),
                        number(cells, fieldIdx.get(AgronomicField.PH), datasetId, lineNo),
                        number(cells, fieldIdx.get(AgronomicField.RAINFALL), datasetId, lineNo)
                );
                out.add(new LabeledSample(lineNo, sample, cells[labelIdx]));
            }

            log.info("📥 Dataset read: id={} rows={}", datasetId, out.size());
            return out;

        } catch (IOException e) {
            throw new TrainingFailedException("failed to read dataset '" + datasetId + "'", e);
        }
    }

    private static Double number(String[] cells, int idx, String datasetId, int lineNo) {
        String raw = cells[idx];
        if (raw.isEmpty()) return null;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new TrainingFailedException("dataset '" + datasetId + "' line " + lineNo
                    + ": not a number '" + raw + "'");
        }
    }

    private static String[] split(String line) {
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = unquote(parts[i].trim());
        }
        return parts;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    private static String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
