package com.chicu.croprecommender.ai.ml;

import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.ai.retrain.RetrainOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * /actuator/health -> components.model.
 * DOWN, если снапшота нет; переобучение на статус не влияет.
 */
@Slf4j
@Component("model")
@RequiredArgsConstructor
public class ModelHealthIndicator implements HealthIndicator {

    private final ModelStore modelStore;
    private final RetrainOrchestrator retrainOrchestrator;

    @Override
    public Health health() {
        Optional<ModelSnapshot> snapshot = modelStore.find();
        if (snapshot.isEmpty()) {
            log.warn("⚠️ health: model not loaded");
            return Health.down()
                    .withDetail("modelLoaded", false)
                    .build();
        }

        ModelSnapshot s = snapshot.get();
        return Health.up()
                .withDetail("modelLoaded", true)
                .withDetail("version", s.version())
                .withDetail("kind", s.kind().name())
                .withDetail("testAccuracy", s.metrics().testAccuracy())
                .withDetail("retrainRunning", retrainOrchestrator.isRunning())
                .build();
    }
}
