package com.chicu.croprecommender.web.controller.api;

import com.chicu.croprecommender.web.dto.HealthResponse;
import com.chicu.croprecommender.web.facade.CropServiceFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthApiController {

    private final CropServiceFacade facade;

    @Value("${crop.api.version:1.0.0}")
    private String apiVersion;

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Crop Recommendation API");
        body.put("version", apiVersion);
        body.put("status", "running");
        return ResponseEntity.ok(body);
    }

    /**
     * Всегда 200: отсутствие модели отражается в status/model_loaded.
     */
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(facade.health());
    }
}
