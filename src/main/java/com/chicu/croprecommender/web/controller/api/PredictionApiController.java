package com.chicu.croprecommender.web.controller.api;

import com.chicu.croprecommender.web.dto.BatchPredictionRequest;
import com.chicu.croprecommender.web.dto.BatchPredictionResponse;
import com.chicu.croprecommender.web.dto.CropPredictionRequest;
import com.chicu.croprecommender.web.dto.CropPredictionResponse;
import com.chicu.croprecommender.web.facade.CropServiceFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/predict")
@RequiredArgsConstructor
public class PredictionApiController {

    private final CropServiceFacade facade;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CropPredictionResponse> predict(@RequestBody CropPredictionRequest request) {
        CropPredictionResponse r = facade.predict(request);
        log.debug("🧠 /predict -> {} ({})", r.predictedCrop(), r.confidence());
        return ResponseEntity.ok(r);
    }

    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchPredictionResponse> predictBatch(@RequestBody BatchPredictionRequest request) {
        return ResponseEntity.ok(facade.predictBatch(request));
    }
}
