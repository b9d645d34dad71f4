package com.chicu.croprecommender.web.controller.api;

import com.chicu.croprecommender.web.dto.FeatureImportanceResponse;
import com.chicu.croprecommender.web.dto.ModelInfoResponse;
import com.chicu.croprecommender.web.dto.RetrainJobResponse;
import com.chicu.croprecommender.web.facade.CropServiceFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping(value = "/model", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ModelApiController {

    private final CropServiceFacade facade;

    @GetMapping("/info")
    public ResponseEntity<ModelInfoResponse> info() {
        return ResponseEntity.ok(facade.modelInfo());
    }

    @GetMapping("/feature-importance")
    public ResponseEntity<FeatureImportanceResponse> featureImportance() {
        return ResponseEntity.ok(facade.featureImportance());
    }

    /**
     * Запуск переобучения в фоне. 202 сразу, статус через GET /model/retrain/{jobId}.
     */
    @PostMapping("/retrain")
    public ResponseEntity<RetrainJobResponse> retrain(
            @RequestParam(name = "data_path", required = false) String dataPath
    ) {
        RetrainJobResponse r = facade.retrain(dataPath);
        log.info("🧠 /model/retrain accepted job={}", r.jobId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(r);
    }

    @GetMapping("/retrain")
    public ResponseEntity<RetrainJobResponse> latestRetrain() {
        return ResponseEntity.ok(facade.retrainStatus(null));
    }

    @GetMapping("/retrain/{jobId}")
    public ResponseEntity<RetrainJobResponse> retrainStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(facade.retrainStatus(jobId));
    }
}
