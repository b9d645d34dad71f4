package com.chicu.croprecommender.web.controller.api;

import com.chicu.croprecommender.common.error.BatchTooLargeException;
import com.chicu.croprecommender.common.error.CropServiceException;
import com.chicu.croprecommender.common.error.InferenceException;
import com.chicu.croprecommender.common.error.NotAvailableException;
import com.chicu.croprecommender.common.error.RetrainInProgressException;
import com.chicu.croprecommender.common.error.RetrainJobNotFoundException;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import com.chicu.croprecommender.common.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException e, HttpServletRequest req) {
        log.warn("400 Validation at {}: field={} bound={}", safePath(req), e.getField(), e.getBound());
        Map<String, Object> body = body(400, e, req);
        body.put("field", e.getField());
        body.put("bound", e.getBound());
        return ResponseEntity.status(400).body(body);
    }

    @ExceptionHandler(BatchTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handleBatchTooLarge(BatchTooLargeException e, HttpServletRequest req) {
        log.warn("400 Batch too large at {}: {}", safePath(req), safeMsg(e));
        return build(400, e, req);
    }

    @ExceptionHandler(InferenceException.class)
    public ResponseEntity<Map<String, Object>> handleInference(InferenceException e, HttpServletRequest req) {
        if (e.isModelUnavailable()) {
            log.warn("503 at {}: {}", safePath(req), safeMsg(e));
            return build(503, e, req);
        }
        log.error("500 Inference at {}: {}", safePath(req), safeMsg(e), e);
        return build(500, e, req);
    }

    @ExceptionHandler(RetrainInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleInProgress(RetrainInProgressException e, HttpServletRequest req) {
        log.info("409 at {}: {}", safePath(req), safeMsg(e));
        Map<String, Object> body = body(409, e, req);
        body.put("job_id", e.getActiveJobId());
        return ResponseEntity.status(409).body(body);
    }

    @ExceptionHandler(TrainingFailedException.class)
    public ResponseEntity<Map<String, Object>> handleTrainingFailed(TrainingFailedException e, HttpServletRequest req) {
        log.warn("422 at {}: {}", safePath(req), safeMsg(e));
        return build(422, e, req);
    }

    @ExceptionHandler(NotAvailableException.class)
    public ResponseEntity<Map<String, Object>> handleNotAvailable(NotAvailableException e, HttpServletRequest req) {
        log.info("501 at {}: {}", safePath(req), safeMsg(e));
        return build(501, e, req);
    }

    @ExceptionHandler(RetrainJobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotFound(RetrainJobNotFoundException e, HttpServletRequest req) {
        log.info("404 at {}: {}", safePath(req), safeMsg(e));
        return build(404, e, req);
    }

    @ExceptionHandler(CropServiceException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(CropServiceException e, HttpServletRequest req) {
        // ModelLoadException и прочее, что не должно доходить до HTTP
        log.error("500 at {}: {}", safePath(req), safeMsg(e), e);
        return build(500, e, req);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest req) {
        log.warn("400 Bad Request at {}: {}", safePath(req), e.toString());
        Map<String, Object> body = body(400, e, req);
        // сообщение Jackson тащит внутренние имена классов
        if (e instanceof HttpMessageNotReadableException) {
            body.put("message", "Malformed JSON request body");
        }
        return ResponseEntity.status(400).body(body);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaType(HttpMediaTypeNotSupportedException e,
                                                               HttpServletRequest req) {
        log.warn("415 at {}: {}", safePath(req), e.getContentType());
        return build(415, e, req);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e,
                                                                      HttpServletRequest req) {
        log.warn("405 Method Not Allowed at {}: {}", safePath(req), e.getMethod());
        return build(405, e, req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e, HttpServletRequest req) {
        log.debug("404 at {}", safePath(req));
        return build(404, e, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle(Exception e, HttpServletRequest req) {
        // общий неожиданный 500, детали только в лог
        log.error("500 at {}: {}", safePath(req), safeMsg(e), e);
        Map<String, Object> body = body(500, e, req);
        body.put("message", "Internal server error");
        return ResponseEntity.status(500).body(body);
    }

    // ---------- helpers ----------

    private ResponseEntity<Map<String, Object>> build(int status, Exception e, HttpServletRequest req) {
        return ResponseEntity.status(status).body(body(status, e, req));
    }

    private Map<String, Object> body(int status, Exception e, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("code", status);
        body.put("error", e.getClass().getSimpleName());
        body.put("message", safeMsg(e));
        body.put("path", safePath(req));
        body.put("timestamp", System.currentTimeMillis());
        return body;
    }

    private String safeMsg(Throwable e) {
        String m = (e != null ? e.getMessage() : null);
        return (m != null && !m.isBlank()) ? m : (e != null ? e.getClass().getSimpleName() : "Error");
    }

    private String safePath(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
