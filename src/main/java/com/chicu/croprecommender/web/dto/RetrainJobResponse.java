package com.chicu.croprecommender.web.dto;

import com.chicu.croprecommender.ai.retrain.RetrainJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrainJobResponse(
        @JsonProperty("accepted") Boolean accepted,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("dataset") String dataset,
        @JsonProperty("message") String message,
        @JsonProperty("error") String error,
        @JsonProperty("submitted_at") String submittedAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("previous_version") String previousVersion,
        @JsonProperty("result_version") String resultVersion,
        @JsonProperty("candidate_metrics") ModelMetricsDto candidateMetrics
) {

    public static RetrainJobResponse accepted(RetrainJob job) {
        return of(Boolean.TRUE, job);
    }

    public static RetrainJobResponse status(RetrainJob job) {
        return of(null, job);
    }

    private static RetrainJobResponse of(Boolean accepted, RetrainJob j) {
        return new RetrainJobResponse(
                accepted,
                j.jobId(),
                j.state().name(),
                j.dataset(),
                j.message(),
                j.error(),
                j.submittedAt() != null ? j.submittedAt().toString() : null,
                j.updatedAt() != null ? j.updatedAt().toString() : null,
                j.previousVersion(),
                j.resultVersion(),
                ModelMetricsDto.from(j.candidateMetrics())
        );
    }
}
