package com.chicu.croprecommender.common.error;

public class RetrainJobNotFoundException extends CropServiceException {

    public RetrainJobNotFoundException(String jobId) {
        super(jobId == null ? "No retrain job has been submitted yet" : "Retrain job not found: " + jobId);
    }
}
