package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.api.dto.JobStatusResponse;
import org.springframework.stereotype.Service;

/**
 * Handler for cancelling and discarding jobs.
 */
@Service
public class ManageJobHandler {
    
    private final JobOrchestrator jobOrchestrator;
    
    public ManageJobHandler(JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }
    
    /**
     * Request cancellation and return the job as it stands. A job already in a terminal
     * state is returned unchanged.
     */
    public JobStatusResponse cancel(String jobId) {
        jobOrchestrator.cancel(jobId);
        return JobStatusResponse.from(jobOrchestrator.getSnapshot(jobId));
    }
    
    public void discard(String jobId) {
        jobOrchestrator.discard(jobId);
    }
}
