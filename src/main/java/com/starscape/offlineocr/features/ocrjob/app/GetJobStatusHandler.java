package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.api.dto.JobStatusResponse;
import org.springframework.stereotype.Service;

/**
 * Handler for retrieving a single job's status, segments and warnings.
 */
@Service
public class GetJobStatusHandler {
    
    private final JobOrchestrator jobOrchestrator;
    
    public GetJobStatusHandler(JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }
    
    public JobStatusResponse handle(String jobId) {
        return JobStatusResponse.from(jobOrchestrator.getSnapshot(jobId));
    }
}
