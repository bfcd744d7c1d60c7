package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.api.dto.JobSummaryItem;
import com.starscape.offlineocr.features.ocrjob.domain.JobStatus;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ListJobsHandler {
    
    private final JobOrchestrator jobOrchestrator;
    
    public ListJobsHandler(JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }
    
    /**
     * @param status optional filter
     */
    public List<JobSummaryItem> handle(JobStatus status) {
        return jobOrchestrator.listSnapshots().stream()
                .filter(job -> status == null || job.status() == status)
                .map(JobSummaryItem::from)
                .toList();
    }
}
