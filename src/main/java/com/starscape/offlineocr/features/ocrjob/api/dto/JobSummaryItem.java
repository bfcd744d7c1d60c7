package com.starscape.offlineocr.features.ocrjob.api.dto;

import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;

import java.time.Instant;

/**
 * One row of the job list.
 */
public record JobSummaryItem(
    String jobId,
    String name,
    String contentClass,
    String status,
    double progress,
    int warningCount,
    Instant createdAt
) {
    public static JobSummaryItem from(JobSnapshot job) {
        return new JobSummaryItem(
            job.jobId(),
            job.name(),
            job.contentClass().getDisplayName(),
            job.status().name(),
            job.progress(),
            job.warnings().size(),
            job.createdAt()
        );
    }
}
