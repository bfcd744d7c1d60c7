package com.starscape.offlineocr.features.ocrjob.api.dto;

import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Job status as returned by the query endpoints.
 */
public record JobStatusResponse(
    String jobId,
    String name,
    String contentClass,
    long size,
    List<String> languages,
    String status,
    double progress,
    Integer pageCount,
    List<SegmentItem> segments,
    String extractedText,
    List<String> warnings,
    JobErrorItem error,
    Instant createdAt,
    Instant completedAt
) {
    public static JobStatusResponse from(JobSnapshot job) {
        return new JobStatusResponse(
            job.jobId(),
            job.name(),
            job.contentClass().getDisplayName(),
            job.size(),
            job.languages(),
            job.status().name(),
            job.progress(),
            job.pageCount(),
            job.segments().stream()
                .map(s -> new SegmentItem(s.pageIndex(), s.text(), s.confidence()))
                .toList(),
            job.extractedText(),
            job.warnings(),
            job.error() == null ? null : new JobErrorItem(job.error().kind().name(), job.error().message()),
            job.createdAt(),
            job.completedAt()
        );
    }
}
