package com.starscape.offlineocr.features.ocrjob.domain;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a job at one point in time. Segments are ordered by page index.
 */
public record JobSnapshot(
    String jobId,
    String name,
    ContentClass contentClass,
    long size,
    List<String> languages,
    JobStatus status,
    double progress,
    Instant createdAt,
    Instant completedAt,
    List<String> warnings,
    JobError error,
    List<Segment> segments,
    String extractedText,
    Integer pageCount
) {}
