package com.starscape.offlineocr.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * Progress update DTO for WebSocket broadcasts.
 * Sent whenever a job's progress advances.
 */
public record JobProgressUpdate(
    String jobId,
    int progressPercent,
    int completedPages,
    int totalPages,
    Instant timestamp
) {
    public static JobProgressUpdate of(String jobId, double progress, int completedPages, int totalPages) {
        return new JobProgressUpdate(jobId, (int) Math.floor(progress * 100), completedPages, totalPages, Instant.now());
    }
}
