package com.starscape.offlineocr.features.trackprogress.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Job status update DTO for WebSocket broadcasts.
 * Sent when a job changes status; carries the warnings collected so far and the error of a
 * failed job.
 */
public record JobStatusUpdate(
    String jobId,
    String status,
    int progressPercent,
    List<String> warnings,
    String errorKind,
    String errorMessage,
    Instant timestamp
) {}
