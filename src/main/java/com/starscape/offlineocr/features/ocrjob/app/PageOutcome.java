package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.domain.RecognitionResult;

import java.time.Duration;

/**
 * Result of recognizing one page: either a result or the reason it failed, plus how long it took.
 */
public record PageOutcome(
    int pageIndex,
    RecognitionResult result,
    String failureReason,
    Duration duration
) {
    
    public static PageOutcome success(int pageIndex, RecognitionResult result, Duration duration) {
        return new PageOutcome(pageIndex, result, null, duration);
    }
    
    public static PageOutcome failure(int pageIndex, String reason, Duration duration) {
        return new PageOutcome(pageIndex, null, reason, duration);
    }
    
    public boolean succeeded() {
        return result != null;
    }
}
