package com.starscape.offlineocr.features.ocrjob.domain;

/**
 * Recognition result for one page of a job.
 */
public record Segment(
    int pageIndex,
    String text,
    double confidence
) {
    
    public Segment {
        if (pageIndex < 0) {
            throw new IllegalArgumentException("Page index cannot be negative");
        }
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be between 0 and 100");
        }
        text = text == null ? "" : text;
    }
}
