package com.starscape.offlineocr.features.ocrjob.domain;

/**
 * Receives progress within a single page, as a fraction in [0, 1].
 */
@FunctionalInterface
public interface ProgressSink {
    
    ProgressSink NONE = fraction -> { };
    
    void report(double fraction);
}
