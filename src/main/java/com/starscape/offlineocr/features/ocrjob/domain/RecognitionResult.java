package com.starscape.offlineocr.features.ocrjob.domain;

/**
 * Text recognized on one page with the engine's confidence (0-100).
 */
public record RecognitionResult(
    String text,
    double confidence
) {}
