package com.starscape.offlineocr.features.ocrjob.api.dto;

public record SegmentItem(
    int pageIndex,
    String text,
    double confidence
) {}
