package com.starscape.offlineocr.features.ocrjob.api.dto;

public record JobErrorItem(
    String kind,
    String message
) {}
