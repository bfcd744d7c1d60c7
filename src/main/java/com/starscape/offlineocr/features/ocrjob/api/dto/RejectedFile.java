package com.starscape.offlineocr.features.ocrjob.api.dto;

public record RejectedFile(
    String name,
    String reason
) {}
