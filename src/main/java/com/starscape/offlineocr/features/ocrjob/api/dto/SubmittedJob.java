package com.starscape.offlineocr.features.ocrjob.api.dto;

public record SubmittedJob(
    String jobId,
    String name,
    String contentClass
) {}
