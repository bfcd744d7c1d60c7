package com.starscape.offlineocr.features.ocrjob.api.dto;

import java.util.List;

/**
 * Result of a multi-file submission: one job per accepted file, plus the files that were
 * turned away at intake.
 */
public record SubmitDocumentsResponse(
    List<SubmittedJob> jobs,
    List<RejectedFile> rejected
) {}
