package com.starscape.offlineocr.features.ocrjob.domain;

import com.starscape.offlineocr.common.exception.ErrorKind;

public record JobError(
    ErrorKind kind,
    String message
) {}
