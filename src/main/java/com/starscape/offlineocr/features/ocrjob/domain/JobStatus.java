package com.starscape.offlineocr.features.ocrjob.domain;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    ERROR;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
