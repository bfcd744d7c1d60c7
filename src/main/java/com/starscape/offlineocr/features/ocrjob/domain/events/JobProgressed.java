package com.starscape.offlineocr.features.ocrjob.domain.events;

import com.starscape.offlineocr.common.domain.DomainEvent;

import java.time.Instant;

public record JobProgressed(
    String jobId,
    double progress,
    int completedPages,
    int totalPages,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "JobProgressed";
    }
    
    @Override
    public String getAggregateId() {
        return jobId;
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
