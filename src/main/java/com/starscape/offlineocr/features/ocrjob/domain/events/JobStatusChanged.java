package com.starscape.offlineocr.features.ocrjob.domain.events;

import com.starscape.offlineocr.common.domain.DomainEvent;
import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;

import java.time.Instant;

public record JobStatusChanged(
    JobSnapshot job,
    Instant occurredOn
) implements DomainEvent {
    
    public static JobStatusChanged of(JobSnapshot job) {
        return new JobStatusChanged(job, Instant.now());
    }
    
    @Override
    public String getEventType() {
        return "JobStatusChanged";
    }
    
    @Override
    public String getAggregateId() {
        return job.jobId();
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
