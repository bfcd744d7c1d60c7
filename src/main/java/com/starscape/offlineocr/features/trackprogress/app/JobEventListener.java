package com.starscape.offlineocr.features.trackprogress.app;

import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;
import com.starscape.offlineocr.features.ocrjob.domain.events.JobProgressed;
import com.starscape.offlineocr.features.ocrjob.domain.events.JobStatusChanged;
import com.starscape.offlineocr.features.trackprogress.api.dto.JobProgressUpdate;
import com.starscape.offlineocr.features.trackprogress.api.dto.JobStatusUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.stereotype.Service;

/**
 * Listens to job domain events and forwards them to WebSocket subscribers.
 * 
 * Events are delivered on the job's worker thread; a broadcast failure is logged and
 * never allowed to fail the job.
 */
@Service
public class JobEventListener {
    
    private static final Logger log = LoggerFactory.getLogger(JobEventListener.class);
    
    private final ProgressBroadcaster progressBroadcaster;
    
    public JobEventListener(ProgressBroadcaster progressBroadcaster) {
        this.progressBroadcaster = progressBroadcaster;
    }
    
    @EventListener
    public void onProgress(JobProgressed event) {
        try {
            progressBroadcaster.broadcastProgress(JobProgressUpdate.of(
                event.jobId(),
                event.progress(),
                event.completedPages(),
                event.totalPages()
            ));
        } catch (MessagingException e) {
            log.warn("Failed to broadcast progress: jobId={}", event.jobId(), e);
        }
    }
    
    @EventListener
    public void onStatusChanged(JobStatusChanged event) {
        JobSnapshot job = event.job();
        try {
            progressBroadcaster.broadcastJobStatus(new JobStatusUpdate(
                job.jobId(),
                job.status().name(),
                (int) Math.floor(job.progress() * 100),
                job.warnings(),
                job.error() == null ? null : job.error().kind().name(),
                job.error() == null ? null : job.error().message(),
                event.occurredOn()
            ));
        } catch (MessagingException e) {
            log.warn("Failed to broadcast job status: jobId={}", job.jobId(), e);
        }
    }
}
