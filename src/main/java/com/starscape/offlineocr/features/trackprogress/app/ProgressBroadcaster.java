package com.starscape.offlineocr.features.trackprogress.app;

import com.starscape.offlineocr.features.trackprogress.api.dto.JobProgressUpdate;
import com.starscape.offlineocr.features.trackprogress.api.dto.JobStatusUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Service for broadcasting job updates via WebSocket.
 * Sends to /topic/job/{jobId}, which clients subscribe to after submitting.
 */
@Service
public class ProgressBroadcaster {
    
    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public ProgressBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    public void broadcastProgress(JobProgressUpdate update) {
        String destination = destinationFor(update.jobId());
        messagingTemplate.convertAndSend(destination, update);
        log.debug("Broadcasted progress to {}: {}% ({}/{} pages)",
            destination, update.progressPercent(), update.completedPages(), update.totalPages());
    }
    
    public void broadcastJobStatus(JobStatusUpdate update) {
        String destination = destinationFor(update.jobId());
        messagingTemplate.convertAndSend(destination, update);
        log.debug("Broadcasted job status to {}: status={}, warnings={}",
            destination, update.status(), update.warnings().size());
    }
    
    static String destinationFor(String jobId) {
        return "/topic/job/" + jobId;
    }
}
