package com.starscape.offlineocr.features.ocrjob.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-dispatches pending jobs that the job executor could not accept at submit time.
 */
@Component
public class JobAdmissionLoop {
    
    private static final Logger log = LoggerFactory.getLogger(JobAdmissionLoop.class);
    
    private final JobOrchestrator jobOrchestrator;
    
    public JobAdmissionLoop(JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }
    
    @Scheduled(fixedDelayString = "${app.processing.admission-interval:PT2S}")
    public void admitPending() {
        int dispatched = jobOrchestrator.dispatchPending();
        if (dispatched > 0) {
            log.info("Dispatched {} pending job(s)", dispatched);
        }
    }
}
