package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.domain.OcrJob;
import com.starscape.offlineocr.features.ocrjob.domain.Segment;
import com.starscape.offlineocr.features.ocrjob.domain.events.JobProgressed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Folds per-page events into a job: segments, warnings and progress.
 * 
 * Progress is (completedPages + intraPageFraction) / totalPages. Completion is tracked per
 * page index rather than counted, so a late or repeated callback can never move progress
 * backwards. This is the only writer of a job's progress.
 */
@Component
public class ProgressAggregator {
    
    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);
    
    private final ApplicationEventPublisher eventPublisher;
    private final ConcurrentMap<String, PageLedger> ledgers = new ConcurrentHashMap<>();
    
    public ProgressAggregator(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }
    
    public void begin(OcrJob job, int totalPages) {
        ledgers.put(job.getJobId(), new PageLedger(totalPages));
        log.debug("Tracking progress: jobId={}, pages={}", job.getJobId(), totalPages);
    }
    
    /**
     * Intra-page progress for the page currently being recognized.
     */
    public void reportPageProgress(OcrJob job, int pageIndex, double fraction) {
        PageLedger ledger = ledgers.get(job.getJobId());
        if (ledger == null) {
            return;
        }
        advance(job, ledger, ledger.progressWithin(pageIndex, fraction));
    }
    
    public void pageFinished(OcrJob job, int pageIndex) {
        PageLedger ledger = ledgers.get(job.getJobId());
        if (ledger == null) {
            return;
        }
        advance(job, ledger, ledger.finish(pageIndex));
    }
    
    public void recordSegment(OcrJob job, Segment segment) {
        job.putSegment(segment);
    }
    
    public void warn(OcrJob job, String warning) {
        log.debug("Job warning: jobId={}, warning={}", job.getJobId(), warning);
        job.addWarning(warning);
    }
    
    /**
     * Mark the job completed with progress 1.0.
     * @return false if the job had already reached a terminal state
     */
    public boolean complete(OcrJob job) {
        return job.complete();
    }
    
    public void release(OcrJob job) {
        ledgers.remove(job.getJobId());
    }
    
    private void advance(OcrJob job, PageLedger ledger, double value) {
        if (job.advanceProgress(value)) {
            eventPublisher.publishEvent(new JobProgressed(
                job.getJobId(),
                job.getProgress(),
                ledger.completedPages(),
                ledger.totalPages(),
                Instant.now()
            ));
        }
    }
    
    /**
     * Per-page completion flags of one job.
     */
    static final class PageLedger {
        
        private final boolean[] finished;
        private int completed;
        
        PageLedger(int totalPages) {
            this.finished = new boolean[Math.max(0, totalPages)];
        }
        
        synchronized double progressWithin(int pageIndex, double fraction) {
            if (!inRange(pageIndex) || finished[pageIndex]) {
                return ratio(completed);
            }
            double clamped = Double.isNaN(fraction) ? 0.0 : Math.min(1.0, Math.max(0.0, fraction));
            return ratio(completed + clamped);
        }
        
        synchronized double finish(int pageIndex) {
            if (inRange(pageIndex) && !finished[pageIndex]) {
                finished[pageIndex] = true;
                completed++;
            }
            return ratio(completed);
        }
        
        synchronized int completedPages() {
            return completed;
        }
        
        int totalPages() {
            return finished.length;
        }
        
        private boolean inRange(int pageIndex) {
            return pageIndex >= 0 && pageIndex < finished.length;
        }
        
        private double ratio(double done) {
            if (finished.length == 0) {
                return 0.0;
            }
            return Math.min(1.0, Math.max(0.0, done / finished.length));
        }
    }
}
