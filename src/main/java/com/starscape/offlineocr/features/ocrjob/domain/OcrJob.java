package com.starscape.offlineocr.features.ocrjob.domain;

import com.starscape.offlineocr.common.exception.ErrorKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * One submitted document's end-to-end processing unit.
 * 
 * Status only moves forward: PENDING -> PROCESSING -> COMPLETED | ERROR, or PENDING -> ERROR
 * when cancelled before it started. Once terminal nothing changes any more. Every mutation
 * and {@link #snapshot()} synchronize on the job, so observers never see a torn state.
 */
public class OcrJob {
    
    private final String jobId;
    private final String name;
    private final ContentClass contentClass;
    private final long size;
    private final List<String> languages;
    private final Instant createdAt;
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    
    private IntakeDocument document;
    private JobStatus status = JobStatus.PENDING;
    private boolean dispatched;
    private double progress;
    private Instant completedAt;
    private JobError error;
    private Integer pageCount;
    private String extractedText;
    private final List<String> warnings = new ArrayList<>();
    private final SortedMap<Integer, Segment> segments = new TreeMap<>();
    
    public OcrJob(String jobId, IntakeDocument document, ContentClass contentClass, List<String> languages) {
        if (languages == null || languages.isEmpty()) {
            throw new IllegalArgumentException("At least one language is required");
        }
        this.jobId = jobId;
        this.document = document;
        this.name = document.name();
        this.size = document.size();
        this.contentClass = contentClass;
        this.languages = List.copyOf(languages);
        this.createdAt = Instant.now();
    }
    
    public String getJobId() {
        return jobId;
    }
    
    public String getName() {
        return name;
    }
    
    public ContentClass getContentClass() {
        return contentClass;
    }
    
    public List<String> getLanguages() {
        return languages;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public synchronized JobStatus getStatus() {
        return status;
    }
    
    /**
     * The submitted bytes; released once the job is terminal.
     */
    public synchronized IntakeDocument getDocument() {
        if (document == null) {
            throw new IllegalStateException("Document of job " + jobId + " has been released");
        }
        return document;
    }
    
    /**
     * Mark the job as handed to the executor. Fails if it is no longer pending or already queued.
     */
    public synchronized boolean markDispatched() {
        if (status != JobStatus.PENDING || dispatched) {
            return false;
        }
        dispatched = true;
        return true;
    }
    
    public synchronized void clearDispatched() {
        dispatched = false;
    }
    
    /**
     * Claim the job for execution. Only one caller ever wins.
     */
    public synchronized boolean claim() {
        if (status != JobStatus.PENDING) {
            return false;
        }
        status = JobStatus.PROCESSING;
        return true;
    }
    
    public synchronized void resolved(int pageCount, String extractedText) {
        if (status != JobStatus.PROCESSING) {
            return;
        }
        this.pageCount = pageCount;
        this.extractedText = extractedText;
    }
    
    public synchronized boolean hasExtractedText() {
        return extractedText != null && !extractedText.isBlank();
    }
    
    /**
     * Raise progress to the given value. Lower values are ignored.
     * @return true if progress changed
     */
    public synchronized boolean advanceProgress(double value) {
        if (status != JobStatus.PROCESSING) {
            return false;
        }
        double clamped = Math.min(1.0, Math.max(0.0, value));
        if (clamped <= progress) {
            return false;
        }
        progress = clamped;
        return true;
    }
    
    public synchronized double getProgress() {
        return progress;
    }
    
    public synchronized void putSegment(Segment segment) {
        if (status != JobStatus.PROCESSING) {
            return;
        }
        segments.put(segment.pageIndex(), segment);
    }
    
    public synchronized void addWarning(String warning) {
        if (status.isTerminal()) {
            return;
        }
        warnings.add(warning);
    }
    
    public synchronized boolean complete() {
        if (status != JobStatus.PROCESSING) {
            return false;
        }
        status = JobStatus.COMPLETED;
        progress = 1.0;
        completedAt = Instant.now();
        document = null;
        return true;
    }
    
    public synchronized boolean fail(JobError jobError) {
        if (status.isTerminal()) {
            return false;
        }
        status = JobStatus.ERROR;
        error = jobError;
        completedAt = Instant.now();
        document = null;
        return true;
    }
    
    /**
     * Ask the job to stop. A pending job fails right away; a running job stops before its
     * next page. Terminal jobs are left alone.
     * @return true if the request changed anything
     */
    public synchronized boolean requestCancel() {
        if (status.isTerminal()) {
            return false;
        }
        if (status == JobStatus.PENDING) {
            fail(new JobError(ErrorKind.CANCELLED, "Job " + jobId + " was cancelled before it started"));
        }
        cancellation.complete(null);
        return true;
    }
    
    public boolean isCancellationRequested() {
        return cancellation.isDone();
    }
    
    /**
     * Completes when cancellation is requested.
     */
    public CompletableFuture<Void> cancellationSignal() {
        return cancellation;
    }
    
    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(
            jobId,
            name,
            contentClass,
            size,
            languages,
            status,
            progress,
            createdAt,
            completedAt,
            List.copyOf(warnings),
            error,
            List.copyOf(segments.values()),
            extractedText,
            pageCount
        );
    }
}
