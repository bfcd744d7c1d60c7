package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.common.config.ProcessingProperties;
import com.starscape.offlineocr.common.exception.ArtifactFetchFailedException;
import com.starscape.offlineocr.common.exception.ErrorKind;
import com.starscape.offlineocr.common.exception.InvalidInputException;
import com.starscape.offlineocr.common.exception.JobCancelledException;
import com.starscape.offlineocr.common.exception.JobFailureException;
import com.starscape.offlineocr.common.exception.NotFoundException;
import com.starscape.offlineocr.common.exception.PageRecognitionFailedException;
import com.starscape.offlineocr.features.languages.app.ArtifactCache;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifact;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifactRegistry;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.JobError;
import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;
import com.starscape.offlineocr.features.ocrjob.domain.JobStatus;
import com.starscape.offlineocr.features.ocrjob.domain.OcrJob;
import com.starscape.offlineocr.features.ocrjob.domain.PageSource;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import com.starscape.offlineocr.features.ocrjob.domain.Segment;
import com.starscape.offlineocr.features.ocrjob.domain.events.JobStatusChanged;
import com.starscape.offlineocr.features.ocrjob.infra.format.FormatResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the job table and drives every job from admission to a terminal state.
 * 
 * Each job runs at most once: artifacts are made resident, the document is resolved into
 * pages and/or text, and pages are recognized strictly in index order. Failures to fetch
 * artifacts or to resolve the document end the job; a failing page only adds a warning.
 * Jobs run concurrently on the job executor and never share mutable state except through
 * the artifact cache.
 */
@Service
public class JobOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);
    
    static final String NO_CONTENT_WARNING = "No visual content found for OCR.";
    
    private final ArtifactCache artifactCache;
    private final LanguageArtifactRegistry languageRegistry;
    private final FormatResolver formatResolver;
    private final RecognitionGateway recognitionGateway;
    private final ProgressAggregator progressAggregator;
    private final ProcessingProperties processingProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor jobExecutor;
    private final ConcurrentMap<String, OcrJob> jobs = new ConcurrentHashMap<>();
    
    public JobOrchestrator(
            ArtifactCache artifactCache,
            LanguageArtifactRegistry languageRegistry,
            FormatResolver formatResolver,
            RecognitionGateway recognitionGateway,
            ProgressAggregator progressAggregator,
            ProcessingProperties processingProperties,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("ocrJobExecutor") Executor jobExecutor) {
        this.artifactCache = artifactCache;
        this.languageRegistry = languageRegistry;
        this.formatResolver = formatResolver;
        this.recognitionGateway = recognitionGateway;
        this.progressAggregator = progressAggregator;
        this.processingProperties = processingProperties;
        this.eventPublisher = eventPublisher;
        this.jobExecutor = jobExecutor;
    }
    
    /**
     * Admit a document as a new pending job and schedule it. Returns without waiting for execution.
     * 
     * @throws InvalidInputException if the content class is missing or the language list is
     *         empty or names an unknown language; no job is created in that case
     */
    public String submit(IntakeDocument document, ContentClass contentClass, List<String> languages) {
        if (document == null) {
            throw new InvalidInputException("Document is required");
        }
        if (contentClass == null) {
            throw new InvalidInputException("Unrecognized content class for " + document.name());
        }
        List<String> requested = normalizeLanguages(languages);
        
        String jobId = "job_" + UUID.randomUUID().toString().replace("-", "");
        OcrJob job = new OcrJob(jobId, document, contentClass, requested);
        jobs.put(jobId, job);
        
        log.info("Admitted job: jobId={}, name={}, class={}, bytes={}, languages={}",
            jobId, document.name(), contentClass, document.size(), requested);
        publishStatus(job);
        dispatch(job);
        return jobId;
    }
    
    /**
     * Execute a job. Does nothing unless the job is still pending, so a job dispatched twice
     * runs once.
     */
    public void run(String jobId) {
        OcrJob job = jobs.get(jobId);
        if (job == null) {
            log.warn("Run requested for unknown job: {}", jobId);
            return;
        }
        if (!job.claim()) {
            log.debug("Job not pending, skipping run: jobId={}, status={}", jobId, job.getStatus());
            return;
        }
        execute(job);
    }
    
    public JobSnapshot getSnapshot(String jobId) {
        return requireJob(jobId).snapshot();
    }
    
    /**
     * All known jobs, newest first.
     */
    public List<JobSnapshot> listSnapshots() {
        return jobs.values().stream()
                .map(OcrJob::snapshot)
                .sorted(Comparator.comparing(JobSnapshot::createdAt).reversed())
                .toList();
    }
    
    /**
     * Request cancellation. Terminal jobs are unaffected; artifact fetches shared with other
     * jobs keep running.
     * @return true if the job was still live
     */
    public boolean cancel(String jobId) {
        OcrJob job = requireJob(jobId);
        boolean wasPending = job.getStatus() == JobStatus.PENDING;
        boolean requested = job.requestCancel();
        if (requested) {
            log.info("Cancellation requested: jobId={}", jobId);
            if (wasPending) {
                publishStatus(job);
            }
        }
        return requested;
    }
    
    /**
     * Drop a job from the table, cancelling it first if it is still live.
     */
    public void discard(String jobId) {
        OcrJob job = jobs.remove(jobId);
        if (job == null) {
            throw new NotFoundException("Job not found: " + jobId);
        }
        job.requestCancel();
        log.info("Discarded job: jobId={}", jobId);
    }
    
    /**
     * Hand every pending job that is not queued yet to the executor.
     * @return number of jobs dispatched
     */
    public int dispatchPending() {
        int dispatched = 0;
        for (OcrJob job : jobs.values()) {
            if (job.getStatus() == JobStatus.PENDING && dispatch(job)) {
                dispatched++;
            }
        }
        return dispatched;
    }
    
    private boolean dispatch(OcrJob job) {
        if (!job.markDispatched()) {
            return false;
        }
        try {
            jobExecutor.execute(() -> run(job.getJobId()));
            return true;
        } catch (RejectedExecutionException e) {
            job.clearDispatched();
            log.warn("Job executor rejected job, admission loop will retry: jobId={}", job.getJobId());
            return false;
        }
    }
    
    private void execute(OcrJob job) {
        String jobId = job.getJobId();
        log.info("Processing job: jobId={}, name={}", jobId, job.getName());
        
        try {
            publishStatus(job);
            awaitArtifacts(job);
            
            try (ResolvedDocument resolved = formatResolver.resolve(job.getDocument(), job.getContentClass())) {
                job.resolved(resolved.pageCount(), resolved.text().orElse(null));
                resolved.warnings().forEach(warning -> progressAggregator.warn(job, warning));
                
                if (resolved.isEmpty()) {
                    progressAggregator.warn(job, NO_CONTENT_WARNING);
                } else {
                    recognizePages(job, resolved.pages());
                }
            }
            
            if (progressAggregator.complete(job)) {
                JobSnapshot done = job.snapshot();
                log.info("Job completed: jobId={}, pages={}, segments={}, warnings={}",
                    jobId, done.pageCount(), done.segments().size(), done.warnings().size());
            }
            
        } catch (JobCancelledException e) {
            failJob(job, e);
        } catch (JobFailureException e) {
            log.error("Job failed: jobId={}, kind={}", jobId, e.kind(), e);
            failJob(job, e);
        } catch (Exception e) {
            log.error("Job failed unexpectedly: jobId={}", jobId, e);
            job.fail(new JobError(ErrorKind.INTERNAL, "Unexpected error: " + e.getMessage()));
        } finally {
            progressAggregator.release(job);
            publishStatus(job);
        }
    }
    
    /**
     * Block until every requested language is cached, or until the job is cancelled.
     * Cancelling only stops this job from waiting; the fetch itself carries on for others.
     */
    private void awaitArtifacts(OcrJob job) {
        CompletableFuture<List<LanguageArtifact>> ready = artifactCache.ensureAllCached(job.getLanguages());
        CompletableFuture.anyOf(ready.handle((artifacts, error) -> null), job.cancellationSignal()).join();
        
        if (job.isCancellationRequested()) {
            throw new JobCancelledException(job.getJobId());
        }
        try {
            List<LanguageArtifact> artifacts = ready.join();
            log.debug("Artifacts ready: jobId={}, languages={}", job.getJobId(),
                artifacts.stream().map(LanguageArtifact::code).toList());
        } catch (CompletionException e) {
            if (e.getCause() instanceof JobFailureException failure) {
                throw failure;
            }
            throw new ArtifactFetchFailedException(String.join("+", job.getLanguages()), e.getCause());
        }
    }
    
    private void recognizePages(OcrJob job, PageSource pages) {
        int totalPages = pages.pageCount();
        Duration slowThreshold = processingProperties.getSlowPageThreshold();
        progressAggregator.begin(job, totalPages);
        
        int recognized = 0;
        String lastFailure = null;
        
        for (int index = 0; index < totalPages; index++) {
            if (job.isCancellationRequested()) {
                throw new JobCancelledException(job.getJobId());
            }
            
            int pageIndex = index;
            PageOutcome outcome;
            try {
                BufferedImage image = pages.render(pageIndex);
                outcome = recognitionGateway.recognize(pageIndex, image, job.getLanguages(),
                    fraction -> progressAggregator.reportPageProgress(job, pageIndex, fraction));
            } catch (IOException | RuntimeException e) {
                log.warn("Page could not be rendered: jobId={}, page={}, reason={}",
                    job.getJobId(), pageIndex + 1, e.getMessage());
                outcome = PageOutcome.failure(pageIndex, "page could not be rendered: " + e.getMessage(), Duration.ZERO);
            }
            
            if (outcome.succeeded()) {
                progressAggregator.recordSegment(job, new Segment(
                    pageIndex, outcome.result().text(), outcome.result().confidence()));
                recognized++;
                if (slowThreshold != null && outcome.duration().compareTo(slowThreshold) > 0) {
                    progressAggregator.warn(job, slowPageWarning(pageIndex, outcome.duration()));
                }
            } else {
                lastFailure = outcome.failureReason();
                progressAggregator.warn(job, String.format(Locale.ROOT,
                    "Page %d could not be recognized: %s", pageIndex + 1, outcome.failureReason()));
            }
            progressAggregator.pageFinished(job, pageIndex);
        }
        
        if (recognized == 0 && !job.hasExtractedText()) {
            throw new PageRecognitionFailedException(String.format(Locale.ROOT,
                "Recognition failed for all %d page(s): %s", totalPages, lastFailure));
        }
    }
    
    private void failJob(OcrJob job, JobFailureException failure) {
        if (job.fail(new JobError(failure.kind(), failure.getMessage()))) {
            log.info("Job ended with error: jobId={}, kind={}, message={}",
                job.getJobId(), failure.kind(), failure.getMessage());
        }
    }
    
    private List<String> normalizeLanguages(List<String> languages) {
        if (languages == null || languages.isEmpty()) {
            throw new InvalidInputException("At least one language is required");
        }
        
        Set<String> ordered = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String language : languages) {
            String code = LanguageArtifact.normalizeCode(language);
            if (code == null || code.isEmpty()) {
                continue;
            }
            if (!languageRegistry.contains(code)) {
                unknown.add(code);
            }
            ordered.add(code);
        }
        
        if (ordered.isEmpty()) {
            throw new InvalidInputException("At least one language is required");
        }
        if (!unknown.isEmpty()) {
            throw new InvalidInputException("Unknown language(s): " + String.join(", ", unknown));
        }
        return List.copyOf(ordered);
    }
    
    private OcrJob requireJob(String jobId) {
        OcrJob job = jobs.get(jobId);
        if (job == null) {
            throw new NotFoundException("Job not found: " + jobId);
        }
        return job;
    }
    
    private void publishStatus(OcrJob job) {
        eventPublisher.publishEvent(JobStatusChanged.of(job.snapshot()));
    }
    
    private static String slowPageWarning(int pageIndex, Duration duration) {
        return String.format(Locale.ROOT,
            "Page %d took %.1fs to process. Consider splitting large documents.",
            pageIndex + 1, duration.toMillis() / 1000.0);
    }
}
