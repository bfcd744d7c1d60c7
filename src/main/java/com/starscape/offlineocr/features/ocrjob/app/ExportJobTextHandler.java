package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;
import com.starscape.offlineocr.features.ocrjob.domain.JobStatus;
import org.springframework.stereotype.Service;

/**
 * Handler for the plain-text export of a finished job.
 */
@Service
public class ExportJobTextHandler {
    
    private final JobOrchestrator jobOrchestrator;
    private final AggregatedTextComposer textComposer;
    
    public ExportJobTextHandler(JobOrchestrator jobOrchestrator, AggregatedTextComposer textComposer) {
        this.jobOrchestrator = jobOrchestrator;
        this.textComposer = textComposer;
    }
    
    public ExportedText handle(String jobId) {
        JobSnapshot job = jobOrchestrator.getSnapshot(jobId);
        if (job.status() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Job is not completed: " + jobId + " is " + job.status());
        }
        return new ExportedText(exportFilename(job.name()), textComposer.compose(job));
    }
    
    static String exportFilename(String documentName) {
        String base = documentName;
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        base = base.replaceAll("[^A-Za-z0-9._-]", "_");
        return (base.isEmpty() ? "document" : base) + ".txt";
    }
    
    public record ExportedText(String filename, String text) {}
}
