package com.starscape.offlineocr.features.ocrjob.api;

import com.starscape.offlineocr.features.ocrjob.api.dto.JobStatusResponse;
import com.starscape.offlineocr.features.ocrjob.api.dto.JobSummaryItem;
import com.starscape.offlineocr.features.ocrjob.api.dto.SubmitDocumentsRequest;
import com.starscape.offlineocr.features.ocrjob.api.dto.SubmitDocumentsResponse;
import com.starscape.offlineocr.features.ocrjob.app.ExportJobTextHandler;
import com.starscape.offlineocr.features.ocrjob.app.ExportJobTextHandler.ExportedText;
import com.starscape.offlineocr.features.ocrjob.app.GetJobStatusHandler;
import com.starscape.offlineocr.features.ocrjob.app.ListJobsHandler;
import com.starscape.offlineocr.features.ocrjob.app.ManageJobHandler;
import com.starscape.offlineocr.features.ocrjob.app.SubmitDocumentsHandler;
import com.starscape.offlineocr.features.ocrjob.domain.JobStatus;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Controller for OCR job intake, status queries, export and cancellation.
 */
@RestController
public class OcrJobController {
    
    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);
    
    private final SubmitDocumentsHandler submitDocumentsHandler;
    private final GetJobStatusHandler getJobStatusHandler;
    private final ListJobsHandler listJobsHandler;
    private final ExportJobTextHandler exportJobTextHandler;
    private final ManageJobHandler manageJobHandler;
    
    public OcrJobController(
            SubmitDocumentsHandler submitDocumentsHandler,
            GetJobStatusHandler getJobStatusHandler,
            ListJobsHandler listJobsHandler,
            ExportJobTextHandler exportJobTextHandler,
            ManageJobHandler manageJobHandler) {
        this.submitDocumentsHandler = submitDocumentsHandler;
        this.getJobStatusHandler = getJobStatusHandler;
        this.listJobsHandler = listJobsHandler;
        this.exportJobTextHandler = exportJobTextHandler;
        this.manageJobHandler = manageJobHandler;
    }
    
    @PostMapping(value = "/commands/ocr-jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmitDocumentsResponse> submit(@Valid @ModelAttribute SubmitDocumentsRequest request) {
        SubmitDocumentsResponse response = submitDocumentsHandler.handle(request.files(), request.languages());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
    
    @GetMapping("/queries/ocr-jobs")
    public ResponseEntity<List<JobSummaryItem>> listJobs(
            @RequestParam(value = "status", required = false) JobStatus status) {
        return ResponseEntity.ok(listJobsHandler.handle(status));
    }
    
    @GetMapping("/queries/ocr-jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(getJobStatusHandler.handle(jobId));
    }
    
    @GetMapping("/queries/ocr-jobs/{jobId}/text")
    public ResponseEntity<String> exportText(@PathVariable String jobId) {
        ExportedText export = exportJobTextHandler.handle(jobId);
        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                    ContentDisposition.attachment().filename(export.filename()).build().toString())
                .body(export.text());
    }
    
    @PostMapping("/commands/ocr-jobs/{jobId}/cancel")
    public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
        return ResponseEntity.ok(manageJobHandler.cancel(jobId));
    }
    
    @DeleteMapping("/commands/ocr-jobs/{jobId}")
    public ResponseEntity<Void> discard(@PathVariable String jobId) {
        manageJobHandler.discard(jobId);
        return ResponseEntity.noContent().build();
    }
}
