package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.common.exception.InvalidInputException;
import com.starscape.offlineocr.features.ocrjob.api.dto.RejectedFile;
import com.starscape.offlineocr.features.ocrjob.api.dto.SubmitDocumentsResponse;
import com.starscape.offlineocr.features.ocrjob.api.dto.SubmittedJob;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Handler for document intake.
 * Creates one job per accepted file; files whose type cannot be recognized are rejected
 * individually without failing the rest of the request.
 */
@Service
public class SubmitDocumentsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(SubmitDocumentsHandler.class);
    
    private final JobOrchestrator jobOrchestrator;
    
    public SubmitDocumentsHandler(JobOrchestrator jobOrchestrator) {
        this.jobOrchestrator = jobOrchestrator;
    }
    
    public SubmitDocumentsResponse handle(List<MultipartFile> files, List<String> languages) {
        if (files == null || files.isEmpty()) {
            throw new InvalidInputException("At least one file is required");
        }
        List<String> requested = splitLanguages(languages);
        
        List<SubmittedJob> jobs = new ArrayList<>();
        List<RejectedFile> rejected = new ArrayList<>();
        
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename();
            if (file.isEmpty()) {
                rejected.add(new RejectedFile(name, "File is empty"));
                continue;
            }
            
            Optional<ContentClass> contentClass = ContentClass.detect(file.getContentType(), name);
            if (contentClass.isEmpty()) {
                rejected.add(new RejectedFile(name, "Unsupported file type: " + file.getContentType()));
                continue;
            }
            
            IntakeDocument document;
            try {
                document = new IntakeDocument(name, file.getContentType(), file.getBytes());
            } catch (IOException e) {
                log.warn("Could not read uploaded file: name={}, reason={}", name, e.getMessage());
                rejected.add(new RejectedFile(name, "Could not read file: " + e.getMessage()));
                continue;
            }
            
            String jobId = jobOrchestrator.submit(document, contentClass.get(), requested);
            jobs.add(new SubmittedJob(jobId, document.name(), contentClass.get().getDisplayName()));
        }
        
        if (jobs.isEmpty()) {
            throw new InvalidInputException("No supported files were submitted: "
                + rejected.stream().map(RejectedFile::name).toList());
        }
        log.info("Submitted {} job(s), rejected {} file(s)", jobs.size(), rejected.size());
        return new SubmitDocumentsResponse(jobs, rejected);
    }
    
    /**
     * Accepts both repeated parameters and a single "eng+deu" or "eng,deu" value.
     */
    private static List<String> splitLanguages(List<String> languages) {
        if (languages == null) {
            return List.of();
        }
        return languages.stream()
                .filter(value -> value != null)
                .flatMap(value -> Arrays.stream(value.split("[+,\\s]+")))
                .filter(code -> !code.isBlank())
                .toList();
    }
}
