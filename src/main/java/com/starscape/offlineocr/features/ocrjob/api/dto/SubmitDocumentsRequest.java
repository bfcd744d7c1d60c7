package com.starscape.offlineocr.features.ocrjob.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

public record SubmitDocumentsRequest(
    @NotEmpty(message = "At least one file is required")
    @Size(max = 100, message = "Maximum 100 files per submission")
    List<MultipartFile> files,
    
    @NotEmpty(message = "At least one language is required")
    List<String> languages
) {}
