package com.starscape.offlineocr.features.languages.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.web.multipart.MultipartFile;

public record ImportLanguageRequest(
    @NotBlank(message = "Language code is required")
    @Pattern(regexp = "\\s*[A-Za-z0-9_]+\\s*",
        message = "Language code may only contain letters, digits and underscores")
    String code,
    
    @NotNull(message = "Language data file is required")
    MultipartFile file
) {}
