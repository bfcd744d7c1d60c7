package com.starscape.offlineocr.features.languages.app;

import com.starscape.offlineocr.common.exception.InvalidArtifactException;
import com.starscape.offlineocr.features.languages.api.dto.LanguageResponse;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Handler for importing a language artifact uploaded by the user,
 * e.g. a custom-trained eng.traineddata or a gzip-compressed one.
 */
@Service
public class ImportLanguageHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ImportLanguageHandler.class);
    
    private final ArtifactCache artifactCache;
    
    public ImportLanguageHandler(ArtifactCache artifactCache) {
        this.artifactCache = artifactCache;
    }
    
    public LanguageResponse handle(String code, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidArtifactException("Artifact file is required");
        }
        
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new InvalidArtifactException("Could not read uploaded artifact: " + e.getMessage(), e);
        }
        
        log.debug("Importing language artifact: code={}, filename={}, bytes={}",
            code, file.getOriginalFilename(), bytes.length);
        LanguageArtifact artifact = artifactCache.importFromBytes(code, bytes);
        return LanguageResponse.from(artifact);
    }
}
