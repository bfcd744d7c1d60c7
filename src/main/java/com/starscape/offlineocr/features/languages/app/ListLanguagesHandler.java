package com.starscape.offlineocr.features.languages.app;

import com.starscape.offlineocr.features.languages.api.dto.LanguageResponse;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifactRegistry;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ListLanguagesHandler {
    
    private final LanguageArtifactRegistry registry;
    
    public ListLanguagesHandler(LanguageArtifactRegistry registry) {
        this.registry = registry;
    }
    
    public List<LanguageResponse> handle() {
        return registry.list().stream()
                .map(LanguageResponse::from)
                .toList();
    }
}
