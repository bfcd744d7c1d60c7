package com.starscape.offlineocr.features.languages.api;

import com.starscape.offlineocr.features.languages.api.dto.ImportLanguageRequest;
import com.starscape.offlineocr.features.languages.api.dto.LanguageResponse;
import com.starscape.offlineocr.features.languages.app.ImportLanguageHandler;
import com.starscape.offlineocr.features.languages.app.ListLanguagesHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for the language artifact registry.
 */
@RestController
public class LanguageController {
    
    private final ListLanguagesHandler listLanguagesHandler;
    private final ImportLanguageHandler importLanguageHandler;
    
    public LanguageController(
            ListLanguagesHandler listLanguagesHandler,
            ImportLanguageHandler importLanguageHandler) {
        this.listLanguagesHandler = listLanguagesHandler;
        this.importLanguageHandler = importLanguageHandler;
    }
    
    @GetMapping("/queries/languages")
    public ResponseEntity<List<LanguageResponse>> listLanguages() {
        return ResponseEntity.ok(listLanguagesHandler.handle());
    }
    
    @PostMapping(value = "/commands/languages", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<LanguageResponse> importLanguage(@Valid @ModelAttribute ImportLanguageRequest request) {
        LanguageResponse response = importLanguageHandler.handle(request.code(), request.file());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
