package com.starscape.offlineocr.features.languages.app;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import com.starscape.offlineocr.features.languages.domain.ArtifactOrigin;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifact;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifactRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Prepares the artifact cache once the application is up: restores what is already on
 * disk and, when enabled, starts fetching every builtin language so later jobs can run offline.
 */
@Component
public class ArtifactCacheInitializer {
    
    private static final Logger log = LoggerFactory.getLogger(ArtifactCacheInitializer.class);
    
    private final ArtifactCache artifactCache;
    private final LanguageArtifactRegistry registry;
    private final ArtifactProperties artifactProperties;
    
    public ArtifactCacheInitializer(
            ArtifactCache artifactCache,
            LanguageArtifactRegistry registry,
            ArtifactProperties artifactProperties) {
        this.artifactCache = artifactCache;
        this.registry = registry;
        this.artifactProperties = artifactProperties;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        artifactCache.restoreFromStore();
        
        if (!artifactProperties.isWarmUpBuiltins()) {
            log.info("Builtin language warm-up disabled");
            return;
        }
        
        for (LanguageArtifact artifact : registry.list()) {
            if (artifact.origin() != ArtifactOrigin.BUILTIN || artifact.cached()) {
                continue;
            }
            artifactCache.ensureCached(artifact).whenComplete((cached, error) -> {
                if (error != null) {
                    // Not fatal: the artifact is fetched again when a job needs it
                    log.warn("Builtin language warm-up failed: code={}, reason={}",
                        artifact.code(), error.getMessage());
                } else {
                    log.debug("Builtin language ready: code={}", cached.code());
                }
            });
        }
    }
}
