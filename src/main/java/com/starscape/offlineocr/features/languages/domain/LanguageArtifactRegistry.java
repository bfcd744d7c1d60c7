package com.starscape.offlineocr.features.languages.domain;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of known language artifacts, one entry per code.
 * Builtins are registered from configuration when the registry is created; imports replace
 * whatever entry has the same code.
 */
@Component
public class LanguageArtifactRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(LanguageArtifactRegistry.class);
    
    private final Map<String, LanguageArtifact> artifacts = new LinkedHashMap<>();
    
    public LanguageArtifactRegistry(ArtifactProperties artifactProperties) {
        for (ArtifactProperties.Builtin builtin : artifactProperties.getBuiltins()) {
            register(LanguageArtifact.builtin(builtin.getCode(), builtin.getLabel()));
        }
        log.info("Registered {} builtin language artifacts", artifacts.size());
    }
    
    /**
     * Register an artifact, replacing any entry with the same code.
     * @return the replaced entry, if there was one
     */
    public synchronized Optional<LanguageArtifact> register(LanguageArtifact artifact) {
        return Optional.ofNullable(artifacts.put(artifact.code(), artifact));
    }
    
    public synchronized Optional<LanguageArtifact> find(String code) {
        return Optional.ofNullable(artifacts.get(LanguageArtifact.normalizeCode(code)));
    }
    
    public synchronized boolean contains(String code) {
        return artifacts.containsKey(LanguageArtifact.normalizeCode(code));
    }
    
    /**
     * Record that the bytes for this artifact are in the store.
     * Registers the artifact if it was not known yet.
     */
    public synchronized LanguageArtifact markCached(LanguageArtifact artifact, String checksum) {
        LanguageArtifact current = artifacts.getOrDefault(artifact.code(), artifact);
        LanguageArtifact cached = current.asCached(checksum);
        artifacts.put(cached.code(), cached);
        return cached;
    }
    
    public synchronized LanguageArtifact markEvicted(LanguageArtifact artifact) {
        LanguageArtifact current = artifacts.getOrDefault(artifact.code(), artifact);
        LanguageArtifact evicted = current.asEvicted();
        artifacts.put(evicted.code(), evicted);
        return evicted;
    }
    
    public synchronized List<LanguageArtifact> list() {
        return new ArrayList<>(artifacts.values());
    }
}
