package com.starscape.offlineocr.features.languages.app;

import com.starscape.offlineocr.common.exception.ArtifactFetchFailedException;
import com.starscape.offlineocr.common.exception.InvalidArtifactException;
import com.starscape.offlineocr.features.languages.domain.ArtifactOrigin;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifact;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifactRegistry;
import com.starscape.offlineocr.features.languages.infra.ArtifactArchives;
import com.starscape.offlineocr.features.languages.infra.ArtifactFetcher;
import com.starscape.offlineocr.features.languages.infra.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps recognition-model artifacts resident in the local store.
 * 
 * A miss starts a fetch; concurrent requests for the same code share that fetch through
 * one in-flight handle instead of starting their own (single-flight). The handle is removed
 * before it completes, on success and on failure, so a request after a failed fetch
 * starts a new one. Different codes fetch independently.
 * 
 * Writes to the store and the registry entry that describes them happen under a per-code
 * lock, so an import and a fetch finishing for the same code cannot interleave.
 */
@Service
public class ArtifactCache {
    
    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);
    
    private final LanguageArtifactRegistry registry;
    private final ArtifactStore store;
    private final ArtifactFetcher fetcher;
    private final Executor fetchExecutor;
    private final ConcurrentMap<String, CompletableFuture<LanguageArtifact>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> codeLocks = new ConcurrentHashMap<>();
    
    public ArtifactCache(
            LanguageArtifactRegistry registry,
            ArtifactStore store,
            ArtifactFetcher fetcher,
            @Qualifier("artifactFetchExecutor") Executor fetchExecutor) {
        this.registry = registry;
        this.store = store;
        this.fetcher = fetcher;
        this.fetchExecutor = fetchExecutor;
    }
    
    /**
     * Make sure the artifact's bytes are in the local store.
     * 
     * @return a future completed with the cached artifact, or failed with
     *         {@link ArtifactFetchFailedException}; every caller waiting on the same fetch
     *         observes the same outcome
     */
    public CompletableFuture<LanguageArtifact> ensureCached(LanguageArtifact artifact) {
        String code = artifact.code();
        LanguageArtifact current = registry.find(code).orElse(artifact);
        
        Optional<LanguageArtifact> resident = residentCopy(current);
        if (resident.isPresent()) {
            return CompletableFuture.completedFuture(resident.get());
        }
        
        CompletableFuture<LanguageArtifact> handle = new CompletableFuture<>();
        CompletableFuture<LanguageArtifact> existing = inFlight.putIfAbsent(code, handle);
        if (existing != null) {
            log.debug("Joining in-flight fetch: code={}", code);
            return existing;
        }
        
        // A fetch may have finished between the residency check and claiming the key
        LanguageArtifact latest = registry.find(code).orElse(current);
        resident = residentCopy(latest);
        if (resident.isPresent()) {
            inFlight.remove(code, handle);
            handle.complete(resident.get());
            return handle;
        }
        
        try {
            fetchExecutor.execute(() -> fetchInto(latest, handle));
        } catch (RejectedExecutionException e) {
            inFlight.remove(code, handle);
            handle.completeExceptionally(new ArtifactFetchFailedException(code, e));
        }
        return handle;
    }
    
    /**
     * Ensure every listed language is cached. Fails with the first fetch failure
     * once all fetches have settled.
     */
    public CompletableFuture<List<LanguageArtifact>> ensureAllCached(List<String> codes) {
        List<CompletableFuture<LanguageArtifact>> futures = new ArrayList<>();
        for (String code : codes) {
            Optional<LanguageArtifact> artifact = registry.find(code);
            if (artifact.isEmpty()) {
                futures.add(CompletableFuture.failedFuture(new ArtifactFetchFailedException(
                    code, new IllegalArgumentException("language is not registered"))));
            } else {
                futures.add(ensureCached(artifact.get()));
            }
        }
        
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }
    
    /**
     * Register an artifact from uploaded bytes and store it as already cached, replacing any
     * artifact with the same code. Gzip-compressed uploads are decompressed first.
     * 
     * @throws InvalidArtifactException if the code is malformed or the bytes are unreadable;
     *         the registry is left unchanged
     */
    public LanguageArtifact importFromBytes(String code, byte[] rawBytes) {
        String normalized = LanguageArtifact.normalizeCode(code);
        if (normalized == null || normalized.isEmpty()) {
            throw new InvalidArtifactException("Language code is required");
        }
        if (!LanguageArtifact.isValidCode(normalized)) {
            throw new InvalidArtifactException(
                "Language code may only contain lower-case letters, digits and underscores: " + code);
        }
        
        byte[] payload = ArtifactArchives.decode(rawBytes);
        String checksum = ArtifactArchives.checksum(payload);
        
        LanguageArtifact artifact;
        Optional<LanguageArtifact> replaced;
        synchronized (lockFor(normalized)) {
            String label = registry.find(normalized).map(LanguageArtifact::label).orElse(null);
            artifact = LanguageArtifact.imported(normalized, label, checksum);
            try {
                store.write(artifact.storageKey(), payload);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to store imported artifact: " + normalized, e);
            }
            replaced = registry.register(artifact);
        }
        log.info("Imported language artifact: code={}, bytes={}, sha256={}, replaced={}",
            normalized, payload.length, checksum, replaced.map(a -> a.origin().name()).orElse("none"));
        return artifact;
    }
    
    /**
     * Re-register artifacts found in the store: builtins are marked cached, unknown codes
     * become imported artifacts so imports survive a restart.
     */
    public int restoreFromStore() {
        int restored = 0;
        for (String key : store.keys()) {
            String code = key.substring(0, key.length() - LanguageArtifact.STORAGE_SUFFIX.length());
            if (!LanguageArtifact.isValidCode(code)) {
                log.warn("Ignoring cached file with an invalid language code: {}", key);
                continue;
            }
            Optional<LanguageArtifact> known = registry.find(code);
            if (known.isPresent()) {
                registry.markCached(known.get(), null);
            } else {
                registry.register(LanguageArtifact.imported(code, null, null));
            }
            restored++;
        }
        log.info("Restored {} cached language artifacts from {}", restored, store.root());
        return restored;
    }
    
    public boolean isFetching(String code) {
        return inFlight.containsKey(LanguageArtifact.normalizeCode(code));
    }
    
    private void fetchInto(LanguageArtifact artifact, CompletableFuture<LanguageArtifact> handle) {
        String code = artifact.code();
        try {
            log.info("Fetching language artifact: code={}", code);
            byte[] payload = ArtifactArchives.decode(fetcher.fetch(code));
            
            LanguageArtifact cached;
            synchronized (lockFor(code)) {
                LanguageArtifact now = registry.find(code).orElse(artifact);
                if (now.origin() == ArtifactOrigin.IMPORTED && now.cached() && store.contains(now.storageKey())) {
                    // Imported while this fetch was running; the import wins
                    log.info("Discarding fetched artifact superseded by an import: code={}", code);
                    cached = now;
                } else {
                    store.write(artifact.storageKey(), payload);
                    cached = registry.markCached(now, ArtifactArchives.checksum(payload));
                    log.info("Cached language artifact: code={}, bytes={}", code, payload.length);
                }
            }
            
            inFlight.remove(code, handle);
            handle.complete(cached);
        } catch (Exception e) {
            log.warn("Failed to fetch language artifact: code={}, reason={}", code, e.getMessage());
            inFlight.remove(code, handle);
            handle.completeExceptionally(e instanceof ArtifactFetchFailedException
                ? e
                : new ArtifactFetchFailedException(code, e));
        }
    }
    
    private Object lockFor(String code) {
        return codeLocks.computeIfAbsent(code, key -> new Object());
    }
    
    private Optional<LanguageArtifact> residentCopy(LanguageArtifact artifact) {
        if (!store.contains(artifact.storageKey())) {
            if (artifact.cached()) {
                // Bytes were removed from disk behind our back
                registry.markEvicted(artifact);
            }
            return Optional.empty();
        }
        return Optional.of(artifact.cached() ? artifact : registry.markCached(artifact, null));
    }
}
