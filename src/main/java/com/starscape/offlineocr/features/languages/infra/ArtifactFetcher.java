package com.starscape.offlineocr.features.languages.infra;

import java.io.IOException;

/**
 * Retrieves artifact bytes from the remote origin. Called only on a cache miss.
 */
public interface ArtifactFetcher {
    
    byte[] fetch(String code) throws IOException;
}
