package com.starscape.offlineocr.features.languages.infra;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Local key-value blob store holding artifact bytes. A key is either fully written or absent;
 * readers never observe a partial write.
 */
public interface ArtifactStore {
    
    boolean contains(String key);
    
    void write(String key, byte[] data) throws IOException;
    
    byte[] read(String key) throws IOException;
    
    List<String> keys();
    
    /**
     * Directory the recognition engine loads its model files from.
     */
    Path root();
}
