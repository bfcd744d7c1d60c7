package com.starscape.offlineocr.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for recognition-model artifacts.
 * Binds to app.artifacts.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.artifacts")
public class ArtifactProperties {
    
    private Path cacheDir = Path.of(System.getProperty("user.home"), ".offline-ocr", "tessdata");
    private Source source = Source.HTTP;
    private String baseUrl = "http://localhost:8090";
    private String remotePrefix = "tesseract/";
    private String remoteSuffix = ".traineddata.gz";
    private boolean warmUpBuiltins = true;
    private int fetchPoolSize = 4;
    private List<Builtin> builtins = new ArrayList<>();
    
    public enum Source {
        HTTP,
        S3
    }
    
    /**
     * A language shipped with the service; fetched on first use and cached from then on.
     */
    public static class Builtin {
        private String code;
        private String label;
        
        public Builtin() {
        }
        
        public Builtin(String code, String label) {
            this.code = code;
            this.label = label;
        }
        
        public String getCode() {
            return code;
        }
        
        public void setCode(String code) {
            this.code = code;
        }
        
        public String getLabel() {
            return label;
        }
        
        public void setLabel(String label) {
            this.label = label;
        }
    }
    
    public Path getCacheDir() {
        return cacheDir;
    }
    
    public void setCacheDir(Path cacheDir) {
        this.cacheDir = cacheDir;
    }
    
    public Source getSource() {
        return source;
    }
    
    public void setSource(Source source) {
        this.source = source;
    }
    
    public String getBaseUrl() {
        return baseUrl;
    }
    
    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
    
    public String getRemotePrefix() {
        return remotePrefix;
    }
    
    public void setRemotePrefix(String remotePrefix) {
        this.remotePrefix = remotePrefix;
    }
    
    public String getRemoteSuffix() {
        return remoteSuffix;
    }
    
    public void setRemoteSuffix(String remoteSuffix) {
        this.remoteSuffix = remoteSuffix;
    }
    
    public boolean isWarmUpBuiltins() {
        return warmUpBuiltins;
    }
    
    public void setWarmUpBuiltins(boolean warmUpBuiltins) {
        this.warmUpBuiltins = warmUpBuiltins;
    }
    
    public int getFetchPoolSize() {
        return fetchPoolSize;
    }
    
    public void setFetchPoolSize(int fetchPoolSize) {
        this.fetchPoolSize = fetchPoolSize;
    }
    
    public List<Builtin> getBuiltins() {
        return builtins;
    }
    
    public void setBuiltins(List<Builtin> builtins) {
        this.builtins = builtins;
    }
    
    /**
     * Remote object name for a language, e.g. tesseract/eng.traineddata.gz
     */
    public String remoteKey(String code) {
        return remotePrefix + code + remoteSuffix;
    }
}
