package com.starscape.offlineocr.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for document processing.
 * Binds to app.processing.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {
    
    private Duration slowPageThreshold = Duration.ofSeconds(15);
    private int maxConcurrentJobs = 4;
    private int maxQueuedJobs = 16;
    private Duration admissionInterval = Duration.ofSeconds(2);
    private int renderDpi = 200;
    private int maxPageDimension = 4000;
    
    public Duration getSlowPageThreshold() {
        return slowPageThreshold;
    }
    
    public void setSlowPageThreshold(Duration slowPageThreshold) {
        this.slowPageThreshold = slowPageThreshold;
    }
    
    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }
    
    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }
    
    public int getMaxQueuedJobs() {
        return maxQueuedJobs;
    }
    
    public void setMaxQueuedJobs(int maxQueuedJobs) {
        this.maxQueuedJobs = maxQueuedJobs;
    }
    
    public Duration getAdmissionInterval() {
        return admissionInterval;
    }
    
    public void setAdmissionInterval(Duration admissionInterval) {
        this.admissionInterval = admissionInterval;
    }
    
    public int getRenderDpi() {
        return renderDpi;
    }
    
    public void setRenderDpi(int renderDpi) {
        this.renderDpi = renderDpi;
    }
    
    public int getMaxPageDimension() {
        return maxPageDimension;
    }
    
    public void setMaxPageDimension(int maxPageDimension) {
        this.maxPageDimension = maxPageDimension;
    }
}
