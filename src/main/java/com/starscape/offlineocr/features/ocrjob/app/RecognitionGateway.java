package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.domain.ProgressSink;
import com.starscape.offlineocr.features.ocrjob.domain.RecognitionEngine;
import com.starscape.offlineocr.features.ocrjob.domain.RecognitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;

/**
 * Calls the recognition engine for one page and times the call.
 * Engine failures come back as a failed {@link PageOutcome}; they never escape the page.
 */
@Service
public class RecognitionGateway {
    
    private static final Logger log = LoggerFactory.getLogger(RecognitionGateway.class);
    
    private final RecognitionEngine engine;
    
    public RecognitionGateway(RecognitionEngine engine) {
        this.engine = engine;
    }
    
    public PageOutcome recognize(int pageIndex, BufferedImage page, List<String> languages, ProgressSink progress) {
        ProgressSink sink = progress != null ? progress : ProgressSink.NONE;
        long start = System.nanoTime();
        
        try {
            RecognitionResult raw = engine.recognize(page, languages, fraction -> sink.report(clamp(fraction, 1.0)));
            if (raw == null) {
                throw new IllegalStateException("engine returned no result");
            }
            
            RecognitionResult result = new RecognitionResult(
                raw.text() == null ? "" : raw.text(),
                clamp(raw.confidence(), 100.0)
            );
            Duration duration = elapsedSince(start);
            log.debug("Recognized page: page={}, chars={}, confidence={}, took={}ms",
                pageIndex + 1, result.text().length(), result.confidence(), duration.toMillis());
            return PageOutcome.success(pageIndex, result, duration);
            
        } catch (Exception e) {
            Duration duration = elapsedSince(start);
            log.warn("Recognition failed: page={}, reason={}", pageIndex + 1, describe(e));
            return PageOutcome.failure(pageIndex, describe(e), duration);
        }
    }
    
    private static double clamp(double value, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(max, Math.max(0.0, value));
    }
    
    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
    
    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
