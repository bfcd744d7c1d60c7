package com.starscape.offlineocr.features.ocrjob.domain;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * The capability that turns pixels into text. Implementations must be safe to call
 * from several job threads at once.
 */
public interface RecognitionEngine {
    
    /**
     * @param page      rendered page
     * @param languages ordered, non-empty language codes, all cached locally
     * @param progress  optional intra-page progress channel
     */
    RecognitionResult recognize(BufferedImage page, List<String> languages, ProgressSink progress) throws Exception;
}
