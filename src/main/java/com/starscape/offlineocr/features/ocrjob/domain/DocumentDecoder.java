package com.starscape.offlineocr.features.ocrjob.domain;

import com.starscape.offlineocr.common.exception.UnsupportedFormatException;

/**
 * Format-specific decoder for one content class.
 */
public interface DocumentDecoder {
    
    ContentClass contentClass();
    
    /**
     * @throws UnsupportedFormatException if the bytes cannot be interpreted as this content class
     */
    ResolvedDocument decode(IntakeDocument document);
}
