package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.starscape.offlineocr.common.exception.UnsupportedFormatException;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.DocumentDecoder;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a document to the decoder registered for its content class.
 */
@Component
public class FormatResolver {
    
    private static final Logger log = LoggerFactory.getLogger(FormatResolver.class);
    
    private final Map<ContentClass, DocumentDecoder> decoders = new EnumMap<>(ContentClass.class);
    
    public FormatResolver(List<DocumentDecoder> decoders) {
        for (DocumentDecoder decoder : decoders) {
            DocumentDecoder previous = this.decoders.put(decoder.contentClass(), decoder);
            if (previous != null) {
                throw new IllegalStateException("Two decoders registered for " + decoder.contentClass()
                    + ": " + previous.getClass().getSimpleName() + ", " + decoder.getClass().getSimpleName());
            }
        }
    }
    
    /**
     * @throws UnsupportedFormatException if no decoder handles the content class or the
     *         decoder cannot interpret the bytes
     */
    public ResolvedDocument resolve(IntakeDocument document, ContentClass contentClass) {
        DocumentDecoder decoder = contentClass == null ? null : decoders.get(contentClass);
        if (decoder == null) {
            throw new UnsupportedFormatException("Unsupported file type: " + contentClass);
        }
        
        ResolvedDocument resolved = decoder.decode(document);
        log.debug("Resolved document: name={}, class={}, pages={}, text={}",
            document.name(), contentClass, resolved.pageCount(), resolved.text().isPresent());
        return resolved;
    }
}
