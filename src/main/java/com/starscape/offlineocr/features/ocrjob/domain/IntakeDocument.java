package com.starscape.offlineocr.features.ocrjob.domain;

/**
 * A submitted file as received at intake.
 */
public record IntakeDocument(
    String name,
    String mimeType,
    byte[] content
) {
    
    public IntakeDocument {
        if (content == null) {
            throw new IllegalArgumentException("Document content is required");
        }
        name = name == null || name.isBlank() ? "document" : name;
    }
    
    public long size() {
        return content.length;
    }
}
