package com.starscape.offlineocr.features.ocrjob.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared kind of a submitted document; decides which decoder turns it into pages.
 */
public enum ContentClass {
    RASTER_IMAGE("Image"),
    PAGINATED_DOCUMENT("PDF"),
    COMPOUND_DOCUMENT("Word Document");
    
    public static final String PDF_MIME_TYPE = "application/pdf";
    public static final String DOCX_MIME_TYPE =
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    
    private final String displayName;
    
    ContentClass(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Sniff the content class from the MIME type, falling back to the file extension
     * for documents browsers often send as application/octet-stream.
     */
    public static Optional<ContentClass> detect(String mimeType, String filename) {
        String mime = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
        String name = filename == null ? "" : filename.trim().toLowerCase(Locale.ROOT);
        
        if (mime.startsWith("image/")) {
            return Optional.of(RASTER_IMAGE);
        }
        if (mime.equals(PDF_MIME_TYPE) || name.endsWith(".pdf")) {
            return Optional.of(PAGINATED_DOCUMENT);
        }
        if (mime.equals(DOCX_MIME_TYPE) || name.endsWith(".docx")) {
            return Optional.of(COMPOUND_DOCUMENT);
        }
        return Optional.empty();
    }
}
