package com.starscape.offlineocr.features.ocrjob.domain;

import java.util.List;
import java.util.Optional;

/**
 * What a document resolves to: pages to recognize and/or text extracted directly.
 * Both are kept apart here and only combined at export time.
 */
public record ResolvedDocument(
    PageSource pages,
    String extractedText,
    List<String> warnings
) implements AutoCloseable {
    
    public ResolvedDocument {
        pages = pages == null ? PageSource.EMPTY : pages;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
    
    public static ResolvedDocument ofPages(PageSource pages) {
        return new ResolvedDocument(pages, null, List.of());
    }
    
    public int pageCount() {
        return pages.pageCount();
    }
    
    public Optional<String> text() {
        return extractedText == null || extractedText.isBlank() ? Optional.empty() : Optional.of(extractedText);
    }
    
    public boolean isEmpty() {
        return pageCount() == 0 && text().isEmpty();
    }
    
    @Override
    public void close() {
        pages.close();
    }
}
