package com.starscape.offlineocr.features.ocrjob.domain;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Ordered pages of a resolved document, rendered on demand.
 */
public interface PageSource extends AutoCloseable {
    
    PageSource EMPTY = new PageSource() {
        @Override
        public int pageCount() {
            return 0;
        }
        
        @Override
        public BufferedImage render(int pageIndex) {
            throw new IndexOutOfBoundsException("No pages");
        }
        
        @Override
        public void close() {
        }
    };
    
    int pageCount();
    
    BufferedImage render(int pageIndex) throws IOException;
    
    @Override
    void close();
}
