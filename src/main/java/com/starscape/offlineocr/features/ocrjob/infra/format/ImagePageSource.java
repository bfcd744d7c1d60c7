package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.starscape.offlineocr.features.ocrjob.domain.PageSource;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Pages backed by encoded images, decoded one at a time when rendered.
 */
class ImagePageSource implements PageSource {
    
    private final List<byte[]> images;
    private final PagePreprocessor preprocessor;
    
    ImagePageSource(List<byte[]> images, PagePreprocessor preprocessor) {
        this.images = List.copyOf(images);
        this.preprocessor = preprocessor;
    }
    
    @Override
    public int pageCount() {
        return images.size();
    }
    
    @Override
    public BufferedImage render(int pageIndex) throws IOException {
        byte[] encoded = images.get(pageIndex);
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
        if (image == null) {
            throw new IOException("image data of page " + (pageIndex + 1) + " is not readable");
        }
        return preprocessor.prepare(image, preprocessor.orientationOf(encoded));
    }
    
    @Override
    public void close() {
        // nothing held open
    }
}
