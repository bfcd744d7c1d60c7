package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.starscape.offlineocr.common.exception.UnsupportedFormatException;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.DocumentDecoder;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Single raster image (PNG, JPEG, GIF, BMP...) as a one-page document.
 */
@Component
public class RasterImageDecoder implements DocumentDecoder {
    
    private final PagePreprocessor preprocessor;
    
    public RasterImageDecoder(PagePreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }
    
    @Override
    public ContentClass contentClass() {
        return ContentClass.RASTER_IMAGE;
    }
    
    @Override
    public ResolvedDocument decode(IntakeDocument document) {
        try {
            if (ImageIO.read(new ByteArrayInputStream(document.content())) == null) {
                throw new UnsupportedFormatException("Could not read image " + document.name()
                    + ": no decoder for " + document.mimeType());
            }
        } catch (IOException e) {
            throw new UnsupportedFormatException("Could not read image " + document.name() + ": " + e.getMessage(), e);
        }
        return ResolvedDocument.ofPages(new ImagePageSource(List.of(document.content()), preprocessor));
    }
}
