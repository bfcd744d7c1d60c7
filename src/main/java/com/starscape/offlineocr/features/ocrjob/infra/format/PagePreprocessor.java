package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.starscape.offlineocr.common.config.ProcessingProperties;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Prepares rendered pages for recognition: rotates photos upright according to their
 * EXIF orientation and caps the long side at app.processing.max-page-dimension.
 */
@Component
public class PagePreprocessor {
    
    private static final Logger log = LoggerFactory.getLogger(PagePreprocessor.class);
    
    private final int maxPageDimension;
    
    public PagePreprocessor(ProcessingProperties processingProperties) {
        this.maxPageDimension = processingProperties.getMaxPageDimension();
    }
    
    public BufferedImage prepare(BufferedImage page) throws IOException {
        return prepare(page, 0);
    }
    
    /**
     * @param rotationDegrees clockwise rotation to apply before scaling
     */
    public BufferedImage prepare(BufferedImage page, int rotationDegrees) throws IOException {
        BufferedImage upright = page;
        if (rotationDegrees % 360 != 0) {
            upright = Thumbnails.of(page)
                    .scale(1.0)
                    .rotate(rotationDegrees)
                    .asBufferedImage();
        }
        
        int longSide = Math.max(upright.getWidth(), upright.getHeight());
        if (maxPageDimension > 0 && longSide > maxPageDimension) {
            log.debug("Downscaling page: {}x{} -> max {}", upright.getWidth(), upright.getHeight(), maxPageDimension);
            return Thumbnails.of(upright)
                    .size(maxPageDimension, maxPageDimension)
                    .keepAspectRatio(true)
                    .asBufferedImage();
        }
        return upright;
    }
    
    /**
     * Clockwise rotation that brings an image upright, read from its EXIF orientation tag.
     * Returns 0 when there is no usable tag.
     */
    public int orientationOf(byte[] imageBytes) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes));
            ExifIFD0Directory directory = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (directory == null || !directory.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                return 0;
            }
            return switch (directory.getInt(ExifIFD0Directory.TAG_ORIENTATION)) {
                case 3, 4 -> 180;
                case 5, 6 -> 90;
                case 7, 8 -> 270;
                default -> 0;
            };
        } catch (ImageProcessingException | IOException | MetadataException e) {
            // Formats without EXIF support end up here; they are treated as upright
            log.debug("No orientation metadata: {}", e.getMessage());
            return 0;
        }
    }
}
