package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.starscape.offlineocr.common.config.ProcessingProperties;
import com.starscape.offlineocr.common.exception.UnsupportedFormatException;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.DocumentDecoder;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.PageSource;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * PDF documents, one page per PDF page rendered at app.processing.render-dpi.
 */
@Component
public class PdfDocumentDecoder implements DocumentDecoder {
    
    private static final Logger log = LoggerFactory.getLogger(PdfDocumentDecoder.class);
    
    private final PagePreprocessor preprocessor;
    private final int renderDpi;
    
    public PdfDocumentDecoder(PagePreprocessor preprocessor, ProcessingProperties processingProperties) {
        this.preprocessor = preprocessor;
        this.renderDpi = processingProperties.getRenderDpi();
    }
    
    @Override
    public ContentClass contentClass() {
        return ContentClass.PAGINATED_DOCUMENT;
    }
    
    @Override
    public ResolvedDocument decode(IntakeDocument document) {
        PDDocument pdf;
        try {
            pdf = Loader.loadPDF(document.content());
        } catch (IOException e) {
            throw new UnsupportedFormatException("Could not read PDF " + document.name() + ": " + e.getMessage(), e);
        }
        
        if (pdf.isEncrypted() && !pdf.getCurrentAccessPermission().canExtractContent()) {
            closeQuietly(pdf, document.name());
            throw new UnsupportedFormatException("PDF " + document.name() + " is encrypted");
        }
        return ResolvedDocument.ofPages(new PdfPageSource(pdf, document.name()));
    }
    
    private static void closeQuietly(PDDocument pdf, String name) {
        try {
            pdf.close();
        } catch (IOException e) {
            log.warn("Failed to close PDF {}: {}", name, e.getMessage());
        }
    }
    
    private final class PdfPageSource implements PageSource {
        
        private final PDDocument pdf;
        private final String name;
        private final PDFRenderer renderer;
        
        private PdfPageSource(PDDocument pdf, String name) {
            this.pdf = pdf;
            this.name = name;
            this.renderer = new PDFRenderer(pdf);
        }
        
        @Override
        public int pageCount() {
            return pdf.getNumberOfPages();
        }
        
        @Override
        public BufferedImage render(int pageIndex) throws IOException {
            BufferedImage page = renderer.renderImageWithDPI(pageIndex, renderDpi, ImageType.RGB);
            return preprocessor.prepare(page);
        }
        
        @Override
        public void close() {
            closeQuietly(pdf, name);
        }
    }
}
