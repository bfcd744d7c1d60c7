package com.starscape.offlineocr.features.ocrjob.infra.recognition;

import com.starscape.offlineocr.features.languages.infra.ArtifactStore;
import com.starscape.offlineocr.features.ocrjob.domain.ProgressSink;
import com.starscape.offlineocr.features.ocrjob.domain.RecognitionEngine;
import com.starscape.offlineocr.features.ocrjob.domain.RecognitionResult;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recognition through the native Tesseract library, reading traineddata files straight
 * from the artifact store directory.
 * 
 * A Tesseract handle is not thread-safe, so one is created per page.
 */
@Component
@ConditionalOnProperty(name = "app.recognition.engine", havingValue = "tesseract", matchIfMissing = true)
public class TesseractRecognitionEngine implements RecognitionEngine {
    
    private static final Logger log = LoggerFactory.getLogger(TesseractRecognitionEngine.class);
    
    private final ArtifactStore artifactStore;
    private final int pageSegMode;
    
    public TesseractRecognitionEngine(
            ArtifactStore artifactStore,
            @Value("${app.recognition.page-seg-mode:3}") int pageSegMode) {
        this.artifactStore = artifactStore;
        this.pageSegMode = pageSegMode;
    }
    
    @Override
    public RecognitionResult recognize(BufferedImage page, List<String> languages, ProgressSink progress) {
        ProgressSink sink = progress != null ? progress : ProgressSink.NONE;
        sink.report(0.0);
        
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(artifactStore.root().toString());
        tesseract.setLanguage(String.join("+", languages));
        tesseract.setPageSegMode(pageSegMode);
        
        List<Word> lines = tesseract.getWords(page, ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE);
        String text = lines.stream()
                .map(Word::getText)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
        double confidence = lines.stream()
                .mapToDouble(Word::getConfidence)
                .average()
                .orElse(0.0);
        
        log.debug("Tesseract recognized {} line(s), languages={}", lines.size(), languages);
        sink.report(1.0);
        return new RecognitionResult(text, confidence);
    }
}
