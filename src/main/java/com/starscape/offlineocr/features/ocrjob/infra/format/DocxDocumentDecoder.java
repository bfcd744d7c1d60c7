package com.starscape.offlineocr.features.ocrjob.infra.format;

import com.starscape.offlineocr.common.exception.UnsupportedFormatException;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.DocumentDecoder;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Word documents (OOXML). Body text is extracted directly and embedded images
 * become the pages to recognize, in archive order.
 */
@Component
public class DocxDocumentDecoder implements DocumentDecoder {
    
    private static final Logger log = LoggerFactory.getLogger(DocxDocumentDecoder.class);
    
    static final String NO_IMAGES_WARNING =
        "No embedded images found in the document; OCR is limited to textual extraction.";
    
    private static final String DOCUMENT_ENTRY = "word/document.xml";
    private static final String MEDIA_PREFIX = "word/media/";
    private static final String WORD_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    private static final long MAX_ENTRY_BYTES = 64L * 1024 * 1024;
    
    private final PagePreprocessor preprocessor;
    
    public DocxDocumentDecoder(PagePreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }
    
    @Override
    public ContentClass contentClass() {
        return ContentClass.COMPOUND_DOCUMENT;
    }
    
    @Override
    public ResolvedDocument decode(IntakeDocument document) {
        byte[] body = null;
        List<byte[]> images = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(document.content()))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String entryName = entry.getName();
                if (entry.isDirectory()) {
                    continue;
                }
                if (DOCUMENT_ENTRY.equals(entryName)) {
                    body = readEntry(zip, entryName);
                } else if (entryName.startsWith(MEDIA_PREFIX)) {
                    byte[] media = readEntry(zip, entryName);
                    if (isReadableImage(media)) {
                        images.add(media);
                    } else {
                        warnings.add("Embedded image " + entryName.substring(MEDIA_PREFIX.length())
                            + " is in an unsupported format and was skipped.");
                    }
                }
            }
        } catch (IOException e) {
            throw new UnsupportedFormatException("Could not read Word document " + document.name() + ": " + e.getMessage(), e);
        }
        
        if (body == null) {
            throw new UnsupportedFormatException("Word document " + document.name() + " has no " + DOCUMENT_ENTRY);
        }
        
        String text = extractText(body, document.name());
        if (images.isEmpty()) {
            warnings.add(NO_IMAGES_WARNING);
        }
        log.debug("Decoded Word document: name={}, images={}, textLength={}", document.name(), images.size(), text.length());
        return new ResolvedDocument(new ImagePageSource(images, preprocessor), text, warnings);
    }
    
    private static byte[] readEntry(InputStream zip, String entryName) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = zip.read(buffer)) != -1) {
            total += read;
            if (total > MAX_ENTRY_BYTES) {
                throw new IOException("entry " + entryName + " exceeds " + MAX_ENTRY_BYTES + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
    
    private static boolean isReadableImage(byte[] media) {
        try {
            return ImageIO.read(new ByteArrayInputStream(media)) != null;
        } catch (IOException e) {
            log.debug("Embedded image not decodable: {}", e.getMessage());
            return false;
        }
    }
    
    /**
     * Concatenates w:t runs; w:tab and w:br become whitespace and paragraphs are
     * separated by a blank line. Empty paragraphs are dropped.
     */
    static String extractText(byte[] documentXml, String documentName) {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        
        List<String> paragraphs = new ArrayList<>();
        StringBuilder paragraph = new StringBuilder();
        boolean inText = false;
        
        XMLStreamReader reader = null;
        try {
            reader = factory.createXMLStreamReader(new ByteArrayInputStream(documentXml));
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT && WORD_NS.equals(reader.getNamespaceURI())) {
                    switch (reader.getLocalName()) {
                        case "t" -> inText = true;
                        case "tab" -> paragraph.append('\t');
                        case "br", "cr" -> paragraph.append('\n');
                        default -> { }
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT && WORD_NS.equals(reader.getNamespaceURI())) {
                    if ("t".equals(reader.getLocalName())) {
                        inText = false;
                    } else if ("p".equals(reader.getLocalName())) {
                        String value = paragraph.toString().strip();
                        if (!value.isEmpty()) {
                            paragraphs.add(value);
                        }
                        paragraph.setLength(0);
                    }
                } else if (inText && (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA)) {
                    paragraph.append(reader.getText());
                }
            }
        } catch (XMLStreamException e) {
            throw new UnsupportedFormatException("Could not parse text of " + documentName + ": " + e.getMessage(), e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.debug("Failed to close XML reader: {}", e.getMessage());
                }
            }
        }
        
        String trailing = paragraph.toString().strip();
        if (!trailing.isEmpty()) {
            paragraphs.add(trailing);
        }
        return String.join("\n\n", paragraphs);
    }
}
